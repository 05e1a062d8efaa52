/**
 * Background dispatch loop.
 *
 * <p>{@link io.rconcron.dispatch.Dispatcher} wakes on a fixed tick, fires every due schedule
 * entry through the {@link io.rconcron.connection.ConnectionPool} and advances each fired
 * entry's next-fire instant whether or not any server accepted the command.
 */
package io.rconcron.dispatch;
