/**
 * Runtime orchestration package.
 *
 * <p>{@link io.rconcron.runtime.RconCronContext} owns the process-wide objects: stored
 * configuration, server connections, scheduled commands, the dispatcher thread and the
 * audit trail used by the CLI.
 */
package io.rconcron.runtime;
