/**
 * rconcron source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.rconcron.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.rconcron.cli.RconCronCommand} maps commands to the runtime context.</li>
 *   <li>{@code io.rconcron.runtime.RconCronContext} wires the pool, schedule table and dispatcher.</li>
 *   <li>{@code io.rconcron.schedule.RecurrenceRule} computes when a command runs next.</li>
 * </ul>
 */
package io.rconcron;
