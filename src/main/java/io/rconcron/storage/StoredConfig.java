package io.rconcron.storage;

import io.rconcron.connection.SlotConfig;
import io.rconcron.schedule.RecurrenceRule;

import java.util.List;

/**
 * Everything that survives a restart: server slots with encrypted credentials and the
 * scheduled commands. Next-fire instants are not stored; entries are re-armed at load.
 *
 * @param migrated true when a plaintext password was encrypted while loading, so the file
 *                 should be written back
 */
public record StoredConfig(List<SlotConfig> slots, List<StoredCommand> commands, boolean migrated) {
    public StoredConfig {
        slots = slots == null ? List.of() : List.copyOf(slots);
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public StoredConfig(List<SlotConfig> slots, List<StoredCommand> commands) {
        this(slots, commands, false);
    }

    public static StoredConfig empty() {
        return new StoredConfig(List.of(), List.of());
    }

    public record StoredCommand(String command, RecurrenceRule rule) {
        /**
         * Two commands are the same schedule when text and cron form match; fields the
         * frequency ignores do not count.
         */
        public boolean sameAs(String otherCommand, RecurrenceRule otherRule) {
            return command.strip().equals(otherCommand.strip()) && rule.toCron().equals(otherRule.toCron());
        }
    }
}
