package io.rconcron.model;

import java.time.Instant;

public record EntryView(
        String id,
        String command,
        String label,
        String cron,
        Instant nextFire
) {
}
