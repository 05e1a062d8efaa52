package io.rconcron.dispatch;

import io.rconcron.connection.SlotOutcome;

import java.time.Instant;
import java.util.List;

public record TickReport(Instant tickTime, List<FiredEntry> fired) {
    public TickReport {
        fired = List.copyOf(fired);
    }

    public record FiredEntry(
            String entryId,
            String command,
            List<SlotOutcome> outcomes,
            Instant nextFire
    ) {
        public long count(SlotOutcome.Status status) {
            return outcomes.stream().filter(o -> o.status() == status).count();
        }
    }
}
