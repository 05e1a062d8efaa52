package io.rconcron.schedule;

import io.rconcron.model.EntryView;

import java.time.Instant;
import java.util.Objects;

/**
 * One scheduled command. The next-fire instant is only advanced by {@link ScheduleTable}
 * while holding its lock.
 */
public final class ScheduleEntry {
    private final String id;
    private final String commandText;
    private final RecurrenceRule rule;
    private final String label;
    private Instant nextFire;

    ScheduleEntry(String id, String commandText, RecurrenceRule rule, Instant nextFire) {
        if (commandText == null || commandText.isBlank()) {
            throw new IllegalArgumentException("command text cannot be empty");
        }
        this.id = Objects.requireNonNull(id, "id");
        this.commandText = commandText.strip();
        this.rule = Objects.requireNonNull(rule, "rule");
        this.label = rule.label();
        this.nextFire = Objects.requireNonNull(nextFire, "nextFire");
    }

    public String id() {
        return id;
    }

    public String commandText() {
        return commandText;
    }

    public RecurrenceRule rule() {
        return rule;
    }

    public String label() {
        return label;
    }

    public Instant nextFire() {
        return nextFire;
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(nextFire);
    }

    Instant advance(Instant now) {
        nextFire = rule.nextFire(now);
        return nextFire;
    }

    public EntryView toView() {
        return new EntryView(id, commandText, label, rule.toCron(), nextFire);
    }
}
