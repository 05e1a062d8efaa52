package io.rconcron.schedule;

import io.rconcron.model.EntryView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory, insertion-ordered schedule. Every read and mutation runs under the table's
 * monitor, so the dispatcher always sees a consistent due set.
 */
public final class ScheduleTable {
    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0L);

    public synchronized ScheduleEntry add(String commandText, RecurrenceRule rule, Instant now) {
        String id = "cmd-" + sequence.incrementAndGet();
        ScheduleEntry entry = new ScheduleEntry(id, commandText, rule, rule.nextFire(now));
        entries.put(id, entry);
        return entry;
    }

    public synchronized boolean remove(String id) {
        return id != null && entries.remove(id) != null;
    }

    public synchronized Optional<ScheduleEntry> find(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * Entries with {@code nextFire <= now}, in insertion order. The returned list is a copy.
     */
    public synchronized List<ScheduleEntry> dueEntries(Instant now) {
        List<ScheduleEntry> due = new ArrayList<>();
        for (ScheduleEntry entry : entries.values()) {
            if (entry.isDue(now)) {
                due.add(entry);
            }
        }
        return due;
    }

    /**
     * Recomputes the entry's next fire from {@code now}. Empty when the entry was removed
     * while it was being dispatched.
     */
    public synchronized Optional<Instant> advance(String id, Instant now) {
        ScheduleEntry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(entry.advance(now));
    }

    public synchronized List<EntryView> snapshot() {
        List<EntryView> out = new ArrayList<>(entries.size());
        for (ScheduleEntry entry : entries.values()) {
            out.add(entry.toView());
        }
        return out;
    }

    public synchronized List<ScheduleEntry> entries() {
        return List.copyOf(entries.values());
    }

    public synchronized int size() {
        return entries.size();
    }
}
