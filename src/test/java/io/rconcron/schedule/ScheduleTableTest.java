package io.rconcron.schedule;

import io.rconcron.model.EntryView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

final class ScheduleTableTest {
    private static final Instant NOW = Instant.parse("2024-01-01T10:00:20Z");

    @Test
    void addArmsEntryFromNowAndAssignsSequentialIds() {
        ScheduleTable table = new ScheduleTable();
        ScheduleEntry first = table.add("  say hello  ", RecurrenceRule.hourly(30), NOW);
        ScheduleEntry second = table.add("save-all", RecurrenceRule.everyMinute(), NOW);

        Assertions.assertEquals("cmd-1", first.id());
        Assertions.assertEquals("cmd-2", second.id());
        Assertions.assertEquals("say hello", first.commandText());
        Assertions.assertEquals(Instant.parse("2024-01-01T10:30:00Z"), first.nextFire());
        Assertions.assertEquals("Hourly at :30", first.label());
        Assertions.assertEquals(2, table.size());
    }

    @Test
    void blankCommandIsRejected() {
        ScheduleTable table = new ScheduleTable();
        Assertions.assertThrows(IllegalArgumentException.class, () -> table.add("   ", RecurrenceRule.everyMinute(), NOW));
        Assertions.assertEquals(0, table.size());
    }

    @Test
    void dueEntriesKeepInsertionOrder() {
        ScheduleTable table = new ScheduleTable();
        table.add("third-by-time", RecurrenceRule.daily(12, 0), NOW);
        table.add("first-by-time", RecurrenceRule.everyMinute(), NOW);
        table.add("later", RecurrenceRule.daily(23, 0), NOW);

        List<ScheduleEntry> due = table.dueEntries(Instant.parse("2024-01-01T12:00:00Z"));
        Assertions.assertEquals(List.of("third-by-time", "first-by-time"),
                due.stream().map(ScheduleEntry::commandText).toList());
        Assertions.assertTrue(table.dueEntries(NOW).isEmpty());
    }

    @Test
    void advanceMovesNextFirePastTheTick() {
        ScheduleTable table = new ScheduleTable();
        ScheduleEntry entry = table.add("say tick", RecurrenceRule.everyMinutes(5), NOW);
        Instant tick = Instant.parse("2024-01-01T10:05:00Z");
        Assertions.assertTrue(entry.isDue(tick));

        Instant next = table.advance(entry.id(), tick).orElseThrow();
        Assertions.assertEquals(Instant.parse("2024-01-01T10:10:00Z"), next);
        Assertions.assertFalse(entry.isDue(tick));
    }

    @Test
    void removedEntryIsNotAdvancedOrListed() {
        ScheduleTable table = new ScheduleTable();
        ScheduleEntry entry = table.add("say bye", RecurrenceRule.everyMinute(), NOW);
        Assertions.assertTrue(table.remove(entry.id()));
        Assertions.assertFalse(table.remove(entry.id()));
        Assertions.assertFalse(table.remove(null));
        Assertions.assertTrue(table.advance(entry.id(), NOW).isEmpty());
        Assertions.assertTrue(table.find(entry.id()).isEmpty());
        Assertions.assertTrue(table.snapshot().isEmpty());
    }

    @Test
    void snapshotCarriesLabelCronAndNextFire() {
        ScheduleTable table = new ScheduleTable();
        table.add("weather clear", RecurrenceRule.weekly(1, 12, 0), NOW);

        EntryView view = table.snapshot().get(0);
        Assertions.assertEquals("cmd-1", view.id());
        Assertions.assertEquals("weather clear", view.command());
        Assertions.assertEquals("Weekly on Monday at 12:00", view.label());
        Assertions.assertEquals("0 12 * * 1", view.cron());
        Assertions.assertEquals(Instant.parse("2024-01-01T12:00:00Z"), view.nextFire());
    }
}
