package io.rconcron.schedule;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structured form of an operator cadence.
 *
 * <p>Only the fields relevant to {@link #frequency()} take part in evaluation, the rest are
 * carried as given but must still be in range. Weekdays use cron numbering: 0 is Sunday,
 * 6 is Saturday. All evaluation happens in UTC.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecurrenceRule(
        @JsonProperty("frequency") Frequency frequency,
        @JsonProperty("interval_minutes") Integer intervalMinutes,
        @JsonProperty("hour") Integer hour,
        @JsonProperty("minute") Integer minute,
        @JsonProperty("weekday") Integer weekday
) {
    public static final Set<Integer> SUPPORTED_INTERVALS = Set.of(5, 15, 30);
    private static final String[] WEEKDAY_NAMES = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    public RecurrenceRule {
        if (frequency == null) {
            throw new InvalidRuleException("frequency is required");
        }
        checkRange("minute", minute, 0, 59);
        checkRange("hour", hour, 0, 23);
        checkRange("weekday", weekday, 0, 6);
        if (intervalMinutes != null && !SUPPORTED_INTERVALS.contains(intervalMinutes)) {
            throw new InvalidRuleException("interval must be one of 5, 15, 30 minutes: " + intervalMinutes);
        }
        if (frequency == Frequency.EVERY_N_MINUTES && intervalMinutes == null) {
            throw new InvalidRuleException("every-n-minutes requires an interval");
        }
        if (frequency.usesMinute() && minute == null) {
            throw new InvalidRuleException(frequency.cliName() + " requires a minute");
        }
        if (frequency.usesHour() && hour == null) {
            throw new InvalidRuleException(frequency.cliName() + " requires an hour");
        }
        if (frequency == Frequency.WEEKLY && weekday == null) {
            throw new InvalidRuleException("weekly requires a weekday");
        }
    }

    public static RecurrenceRule everyMinute() {
        return new RecurrenceRule(Frequency.EVERY_MINUTE, null, null, null, null);
    }

    public static RecurrenceRule everyMinutes(int interval) {
        return new RecurrenceRule(Frequency.EVERY_N_MINUTES, interval, null, null, null);
    }

    public static RecurrenceRule hourly(int minute) {
        return new RecurrenceRule(Frequency.HOURLY, null, null, minute, null);
    }

    public static RecurrenceRule daily(int hour, int minute) {
        return new RecurrenceRule(Frequency.DAILY, null, hour, minute, null);
    }

    public static RecurrenceRule weekly(int weekday, int hour, int minute) {
        return new RecurrenceRule(Frequency.WEEKLY, null, hour, minute, weekday);
    }

    /**
     * Reads the five cron shapes produced by {@link #toCron()}; used for configuration files
     * that only carry a {@code cron_expression}.
     */
    public static RecurrenceRule fromCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRuleException("cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidRuleException("expected 5 cron fields: " + expression);
        }
        if (!"*".equals(fields[2]) || !"*".equals(fields[3])) {
            throw new InvalidRuleException("day-of-month and month must be '*': " + expression);
        }
        String minuteField = fields[0];
        String hourField = fields[1];
        String weekdayField = fields[4];
        if ("*".equals(hourField) && "*".equals(weekdayField)) {
            if ("*".equals(minuteField)) {
                return everyMinute();
            }
            if (minuteField.startsWith("*/")) {
                return everyMinutes(parseField(minuteField.substring(2), expression));
            }
            return hourly(parseField(minuteField, expression));
        }
        if ("*".equals(hourField)) {
            throw new InvalidRuleException("weekday requires a fixed hour: " + expression);
        }
        int minuteValue = parseField(minuteField, expression);
        int hourValue = parseField(hourField, expression);
        if ("*".equals(weekdayField)) {
            return daily(hourValue, minuteValue);
        }
        int weekdayValue = parseField(weekdayField, expression);
        return weekly(weekdayValue == 7 ? 0 : weekdayValue, hourValue, minuteValue);
    }

    public static int parseWeekday(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRuleException("weekday is empty");
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            int parsed = Integer.parseInt(value);
            return parsed == 7 ? 0 : parsed;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (int i = 0; i < WEEKDAY_NAMES.length; i++) {
            String name = WEEKDAY_NAMES[i].toLowerCase(Locale.ROOT);
            if (name.equals(lower) || (lower.length() >= 3 && name.startsWith(lower))) {
                return i;
            }
        }
        throw new InvalidRuleException("Unknown weekday: " + raw);
    }

    /**
     * Smallest instant strictly after {@code after} that matches this rule.
     */
    public Instant nextFire(Instant after) {
        LocalDateTime start = LocalDateTime.ofInstant(after, ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MINUTES)
                .plusMinutes(1);
        LocalDateTime next = switch (frequency) {
            case EVERY_MINUTE -> start;
            case EVERY_N_MINUTES -> {
                int remainder = start.getMinute() % intervalMinutes;
                yield remainder == 0 ? start : start.plusMinutes(intervalMinutes - remainder);
            }
            case HOURLY -> {
                LocalDateTime candidate = start.withMinute(minute);
                yield candidate.isBefore(start) ? candidate.plusHours(1) : candidate;
            }
            case DAILY -> nextDaily(start);
            case WEEKLY -> {
                LocalDateTime candidate = nextDaily(start);
                int current = cronWeekday(candidate.getDayOfWeek());
                yield candidate.plusDays(Math.floorMod(weekday - current, 7));
            }
        };
        return next.toInstant(ZoneOffset.UTC);
    }

    public List<Instant> nextFires(Instant after, int count) {
        List<Instant> out = new ArrayList<>(Math.max(0, count));
        Instant cursor = after;
        for (int i = 0; i < count; i++) {
            cursor = nextFire(cursor);
            out.add(cursor);
        }
        return out;
    }

    public boolean matches(Instant instant) {
        LocalDateTime t = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        if (t.getSecond() != 0 || t.getNano() != 0) {
            return false;
        }
        return switch (frequency) {
            case EVERY_MINUTE -> true;
            case EVERY_N_MINUTES -> t.getMinute() % intervalMinutes == 0;
            case HOURLY -> t.getMinute() == minute;
            case DAILY -> t.getHour() == hour && t.getMinute() == minute;
            case WEEKLY -> t.getHour() == hour
                    && t.getMinute() == minute
                    && cronWeekday(t.getDayOfWeek()) == weekday;
        };
    }

    public String label() {
        return switch (frequency) {
            case EVERY_MINUTE -> "Every Minute";
            case EVERY_N_MINUTES -> "Every " + intervalMinutes + " Minutes";
            case HOURLY -> String.format(Locale.ROOT, "Hourly at :%02d", minute);
            case DAILY -> String.format(Locale.ROOT, "Daily at %02d:%02d", hour, minute);
            case WEEKLY -> String.format(Locale.ROOT, "Weekly on %s at %02d:%02d", WEEKDAY_NAMES[weekday], hour, minute);
        };
    }

    public String toCron() {
        return switch (frequency) {
            case EVERY_MINUTE -> "* * * * *";
            case EVERY_N_MINUTES -> "*/" + intervalMinutes + " * * * *";
            case HOURLY -> minute + " * * * *";
            case DAILY -> minute + " " + hour + " * * *";
            case WEEKLY -> minute + " " + hour + " * * " + weekday;
        };
    }

    private LocalDateTime nextDaily(LocalDateTime start) {
        LocalDateTime candidate = start.withHour(hour).withMinute(minute);
        return candidate.isBefore(start) ? candidate.plusDays(1) : candidate;
    }

    private static int cronWeekday(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    private static void checkRange(String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new InvalidRuleException(field + " must be within " + min + ".." + max + ": " + value);
        }
    }

    private static int parseField(String raw, String expression) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("unsupported cron field '" + raw + "' in: " + expression);
        }
    }
}
