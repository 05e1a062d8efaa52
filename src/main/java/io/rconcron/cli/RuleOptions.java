package io.rconcron.cli;

import io.rconcron.schedule.Frequency;
import io.rconcron.schedule.InvalidRuleException;
import io.rconcron.schedule.RecurrenceRule;
import picocli.CommandLine.Option;

/**
 * Cadence options shared by {@code schedule} and {@code preview}.
 */
final class RuleOptions {
    @Option(names = {"--frequency"}, description = "every-minute | every-n-minutes | hourly | daily | weekly")
    String frequency;

    @Option(names = {"--interval"}, description = "Minutes between runs for every-n-minutes: 5, 15 or 30")
    Integer interval;

    @Option(names = {"--hour"}, description = "UTC hour (0-23) for daily and weekly")
    Integer hour;

    @Option(names = {"--minute"}, description = "Minute (0-59) for hourly, daily and weekly")
    Integer minute;

    @Option(names = {"--weekday"}, description = "Weekday for weekly: 0-6 (0 = Sunday) or a name such as Monday")
    String weekday;

    @Option(names = {"--cron"}, description = "Five-field cron expression instead of --frequency")
    String cron;

    RecurrenceRule toRule() {
        if (cron != null && !cron.isBlank()) {
            if (frequency != null) {
                throw new InvalidRuleException("use either --cron or --frequency, not both");
            }
            return RecurrenceRule.fromCron(cron);
        }
        Frequency parsed = Frequency.fromString(frequency);
        switch (parsed) {
            case EVERY_MINUTE:
                return RecurrenceRule.everyMinute();
            case EVERY_N_MINUTES:
                return RecurrenceRule.everyMinutes(require(interval, "--interval", parsed));
            case HOURLY:
                return RecurrenceRule.hourly(require(minute, "--minute", parsed));
            case DAILY:
                return RecurrenceRule.daily(require(hour, "--hour", parsed), require(minute, "--minute", parsed));
            case WEEKLY:
                if (weekday == null) {
                    throw new InvalidRuleException("--weekday is required for weekly");
                }
                return RecurrenceRule.weekly(
                        RecurrenceRule.parseWeekday(weekday),
                        require(hour, "--hour", parsed),
                        require(minute, "--minute", parsed)
                );
            default:
                throw new InvalidRuleException("Unknown frequency: " + frequency);
        }
    }

    private static int require(Integer value, String option, Frequency frequency) {
        if (value == null) {
            throw new InvalidRuleException(option + " is required for " + frequency.cliName());
        }
        return value;
    }
}
