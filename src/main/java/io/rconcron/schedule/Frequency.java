package io.rconcron.schedule;

import java.util.Locale;

public enum Frequency {
    EVERY_MINUTE("every-minute"),
    EVERY_N_MINUTES("every-n-minutes"),
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly");

    private final String cliName;

    Frequency(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    public boolean usesMinute() {
        return this == HOURLY || this == DAILY || this == WEEKLY;
    }

    public boolean usesHour() {
        return this == DAILY || this == WEEKLY;
    }

    public static Frequency fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRuleException("frequency is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (Frequency value : values()) {
            if (value.cliName.equals(normalized) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new InvalidRuleException("Unknown frequency: " + raw);
    }
}
