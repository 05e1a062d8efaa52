package io.rconcron.schedule;

/**
 * Raised when cadence parameters cannot form a {@link RecurrenceRule}.
 */
public final class InvalidRuleException extends IllegalArgumentException {
    public InvalidRuleException(String message) {
        super(message);
    }
}
