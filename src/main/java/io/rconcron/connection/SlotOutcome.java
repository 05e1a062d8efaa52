package io.rconcron.connection;

public record SlotOutcome(
        int slot,
        String endpoint,
        Status status,
        String response,
        String reason
) {
    public enum Status {
        SUCCESS,
        FAILED,
        SKIPPED
    }

    public static SlotOutcome success(int slot, String endpoint, String response) {
        return new SlotOutcome(slot, endpoint, Status.SUCCESS, response == null ? "" : response, null);
    }

    public static SlotOutcome failed(int slot, String endpoint, String reason) {
        return new SlotOutcome(slot, endpoint, Status.FAILED, null, reason);
    }

    public static SlotOutcome skipped(int slot, String endpoint, String reason) {
        return new SlotOutcome(slot, endpoint, Status.SKIPPED, null, reason);
    }
}
