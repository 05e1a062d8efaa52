package io.rconcron.model;

public record SlotView(
        int slot,
        String host,
        String port,
        String state,
        String lastFailure
) {
}
