package io.rconcron.dispatch;

public enum DispatcherState {
    IDLE,
    SCANNING,
    DISPATCHING,
    STOPPED
}
