package io.rconcron.connection;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    FAILED
}
