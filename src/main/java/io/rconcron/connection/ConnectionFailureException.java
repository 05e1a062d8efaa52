package io.rconcron.connection;

/**
 * Transport or authentication failure while opening a session.
 */
public final class ConnectionFailureException extends Exception {
    public ConnectionFailureException(String message) {
        super(message);
    }

    public ConnectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
