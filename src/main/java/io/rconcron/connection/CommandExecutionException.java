package io.rconcron.connection;

/**
 * A command could not be sent or its response could not be read.
 */
public final class CommandExecutionException extends Exception {
    public CommandExecutionException(String message) {
        super(message);
    }

    public CommandExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
