package io.rconcron.storage;

public final class ConfigStoreException extends RuntimeException {
    public ConfigStoreException(String message) {
        super(message);
    }

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
