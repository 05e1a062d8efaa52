package io.rconcron.rcon;

import java.io.IOException;

public final class RconAuthenticationException extends IOException {
    public RconAuthenticationException(String message) {
        super(message);
    }
}
