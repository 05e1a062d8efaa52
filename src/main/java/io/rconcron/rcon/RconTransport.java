package io.rconcron.rcon;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open link to one RCON endpoint.
 */
public interface RconTransport extends Closeable {
    /**
     * @throws RconAuthenticationException when the server rejects the password
     */
    void authenticate(String password) throws IOException;

    String command(String command) throws IOException;
}
