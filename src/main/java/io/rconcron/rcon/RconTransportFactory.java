package io.rconcron.rcon;

import java.io.IOException;

@FunctionalInterface
public interface RconTransportFactory {
    RconTransport open(String host, int port) throws IOException;
}
