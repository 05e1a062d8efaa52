package io.rconcron.testing;

import io.rconcron.rcon.RconAuthenticationException;
import io.rconcron.rcon.RconTransport;
import io.rconcron.rcon.RconTransportFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory RCON endpoints keyed by host name. Unknown hosts refuse connections.
 */
public final class FakeRconServers implements RconTransportFactory {
    public enum Behavior {
        ACCEPT,
        REFUSE,
        REJECT_LOGIN,
        FAIL_COMMANDS
    }

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final Map<String, String> passwords = new ConcurrentHashMap<>();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final List<Long> openTimes = new CopyOnWriteArrayList<>();
    private volatile Consumer<String> commandListener = command -> { };

    public FakeRconServers accept(String host, String password) {
        behaviors.put(host, Behavior.ACCEPT);
        passwords.put(host, password);
        return this;
    }

    public FakeRconServers set(String host, Behavior behavior) {
        behaviors.put(host, behavior);
        return this;
    }

    /**
     * Called with each delivered command, on the sending thread, before the reply is returned.
     */
    public FakeRconServers onCommand(Consumer<String> listener) {
        commandListener = listener;
        return this;
    }

    /**
     * Commands delivered so far as {@code host:command}.
     */
    public List<String> received() {
        return new ArrayList<>(received);
    }

    public List<Long> openTimes() {
        return new ArrayList<>(openTimes);
    }

    public int opens() {
        return openTimes.size();
    }

    @Override
    public RconTransport open(String host, int port) throws IOException {
        openTimes.add(System.nanoTime());
        Behavior behavior = behaviors.getOrDefault(host, Behavior.REFUSE);
        if (behavior == Behavior.REFUSE) {
            throw new ConnectException("Connection refused: " + host + ":" + port);
        }
        return new RconTransport() {
            @Override
            public void authenticate(String password) throws IOException {
                Behavior current = behaviors.getOrDefault(host, Behavior.REFUSE);
                if (current == Behavior.REJECT_LOGIN) {
                    throw new RconAuthenticationException("RCON login rejected");
                }
                String expected = passwords.get(host);
                if (expected != null && !expected.equals(password)) {
                    throw new RconAuthenticationException("RCON login rejected");
                }
            }

            @Override
            public String command(String command) throws IOException {
                if (behaviors.getOrDefault(host, Behavior.REFUSE) == Behavior.FAIL_COMMANDS) {
                    throw new IOException("Broken pipe");
                }
                received.add(host + ":" + command);
                commandListener.accept(command);
                return "ok " + command;
            }

            @Override
            public void close() {
            }
        };
    }
}
