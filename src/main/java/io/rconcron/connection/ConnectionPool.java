package io.rconcron.connection;

import io.rconcron.model.SlotView;
import io.rconcron.rcon.RconTransportFactory;
import io.rconcron.security.CredentialCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * The configured server slots and their live connections.
 *
 * <p>The slot maps are swapped under {@code lock}; network work always runs on a snapshot
 * taken under the lock and released before any connect or command. Connections dropped by
 * {@link #configure(List)} are retired so an in-flight broadcast cannot revive them.
 */
public final class ConnectionPool {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);
    public static final String NOT_CONFIGURED = "NOT_CONFIGURED";

    private final CredentialCipher cipher;
    private final RconTransportFactory transportFactory;
    private final int retryLimit;
    private final Duration retryDelay;
    private final Object lock = new Object();
    private TreeMap<Integer, SlotConfig> slots = new TreeMap<>();
    private TreeMap<Integer, RemoteConnection> connections = new TreeMap<>();

    public ConnectionPool(
            CredentialCipher cipher,
            RconTransportFactory transportFactory,
            int retryLimit,
            Duration retryDelay
    ) {
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retry limit must be at least 1: " + retryLimit);
        }
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.retryLimit = retryLimit;
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
    }

    /**
     * Replaces the slot list. Unchanged slots keep their live connection; new or changed
     * slots are connected before this returns.
     */
    public List<SlotView> configure(List<SlotConfig> configured) {
        TreeMap<Integer, SlotConfig> nextSlots = new TreeMap<>();
        for (SlotConfig config : configured) {
            if (nextSlots.put(config.slot(), config) != null) {
                throw new IllegalArgumentException("duplicate slot: " + config.slot());
            }
        }
        List<RemoteConnection> toConnect = new ArrayList<>();
        List<RemoteConnection> toRetire = new ArrayList<>();
        synchronized (lock) {
            TreeMap<Integer, RemoteConnection> nextConnections = new TreeMap<>();
            for (SlotConfig config : nextSlots.values()) {
                if (!config.isComplete()) {
                    if (!config.isBlank()) {
                        LOG.warn("Incomplete server details for slot {}", config.slot());
                    }
                    continue;
                }
                RemoteConnection existing = connections.get(config.slot());
                if (existing != null && existing.slot().equals(config)) {
                    nextConnections.put(config.slot(), existing);
                    continue;
                }
                RemoteConnection created = new RemoteConnection(config, cipher, transportFactory);
                nextConnections.put(config.slot(), created);
                toConnect.add(created);
            }
            for (Map.Entry<Integer, RemoteConnection> entry : connections.entrySet()) {
                if (nextConnections.get(entry.getKey()) != entry.getValue()) {
                    toRetire.add(entry.getValue());
                }
            }
            slots = nextSlots;
            connections = nextConnections;
        }
        for (RemoteConnection retired : toRetire) {
            retired.retire();
        }
        for (RemoteConnection connection : toConnect) {
            connection.connect();
        }
        List<SlotView> states = states();
        LOG.info("Connected to {} server(s) across {} configured slot(s)", connectedCount(), states.size());
        return states;
    }

    public List<SlotOutcome> broadcast(String command) {
        return broadcast(command, () -> false);
    }

    /**
     * Sends {@code command} to every CONNECTED slot in slot order, opening a fresh session
     * for each. Slots that are not connected are reported as skipped, as are all slots left
     * once {@code cancelled} turns true.
     */
    public List<SlotOutcome> broadcast(String command, BooleanSupplier cancelled) {
        List<RemoteConnection> snapshot = connectionSnapshot();
        List<SlotOutcome> outcomes = new ArrayList<>(snapshot.size());
        for (RemoteConnection connection : snapshot) {
            int slot = connection.slot().slot();
            String endpoint = connection.endpoint();
            if (cancelled.getAsBoolean()) {
                outcomes.add(SlotOutcome.skipped(slot, endpoint, "dispatch cancelled"));
                continue;
            }
            if (connection.state() != ConnectionState.CONNECTED) {
                outcomes.add(SlotOutcome.skipped(slot, endpoint, "not connected (" + connection.state() + ")"));
                continue;
            }
            if (connection.reconnect(retryLimit, retryDelay) != ConnectionState.CONNECTED) {
                outcomes.add(SlotOutcome.failed(slot, endpoint, connection.lastFailure()));
                continue;
            }
            try {
                String response = connection.execute(command);
                LOG.info("Executed '{}' on {}. Response: {}", command, endpoint, response);
                outcomes.add(SlotOutcome.success(slot, endpoint, response));
            } catch (CommandExecutionException e) {
                LOG.error("Error executing '{}' on {}: {}", command, endpoint, e.getMessage());
                outcomes.add(SlotOutcome.failed(slot, endpoint, e.getMessage()));
            }
        }
        return outcomes;
    }

    public int recoverFailed() {
        return recoverFailed(() -> false);
    }

    /**
     * Makes one immediate reconnect attempt for every slot currently in FAILED state. Unlike
     * {@link #broadcast} this does not use the retry budget, so a pass over all slots costs at
     * most one connect each. Slots after {@code cancelled} turns true are left as they are.
     *
     * @return number of slots that came back
     */
    public int recoverFailed(BooleanSupplier cancelled) {
        int recovered = 0;
        for (RemoteConnection connection : connectionSnapshot()) {
            if (cancelled.getAsBoolean()) {
                break;
            }
            if (connection.state() != ConnectionState.FAILED) {
                continue;
            }
            if (connection.reconnect(1, Duration.ZERO) == ConnectionState.CONNECTED) {
                recovered++;
            }
        }
        return recovered;
    }

    public List<SlotView> reconnectAll() {
        for (RemoteConnection connection : connectionSnapshot()) {
            connection.reconnect(retryLimit, retryDelay);
        }
        return states();
    }

    public void disconnectAll() {
        for (RemoteConnection connection : connectionSnapshot()) {
            connection.disconnect();
        }
    }

    public List<SlotView> states() {
        TreeMap<Integer, SlotConfig> slotSnapshot;
        TreeMap<Integer, RemoteConnection> connectionMap;
        synchronized (lock) {
            slotSnapshot = slots;
            connectionMap = connections;
        }
        List<SlotView> out = new ArrayList<>(slotSnapshot.size());
        for (SlotConfig config : slotSnapshot.values()) {
            RemoteConnection connection = connectionMap.get(config.slot());
            if (connection == null) {
                out.add(new SlotView(config.slot(), config.host(), config.port(), NOT_CONFIGURED, null));
            } else {
                out.add(new SlotView(
                        config.slot(),
                        config.host(),
                        config.port(),
                        connection.state().name(),
                        connection.lastFailure()
                ));
            }
        }
        return out;
    }

    public int connectedCount() {
        int connected = 0;
        for (RemoteConnection connection : connectionSnapshot()) {
            if (connection.state() == ConnectionState.CONNECTED) {
                connected++;
            }
        }
        return connected;
    }

    private List<RemoteConnection> connectionSnapshot() {
        synchronized (lock) {
            return List.copyOf(connections.values());
        }
    }
}
