package io.rconcron.connection;

import io.rconcron.rcon.RconAuthenticationException;
import io.rconcron.rcon.RconTransport;
import io.rconcron.rcon.RconTransportFactory;
import io.rconcron.security.CredentialCipher;
import io.rconcron.security.CryptoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Owns the link to one RCON endpoint.
 *
 * <p>Connection failures never escape {@link #connect()}; they move the connection to
 * {@link ConnectionState#FAILED} and are kept in {@link #lastFailure()}. Command failures are
 * thrown to the caller after the state has been degraded. The credential is decrypted only
 * for the duration of a login and is never logged.
 */
public final class RemoteConnection {
    private static final Logger LOG = LoggerFactory.getLogger(RemoteConnection.class);

    private final SlotConfig slot;
    private final CredentialCipher cipher;
    private final RconTransportFactory transportFactory;
    private volatile ConnectionState state;
    private volatile String lastFailure;
    private volatile boolean retired;
    private RconTransport transport;

    public RemoteConnection(SlotConfig slot, CredentialCipher cipher, RconTransportFactory transportFactory) {
        this.slot = Objects.requireNonNull(slot, "slot");
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.state = ConnectionState.DISCONNECTED;
    }

    public SlotConfig slot() {
        return slot;
    }

    public String endpoint() {
        return slot.endpoint();
    }

    public ConnectionState state() {
        return state;
    }

    public String lastFailure() {
        return lastFailure;
    }

    public synchronized ConnectionState connect() {
        if (state == ConnectionState.CONNECTED) {
            return state;
        }
        if (retired) {
            markFailed("slot " + slot.slot() + " was removed from the configuration");
            return state;
        }
        try {
            transport = openSession();
            state = ConnectionState.CONNECTED;
            lastFailure = null;
            LOG.info("Connected to {} via RCON", endpoint());
        } catch (ConnectionFailureException e) {
            markFailed(e.getMessage());
            LOG.error("Error connecting to {} via RCON: {}", endpoint(), e.getMessage());
        }
        return state;
    }

    public synchronized void disconnect() {
        if (state != ConnectionState.CONNECTED) {
            return;
        }
        closeTransport();
        state = ConnectionState.DISCONNECTED;
        LOG.info("Disconnected from {}", endpoint());
    }

    public synchronized String execute(String command) throws CommandExecutionException {
        if (state != ConnectionState.CONNECTED || transport == null) {
            throw new CommandExecutionException("not connected to " + endpoint() + " (state " + state + ")");
        }
        try {
            return transport.command(command);
        } catch (IOException e) {
            closeTransport();
            String reason = "command failed on " + endpoint() + ": " + describe(e);
            markFailed(reason);
            throw new CommandExecutionException(reason, e);
        }
    }

    /**
     * Drops the current session and makes up to {@code retryLimit} connect attempts, each
     * preceded by {@code retryDelay}. Blocks the caller for up to {@code retryLimit * retryDelay}.
     */
    public synchronized ConnectionState reconnect(int retryLimit, Duration retryDelay) {
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retry limit must be at least 1: " + retryLimit);
        }
        disconnect();
        long delayMs = Math.max(0L, retryDelay.toMillis());
        for (int attempt = 1; attempt <= retryLimit; attempt++) {
            LOG.info("Reconnect attempt {} for {}", attempt, endpoint());
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                markFailed("reconnect to " + endpoint() + " interrupted");
                LOG.warn("Reconnect to {} interrupted after {} attempt(s)", endpoint(), attempt - 1);
                return state;
            }
            if (connect() == ConnectionState.CONNECTED) {
                LOG.info("Successfully reconnected to {}", endpoint());
                return state;
            }
            LOG.warn("Failed to reconnect to {}, attempt {} of {}", endpoint(), attempt, retryLimit);
        }
        return state;
    }

    /**
     * Marks the connection as no longer part of the pool and closes it. Later connect attempts
     * are refused.
     */
    synchronized void retire() {
        retired = true;
        disconnect();
    }

    private RconTransport openSession() throws ConnectionFailureException {
        int port = parsePort(slot.port());
        String password;
        try {
            password = cipher.decrypt(slot.credentialCiphertext());
        } catch (CryptoException e) {
            throw new ConnectionFailureException("credential unavailable: " + e.getMessage(), e);
        }
        RconTransport opened;
        try {
            opened = transportFactory.open(slot.host(), port);
        } catch (IOException e) {
            throw new ConnectionFailureException("cannot reach " + endpoint() + ": " + describe(e), e);
        }
        try {
            opened.authenticate(password);
            return opened;
        } catch (RconAuthenticationException e) {
            closeQuietly(opened);
            throw new ConnectionFailureException("authentication rejected by " + endpoint(), e);
        } catch (IOException e) {
            closeQuietly(opened);
            throw new ConnectionFailureException("login to " + endpoint() + " failed: " + describe(e), e);
        }
    }

    static int parsePort(String raw) throws ConnectionFailureException {
        if (raw == null || raw.isBlank() || !raw.trim().chars().allMatch(Character::isDigit)) {
            throw new ConnectionFailureException("Port must be a number: '" + (raw == null ? "" : raw) + "'");
        }
        int port;
        try {
            port = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConnectionFailureException("Port out of range: " + raw, e);
        }
        if (port < 1 || port > 65535) {
            throw new ConnectionFailureException("Port out of range: " + port);
        }
        return port;
    }

    private void markFailed(String reason) {
        state = ConnectionState.FAILED;
        lastFailure = reason;
    }

    private void closeTransport() {
        RconTransport current = transport;
        transport = null;
        if (current != null) {
            closeQuietly(current);
        }
    }

    private void closeQuietly(RconTransport target) {
        try {
            target.close();
        } catch (IOException e) {
            LOG.warn("Error disconnecting from {}: {}", endpoint(), describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
