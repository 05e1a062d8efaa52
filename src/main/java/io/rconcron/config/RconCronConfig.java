package io.rconcron.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class RconCronConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_RETRY_LIMIT = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_JOIN_GRACE = Duration.ofSeconds(2);
    public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_RCON_PORT = 25575;
    public static final int MAX_SLOTS = 9;

    private final Path rootDir;
    private final Duration tickInterval;
    private final int retryLimit;
    private final Duration retryDelay;
    private final Duration joinGrace;
    private final Duration socketTimeout;
    private final boolean recoverFailedSlots;

    public RconCronConfig(
            Path rootDir,
            Duration tickInterval,
            int retryLimit,
            Duration retryDelay,
            Duration joinGrace,
            Duration socketTimeout,
            boolean recoverFailedSlots
    ) {
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retry limit must be at least 1: " + retryLimit);
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tick interval must be positive: " + tickInterval);
        }
        this.rootDir = rootDir;
        this.tickInterval = tickInterval;
        this.retryLimit = retryLimit;
        this.retryDelay = retryDelay.isNegative() ? Duration.ZERO : retryDelay;
        this.joinGrace = joinGrace;
        this.socketTimeout = socketTimeout;
        this.recoverFailedSlots = recoverFailedSlots;
    }

    public static RconCronConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new RconCronConfig(
                resolved.toAbsolutePath().normalize(),
                DEFAULT_TICK_INTERVAL,
                DEFAULT_RETRY_LIMIT,
                DEFAULT_RETRY_DELAY,
                DEFAULT_JOIN_GRACE,
                DEFAULT_SOCKET_TIMEOUT,
                true
        );
    }

    public RconCronConfig withTickInterval(Duration value) {
        return new RconCronConfig(rootDir, value, retryLimit, retryDelay, joinGrace, socketTimeout, recoverFailedSlots);
    }

    public RconCronConfig withRetry(int limit, Duration delay) {
        return new RconCronConfig(rootDir, tickInterval, limit, delay, joinGrace, socketTimeout, recoverFailedSlots);
    }

    public RconCronConfig withRecoverFailedSlots(boolean value) {
        return new RconCronConfig(rootDir, tickInterval, retryLimit, retryDelay, joinGrace, socketTimeout, value);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public int retryLimit() {
        return retryLimit;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public Duration joinGrace() {
        return joinGrace;
    }

    public Duration socketTimeout() {
        return socketTimeout;
    }

    public boolean recoverFailedSlots() {
        return recoverFailedSlots;
    }

    public Path serverConfigFile() {
        return rootDir.resolve("server-config.json");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path credentialKeyFile() {
        return securityRoot().resolve("credential-keys.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
