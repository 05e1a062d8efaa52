package io.rconcron.connection;

import io.rconcron.security.SensitiveDataMasker;

/**
 * One configured server position. The port is kept as entered so a malformed value is
 * reported by the connection rather than rejected at load.
 */
public record SlotConfig(
        int slot,
        String host,
        String port,
        String credentialCiphertext
) {
    public SlotConfig {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative: " + slot);
        }
        host = host == null ? "" : host.trim();
        port = port == null ? "" : port.trim();
        credentialCiphertext = credentialCiphertext == null ? "" : credentialCiphertext;
    }

    public boolean isComplete() {
        return !host.isEmpty() && !port.isEmpty() && !credentialCiphertext.isBlank();
    }

    public boolean isBlank() {
        return host.isEmpty() && port.isEmpty() && credentialCiphertext.isBlank();
    }

    public String endpoint() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return "SlotConfig[slot=" + slot + ", host=" + host + ", port=" + port
                + ", credential=" + SensitiveDataMasker.maskCredential(credentialCiphertext) + "]";
    }
}
