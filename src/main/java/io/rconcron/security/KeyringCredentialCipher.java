package io.rconcron.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rconcron.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-GCM credential cipher backed by a rotating keyring file.
 *
 * <p>The keyring is created on first use. Ciphertexts are compact JSON envelopes naming the
 * key id that produced them, so credentials written before a rotation stay readable.
 */
public final class KeyringCredentialCipher implements CredentialCipher {
    private static final Logger LOG = LoggerFactory.getLogger(KeyringCredentialCipher.class);
    private static final String SCHEMA = "rconcron.aesgcm.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;
    private volatile String loadFailure;

    public KeyringCredentialCipher(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        try {
            this.keyring = loadOrCreateKeyring();
        } catch (IOException | RuntimeException e) {
            this.loadFailure = e.getMessage();
            LOG.warn("Credential keyring unavailable at {}: {}", keyFile, e.getMessage());
        }
    }

    @Override
    public String encrypt(String plaintext) throws CryptoException {
        if (plaintext == null) {
            throw new CryptoException("Cannot encrypt a null credential");
        }
        Keyring ring = requireKeyring();
        SecretKeySpec key = ring.keys.get(ring.activeKid);
        if (key == null) {
            throw new CryptoException("Active key " + ring.activeKid + " is missing from " + keyFile);
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("kid", ring.activeKid);
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactJson(row);
        } catch (Exception e) {
            throw new CryptoException("Failed to encrypt credential", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) throws CryptoException {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new CryptoException("Credential ciphertext is empty");
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(ciphertext.trim());
        } catch (Exception e) {
            throw new CryptoException("Credential ciphertext is not a valid envelope", e);
        }
        if (node == null || !SCHEMA.equals(node.path("enc").asText(""))) {
            throw new CryptoException("Unsupported credential envelope");
        }
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        String kid = node.path("kid").asText("");
        if (ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new CryptoException("Invalid credential envelope: missing iv/ct");
        }
        byte[] iv;
        byte[] cipherText;
        try {
            iv = Base64.getDecoder().decode(ivBase64);
            cipherText = Base64.getDecoder().decode(ctBase64);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Invalid credential envelope: bad base64", e);
        }
        Keyring ring = requireKeyring();
        if (!kid.isBlank()) {
            SecretKeySpec exact = ring.keys.get(kid);
            if (exact != null) {
                return decrypt(cipherText, iv, exact);
            }
        }
        for (SecretKeySpec key : ring.keys.values()) {
            try {
                return decrypt(cipherText, iv, key);
            } catch (CryptoException ignored) {
                // Try next key in rotation.
            }
        }
        throw new CryptoException("Unable to decrypt credential with current keyring");
    }

    public synchronized RotationOutcome rotate() throws CryptoException {
        Keyring current = keyring == null ? new Keyring("", new LinkedHashMap<>()) : keyring;
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(current.keys);
        String kid = newKid(next);
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        next.put(kid, new SecretKeySpec(raw, "AES"));
        Keyring rotated = new Keyring(kid, next);
        try {
            persistKeyring(rotated);
        } catch (IOException e) {
            throw new CryptoException("Failed to persist credential keyring: " + keyFile, e);
        }
        keyring = rotated;
        loadFailure = null;
        return new RotationOutcome(kid, next.size(), keyFile.toString());
    }

    public KeyringStatus status() {
        Keyring ring = keyring;
        int total = ring == null ? 0 : ring.keys.size();
        String active = ring == null ? "" : ring.activeKid;
        return new KeyringStatus(active, total, keyFile.toString());
    }

    private Keyring requireKeyring() throws CryptoException {
        Keyring ring = keyring;
        if (ring == null || ring.keys.isEmpty()) {
            throw new CryptoException("Credential keyring is not loaded"
                    + (loadFailure == null ? "" : ": " + loadFailure));
        }
        return ring;
    }

    private String decrypt(byte[] cipherText, byte[] iv, SecretKeySpec key) throws CryptoException {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] plain = cipher.doFinal(cipherText);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new CryptoException("Failed to decrypt credential", e);
        }
    }

    private synchronized Keyring loadOrCreateKeyring() throws IOException {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            LOG.info("Created credential keyring at {}", keyFile);
            return created;
        }
        JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
        String active = node.path("active_kid").asText("");
        JsonNode keysNode = node.path("keys");
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        if (keysNode.isObject()) {
            keysNode.fieldNames().forEachRemaining(kid -> {
                String rawBase64 = keysNode.path(kid).asText("");
                if (kid == null || kid.isBlank() || rawBase64.isBlank()) {
                    return;
                }
                byte[] raw = Base64.getDecoder().decode(rawBase64);
                keys.put(kid, new SecretKeySpec(raw, "AES"));
            });
        }
        if (keys.isEmpty()) {
            throw new IOException("Credential keyring has no keys: " + keyFile);
        }
        if (!keys.containsKey(active)) {
            active = keys.keySet().iterator().next();
        }
        return new Keyring(active, keys);
    }

    private Keyring bootstrapKeyring() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = newKid(keys);
        keys.put(kid, new SecretKeySpec(raw, "AES"));
        return new Keyring(kid, keys);
    }

    private static String newKid(Map<String, SecretKeySpec> existing) {
        String base = "k" + Instant.now().toEpochMilli();
        String kid = base;
        int suffix = 1;
        while (existing.containsKey(kid)) {
            kid = base + "-" + suffix++;
        }
        return kid;
    }

    private void persistKeyring(Keyring ring) throws IOException {
        if (keyFile.getParent() != null) {
            Files.createDirectories(keyFile.getParent());
        }
        LinkedHashMap<String, String> keys = new LinkedHashMap<>();
        for (Map.Entry<String, SecretKeySpec> entry : ring.keys.entrySet()) {
            keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
        }
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("schema", "rconcron.credential.keys.v1");
        root.put("active_kid", ring.activeKid);
        root.set("keys", Jsons.mapper().valueToTree(keys));
        Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }

    public record RotationOutcome(String activeKid, int totalKeys, String keyFile) {
    }

    public record KeyringStatus(String activeKid, int totalKeys, String keyFile) {
    }
}
