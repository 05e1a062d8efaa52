package io.rconcron.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rconcron.connection.SlotConfig;
import io.rconcron.schedule.InvalidRuleException;
import io.rconcron.schedule.RecurrenceRule;
import io.rconcron.security.CredentialCipher;
import io.rconcron.security.CryptoException;
import io.rconcron.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and writes {@code server-config.json}.
 *
 * <p>Older files are accepted: a server may carry a plaintext {@code password} (encrypted on
 * load) and a command may carry only a {@code cron_expression}.
 */
public final class ConfigStore {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigStore.class);

    private final Path file;
    private final CredentialCipher cipher;

    public ConfigStore(Path file, CredentialCipher cipher) {
        this.file = file;
        this.cipher = cipher;
    }

    public Path file() {
        return file;
    }

    public StoredConfig load() {
        if (!Files.exists(file)) {
            LOG.warn("Configuration file not found: {}", file);
            return StoredConfig.empty();
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigStoreException("Error loading configuration " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigStoreException("Configuration " + file + " is not a JSON object");
        }
        List<SlotConfig> slots = readServers(root.path("servers"));
        List<StoredConfig.StoredCommand> commands = readCommands(root.path("scheduled_commands"));
        LOG.info("Loaded {} server slot(s) and {} scheduled command(s) from {}", slots.size(), commands.size(), file);
        return new StoredConfig(slots, commands, hasPlaintextPasswords(root.path("servers")));
    }

    /**
     * Identity of the file as it is on disk now; empty when it does not exist. Every
     * {@link #save} replaces the file, so the stamp changes even within one clock tick.
     */
    public Optional<Stamp> stamp() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return Optional.of(new Stamp(attributes.lastModifiedTime(), attributes.size(), attributes.fileKey()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ConfigStoreException("Cannot read attributes of " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(List<SlotConfig> slots, List<StoredConfig.StoredCommand> commands) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        ArrayNode servers = root.putArray("servers");
        for (SlotConfig slot : slots) {
            if (slot.isBlank()) {
                continue;
            }
            ObjectNode row = servers.addObject();
            row.put("slot", slot.slot());
            row.put("address", slot.host());
            row.put("port", slot.port());
            row.put("password_enc", slot.credentialCiphertext());
        }
        ArrayNode scheduled = root.putArray("scheduled_commands");
        for (StoredConfig.StoredCommand command : commands) {
            ObjectNode row = scheduled.addObject();
            row.put("command", command.command());
            row.put("label", command.rule().label());
            row.put("cron_expression", command.rule().toCron());
            row.set("rule", Jsons.mapper().valueToTree(command.rule()));
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ConfigStoreException("Error saving configuration " + file + ": " + e.getMessage(), e);
        }
        LOG.info("Configuration and scheduled commands saved to {}", file);
    }

    private static boolean hasPlaintextPasswords(JsonNode servers) {
        for (JsonNode server : servers) {
            if (server.path("password_enc").asText("").isBlank() && !server.path("password").asText("").isBlank()) {
                return true;
            }
        }
        return false;
    }

    private List<SlotConfig> readServers(JsonNode servers) {
        List<SlotConfig> out = new ArrayList<>();
        if (!servers.isArray()) {
            return out;
        }
        Set<Integer> seen = new HashSet<>();
        int position = 0;
        for (JsonNode server : servers) {
            int slot = server.hasNonNull("slot") ? server.path("slot").asInt(position) : position;
            position++;
            if (!seen.add(slot)) {
                LOG.warn("Ignoring duplicate server slot {} in {}", slot, file);
                continue;
            }
            String credential = server.path("password_enc").asText("");
            String legacyPassword = server.path("password").asText("");
            if (credential.isBlank() && !legacyPassword.isBlank()) {
                credential = encryptLegacy(slot, legacyPassword);
            }
            out.add(new SlotConfig(
                    slot,
                    server.path("address").asText(""),
                    server.path("port").asText(""),
                    credential
            ));
        }
        return out;
    }

    private List<StoredConfig.StoredCommand> readCommands(JsonNode commands) {
        List<StoredConfig.StoredCommand> out = new ArrayList<>();
        if (!commands.isArray()) {
            return out;
        }
        for (JsonNode row : commands) {
            String command = row.path("command").asText("").strip();
            if (command.isEmpty()) {
                LOG.warn("Could not parse scheduled command without text: {}", row);
                continue;
            }
            try {
                out.add(new StoredConfig.StoredCommand(command, readRule(row)));
            } catch (InvalidRuleException e) {
                LOG.warn("Could not parse schedule of command '{}': {}", command, e.getMessage());
            }
        }
        return out;
    }

    private RecurrenceRule readRule(JsonNode row) {
        JsonNode rule = row.path("rule");
        if (rule.isObject()) {
            try {
                return Jsons.mapper().treeToValue(rule, RecurrenceRule.class);
            } catch (IOException | IllegalArgumentException e) {
                if (!row.hasNonNull("cron_expression")) {
                    throw new InvalidRuleException("unreadable rule " + rule + ": " + e.getMessage());
                }
                LOG.warn("Unreadable rule {}, falling back to cron_expression", rule);
            }
        }
        return RecurrenceRule.fromCron(row.path("cron_expression").asText(""));
    }

    private String encryptLegacy(int slot, String plaintext) {
        if (cipher == null) {
            throw new ConfigStoreException("Slot " + slot + " stores a plaintext password but no cipher is available");
        }
        try {
            return cipher.encrypt(plaintext);
        } catch (CryptoException e) {
            throw new ConfigStoreException("Cannot encrypt plaintext password of slot " + slot + ": " + e.getMessage(), e);
        }
    }

    public record Stamp(FileTime modified, long size, Object fileKey) {
    }
}
