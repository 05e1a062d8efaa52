package io.rconcron.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.rconcron.connection.SlotConfig;
import io.rconcron.schedule.RecurrenceRule;
import io.rconcron.testing.PrefixCredentialCipher;
import io.rconcron.testing.TestFiles;
import io.rconcron.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ConfigStoreTest {

    @Test
    void missingFileLoadsAsEmptyConfiguration() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-missing-");
        try {
            StoredConfig loaded = new ConfigStore(root.resolve("server-config.json"), new PrefixCredentialCipher()).load();
            Assertions.assertTrue(loaded.slots().isEmpty());
            Assertions.assertTrue(loaded.commands().isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void saveThenLoadKeepsSlotsAndRules() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-save-");
        try {
            Path file = root.resolve("server-config.json");
            ConfigStore store = new ConfigStore(file, new PrefixCredentialCipher());
            store.save(
                    List.of(
                            new SlotConfig(0, "mc.example.com", "25575", "enc:pw0"),
                            new SlotConfig(3, "10.0.0.3", "25580", "enc:pw3"),
                            new SlotConfig(4, "", "", "")
                    ),
                    List.of(
                            new StoredConfig.StoredCommand("say hi", RecurrenceRule.daily(14, 0)),
                            new StoredConfig.StoredCommand("save-all", RecurrenceRule.everyMinutes(15))
                    )
            );

            JsonNode written = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            Assertions.assertEquals(2, written.path("servers").size());
            Assertions.assertEquals("enc:pw3", written.path("servers").get(1).path("password_enc").asText());
            Assertions.assertFalse(written.path("servers").get(1).has("password"));
            Assertions.assertEquals("Daily at 14:00", written.path("scheduled_commands").get(0).path("label").asText());
            Assertions.assertEquals("0 14 * * *", written.path("scheduled_commands").get(0).path("cron_expression").asText());
            Assertions.assertFalse(Files.exists(root.resolve("server-config.json.tmp")));

            StoredConfig loaded = store.load();
            Assertions.assertEquals(List.of(0, 3), loaded.slots().stream().map(SlotConfig::slot).toList());
            Assertions.assertEquals("25580", loaded.slots().get(1).port());
            Assertions.assertEquals(RecurrenceRule.daily(14, 0), loaded.commands().get(0).rule());
            Assertions.assertEquals(RecurrenceRule.everyMinutes(15), loaded.commands().get(1).rule());
            Assertions.assertFalse(loaded.migrated());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void stampChangesWithEverySave() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-stamp-");
        try {
            ConfigStore store = new ConfigStore(root.resolve("server-config.json"), new PrefixCredentialCipher());
            Assertions.assertTrue(store.stamp().isEmpty());
            List<StoredConfig.StoredCommand> commands =
                    List.of(new StoredConfig.StoredCommand("say hi", RecurrenceRule.everyMinute()));

            store.save(List.of(), commands);
            ConfigStore.Stamp first = store.stamp().orElseThrow();
            Assertions.assertEquals(first, store.stamp().orElseThrow());
            store.save(List.of(), commands);

            Assertions.assertNotEquals(first, store.stamp().orElseThrow());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void legacyFileWithCronAndPlaintextPasswordIsUpgradedOnLoad() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-legacy-");
        try {
            Path file = root.resolve("server-config.json");
            Files.writeString(file, """
                    {
                      "servers": [
                        {"address": "alpha", "port": "25575", "password": "plain"},
                        {"address": "beta", "port": "25575", "password": "other"}
                      ],
                      "scheduled_commands": [
                        {"command": "weather clear", "label": "Weekly", "cron_expression": "0 12 * * 1"},
                        {"command": "broken", "cron_expression": "0 0 1 * *"},
                        {"command": "", "cron_expression": "* * * * *"},
                        {"command": "say every", "rule": {"frequency": "EVERY_MINUTE"}}
                      ]
                    }
                    """, StandardCharsets.UTF_8);

            StoredConfig loaded = new ConfigStore(file, new PrefixCredentialCipher()).load();

            Assertions.assertEquals(List.of(0, 1), loaded.slots().stream().map(SlotConfig::slot).toList());
            Assertions.assertEquals("enc:plain", loaded.slots().get(0).credentialCiphertext());
            Assertions.assertTrue(loaded.migrated());
            Assertions.assertEquals(2, loaded.commands().size());
            Assertions.assertEquals(RecurrenceRule.weekly(1, 12, 0), loaded.commands().get(0).rule());
            Assertions.assertEquals(RecurrenceRule.everyMinute(), loaded.commands().get(1).rule());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void invalidRuleObjectFallsBackToCronExpression() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-fallback-");
        try {
            Path file = root.resolve("server-config.json");
            Files.writeString(file, """
                    {"servers": [], "scheduled_commands": [
                      {"command": "say hi", "cron_expression": "30 * * * *", "rule": {"frequency": "HOURLY", "minute": 99}}
                    ]}
                    """, StandardCharsets.UTF_8);

            StoredConfig loaded = new ConfigStore(file, new PrefixCredentialCipher()).load();

            Assertions.assertEquals(RecurrenceRule.hourly(30), loaded.commands().get(0).rule());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void duplicateSlotsKeepTheFirstEntry() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-dup-");
        try {
            Path file = root.resolve("server-config.json");
            Files.writeString(file, """
                    {"servers": [
                      {"slot": 2, "address": "first", "port": "25575", "password_enc": "enc:a"},
                      {"slot": 2, "address": "second", "port": "25575", "password_enc": "enc:b"}
                    ]}
                    """, StandardCharsets.UTF_8);

            StoredConfig loaded = new ConfigStore(file, new PrefixCredentialCipher()).load();

            Assertions.assertEquals(1, loaded.slots().size());
            Assertions.assertEquals("first", loaded.slots().get(0).host());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void corruptFileIsReported() throws Exception {
        Path root = Files.createTempDirectory("rconcron-store-corrupt-");
        try {
            Path file = root.resolve("server-config.json");
            Files.writeString(file, "{not json", StandardCharsets.UTF_8);
            ConfigStore store = new ConfigStore(file, new PrefixCredentialCipher());
            Assertions.assertThrows(ConfigStoreException.class, store::load);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
