package io.rconcron.runtime;

import io.rconcron.config.RconCronConfig;
import io.rconcron.connection.ConnectionPool;
import io.rconcron.connection.SlotConfig;
import io.rconcron.connection.SlotOutcome;
import io.rconcron.dispatch.Dispatcher;
import io.rconcron.dispatch.DispatcherState;
import io.rconcron.model.EntryView;
import io.rconcron.model.SlotView;
import io.rconcron.observability.AuditLogger;
import io.rconcron.rcon.RconTransportFactory;
import io.rconcron.rcon.SocketRconTransport;
import io.rconcron.schedule.RecurrenceRule;
import io.rconcron.schedule.ScheduleEntry;
import io.rconcron.schedule.ScheduleTable;
import io.rconcron.security.CredentialCipher;
import io.rconcron.security.CryptoException;
import io.rconcron.security.KeyringCredentialCipher;
import io.rconcron.storage.ConfigStore;
import io.rconcron.storage.StoredConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Process-scoped wiring of the credential cipher, connection pool, schedule table and
 * dispatcher. The operator surface talks to the engine only through this object.
 */
public final class RconCronContext {
    private static final Logger LOG = LoggerFactory.getLogger(RconCronContext.class);

    private final RconCronConfig config;
    private final CredentialCipher cipher;
    private final Clock clock;
    private final ConnectionPool pool;
    private final ScheduleTable table;
    private final ConfigStore configStore;
    private final AuditLogger auditLogger;
    private final Dispatcher dispatcher;
    private final Object syncLock = new Object();
    private List<SlotConfig> slotConfigs = List.of();
    // The configuration file as this context last read or wrote it, and its stamp at that time.
    private StoredConfig synced = StoredConfig.empty();
    private ConfigStore.Stamp syncedStamp;
    private boolean rewritePending;
    private volatile boolean live;

    public RconCronContext(
            RconCronConfig config,
            CredentialCipher cipher,
            RconTransportFactory transportFactory,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pool = new ConnectionPool(cipher, transportFactory, config.retryLimit(), config.retryDelay());
        this.table = new ScheduleTable();
        this.configStore = new ConfigStore(config.serverConfigFile(), cipher);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.dispatcher = new Dispatcher(
                table,
                pool,
                clock,
                config.tickInterval(),
                config.recoverFailedSlots(),
                auditLogger,
                this::refreshFromStore
        );
    }

    public static RconCronContext open(RconCronConfig config) {
        return new RconCronContext(
                config,
                new KeyringCredentialCipher(config.credentialKeyFile()),
                SocketRconTransport.factory(config.socketTimeout()),
                Clock.systemUTC()
        );
    }

    /**
     * Reads the stored configuration into this context without opening any connection.
     * Commands not yet scheduled here are armed from now; see {@link #refreshFromStore()} for
     * how the file is merged with changes made in this process.
     */
    public StoredConfig load() {
        return syncWithStore();
    }

    /**
     * {@link #load()} followed by connecting every configured slot.
     */
    public List<SlotView> loadConfiguration() {
        load();
        return connectAll();
    }

    public List<SlotView> connectAll() {
        return configure(slotConfigs());
    }

    public List<SlotView> configure(List<SlotConfig> slots) {
        synchronized (syncLock) {
            slotConfigs = List.copyOf(slots);
        }
        return applySlots(slots);
    }

    private List<SlotView> applySlots(List<SlotConfig> slots) {
        live = true;
        List<SlotView> states = pool.configure(slots);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("slots", states.size());
        details.put("connected", pool.connectedCount());
        auditLogger.log(AuditLogger.AuditEvent.of("servers.configure", "pool", "ok", details));
        return states;
    }

    /**
     * Picks up the configuration file when another process has rewritten it since this context
     * last read or wrote it. Scheduled commands that are still present keep their next fire
     * time, new ones are armed from now, and slots whose details changed are reconnected if the
     * pool is live. Changes made in this process and not yet saved are kept.
     *
     * @return true when the file had changed
     */
    public boolean refreshFromStore() {
        if (!storeChanged()) {
            return false;
        }
        StoredConfig onDisk = syncWithStore();
        LOG.info("Reloaded {}: {} server slot(s), {} scheduled command(s)",
                configStore.file(), onDisk.slots().size(), table.size());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("slots", onDisk.slots().size());
        details.put("scheduled", table.size());
        auditLogger.log(AuditLogger.AuditEvent.of("config.reload", "store", "ok", details));
        return true;
    }

    /**
     * True when this process holds changes the configuration file does not have.
     */
    public boolean hasLocalChanges() {
        synchronized (syncLock) {
            List<StoredConfig.StoredCommand> local = currentCommands();
            return rewritePending
                    || !withoutBlank(slotConfigs).equals(withoutBlank(synced.slots()))
                    || !minus(local, synced.commands()).isEmpty()
                    || !minus(synced.commands(), local).isEmpty();
        }
    }

    private boolean storeChanged() {
        ConfigStore.Stamp current = configStore.stamp().orElse(null);
        synchronized (syncLock) {
            return !Objects.equals(current, syncedStamp);
        }
    }

    /**
     * Three-way merge of the file into this context, using the copy last synced as the common
     * base: whatever this process changed since then wins, everything else follows the file.
     */
    private StoredConfig syncWithStore() {
        List<SlotConfig> before;
        List<SlotConfig> after;
        StoredConfig onDisk;
        synchronized (syncLock) {
            ConfigStore.Stamp stamp = configStore.stamp().orElse(null);
            onDisk = configStore.load();
            mergeCommands(synced.commands(), onDisk.commands());
            before = slotConfigs;
            after = mergeSlots(synced.slots(), before, onDisk.slots());
            slotConfigs = after;
            synced = onDisk;
            syncedStamp = stamp;
            rewritePending = rewritePending || onDisk.migrated();
        }
        if (live && !after.equals(before)) {
            applySlots(after);
        }
        return onDisk;
    }

    private void mergeCommands(List<StoredConfig.StoredCommand> base, List<StoredConfig.StoredCommand> onDisk) {
        List<ScheduleEntry> entries = table.entries();
        List<StoredConfig.StoredCommand> local = currentCommands();
        List<StoredConfig.StoredCommand> wanted = minus(onDisk, minus(base, local));
        wanted.addAll(minus(local, base));
        for (ScheduleEntry entry : entries) {
            if (!removeFirst(wanted, entry.commandText(), entry.rule())) {
                table.remove(entry.id());
                LOG.info("Command '{}' ({}) is no longer scheduled", entry.commandText(), entry.rule().toCron());
            }
        }
        for (StoredConfig.StoredCommand command : wanted) {
            ScheduleEntry added = table.add(command.command(), command.rule(), clock.instant());
            LOG.info("Scheduled command '{}' ({}) for next run at {} UTC", added.commandText(), command.rule().toCron(), added.nextFire());
        }
    }

    private static List<SlotConfig> mergeSlots(List<SlotConfig> base, List<SlotConfig> local, List<SlotConfig> onDisk) {
        Map<Integer, SlotConfig> baseBySlot = bySlot(base);
        Map<Integer, SlotConfig> localBySlot = bySlot(local);
        Map<Integer, SlotConfig> diskBySlot = bySlot(onDisk);
        TreeMap<Integer, SlotConfig> merged = new TreeMap<>();
        TreeSet<Integer> indexes = new TreeSet<>(baseBySlot.keySet());
        indexes.addAll(localBySlot.keySet());
        indexes.addAll(diskBySlot.keySet());
        for (Integer index : indexes) {
            SlotConfig mine = localBySlot.get(index);
            SlotConfig chosen = Objects.equals(mine, baseBySlot.get(index)) ? diskBySlot.get(index) : mine;
            if (chosen != null) {
                merged.put(index, chosen);
            }
        }
        return List.copyOf(merged.values());
    }

    private static Map<Integer, SlotConfig> bySlot(List<SlotConfig> slots) {
        Map<Integer, SlotConfig> out = new LinkedHashMap<>();
        for (SlotConfig slot : slots) {
            out.put(slot.slot(), slot);
        }
        return out;
    }

    private static List<SlotConfig> withoutBlank(List<SlotConfig> slots) {
        List<SlotConfig> out = new ArrayList<>();
        for (SlotConfig slot : slots) {
            if (!slot.isBlank()) {
                out.add(slot);
            }
        }
        out.sort(Comparator.comparingInt(SlotConfig::slot));
        return out;
    }

    private List<StoredConfig.StoredCommand> currentCommands() {
        List<StoredConfig.StoredCommand> commands = new ArrayList<>();
        for (ScheduleEntry entry : table.entries()) {
            commands.add(new StoredConfig.StoredCommand(entry.commandText(), entry.rule()));
        }
        return commands;
    }

    /**
     * Multiset difference: {@code from} with one match removed for every element of
     * {@code remove}.
     */
    private static List<StoredConfig.StoredCommand> minus(
            List<StoredConfig.StoredCommand> from,
            List<StoredConfig.StoredCommand> remove
    ) {
        List<StoredConfig.StoredCommand> out = new ArrayList<>(from);
        for (StoredConfig.StoredCommand command : remove) {
            removeFirst(out, command.command(), command.rule());
        }
        return out;
    }

    private static boolean removeFirst(List<StoredConfig.StoredCommand> commands, String command, RecurrenceRule rule) {
        for (int i = 0; i < commands.size(); i++) {
            if (commands.get(i).sameAs(command, rule)) {
                commands.remove(i);
                return true;
            }
        }
        return false;
    }

    /**
     * Adds or replaces one slot in the stored configuration. Live connections are not touched
     * until the next {@link #connectAll()}.
     */
    public void putSlot(SlotConfig slot) {
        synchronized (syncLock) {
            List<SlotConfig> next = new ArrayList<>();
            for (SlotConfig existing : slotConfigs) {
                if (existing.slot() != slot.slot()) {
                    next.add(existing);
                }
            }
            next.add(slot);
            next.sort((a, b) -> Integer.compare(a.slot(), b.slot()));
            slotConfigs = List.copyOf(next);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("servers.put", "slot-" + slot.slot(), "ok",
                Map.of("endpoint", slot.endpoint(), "password_enc", slot.credentialCiphertext())));
    }

    public boolean removeSlot(int slot) {
        boolean removed;
        synchronized (syncLock) {
            List<SlotConfig> next = new ArrayList<>(slotConfigs);
            removed = next.removeIf(existing -> existing.slot() == slot);
            slotConfigs = List.copyOf(next);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("servers.remove", "slot-" + slot, removed ? "ok" : "not_found", Map.of()));
        return removed;
    }

    public List<SlotConfig> slotConfigs() {
        synchronized (syncLock) {
            return slotConfigs;
        }
    }

    public String schedule(String commandText, RecurrenceRule rule) {
        ScheduleEntry entry;
        synchronized (syncLock) {
            entry = table.add(commandText, rule, clock.instant());
        }
        LOG.info("Scheduled command '{}' ({}) for next run at {} UTC", entry.commandText(), rule.toCron(), entry.nextFire());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", entry.commandText());
        details.put("schedule", entry.label());
        details.put("next_fire", entry.nextFire().toString());
        auditLogger.log(AuditLogger.AuditEvent.of("schedule.add", entry.id(), "ok", details));
        return entry.id();
    }

    public boolean unschedule(String entryId) {
        boolean removed;
        synchronized (syncLock) {
            removed = table.remove(entryId);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("schedule.remove", entryId, removed ? "ok" : "not_found", Map.of()));
        return removed;
    }

    public List<EntryView> entries() {
        return table.snapshot();
    }

    public List<SlotView> slots() {
        return pool.states();
    }

    public int connectedCount() {
        return pool.connectedCount();
    }

    public void disconnectAll() {
        pool.disconnectAll();
    }

    public List<SlotView> reconnectAll() {
        return pool.reconnectAll();
    }

    /**
     * One-off broadcast outside the schedule. Blocks for the full reconnect and command cycle.
     */
    public List<SlotOutcome> broadcastNow(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        List<SlotOutcome> outcomes = pool.broadcast(command.strip());
        long succeeded = outcomes.stream().filter(o -> o.status() == SlotOutcome.Status.SUCCESS).count();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", command.strip());
        details.put("succeeded", succeeded);
        details.put("slots", outcomes.size());
        auditLogger.log(AuditLogger.AuditEvent.of("command.send", "pool", succeeded > 0 ? "success" : "no_delivery", details));
        return outcomes;
    }

    public void start() {
        dispatcher.start();
    }

    public boolean stop() {
        return dispatcher.stop(config.joinGrace());
    }

    public DispatcherState dispatcherState() {
        return dispatcher.state();
    }

    /**
     * Stops the dispatcher and closes every connection. The configuration is written back only
     * when this process changed it; edits other processes made in the meantime are merged in
     * rather than overwritten.
     */
    public void shutdown() {
        stop();
        disconnectAll();
        if (hasLocalChanges()) {
            save();
        } else {
            LOG.debug("No local configuration changes; {} left as is", configStore.file());
        }
    }

    /**
     * Writes slots and scheduled commands, first merging in the file if another process
     * rewrote it since this context last read or wrote it.
     */
    public void save() {
        if (storeChanged()) {
            LOG.info("{} changed on disk since it was read; merging before writing", configStore.file());
            syncWithStore();
        }
        synchronized (syncLock) {
            List<StoredConfig.StoredCommand> commands = currentCommands();
            configStore.save(slotConfigs, commands);
            synced = new StoredConfig(withoutBlank(slotConfigs), commands);
            syncedStamp = configStore.stamp().orElse(null);
            rewritePending = false;
        }
    }

    public KeyringCredentialCipher.KeyringStatus keyStatus() {
        return keyring().status();
    }

    /**
     * Adds a fresh active key and re-encrypts every stored server credential under it. Old keys
     * stay in the keyring so copies of the configuration written before the rotation still load.
     */
    public KeyRotationReport rotateCredentialKey() throws CryptoException {
        KeyringCredentialCipher keyring = keyring();
        KeyringCredentialCipher.RotationOutcome rotation = keyring.rotate();
        int reencrypted = 0;
        List<SlotConfig> next = new ArrayList<>();
        for (SlotConfig slot : slotConfigs()) {
            if (slot.credentialCiphertext().isBlank()) {
                next.add(slot);
                continue;
            }
            String plaintext = keyring.decrypt(slot.credentialCiphertext());
            next.add(new SlotConfig(slot.slot(), slot.host(), slot.port(), keyring.encrypt(plaintext)));
            reencrypted++;
        }
        synchronized (syncLock) {
            slotConfigs = List.copyOf(next);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("active_kid", rotation.activeKid());
        details.put("reencrypted", reencrypted);
        auditLogger.log(AuditLogger.AuditEvent.of("credentials.rotate", "keyring", "ok", details));
        return new KeyRotationReport(rotation.activeKid(), rotation.totalKeys(), reencrypted);
    }

    private KeyringCredentialCipher keyring() {
        if (cipher instanceof KeyringCredentialCipher keyring) {
            return keyring;
        }
        throw new IllegalStateException("credential cipher has no keyring: " + cipher.getClass().getSimpleName());
    }

    public RconCronConfig config() {
        return config;
    }

    public CredentialCipher cipher() {
        return cipher;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public ConfigStore configStore() {
        return configStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public record KeyRotationReport(String activeKid, int totalKeys, int reencryptedCredentials) {
    }
}
