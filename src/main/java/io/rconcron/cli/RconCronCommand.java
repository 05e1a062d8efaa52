package io.rconcron.cli;

import io.rconcron.config.RconCronConfig;
import io.rconcron.connection.SlotConfig;
import io.rconcron.connection.SlotOutcome;
import io.rconcron.model.EntryView;
import io.rconcron.model.SlotView;
import io.rconcron.runtime.RconCronContext;
import io.rconcron.schedule.RecurrenceRule;
import io.rconcron.security.CryptoException;
import io.rconcron.security.SensitiveDataMasker;
import io.rconcron.storage.ConfigStoreException;
import io.rconcron.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "rconcron",
        mixinStandardHelpOptions = true,
        description = "Scheduled RCON command dispatcher",
        subcommands = {
                RconCronCommand.RunCommand.class,
                RconCronCommand.ServerSetCommand.class,
                RconCronCommand.ServerRemoveCommand.class,
                RconCronCommand.ServersCommand.class,
                RconCronCommand.ScheduleCommand.class,
                RconCronCommand.UnscheduleCommand.class,
                RconCronCommand.SchedulesCommand.class,
                RconCronCommand.PreviewCommand.class,
                RconCronCommand.SendCommand.class,
                RconCronCommand.CheckCommand.class,
                RconCronCommand.KeyStatusCommand.class,
                RconCronCommand.KeyRotateCommand.class,
                RconCronCommand.AuditTailCommand.class
        }
)
public final class RconCronCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = RconCronConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | server-set | server-remove | servers | schedule | unschedule | schedules | preview | send | check | key-status | key-rotate | audit-tail");
    }

    /**
     * Command line with the error mapping used by {@code main}: rule, credential and
     * configuration errors print {@code {"error": ...}} and exit with 1.
     */
    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new RconCronCommand());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof IllegalArgumentException
                    || ex instanceof IllegalStateException
                    || ex instanceof CryptoException
                    || ex instanceof ConfigStoreException) {
                return error(ex.getMessage());
            }
            throw ex;
        });
        return commandLine;
    }

    RconCronConfig config() {
        return RconCronConfig.fromRoot(root);
    }

    RconCronContext context() {
        return RconCronContext.open(config());
    }

    static int error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message == null ? "unknown error" : message);
        System.out.println(Jsons.toJson(out));
        return 1;
    }

    static Map<String, Object> describeSlot(SlotConfig slot) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("slot", slot.slot());
        out.put("address", slot.host());
        out.put("port", slot.port());
        out.put("password", SensitiveDataMasker.maskCredential(slot.credentialCiphertext()));
        return out;
    }

    @Command(name = "run", description = "Connect configured servers and dispatch scheduled commands until shutdown")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Option(names = {"--tick-seconds"}, description = "Seconds between schedule scans")
        Long tickSeconds;

        @Option(names = {"--retry-limit"}, description = "Reconnect attempts before a slot is marked failed")
        Integer retryLimit;

        @Option(names = {"--retry-delay-seconds"}, description = "Seconds to wait before each reconnect attempt")
        Long retryDelaySeconds;

        @Option(names = {"--no-recover"}, description = "Do not retry failed slots at the start of each tick")
        boolean noRecover;

        @Option(names = {"--duration-seconds"}, defaultValue = "0", description = "Stop after this many seconds; 0 runs until interrupted")
        long durationSeconds;

        @Override
        public Integer call() throws Exception {
            RconCronConfig config = parent.config();
            if (tickSeconds != null) {
                config = config.withTickInterval(Duration.ofSeconds(tickSeconds));
            }
            if (retryLimit != null || retryDelaySeconds != null) {
                config = config.withRetry(
                        retryLimit == null ? config.retryLimit() : retryLimit,
                        retryDelaySeconds == null ? config.retryDelay() : Duration.ofSeconds(retryDelaySeconds)
                );
            }
            if (noRecover) {
                config = config.withRecoverFailedSlots(false);
            }
            RconCronContext context = RconCronContext.open(config);
            List<SlotView> slots = context.loadConfiguration();
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("status", "Connected to " + context.connectedCount() + " server(s)");
            summary.put("slots", slots);
            summary.put("schedules", context.entries());
            System.out.println(Jsons.toJson(summary));

            Thread hook = new Thread(context::shutdown, "rconcron-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            context.start();
            if (durationSeconds <= 0) {
                Thread.currentThread().join();
                return 0;
            }
            Thread.sleep(Duration.ofSeconds(durationSeconds).toMillis());
            Runtime.getRuntime().removeShutdownHook(hook);
            context.shutdown();
            return 0;
        }
    }

    @Command(name = "server-set", description = "Store the address and encrypted password of one server slot")
    static final class ServerSetCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Option(names = {"--slot"}, required = true, description = "Slot index 0-8")
        int slot;

        @Option(names = {"--address"}, required = true, description = "Server host name or IP")
        String address;

        @Option(names = {"--port"}, defaultValue = "" + RconCronConfig.DEFAULT_RCON_PORT, description = "RCON port")
        String port;

        @Option(names = {"--password"}, arity = "0..1", interactive = true, description = "RCON password; prompts when given without a value")
        String password;

        @Option(names = {"--password-env"}, description = "Environment variable holding the RCON password")
        String passwordEnv;

        @Override
        public Integer call() throws CryptoException {
            if (slot < 0 || slot >= RconCronConfig.MAX_SLOTS) {
                return error("slot must be between 0 and " + (RconCronConfig.MAX_SLOTS - 1) + ": " + slot);
            }
            String secret = password;
            if (passwordEnv != null) {
                secret = System.getenv(passwordEnv);
                if (secret == null) {
                    return error("environment variable not set: " + passwordEnv);
                }
            }
            if (secret == null || secret.isEmpty()) {
                return error("a password is required (--password or --password-env)");
            }
            RconCronContext context = parent.context();
            context.load();
            SlotConfig config = new SlotConfig(slot, address, port, context.cipher().encrypt(secret));
            context.putSlot(config);
            context.save();
            System.out.println(Jsons.toJson(describeSlot(config)));
            return 0;
        }
    }

    @Command(name = "server-remove", description = "Remove one server slot")
    static final class ServerRemoveCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Option(names = {"--slot"}, required = true, description = "Slot index")
        int slot;

        @Override
        public Integer call() {
            RconCronContext context = parent.context();
            context.load();
            if (!context.removeSlot(slot)) {
                return error("slot not configured: " + slot);
            }
            context.save();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("removed", slot);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "servers", description = "List configured server slots")
    static final class ServersCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Override
        public Integer call() {
            RconCronContext context = parent.context();
            context.load();
            List<Map<String, Object>> out = new ArrayList<>();
            for (SlotConfig slot : context.slotConfigs()) {
                out.add(describeSlot(slot));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "schedule", description = "Add a scheduled command")
    static final class ScheduleCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Option(names = {"--command"}, required = true, description = "Console command to send, without the leading slash")
        String command;

        @Mixin
        RuleOptions rule;

        @Override
        public Integer call() {
            RecurrenceRule parsed = rule.toRule();
            RconCronContext context = parent.context();
            context.load();
            String id = context.schedule(command, parsed);
            context.save();
            EntryView added = context.entries().stream()
                    .filter(entry -> entry.id().equals(id))
                    .findFirst()
                    .orElseThrow();
            System.out.println(Jsons.toJson(added));
            return 0;
        }
    }

    @Command(name = "unschedule", description = "Remove a scheduled command by id")
    static final class UnscheduleCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Parameters(index = "0", description = "Schedule id as listed by 'schedules'")
        String entryId;

        @Override
        public Integer call() {
            RconCronContext context = parent.context();
            context.load();
            if (!context.unschedule(entryId)) {
                return error("schedule not found: " + entryId);
            }
            context.save();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("removed", entryId);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "schedules", description = "List scheduled commands with their next run")
    static final class SchedulesCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Override
        public Integer call() {
            RconCronContext context = parent.context();
            context.load();
            System.out.println(Jsons.toJson(context.entries()));
            return 0;
        }
    }

    @Command(name = "preview", description = "Show the next run times of a cadence")
    static final class PreviewCommand implements Callable<Integer> {
        @Mixin
        RuleOptions rule;

        @Option(names = {"--count"}, defaultValue = "5", description = "Number of run times")
        int count;

        @Option(names = {"--after"}, description = "ISO-8601 instant to start from (default now)")
        String after;

        @Override
        public Integer call() {
            if (count < 1) {
                return error("--count must be at least 1");
            }
            RecurrenceRule parsed = rule.toRule();
            Instant from;
            try {
                from = after == null ? Instant.now() : Instant.parse(after);
            } catch (DateTimeParseException e) {
                return error("--after must be an ISO-8601 instant: " + after);
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("label", parsed.label());
            out.put("cron", parsed.toCron());
            out.put("next", parsed.nextFires(from, count));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "send", description = "Connect all servers and send one command now")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Option(names = {"--command"}, required = true, description = "Console command to send")
        String command;

        @Override
        public Integer call() {
            RconCronContext context = parent.context();
            context.loadConfiguration();
            try {
                List<SlotOutcome> outcomes = context.broadcastNow(command);
                System.out.println(Jsons.toJson(outcomes));
                return outcomes.stream().anyMatch(o -> o.status() == SlotOutcome.Status.SUCCESS) ? 0 : 1;
            } finally {
                context.disconnectAll();
            }
        }
    }

    @Command(name = "check", description = "Connect all servers and report each slot's state")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Override
        public Integer call() {
            RconCronContext context = parent.context();
            try {
                List<SlotView> slots = context.loadConfiguration();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("status", "Connected to " + context.connectedCount() + " server(s)");
                out.put("slots", slots);
                System.out.println(Jsons.toJson(out));
                return 0;
            } finally {
                context.disconnectAll();
            }
        }
    }

    @Command(name = "key-status", description = "Show credential keyring status")
    static final class KeyStatusCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.context().keyStatus()));
            return 0;
        }
    }

    @Command(name = "key-rotate", description = "Rotate the credential key and re-encrypt stored passwords")
    static final class KeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Override
        public Integer call() throws CryptoException {
            RconCronContext context = parent.context();
            context.load();
            RconCronContext.KeyRotationReport report = context.rotateCredentialKey();
            context.save();
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        RconCronCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of latest lines")
        int limit;

        @Override
        public Integer call() throws Exception {
            for (String row : parent.context().auditLogger().tail(limit)) {
                System.out.println(row);
            }
            return 0;
        }
    }
}
