package io.rconcron.dispatch;

import io.rconcron.connection.ConnectionPool;
import io.rconcron.connection.SlotOutcome;
import io.rconcron.observability.AuditLogger;
import io.rconcron.schedule.ScheduleEntry;
import io.rconcron.schedule.ScheduleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);
    private static final String THREAD_NAME = "rconcron-dispatcher";

    private final ScheduleTable table;
    private final ConnectionPool pool;
    private final Clock clock;
    private final Duration tickInterval;
    private final boolean recoverFailedSlots;
    private final AuditLogger auditLogger;
    private final Runnable beforeTick;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final Object tickLock = new Object();
    private volatile DispatcherState state = DispatcherState.IDLE;
    private volatile boolean stopRequested;
    private volatile Thread thread;

    public Dispatcher(
            ScheduleTable table,
            ConnectionPool pool,
            Clock clock,
            Duration tickInterval,
            boolean recoverFailedSlots,
            AuditLogger auditLogger
    ) {
        this(table, pool, clock, tickInterval, recoverFailedSlots, auditLogger, null);
    }

    /**
     * @param beforeTick run on the dispatcher thread ahead of every scheduled tick, e.g. to pick
     *                   up configuration written by another process; its failures are logged
     */
    public Dispatcher(
            ScheduleTable table,
            ConnectionPool pool,
            Clock clock,
            Duration tickInterval,
            boolean recoverFailedSlots,
            AuditLogger auditLogger,
            Runnable beforeTick
    ) {
        this.table = Objects.requireNonNull(table, "table");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        this.recoverFailedSlots = recoverFailedSlots;
        this.auditLogger = auditLogger;
        this.beforeTick = beforeTick;
    }

    public synchronized void start() {
        if (stopRequested) {
            throw new IllegalStateException("dispatcher was stopped and cannot be restarted");
        }
        if (thread != null) {
            throw new IllegalStateException("dispatcher already started");
        }
        thread = new Thread(this::runLoop, THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
        LOG.info("Dispatcher started, tick every {}s", tickInterval.toSeconds());
    }

    /**
     * Requests shutdown and waits up to {@code grace} for the current tick to finish. A tick
     * still running after the grace period is interrupted and abandoned.
     *
     * @return true when the loop ended within the grace period
     */
    public boolean stop(Duration grace) {
        Thread running;
        synchronized (this) {
            stopRequested = true;
            running = thread;
        }
        stopSignal.countDown();
        boolean clean = true;
        if (running != null && running != Thread.currentThread()) {
            try {
                running.join(Math.max(1L, grace.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (running.isAlive()) {
                clean = false;
                LOG.warn("Dispatcher did not finish its tick within {} ms; abandoning it", grace.toMillis());
                running.interrupt();
            }
        }
        state = DispatcherState.STOPPED;
        LOG.info("Dispatcher stopped");
        return clean;
    }

    public DispatcherState state() {
        return state;
    }

    public boolean isRunning() {
        Thread running = thread;
        return running != null && running.isAlive() && !stopRequested;
    }

    /**
     * Runs one scan-and-dispatch pass as of {@code now}. Due entries fire in insertion order;
     * each fired entry's next fire is recomputed from {@code now} regardless of the outcome.
     * Entries unscheduled before their turn are skipped; entries added during the pass wait for
     * the next tick.
     */
    public TickReport tick(Instant now) {
        synchronized (tickLock) {
            List<TickReport.FiredEntry> fired = new ArrayList<>();
            try {
                state = DispatcherState.SCANNING;
                if (recoverFailedSlots && !stopRequested) {
                    int recovered = pool.recoverFailed(() -> stopRequested);
                    if (recovered > 0) {
                        LOG.info("Recovered {} failed server connection(s)", recovered);
                    }
                }
                List<ScheduleEntry> due = table.dueEntries(now);
                LOG.debug("Tick at {}: {} due of {} scheduled", now, due.size(), table.size());
                if (!due.isEmpty()) {
                    state = DispatcherState.DISPATCHING;
                }
                for (int i = 0; i < due.size(); i++) {
                    ScheduleEntry entry = due.get(i);
                    if (stopRequested) {
                        LOG.info("Stop requested; leaving {} due command(s) for the next run", due.size() - i);
                        break;
                    }
                    if (table.find(entry.id()).isEmpty()) {
                        LOG.debug("Skipping '{}', unscheduled during this tick", entry.commandText());
                        continue;
                    }
                    fired.add(fire(entry, now));
                }
            } finally {
                state = stopRequested ? DispatcherState.STOPPED : DispatcherState.IDLE;
            }
            return new TickReport(now, fired);
        }
    }

    private TickReport.FiredEntry fire(ScheduleEntry entry, Instant now) {
        List<SlotOutcome> outcomes = List.of();
        Instant nextFire = null;
        try {
            outcomes = pool.broadcast(entry.commandText(), () -> stopRequested);
        } catch (RuntimeException e) {
            LOG.error("Error processing scheduled command '{}': {}", entry.commandText(), e.getMessage(), e);
        } finally {
            nextFire = table.advance(entry.id(), now).orElse(null);
        }
        TickReport.FiredEntry result = new TickReport.FiredEntry(entry.id(), entry.commandText(), outcomes, nextFire);
        long succeeded = result.count(SlotOutcome.Status.SUCCESS);
        long failed = result.count(SlotOutcome.Status.FAILED);
        if (succeeded > 0) {
            LOG.info("Command '{}' executed on {} server(s); next run {}", entry.commandText(), succeeded, nextFire);
        } else {
            LOG.warn("Command '{}' reached no server ({} failed, {} skipped); next run {}",
                    entry.commandText(), failed, result.count(SlotOutcome.Status.SKIPPED), nextFire);
        }
        audit(entry, result);
        return result;
    }

    private void audit(ScheduleEntry entry, TickReport.FiredEntry result) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("command", entry.commandText());
        details.put("schedule", entry.label());
        details.put("succeeded", result.count(SlotOutcome.Status.SUCCESS));
        details.put("failed", result.count(SlotOutcome.Status.FAILED));
        details.put("skipped", result.count(SlotOutcome.Status.SKIPPED));
        details.put("next_fire", result.nextFire() == null ? null : result.nextFire().toString());
        String outcome = result.count(SlotOutcome.Status.SUCCESS) > 0 ? "success" : "no_delivery";
        auditLogger.log(AuditLogger.AuditEvent.of("schedule.fire", entry.id(), outcome, details));
    }

    private void runBeforeTick() {
        if (beforeTick == null) {
            return;
        }
        try {
            beforeTick.run();
        } catch (RuntimeException e) {
            LOG.warn("Pre-tick refresh failed, dispatching the current schedule: {}", e.getMessage(), e);
        }
    }

    private void runLoop() {
        try {
            while (!stopRequested) {
                runBeforeTick();
                try {
                    tick(clock.instant());
                } catch (RuntimeException e) {
                    LOG.error("Dispatcher tick failed: {}", e.getMessage(), e);
                }
                if (stopSignal.await(tickInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = DispatcherState.STOPPED;
        }
    }
}
