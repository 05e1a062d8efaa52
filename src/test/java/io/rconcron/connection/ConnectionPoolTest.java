package io.rconcron.connection;

import io.rconcron.model.SlotView;
import io.rconcron.testing.FakeRconServers;
import io.rconcron.testing.PrefixCredentialCipher;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class ConnectionPoolTest {

    @Test
    void broadcastWithNothingConnectedSkipsEverySlot() {
        FakeRconServers servers = new FakeRconServers();
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "down-a"), slot(1, "down-b")));

        List<SlotOutcome> outcomes = pool.broadcast("say hi");

        Assertions.assertEquals(2, outcomes.size());
        Assertions.assertTrue(outcomes.stream().allMatch(o -> o.status() == SlotOutcome.Status.SKIPPED));
        Assertions.assertTrue(servers.received().isEmpty());
    }

    @Test
    void oneFailingSlotDoesNotStopTheOthers() {
        FakeRconServers servers = new FakeRconServers()
                .accept("a", "pw")
                .accept("b", "pw")
                .accept("c", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a"), slot(1, "b"), slot(2, "c")));
        servers.set("b", FakeRconServers.Behavior.FAIL_COMMANDS);

        List<SlotOutcome> outcomes = pool.broadcast("save-all");

        Assertions.assertEquals(SlotOutcome.Status.SUCCESS, outcomes.get(0).status());
        Assertions.assertEquals(SlotOutcome.Status.FAILED, outcomes.get(1).status());
        Assertions.assertEquals(SlotOutcome.Status.SUCCESS, outcomes.get(2).status());
        Assertions.assertEquals("ok save-all", outcomes.get(2).response());
        Assertions.assertEquals(List.of("a:save-all", "c:save-all"), servers.received());
        Assertions.assertEquals(ConnectionState.FAILED.name(), pool.states().get(1).state());
        Assertions.assertEquals(2, pool.connectedCount());
    }

    @Test
    void broadcastSendsInSlotOrderRegardlessOfConfigurationOrder() {
        FakeRconServers servers = new FakeRconServers().accept("low", "pw").accept("high", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(5, "high"), slot(1, "low")));

        pool.broadcast("list");

        Assertions.assertEquals(List.of("low:list", "high:list"), servers.received());
    }

    @Test
    void reconnectFailureBeforeSendIsReportedAsFailed() {
        FakeRconServers servers = new FakeRconServers().accept("a", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a")));
        servers.set("a", FakeRconServers.Behavior.REFUSE);

        SlotOutcome outcome = pool.broadcast("say hi").get(0);

        Assertions.assertEquals(SlotOutcome.Status.FAILED, outcome.status());
        Assertions.assertTrue(outcome.reason().startsWith("cannot reach a:25575"), outcome.reason());
    }

    @Test
    void cancellationSkipsRemainingSlots() {
        FakeRconServers servers = new FakeRconServers().accept("a", "pw").accept("b", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a"), slot(1, "b")));
        AtomicInteger checks = new AtomicInteger();

        List<SlotOutcome> outcomes = pool.broadcast("say hi", () -> checks.incrementAndGet() > 1);

        Assertions.assertEquals(SlotOutcome.Status.SUCCESS, outcomes.get(0).status());
        Assertions.assertEquals(SlotOutcome.Status.SKIPPED, outcomes.get(1).status());
        Assertions.assertEquals("dispatch cancelled", outcomes.get(1).reason());
    }

    @Test
    void configureKeepsUnchangedConnectionsAndReplacesChangedOnes() {
        FakeRconServers servers = new FakeRconServers().accept("a", "pw").accept("b", "pw").accept("b2", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a"), slot(1, "b")));
        Assertions.assertEquals(2, servers.opens());

        List<SlotView> states = pool.configure(List.of(slot(0, "a"), slot(1, "b2")));

        Assertions.assertEquals(3, servers.opens());
        Assertions.assertEquals("b2", states.get(1).host());
        Assertions.assertEquals(2, pool.connectedCount());
    }

    @Test
    void incompleteSlotsAreListedAsNotConfigured() {
        ConnectionPool pool = pool(new FakeRconServers().accept("a", "pw"));
        List<SlotView> states = pool.configure(List.of(
                slot(0, "a"),
                new SlotConfig(1, "b", "", "enc:pw"),
                new SlotConfig(2, "", "", "")
        ));

        Assertions.assertEquals(3, states.size());
        Assertions.assertEquals("CONNECTED", states.get(0).state());
        Assertions.assertEquals(ConnectionPool.NOT_CONFIGURED, states.get(1).state());
        Assertions.assertEquals(ConnectionPool.NOT_CONFIGURED, states.get(2).state());
        Assertions.assertEquals(1, pool.broadcast("say hi").size());
    }

    @Test
    void duplicateSlotsAreRejected() {
        ConnectionPool pool = pool(new FakeRconServers());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> pool.configure(List.of(slot(0, "a"), slot(0, "b"))));
    }

    @Test
    void recoverFailedReconnectsOnlyFailedSlots() {
        FakeRconServers servers = new FakeRconServers().accept("a", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a"), slot(1, "b")));
        Assertions.assertEquals(1, pool.connectedCount());
        int opensBefore = servers.opens();
        servers.accept("b", "pw");

        Assertions.assertEquals(1, pool.recoverFailed());
        Assertions.assertEquals(opensBefore + 1, servers.opens());
        Assertions.assertEquals(2, pool.connectedCount());
    }

    @Test
    void recoveryMakesOneImmediateAttemptPerSlotWhateverTheRetryBudget() {
        FakeRconServers servers = new FakeRconServers();
        ConnectionPool pool = new ConnectionPool(new PrefixCredentialCipher(), servers, 3, Duration.ofSeconds(5));
        pool.configure(List.of(slot(0, "a"), slot(1, "b"), slot(2, "c")));
        int opensBefore = servers.opens();

        long started = System.nanoTime();
        Assertions.assertEquals(0, pool.recoverFailed());

        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(2)) < 0);
        Assertions.assertEquals(opensBefore + 3, servers.opens());
    }

    @Test
    void recoveryStopsAtTheFirstCancelledSlot() {
        FakeRconServers servers = new FakeRconServers();
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a"), slot(1, "b"), slot(2, "c")));
        int opensBefore = servers.opens();
        AtomicInteger checks = new AtomicInteger();

        pool.recoverFailed(() -> checks.incrementAndGet() > 1);

        Assertions.assertEquals(opensBefore + 1, servers.opens());
    }

    @Test
    void reconnectAllRefreshesEveryConfiguredSlot() {
        FakeRconServers servers = new FakeRconServers().accept("a", "pw");
        ConnectionPool pool = pool(servers);
        pool.configure(List.of(slot(0, "a"), slot(1, "b")));
        servers.accept("b", "pw");

        List<SlotView> states = pool.reconnectAll();

        Assertions.assertEquals("CONNECTED", states.get(0).state());
        Assertions.assertEquals("CONNECTED", states.get(1).state());
        Assertions.assertEquals(4, servers.opens());
    }

    @Test
    void disconnectAllLeavesEverySlotDisconnected() {
        ConnectionPool pool = pool(new FakeRconServers().accept("a", "pw"));
        pool.configure(List.of(slot(0, "a")));
        pool.disconnectAll();
        Assertions.assertEquals("DISCONNECTED", pool.states().get(0).state());
        Assertions.assertEquals(SlotOutcome.Status.SKIPPED, pool.broadcast("say hi").get(0).status());
    }

    private static ConnectionPool pool(FakeRconServers servers) {
        return new ConnectionPool(new PrefixCredentialCipher(), servers, 1, Duration.ZERO);
    }

    private static SlotConfig slot(int index, String host) {
        return new SlotConfig(index, host, "25575", "enc:pw");
    }
}
