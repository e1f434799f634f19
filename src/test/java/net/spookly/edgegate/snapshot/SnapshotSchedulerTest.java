package net.spookly.edgegate.snapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import net.spookly.edgegate.environment.Environment;
import net.spookly.edgegate.environment.EnvironmentKind;
import net.spookly.edgegate.environment.EnvironmentService;
import net.spookly.edgegate.environment.EnvironmentStatus;
import net.spookly.edgegate.environment.InMemoryEnvironmentStore;
import net.spookly.edgegate.error.EnvironmentUnreachableException;
import net.spookly.edgegate.tunnel.TunnelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotSchedulerTest {
    private final Map<String, Supplier<CompletableFuture<Boolean>>> outcomes = new ConcurrentHashMap<>();
    private EnvironmentService environments;
    private SnapshotScheduler scheduler;

    @BeforeEach
    void setUp() {
        environments = new EnvironmentService(new InMemoryEnvironmentStore(), Clock.systemUTC());
        environments.save(Environment.builder().id("local").kind(EnvironmentKind.DOCKER_HTTP).url("tcp://127.0.0.1:2375").build());
        EnvironmentProbe probe = (environment, timeoutMs) ->
                outcomes.getOrDefault(environment.id(), () -> CompletableFuture.completedFuture(true)).get();
        scheduler = new SnapshotScheduler(SnapshotSettings.builder()
                .intervalSeconds(0)
                .probeTimeoutMs(200)
                .workers(2)
                .failureThreshold(3)
                .build(), environments, new TunnelStore(), probe, Clock.systemUTC());
        environments.addListener(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void successfulProbeMarksUp() throws Exception {
        round();

        assertEquals(EnvironmentStatus.UP, environments.require("local").status());
        assertNotNull(environments.require("local").lastProbeAt());
        EnvironmentSnapshot snapshot = scheduler.lastSnapshot("local").orElseThrow();
        assertTrue(snapshot.success());
        assertEquals(0, snapshot.consecutiveFailures());
    }

    @Test
    void failuresBelowThresholdKeepStatus() throws Exception {
        round();
        failing("local");

        round();
        round();
        assertEquals(EnvironmentStatus.UP, environments.require("local").status());
        assertEquals(2, scheduler.lastSnapshot("local").orElseThrow().consecutiveFailures());

        round();
        assertEquals(EnvironmentStatus.DOWN, environments.require("local").status());
    }

    @Test
    void successResetsFailureStreak() throws Exception {
        failing("local");
        round();
        round();
        outcomes.remove("local");
        round();
        failing("local");
        round();
        round();

        assertEquals(EnvironmentStatus.UP, environments.require("local").status());
        assertEquals(2, scheduler.lastSnapshot("local").orElseThrow().consecutiveFailures());
    }

    @Test
    void badAnswerCountsAsFailure() throws Exception {
        outcomes.put("local", () -> CompletableFuture.completedFuture(false));

        round();

        EnvironmentSnapshot snapshot = scheduler.lastSnapshot("local").orElseThrow();
        assertFalse(snapshot.success());
        assertEquals("unexpected response", snapshot.detail());
    }

    @Test
    void edgeEnvironmentWithoutTunnelStillWaitsForThreshold() throws Exception {
        saveEdgeEnvironment();
        environments.updateStatus("edge-1", EnvironmentStatus.UP, "tunnel established");
        failing("edge-1");

        round();
        assertEquals(EnvironmentStatus.UP, environments.require("edge-1").status());
        assertTrue(scheduler.lastSnapshot("edge-1").orElseThrow().detail().startsWith("no active tunnel"));

        round();
        round();
        assertEquals(EnvironmentStatus.DOWN, environments.require("edge-1").status());
        assertEquals(EnvironmentStatus.UP, environments.require("local").status());
    }

    @Test
    void failedProbeDoesNotOverrideStatusChangedWhileRunning() throws Exception {
        saveEdgeEnvironment();
        environments.updateStatus("edge-1", EnvironmentStatus.UP, "tunnel established");
        failing("edge-1");
        round();
        round();

        outcomes.put("edge-1", () -> {
            environments.updateStatus("edge-1", EnvironmentStatus.DOWN, "heartbeat lost");
            environments.updateStatus("edge-1", EnvironmentStatus.UP, "tunnel established");
            return CompletableFuture.failedFuture(new EnvironmentUnreachableException("connection refused"));
        });
        round();

        assertEquals(3, scheduler.lastSnapshot("edge-1").orElseThrow().consecutiveFailures());
        assertEquals(EnvironmentStatus.UP, environments.require("edge-1").status());

        failing("edge-1");
        round();
        assertEquals(EnvironmentStatus.DOWN, environments.require("edge-1").status());
    }

    @Test
    void hangingProbeTimesOut() throws Exception {
        outcomes.put("local", CompletableFuture::new);

        round();

        EnvironmentSnapshot snapshot = scheduler.lastSnapshot("local").orElseThrow();
        assertFalse(snapshot.success());
        assertTrue(snapshot.detail().startsWith("timed out"));
    }

    @Test
    void environmentStillBeingProbedIsSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CompletableFuture<Boolean> pending = new CompletableFuture<>();
        outcomes.put("local", () -> {
            entered.countDown();
            return pending;
        });

        List<CompletableFuture<Void>> first = scheduler.runOnce();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        List<CompletableFuture<Void>> second = scheduler.runOnce();

        assertEquals(1, first.size());
        assertTrue(second.isEmpty());
        pending.complete(true);
        CompletableFuture.allOf(first.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
    }

    @Test
    void deletedEnvironmentLosesSnapshot() throws Exception {
        round();

        environments.delete("local");

        assertTrue(scheduler.lastSnapshot("local").isEmpty());
    }

    private void saveEdgeEnvironment() {
        environments.save(Environment.builder()
                .id("edge-1")
                .kind(EnvironmentKind.DOCKER_EDGE)
                .edgeKey("0123456789abcdef0123456789abcdef")
                .build());
    }

    private void failing(String environmentId) {
        outcomes.put(environmentId, () -> CompletableFuture.failedFuture(
                new EnvironmentUnreachableException("connection refused")));
    }

    private void round() throws Exception {
        CompletableFuture.allOf(scheduler.runOnce().toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
    }
}
