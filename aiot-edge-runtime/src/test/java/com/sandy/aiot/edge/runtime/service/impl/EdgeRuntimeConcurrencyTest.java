package com.sandy.aiot.edge.runtime.service.impl;

import com.sandy.aiot.edge.runtime.RecordingSchemeSwitcher;
import com.sandy.aiot.edge.runtime.ScriptedTelemetryCollector;
import com.sandy.aiot.edge.runtime.entity.Alert;
import com.sandy.aiot.edge.runtime.entity.RuntimeEvent;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.service.AlertEngine;
import com.sandy.aiot.edge.runtime.service.DecisionBridge;
import com.sandy.aiot.edge.runtime.service.DigitalTwinSimulator;
import com.sandy.aiot.edge.runtime.service.HealthScorer;
import com.sandy.aiot.edge.runtime.service.LoadForecastService;
import com.sandy.aiot.edge.runtime.service.OptimizationService;
import com.sandy.aiot.edge.runtime.service.PowerProfileController;
import com.sandy.aiot.edge.runtime.service.ScenarioInjector;
import com.sandy.aiot.edge.runtime.service.TelemetrySourceService;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import com.sandy.aiot.edge.runtime.vo.RuntimePayloadVO;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scan loop under concurrent scans, readers and control calls, wired by hand so a cycle can be
 * paused between evaluation and commit.
 */
class EdgeRuntimeConcurrencyTest {

    private final Clock clock = Clock.systemDefaultZone();
    private final ScriptedTelemetryCollector collector = new ScriptedTelemetryCollector();
    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private EdgeRuntimeService runtime(AlertEngine alertEngine) {
        OptimizationService optimization = new OptimizationService(10, 100, 50, 0.12, 0.5, 0.3, clock);
        OptimizationDecisionEngine decisionEngine = new OptimizationDecisionEngine(new LoadForecastService(6), optimization, clock);
        TelemetrySourceService source = new TelemetrySourceService(collector,
                new DigitalTwinSimulator(new Random(42), clock), clock);
        return new EdgeRuntimeService(source, new ScenarioInjector(), new DecisionBridge(decisionEngine, clock),
                new HealthScorer(), alertEngine, new PowerProfileController(new RecordingSchemeSwitcher(), true, 120),
                optimization, clock, false, 5000, 720, 500, 200);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            assertTrue(System.currentTimeMillis() < deadline, "condition not reached in time");
            Thread.sleep(5);
        }
    }

    private static void assertIdsIncrease(List<RuntimeEvent> events, List<Alert> alerts) {
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).getId() > events.get(i - 1).getId(),
                    "event id " + events.get(i).getId() + " committed after " + events.get(i - 1).getId());
        }
        for (int i = 1; i < alerts.size(); i++) {
            assertTrue(alerts.get(i).getId() > alerts.get(i - 1).getId());
        }
    }

    @Test
    void controlCallDuringAScanKeepsIdsInCommitOrder() throws Exception {
        CountDownLatch evaluated = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean pauseOnce = new AtomicBoolean(true);
        AlertEngine pausing = new AlertEngine() {
            @Override
            public Findings evaluate(TelemetrySnapshot current, TelemetrySnapshot previous, double score, String timeLabel) {
                Findings findings = super.evaluate(current, previous, score, timeLabel);
                if (pauseOnce.compareAndSet(true, false)) {
                    evaluated.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return findings;
            }
        };
        EdgeRuntimeService runtime = runtime(pausing);
        collector.enqueueCpu(95.0);

        Future<?> scan = pool.submit(runtime::scanNow);
        assertTrue(evaluated.await(10, TimeUnit.SECONDS));
        Future<?> modeChange = pool.submit(() -> runtime.setMode("HYBRID"));
        await(() -> runtime.latestPayload(0, 500, 0).getEvents().stream()
                .anyMatch(e -> e.getMessage().equals("runtime_mode_changed HYBRID")));
        release.countDown();
        scan.get(10, TimeUnit.SECONDS);
        modeChange.get(10, TimeUnit.SECONDS);

        RuntimePayloadVO payload = runtime.latestPayload(10, 500, 200);
        List<RuntimeEvent> events = payload.getEvents();
        assertEquals("runtime_mode_changed HYBRID", events.get(0).getMessage());
        assertTrue(events.get(1).getMessage().startsWith("scan_complete mode=LIVE_EDGE"));
        assertEquals(2, payload.getHistory().size());
        assertEquals(1, payload.getAlerts().size());
        assertIdsIncrease(events, payload.getAlerts());
    }

    @Test
    void scheduledAndManualScansNeverOverlap() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AlertEngine counting = new AlertEngine() {
            @Override
            public Findings evaluate(TelemetrySnapshot current, TelemetrySnapshot previous, double score, String timeLabel) {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(1);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                active.decrementAndGet();
                return super.evaluate(current, previous, score, timeLabel);
            }
        };
        EdgeRuntimeService runtime = runtime(counting);
        runtime.start();

        List<Future<?>> workers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            boolean scheduled = t % 2 == 0;
            workers.add(pool.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    if (scheduled) runtime.scheduledScan();
                    else runtime.scanNow();
                }
            }));
        }
        for (Future<?> w : workers) w.get(30, TimeUnit.SECONDS);

        assertEquals(1, maxActive.get());
        RuntimePayloadVO payload = runtime.latestPayload(1000, 500, 200);
        assertEquals(200, payload.getHistory().size());
        assertNull(runtime.healthStatus().getLastScanError());
        assertIdsIncrease(payload.getEvents(), payload.getAlerts());
    }

    @Test
    void readersNeverSeeAHalfCommittedCycle() throws Exception {
        EdgeRuntimeService runtime = runtime(new AlertEngine());
        double[] cpu = new double[300];
        for (int i = 0; i < cpu.length; i++) cpu[i] = 10.0 + i * 0.25;
        collector.enqueueCpu(cpu);

        AtomicBoolean done = new AtomicBoolean();
        List<String> violations = Collections.synchronizedList(new ArrayList<>());

        Future<?> reader = pool.submit(() -> {
            while (!done.get()) {
                RuntimePayloadVO p = runtime.latestPayload(1, 1, 1);
                if (p.getTelemetry() == null) continue;
                double latestCpu = p.getTelemetry().getCpuPercent();
                if (p.getHistory().size() != 1 || p.getHistory().get(0).getEnergy() != MetricMath.round2(latestCpu)) {
                    violations.add("history does not match telemetry cpu=" + latestCpu);
                }
                if (p.getRuntimeHealth().size() != 5
                        || p.getRuntimeHealth().get(0).getValue() != MetricMath.round2(100.0 - latestCpu)) {
                    violations.add("health does not match telemetry cpu=" + latestCpu);
                }
            }
        });
        Future<?> controls = pool.submit(() -> {
            for (int i = 0; i < 20; i++) {
                runtime.setScenario("low_load", 1);
                runtime.setMode("LIVE_EDGE");
                runtime.setAutoApply(i % 2 == 0);
            }
        });
        Future<?> scanner = pool.submit(() -> {
            for (int i = 0; i < 300; i++) runtime.scanNow();
        });

        scanner.get(30, TimeUnit.SECONDS);
        controls.get(30, TimeUnit.SECONDS);
        done.set(true);
        reader.get(10, TimeUnit.SECONDS);

        assertTrue(violations.isEmpty(), () -> violations.get(0));
        RuntimePayloadVO payload = runtime.latestPayload(1000, 1000, 1000);
        assertEquals(340, payload.getHistory().size());
        assertTrue(payload.getEvents().size() <= 500);
        assertIdsIncrease(payload.getEvents(), payload.getAlerts());
    }
}
