package com.sandy.aiot.edge.runtime.service.impl;

import com.sandy.aiot.edge.runtime.entity.Alert;
import com.sandy.aiot.edge.runtime.entity.Decision;
import com.sandy.aiot.edge.runtime.entity.DecisionInput;
import com.sandy.aiot.edge.runtime.entity.EventType;
import com.sandy.aiot.edge.runtime.entity.HistoryRecord;
import com.sandy.aiot.edge.runtime.entity.PowerProfile;
import com.sandy.aiot.edge.runtime.entity.RuntimeEvent;
import com.sandy.aiot.edge.runtime.entity.RuntimeHealthMetric;
import com.sandy.aiot.edge.runtime.entity.RuntimeMode;
import com.sandy.aiot.edge.runtime.entity.Scenario;
import com.sandy.aiot.edge.runtime.entity.ScenarioState;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.service.AlertEngine;
import com.sandy.aiot.edge.runtime.service.DecisionBridge;
import com.sandy.aiot.edge.runtime.service.HealthScorer;
import com.sandy.aiot.edge.runtime.service.OptimizationService;
import com.sandy.aiot.edge.runtime.service.PowerProfileController;
import com.sandy.aiot.edge.runtime.service.ScenarioInjector;
import com.sandy.aiot.edge.runtime.service.TelemetryCollectionException;
import com.sandy.aiot.edge.runtime.service.TelemetrySourceService;
import com.sandy.aiot.edge.runtime.tools.BoundedRingBuffer;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import com.sandy.aiot.edge.runtime.vo.PowerActionVO;
import com.sandy.aiot.edge.runtime.vo.RuntimePayloadVO;
import com.sandy.aiot.edge.runtime.vo.ServiceHealthVO;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the runtime state and runs the telemetry scan loop.
 * <p>
 * {@code scanLock} serializes whole cycles, so a scheduled tick and a control-triggered rescan
 * never overlap. {@code stateLock} guards the buffers, latest results, mode and scenario; it is
 * held briefly and never across sensor queries or out-of-process calls. A cycle's snapshot,
 * decision, health metrics, history entry, events and alerts commit in one write section.
 */
@Service
@Slf4j
public class EdgeRuntimeService {

    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final TelemetrySourceService telemetrySourceService;
    private final ScenarioInjector scenarioInjector;
    private final DecisionBridge decisionBridge;
    private final HealthScorer healthScorer;
    private final AlertEngine alertEngine;
    private final PowerProfileController powerProfileController;
    private final OptimizationService optimizationService;
    private final Clock clock;

    private final boolean autoStart;
    private final long scanIntervalMs;

    private final ReentrantLock scanLock = new ReentrantLock();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final AtomicLong idSequence = new AtomicLong();
    private volatile boolean running;

    // guarded by stateLock
    private final BoundedRingBuffer<HistoryRecord> history;
    private final BoundedRingBuffer<RuntimeEvent> events;
    private final BoundedRingBuffer<Alert> alerts;
    private TelemetrySnapshot latestSnapshot;
    private TelemetrySnapshot previousSnapshot;
    private Decision latestDecision;
    private List<RuntimeHealthMetric> latestRuntimeHealth = List.of();
    private String lastScanError;
    private RuntimeMode runtimeMode = RuntimeMode.LIVE_EDGE;
    private ScenarioState scenarioState = ScenarioState.NORMAL;

    public EdgeRuntimeService(TelemetrySourceService telemetrySourceService,
                              ScenarioInjector scenarioInjector,
                              DecisionBridge decisionBridge,
                              HealthScorer healthScorer,
                              AlertEngine alertEngine,
                              PowerProfileController powerProfileController,
                              OptimizationService optimizationService,
                              Clock clock,
                              @Value("${runtime.auto-start:true}") boolean autoStart,
                              @Value("${runtime.scan-interval-ms:5000}") long scanIntervalMs,
                              @Value("${runtime.history-capacity:720}") int historyCapacity,
                              @Value("${runtime.event-capacity:500}") int eventCapacity,
                              @Value("${runtime.alert-capacity:200}") int alertCapacity) {
        this.telemetrySourceService = telemetrySourceService;
        this.scenarioInjector = scenarioInjector;
        this.decisionBridge = decisionBridge;
        this.healthScorer = healthScorer;
        this.alertEngine = alertEngine;
        this.powerProfileController = powerProfileController;
        this.optimizationService = optimizationService;
        this.clock = clock;
        this.autoStart = autoStart;
        this.scanIntervalMs = scanIntervalMs;
        this.history = new BoundedRingBuffer<>(historyCapacity);
        this.events = new BoundedRingBuffer<>(eventCapacity);
        this.alerts = new BoundedRingBuffer<>(alertCapacity);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) start();
    }

    public void start() {
        if (running) return;
        running = true;
        log.info("Edge runtime started: scanIntervalMs={} mode={}", scanIntervalMs, getRuntimeMode());
    }

    @PreDestroy
    public void stop() {
        if (!running) return;
        running = false;
        log.info("Edge runtime stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Scheduled(fixedDelayString = "${runtime.scan-interval-ms:5000}")
    public void scheduledScan() {
        if (!running) return;
        scanNow();
    }

    /**
     * Runs one full cycle on the caller's thread. Never throws; a failed cycle is recorded
     * as the last scan error.
     */
    public void scanNow() {
        scanLock.lock();
        try {
            scanIteration();
        } catch (Exception e) {
            log.error("Edge runtime scan iteration failed: {}", e.getMessage(), e);
            stateLock.writeLock().lock();
            try {
                lastScanError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            } finally {
                stateLock.writeLock().unlock();
            }
        } finally {
            scanLock.unlock();
        }
    }

    public void setMode(String mode) {
        RuntimeMode parsed = RuntimeMode.parse(mode);
        stateLock.writeLock().lock();
        try {
            runtimeMode = parsed;
            events.add(event(EventType.INFO, "runtime_mode_changed " + parsed, nowLabel()));
        } finally {
            stateLock.writeLock().unlock();
        }
        log.info("Runtime mode changed to {}", parsed);
        scanNow();
    }

    public void setScenario(String scenario, int cycles) {
        ScenarioState next = ScenarioState.of(Scenario.parse(scenario), cycles);
        stateLock.writeLock().lock();
        try {
            scenarioState = next;
            events.add(event(next.isNormal() ? EventType.INFO : EventType.WARN,
                    "scenario_set " + next.getScenario(), nowLabel()));
        } finally {
            stateLock.writeLock().unlock();
        }
        log.info("Scenario set to {} for {} cycle(s)", next.getScenario(), next.getCyclesLeft());
        scanNow();
    }

    public void setAutoApply(boolean enabled) {
        powerProfileController.setAutoApply(enabled);
        log.info("Power profile auto-apply {}", enabled ? "enabled" : "disabled");
    }

    public ServiceHealthVO healthStatus() {
        stateLock.readLock().lock();
        try {
            return buildServiceHealth();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public RuntimePayloadVO latestPayload(int historyLimit, int eventLimit, int alertLimit) {
        stateLock.readLock().lock();
        try {
            return RuntimePayloadVO.builder()
                    .status("ok")
                    .mode(runtimeMode)
                    .scenario(scenarioState.getScenario())
                    .timestamp(clock.instant())
                    .telemetry(latestSnapshot)
                    .decision(latestDecision)
                    .runtimeHealth(new ArrayList<>(latestRuntimeHealth))
                    .history(history.tail(historyLimit))
                    .events(events.tail(eventLimit))
                    .alerts(alerts.tail(alertLimit))
                    .serviceHealth(buildServiceHealth())
                    .build();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public RuntimeMode getRuntimeMode() {
        stateLock.readLock().lock();
        try {
            return runtimeMode;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public ScenarioState getScenarioState() {
        stateLock.readLock().lock();
        try {
            return scenarioState;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    private void scanIteration() {
        RuntimeMode mode;
        ScenarioState scenario;
        TelemetrySnapshot previous;
        stateLock.readLock().lock();
        try {
            mode = runtimeMode;
            scenario = scenarioState;
            previous = previousSnapshot;
        } finally {
            stateLock.readLock().unlock();
        }

        String collectionError = null;
        TelemetrySnapshot edge = null;
        if (mode != RuntimeMode.SIMULATION) {
            try {
                edge = telemetrySourceService.collectLive();
            } catch (TelemetryCollectionException e) {
                log.warn("Live telemetry exhausted all fallbacks, using minimal estimate: {}", e.getMessage());
                collectionError = e.getMessage();
                edge = telemetrySourceService.estimateMinimal();
            }
        }
        TelemetrySnapshot simulated = telemetrySourceService.collectSimulated();
        TelemetrySnapshot snapshot = switch (mode) {
            case SIMULATION -> simulated;
            case HYBRID -> telemetrySourceService.blend(edge, simulated);
            case LIVE_EDGE -> edge;
        };

        snapshot = scenarioInjector.apply(snapshot, scenario.getScenario());
        snapshot = snapshot.toBuilder().scanMode(mode).scenario(scenario.getScenario()).build();
        snapshot = snapshot.toBuilder().industrialMetrics(telemetrySourceService.industrialMetrics(snapshot)).build();

        DecisionInput decisionInput = decisionBridge.toDecisionInput(snapshot);
        Decision decision = decisionBridge.requestDecision(decisionInput);
        double score = healthScorer.optimizationScore(snapshot);
        PowerProfile profile = powerProfileController.pickProfile(snapshot);
        PowerActionVO powerAction = mode == RuntimeMode.SIMULATION
                ? PowerActionVO.notApplied(profile, PowerActionVO.SIMULATION_MODE)
                : powerProfileController.apply(profile);
        List<RuntimeHealthMetric> runtimeHealth = healthScorer.runtimeHealth(snapshot, decisionBridge.stabilityOf(decision));

        String timeLabel = LocalTime.ofInstant(snapshot.getTimestamp(), clock.getZone()).format(TIME_FMT);
        HistoryRecord record = HistoryRecord.builder()
                .timestamp(snapshot.getTimestamp())
                .time(timeLabel)
                .optimization(score)
                .energy(MetricMath.round2(snapshot.getCpuPercent()))
                .build();
        AlertEngine.Findings findings = alertEngine.evaluate(snapshot, previous, score, timeLabel);
        RuntimeEvent powerEvent = powerProfileController.toEvent(profile, powerAction, timeLabel);

        stateLock.writeLock().lock();
        try {
            // ids are drawn here so they follow commit order even when a control call interleaves
            for (RuntimeEvent e : findings.events()) {
                events.add(numbered(e));
            }
            events.add(numbered(powerEvent));
            // a scenario set while this cycle ran is left untouched
            if (!scenario.isNormal() && scenarioState == scenario) {
                scenarioState = scenario.advance();
                if (scenarioState.isNormal()) {
                    events.add(event(EventType.INFO, "scenario_completed normal", timeLabel));
                    log.info("Scenario {} completed, reverted to normal", scenario.getScenario());
                }
            }
            for (Alert a : findings.alerts()) {
                alerts.add(a.toBuilder().id(idSequence.incrementAndGet()).build());
            }
            history.add(record);
            latestSnapshot = snapshot;
            latestDecision = decision;
            latestRuntimeHealth = runtimeHealth;
            lastScanError = collectionError;
            previousSnapshot = snapshot;
        } finally {
            stateLock.writeLock().unlock();
        }
        log.debug("Scan complete mode={} scenario={} cpu={} score={} profile={} applied={}",
                mode, scenario.getScenario(), snapshot.getCpuPercent(), score, profile, powerAction.isApplied());
    }

    private ServiceHealthVO buildServiceHealth() {
        return ServiceHealthVO.builder()
                .running(running)
                .scanIntervalSeconds(scanIntervalMs / 1000)
                .lastScanError(lastScanError)
                .autoApplyPowerProfile(powerProfileController.isAutoApply())
                .runtimeMode(runtimeMode)
                .scenario(scenarioState.getScenario())
                .scenarioCyclesLeft(scenarioState.getCyclesLeft())
                .supportedModes(RuntimeMode.supported())
                .supportedScenarios(Scenario.supported())
                .latestTimestamp(latestSnapshot == null ? null : latestSnapshot.getTimestamp())
                .lastOptimizationTime(optimizationService.getLastOptimizationTime())
                .build();
    }

    // caller holds the state write lock
    private RuntimeEvent event(EventType type, String message, String timeLabel) {
        return RuntimeEvent.builder().id(idSequence.incrementAndGet()).type(type).message(message).time(timeLabel).build();
    }

    private RuntimeEvent numbered(RuntimeEvent e) {
        return e.toBuilder().id(idSequence.incrementAndGet()).build();
    }

    private String nowLabel() {
        return LocalTime.now(clock).format(TIME_FMT);
    }
}
