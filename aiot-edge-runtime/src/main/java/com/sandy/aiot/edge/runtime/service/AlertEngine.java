package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.Alert;
import com.sandy.aiot.edge.runtime.entity.AlertSeverity;
import com.sandy.aiot.edge.runtime.entity.EventType;
import com.sandy.aiot.edge.runtime.entity.RuntimeEvent;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Detects alert-worthy transitions between the previous committed snapshot and the current one.
 * CPU and memory alerts fire on the upward threshold crossing only; low battery and grid
 * failure alerts repeat every cycle while the condition holds.
 */
@Component
@Slf4j
public class AlertEngine {

    static final double CPU_CRITICAL = 90.0;
    static final double MEMORY_HIGH = 90.0;
    static final double BATTERY_LOW = 20.0;

    /**
     * Events and alerts come back without ids; the orchestrator numbers them when it commits.
     */
    public Findings evaluate(TelemetrySnapshot current, TelemetrySnapshot previous, double score, String timeLabel) {
        double cpu = current.getCpuPercent();
        double memory = current.getMemoryPercent();
        double prevCpu = previous == null ? 0.0 : previous.getCpuPercent();
        double prevMemory = previous == null ? 0.0 : previous.getMemoryPercent();

        List<RuntimeEvent> events = new ArrayList<>();
        List<Alert> alerts = new ArrayList<>();

        events.add(event(EventType.INFO, timeLabel, String.format(Locale.ROOT,
                "scan_complete mode=%s scenario=%s cpu=%.1f%% mem=%.1f%% grid=%.2f score=%.1f",
                current.getScanMode(), current.getScenario(), cpu, memory, current.gridLoadOrCpu(), score)));

        if (cpu >= CPU_CRITICAL && prevCpu < CPU_CRITICAL) {
            alerts.add(alert(AlertSeverity.CRITICAL, Alert.CPU_PRESSURE_CRITICAL,
                    String.format(Locale.ROOT, "CPU usage reached %.1f%%", cpu), timeLabel));
            events.add(event(EventType.ERROR, timeLabel,
                    String.format(Locale.ROOT, "cpu_critical threshold_crossed %.1f%%", cpu)));
        }
        if (memory >= MEMORY_HIGH && prevMemory < MEMORY_HIGH) {
            alerts.add(alert(AlertSeverity.WARNING, Alert.MEMORY_PRESSURE_HIGH,
                    String.format(Locale.ROOT, "Memory usage reached %.1f%%", memory), timeLabel));
        }
        if (current.hasBattery() && current.getBatteryPercent() <= BATTERY_LOW) {
            alerts.add(alert(AlertSeverity.WARNING, Alert.LOW_BATTERY,
                    String.format(Locale.ROOT, "Battery at %.1f%%", current.getBatteryPercent()), timeLabel));
        }
        if (current.industrialFault()) {
            alerts.add(alert(AlertSeverity.CRITICAL, Alert.GRID_FAILURE,
                    "Grid status is DOWN - failover path engaged", timeLabel));
            events.add(event(EventType.ERROR, timeLabel, "grid_failure detected; failover policy recommended"));
        }
        if (!alerts.isEmpty()) {
            log.info("Raised {} alert(s): {}", alerts.size(), alerts.stream().map(Alert::getTitle).toList());
        }
        return new Findings(events, alerts);
    }

    private static RuntimeEvent event(EventType type, String time, String message) {
        return RuntimeEvent.builder().type(type).message(message).time(time).build();
    }

    private static Alert alert(AlertSeverity severity, String title, String message, String time) {
        return Alert.builder().severity(severity).title(title).message(message).time(time).build();
    }

    public record Findings(List<RuntimeEvent> events, List<Alert> alerts) {
    }
}
