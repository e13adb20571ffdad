package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.ScriptedTelemetryCollector;
import com.sandy.aiot.edge.runtime.entity.Alert;
import com.sandy.aiot.edge.runtime.entity.AlertSeverity;
import com.sandy.aiot.edge.runtime.entity.EventType;
import com.sandy.aiot.edge.runtime.entity.IndustrialMetrics;
import com.sandy.aiot.edge.runtime.entity.RuntimeMode;
import com.sandy.aiot.edge.runtime.entity.Scenario;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertEngineTest {

    private final AlertEngine engine = new AlertEngine();

    private static TelemetrySnapshot at(double cpu, double memory) {
        return ScriptedTelemetryCollector.reading(cpu, memory, null, null).toBuilder()
                .scanMode(RuntimeMode.LIVE_EDGE).scenario(Scenario.NORMAL).build();
    }

    @Test
    void cpuAlertFiresOnlyOnCrossing() {
        List<Alert> raised = new ArrayList<>();
        TelemetrySnapshot previous = null;
        for (double cpu : new double[]{80, 95, 95}) {
            TelemetrySnapshot current = at(cpu, 40);
            raised.addAll(engine.evaluate(current, previous, 50, "10:00:00").alerts());
            previous = current;
        }
        assertEquals(1, raised.size());
        assertEquals(Alert.CPU_PRESSURE_CRITICAL, raised.get(0).getTitle());
        assertEquals(AlertSeverity.CRITICAL, raised.get(0).getSeverity());
    }

    @Test
    void firstCycleComparesAgainstZero() {
        AlertEngine.Findings findings = engine.evaluate(at(91, 92), null, 20, "10:00:00");
        assertEquals(List.of(Alert.CPU_PRESSURE_CRITICAL, Alert.MEMORY_PRESSURE_HIGH),
                findings.alerts().stream().map(Alert::getTitle).toList());
        assertTrue(findings.events().stream().anyMatch(e -> e.getType() == EventType.ERROR));
    }

    @Test
    void summaryEventComesFirst() {
        AlertEngine.Findings findings = engine.evaluate(at(42.25, 33), null, 71.5, "12:30:05");
        assertTrue(findings.alerts().isEmpty());
        assertEquals(1, findings.events().size());
        String message = findings.events().get(0).getMessage();
        assertEquals(EventType.INFO, findings.events().get(0).getType());
        assertTrue(message.startsWith("scan_complete mode=LIVE_EDGE scenario=normal"), message);
        assertTrue(message.contains("score=71.5"), message);
        assertEquals("12:30:05", findings.events().get(0).getTime());
    }

    @Test
    void lowBatteryRepeatsEveryCycle() {
        TelemetrySnapshot low = ScriptedTelemetryCollector.reading(30.0, 30.0, 18.0, false);
        assertEquals(1, engine.evaluate(low, null, 50, "t").alerts().size());
        assertEquals(1, engine.evaluate(low, low, 50, "t").alerts().size());
        TelemetrySnapshot ok = ScriptedTelemetryCollector.reading(30.0, 30.0, 21.0, false);
        assertTrue(engine.evaluate(ok, low, 50, "t").alerts().isEmpty());
    }

    @Test
    void industrialFaultRaisesCriticalAlert() {
        IndustrialMetrics plant = IndustrialMetrics.builder().siteId("plant-2").gridLoad(0.7)
                .gridStatus("down").faultFlag(true).build();
        TelemetrySnapshot s = at(75, 70).toBuilder().faultFlag(true).industrialMetrics(plant).build();
        AlertEngine.Findings findings = engine.evaluate(s, s, 30, "t");
        assertEquals(1, findings.alerts().size());
        assertEquals(Alert.GRID_FAILURE, findings.alerts().get(0).getTitle());
        assertEquals(AlertSeverity.CRITICAL, findings.alerts().get(0).getSeverity());
        assertEquals(2, findings.events().size());
    }

    @Test
    void findingsAreLeftUnnumbered() {
        AlertEngine.Findings findings = engine.evaluate(at(95, 95), null, 10, "t");
        assertTrue(findings.events().stream().allMatch(e -> e.getId() == 0));
        assertTrue(findings.alerts().stream().allMatch(a -> a.getId() == 0));
    }
}
