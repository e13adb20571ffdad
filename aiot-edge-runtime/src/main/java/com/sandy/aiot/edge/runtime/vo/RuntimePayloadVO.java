package com.sandy.aiot.edge.runtime.vo;

import com.sandy.aiot.edge.runtime.entity.Alert;
import com.sandy.aiot.edge.runtime.entity.Decision;
import com.sandy.aiot.edge.runtime.entity.HistoryRecord;
import com.sandy.aiot.edge.runtime.entity.RuntimeEvent;
import com.sandy.aiot.edge.runtime.entity.RuntimeHealthMetric;
import com.sandy.aiot.edge.runtime.entity.RuntimeMode;
import com.sandy.aiot.edge.runtime.entity.Scenario;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard payload: latest cycle plus bounded tails of history, events and alerts.
 */
@Data
@Builder
public class RuntimePayloadVO {
    private String status;
    private RuntimeMode mode;
    private Scenario scenario;
    private Instant timestamp;
    private TelemetrySnapshot telemetry;
    private Decision decision;
    private List<RuntimeHealthMetric> runtimeHealth;
    private List<HistoryRecord> history;
    private List<RuntimeEvent> events;
    private List<Alert> alerts;
    private ServiceHealthVO serviceHealth;
}
