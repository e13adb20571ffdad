package com.sandy.aiot.edge.runtime.vo;

import com.sandy.aiot.edge.runtime.entity.RuntimeMode;
import com.sandy.aiot.edge.runtime.entity.Scenario;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class ServiceHealthVO {
    private boolean running;
    private long scanIntervalSeconds;
    private String lastScanError;
    private boolean autoApplyPowerProfile;
    private RuntimeMode runtimeMode;
    private Scenario scenario;
    private int scenarioCyclesLeft;
    private List<String> supportedModes;
    private List<String> supportedScenarios;
    private Instant latestTimestamp;
    private Instant lastOptimizationTime;
}
