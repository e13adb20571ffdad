package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.EventType;
import com.sandy.aiot.edge.runtime.entity.PowerProfile;
import com.sandy.aiot.edge.runtime.entity.RuntimeEvent;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.tools.ProcessCommandRunner.CommandResult;
import com.sandy.aiot.edge.runtime.vo.PowerActionVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Chooses a power profile for the node and applies it, subject to the auto-apply flag,
 * platform support and a same-profile cooldown.
 */
@Service
@Slf4j
public class PowerProfileController {

    private final PowerSchemeSwitcher schemeSwitcher;
    private final long cooldownMillis;
    private final LongSupplier monotonicMillis;

    private volatile boolean autoApply;
    private PowerProfile lastAppliedProfile;
    private long lastAppliedAt;

    @Autowired
    public PowerProfileController(PowerSchemeSwitcher schemeSwitcher,
                                  @Value("${power.auto-apply:true}") boolean autoApply,
                                  @Value("${power.cooldown-seconds:120}") long cooldownSeconds) {
        this(schemeSwitcher, autoApply, cooldownSeconds, () -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime()));
    }

    PowerProfileController(PowerSchemeSwitcher schemeSwitcher, boolean autoApply, long cooldownSeconds,
                           LongSupplier monotonicMillis) {
        this.schemeSwitcher = schemeSwitcher;
        this.autoApply = autoApply;
        this.cooldownMillis = TimeUnit.SECONDS.toMillis(cooldownSeconds);
        this.monotonicMillis = monotonicMillis;
    }

    public PowerProfile pickProfile(TelemetrySnapshot snapshot) {
        if (snapshot.isFaultFlag()) return PowerProfile.HIGH_PERFORMANCE;
        boolean plugged = Boolean.TRUE.equals(snapshot.getPowerPlugged());
        if (snapshot.hasBattery() && !plugged && snapshot.getBatteryPercent() <= 25) {
            return PowerProfile.POWER_SAVER;
        }
        if (plugged && snapshot.getCpuPercent() >= 85) return PowerProfile.HIGH_PERFORMANCE;
        return PowerProfile.BALANCED;
    }

    /**
     * Never throws; every refusal or switch failure comes back as a not-applied action.
     */
    public synchronized PowerActionVO apply(PowerProfile profile) {
        if (!autoApply) {
            return PowerActionVO.notApplied(profile, PowerActionVO.AUTO_APPLY_DISABLED);
        }
        if (!schemeSwitcher.isSupported()) {
            return PowerActionVO.notApplied(profile, PowerActionVO.UNSUPPORTED_PLATFORM);
        }
        long now = monotonicMillis.getAsLong();
        if (profile == lastAppliedProfile && now - lastAppliedAt < cooldownMillis) {
            return PowerActionVO.notApplied(profile, PowerActionVO.COOLDOWN);
        }
        try {
            CommandResult result = schemeSwitcher.activate(profile.getScheme());
            if (!result.isSuccess()) {
                String err = result.stderr() == null ? "" : result.stderr().trim();
                log.warn("Power scheme switch to {} failed exit={} err={}", profile, result.exitCode(), err);
                return PowerActionVO.notApplied(profile, err.isEmpty() ? PowerActionVO.SWITCH_FAILED : err);
            }
        } catch (Exception e) {
            log.warn("Power scheme switch to {} could not run: {}", profile, e.getMessage());
            return PowerActionVO.notApplied(profile, e.getMessage() == null ? PowerActionVO.SWITCH_FAILED : e.getMessage());
        }
        lastAppliedProfile = profile;
        lastAppliedAt = now;
        log.info("Power profile applied: {} ({})", profile, profile.getScheme());
        return PowerActionVO.applied(profile);
    }

    public RuntimeEvent toEvent(PowerProfile requested, PowerActionVO action, String timeLabel) {
        if (action.isApplied()) {
            return RuntimeEvent.builder().type(EventType.SUCCESS).time(timeLabel)
                    .message("power_profile_applied " + action.getProfile()).build();
        }
        String reason = action.getReason() == null ? "n/a" : action.getReason();
        return RuntimeEvent.builder().type(EventType.WARN).time(timeLabel)
                .message("power_profile_not_applied " + requested + " (" + reason + ")").build();
    }

    public boolean isAutoApply() {
        return autoApply;
    }

    public void setAutoApply(boolean enabled) {
        this.autoApply = enabled;
    }

    public synchronized PowerProfile getLastAppliedProfile() {
        return lastAppliedProfile;
    }
}
