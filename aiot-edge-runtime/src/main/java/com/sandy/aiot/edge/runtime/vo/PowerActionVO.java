package com.sandy.aiot.edge.runtime.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sandy.aiot.edge.runtime.entity.PowerProfile;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a power profile request. Not-applied outcomes carry the reason.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PowerActionVO {
    public static final String AUTO_APPLY_DISABLED = "auto_apply_disabled";
    public static final String UNSUPPORTED_PLATFORM = "unsupported_platform";
    public static final String COOLDOWN = "cooldown";
    public static final String SIMULATION_MODE = "simulation_mode";
    public static final String SWITCH_FAILED = "powercfg_failed";

    private boolean applied;
    private PowerProfile profile;
    private PowerProfile requestedProfile;
    private String reason;

    public static PowerActionVO applied(PowerProfile profile) {
        return PowerActionVO.builder().applied(true).profile(profile).build();
    }

    public static PowerActionVO notApplied(PowerProfile requested, String reason) {
        return PowerActionVO.builder().applied(false).requestedProfile(requested).reason(reason).build();
    }
}
