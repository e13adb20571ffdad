package com.sandy.aiot.edge.runtime.entity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Selects which telemetry source feeds a scan cycle.
 */
public enum RuntimeMode {
    /** Host sensors only. */
    LIVE_EDGE,
    /** Digital twin random walk only. */
    SIMULATION,
    /** Weighted blend of host and digital twin. */
    HYBRID;

    public static RuntimeMode parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (RuntimeMode mode : values()) {
            if (mode.name().equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unsupported runtime mode: " + value);
    }

    public static List<String> supported() {
        return Arrays.stream(values()).map(Enum::name).sorted().toList();
    }
}
