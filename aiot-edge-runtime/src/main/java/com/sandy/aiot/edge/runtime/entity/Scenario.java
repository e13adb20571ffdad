package com.sandy.aiot.edge.runtime.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Synthetic load / fault condition injected on top of collected telemetry.
 */
public enum Scenario {
    NORMAL("normal"),
    PEAK_LOAD("peak_load"),
    LOW_LOAD("low_load"),
    GRID_FAILURE("grid_failure");

    private final String code;

    Scenario(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Scenario parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (Scenario s : values()) {
            if (s.code.equals(normalized)) return s;
        }
        throw new IllegalArgumentException("Unsupported scenario: " + value);
    }

    public static List<String> supported() {
        return Arrays.stream(values()).map(Scenario::getCode).sorted().toList();
    }

    @Override
    public String toString() {
        return code;
    }
}
