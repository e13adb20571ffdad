package com.sandy.aiot.edge.runtime.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Host power profile and the platform power scheme alias it maps to.
 */
public enum PowerProfile {
    POWER_SAVER("power_saver", "SCHEME_MAX"),
    BALANCED("balanced", "SCHEME_BALANCED"),
    HIGH_PERFORMANCE("high_performance", "SCHEME_MIN");

    private final String code;
    private final String scheme;

    PowerProfile(String code, String scheme) {
        this.code = code;
        this.scheme = scheme;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getScheme() {
        return scheme;
    }

    @Override
    public String toString() {
        return code;
    }
}
