package com.sandy.aiot.edge.runtime.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    WARNING("warning"),
    CRITICAL("critical");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
