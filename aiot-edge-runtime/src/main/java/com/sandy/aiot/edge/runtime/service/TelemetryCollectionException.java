package com.sandy.aiot.edge.runtime.service;

public class TelemetryCollectionException extends RuntimeException {

    public TelemetryCollectionException(String message) {
        super(message);
    }

    public TelemetryCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
