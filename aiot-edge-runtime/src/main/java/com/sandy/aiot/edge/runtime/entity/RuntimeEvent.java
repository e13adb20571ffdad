package com.sandy.aiot.edge.runtime.entity;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RuntimeEvent {
    long id;
    EventType type;
    String message;
    /** Local time label HH:mm:ss. */
    String time;
}
