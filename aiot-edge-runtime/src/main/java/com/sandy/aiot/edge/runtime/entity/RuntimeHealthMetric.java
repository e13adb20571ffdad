package com.sandy.aiot.edge.runtime.entity;

import lombok.Value;

@Value
public class RuntimeHealthMetric {
    String name;
    /** 0..100 */
    double value;
}
