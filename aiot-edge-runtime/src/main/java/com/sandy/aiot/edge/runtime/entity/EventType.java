package com.sandy.aiot.edge.runtime.entity;

public enum EventType {
    INFO, WARN, ERROR, SUCCESS
}
