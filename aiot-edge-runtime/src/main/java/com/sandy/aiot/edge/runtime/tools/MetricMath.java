package com.sandy.aiot.edge.runtime.tools;

public final class MetricMath {

    private MetricMath() {
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    public static double clampPercent(double value) {
        if (Double.isNaN(value)) return 0.0;
        return clamp(value, 0.0, 100.0);
    }
}
