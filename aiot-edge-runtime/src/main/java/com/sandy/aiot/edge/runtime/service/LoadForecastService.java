package com.sandy.aiot.edge.runtime.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Naive drift forecast of the next cycle's load: the latest sample plus the mean step
 * over a short window. Falls back to persistence until two samples are known.
 */
@Service
@Slf4j
public class LoadForecastService {

    private final int window;
    private final Deque<Double> recent = new ArrayDeque<>();

    public LoadForecastService(@Value("${decision.forecast-window:6}") int window) {
        this.window = Math.max(2, window);
    }

    public synchronized double predictNext(double currentLoad) {
        if (Double.isNaN(currentLoad)) {
            return recent.isEmpty() ? 0.0 : recent.peekLast();
        }
        recent.addLast(currentLoad);
        while (recent.size() > window) recent.removeFirst();
        if (recent.size() < 2) return currentLoad;

        double sumSteps = 0;
        Iterator<Double> it = recent.iterator();
        double prev = it.next();
        while (it.hasNext()) {
            double v = it.next();
            sumSteps += v - prev;
            prev = v;
        }
        double drift = sumSteps / (recent.size() - 1);
        double predicted = Math.max(0.0, currentLoad + drift);
        log.debug("Load forecast current={} drift={} predicted={}", currentLoad, drift, predicted);
        return predicted;
    }

    public synchronized int sampleCount() {
        return recent.size();
    }
}
