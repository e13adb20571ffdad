package com.sandy.aiot.edge.runtime.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Configuration
@Slf4j
public class RuntimeConfig {

    /**
     * Generator behind the digital twin random walk, owned per service instance.
     * A configured seed makes the walk reproducible.
     */
    @Bean
    public Random simulationRandom(@Value("${runtime.simulation.seed:#{null}}") Long seed) {
        if (seed == null) {
            return new Random();
        }
        log.info("Digital twin random walk seeded with {}", seed);
        return new Random(seed);
    }

    @Bean
    public Clock runtimeClock() {
        return Clock.systemDefaultZone();
    }
}
