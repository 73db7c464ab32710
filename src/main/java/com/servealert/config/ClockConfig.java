package com.servealert.config;

import java.time.Clock;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time and randomness sources.
 *
 * <p>Everything that reads "now" or draws a random number gets these beans injected,
 * so tests can pin both with {@code Clock.fixed} and a seeded {@link Random}.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Random random() {
        return new Random();
    }
}
