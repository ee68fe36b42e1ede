package com.caf.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * The one time source of the service. Entity timestamps, audit entries, retention and
 * notification dedup days all read this clock.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DateTimeProvider entityTimestampProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
