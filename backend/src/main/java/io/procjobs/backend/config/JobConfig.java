package io.procjobs.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class JobConfig {

    /**
     * Clock used for job timestamps and durations; replaced by a fixed clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
