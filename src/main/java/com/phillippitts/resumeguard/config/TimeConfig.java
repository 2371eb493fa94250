package com.phillippitts.resumeguard.config;

import com.phillippitts.resumeguard.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time sources shared by recovery components. Tests replace both with manual doubles.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
