package com.gt.flashcard.conf;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of "now" for scheduling. The zone decides where calendar days start for daily statistics.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock getClock(@Value("${flashcard.timezone:}") String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Clock.systemDefaultZone();
        }

        return Clock.system(ZoneId.of(timezone));
    }
}
