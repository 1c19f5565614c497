package com.gt.studyscheduler.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    // Calendar-day arithmetic (due today, study streaks, practice dates) happens in this zone
    @Bean
    public Clock getClock(@Value("${studyscheduler.timezone:UTC}") String timezone) {
        String zone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        log.info("Using time zone {}", zone);

        return Clock.system(ZoneId.of(zone));
    }

    // A seed of 0 or less means unseeded
    @Bean
    public Random getShuffleRandom(@Value("${studyscheduler.session.shuffleSeed:0}") long shuffleSeed) {
        return shuffleSeed > 0 ? new Random(shuffleSeed) : new Random();
    }
}
