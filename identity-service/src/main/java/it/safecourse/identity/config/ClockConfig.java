package it.safecourse.identity.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock used to resolve the birth-year century of fiscal codes.
 *
 * The year changes at midnight in the configured zone (Italy by default).
 */
@Slf4j
@Configuration
public class ClockConfig {

    @Value("${identity.zone-id:Europe/Rome}")
    private String zoneId;

    @Bean
    public Clock clock() {
        ZoneId zone = ZoneId.of(zoneId);
        log.info("Identity service clock zone: {}", zone);
        return Clock.system(zone);
    }
}
