package com.rentdesk.backend.config;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock systemClock(RentBillingProperties properties) {
        return Clock.system(ZoneId.of(properties.zoneId()));
    }

    @Bean
    public BusinessClock businessClock(Clock systemClock) {
        return () -> LocalDate.now(systemClock);
    }
}
