package com.example.clinic.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wall clock used to date statements and age balances.
 */
@Configuration
public class BillingConfig {

    private static final Logger log = LoggerFactory.getLogger(BillingConfig.class);

    @Bean
    public Clock billingClock(@Value("${clinic.billing.time-zone:}") String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        ZoneId zone = ZoneId.of(timeZone.trim());
        log.info("Billing clock using time zone {}", zone);
        return Clock.system(zone);
    }
}
