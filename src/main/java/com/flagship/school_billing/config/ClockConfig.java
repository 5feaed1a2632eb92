package com.flagship.school_billing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Source of "today" for billing.
 *
 * Month counting and default enrollment/payment dates read the injected
 * {@link Clock}, never the system clock directly, so reports are
 * reproducible for a fixed evaluation date.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock billingClock(@Value("${billing.time-zone:}") String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(timeZone));
    }
}
