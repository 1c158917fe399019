package com.clinic.scheduling.config;

import com.clinic.scheduling.recurrence.RecurrenceExpander;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

    @Bean
    public RecurrenceExpander recurrenceExpander(SchedulingProperties properties) {
        return new RecurrenceExpander(properties.timeZone());
    }
}
