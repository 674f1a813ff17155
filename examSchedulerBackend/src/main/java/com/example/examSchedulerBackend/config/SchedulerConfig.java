package com.example.examSchedulerBackend.config;

import com.example.examSchedulerBackend.model.CapacityProfile;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchedulerConfig {

    @Bean
    public CapacityProfile capacityProfile(SchedulerProperties properties) {
        return properties.toCapacityProfile();
    }
}
