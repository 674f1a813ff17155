package com.example.examSchedulerBackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExamSchedulerBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamSchedulerBackendApplication.class, args);
    }
}
