package com.example.examSchedulerBackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the hosted vision model used to read exam-schedule images.
 * {@code models} is tried in order until one answers.
 */
@Data
@ConfigurationProperties(prefix = "vision")
public class VisionProperties {

    private String apiKey;
    private String baseUrl = "https://api.groq.com/openai/v1";
    private List<String> models = new ArrayList<>();
    // per backend attempt, counted from the moment the call starts
    private Duration timeout = Duration.ofSeconds(60);

    // whole fallback chain for one uploaded image
    private Duration overallTimeout = Duration.ofSeconds(360);

    // calls beyond this are rejected instead of queued
    private int maxConcurrentCalls = 16;
    private int maxTokens = 8192;
    private List<String> allowedMimeTypes = new ArrayList<>(List.of("image/png", "image/jpeg", "image/jpg"));

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
