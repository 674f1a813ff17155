package com.example.examSchedulerBackend.config;

import com.example.examSchedulerBackend.service.vision.GroqVisionBackend;
import com.example.examSchedulerBackend.service.vision.ImageAnalysisService;
import com.example.examSchedulerBackend.service.vision.VisionBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class VisionConfig {

    @Bean
    public RestClient visionRestClient(VisionProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (properties.isConfigured()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        return builder.build();
    }

    /**
     * Direct hand-off pool: an attempt either starts at once or is rejected,
     * it never waits in a queue.
     */
    @Bean
    public ThreadPoolTaskExecutor visionExecutor(VisionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(properties.getMaxConcurrentCalls());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("vision-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler visionTimeoutScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setThreadNamePrefix("vision-timeout-");
        return scheduler;
    }

    @Bean
    public ImageAnalysisService imageAnalysisService(RestClient visionRestClient,
                                                     VisionProperties properties,
                                                     @Qualifier("visionExecutor") ThreadPoolTaskExecutor visionExecutor,
                                                     @Qualifier("visionTimeoutScheduler") ThreadPoolTaskScheduler visionTimeoutScheduler,
                                                     @Value("${vision.prompt:classpath:prompts/exam-schedule-extraction.txt}") Resource prompt)
            throws IOException {
        String promptText;
        try (InputStream in = prompt.getInputStream()) {
            promptText = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        }
        List<VisionBackend> backends = new ArrayList<>();
        for (String model : properties.getModels()) {
            backends.add(new GroqVisionBackend(visionRestClient, model, promptText, properties.getMaxTokens()));
        }
        log.info("Vision backends in order of preference: {}", properties.getModels());
        return new ImageAnalysisService(backends, properties.getTimeout(), visionExecutor.getThreadPoolExecutor(),
                visionTimeoutScheduler.getScheduledExecutor());
    }
}
