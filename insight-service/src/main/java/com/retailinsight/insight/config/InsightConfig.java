package com.retailinsight.insight.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class InsightConfig {

    @Value("${insight.source.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${insight.source.server-selection-timeout-ms:5000}")
    private int serverSelectionTimeoutMs;

    // ── Mongo client timeouts (an unreachable source must fail fast) ──────────
    @Bean
    public MongoClientSettingsBuilderCustomizer mongoTimeoutCustomizer() {
        return builder -> builder
            .applyToSocketSettings(socket ->
                socket.connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS))
            .applyToClusterSettings(cluster ->
                cluster.serverSelectionTimeout(serverSelectionTimeoutMs, TimeUnit.MILLISECONDS));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
