package com.sarkari.jobfeed.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScrapeConfig {

    @Bean(name = "scrapeExecutor", destroyMethod = "shutdown")
    public ExecutorService scrapeExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency());
    }

    @Bean(name = "extractionExecutor", destroyMethod = "shutdown")
    public ExecutorService extractionExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getExtractionConcurrency());
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
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
