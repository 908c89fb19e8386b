package com.leadharvest.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class HarvestConfig {

    @Bean(name = "scrapeJobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scrapeJobExecutor(HarvestProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getJobs().getMaxConcurrentJobs(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("scrape-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "providerHttpExecutor", destroyMethod = "shutdown")
    public ExecutorService providerHttpExecutor(HarvestProperties properties) {
        int size = Math.max(2, properties.getProvider().getMaxConcurrentRequests() * 2);
        return Executors.newFixedThreadPool(size);
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
