package com.delta.jobscraper.config;

import com.delta.jobscraper.crawl.cache.CacheStore;
import com.delta.jobscraper.crawl.retry.AdaptiveOriginThrottle;
import com.delta.jobscraper.crawl.util.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    // one worker per backend partition
    @Bean(name = "partitionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService partitionExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getScheduler().getMaxPartitions());
    }

    // crawls that outlive their timeout are cancelled but may still hold a thread until they notice
    @Bean(name = "sourceExecutor", destroyMethod = "shutdownNow")
    public ExecutorService sourceExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public AdaptiveOriginThrottle adaptiveOriginThrottle(ScraperProperties properties, Sleeper sleeper) {
        return new AdaptiveOriginThrottle(
            Duration.ofMillis(properties.getThrottle().getFloorMs()),
            Duration.ofMillis(properties.getThrottle().getCeilingMs()),
            sleeper
        );
    }

    @Bean
    public CacheStore cacheStore(ScraperProperties properties) {
        return new CacheStore(Path.of(properties.getCacheDir()));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
