package com.openforge.docrouter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.docrouter.routing.RoutingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - bounded worker pools  → emails, attachments, similarity lookups
 *  - Java HttpClient       → the only HTTP engine (embedding endpoint)
 *  - Jackson ObjectMapper  → snake_case on the wire and in seed files, ISO dates

 */
@Configuration
public class AppConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService emailExecutor(RoutingProperties routing) {
        int threads = Math.max(1, routing.maxConcurrentEmails());
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 20), named("email-worker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService attachmentExecutor(RoutingProperties routing) {
        int threads = Math.max(1, routing.maxConcurrentEmails() * routing.maxConcurrentAttachments());
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 20), named("attachment-worker"));
    }

    /** Runs similarity lookups and index writes; callers never wait on it past the time limit. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService similarityExecutor(RoutingProperties routing) {
        int threads = Math.max(2, routing.maxConcurrentEmails() * routing.maxConcurrentAttachments());
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 10), named("similarity"));
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - snake_case property names (asset_id, is_allowed …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
