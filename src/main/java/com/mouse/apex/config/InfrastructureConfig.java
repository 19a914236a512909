package com.mouse.apex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mouse.apex.interceptor.SimpleHttpLoggingInterceptor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class InfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Bean
    public OkHttpClient oddsApiHttpClient(OddsApiConfig oddsApiConfig) {
        long timeoutMs = oddsApiConfig.getTimeoutMs();
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .retryOnConnectionFailure(true)
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();
    }

    /** Pool for collaborator calls and per-fixture analysis. */
    @Bean(destroyMethod = "")
    public ExecutorService pipelineExecutor(PipelineConfig pipelineConfig) {
        AtomicInteger counter = new AtomicInteger();
        int size = Math.max(1, pipelineConfig.getThreadPoolSize());
        log.info("Creating pipeline executor | PoolSize: {}", size);
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "pipeline-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
