package com.pivotbot.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AppConfig {

    public static final String CYCLE_IO_EXECUTOR = "cycleIoExecutor";

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Register the JavaTimeModule for Java 8 time support
        mapper.registerModule(new JavaTimeModule());

        // ISO dates in the state and report files
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS, false);

        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the advisor request and the balance fetch of a cycle side by side.
     */
    @Bean(name = CYCLE_IO_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService cycleIoExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "cycle-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(2, threadFactory);
    }
}
