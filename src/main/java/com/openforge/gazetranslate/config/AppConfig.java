package com.openforge.gazetranslate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - captureExecutor      → runs screenshot handling off the STOMP inbound channel
 *  - externalCallExecutor → runs OCR / translation calls under their time limits
 *  - Java HttpClient      → the only HTTP engine; no WebClient, no RestTemplate
 *  - Clock                → the only time source, replaced in tests
 *
 * JSON naming (snake_case, ISO dates, lenient reads) is set through
 * spring.jackson.* so MVC, STOMP and the HTTP clients share one ObjectMapper.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /** Bounded; a full queue rejects the capture and the client gets an ERROR event. */
    @Bean
    public ExecutorService captureExecutor() {
        return new ThreadPoolExecutor(16, 16, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(256), named("capture-"), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public ExecutorService externalCallExecutor() {
        return Executors.newFixedThreadPool(32, named("external-call-"));
    }

    /**
     * Single, shared HttpClient instance. Connect timeout only; per-request
     * read timeouts are set at the call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
