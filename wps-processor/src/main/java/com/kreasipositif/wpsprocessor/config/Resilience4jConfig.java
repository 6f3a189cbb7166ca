package com.kreasipositif.wpsprocessor.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j configuration for the two downstream dependencies.
 *
 * <ul>
 *   <li><b>bankRegistryBulkhead</b> (semaphore): caps concurrent lookups against the
 *       bank-registry-service. Calls run inline on the caller's thread.</li>
 *   <li><b>bankConnectorThreadPoolBulkhead</b> (fixed thread pool): bank connector calls are
 *       dispatched here as {@link java.util.concurrent.CompletionStage}s, keeping slow bank
 *       channels off request and scheduler threads.</li>
 *   <li><b>bankConnectorTimeLimiter</b>: bounds each connector call by
 *       {@code wps.submission.transmit-timeout}. The running call is not cancelled; its late
 *       result is discarded by the orchestrator.</li>
 * </ul>
 *
 * <p>Sizes are read from {@code application.yml} under the {@code resilience4j.*} namespace.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    // ── SemaphoreBulkhead: bank-registry-service ─────────────────────────────

    @Value("${resilience4j.bulkhead.instances.bankRegistryBulkhead.max-concurrent-calls:20}")
    private int registryMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.bankRegistryBulkhead.max-wait-duration:500ms}")
    private Duration registryMaxWait;

    // ── FixedThreadPoolBulkhead: bank connectors ─────────────────────────────

    @Value("${resilience4j.thread-pool-bulkhead.instances.bankConnectorThreadPoolBulkhead.max-thread-pool-size:8}")
    private int tpMaxPoolSize;

    @Value("${resilience4j.thread-pool-bulkhead.instances.bankConnectorThreadPoolBulkhead.core-thread-pool-size:4}")
    private int tpCorePoolSize;

    @Value("${resilience4j.thread-pool-bulkhead.instances.bankConnectorThreadPoolBulkhead.queue-capacity:100}")
    private int tpQueueCapacity;

    @Value("${resilience4j.thread-pool-bulkhead.instances.bankConnectorThreadPoolBulkhead.keep-alive-duration:20ms}")
    private Duration tpKeepAlive;

    // ─── Beans ───────────────────────────────────────────────────────────────

    @Bean("bankRegistryBulkhead")
    public Bulkhead bankRegistryBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(registryMaxConcurrent)
                .maxWaitDuration(registryMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("bankRegistryBulkhead", cfg);
        log.info("SemaphoreBulkhead 'bankRegistryBulkhead' created: maxConcurrent={}, maxWait={}",
                registryMaxConcurrent, registryMaxWait);
        return bh;
    }

    @Bean("bankConnectorThreadPoolBulkhead")
    public ThreadPoolBulkhead bankConnectorThreadPoolBulkhead(ThreadPoolBulkheadRegistry registry) {
        ThreadPoolBulkheadConfig cfg = ThreadPoolBulkheadConfig.custom()
                .maxThreadPoolSize(tpMaxPoolSize)
                .coreThreadPoolSize(tpCorePoolSize)
                .queueCapacity(tpQueueCapacity)
                .keepAliveDuration(tpKeepAlive)
                .build();
        ThreadPoolBulkhead bh = registry.bulkhead("bankConnectorThreadPoolBulkhead", cfg);
        log.info("ThreadPoolBulkhead 'bankConnectorThreadPoolBulkhead' created: corePool={}, maxPool={}, queue={}",
                tpCorePoolSize, tpMaxPoolSize, tpQueueCapacity);
        return bh;
    }

    @Bean("bankConnectorTimeLimiter")
    public TimeLimiter bankConnectorTimeLimiter(TimeLimiterRegistry registry, WpsProperties properties) {
        Duration timeout = properties.getSubmission().getTransmitTimeout();
        TimeLimiterConfig cfg = TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(false)
                .build();
        TimeLimiter limiter = registry.timeLimiter("bankConnectorTimeLimiter", cfg);
        log.info("TimeLimiter 'bankConnectorTimeLimiter' created: timeout={}", timeout);
        return limiter;
    }

    // ─── Registries ──────────────────────────────────────────────────────────

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }

    @Bean
    public ThreadPoolBulkheadRegistry threadPoolBulkheadRegistry() {
        return ThreadPoolBulkheadRegistry.ofDefaults();
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }
}
