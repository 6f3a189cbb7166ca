package com.kreasipositif.wpsprocessor.config;

import com.kreasipositif.wpsprocessor.validation.ValidationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the validation engine to its own bounded worker pool.
 */
@Slf4j
@Configuration
public class ValidationConfig {

    @Bean("validationTaskExecutor")
    public ThreadPoolTaskExecutor validationTaskExecutor(WpsProperties properties) {
        int parallelism = properties.getValidation().getParallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("wps-validate-");
        executor.initialize();
        log.info("Validation executor created with {} worker(s)", parallelism);
        return executor;
    }

    @Bean
    public ValidationEngine validationEngine(@Qualifier("validationTaskExecutor") TaskExecutor executor,
                                             WpsProperties properties) {
        return new ValidationEngine(executor, properties.getValidation().getParallelism());
    }
}
