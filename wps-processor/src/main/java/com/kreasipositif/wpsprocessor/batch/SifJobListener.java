package com.kreasipositif.wpsprocessor.batch;

import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.stereotype.Component;

/**
 * Turns a validation block into the job exit code {@value SifJobParameters#EXIT_BLOCKED}.
 */
@Slf4j
@Component
public class SifJobListener implements JobExecutionListener {

    @Override
    public void afterJob(JobExecution jobExecution) {
        jobExecution.getAllFailureExceptions().stream()
                .filter(ValidationBlockedException.class::isInstance)
                .findFirst()
                .ifPresent(e -> {
                    jobExecution.setExitStatus(new ExitStatus(SifJobParameters.EXIT_BLOCKED, e.getMessage()));
                    log.warn("Job {} blocked by validation: {}", jobExecution.getId(), e.getMessage());
                });
        log.info("Job {} finished with status={} exitCode={}", jobExecution.getId(),
                jobExecution.getStatus(), jobExecution.getExitStatus().getExitCode());
    }
}
