package com.kreasipositif.wpsprocessor.submission;

import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.exception.WpsException;
import com.kreasipositif.wpsprocessor.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic work on open submissions: polls the bank for PROCESSING ones and, when enabled,
 * re-attempts DRAFT ones whose previous attempt failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionScheduler {

    static final String SYSTEM_ACTOR = "scheduler";

    private final SubmissionOrchestrator orchestrator;
    private final SubmissionRepository submissions;
    private final WpsProperties properties;

    @Scheduled(fixedDelayString = "${wps.submission.status-poll-interval:PT1M}",
            initialDelayString = "${wps.submission.status-poll-interval:PT1M}")
    public void pollOpenSubmissions() {
        WpsProperties.Submission config = properties.getSubmission();
        if (config.isStatusPollingEnabled()) {
            for (Submission submission : submissions.findByState(SubmissionState.PROCESSING)) {
                try {
                    orchestrator.checkStatus(submission.getReference());
                } catch (WpsException e) {
                    log.warn("Status poll of {} failed: {}", submission.getReference(), e.getMessage());
                }
            }
        }
        if (config.isAutoRetryEnabled()) {
            for (Submission submission : submissions.findByState(SubmissionState.DRAFT)) {
                if (submission.getRetryCount() == 0) {
                    continue;
                }
                try {
                    orchestrator.retry(submission.getReference(), SYSTEM_ACTOR);
                } catch (WpsException e) {
                    log.warn("Automatic retry of {} failed: {}", submission.getReference(), e.getMessage());
                }
            }
        }
    }
}
