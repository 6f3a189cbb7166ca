package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.batch.SifJobParameters;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.service.WpsBatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.kreasipositif.wpsprocessor.controller.WpsBatchController.ACTOR_HEADER;
import static com.kreasipositif.wpsprocessor.controller.WpsBatchController.DEFAULT_ACTOR;

/**
 * REST API for launching and monitoring SIF generation jobs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/wps/jobs")
@Tag(name = "SIF Jobs", description = "Run assemble → validate → write-file as an asynchronous Spring Batch job")
public class JobController {

    private final JobLauncher asyncJobLauncher;
    private final Job sifGenerationJob;
    private final JobExplorer jobExplorer;
    private final WpsBatchService batchService;

    public JobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                         Job sifGenerationJob,
                         JobExplorer jobExplorer,
                         WpsBatchService batchService) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.sifGenerationJob = sifGenerationJob;
        this.jobExplorer = jobExplorer;
        this.batchService = batchService;
    }

    // ─── POST /api/v1/wps/jobs ───────────────────────────────────────────────

    @PostMapping
    @Operation(
            summary = "Start a SIF generation job",
            description = "Launches `sifGenerationJob` for one batch **asynchronously** and returns its "
                    + "`jobExecutionId` with `STARTING` status. Poll `GET /api/v1/wps/jobs/{jobExecutionId}`. "
                    + "A job stopped by validation ends `FAILED` with exit code `BLOCKED`.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Job accepted and started in the background",
                            content = @Content(schema = @Schema(implementation = JobStartResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Unknown batch reference"),
                    @ApiResponse(responseCode = "500", description = "Failed to launch job",
                            content = @Content(schema = @Schema(implementation = Map.class)))
            })
    public ResponseEntity<?> startJob(
            @Parameter(description = "Batch to generate", example = "WPS-2026-00001", required = true)
            @RequestParam("batchReference") String batchReference,
            @Parameter(description = "Rebuild lines from the payroll register before validating")
            @RequestParam(value = "assemble", defaultValue = "true") boolean assemble,
            @RequestHeader(value = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor) {

        WpsBatch batch = batchService.get(batchReference);
        log.info("Starting {} for batch '{}' (assemble={})", SifJobParameters.JOB_NAME, batchReference, assemble);

        try {
            JobParameters params = new JobParametersBuilder()
                    .addString(SifJobParameters.BATCH_REFERENCE, batchReference)
                    .addString(SifJobParameters.COMPANY_ID, batch.getCompanyId())
                    .addString(SifJobParameters.ACTOR, actor)
                    .addString(SifJobParameters.ASSEMBLE, String.valueOf(assemble))
                    .addLong(SifJobParameters.STARTED_AT, Instant.now().toEpochMilli())
                    .toJobParameters();

            JobExecution execution = asyncJobLauncher.run(sifGenerationJob, params);

            return ResponseEntity.accepted().body(new JobStartResponse(
                    execution.getId(),
                    execution.getStatus().name(),
                    batchReference,
                    execution.getStartTime() != null ? execution.getStartTime().toString() : null));

        } catch (Exception e) {
            log.error("Failed to start job for batch {}: {}", batchReference, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start job: " + e.getMessage()));
        }
    }

    // ─── GET /api/v1/wps/jobs/{jobExecutionId} ───────────────────────────────

    @GetMapping("/{jobExecutionId}")
    @Operation(
            summary = "Get job execution status",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Job execution found",
                            content = @Content(schema = @Schema(implementation = JobStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Job execution not found")
            })
    public ResponseEntity<JobStatusResponse> getStatus(
            @Parameter(name = "jobExecutionId", description = "The job execution ID returned on start", required = true)
            @PathVariable("jobExecutionId") Long jobExecutionId) {

        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        LocalDateTime startTime = execution.getStartTime();
        LocalDateTime endTime = execution.getEndTime();
        String elapsed = null;
        if (startTime != null) {
            LocalDateTime until = endTime != null ? endTime : LocalDateTime.now();
            elapsed = Duration.between(startTime, until).toMillis() + "ms";
        }

        List<StepDetail> steps = execution.getStepExecutions().stream()
                .sorted(Comparator.comparing(StepExecution::getId))
                .map(se -> new StepDetail(
                        se.getStepName(),
                        se.getStatus().name(),
                        se.getExitStatus().getExitCode(),
                        se.getReadCount(),
                        se.getWriteCount(),
                        se.getStartTime() != null ? se.getStartTime().toString() : null,
                        se.getEndTime() != null ? se.getEndTime().toString() : null))
                .toList();

        return ResponseEntity.ok(new JobStatusResponse(
                jobExecutionId,
                execution.getJobInstance() != null ? execution.getJobInstance().getJobName() : SifJobParameters.JOB_NAME,
                execution.getJobParameters().getString(SifJobParameters.BATCH_REFERENCE),
                execution.getStatus().name(),
                execution.getExitStatus().getExitCode(),
                execution.getExitStatus().getExitDescription(),
                startTime != null ? startTime.toString() : null,
                endTime != null ? endTime.toString() : null,
                elapsed,
                execution.getExecutionContext().getString(SifJobParameters.CTX_FILE_PATH, null),
                steps));
    }

    // ─── Response records ─────────────────────────────────────────────────────

    public record JobStartResponse(Long jobExecutionId, String status, String batchReference, String startTime) {}

    /**
     * @param filePath written SIF file, once {@code writeSifFileStep} has completed
     */
    public record JobStatusResponse(
            Long jobExecutionId,
            String jobName,
            String batchReference,
            String status,
            String exitCode,
            String exitDescription,
            String startTime,
            String endTime,
            String elapsed,
            String filePath,
            List<StepDetail> steps) {}

    public record StepDetail(
            String step,
            String status,
            String exitCode,
            long readCount,
            long writeCount,
            String startTime,
            String endTime) {}
}
