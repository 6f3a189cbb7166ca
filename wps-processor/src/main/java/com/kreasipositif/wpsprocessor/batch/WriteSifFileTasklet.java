package com.kreasipositif.wpsprocessor.batch;

import com.kreasipositif.wpsprocessor.config.WpsProperties;
import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.service.WpsBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Step 3: encodes the validated batch and writes {@code <output-dir>/<fileName>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WriteSifFileTasklet implements Tasklet {

    private final WpsBatchService batchService;
    private final WpsProperties properties;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws IOException {
        String reference = (String) chunkContext.getStepContext().getJobParameters().get(SifJobParameters.BATCH_REFERENCE);
        WpsBatch batch = batchService.encode(batchService.get(reference));

        Path dir = Paths.get(properties.getOutputDir());
        Files.createDirectories(dir);
        Path target = dir.resolve(batch.getSifFileName());
        Files.write(target, batch.getSifContent());
        contribution.incrementWriteCount(batch.employeeCount());

        ExecutionContext jobContext = contribution.getStepExecution().getJobExecution().getExecutionContext();
        jobContext.putString(SifJobParameters.CTX_FILE_NAME, batch.getSifFileName());
        jobContext.putString(SifJobParameters.CTX_FILE_PATH, target.toAbsolutePath().toString());
        log.info("SIF file for batch {} written to {}", reference, target.toAbsolutePath());
        return RepeatStatus.FINISHED;
    }
}
