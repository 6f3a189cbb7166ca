package com.kreasipositif.wpsprocessor.batch;

import com.kreasipositif.wpsprocessor.exception.ValidationBlockedException;
import com.kreasipositif.wpsprocessor.service.WpsBatchService;
import com.kreasipositif.wpsprocessor.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Step 2: validates the batch. An ERROR-severity failure stops the job; the job listener then
 * reports exit code {@value SifJobParameters#EXIT_BLOCKED}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidateBatchTasklet implements Tasklet {

    private final WpsBatchService batchService;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Map<String, Object> params = chunkContext.getStepContext().getJobParameters();
        String reference = (String) params.get(SifJobParameters.BATCH_REFERENCE);
        String actor = (String) params.getOrDefault(SifJobParameters.ACTOR, "batch-job");

        ValidationResult result = batchService.validate(reference, actor);

        ExecutionContext stepContext = contribution.getStepExecution().getExecutionContext();
        stepContext.putString(SifJobParameters.CTX_VALIDATION_STATUS, result.status().name());
        stepContext.putInt(SifJobParameters.CTX_ERROR_COUNT, result.failedErrorCount());
        stepContext.putInt(SifJobParameters.CTX_WARNING_COUNT, result.warningCount());

        if (!result.canSubmit()) {
            throw new ValidationBlockedException(reference, result);
        }
        return RepeatStatus.FINISHED;
    }
}
