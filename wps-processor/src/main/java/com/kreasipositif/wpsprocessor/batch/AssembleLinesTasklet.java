package com.kreasipositif.wpsprocessor.batch;

import com.kreasipositif.wpsprocessor.domain.WpsBatch;
import com.kreasipositif.wpsprocessor.exception.WpsException;
import com.kreasipositif.wpsprocessor.service.WpsBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Step 1: rebuilds the batch's lines from the payroll register, unless the job was started
 * with {@code assemble=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssembleLinesTasklet implements Tasklet {

    private final WpsBatchService batchService;

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Map<String, Object> params = chunkContext.getStepContext().getJobParameters();
        String reference = (String) params.get(SifJobParameters.BATCH_REFERENCE);
        WpsBatch batch = batchService.get(reference);

        Object companyId = params.get(SifJobParameters.COMPANY_ID);
        if (companyId != null && !companyId.equals(batch.getCompanyId())) {
            throw new WpsException("Batch %s belongs to company %s, not %s"
                    .formatted(reference, batch.getCompanyId(), companyId));
        }

        if ("false".equalsIgnoreCase(String.valueOf(params.get(SifJobParameters.ASSEMBLE)))) {
            log.info("Keeping the {} existing line(s) of batch {}", batch.employeeCount(), reference);
        } else {
            batch = batchService.assemble(reference, Set.of());
            contribution.incrementReadCount();
        }
        contribution.getStepExecution().getExecutionContext()
                .putInt(SifJobParameters.CTX_LINE_COUNT, batch.employeeCount());
        return RepeatStatus.FINISHED;
    }
}
