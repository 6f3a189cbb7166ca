package com.kreasipositif.wpsprocessor.config;

import com.kreasipositif.wpsprocessor.batch.AssembleLinesTasklet;
import com.kreasipositif.wpsprocessor.batch.SifJobListener;
import com.kreasipositif.wpsprocessor.batch.SifJobParameters;
import com.kreasipositif.wpsprocessor.batch.ValidateBatchTasklet;
import com.kreasipositif.wpsprocessor.batch.WriteSifFileTasklet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Spring Batch configuration of the SIF generation job.
 *
 * <pre>
 *  sifGenerationJob
 *     ├── assembleLinesStep   (rebuild lines from payroll)
 *     ├── validateBatchStep   (ERROR failures stop the job, exit code BLOCKED)
 *     └── writeSifFileStep    (encode, write &lt;output-dir&gt;/&lt;fileName&gt;)
 * </pre>
 *
 * Jobs are started through {@code asyncJobLauncher}, which returns as soon as the execution is
 * created; progress is polled over REST.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job sifGenerationJob(AssembleLinesTasklet assembleLinesTasklet,
                                ValidateBatchTasklet validateBatchTasklet,
                                WriteSifFileTasklet writeSifFileTasklet,
                                SifJobListener sifJobListener) {
        return new JobBuilder(SifJobParameters.JOB_NAME, jobRepository)
                .listener(sifJobListener)
                .start(step("assembleLinesStep", assembleLinesTasklet))
                .next(step("validateBatchStep", validateBatchTasklet))
                .next(step("writeSifFileStep", writeSifFileTasklet))
                .build();
    }

    private Step step(String name, Tasklet tasklet) {
        return new StepBuilder(name, jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * {@code run(...)} returns immediately with {@code STARTING}; the job runs on its own thread.
     */
    @Bean("asyncJobLauncher")
    @Primary
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("wps-job-"));
        launcher.afterPropertiesSet();
        log.info("Async job launcher ready");
        return launcher;
    }
}
