package br.com.analytics.pipeline.sales_warehouse_batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Component
public class PipelineLauncher implements ApplicationRunner, ExitCodeGenerator {

    private final JobOperator jobOperator;
    private final Job salesWarehouseJob;
    private final Clock clock;

    private int exitCode = 0;

    public PipelineLauncher(JobOperator jobOperator, Job salesWarehouseJob, Clock clock) {
        this.jobOperator = jobOperator;
        this.salesWarehouseJob = salesWarehouseJob;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        JobParameters parameters = new JobParametersBuilder()
                .addLocalDateTime("run.timestamp", LocalDateTime.now(clock))
                .toJobParameters();

        JobExecution execution = jobOperator.start(salesWarehouseJob, parameters);

        if (execution.getStatus().isUnsuccessful()) {
            exitCode = 1;
            log.error("Pipeline run finished with status {}", execution.getStatus());
            for (Throwable failure : execution.getAllFailureExceptions()) {
                log.error("Cause: {}", failure.getMessage(), failure);
            }
        } else {
            log.info("Pipeline run finished with status {}", execution.getStatus());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
