package br.com.analytics.pipeline.sales_warehouse_batch.tasklet;

import br.com.analytics.pipeline.sales_warehouse_batch.exception.WarehousePipelineException;
import br.com.analytics.pipeline.sales_warehouse_batch.quality.QualityReport;
import br.com.analytics.pipeline.sales_warehouse_batch.quality.QualityVerifier;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class QualityVerificationTasklet implements Tasklet {

    private final QualityVerifier verifier;
    private final boolean failOnViolation;

    public QualityVerificationTasklet(QualityVerifier verifier, boolean failOnViolation) {
        this.verifier = verifier;
        this.failOnViolation = failOnViolation;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        QualityReport report = verifier.verify();

        if (failOnViolation && !report.isClean()) {
            throw new WarehousePipelineException("quality",
                    report.violations().size() + " quality checks failed: " + report.violations());
        }
        return RepeatStatus.FINISHED;
    }
}
