package br.com.analytics.pipeline.sales_warehouse_batch.config;

import br.com.analytics.pipeline.sales_warehouse_batch.dimension.DimensionalModeler;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.BronzeTableLoader;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.DelimitedSourceReader;
import br.com.analytics.pipeline.sales_warehouse_batch.processor.TransformationEngine;
import br.com.analytics.pipeline.sales_warehouse_batch.quality.QualityChecks;
import br.com.analytics.pipeline.sales_warehouse_batch.quality.QualityVerifier;
import br.com.analytics.pipeline.sales_warehouse_batch.reader.RawStoreReader;
import br.com.analytics.pipeline.sales_warehouse_batch.tasklet.BronzeIngestionTasklet;
import br.com.analytics.pipeline.sales_warehouse_batch.tasklet.QualityVerificationTasklet;
import br.com.analytics.pipeline.sales_warehouse_batch.tasklet.WarehouseBuildTasklet;
import br.com.analytics.pipeline.sales_warehouse_batch.writer.WarehouseSnapshotWriter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.builder.SimpleJobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableBatchProcessing
public class SalesWarehouseBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final WarehouseProperties properties;

    public SalesWarehouseBatchConfig(JobRepository jobRepository,
                                     PlatformTransactionManager transactionManager,
                                     WarehouseProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public TransformationEngine transformationEngine(Clock clock) {
        WarehouseProperties.Transform transform = properties.getTransform();
        return TransformationEngine.create(
                properties.codeMappings(),
                transform.getMinValidDateInt(),
                transform.getMaxValidDateInt(),
                clock,
                transform.isRequireNonEmptySources());
    }

    @Bean
    public DimensionalModeler dimensionalModeler() {
        return new DimensionalModeler(properties.codeMappings());
    }

    @Bean
    public RawStoreReader rawStoreReader(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new RawStoreReader(warehouseDataSource);
    }

    @Bean
    public WarehouseSnapshotWriter warehouseSnapshotWriter(
            @Qualifier("warehouseDataSource") DataSource warehouseDataSource, Clock clock) {
        return new WarehouseSnapshotWriter(warehouseDataSource, transactionManager, clock);
    }

    @Bean
    public QualityVerifier qualityVerifier(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new QualityVerifier(warehouseDataSource, QualityChecks.defaults());
    }

    @Bean
    public Step warehouseBuildStep(RawStoreReader rawStoreReader,
                                   TransformationEngine transformationEngine,
                                   DimensionalModeler dimensionalModeler,
                                   WarehouseSnapshotWriter warehouseSnapshotWriter) {
        WarehouseBuildTasklet tasklet = new WarehouseBuildTasklet(
                rawStoreReader, transformationEngine, dimensionalModeler, warehouseSnapshotWriter);
        return new StepBuilder("warehouseBuildStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Step qualityVerificationStep(QualityVerifier qualityVerifier) {
        QualityVerificationTasklet tasklet =
                new QualityVerificationTasklet(qualityVerifier, properties.getQuality().isFailOnViolation());
        return new StepBuilder("qualityVerificationStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Job salesWarehouseJob(@Qualifier("warehouseDataSource") DataSource warehouseDataSource,
                                 Step warehouseBuildStep,
                                 Step qualityVerificationStep) {
        JobBuilder jobBuilder = new JobBuilder("salesWarehouseJob", jobRepository)
                .incrementer(new RunIdIncrementer());

        SimpleJobBuilder flow;
        if (properties.getIngestion().isEnabled()) {
            flow = jobBuilder.start(bronzeIngestionStep(warehouseDataSource)).next(warehouseBuildStep);
        } else {
            flow = jobBuilder.start(warehouseBuildStep);
        }
        if (properties.getQuality().isEnabled()) {
            flow = flow.next(qualityVerificationStep);
        }
        return flow.build();
    }

    private Step bronzeIngestionStep(DataSource warehouseDataSource) {
        WarehouseProperties.Ingestion ingestion = properties.getIngestion();
        if (StringUtils.isBlank(ingestion.getSourcePath())) {
            throw new IllegalStateException(
                    "warehouse.ingestion.source-path is not configured. Set it or disable warehouse.ingestion.enabled.");
        }
        DelimitedSourceReader reader = new DelimitedSourceReader(
                ingestion.getFieldDelimiter(),
                Charset.forName(ingestion.getEncoding()),
                ingestion.isHeaderRowPresent());
        BronzeTableLoader loader = new BronzeTableLoader(warehouseDataSource, transactionManager);
        BronzeIngestionTasklet tasklet = new BronzeIngestionTasklet(reader, loader, Path.of(ingestion.getSourcePath()));

        return new StepBuilder("bronzeIngestionStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

}
