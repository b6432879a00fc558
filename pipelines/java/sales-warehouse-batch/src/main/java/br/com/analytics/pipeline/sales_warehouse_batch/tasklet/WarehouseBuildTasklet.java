package br.com.analytics.pipeline.sales_warehouse_batch.tasklet;

import br.com.analytics.pipeline.sales_warehouse_batch.dimension.DimensionalModeler;
import br.com.analytics.pipeline.sales_warehouse_batch.exception.WarehousePipelineException;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.DimensionalSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.processor.TransformationEngine;
import br.com.analytics.pipeline.sales_warehouse_batch.reader.RawStoreReader;
import br.com.analytics.pipeline.sales_warehouse_batch.writer.WarehouseSnapshotWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.time.Duration;

@Slf4j
public class WarehouseBuildTasklet implements Tasklet {

    private final RawStoreReader rawStoreReader;
    private final TransformationEngine transformationEngine;
    private final DimensionalModeler dimensionalModeler;
    private final WarehouseSnapshotWriter snapshotWriter;

    public WarehouseBuildTasklet(RawStoreReader rawStoreReader,
                                 TransformationEngine transformationEngine,
                                 DimensionalModeler dimensionalModeler,
                                 WarehouseSnapshotWriter snapshotWriter) {
        this.rawStoreReader = rawStoreReader;
        this.transformationEngine = transformationEngine;
        this.dimensionalModeler = dimensionalModeler;
        this.snapshotWriter = snapshotWriter;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        long started = System.nanoTime();
        log.info("=================================================================");
        log.info("Starting warehouse build (silver + gold)");
        log.info("=================================================================");

        try {
            RawSnapshot raw = rawStoreReader.readSnapshot();
            CanonicalSnapshot canonical = transformationEngine.transform(raw);
            DimensionalSnapshot dimensional = dimensionalModeler.model(canonical);
            snapshotWriter.publish(canonical, dimensional);

            logCounts(canonical, dimensional);
        } catch (WarehousePipelineException e) {
            log.error("Warehouse build failed on {}: {}. The previous snapshot is left in place.",
                    e.getEntity(), e.getMessage());
            throw e;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Warehouse build completed in {} ms", elapsed.toMillis());
        return RepeatStatus.FINISHED;
    }

    private void logCounts(CanonicalSnapshot canonical, DimensionalSnapshot dimensional) {
        log.info("silver.crm_cust_info      : {}", canonical.customers().size());
        log.info("silver.crm_prd_info       : {}", canonical.products().size());
        log.info("silver.crm_sales_details  : {}", canonical.salesLines().size());
        log.info("silver.erp_cust_az12      : {}", canonical.erpCustomers().size());
        log.info("silver.erp_loc_a101       : {}", canonical.erpLocations().size());
        log.info("silver.erp_px_cat_g1v2    : {}", canonical.erpCategories().size());
        log.info("gold.dim_customers        : {}", dimensional.customers().size());
        log.info("gold.dim_products         : {}", dimensional.products().size());
        log.info("gold.fact_sales           : {}", dimensional.sales().size());
    }
}
