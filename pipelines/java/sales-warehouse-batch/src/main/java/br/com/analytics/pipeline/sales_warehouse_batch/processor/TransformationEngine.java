package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.exception.IngestionException;
import br.com.analytics.pipeline.sales_warehouse_batch.exception.TransformationException;
import br.com.analytics.pipeline.sales_warehouse_batch.exception.WarehousePipelineException;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCategory;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpLocation;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpCategory;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpLocation;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Produces the canonical (silver) record sets from a raw snapshot.
 *
 * <p>
 * The engine holds no state between calls: the same snapshot, mappings and run date always give
 * the same output. Per-record anomalies are repaired by the individual processors; anything that
 * cannot be repaired aborts the whole transformation with the failing entity attached.
 * </p>
 */
@Slf4j
public class TransformationEngine {

    private final CanonicalProcessor<RawCustomer, CanonicalCustomer> customerProcessor;
    private final CanonicalProcessor<RawProduct, CanonicalProduct> productProcessor;
    private final CanonicalProcessor<RawSalesLine, CanonicalSalesLine> salesProcessor;
    private final CanonicalProcessor<RawErpCustomer, CanonicalErpCustomer> erpCustomerProcessor;
    private final CanonicalProcessor<RawErpLocation, CanonicalErpLocation> erpLocationProcessor;
    private final CanonicalProcessor<RawErpCategory, CanonicalErpCategory> erpCategoryProcessor;
    private final boolean requireNonEmptySources;

    public TransformationEngine(
            CanonicalProcessor<RawCustomer, CanonicalCustomer> customerProcessor,
            CanonicalProcessor<RawProduct, CanonicalProduct> productProcessor,
            CanonicalProcessor<RawSalesLine, CanonicalSalesLine> salesProcessor,
            CanonicalProcessor<RawErpCustomer, CanonicalErpCustomer> erpCustomerProcessor,
            CanonicalProcessor<RawErpLocation, CanonicalErpLocation> erpLocationProcessor,
            CanonicalProcessor<RawErpCategory, CanonicalErpCategory> erpCategoryProcessor,
            boolean requireNonEmptySources) {
        this.customerProcessor = customerProcessor;
        this.productProcessor = productProcessor;
        this.salesProcessor = salesProcessor;
        this.erpCustomerProcessor = erpCustomerProcessor;
        this.erpLocationProcessor = erpLocationProcessor;
        this.erpCategoryProcessor = erpCategoryProcessor;
        this.requireNonEmptySources = requireNonEmptySources;
    }

    public static TransformationEngine create(CodeMappings mappings, int minValidDate, int maxValidDate,
                                              Clock clock, boolean requireNonEmptySources) {
        return new TransformationEngine(
                new CustomerDeduplicationProcessor(mappings),
                new ProductHistoryProcessor(mappings),
                new SalesLineRepairProcessor(minValidDate, maxValidDate),
                new ErpCustomerProcessor(mappings, clock),
                new ErpLocationProcessor(mappings),
                new ErpCategoryProcessor(),
                requireNonEmptySources);
    }

    public CanonicalSnapshot transform(RawSnapshot raw) {
        log.info("[silver] Transforming raw snapshot into canonical record sets");
        return new CanonicalSnapshot(
                apply(customerProcessor, raw.customers()),
                apply(productProcessor, raw.products()),
                apply(salesProcessor, raw.salesLines()),
                apply(erpCustomerProcessor, raw.erpCustomers()),
                apply(erpLocationProcessor, raw.erpLocations()),
                apply(erpCategoryProcessor, raw.erpCategories())
        );
    }

    private <I, O> List<O> apply(CanonicalProcessor<I, O> processor, List<I> records) {
        String entity = processor.entityName();
        if (records == null) {
            throw new IngestionException(entity, "Raw record set " + entity + " is absent");
        }
        if (records.isEmpty() && requireNonEmptySources) {
            throw new IngestionException(entity, "Raw record set " + entity + " is empty");
        }

        List<O> canonical;
        try {
            canonical = processor.process(records);
        } catch (WarehousePipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransformationException(entity, "Failed to transform " + entity + ": " + e.getMessage(), e);
        }

        log.info("[silver] {}: {} raw -> {} canonical records", entity, records.size(), canonical.size());
        return List.copyOf(canonical);
    }
}
