package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

public record RawErpLocation(
        String customerId,
        String country
) {
}
