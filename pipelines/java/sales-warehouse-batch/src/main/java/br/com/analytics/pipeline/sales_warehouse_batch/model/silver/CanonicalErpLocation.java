package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

public record CanonicalErpLocation(
        String customerId,
        String country
) {
}
