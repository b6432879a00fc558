package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

public record CanonicalErpCategory(
        String id,
        String category,
        String subcategory,
        String maintenance
) {
}
