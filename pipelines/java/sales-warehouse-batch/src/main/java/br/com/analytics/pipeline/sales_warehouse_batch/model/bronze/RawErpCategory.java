package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

public record RawErpCategory(
        String id,
        String category,
        String subcategory,
        String maintenance
) {
}
