package br.com.analytics.pipeline.sales_warehouse_batch.quality;

public record QualityCheck(
        String name,
        String table,
        String description,
        String countSql
) {
}
