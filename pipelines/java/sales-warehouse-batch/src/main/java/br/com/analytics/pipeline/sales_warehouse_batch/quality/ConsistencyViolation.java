package br.com.analytics.pipeline.sales_warehouse_batch.quality;

public record ConsistencyViolation(
        String check,
        String table,
        long count,
        String description
) {
}
