package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

import java.time.LocalDateTime;

public record RawProduct(
        Integer productId,
        String productKey,
        String productName,
        Integer cost,
        String productLine,
        LocalDateTime startDate,
        LocalDateTime endDate
) {
}
