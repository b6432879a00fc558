package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record CanonicalSalesLine(
        String orderNumber,
        String productKey,
        Integer customerId,
        @Nullable LocalDate orderDate,
        @Nullable LocalDate shipDate,
        @Nullable LocalDate dueDate,
        Integer sales,
        Integer quantity,
        Integer price
) {
}
