package br.com.analytics.pipeline.sales_warehouse_batch.model.gold;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record FactSalesLine(
        String orderNumber,
        @Nullable Long productKey,
        @Nullable Long customerKey,
        @Nullable LocalDate orderDate,
        @Nullable LocalDate shippingDate,
        @Nullable LocalDate dueDate,
        Integer price,
        Integer quantity,
        Integer salesAmount
) {
}
