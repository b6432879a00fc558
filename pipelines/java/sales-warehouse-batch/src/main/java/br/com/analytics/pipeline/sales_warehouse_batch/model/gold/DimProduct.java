package br.com.analytics.pipeline.sales_warehouse_batch.model.gold;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record DimProduct(
        long productKey,
        Integer productId,
        String productNumber,
        String productName,
        String categoryId,
        @Nullable String category,
        @Nullable String subcategory,
        @Nullable String maintenance,
        Integer cost,
        String productLine,
        LocalDate startDate
) {
}
