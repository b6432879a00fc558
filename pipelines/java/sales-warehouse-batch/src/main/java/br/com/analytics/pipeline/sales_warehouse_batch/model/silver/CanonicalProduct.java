package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record CanonicalProduct(
        Integer productId,
        String categoryId,
        String productKey,
        String productName,
        Integer cost,
        String productLine,
        LocalDate startDate,
        @Nullable LocalDate endDate
) {

    public boolean isActive() {
        return endDate == null;
    }
}
