package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record CanonicalErpCustomer(
        String customerId,
        @Nullable LocalDate birthDate,
        String gender
) {
}
