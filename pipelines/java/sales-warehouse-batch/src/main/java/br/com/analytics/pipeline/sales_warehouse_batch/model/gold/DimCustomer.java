package br.com.analytics.pipeline.sales_warehouse_batch.model.gold;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

public record DimCustomer(
        long customerKey,
        Integer customerId,
        String customerNumber,
        String firstName,
        String lastName,
        @Nullable String country,
        String maritalStatus,
        String gender,
        @Nullable LocalDate birthDate,
        LocalDate createDate
) {
}
