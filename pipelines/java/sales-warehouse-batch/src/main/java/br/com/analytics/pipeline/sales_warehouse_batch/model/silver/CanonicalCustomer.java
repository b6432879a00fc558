package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

import java.time.LocalDate;

public record CanonicalCustomer(
        Integer customerId,
        String customerKey,
        String firstName,
        String lastName,
        String maritalStatus,
        String gender,
        LocalDate createDate
) {
}
