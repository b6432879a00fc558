package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

import java.time.LocalDate;

public record RawCustomer(
        Integer customerId,
        String customerKey,
        String firstName,
        String lastName,
        String maritalStatus,
        String gender,
        LocalDate createDate
) {
}
