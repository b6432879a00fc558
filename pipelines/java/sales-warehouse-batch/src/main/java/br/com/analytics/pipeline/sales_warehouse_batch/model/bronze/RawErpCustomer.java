package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

import java.time.LocalDate;

public record RawErpCustomer(
        String customerId,
        LocalDate birthDate,
        String gender
) {
}
