package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

import java.util.List;

public record RawSnapshot(
        List<RawCustomer> customers,
        List<RawProduct> products,
        List<RawSalesLine> salesLines,
        List<RawErpCustomer> erpCustomers,
        List<RawErpLocation> erpLocations,
        List<RawErpCategory> erpCategories
) {
}
