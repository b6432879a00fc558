package br.com.analytics.pipeline.sales_warehouse_batch.model.silver;

import java.util.List;

public record CanonicalSnapshot(
        List<CanonicalCustomer> customers,
        List<CanonicalProduct> products,
        List<CanonicalSalesLine> salesLines,
        List<CanonicalErpCustomer> erpCustomers,
        List<CanonicalErpLocation> erpLocations,
        List<CanonicalErpCategory> erpCategories
) {
}
