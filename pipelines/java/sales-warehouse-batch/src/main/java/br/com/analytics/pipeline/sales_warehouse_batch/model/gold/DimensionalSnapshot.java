package br.com.analytics.pipeline.sales_warehouse_batch.model.gold;

import java.util.List;

public record DimensionalSnapshot(
        List<DimCustomer> customers,
        List<DimProduct> products,
        List<FactSalesLine> sales
) {
}
