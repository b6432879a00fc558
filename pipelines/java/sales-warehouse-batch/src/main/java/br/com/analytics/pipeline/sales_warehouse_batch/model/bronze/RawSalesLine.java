package br.com.analytics.pipeline.sales_warehouse_batch.model.bronze;

public record RawSalesLine(
        String orderNumber,
        String productKey,
        Integer customerId,
        Integer orderDate,
        Integer shipDate,
        Integer dueDate,
        Integer sales,
        Integer quantity,
        Integer price
) {
}
