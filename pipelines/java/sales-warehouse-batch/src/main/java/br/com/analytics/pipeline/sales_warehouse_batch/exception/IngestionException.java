package br.com.analytics.pipeline.sales_warehouse_batch.exception;

public class IngestionException extends WarehousePipelineException {

    public IngestionException(String entity, String message) {
        super(entity, message);
    }

    public IngestionException(String entity, String message, Throwable cause) {
        super(entity, message, cause);
    }
}
