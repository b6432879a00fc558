package br.com.analytics.pipeline.sales_warehouse_batch.exception;

public class TransformationException extends WarehousePipelineException {

    public TransformationException(String entity, String message) {
        super(entity, message);
    }

    public TransformationException(String entity, String message, Throwable cause) {
        super(entity, message, cause);
    }
}
