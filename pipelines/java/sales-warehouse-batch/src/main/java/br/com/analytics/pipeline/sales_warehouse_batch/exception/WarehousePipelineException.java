package br.com.analytics.pipeline.sales_warehouse_batch.exception;

import lombok.Getter;

@Getter
public class WarehousePipelineException extends RuntimeException {

    private final String entity;

    public WarehousePipelineException(String entity, String message) {
        super(message);
        this.entity = entity;
    }

    public WarehousePipelineException(String entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }
}
