package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import java.util.List;

public interface CanonicalProcessor<I, O> {

    String entityName();

    List<O> process(List<I> records);
}
