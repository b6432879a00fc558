package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCategory;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpCategory;

import java.util.ArrayList;
import java.util.List;

public class ErpCategoryProcessor implements CanonicalProcessor<RawErpCategory, CanonicalErpCategory> {

    @Override
    public String entityName() {
        return "erp_px_cat_g1v2";
    }

    @Override
    public List<CanonicalErpCategory> process(List<RawErpCategory> records) {
        List<CanonicalErpCategory> canonical = new ArrayList<>(records.size());
        for (RawErpCategory category : records) {
            canonical.add(new CanonicalErpCategory(
                    category.id(),
                    category.category(),
                    category.subcategory(),
                    category.maintenance()
            ));
        }
        return canonical;
    }
}
