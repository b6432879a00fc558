package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpLocation;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpLocation;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

public class ErpLocationProcessor implements CanonicalProcessor<RawErpLocation, CanonicalErpLocation> {

    private final CodeMappings mappings;

    public ErpLocationProcessor(CodeMappings mappings) {
        this.mappings = mappings;
    }

    @Override
    public String entityName() {
        return "erp_loc_a101";
    }

    @Override
    public List<CanonicalErpLocation> process(List<RawErpLocation> records) {
        List<CanonicalErpLocation> canonical = new ArrayList<>(records.size());
        for (RawErpLocation location : records) {
            canonical.add(new CanonicalErpLocation(
                    StringUtils.remove(location.customerId(), '-'),
                    mappings.countryOf(location.country())
            ));
        }
        return canonical;
    }
}
