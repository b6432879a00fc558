package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpCustomer;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class ErpCustomerProcessor implements CanonicalProcessor<RawErpCustomer, CanonicalErpCustomer> {

    private static final String LEGACY_PREFIX = "NAS";

    private final CodeMappings mappings;
    private final Clock clock;

    public ErpCustomerProcessor(CodeMappings mappings, Clock clock) {
        this.mappings = mappings;
        this.clock = clock;
    }

    @Override
    public String entityName() {
        return "erp_cust_az12";
    }

    @Override
    public List<CanonicalErpCustomer> process(List<RawErpCustomer> records) {
        LocalDate today = LocalDate.now(clock);
        List<CanonicalErpCustomer> canonical = new ArrayList<>(records.size());
        for (RawErpCustomer customer : records) {
            LocalDate birthDate = customer.birthDate();
            canonical.add(new CanonicalErpCustomer(
                    stripPrefix(customer.customerId()),
                    birthDate != null && birthDate.isAfter(today) ? null : birthDate,
                    mappings.erpGenderOf(customer.gender())
            ));
        }
        return canonical;
    }

    static String stripPrefix(String customerId) {
        if (StringUtils.startsWithIgnoreCase(customerId, LEGACY_PREFIX)) {
            return customerId.substring(LEGACY_PREFIX.length());
        }
        return customerId;
    }
}
