package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalCustomer;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one record per CRM customer id: the one created last. Records without an id are dropped.
 *
 * <p>
 * When two records share the latest create date the survivor is the one that sorts first by key,
 * first name, last name, marital code and gender code (nulls last), so the outcome never depends on
 * the order rows were read in.
 * </p>
 */
public class CustomerDeduplicationProcessor implements CanonicalProcessor<RawCustomer, CanonicalCustomer> {

    static final Comparator<RawCustomer> SURVIVOR_ORDER = Comparator
            .comparing(RawCustomer::createDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
            .thenComparing(RawCustomer::customerKey, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(RawCustomer::firstName, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(RawCustomer::lastName, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(RawCustomer::maritalStatus, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(RawCustomer::gender, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final CodeMappings mappings;

    public CustomerDeduplicationProcessor(CodeMappings mappings) {
        this.mappings = mappings;
    }

    @Override
    public String entityName() {
        return "crm_cust_info";
    }

    @Override
    public List<CanonicalCustomer> process(List<RawCustomer> records) {
        Map<Integer, RawCustomer> survivors = new LinkedHashMap<>();
        for (RawCustomer customer : records) {
            if (customer.customerId() == null) {
                continue;
            }
            survivors.merge(customer.customerId(), customer,
                    (current, candidate) -> SURVIVOR_ORDER.compare(candidate, current) < 0 ? candidate : current);
        }

        List<CanonicalCustomer> canonical = new ArrayList<>(survivors.size());
        for (RawCustomer survivor : survivors.values()) {
            canonical.add(toCanonical(survivor));
        }
        return canonical;
    }

    private CanonicalCustomer toCanonical(RawCustomer customer) {
        return new CanonicalCustomer(
                customer.customerId(),
                customer.customerKey(),
                StringUtils.trim(customer.firstName()),
                StringUtils.trim(customer.lastName()),
                mappings.maritalStatusOf(customer.maritalStatus()),
                mappings.genderOf(customer.gender()),
                customer.createDate()
        );
    }
}
