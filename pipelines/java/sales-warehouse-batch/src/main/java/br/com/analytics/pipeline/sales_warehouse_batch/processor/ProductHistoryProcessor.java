package br.com.analytics.pipeline.sales_warehouse_batch.processor;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.exception.TransformationException;
import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalProduct;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the CRM product key into category id and product key, normalizes cost and line, and
 * rebuilds each product's validity chain.
 *
 * <p>
 * Versions of a product are grouped by the cleaned product key and ordered by start date; every
 * version ends the day before its successor starts and the most recent one stays open
 * ({@code endDate == null}). The raw end date is ignored.
 * </p>
 *
 * <p>
 * Undated versions sort first. A version followed by an undated one has no day to end on and stays
 * open, so a key with several undated versions keeps more than one open version; the
 * {@code product_single_open_version} quality check reports such keys.
 * </p>
 */
public class ProductHistoryProcessor implements CanonicalProcessor<RawProduct, CanonicalProduct> {

    private static final int CATEGORY_LENGTH = 5;
    private static final int PRODUCT_KEY_OFFSET = 6;

    static final Comparator<CanonicalProduct> VERSION_ORDER = Comparator
            .comparing(CanonicalProduct::startDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(CanonicalProduct::productId, Comparator.nullsLast(Comparator.<Integer>naturalOrder()));

    private final CodeMappings mappings;

    public ProductHistoryProcessor(CodeMappings mappings) {
        this.mappings = mappings;
    }

    @Override
    public String entityName() {
        return "crm_prd_info";
    }

    @Override
    public List<CanonicalProduct> process(List<RawProduct> records) {
        Map<String, List<CanonicalProduct>> versionsByKey = new LinkedHashMap<>();
        for (RawProduct product : records) {
            CanonicalProduct canonical = derive(product);
            versionsByKey.computeIfAbsent(canonical.productKey(), key -> new ArrayList<>()).add(canonical);
        }

        List<CanonicalProduct> chained = new ArrayList<>(records.size());
        for (List<CanonicalProduct> versions : versionsByKey.values()) {
            versions.sort(VERSION_ORDER);
            for (int i = 0; i < versions.size(); i++) {
                CanonicalProduct current = versions.get(i);
                LocalDate endDate = null;
                if (i + 1 < versions.size()) {
                    LocalDate nextStart = versions.get(i + 1).startDate();
                    endDate = nextStart == null ? null : nextStart.minusDays(1);
                }
                chained.add(withEndDate(current, endDate));
            }
        }
        return chained;
    }

    CanonicalProduct derive(RawProduct product) {
        String rawKey = product.productKey();
        if (rawKey == null) {
            throw new TransformationException(entityName(),
                    "Product " + product.productId() + " has no product key");
        }
        return new CanonicalProduct(
                product.productId(),
                categoryIdOf(rawKey),
                productKeyOf(rawKey),
                product.productName(),
                product.cost() == null ? 0 : product.cost(),
                mappings.productLineOf(product.productLine()),
                product.startDate() == null ? null : product.startDate().toLocalDate(),
                null
        );
    }

    static String categoryIdOf(String rawKey) {
        return rawKey.substring(0, Math.min(CATEGORY_LENGTH, rawKey.length())).replace('-', '_');
    }

    static String productKeyOf(String rawKey) {
        return rawKey.length() > PRODUCT_KEY_OFFSET ? rawKey.substring(PRODUCT_KEY_OFFSET) : "";
    }

    private CanonicalProduct withEndDate(CanonicalProduct product, LocalDate endDate) {
        return new CanonicalProduct(
                product.productId(),
                product.categoryId(),
                product.productKey(),
                product.productName(),
                product.cost(),
                product.productLine(),
                product.startDate(),
                endDate
        );
    }
}
