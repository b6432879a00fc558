package br.com.analytics.pipeline.sales_warehouse_batch.dimension;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.DimCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.DimProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.DimensionalSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.FactSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpCategory;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpCustomer;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalErpLocation;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalProduct;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the gold layer: the customer and product dimensions with dense surrogate keys, then the
 * sales fact resolved against them.
 *
 * <p>
 * Surrogate keys are reassigned from 1 on every run. They are only stable while the set and order
 * of business keys stays the same.
 * </p>
 */
@Slf4j
public class DimensionalModeler {

    static final Comparator<CanonicalCustomer> CUSTOMER_ORDER = Comparator
            .comparing(CanonicalCustomer::customerId);

    static final Comparator<CanonicalProduct> PRODUCT_ORDER = Comparator
            .comparing(CanonicalProduct::startDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(CanonicalProduct::productKey, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(CanonicalProduct::productId, Comparator.nullsLast(Comparator.<Integer>naturalOrder()));

    private final CodeMappings mappings;

    public DimensionalModeler(CodeMappings mappings) {
        this.mappings = mappings;
    }

    public DimensionalSnapshot model(CanonicalSnapshot canonical) {
        List<DimCustomer> customers = buildCustomerDimension(
                canonical.customers(), canonical.erpCustomers(), canonical.erpLocations());
        List<DimProduct> products = buildProductDimension(canonical.products(), canonical.erpCategories());
        List<FactSalesLine> sales = buildSalesFact(canonical.salesLines(), customers, products);

        log.info("[gold] dim_customers: {} rows, dim_products: {} rows, fact_sales: {} rows",
                customers.size(), products.size(), sales.size());
        return new DimensionalSnapshot(customers, products, sales);
    }

    List<DimCustomer> buildCustomerDimension(List<CanonicalCustomer> customers,
                                             List<CanonicalErpCustomer> erpCustomers,
                                             List<CanonicalErpLocation> erpLocations) {
        Map<String, CanonicalErpCustomer> erpById = firstById(erpCustomers, CanonicalErpCustomer::customerId);
        Map<String, CanonicalErpLocation> locationById = firstById(erpLocations, CanonicalErpLocation::customerId);

        List<CanonicalCustomer> ordered = new ArrayList<>(customers);
        ordered.sort(CUSTOMER_ORDER);

        List<DimCustomer> dimension = new ArrayList<>(ordered.size());
        long surrogateKey = 1;
        for (CanonicalCustomer customer : ordered) {
            CanonicalErpCustomer erp = erpById.get(customer.customerKey());
            CanonicalErpLocation location = locationById.get(customer.customerKey());
            dimension.add(new DimCustomer(
                    surrogateKey++,
                    customer.customerId(),
                    customer.customerKey(),
                    customer.firstName(),
                    customer.lastName(),
                    location == null ? null : location.country(),
                    customer.maritalStatus(),
                    resolveGender(customer, erp),
                    erp == null ? null : erp.birthDate(),
                    customer.createDate()
            ));
        }
        return dimension;
    }

    // CRM is the primary source for gender, ERP only fills in unknowns
    String resolveGender(CanonicalCustomer customer, CanonicalErpCustomer erp) {
        if (!mappings.isNotAvailable(customer.gender())) {
            return customer.gender();
        }
        if (erp != null && erp.gender() != null) {
            return erp.gender();
        }
        return mappings.notAvailable();
    }

    List<DimProduct> buildProductDimension(List<CanonicalProduct> products, List<CanonicalErpCategory> categories) {
        Map<String, CanonicalErpCategory> categoryById = firstById(categories, CanonicalErpCategory::id);

        List<CanonicalProduct> active = new ArrayList<>();
        for (CanonicalProduct product : products) {
            if (product.isActive()) {
                active.add(product);
            }
        }
        active.sort(PRODUCT_ORDER);

        List<DimProduct> dimension = new ArrayList<>(active.size());
        long surrogateKey = 1;
        for (CanonicalProduct product : active) {
            CanonicalErpCategory category = categoryById.get(product.categoryId());
            dimension.add(new DimProduct(
                    surrogateKey++,
                    product.productId(),
                    product.productKey(),
                    product.productName(),
                    product.categoryId(),
                    category == null ? null : category.category(),
                    category == null ? null : category.subcategory(),
                    category == null ? null : category.maintenance(),
                    product.cost(),
                    product.productLine(),
                    product.startDate()
            ));
        }
        return dimension;
    }

    List<FactSalesLine> buildSalesFact(List<CanonicalSalesLine> salesLines,
                                       List<DimCustomer> customers,
                                       List<DimProduct> products) {
        Map<Integer, Long> customerKeys = new HashMap<>();
        for (DimCustomer customer : customers) {
            customerKeys.put(customer.customerId(), customer.customerKey());
        }
        Map<String, Long> productKeys = new HashMap<>();
        for (DimProduct product : products) {
            productKeys.putIfAbsent(product.productNumber(), product.productKey());
        }

        List<FactSalesLine> fact = new ArrayList<>(salesLines.size());
        int unresolved = 0;
        for (CanonicalSalesLine line : salesLines) {
            Long productKey = line.productKey() == null ? null : productKeys.get(line.productKey());
            Long customerKey = line.customerId() == null ? null : customerKeys.get(line.customerId());
            if (productKey == null || customerKey == null) {
                unresolved++;
            }
            fact.add(new FactSalesLine(
                    line.orderNumber(),
                    productKey,
                    customerKey,
                    line.orderDate(),
                    line.shipDate(),
                    line.dueDate(),
                    line.price(),
                    line.quantity(),
                    line.sales()
            ));
        }
        if (unresolved > 0) {
            log.warn("[gold] {} sales lines reference a product or customer missing from the dimensions", unresolved);
        }
        return fact;
    }

    private static <T> Map<String, T> firstById(List<T> records, Function<T, String> id) {
        Map<String, T> index = new HashMap<>();
        for (T record : records) {
            String key = id.apply(record);
            if (key != null) {
                index.putIfAbsent(key, record);
            }
        }
        return index;
    }
}
