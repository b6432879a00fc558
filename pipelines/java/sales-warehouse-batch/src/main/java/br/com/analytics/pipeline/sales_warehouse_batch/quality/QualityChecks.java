package br.com.analytics.pipeline.sales_warehouse_batch.quality;

import java.util.List;

public final class QualityChecks {

    private QualityChecks() {
    }

    public static List<QualityCheck> defaults() {
        return List.of(
                new QualityCheck("customer_id_unique", "silver.crm_cust_info",
                        "customer ids must be unique and not null",
                        "SELECT COUNT(*) FROM (SELECT cst_id FROM silver.crm_cust_info " +
                                "GROUP BY cst_id HAVING COUNT(*) > 1 OR cst_id IS NULL) t"),
                new QualityCheck("customer_key_trimmed", "silver.crm_cust_info",
                        "customer keys must not carry surrounding spaces",
                        "SELECT COUNT(*) FROM silver.crm_cust_info WHERE cst_key <> TRIM(cst_key)"),
                new QualityCheck("product_cost_valid", "silver.crm_prd_info",
                        "product cost must be present and not negative",
                        "SELECT COUNT(*) FROM silver.crm_prd_info WHERE prd_cost < 0 OR prd_cost IS NULL"),
                new QualityCheck("product_dates_ordered", "silver.crm_prd_info",
                        "product end date must not precede its start date",
                        "SELECT COUNT(*) FROM silver.crm_prd_info WHERE prd_end_dt < prd_start_dt"),
                new QualityCheck("product_single_open_version", "silver.crm_prd_info",
                        "every product key must have exactly one open version",
                        "SELECT COUNT(*) FROM (SELECT prd_key FROM silver.crm_prd_info GROUP BY prd_key " +
                                "HAVING SUM(CASE WHEN prd_end_dt IS NULL THEN 1 ELSE 0 END) <> 1) t"),
                new QualityCheck("sales_dates_ordered", "silver.crm_sales_details",
                        "order date must not be after ship or due date",
                        "SELECT COUNT(*) FROM silver.crm_sales_details " +
                                "WHERE sls_order_dt > sls_ship_dt OR sls_order_dt > sls_due_dt"),
                new QualityCheck("sales_arithmetic", "silver.crm_sales_details",
                        "sales must equal quantity * price with all three positive",
                        "SELECT COUNT(*) FROM silver.crm_sales_details " +
                                "WHERE sls_sales IS NULL OR sls_quantity IS NULL OR sls_price IS NULL " +
                                "OR sls_sales <= 0 OR sls_quantity <= 0 OR sls_price <= 0 " +
                                "OR sls_sales <> sls_quantity * sls_price"),
                new QualityCheck("birth_date_range", "silver.erp_cust_az12",
                        "birth dates must lie between 1924-01-01 and today",
                        "SELECT COUNT(*) FROM silver.erp_cust_az12 " +
                                "WHERE bdate < DATE '1924-01-01' OR bdate > CURRENT_DATE"),
                new QualityCheck("category_trimmed", "silver.erp_px_cat_g1v2",
                        "category attributes must not carry surrounding spaces",
                        "SELECT COUNT(*) FROM silver.erp_px_cat_g1v2 " +
                                "WHERE cat <> TRIM(cat) OR subcat <> TRIM(subcat) OR maintenance <> TRIM(maintenance)"),
                new QualityCheck("customer_key_unique", "gold.dim_customers",
                        "customer surrogate keys must be unique",
                        "SELECT COUNT(*) FROM (SELECT customer_key FROM gold.dim_customers " +
                                "GROUP BY customer_key HAVING COUNT(*) > 1) t"),
                new QualityCheck("product_key_unique", "gold.dim_products",
                        "product surrogate keys must be unique",
                        "SELECT COUNT(*) FROM (SELECT product_key FROM gold.dim_products " +
                                "GROUP BY product_key HAVING COUNT(*) > 1) t"),
                new QualityCheck("customer_key_dense", "gold.dim_customers",
                        "customer surrogate keys must run 1..N without gaps",
                        denseKeySql("gold.dim_customers", "customer_key")),
                new QualityCheck("product_key_dense", "gold.dim_products",
                        "product surrogate keys must run 1..N without gaps",
                        denseKeySql("gold.dim_products", "product_key")),
                new QualityCheck("fact_product_resolved", "gold.fact_sales",
                        "every sales line must reference an existing product",
                        "SELECT COUNT(*) FROM gold.fact_sales f " +
                                "LEFT JOIN gold.dim_products p ON p.product_key = f.product_key " +
                                "WHERE p.product_key IS NULL"),
                new QualityCheck("fact_customer_resolved", "gold.fact_sales",
                        "every sales line must reference an existing customer",
                        "SELECT COUNT(*) FROM gold.fact_sales f " +
                                "LEFT JOIN gold.dim_customers c ON c.customer_key = f.customer_key " +
                                "WHERE c.customer_key IS NULL")
        );
    }

    private static String denseKeySql(String table, String keyColumn) {
        return "SELECT CASE WHEN COUNT(*) = 0 THEN 0 " +
                "WHEN MIN(" + keyColumn + ") = 1 AND MAX(" + keyColumn + ") = COUNT(*) " +
                "AND COUNT(DISTINCT " + keyColumn + ") = COUNT(*) THEN 0 ELSE 1 END " +
                "FROM " + table;
    }
}
