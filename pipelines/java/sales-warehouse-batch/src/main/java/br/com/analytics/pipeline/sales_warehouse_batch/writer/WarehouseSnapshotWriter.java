package br.com.analytics.pipeline.sales_warehouse_batch.writer;

import br.com.analytics.pipeline.sales_warehouse_batch.exception.WarehousePipelineException;
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
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.database.ItemSqlParameterSourceProvider;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Replaces the silver and gold tables with a freshly built snapshot.
 *
 * <p>
 * All nine tables are cleared and refilled inside a single transaction: either every table shows
 * the new snapshot or, after a failure, every table still shows the previous one. Rows are removed
 * with {@code DELETE} rather than {@code TRUNCATE} because some databases commit on truncate.
 * </p>
 */
@Slf4j
public class WarehouseSnapshotWriter {

    static final List<String> PUBLISHED_TABLES = List.of(
            "gold.fact_sales",
            "gold.dim_products",
            "gold.dim_customers",
            "silver.crm_cust_info",
            "silver.crm_prd_info",
            "silver.crm_sales_details",
            "silver.erp_cust_az12",
            "silver.erp_loc_a101",
            "silver.erp_px_cat_g1v2"
    );

    private static final String SQL_INSERT_CUSTOMER =
            "INSERT INTO silver.crm_cust_info (cst_id, cst_key, cst_firstname, cst_lastname, " +
                    "cst_marital_status, cst_gndr, cst_create_date, dwh_create_date) " +
                    "VALUES (:customerId, :customerKey, :firstName, :lastName, :maritalStatus, :gender, " +
                    ":createDate, :dwhCreateDate)";

    private static final String SQL_INSERT_PRODUCT =
            "INSERT INTO silver.crm_prd_info (prd_id, cat_id, prd_key, prd_nm, prd_cost, prd_line, " +
                    "prd_start_dt, prd_end_dt, dwh_create_date) " +
                    "VALUES (:productId, :categoryId, :productKey, :productName, :cost, :productLine, " +
                    ":startDate, :endDate, :dwhCreateDate)";

    private static final String SQL_INSERT_SALES =
            "INSERT INTO silver.crm_sales_details (sls_ord_num, sls_prd_key, sls_cust_id, sls_order_dt, " +
                    "sls_ship_dt, sls_due_dt, sls_sales, sls_quantity, sls_price, dwh_create_date) " +
                    "VALUES (:orderNumber, :productKey, :customerId, :orderDate, :shipDate, :dueDate, " +
                    ":sales, :quantity, :price, :dwhCreateDate)";

    private static final String SQL_INSERT_ERP_CUSTOMER =
            "INSERT INTO silver.erp_cust_az12 (cid, bdate, gen, dwh_create_date) " +
                    "VALUES (:customerId, :birthDate, :gender, :dwhCreateDate)";

    private static final String SQL_INSERT_ERP_LOCATION =
            "INSERT INTO silver.erp_loc_a101 (cid, country, dwh_create_date) " +
                    "VALUES (:customerId, :country, :dwhCreateDate)";

    private static final String SQL_INSERT_ERP_CATEGORY =
            "INSERT INTO silver.erp_px_cat_g1v2 (id, cat, subcat, maintenance, dwh_create_date) " +
                    "VALUES (:id, :category, :subcategory, :maintenance, :dwhCreateDate)";

    private static final String SQL_INSERT_DIM_CUSTOMER =
            "INSERT INTO gold.dim_customers (customer_key, customer_id, customer_number, first_name, last_name, " +
                    "country, marital_status, gender, birth_date, create_date) " +
                    "VALUES (:customerKey, :customerId, :customerNumber, :firstName, :lastName, :country, " +
                    ":maritalStatus, :gender, :birthDate, :createDate)";

    private static final String SQL_INSERT_DIM_PRODUCT =
            "INSERT INTO gold.dim_products (product_key, product_id, product_number, product_name, category_id, " +
                    "category, subcategory, maintenance, cost, product_line, start_date) " +
                    "VALUES (:productKey, :productId, :productNumber, :productName, :categoryId, :category, " +
                    ":subcategory, :maintenance, :cost, :productLine, :startDate)";

    private static final String SQL_INSERT_FACT_SALES =
            "INSERT INTO gold.fact_sales (order_number, product_key, customer_key, order_date, shipping_date, " +
                    "due_date, price, quantity, sales_amount) " +
                    "VALUES (:orderNumber, :productKey, :customerKey, :orderDate, :shippingDate, :dueDate, " +
                    ":price, :quantity, :salesAmount)";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public WarehouseSnapshotWriter(DataSource dataSource, PlatformTransactionManager transactionManager, Clock clock) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public LocalDateTime publish(CanonicalSnapshot canonical, DimensionalSnapshot dimensional) {
        LocalDateTime publishedAt = LocalDateTime.now(clock);

        transactionTemplate.executeWithoutResult(status -> {
            for (String table : PUBLISHED_TABLES) {
                int removed = jdbcTemplate.update("DELETE FROM " + table);
                log.debug("Cleared {} rows from {}", removed, table);
            }

            write("silver.crm_cust_info", SQL_INSERT_CUSTOMER, canonical.customers(),
                    customer -> customerParameters(customer).addValue("dwhCreateDate", publishedAt));
            write("silver.crm_prd_info", SQL_INSERT_PRODUCT, canonical.products(),
                    product -> productParameters(product).addValue("dwhCreateDate", publishedAt));
            write("silver.crm_sales_details", SQL_INSERT_SALES, canonical.salesLines(),
                    line -> salesParameters(line).addValue("dwhCreateDate", publishedAt));
            write("silver.erp_cust_az12", SQL_INSERT_ERP_CUSTOMER, canonical.erpCustomers(),
                    customer -> erpCustomerParameters(customer).addValue("dwhCreateDate", publishedAt));
            write("silver.erp_loc_a101", SQL_INSERT_ERP_LOCATION, canonical.erpLocations(),
                    location -> erpLocationParameters(location).addValue("dwhCreateDate", publishedAt));
            write("silver.erp_px_cat_g1v2", SQL_INSERT_ERP_CATEGORY, canonical.erpCategories(),
                    category -> erpCategoryParameters(category).addValue("dwhCreateDate", publishedAt));

            write("gold.dim_customers", SQL_INSERT_DIM_CUSTOMER, dimensional.customers(),
                    WarehouseSnapshotWriter::dimCustomerParameters);
            write("gold.dim_products", SQL_INSERT_DIM_PRODUCT, dimensional.products(),
                    WarehouseSnapshotWriter::dimProductParameters);
            write("gold.fact_sales", SQL_INSERT_FACT_SALES, dimensional.sales(),
                    WarehouseSnapshotWriter::factSalesParameters);
        });

        log.info("[publish] Snapshot published at {}", publishedAt);
        return publishedAt;
    }

    private <T> void write(String table, String sql, List<T> items, ItemSqlParameterSourceProvider<T> parameters) {
        JdbcBatchItemWriter<T> delegateWriter = new JdbcBatchItemWriterBuilder<T>()
                .itemSqlParameterSourceProvider(parameters)
                .sql(sql)
                .dataSource(dataSource)
                .build();
        try {
            delegateWriter.afterPropertiesSet();
            delegateWriter.write(new Chunk<>(items));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new WarehousePipelineException(table, "Failed to write " + table + ": " + e.getMessage(), e);
        }
        log.info("[publish] {}: {} rows written", table, items.size());
    }

    private static MapSqlParameterSource customerParameters(CanonicalCustomer customer) {
        return new MapSqlParameterSource()
                .addValue("customerId", customer.customerId())
                .addValue("customerKey", customer.customerKey())
                .addValue("firstName", customer.firstName())
                .addValue("lastName", customer.lastName())
                .addValue("maritalStatus", customer.maritalStatus())
                .addValue("gender", customer.gender())
                .addValue("createDate", customer.createDate());
    }

    private static MapSqlParameterSource productParameters(CanonicalProduct product) {
        return new MapSqlParameterSource()
                .addValue("productId", product.productId())
                .addValue("categoryId", product.categoryId())
                .addValue("productKey", product.productKey())
                .addValue("productName", product.productName())
                .addValue("cost", product.cost())
                .addValue("productLine", product.productLine())
                .addValue("startDate", product.startDate())
                .addValue("endDate", product.endDate());
    }

    private static MapSqlParameterSource salesParameters(CanonicalSalesLine line) {
        return new MapSqlParameterSource()
                .addValue("orderNumber", line.orderNumber())
                .addValue("productKey", line.productKey())
                .addValue("customerId", line.customerId())
                .addValue("orderDate", line.orderDate())
                .addValue("shipDate", line.shipDate())
                .addValue("dueDate", line.dueDate())
                .addValue("sales", line.sales())
                .addValue("quantity", line.quantity())
                .addValue("price", line.price());
    }

    private static MapSqlParameterSource erpCustomerParameters(CanonicalErpCustomer customer) {
        return new MapSqlParameterSource()
                .addValue("customerId", customer.customerId())
                .addValue("birthDate", customer.birthDate())
                .addValue("gender", customer.gender());
    }

    private static MapSqlParameterSource erpLocationParameters(CanonicalErpLocation location) {
        return new MapSqlParameterSource()
                .addValue("customerId", location.customerId())
                .addValue("country", location.country());
    }

    private static MapSqlParameterSource erpCategoryParameters(CanonicalErpCategory category) {
        return new MapSqlParameterSource()
                .addValue("id", category.id())
                .addValue("category", category.category())
                .addValue("subcategory", category.subcategory())
                .addValue("maintenance", category.maintenance());
    }

    private static MapSqlParameterSource dimCustomerParameters(DimCustomer customer) {
        return new MapSqlParameterSource()
                .addValue("customerKey", customer.customerKey())
                .addValue("customerId", customer.customerId())
                .addValue("customerNumber", customer.customerNumber())
                .addValue("firstName", customer.firstName())
                .addValue("lastName", customer.lastName())
                .addValue("country", customer.country())
                .addValue("maritalStatus", customer.maritalStatus())
                .addValue("gender", customer.gender())
                .addValue("birthDate", customer.birthDate())
                .addValue("createDate", customer.createDate());
    }

    private static MapSqlParameterSource dimProductParameters(DimProduct product) {
        return new MapSqlParameterSource()
                .addValue("productKey", product.productKey())
                .addValue("productId", product.productId())
                .addValue("productNumber", product.productNumber())
                .addValue("productName", product.productName())
                .addValue("categoryId", product.categoryId())
                .addValue("category", product.category())
                .addValue("subcategory", product.subcategory())
                .addValue("maintenance", product.maintenance())
                .addValue("cost", product.cost())
                .addValue("productLine", product.productLine())
                .addValue("startDate", product.startDate());
    }

    private static MapSqlParameterSource factSalesParameters(FactSalesLine line) {
        return new MapSqlParameterSource()
                .addValue("orderNumber", line.orderNumber())
                .addValue("productKey", line.productKey())
                .addValue("customerKey", line.customerKey())
                .addValue("orderDate", line.orderDate())
                .addValue("shippingDate", line.shippingDate())
                .addValue("dueDate", line.dueDate())
                .addValue("price", line.price())
                .addValue("quantity", line.quantity())
                .addValue("salesAmount", line.salesAmount());
    }
}
