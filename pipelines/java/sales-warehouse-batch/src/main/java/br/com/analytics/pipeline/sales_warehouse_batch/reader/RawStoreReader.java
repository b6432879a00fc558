package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@Slf4j
public class RawStoreReader {

    // Stable ordering: the dimensional joins keep the first ERP row per id
    private static final String SQL_CUSTOMERS =
            "SELECT cst_id, cst_key, cst_firstname, cst_lastname, cst_marital_status, cst_gndr, cst_create_date " +
                    "FROM bronze.crm_cust_info " +
                    "ORDER BY cst_id, cst_create_date, cst_key";

    private static final String SQL_PRODUCTS =
            "SELECT prd_id, prd_key, prd_nm, prd_cost, prd_line, prd_start_dt, prd_end_dt " +
                    "FROM bronze.crm_prd_info " +
                    "ORDER BY prd_key, prd_start_dt, prd_id";

    private static final String SQL_SALES =
            "SELECT sls_ord_num, sls_prd_key, sls_cust_id, sls_order_dt, sls_ship_dt, sls_due_dt, " +
                    "sls_sales, sls_quantity, sls_price " +
                    "FROM bronze.crm_sales_details " +
                    "ORDER BY sls_ord_num, sls_prd_key, sls_cust_id";

    private static final String SQL_ERP_CUSTOMERS =
            "SELECT cid, bdate, gen FROM bronze.erp_cust_az12 ORDER BY cid, bdate, gen";

    private static final String SQL_ERP_LOCATIONS =
            "SELECT cid, country FROM bronze.erp_loc_a101 ORDER BY cid, country";

    private static final String SQL_ERP_CATEGORIES =
            "SELECT id, cat, subcat, maintenance FROM bronze.erp_px_cat_g1v2 ORDER BY id, cat, subcat";

    private final JdbcTemplate jdbcTemplate;

    public RawStoreReader(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public RawSnapshot readSnapshot() {
        RawSnapshot snapshot = new RawSnapshot(
                jdbcTemplate.query(SQL_CUSTOMERS, new RawCustomerRowMapper()),
                jdbcTemplate.query(SQL_PRODUCTS, new RawProductRowMapper()),
                jdbcTemplate.query(SQL_SALES, new RawSalesLineRowMapper()),
                jdbcTemplate.query(SQL_ERP_CUSTOMERS, new RawErpCustomerRowMapper()),
                jdbcTemplate.query(SQL_ERP_LOCATIONS, new RawErpLocationRowMapper()),
                jdbcTemplate.query(SQL_ERP_CATEGORIES, new RawErpCategoryRowMapper())
        );

        log.info("[bronze] Read raw snapshot: {} customers, {} products, {} sales lines, " +
                        "{} ERP customers, {} ERP locations, {} ERP categories",
                snapshot.customers().size(), snapshot.products().size(), snapshot.salesLines().size(),
                snapshot.erpCustomers().size(), snapshot.erpLocations().size(), snapshot.erpCategories().size());
        return snapshot;
    }
}
