package br.com.analytics.pipeline.sales_warehouse_batch.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import br.com.analytics.pipeline.sales_warehouse_batch.config.CodeMappings;
import br.com.analytics.pipeline.sales_warehouse_batch.dimension.DimensionalModeler;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.DimensionalSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.model.gold.FactSalesLine;
import br.com.analytics.pipeline.sales_warehouse_batch.model.silver.CanonicalSnapshot;
import br.com.analytics.pipeline.sales_warehouse_batch.processor.TransformationEngine;
import br.com.analytics.pipeline.sales_warehouse_batch.support.RawFixtures;
import br.com.analytics.pipeline.sales_warehouse_batch.support.WarehouseTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

class WarehouseSnapshotWriterTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private WarehouseTestDatabase database;
    private WarehouseSnapshotWriter writer;
    private CanonicalSnapshot canonical;
    private DimensionalSnapshot dimensional;

    @BeforeEach
    void setUp() {
        database = new WarehouseTestDatabase();
        writer = new WarehouseSnapshotWriter(database.dataSource(), database.transactionManager(), clock);
        canonical = TransformationEngine.create(CodeMappings.defaults(), 19000101, 20500101, clock, true)
                .transform(RawFixtures.snapshot());
        dimensional = new DimensionalModeler(CodeMappings.defaults()).model(canonical);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void publish_writesEverySilverAndGoldTable() {
        LocalDateTime publishedAt = writer.publish(canonical, dimensional);

        assertEquals(LocalDateTime.of(2026, 3, 1, 10, 0), publishedAt);
        assertEquals(2, database.count("silver.crm_cust_info"));
        assertEquals(3, database.count("silver.crm_prd_info"));
        assertEquals(3, database.count("silver.crm_sales_details"));
        assertEquals(2, database.count("silver.erp_cust_az12"));
        assertEquals(2, database.count("silver.erp_loc_a101"));
        assertEquals(2, database.count("silver.erp_px_cat_g1v2"));
        assertEquals(2, database.count("gold.dim_customers"));
        assertEquals(2, database.count("gold.dim_products"));
        assertEquals(3, database.count("gold.fact_sales"));

        Timestamp stamped = database.jdbc().queryForObject(
                "SELECT MAX(dwh_create_date) FROM silver.crm_prd_info", Timestamp.class);
        assertEquals(publishedAt, stamped.toLocalDateTime());
    }

    @Test
    void publish_twice_replacesPreviousSnapshot() {
        writer.publish(canonical, dimensional);
        writer.publish(canonical, dimensional);

        assertEquals(2, database.count("silver.crm_cust_info"));
        assertEquals(3, database.count("gold.fact_sales"));
    }

    @Test
    void publish_unresolvedFactKeys_areStoredAsNull() {
        writer.publish(canonical, dimensional);

        Long productKey = database.jdbc().queryForObject(
                "SELECT product_key FROM gold.fact_sales WHERE order_number = 'SO43699'", Long.class);
        assertNull(productKey);
    }

    @Test
    void publish_failureMidWay_leavesPreviousSnapshotInPlace() {
        writer.publish(canonical, dimensional);

        List<FactSalesLine> sales = new ArrayList<>(dimensional.sales());
        sales.add(new FactSalesLine("SO-" + "X".repeat(60), 1L, 1L, null, null, null, 10, 1, 10));
        DimensionalSnapshot broken = new DimensionalSnapshot(List.of(), List.of(), sales);
        CanonicalSnapshot emptied = new CanonicalSnapshot(
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

        assertThrows(DataAccessException.class, () -> writer.publish(emptied, broken));

        assertEquals(2, database.count("silver.crm_cust_info"));
        assertEquals(3, database.count("silver.crm_prd_info"));
        assertEquals(2, database.count("gold.dim_customers"));
        assertEquals(3, database.count("gold.fact_sales"));
    }
}
