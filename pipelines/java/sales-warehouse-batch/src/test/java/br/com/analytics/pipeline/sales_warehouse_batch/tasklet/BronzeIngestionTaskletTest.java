package br.com.analytics.pipeline.sales_warehouse_batch.tasklet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import br.com.analytics.pipeline.sales_warehouse_batch.exception.IngestionException;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.BronzeTableLoader;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.DelimitedSourceReader;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.RawSourceTable;
import br.com.analytics.pipeline.sales_warehouse_batch.support.WarehouseTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class BronzeIngestionTaskletTest {

    @TempDir
    Path sourceRoot;

    private WarehouseTestDatabase database;
    private BronzeIngestionTasklet tasklet;

    @BeforeEach
    void setUp() {
        database = new WarehouseTestDatabase();
        tasklet = new BronzeIngestionTasklet(
                new DelimitedSourceReader(",", StandardCharsets.UTF_8, true),
                new BronzeTableLoader(database.dataSource(), database.transactionManager()),
                sourceRoot);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void execute_loadsEverySourceFile() throws Exception {
        writeAllSources();

        tasklet.execute(null, null);

        assertEquals(2, database.count("bronze.crm_cust_info"));
        assertEquals(1, database.count("bronze.crm_prd_info"));
        assertEquals(1, database.count("bronze.crm_sales_details"));
        assertEquals(1, database.count("bronze.erp_cust_az12"));
        assertEquals(1, database.count("bronze.erp_loc_a101"));
        assertEquals(1, database.count("bronze.erp_px_cat_g1v2"));
        assertEquals("Jon ", database.jdbc().queryForObject(
                "SELECT cst_firstname FROM bronze.crm_cust_info WHERE cst_id = 11000", String.class));
    }

    @Test
    void execute_missingFile_keepsPreviousBronzeContent() throws Exception {
        writeAllSources();
        tasklet.execute(null, null);
        Files.delete(RawSourceTable.ERP_LOCATIONS.resolve(sourceRoot));
        write(RawSourceTable.CRM_CUSTOMERS,
                "cst_id,cst_key,cst_firstname,cst_lastname,cst_marital_status,cst_gndr,cst_create_date");

        assertThrows(IngestionException.class, () -> tasklet.execute(null, null));

        assertEquals(2, database.count("bronze.crm_cust_info"));
    }

    private void writeAllSources() throws IOException {
        write(RawSourceTable.CRM_CUSTOMERS,
                "cst_id,cst_key,cst_firstname,cst_lastname,cst_marital_status,cst_gndr,cst_create_date",
                "11000,AW00011000,Jon ,Yang,M,M,2025-10-06",
                "11001,AW00011001,Eugene,Huang,S,,2025-10-06");
        write(RawSourceTable.CRM_PRODUCTS,
                "prd_id,prd_key,prd_nm,prd_cost,prd_line,prd_start_dt,prd_end_dt",
                "210,CO-RF-FR-R92B-58,HL Road Frame - Black- 58,,R ,2003-07-01,");
        write(RawSourceTable.CRM_SALES,
                "sls_ord_num,sls_prd_key,sls_cust_id,sls_order_dt,sls_ship_dt,sls_due_dt,sls_sales,sls_quantity,sls_price",
                "SO43697,FR-R92B-58,11000,20101229,20110105,20110110,3578,1,3578");
        write(RawSourceTable.ERP_CUSTOMERS, "CID,BDATE,GEN", "NASAW00011000,1971-10-06,Male");
        write(RawSourceTable.ERP_LOCATIONS, "CID,CNTRY", "AW-00011000,Australia");
        write(RawSourceTable.ERP_CATEGORIES, "ID,CAT,SUBCAT,MAINTENANCE", "CO_RF,Components,Road Frames,No");
    }

    private void write(RawSourceTable source, String... lines) throws IOException {
        Path file = source.resolve(sourceRoot);
        Files.createDirectories(file.getParent());
        Files.write(file, List.of(lines), StandardCharsets.UTF_8);
    }
}
