package br.com.analytics.pipeline.sales_warehouse_batch.ingestion;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public enum RawSourceTable {

    CRM_CUSTOMERS("source_crm", "cust_info.csv", "bronze.crm_cust_info", List.of(
            new SourceColumn("cst_id", ColumnType.INTEGER),
            new SourceColumn("cst_key", ColumnType.TEXT),
            new SourceColumn("cst_firstname", ColumnType.TEXT),
            new SourceColumn("cst_lastname", ColumnType.TEXT),
            new SourceColumn("cst_marital_status", ColumnType.TEXT),
            new SourceColumn("cst_gndr", ColumnType.TEXT),
            new SourceColumn("cst_create_date", ColumnType.DATE))),

    CRM_PRODUCTS("source_crm", "prd_info.csv", "bronze.crm_prd_info", List.of(
            new SourceColumn("prd_id", ColumnType.INTEGER),
            new SourceColumn("prd_key", ColumnType.TEXT),
            new SourceColumn("prd_nm", ColumnType.TEXT),
            new SourceColumn("prd_cost", ColumnType.INTEGER),
            new SourceColumn("prd_line", ColumnType.TEXT),
            new SourceColumn("prd_start_dt", ColumnType.DATETIME),
            new SourceColumn("prd_end_dt", ColumnType.DATETIME))),

    CRM_SALES("source_crm", "sales_details.csv", "bronze.crm_sales_details", List.of(
            new SourceColumn("sls_ord_num", ColumnType.TEXT),
            new SourceColumn("sls_prd_key", ColumnType.TEXT),
            new SourceColumn("sls_cust_id", ColumnType.INTEGER),
            new SourceColumn("sls_order_dt", ColumnType.INTEGER),
            new SourceColumn("sls_ship_dt", ColumnType.INTEGER),
            new SourceColumn("sls_due_dt", ColumnType.INTEGER),
            new SourceColumn("sls_sales", ColumnType.INTEGER),
            new SourceColumn("sls_quantity", ColumnType.INTEGER),
            new SourceColumn("sls_price", ColumnType.INTEGER))),

    ERP_CUSTOMERS("source_erp", "CUST_AZ12.csv", "bronze.erp_cust_az12", List.of(
            new SourceColumn("cid", ColumnType.TEXT),
            new SourceColumn("bdate", ColumnType.DATE),
            new SourceColumn("gen", ColumnType.TEXT))),

    ERP_LOCATIONS("source_erp", "LOC_A101.csv", "bronze.erp_loc_a101", List.of(
            new SourceColumn("cid", ColumnType.TEXT),
            new SourceColumn("country", ColumnType.TEXT))),

    ERP_CATEGORIES("source_erp", "PX_CAT_G1V2.csv", "bronze.erp_px_cat_g1v2", List.of(
            new SourceColumn("id", ColumnType.TEXT),
            new SourceColumn("cat", ColumnType.TEXT),
            new SourceColumn("subcat", ColumnType.TEXT),
            new SourceColumn("maintenance", ColumnType.TEXT)));

    private final String directory;
    private final String fileName;
    private final String tableName;
    private final List<SourceColumn> columns;

    RawSourceTable(String directory, String fileName, String tableName, List<SourceColumn> columns) {
        this.directory = directory;
        this.fileName = fileName;
        this.tableName = tableName;
        this.columns = columns;
    }

    public String tableName() {
        return tableName;
    }

    public List<SourceColumn> columns() {
        return columns;
    }

    public Path resolve(Path sourceRoot) {
        return sourceRoot.resolve(directory).resolve(fileName);
    }

    String insertSql() {
        String names = columns.stream().map(SourceColumn::name).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(column -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + tableName + " (" + names + ") VALUES (" + placeholders + ")";
    }

    public record SourceColumn(String name, ColumnType type) {
    }
}
