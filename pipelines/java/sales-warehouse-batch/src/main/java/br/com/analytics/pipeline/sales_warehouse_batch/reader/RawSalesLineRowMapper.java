package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawSalesLine;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class RawSalesLineRowMapper implements RowMapper<RawSalesLine> {

    @Override
    public RawSalesLine mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RawSalesLine(
                resultSet.getString("sls_ord_num"),
                resultSet.getString("sls_prd_key"),
                resultSet.getObject("sls_cust_id", Integer.class),
                resultSet.getObject("sls_order_dt", Integer.class),
                resultSet.getObject("sls_ship_dt", Integer.class),
                resultSet.getObject("sls_due_dt", Integer.class),
                resultSet.getObject("sls_sales", Integer.class),
                resultSet.getObject("sls_quantity", Integer.class),
                resultSet.getObject("sls_price", Integer.class)
        );
    }
}
