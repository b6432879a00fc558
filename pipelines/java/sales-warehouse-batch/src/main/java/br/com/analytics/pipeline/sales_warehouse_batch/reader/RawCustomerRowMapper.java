package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawCustomer;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

public class RawCustomerRowMapper implements RowMapper<RawCustomer> {

    @Override
    public RawCustomer mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RawCustomer(
                resultSet.getObject("cst_id", Integer.class),
                resultSet.getString("cst_key"),
                resultSet.getString("cst_firstname"),
                resultSet.getString("cst_lastname"),
                resultSet.getString("cst_marital_status"),
                resultSet.getString("cst_gndr"),
                resultSet.getObject("cst_create_date", LocalDate.class)
        );
    }
}
