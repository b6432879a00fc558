package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCustomer;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

public class RawErpCustomerRowMapper implements RowMapper<RawErpCustomer> {

    @Override
    public RawErpCustomer mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RawErpCustomer(
                resultSet.getString("cid"),
                resultSet.getObject("bdate", LocalDate.class),
                resultSet.getString("gen")
        );
    }
}
