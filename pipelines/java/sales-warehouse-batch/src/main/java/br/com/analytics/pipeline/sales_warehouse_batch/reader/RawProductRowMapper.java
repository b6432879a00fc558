package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawProduct;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

public class RawProductRowMapper implements RowMapper<RawProduct> {

    @Override
    public RawProduct mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RawProduct(
                resultSet.getObject("prd_id", Integer.class),
                resultSet.getString("prd_key"),
                resultSet.getString("prd_nm"),
                resultSet.getObject("prd_cost", Integer.class),
                resultSet.getString("prd_line"),
                resultSet.getObject("prd_start_dt", LocalDateTime.class),
                resultSet.getObject("prd_end_dt", LocalDateTime.class)
        );
    }
}
