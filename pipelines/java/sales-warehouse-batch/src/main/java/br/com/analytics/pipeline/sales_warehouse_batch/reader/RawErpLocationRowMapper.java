package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpLocation;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class RawErpLocationRowMapper implements RowMapper<RawErpLocation> {

    @Override
    public RawErpLocation mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RawErpLocation(
                resultSet.getString("cid"),
                resultSet.getString("country")
        );
    }
}
