package br.com.analytics.pipeline.sales_warehouse_batch.reader;

import br.com.analytics.pipeline.sales_warehouse_batch.model.bronze.RawErpCategory;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class RawErpCategoryRowMapper implements RowMapper<RawErpCategory> {

    @Override
    public RawErpCategory mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new RawErpCategory(
                resultSet.getString("id"),
                resultSet.getString("cat"),
                resultSet.getString("subcat"),
                resultSet.getString("maintenance")
        );
    }
}
