package br.com.analytics.pipeline.sales_warehouse_batch.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.SqlTypeValue;
import org.springframework.jdbc.core.StatementCreatorUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class BronzeTableLoader {

    private static final int BATCH_SIZE = 1000;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public BronzeTableLoader(DataSource dataSource, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public Map<RawSourceTable, Integer> replaceAll(Map<RawSourceTable, List<Object[]>> rowsByTable) {
        Map<RawSourceTable, Integer> counts = new EnumMap<>(RawSourceTable.class);
        transactionTemplate.executeWithoutResult(status -> rowsByTable.forEach((source, rows) -> {
            jdbcTemplate.update("DELETE FROM " + source.tableName());
            jdbcTemplate.batchUpdate(source.insertSql(), rows, BATCH_SIZE, (ps, row) -> {
                for (int i = 0; i < row.length; i++) {
                    StatementCreatorUtils.setParameterValue(ps, i + 1, SqlTypeValue.TYPE_UNKNOWN, row[i]);
                }
            });
            counts.put(source, rows.size());
            log.info("[bronze] {}: {} records loaded", source.tableName(), rows.size());
        }));
        return counts;
    }
}
