package br.com.analytics.pipeline.sales_warehouse_batch.quality;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class QualityVerifier {

    private final JdbcTemplate jdbcTemplate;
    private final List<QualityCheck> checks;

    public QualityVerifier(DataSource dataSource, List<QualityCheck> checks) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.checks = List.copyOf(checks);
    }

    public QualityReport verify() {
        List<ConsistencyViolation> violations = new ArrayList<>();
        for (QualityCheck check : checks) {
            Long count = jdbcTemplate.queryForObject(check.countSql(), Long.class);
            if (count != null && count > 0) {
                ConsistencyViolation violation =
                        new ConsistencyViolation(check.name(), check.table(), count, check.description());
                violations.add(violation);
                log.warn("[quality] {} failed on {}: {} ({} offending rows)",
                        check.name(), check.table(), check.description(), count);
            } else {
                log.debug("[quality] {} passed", check.name());
            }
        }

        QualityReport report = new QualityReport(checks.size(), List.copyOf(violations));
        log.info("[quality] {} checks run, {} violations", report.checksRun(), report.violations().size());
        return report;
    }
}
