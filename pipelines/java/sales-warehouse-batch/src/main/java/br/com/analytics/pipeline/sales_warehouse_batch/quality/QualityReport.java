package br.com.analytics.pipeline.sales_warehouse_batch.quality;

import java.util.List;

public record QualityReport(
        int checksRun,
        List<ConsistencyViolation> violations
) {

    public boolean isClean() {
        return violations.isEmpty();
    }
}
