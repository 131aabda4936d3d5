package com.shlawgathon.drawcheck.backend.orchestration;

import com.shlawgathon.drawcheck.backend.model.AggregateMetrics;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;

import java.util.Collection;

/**
 * Sums per-domain results. Order of the inputs does not matter.
 */
public final class ReportAggregator {

    private ReportAggregator() {
    }

    public static AggregateMetrics aggregate(Collection<ValidationResult> results) {
        int total = 0;
        int passed = 0;
        int failed = 0;
        int warnings = 0;
        int critical = 0;
        for (ValidationResult result : results) {
            total += result.getTotalChecks();
            passed += result.getPassed();
            failed += result.getFailed();
            warnings += result.getWarnings();
            critical += result.countIssues(Severity.CRITICAL);
        }
        return AggregateMetrics.builder()
                .totalChecks(total)
                .passed(passed)
                .failed(failed)
                .warnings(warnings)
                .criticalFailures(critical)
                .passRate(total == 0 ? 0.0 : passed * 100.0 / total)
                .build();
    }
}
