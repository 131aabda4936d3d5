package com.shlawgathon.drawcheck.backend.validation.checklist;

import com.shlawgathon.drawcheck.backend.model.CheckOutcome;
import com.shlawgathon.drawcheck.backend.model.PhaseSummary;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.validation.DrawingValidator;
import com.shlawgathon.drawcheck.backend.validation.ResultBuilder;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.shlawgathon.drawcheck.backend.validation.ResultBuilder.issue;

/**
 * Runs the phased equipment review checklist and reports per-phase totals.
 */
public class EquipmentChecklistValidator implements DrawingValidator {

    static final String CHECK_ACCEPTANCE = "checklist.acceptance";
    static final double ACCEPTANCE_PASS_RATE = 90.0;

    private final List<ChecklistItem> items;

    public EquipmentChecklistValidator() {
        this(Api661Checklist.items());
    }

    public EquipmentChecklistValidator(List<ChecklistItem> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public ValidationDomain domain() {
        return ValidationDomain.EQUIPMENT_CHECKLIST;
    }

    @Override
    public ValidationResult validate(ExtractedDrawingData data, StandardsStore standards, ValidationParams params) {
        ResultBuilder result = new ResultBuilder(domain());
        result.noteIncomplete(data);
        ChecklistContext context = new ChecklistContext(data, standards, params);

        Map<ChecklistPhase, PhaseTally> tallies = new EnumMap<>(ChecklistPhase.class);
        int criticalFailures = 0;
        for (ChecklistItem item : items) {
            ItemResult outcome = item.evaluate(context);
            List<ValidationIssue> issues = issuesFor(item, outcome);
            CheckOutcome counted;
            if (outcome.status() == ItemResult.Status.NOT_APPLICABLE) {
                counted = CheckOutcome.NOT_APPLICABLE;
            } else {
                counted = result.check(issues);
            }
            if (outcome.status() == ItemResult.Status.FAIL && item.isCritical()) {
                criticalFailures++;
            }
            tallies.computeIfAbsent(item.phase(), p -> new PhaseTally()).add(counted);
        }

        PhaseTally overall = new PhaseTally();
        for (ChecklistPhase phase : ChecklistPhase.values()) {
            PhaseTally tally = tallies.get(phase);
            if (tally == null) {
                continue;
            }
            result.phase(tally.summary(phase.title()));
            overall.addAll(tally);
        }

        double passRate = overall.passRate();
        if (passRate < ACCEPTANCE_PASS_RATE || criticalFailures > 0) {
            result.note(issue(Severity.WARNING, CHECK_ACCEPTANCE,
                    String.format(Locale.ROOT, "Checklist not acceptable: pass rate %.1f%% (%d critical failure%s)",
                            passRate, criticalFailures, criticalFailures == 1 ? "" : "s"),
                    null, criticalFailures > 0
                            ? "Resolve critical failures before fabrication"
                            : "Review and address failed checklist items",
                    "API 661"));
        } else {
            result.note(issue(Severity.INFO, CHECK_ACCEPTANCE,
                    String.format(Locale.ROOT, "Checklist acceptable: pass rate %.1f%%", passRate),
                    null, null, "API 661"));
        }
        return result.build();
    }

    private static List<ValidationIssue> issuesFor(ChecklistItem item, ItemResult outcome) {
        List<ValidationIssue> issues = new ArrayList<>();
        String checkType = "checklist." + item.id();
        String message = item.id() + " " + item.description() + ": " + outcome.message();
        switch (outcome.status()) {
            case FAIL -> issues.add(issue(item.isCritical() ? Severity.CRITICAL : Severity.ERROR, checkType,
                    message, null, null, item.reference()));
            case WARN -> issues.add(issue(Severity.WARNING, checkType, message, null, null, item.reference()));
            case MISSING_REQUIRED -> issues.add(issue(Severity.WARNING, checkType,
                    "Insufficient data: " + message, null,
                    "Provide the value on the drawing or as a request parameter", item.reference()));
            case PASS, NOT_APPLICABLE -> {
            }
        }
        return issues;
    }

    private static final class PhaseTally {
        int total;
        int passed;
        int failed;
        int warnings;
        int notApplicable;

        void add(CheckOutcome outcome) {
            total++;
            switch (outcome) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case WARNING -> warnings++;
                case NOT_APPLICABLE -> notApplicable++;
            }
        }

        void addAll(PhaseTally other) {
            total += other.total;
            passed += other.passed;
            failed += other.failed;
            warnings += other.warnings;
            notApplicable += other.notApplicable;
        }

        double passRate() {
            int counted = passed + failed + warnings;
            return counted == 0 ? 0.0 : passed * 100.0 / counted;
        }

        PhaseSummary summary(String phase) {
            return PhaseSummary.builder()
                    .phase(phase)
                    .total(total)
                    .passed(passed)
                    .failed(failed)
                    .warnings(warnings)
                    .notApplicable(notApplicable)
                    .passRate(passRate())
                    .build();
        }
    }
}
