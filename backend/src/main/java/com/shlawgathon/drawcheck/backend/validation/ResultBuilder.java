package com.shlawgathon.drawcheck.backend.validation;

import com.shlawgathon.drawcheck.backend.model.CheckOutcome;
import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import com.shlawgathon.drawcheck.backend.model.PhaseSummary;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates checks for one domain. A check's outcome follows from the worst
 * issue it raised: error or critical fails it, warning counts as a warning,
 * info or nothing passes it.
 */
public class ResultBuilder {

    private final ValidationDomain domain;
    private final List<ValidationIssue> issues = new ArrayList<>();
    private final List<PhaseSummary> phases = new ArrayList<>();
    private int passed;
    private int failed;
    private int warnings;

    public ResultBuilder(ValidationDomain domain) {
        this.domain = domain;
    }

    public static CheckOutcome outcomeOf(List<ValidationIssue> checkIssues) {
        Severity worst = null;
        for (ValidationIssue issue : checkIssues) {
            if (worst == null || issue.getSeverity().isAtLeast(worst)) {
                worst = issue.getSeverity();
            }
        }
        if (worst == null || worst == Severity.INFO) {
            return CheckOutcome.PASSED;
        }
        return worst == Severity.WARNING ? CheckOutcome.WARNING : CheckOutcome.FAILED;
    }

    /**
     * Record one check with the issues it produced.
     */
    public CheckOutcome check(List<ValidationIssue> checkIssues) {
        CheckOutcome outcome = outcomeOf(checkIssues);
        count(outcome);
        issues.addAll(checkIssues);
        return outcome;
    }

    public CheckOutcome check(ValidationIssue... checkIssues) {
        return check(List.of(checkIssues));
    }

    public void pass() {
        passed++;
    }

    public void count(CheckOutcome outcome) {
        switch (outcome) {
            case PASSED -> passed++;
            case FAILED -> failed++;
            case WARNING -> warnings++;
            case NOT_APPLICABLE -> {
            }
        }
    }

    /**
     * Add an issue that does not belong to a counted check.
     */
    public void note(ValidationIssue issue) {
        issues.add(issue);
    }

    /**
     * A required input is missing: counted as a warning check.
     */
    public void insufficientData(String checkType, String message, IssueLocation location) {
        check(issue(Severity.WARNING, checkType, "Insufficient data: " + message, location,
                "Provide the missing value on the drawing or as a request parameter", null));
    }

    /**
     * Nothing to evaluate at all: an uncounted info note.
     */
    public void nothingToCheck(String checkType, String message) {
        note(issue(Severity.INFO, checkType, "Insufficient data: " + message, null, null, null));
    }

    public void noteIncomplete(ExtractedDrawingData data) {
        if (data.isIncomplete()) {
            note(issue(Severity.INFO, "extraction.incomplete",
                    "Drawing extraction was incomplete (missing pages " + data.getMissingPages()
                            + "); " + domain.key() + " findings may be partial",
                    null, "Re-run with a readable copy of the missing pages", null));
        }
    }

    public void phase(PhaseSummary summary) {
        phases.add(summary);
    }

    public ValidationResult build() {
        return ValidationResult.builder()
                .domain(domain.key())
                .totalChecks(passed + failed + warnings)
                .passed(passed)
                .failed(failed)
                .warnings(warnings)
                .issues(issues)
                .phases(phases)
                .build();
    }

    public static ValidationIssue issue(Severity severity, String checkType, String message,
            IssueLocation location, String suggestion, String standardReference) {
        return ValidationIssue.builder()
                .severity(severity)
                .checkType(checkType)
                .message(message)
                .location(location)
                .suggestion(suggestion)
                .standardReference(standardReference)
                .build();
    }
}
