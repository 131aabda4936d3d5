package com.shlawgathon.drawcheck.backend.validation.checklist;

import com.shlawgathon.drawcheck.backend.model.PhaseSummary;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.DesignData;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.standards.TestStandards;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.shlawgathon.drawcheck.backend.validation.DrawingFixtures.drawing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EquipmentChecklistValidatorTest {

    private static Optional<ValidationIssue> issue(ValidationResult result, String checkType) {
        return result.getIssues().stream().filter(i -> i.getCheckType().equals(checkType)).findFirst();
    }

    private static ChecklistItem item(String id, ChecklistPhase phase, ItemResult outcome) {
        return new ChecklistItem(id, phase, "Item " + id, "API 661", ctx -> outcome);
    }

    @Nested
    @DisplayName("API 661 items")
    class DefaultChecklist {

        private final EquipmentChecklistValidator validator = new EquipmentChecklistValidator();

        private ValidationResult run(ExtractedDrawingData data, Map<String, ?> params) {
            return validator.validate(data, TestStandards.store(), ValidationParams.of(params));
        }

        @Test
        void missingDesignBasisIsInsufficientData() {
            ValidationResult result = run(drawing("GENERAL ARRANGEMENT").build(), Map.of());

            assertThat(issue(result, "checklist.DB-01")).hasValueSatisfying(i -> {
                assertThat(i.getSeverity()).isEqualTo(Severity.WARNING);
                assertThat(i.getMessage()).isEqualTo("Insufficient data: DB-01 Heat duty specified: heat duty not stated");
            });
            assertThat(issue(result, "checklist.DB-02")).isPresent();
            assertThat(issue(result, "checklist.DB-03")).isPresent();
            assertThat(issue(result, EquipmentChecklistValidator.CHECK_ACCEPTANCE)).hasValueSatisfying(
                    i -> assertThat(i.getMessage()).startsWith("Checklist not acceptable"));
            assertThat(result.getPhases()).first()
                    .satisfies(phase -> assertThat(phase.getPhase()).isEqualTo("Design basis"));
        }

        @Test
        void hydroTestBelowMinimumRatioIsCritical() {
            ValidationResult result = run(drawing("NOTES").build(),
                    Map.of(Api661Checklist.HYDRO_TEST_PRESSURE, 180, Api661Checklist.DESIGN_PRESSURE, 150));

            assertThat(issue(result, "checklist.IT-01")).hasValueSatisfying(i -> {
                assertThat(i.getSeverity()).isEqualTo(Severity.CRITICAL);
                assertThat(i.getMessage()).contains("1.2 x 150 psig; minimum is 1.3 x");
            });
        }

        @Test
        void hydroTestAboveMaximumRatioWarns() {
            ValidationResult result = run(drawing("NOTES").build(),
                    Map.of(Api661Checklist.HYDRO_TEST_PRESSURE, 270, Api661Checklist.DESIGN_PRESSURE, 150));

            assertThat(issue(result, "checklist.IT-01")).hasValueSatisfying(
                    i -> assertThat(i.getSeverity()).isEqualTo(Severity.WARNING));
        }

        @Test
        void designDataFromTheDrawingIsUsed() {
            ExtractedDrawingData data = drawing("DESIGN PRESSURE 150 PSIG", "HYDROTEST 225 PSIG")
                    .designData(DesignData.builder().designPressure(150.0).hydroTestPressure(225.0).build())
                    .build();

            ValidationResult result = run(data, Map.of());

            assertThat(issue(result, "checklist.DB-02")).isEmpty();
            assertThat(issue(result, "checklist.IT-01")).isEmpty();
        }

        @Test
        void lowHandrailFailsWithoutBeingCritical() {
            ValidationResult result = run(drawing("NOTES").build(), Map.of(Api661Checklist.HANDRAIL_HEIGHT, 38));

            assertThat(issue(result, "checklist.OM-01")).hasValueSatisfying(i -> {
                assertThat(i.getSeverity()).isEqualTo(Severity.ERROR);
                assertThat(i.getMessage()).endsWith("Handrail height 38 in is below 39 in");
            });
        }
    }

    @Nested
    @DisplayName("phase totals and acceptance")
    class Acceptance {

        @Test
        void notApplicableItemsAreTotalledButNotCounted() {
            EquipmentChecklistValidator validator = new EquipmentChecklistValidator(List.of(
                    item("OM-01", ChecklistPhase.OPERATIONS_MAINTENANCE, ItemResult.pass("ok")),
                    item("OM-02", ChecklistPhase.OPERATIONS_MAINTENANCE, ItemResult.pass("ok")),
                    item("OM-03", ChecklistPhase.OPERATIONS_MAINTENANCE, ItemResult.notApplicable("n/a"))));

            ValidationResult result = validator.validate(drawing("NOTES").build(), TestStandards.store(),
                    ValidationParams.empty());

            assertThat(result.getTotalChecks()).isEqualTo(2);
            assertThat(result.getPhases()).singleElement().satisfies(phase -> {
                assertThat(phase.getTotal()).isEqualTo(3);
                assertThat(phase.getPassed()).isEqualTo(2);
                assertThat(phase.getNotApplicable()).isEqualTo(1);
                assertThat(phase.getPassRate()).isEqualTo(100.0);
            });
            assertThat(issue(result, EquipmentChecklistValidator.CHECK_ACCEPTANCE)).hasValueSatisfying(i -> {
                assertThat(i.getSeverity()).isEqualTo(Severity.INFO);
                assertThat(i.getMessage()).isEqualTo("Checklist acceptable: pass rate 100.0%");
            });
        }

        @Test
        void criticalFailureBlocksAcceptanceDespiteHighPassRate() {
            List<ChecklistItem> items = new ArrayList<>();
            for (int i = 1; i <= 10; i++) {
                items.add(item(String.format("OM-%02d", i), ChecklistPhase.OPERATIONS_MAINTENANCE,
                        ItemResult.pass("ok")));
            }
            items.add(item("DB-01", ChecklistPhase.DESIGN_BASIS, ItemResult.fail("bad")));

            ValidationResult result = new EquipmentChecklistValidator(items)
                    .validate(drawing("NOTES").build(), TestStandards.store(), ValidationParams.empty());

            assertThat(result.getPhases()).extracting(PhaseSummary::getPhase)
                    .containsExactly("Design basis", "Operations and maintenance");
            assertThat(issue(result, "checklist.DB-01")).hasValueSatisfying(
                    i -> assertThat(i.getSeverity()).isEqualTo(Severity.CRITICAL));
            assertThat(issue(result, EquipmentChecklistValidator.CHECK_ACCEPTANCE)).hasValueSatisfying(i -> {
                assertThat(i.getSeverity()).isEqualTo(Severity.WARNING);
                assertThat(i.getMessage()).isEqualTo("Checklist not acceptable: pass rate 90.9% (1 critical failure)");
            });
        }

        @Test
        void nothingCountedMeansZeroPassRate() {
            EquipmentChecklistValidator validator = new EquipmentChecklistValidator(List.of(
                    item("LA-01", ChecklistPhase.LOADS_ANALYSIS, ItemResult.notApplicable("n/a"))));

            ValidationResult result = validator.validate(drawing("NOTES").build(), TestStandards.store(),
                    ValidationParams.empty());

            assertThat(result.getPhases()).singleElement()
                    .satisfies(phase -> assertThat(phase.getPassRate()).isZero());
            assertThat(issue(result, EquipmentChecklistValidator.CHECK_ACCEPTANCE)).hasValueSatisfying(i ->
                    assertThat(i.getMessage()).isEqualTo("Checklist not acceptable: pass rate 0.0% (0 critical failures)"));
        }
    }

    @Test
    void itemIdMustMatchItsPhase() {
        assertThatThrownBy(() -> item("MD-01", ChecklistPhase.DESIGN_BASIS, ItemResult.pass("ok")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
