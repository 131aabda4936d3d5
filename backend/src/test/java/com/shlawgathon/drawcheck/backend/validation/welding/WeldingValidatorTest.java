package com.shlawgathon.drawcheck.backend.validation.welding;

import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldCallout;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldSide;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldType;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.standards.TestStandards;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static com.shlawgathon.drawcheck.backend.validation.DrawingFixtures.drawing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WeldingValidatorTest {

    private static final String WPS_NOTE = "ALL WELDING PER WPS-101";

    private final WeldingValidator validator = new WeldingValidator();
    private final StandardsStore standards = TestStandards.store();

    private ValidationResult run(ExtractedDrawingData data) {
        return validator.validate(data, standards, ValidationParams.empty());
    }

    private static WeldCallout fillet(double size, Double thickness) {
        return WeldCallout.builder()
                .raw(size + " FILLET")
                .type(WeldType.FILLET)
                .size(size)
                .baseMetalThickness(thickness)
                .build();
    }

    private static List<ValidationIssue> ofType(ValidationResult result, String checkType) {
        return result.getIssues().stream().filter(i -> i.getCheckType().equals(checkType)).toList();
    }

    @Nested
    @DisplayName("minimum fillet size")
    class MinimumSize {

        @Test
        void quarterInchBothSidesOnThreeEighthsPlatePasses() {
            WeldCallout weld = WeldCallout.builder()
                    .raw("1/4 FILLET, BOTH SIDES")
                    .type(WeldType.FILLET)
                    .size(0.25)
                    .side(WeldSide.BOTH_SIDES)
                    .baseMetalThickness(0.375)
                    .build();

            ValidationResult result = run(drawing(WPS_NOTE).weld(weld).build());

            assertThat(result.getFailed()).isZero();
            assertThat(result.getPassed()).isEqualTo(result.getTotalChecks());
            assertThat(ofType(result, "welding.effective-throat")).singleElement().satisfies(issue -> {
                assertThat(issue.getSeverity()).isEqualTo(Severity.INFO);
                assertThat(issue.getMessage()).startsWith("Effective throat for 0.25 fillet is 0.17");
                assertThat(issue.getMessage()).endsWith("per side (both sides)");
            });
        }

        @Test
        void sixteenthOnHalfInchPlateIsCritical() {
            ValidationResult result = run(drawing(WPS_NOTE).weld(fillet(0.0625, 0.5)).build());

            assertThat(result.getFailed()).isEqualTo(1);
            assertThat(ofType(result, WeldingValidator.CHECK_SIZE)).singleElement().satisfies(issue -> {
                assertThat(issue.getSeverity()).isEqualTo(Severity.CRITICAL);
                assertThat(issue.getMessage()).contains("below minimum 0.1875 for 0.5 base metal");
                assertThat(issue.getStandardReference()).contains("AWS D1.1");
            });
        }

        @ParameterizedTest(name = "{0} fillet on {1} plate passes={2}")
        @CsvSource({
                "0.125, 0.2499999, true",
                "0.125, 0.25, true",
                "0.125, 0.2500001, false",
                "0.1875, 0.2500001, true",
                "0.125, 0.4999999, false",
                "0.1875, 0.4999999, true",
                "0.1875, 0.5, true",
                "0.1875, 0.5000001, false",
                "0.25, 0.5000001, true",
                "0.25, 0.7499999, true",
                "0.25, 0.75, true",
                "0.25, 0.7500001, false",
                "0.3125, 0.7500001, true"
        })
        void bracketBoundaries(double size, double thickness, boolean passes) {
            ValidationResult result = run(drawing(WPS_NOTE).weld(fillet(size, thickness)).build());

            boolean critical = ofType(result, WeldingValidator.CHECK_SIZE).stream()
                    .anyMatch(i -> i.getSeverity() == Severity.CRITICAL);
            assertThat(critical).isEqualTo(!passes);
        }

        @Test
        void oversizedFilletWarns() {
            ValidationResult result = run(drawing(WPS_NOTE).weld(fillet(0.375, 0.375)).build());

            assertThat(result.getWarnings()).isEqualTo(1);
            assertThat(ofType(result, WeldingValidator.CHECK_SIZE)).singleElement()
                    .satisfies(issue -> assertThat(issue.getMessage()).contains("exceeds maximum 0.3125"));
        }
    }

    @Nested
    @DisplayName("missing inputs")
    class MissingInputs {

        @Test
        void unknownThicknessIsInsufficientData() {
            ValidationResult result = run(drawing(WPS_NOTE).weld(fillet(0.25, null)).build());

            assertThat(result.getWarnings()).isEqualTo(1);
            assertThat(ofType(result, WeldingValidator.CHECK_SIZE)).singleElement()
                    .satisfies(issue -> assertThat(issue.getMessage()).startsWith("Insufficient data:"));
        }

        @Test
        void thicknessParameterFillsTheGap() {
            ValidationResult result = validator.validate(drawing(WPS_NOTE).weld(fillet(0.0625, null)).build(),
                    standards, ValidationParams.of(Map.of(WeldingValidator.PARAM_BASE_METAL_THICKNESS, "1/2")));

            assertThat(ofType(result, WeldingValidator.CHECK_SIZE)).singleElement()
                    .satisfies(issue -> assertThat(issue.getSeverity()).isEqualTo(Severity.CRITICAL));
        }

        @Test
        void noWeldsIsAnUncountedNote() {
            ValidationResult result = run(drawing("GENERAL NOTES").build());

            assertThat(result.getTotalChecks()).isZero();
            assertThat(result.getIssues()).singleElement()
                    .satisfies(issue -> assertThat(issue.getSeverity()).isEqualTo(Severity.INFO));
        }

        @Test
        void incompleteExtractionIsNoted() {
            ValidationResult result = run(drawing(WPS_NOTE).weld(fillet(0.25, 0.375))
                    .missingPage(2).incomplete(true).build());

            assertThat(ofType(result, "extraction.incomplete")).hasSize(1);
        }
    }

    @Test
    void grooveWeldsAreNotSizedByTheFilletTable() {
        WeldCallout groove = WeldCallout.builder().raw("V-GROOVE").type(WeldType.GROOVE).build();

        ValidationResult result = run(drawing(WPS_NOTE).weld(groove).build());

        assertThat(result.getTotalChecks()).isEqualTo(1);
        assertThat(ofType(result, "welding.groove")).hasSize(1);
    }

    @Test
    void missingProcedureReferenceWarns() {
        ValidationResult result = run(drawing("NOTES").weld(fillet(0.25, 0.375)).build());

        assertThat(ofType(result, WeldingValidator.CHECK_PROCEDURE)).singleElement()
                .satisfies(issue -> assertThat(issue.getSeverity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void shortIntermittentPitchWarns() {
        WeldCallout weld = WeldCallout.builder()
                .raw("1/4 FILLET 2-2")
                .type(WeldType.FILLET)
                .size(0.25)
                .baseMetalThickness(0.375)
                .intermittentLength(2.0)
                .intermittentPitch(2.0)
                .build();

        ValidationResult result = run(drawing(WPS_NOTE).weld(weld).build());

        assertThat(ofType(result, "welding.intermittent-pitch")).singleElement()
                .satisfies(issue -> assertThat(issue.getMessage()).contains("less than 3"));
    }

    @Test
    void thickPlateGetsPreheatNote() {
        ValidationResult result = run(drawing(WPS_NOTE).weld(fillet(0.375, 2.0)).build());

        assertThat(ofType(result, "welding.preheat")).singleElement()
                .satisfies(issue -> assertThat(issue.getMessage()).contains("150 F"));
    }

    @Test
    void capacityReportedWhenElectrodeAndLengthGiven() {
        ValidationResult result = validator.validate(drawing(WPS_NOTE).weld(fillet(0.25, 0.375)).build(),
                standards, ValidationParams.of(Map.of(
                        WeldingValidator.PARAM_ELECTRODE, "E70XX",
                        WeldingValidator.PARAM_WELD_LENGTH, 4)));

        assertThat(ofType(result, "welding.capacity")).singleElement()
                .satisfies(issue -> assertThat(issue.getMessage()).contains("22.27 kips"));
    }

    @Test
    void effectiveThroat() {
        assertThat(FilletWeldGeometry.effectiveThroat(0.25)).isCloseTo(0.177, within(0.001));
    }
}
