package com.shlawgathon.drawcheck.backend.validation.welding;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldCallout;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldSide;
import com.shlawgathon.drawcheck.backend.model.drawing.WeldType;
import com.shlawgathon.drawcheck.backend.standards.StandardsRecord;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.validation.DrawingValidator;
import com.shlawgathon.drawcheck.backend.validation.ResultBuilder;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.shlawgathon.drawcheck.backend.extraction.Measurements.inches;
import static com.shlawgathon.drawcheck.backend.validation.ResultBuilder.issue;

/**
 * Structural weld checks against AWS D1.1: minimum and maximum fillet size
 * for the base metal, effective throat, intermittent pitch and procedure
 * references.
 */
public class WeldingValidator implements DrawingValidator {

    public static final String PARAM_BASE_METAL_THICKNESS = "baseMetalThickness";
    public static final String PARAM_ELECTRODE = "electrode";
    public static final String PARAM_WELD_LENGTH = "weldLength";

    static final String CHECK_SIZE = "welding.fillet-size";
    static final String CHECK_PROCEDURE = "welding.procedure";

    private static final String MIN_SIZE_REF = "AWS D1.1 Table 5.8";
    private static final String MAX_SIZE_REF = "AWS D1.1 Section 2.4.2.9";
    private static final double EPSILON = 1e-9;

    private static final Pattern WPS = Pattern.compile("\\bWPS\\b|WELD(?:ING)?\\s+PROCEDURE", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Double> ELECTRODE_STRENGTH_KSI = Map.of(
            "E60", 60.0, "E70", 70.0, "E80", 80.0, "E90", 90.0, "E100", 100.0, "E110", 110.0);

    @Override
    public ValidationDomain domain() {
        return ValidationDomain.WELDING;
    }

    @Override
    public ValidationResult validate(ExtractedDrawingData data, StandardsStore standards, ValidationParams params) {
        ResultBuilder result = new ResultBuilder(domain());
        result.noteIncomplete(data);

        if (data.getWelds().isEmpty()) {
            result.nothingToCheck("welding.callouts", "no weld callouts found on the drawing");
            return result.build();
        }

        Optional<Double> defaultThickness = params.getDouble(PARAM_BASE_METAL_THICKNESS);
        for (WeldCallout weld : data.getWelds()) {
            checkCallout(weld, defaultThickness, standards, params, result);
        }
        checkProcedureReference(data, result);
        notePreheat(data, defaultThickness, standards, result);
        return result.build();
    }

    private void checkCallout(WeldCallout weld, Optional<Double> defaultThickness, StandardsStore standards,
            ValidationParams params, ResultBuilder result) {
        IssueLocation location = weld.getLocation();
        if (weld.getType() != WeldType.FILLET) {
            result.note(issue(Severity.INFO, "welding.groove", weld.getType().name().toLowerCase(Locale.ROOT)
                            + " weld '" + weld.getRaw() + "' is not sized by the fillet table",
                    location, "Confirm joint preparation against a prequalified joint detail", "AWS D1.1 Clause 5"));
            return;
        }
        if (weld.getSize() == null || weld.getSize() <= 0) {
            result.insufficientData(CHECK_SIZE, "weld size not stated for '" + weld.getRaw() + "'", location);
            return;
        }
        Double thickness = weld.getBaseMetalThickness() != null ? weld.getBaseMetalThickness()
                : defaultThickness.orElse(null);
        if (thickness == null || thickness <= 0) {
            result.insufficientData(CHECK_SIZE, "base metal thickness unknown for '" + weld.getRaw()
                    + "'; minimum size check skipped", location);
            return;
        }
        Optional<Double> minimum = standards.minimumFilletWeldSize(thickness);
        if (minimum.isEmpty()) {
            result.insufficientData(CHECK_SIZE, "no minimum fillet size tabulated for " + inches(thickness)
                    + " base metal", location);
            return;
        }

        double size = weld.getSize();
        List<ValidationIssue> issues = new ArrayList<>();
        if (size + EPSILON < minimum.get()) {
            issues.add(issue(Severity.CRITICAL, CHECK_SIZE,
                    "Fillet weld size " + inches(size) + " is below minimum " + inches(minimum.get())
                            + " for " + inches(thickness) + " base metal",
                    location, "Increase the fillet leg to at least " + inches(minimum.get()) + " in",
                    citation(standards.minimumFilletRow(thickness), MIN_SIZE_REF)));
        }
        standards.maximumFilletWeldSize(thickness).ifPresent(maximum -> {
            if (size > maximum + EPSILON) {
                issues.add(issue(Severity.WARNING, CHECK_SIZE,
                        "Fillet weld size " + inches(size) + " exceeds maximum " + inches(maximum)
                                + " along the edge of " + inches(thickness) + " base metal",
                        location, "Reduce the leg or detail the weld as built out to full throat", MAX_SIZE_REF));
            }
        });

        double throat = FilletWeldGeometry.effectiveThroat(size);
        issues.add(issue(Severity.INFO, "welding.effective-throat",
                String.format(Locale.ROOT, "Effective throat for %s fillet is %.3f%s", inches(size), throat,
                        weld.getSide() == WeldSide.BOTH_SIDES ? " per side (both sides)" : ""),
                location, null, "AWS D1.1 Section 2.4.2.10"));

        if (weld.isIntermittent()) {
            double minimumPitch = standards.codeLimit("INTERMITTENT-PITCH", "minPitchToLength").orElse(1.5)
                    * weld.getIntermittentLength();
            if (weld.getIntermittentPitch() + EPSILON < minimumPitch) {
                issues.add(issue(Severity.WARNING, "welding.intermittent-pitch",
                        "Intermittent weld pitch " + inches(weld.getIntermittentPitch()) + " is less than "
                                + inches(minimumPitch) + " for " + inches(weld.getIntermittentLength())
                                + " segments",
                        location, "Use a continuous weld or increase the pitch", "AWS D1.1 Section 2.4"));
            }
        }

        capacity(size, params, standards).ifPresent(kips -> issues.add(issue(Severity.INFO, "welding.capacity",
                String.format(Locale.ROOT, "Design shear strength of %s fillet is %.2f kips over %s in",
                        inches(size), kips, inches(params.getDouble(PARAM_WELD_LENGTH).orElse(0.0))),
                location, null, "AISC 360 Section J2.4")));

        result.check(issues);
    }

    private Optional<Double> capacity(double size, ValidationParams params, StandardsStore standards) {
        Optional<String> electrode = params.getString(PARAM_ELECTRODE);
        Optional<Double> length = params.getDouble(PARAM_WELD_LENGTH);
        if (electrode.isEmpty() || length.isEmpty()) {
            return Optional.empty();
        }
        String classification = electrode.get().toUpperCase(Locale.ROOT).replaceAll("X+$", "");
        Double fexx = ELECTRODE_STRENGTH_KSI.get(classification.length() > 4
                ? classification.substring(0, classification.length() - 2) : classification);
        if (fexx == null) {
            return Optional.empty();
        }
        double phi = standards.codeLimit("FILLET-STRENGTH", "phi").orElse(0.75);
        double shear = standards.codeLimit("FILLET-STRENGTH", "shearRatio").orElse(0.6);
        return Optional.of(phi * shear * fexx * FilletWeldGeometry.effectiveThroat(size) * length.get());
    }

    private void checkProcedureReference(ExtractedDrawingData data, ResultBuilder result) {
        if (WPS.matcher(data.fullText()).find()) {
            result.pass();
            return;
        }
        result.check(issue(Severity.WARNING, CHECK_PROCEDURE,
                "Welds are called out but no welding procedure specification (WPS) is referenced",
                null, "Add a general note referencing the qualified WPS", "AWS D1.1 Clause 5"));
    }

    private void notePreheat(ExtractedDrawingData data, Optional<Double> defaultThickness, StandardsStore standards,
            ResultBuilder result) {
        double thickest = data.getWelds().stream()
                .map(WeldCallout::getBaseMetalThickness)
                .filter(t -> t != null && t > 0)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(defaultThickness.orElse(0.0));
        if (thickest <= 0) {
            return;
        }
        standards.preheatRow(thickest)
                .flatMap(row -> row.property("minPreheatF"))
                .filter(preheat -> preheat > 32)
                .ifPresent(preheat -> result.note(issue(Severity.INFO, "welding.preheat",
                        String.format(Locale.ROOT, "Minimum preheat %.0f F applies to %s base metal (Group I steels)",
                                preheat, inches(thickest)),
                        null, "State the preheat requirement in the weld notes", "AWS D1.1 Table 3.2")));
    }

    private static String citation(Optional<StandardsRecord> row, String fallback) {
        return row.map(StandardsRecord::getCitation).orElse(fallback);
    }
}
