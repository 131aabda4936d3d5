package com.shlawgathon.drawcheck.backend.validation.material;

import com.shlawgathon.drawcheck.backend.model.IssueLocation;
import com.shlawgathon.drawcheck.backend.model.Severity;
import com.shlawgathon.drawcheck.backend.model.ValidationIssue;
import com.shlawgathon.drawcheck.backend.model.ValidationResult;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.model.drawing.MaterialSpec;
import com.shlawgathon.drawcheck.backend.standards.StandardsCategory;
import com.shlawgathon.drawcheck.backend.standards.StandardsRecord;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.validation.DrawingValidator;
import com.shlawgathon.drawcheck.backend.validation.ResultBuilder;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.shlawgathon.drawcheck.backend.validation.ResultBuilder.issue;

/**
 * Material specification checks: recognized ASTM/ASME designation, mill test
 * chemistry and mechanical values against the specification limits, carbon
 * equivalent, heat treatment and heat number traceability.
 */
public class MaterialValidator implements DrawingValidator {

    public static final String PARAM_CHEMISTRY = "chemistry";
    public static final String PARAM_MECHANICAL = "mechanical";
    public static final String PARAM_HEAT_TREATMENT = "heatTreatment";
    public static final String PARAM_HEAT_NUMBER = "heatNumber";

    static final String CHECK_SPEC = "material.specification";
    static final String CHECK_CHEMISTRY = "material.chemistry";
    static final String CHECK_MECHANICAL = "material.mechanical";
    static final String CHECK_CARBON_EQUIVALENT = "material.carbon-equivalent";
    static final String CHECK_HEAT_TREATMENT = "material.heat-treatment";
    static final String CHECK_TRACEABILITY = "material.traceability";

    private static final String CE_REF = "AWS D1.1 Annex H";

    /** Mechanical value key to the specification limits it is held against. */
    private static final Map<String, String[]> MECHANICAL_LIMITS = Map.of(
            "yieldKsi", new String[]{"yieldMinKsi", null},
            "tensileKsi", new String[]{"tensileMinKsi", "tensileMaxKsi"},
            "elongationPct", new String[]{"elongationMinPct", null});

    @Override
    public ValidationDomain domain() {
        return ValidationDomain.MATERIAL;
    }

    @Override
    public ValidationResult validate(ExtractedDrawingData data, StandardsStore standards, ValidationParams params) {
        ResultBuilder result = new ResultBuilder(domain());
        result.noteIncomplete(data);

        if (data.getMaterials().isEmpty()) {
            result.nothingToCheck("material.callouts", "no material specifications found on the drawing");
            return result.build();
        }
        for (MaterialSpec spec : data.getMaterials()) {
            validate(spec, standards, params, result);
        }
        return result.build();
    }

    private void validate(MaterialSpec spec, StandardsStore standards, ValidationParams params,
            ResultBuilder result) {
        IssueLocation location = spec.getLocation();
        String name = spec.getDesignation();

        Optional<StandardsRecord> record = standards.lookup(StandardsCategory.MATERIAL, name);
        if (record.isEmpty()) {
            result.check(issue(Severity.WARNING, CHECK_SPEC,
                    "Material specification " + name + " is not recognized", location,
                    "Verify the ASTM/ASME designation and grade", null));
        } else {
            result.pass();
        }

        Map<String, Double> chemistry = new LinkedHashMap<>(spec.getChemistry());
        chemistry.putAll(params.getNumberMap(PARAM_CHEMISTRY));
        Map<String, Double> mechanical = new LinkedHashMap<>(spec.getMechanical());
        mechanical.putAll(params.getNumberMap(PARAM_MECHANICAL));

        if (record.isPresent()) {
            StandardsRecord limits = record.get();
            if (chemistry.isEmpty()) {
                result.insufficientData(CHECK_CHEMISTRY, "no mill test chemistry for " + name, location);
            } else {
                result.check(checkChemistry(name, chemistry, limits, location));
            }
            if (mechanical.isEmpty()) {
                result.insufficientData(CHECK_MECHANICAL, "no mill test mechanical properties for " + name,
                        location);
            } else {
                result.check(checkMechanical(name, mechanical, limits, location));
            }
            checkHeatTreatment(spec, params, limits, result);
        }

        boolean stainless = record.flatMap(r -> r.attribute("family"))
                .map(family -> family.startsWith("STAINLESS"))
                .orElse(false);
        if (!stainless) {
            CarbonEquivalent.iiw(chemistry)
                    .ifPresent(ce -> result.check(carbonEquivalent(name, ce, standards, location)));
        }

        String heatNumber = spec.getHeatNumber() != null ? spec.getHeatNumber()
                : params.getString(PARAM_HEAT_NUMBER).orElse(null);
        if (heatNumber == null || heatNumber.isBlank()) {
            result.check(issue(Severity.WARNING, CHECK_TRACEABILITY,
                    "No heat number recorded for " + name + "; traceability to the mill test report is not "
                            + "established", location, "Record the heat number from the MTR",
                    "ASME Section VIII Div. 1 UG-93"));
        } else {
            result.pass();
        }
    }

    List<ValidationIssue> checkChemistry(String name, Map<String, Double> chemistry, StandardsRecord limits,
            IssueLocation location) {
        List<ValidationIssue> issues = new ArrayList<>();
        chemistry.forEach((element, value) -> {
            limits.property(element + "Max").filter(max -> value > max).ifPresent(max ->
                    issues.add(outOfRange(CHECK_CHEMISTRY, name, element, value, "maximum", max, "%",
                            limits, location)));
            limits.property(element + "Min").filter(min -> value < min).ifPresent(min ->
                    issues.add(outOfRange(CHECK_CHEMISTRY, name, element, value, "minimum", min, "%",
                            limits, location)));
        });
        return issues;
    }

    List<ValidationIssue> checkMechanical(String name, Map<String, Double> mechanical, StandardsRecord limits,
            IssueLocation location) {
        List<ValidationIssue> issues = new ArrayList<>();
        mechanical.forEach((property, value) -> {
            String[] keys = MECHANICAL_LIMITS.get(property);
            if (keys == null) {
                return;
            }
            String unit = property.endsWith("Pct") ? "%" : " ksi";
            String label = property.replaceAll("(Ksi|Pct)$", "");
            limits.property(keys[0]).filter(min -> value < min).ifPresent(min ->
                    issues.add(outOfRange(CHECK_MECHANICAL, name, label, value, "minimum", min, unit,
                            limits, location)));
            if (keys[1] != null) {
                limits.property(keys[1]).filter(max -> value > max).ifPresent(max ->
                        issues.add(outOfRange(CHECK_MECHANICAL, name, label, value, "maximum", max, unit,
                                limits, location)));
            }
        });
        return issues;
    }

    private ValidationIssue carbonEquivalent(String name, double ce, StandardsStore standards,
            IssueLocation location) {
        double warningAbove = standards.codeLimit("CE-PREHEAT", "warningAbove").orElse(0.45);
        double infoAbove = standards.codeLimit("CE-PREHEAT", "infoAbove").orElse(0.40);
        String value = String.format(Locale.ROOT, "%.3f", ce);
        if (ce > warningAbove) {
            return issue(Severity.WARNING, CHECK_CARBON_EQUIVALENT,
                    "Carbon equivalent " + value + " for " + name + " exceeds " + warningAbove
                            + "; preheat and low-hydrogen practice required",
                    location, "Specify preheat and low-hydrogen electrodes in the WPS", CE_REF);
        }
        if (ce > infoAbove) {
            return issue(Severity.INFO, CHECK_CARBON_EQUIVALENT,
                    "Carbon equivalent " + value + " for " + name + " indicates moderate weldability; "
                            + "preheat may be needed for thick sections",
                    location, null, CE_REF);
        }
        return issue(Severity.INFO, CHECK_CARBON_EQUIVALENT,
                "Carbon equivalent " + value + " for " + name + " indicates good weldability", location, null,
                CE_REF);
    }

    private void checkHeatTreatment(MaterialSpec spec, ValidationParams params, StandardsRecord limits,
            ResultBuilder result) {
        Optional<String> required = limits.attribute("heatTreatment");
        if (required.isEmpty()) {
            return;
        }
        String stated = spec.getHeatTreatment() != null ? spec.getHeatTreatment()
                : params.getString(PARAM_HEAT_TREATMENT)
                        .map(t -> t.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_"))
                        .orElse(null);
        if (stated == null) {
            result.note(issue(Severity.INFO, CHECK_HEAT_TREATMENT,
                    spec.getDesignation() + " is supplied " + readable(required.get())
                            + "; heat treatment is not stated on the drawing",
                    spec.getLocation(), null, limits.getCitation()));
            return;
        }
        if (stated.equals(required.get())) {
            result.pass();
            return;
        }
        result.check(issue(Severity.WARNING, CHECK_HEAT_TREATMENT,
                "Heat treatment " + readable(stated) + " does not match " + readable(required.get())
                        + " required for " + spec.getDesignation(),
                spec.getLocation(), "Confirm the heat treatment condition with the material supplier",
                limits.getCitation()));
    }

    private static ValidationIssue outOfRange(String checkType, String name, String property, double value,
            String bound, double limit, String unit, StandardsRecord limits, IssueLocation location) {
        return issue(Severity.ERROR, checkType,
                String.format(Locale.ROOT, "%s %s %s%s %s %s %s%s", name, property, trim(value), unit,
                        bound.equals("maximum") ? "exceeds" : "is below", bound, trim(limit), unit),
                location, "Reject the heat or obtain a conforming mill test report", limits.getCitation());
    }

    private static String trim(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String readable(String constant) {
        return constant.toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
