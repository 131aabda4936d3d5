package com.shlawgathon.drawcheck.backend.validation.gdt;

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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.shlawgathon.drawcheck.backend.extraction.Measurements.inches;
import static com.shlawgathon.drawcheck.backend.validation.ResultBuilder.issue;

/**
 * Feature control frame checks per ASME Y14.5-2018.
 */
public class GdtValidator implements DrawingValidator {

    public static final String PARAM_FEATURE_TYPE = "featureType";
    public static final String PARAM_MMC_SIZE = "mmcSize";
    public static final String PARAM_LMC_SIZE = "lmcSize";
    public static final String PARAM_ACTUAL_SIZE = "actualSize";

    static final String CHECK_FRAME = "gdt.feature-control-frame";
    static final String CHECK_DATUMS = "gdt.datum-usage";
    static final String CHECK_BONUS = "gdt.bonus-tolerance";

    private static final String Y14_5 = "ASME Y14.5-2018";

    private final FeatureControlFrameParser parser;

    public GdtValidator() {
        this(new FeatureControlFrameParser());
    }

    public GdtValidator(FeatureControlFrameParser parser) {
        this.parser = parser;
    }

    @Override
    public ValidationDomain domain() {
        return ValidationDomain.GDT;
    }

    @Override
    public ValidationResult validate(ExtractedDrawingData data, StandardsStore standards, ValidationParams params) {
        ResultBuilder result = new ResultBuilder(domain());
        result.noteIncomplete(data);

        List<FeatureControlFrame> frames = parser.parse(data);
        if (frames.isEmpty() && data.getDatums().isEmpty()) {
            result.nothingToCheck("gdt.frames", "no feature control frames or datum features found");
            return result.build();
        }

        for (FeatureControlFrame frame : frames) {
            result.check(checkFrame(frame, data));
            if (frame.getCharacteristic() == GeometricCharacteristic.POSITION && frame.hasBonusModifier()) {
                checkBonus(frame, params, result);
            }
        }
        checkDatumUsage(frames, data, result);
        return result.build();
    }

    List<ValidationIssue> checkFrame(FeatureControlFrame frame, ExtractedDrawingData data) {
        List<ValidationIssue> issues = new ArrayList<>();
        GeometricCharacteristic characteristic = frame.getCharacteristic();
        String label = capitalize(characteristic.label());

        if (frame.getTolerance() <= 0) {
            issues.add(error(frame, label + " tolerance must be greater than zero",
                    "State a positive tolerance value", Y14_5 + " Section 1.4"));
        }
        switch (characteristic.category().datumRule()) {
            case REQUIRED -> {
                if (frame.getDatums().isEmpty()) {
                    issues.add(error(frame, label + " requires a datum reference frame",
                            "Add primary (and secondary/tertiary as needed) datum references", Y14_5 + " Section 7"));
                }
            }
            case FORBIDDEN -> {
                if (!frame.getDatums().isEmpty()) {
                    issues.add(error(frame, "Form tolerance " + characteristic.label()
                                    + " must not reference datums",
                            "Remove the datum references from the frame", Y14_5 + " Section 8"));
                }
            }
            case OPTIONAL -> {
            }
        }
        if (frame.getDatums().size() > 3) {
            issues.add(error(frame, label + " references " + frame.getDatums().size()
                    + " datums; at most three are allowed", "Limit the frame to primary, secondary and tertiary",
                    Y14_5 + " Section 7"));
        }

        Set<String> seen = new HashSet<>();
        for (DatumReference datum : frame.getDatums()) {
            if (!seen.add(datum.letter())) {
                issues.add(error(frame, "Datum " + datum.letter() + " is referenced more than once in "
                        + characteristic.label() + " frame", "Reference each datum once", Y14_5 + " Section 7"));
            } else if (!data.getDatums().contains(datum.letter())) {
                issues.add(issue(data.isIncomplete() ? Severity.WARNING : Severity.ERROR, CHECK_FRAME,
                        "Datum " + datum.letter() + " is referenced but not defined on the drawing"
                                + (data.isIncomplete() ? " (it may be on a missing page)" : ""),
                        frame.getLocation(), "Add a datum feature symbol for " + datum.letter(),
                        Y14_5 + " Section 7"));
            }
        }

        MaterialCondition modifier = frame.getModifier();
        if (modifier != null && modifier.allowsBonus()) {
            if (characteristic.forbidsMaterialCondition()) {
                issues.add(error(frame, modifier + " modifier is not applicable to " + characteristic.label(),
                        "Remove the material condition modifier", Y14_5 + " Section 5"));
            } else {
                issues.add(issue(Severity.INFO, CHECK_FRAME, label + " applies at " + modifier
                                + "; bonus tolerance is available as the feature departs from " + modifier,
                        frame.getLocation(), null, Y14_5 + " Section 5"));
            }
        }
        if (characteristic.isObsolete()) {
            issues.add(issue(Severity.WARNING, CHECK_FRAME, label + " was removed from " + Y14_5,
                    frame.getLocation(), "Use position, runout or profile instead", Y14_5));
        }
        return issues;
    }

    private void checkBonus(FeatureControlFrame frame, ValidationParams params, ResultBuilder result) {
        MaterialCondition modifier = frame.getModifier();
        Optional<String> type = params.getString(PARAM_FEATURE_TYPE).map(t -> t.trim().toLowerCase(Locale.ROOT));
        Optional<Double> limit = params.getDouble(modifier == MaterialCondition.MMC ? PARAM_MMC_SIZE : PARAM_LMC_SIZE);
        Optional<Double> actual = params.getDouble(PARAM_ACTUAL_SIZE);
        if (type.isEmpty() || limit.isEmpty() || actual.isEmpty()
                || !(type.get().equals("hole") || type.get().equals("shaft"))) {
            result.check(issue(Severity.WARNING, CHECK_BONUS,
                    "Insufficient data: feature size data missing for bonus calculation",
                    frame.getLocation(), "Provide featureType (hole or shaft), "
                            + (modifier == MaterialCondition.MMC ? PARAM_MMC_SIZE : PARAM_LMC_SIZE)
                            + " and actualSize", Y14_5 + " Section 5"));
            return;
        }
        BonusTolerance bonus = BonusTolerance.compute(type.get().equals("hole"), modifier,
                frame.getTolerance(), limit.get(), actual.get());
        result.check(issue(Severity.INFO, CHECK_BONUS,
                "Position at " + modifier + ": bonus " + inches(bonus.bonus()) + ", total allowed "
                        + inches(bonus.totalTolerance()) + ", virtual condition " + inches(bonus.virtualCondition()),
                frame.getLocation(), null, Y14_5 + " Section 5"));
    }

    private void checkDatumUsage(List<FeatureControlFrame> frames, ExtractedDrawingData data, ResultBuilder result) {
        if (data.getDatums().isEmpty()) {
            return;
        }
        Set<String> referenced = new HashSet<>();
        frames.forEach(f -> f.getDatums().forEach(d -> referenced.add(d.letter())));
        Set<String> unused = new TreeSet<>(data.getDatums());
        unused.removeAll(referenced);
        if (unused.isEmpty()) {
            result.pass();
            return;
        }
        result.check(issue(Severity.WARNING, CHECK_DATUMS,
                "Datum" + (unused.size() > 1 ? "s " : " ") + String.join(", ", unused)
                        + " defined but not referenced by any feature control frame",
                null, "Reference the datum or remove the datum feature symbol", Y14_5 + " Section 7"));
    }

    private static ValidationIssue error(FeatureControlFrame frame, String message, String suggestion,
            String reference) {
        return issue(Severity.ERROR, CHECK_FRAME, message, frame.getLocation(), suggestion, reference);
    }

    private static String capitalize(String label) {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
