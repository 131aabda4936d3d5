package com.shlawgathon.drawcheck.backend.validation.checklist;

import com.shlawgathon.drawcheck.backend.model.drawing.DesignData;
import com.shlawgathon.drawcheck.backend.model.drawing.ExtractedDrawingData;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.validation.ValidationParams;

import java.util.Locale;
import java.util.Optional;

/**
 * Inputs visible to checklist rules. Request parameters take precedence over
 * values read from the drawing notes.
 */
public class ChecklistContext {

    private final ExtractedDrawingData data;
    private final StandardsStore standards;
    private final ValidationParams params;

    public ChecklistContext(ExtractedDrawingData data, StandardsStore standards, ValidationParams params) {
        this.data = data;
        this.standards = standards;
        this.params = params;
    }

    public ExtractedDrawingData data() {
        return data;
    }

    public StandardsStore standards() {
        return standards;
    }

    public Optional<Double> number(String key) {
        Optional<Double> value = params.getDouble(key);
        return value.isPresent() ? value : fromDesignData(key);
    }

    public Optional<String> text(String key) {
        return params.getString(key).map(String::trim).filter(s -> !s.isEmpty());
    }

    public Optional<Boolean> flag(String key) {
        return params.getBoolean(key);
    }

    public boolean referencesCode(String code) {
        String wanted = code.toUpperCase(Locale.ROOT);
        return data.getDesignData().getDesignCodes().stream()
                .anyMatch(c -> c.toUpperCase(Locale.ROOT).contains(wanted));
    }

    private Optional<Double> fromDesignData(String key) {
        DesignData design = data.getDesignData();
        Double value = switch (key) {
            case Api661Checklist.DESIGN_PRESSURE -> design.getDesignPressure();
            case Api661Checklist.DESIGN_TEMPERATURE -> design.getDesignTemperature();
            case Api661Checklist.MAWP -> design.getMawp();
            case Api661Checklist.MDMT -> design.getMdmt();
            case Api661Checklist.HYDRO_TEST_PRESSURE -> design.getHydroTestPressure();
            case Api661Checklist.CORROSION_ALLOWANCE -> design.getCorrosionAllowance();
            default -> null;
        };
        return Optional.ofNullable(value);
    }
}
