package com.shlawgathon.drawcheck.backend.validation.gdt;

/**
 * ASME Y14.5 tolerance families and whether they take a datum reference frame.
 */
public enum ToleranceCategory {
    FORM(DatumRule.FORBIDDEN),
    PROFILE(DatumRule.OPTIONAL),
    ORIENTATION(DatumRule.REQUIRED),
    LOCATION(DatumRule.REQUIRED),
    RUNOUT(DatumRule.REQUIRED);

    public enum DatumRule {
        FORBIDDEN, OPTIONAL, REQUIRED
    }

    private final DatumRule datumRule;

    ToleranceCategory(DatumRule datumRule) {
        this.datumRule = datumRule;
    }

    public DatumRule datumRule() {
        return datumRule;
    }
}
