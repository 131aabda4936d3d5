package com.shlawgathon.drawcheck.backend.validation.gdt;

import java.util.List;

/**
 * The fourteen geometric characteristics with the words, abbreviations and
 * symbols they appear as in drawing text.
 */
public enum GeometricCharacteristic {
    STRAIGHTNESS(ToleranceCategory.FORM, "straightness", "STRAIGHTNESS", "⏤"),
    FLATNESS(ToleranceCategory.FORM, "flatness", "FLATNESS", "FLT", "⏥"),
    CIRCULARITY(ToleranceCategory.FORM, "circularity", "CIRCULARITY", "ROUNDNESS", "○"),
    CYLINDRICITY(ToleranceCategory.FORM, "cylindricity", "CYLINDRICITY", "⌭"),
    PROFILE_OF_A_LINE(ToleranceCategory.PROFILE, "profile of a line", "PROFILE OF A LINE", "LINE PROFILE", "⌒"),
    PROFILE_OF_A_SURFACE(ToleranceCategory.PROFILE, "profile of a surface", "PROFILE OF A SURFACE",
            "SURFACE PROFILE", "PROFILE", "⌓"),
    PERPENDICULARITY(ToleranceCategory.ORIENTATION, "perpendicularity", "PERPENDICULARITY", "PERP", "⊥"),
    ANGULARITY(ToleranceCategory.ORIENTATION, "angularity", "ANGULARITY", "∠"),
    PARALLELISM(ToleranceCategory.ORIENTATION, "parallelism", "PARALLELISM", "PARA", "∥"),
    POSITION(ToleranceCategory.LOCATION, "position", "TRUE POSITION", "POSITION", "POS", "TP", "⌖", "⊕"),
    CONCENTRICITY(ToleranceCategory.LOCATION, "concentricity", "CONCENTRICITY", "◎"),
    SYMMETRY(ToleranceCategory.LOCATION, "symmetry", "SYMMETRY", "⌯"),
    CIRCULAR_RUNOUT(ToleranceCategory.RUNOUT, "circular runout", "CIRCULAR RUNOUT", "RUNOUT", "↗"),
    TOTAL_RUNOUT(ToleranceCategory.RUNOUT, "total runout", "TOTAL RUNOUT", "⌰");

    private final ToleranceCategory category;
    private final String label;
    private final List<String> tokens;

    GeometricCharacteristic(ToleranceCategory category, String label, String... tokens) {
        this.category = category;
        this.label = label;
        this.tokens = List.of(tokens);
    }

    public ToleranceCategory category() {
        return category;
    }

    public String label() {
        return label;
    }

    public List<String> tokens() {
        return tokens;
    }

    /**
     * Characteristics for which a material condition modifier is meaningless.
     */
    public boolean forbidsMaterialCondition() {
        return this == FLATNESS || this == CIRCULARITY || this == CYLINDRICITY;
    }

    public boolean isObsolete() {
        return this == CONCENTRICITY || this == SYMMETRY;
    }
}
