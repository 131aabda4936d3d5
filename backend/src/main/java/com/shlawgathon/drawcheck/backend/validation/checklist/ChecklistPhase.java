package com.shlawgathon.drawcheck.backend.validation.checklist;

public enum ChecklistPhase {
    DESIGN_BASIS("DB", "Design basis"),
    MECHANICAL_DESIGN("MD", "Mechanical design"),
    PIPING_INSTRUMENTATION("PI", "Piping and instrumentation"),
    ELECTRICAL_CONTROLS("EC", "Electrical and controls"),
    MATERIALS_FABRICATION("MF", "Materials and fabrication"),
    INSTALLATION_TESTING("IT", "Installation and testing"),
    OPERATIONS_MAINTENANCE("OM", "Operations and maintenance"),
    LOADS_ANALYSIS("LA", "Loads and analysis");

    private final String prefix;
    private final String title;

    ChecklistPhase(String prefix, String title) {
        this.prefix = prefix;
        this.title = title;
    }

    public String prefix() {
        return prefix;
    }

    public String title() {
        return title;
    }
}
