package com.shlawgathon.drawcheck.backend.validation.checklist;

import java.util.Locale;
import java.util.function.Function;

public record ChecklistItem(String id, ChecklistPhase phase, String description, String reference,
        Function<ChecklistContext, ItemResult> rule) {

    public ChecklistItem {
        if (!id.startsWith(phase.prefix() + "-")) {
            throw new IllegalArgumentException("Item " + id + " does not belong to phase " + phase);
        }
    }

    public ItemResult evaluate(ChecklistContext context) {
        return rule.apply(context);
    }

    /**
     * Failures in the design basis, or on anything about pressure or the ASME
     * code, are critical.
     */
    public boolean isCritical() {
        return phase == ChecklistPhase.DESIGN_BASIS
                || description.toUpperCase(Locale.ROOT).contains("PRESSURE")
                || (reference != null && reference.contains("ASME"));
    }
}
