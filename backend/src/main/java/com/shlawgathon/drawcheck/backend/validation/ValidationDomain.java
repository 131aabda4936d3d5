package com.shlawgathon.drawcheck.backend.validation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Validation domains. Declaration order is the order domains appear in a
 * report.
 */
public enum ValidationDomain {
    GDT("gdt"),
    WELDING("welding"),
    MATERIAL("material"),
    EQUIPMENT_CHECKLIST("equipmentChecklist");

    private final String key;

    ValidationDomain(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Accepts the report key ({@code equipmentChecklist}) or the enum name
     * ({@code EQUIPMENT_CHECKLIST}), case-insensitively.
     */
    public static Optional<ValidationDomain> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace("-", "_").toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.key.equalsIgnoreCase(value.trim()) || d.name().equals(normalized))
                .findFirst();
    }
}
