package com.shlawgathon.drawcheck.backend.validation.gdt;

import java.util.Optional;

public enum MaterialCondition {
    MMC, LMC, RFS;

    /**
     * Accepts MMC/LMC/RFS, the circled letters and their (M)/(L)/(S) forms.
     */
    public static Optional<MaterialCondition> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        switch (symbol.replaceAll("[()\\s]", "")) {
            case "MMC", "M", "Ⓜ":
                return Optional.of(MMC);
            case "LMC", "L", "Ⓛ":
                return Optional.of(LMC);
            case "RFS", "S", "Ⓢ":
                return Optional.of(RFS);
            default:
                return Optional.empty();
        }
    }

    public boolean allowsBonus() {
        return this != RFS;
    }
}
