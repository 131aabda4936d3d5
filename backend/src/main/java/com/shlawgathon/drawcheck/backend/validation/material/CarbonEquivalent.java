package com.shlawgathon.drawcheck.backend.validation.material;

import java.util.Map;
import java.util.Optional;

/**
 * IIW carbon equivalent: CE = C + Mn/6 + (Cr + Mo + V)/5 + (Ni + Cu)/15.
 */
public final class CarbonEquivalent {

    private CarbonEquivalent() {
    }

    /**
     * Empty unless both carbon and manganese are known. Other elements count
     * as zero when absent.
     */
    public static Optional<Double> iiw(Map<String, Double> chemistry) {
        Double carbon = chemistry.get("carbon");
        Double manganese = chemistry.get("manganese");
        if (carbon == null || manganese == null) {
            return Optional.empty();
        }
        double ce = carbon + manganese / 6.0
                + (get(chemistry, "chromium") + get(chemistry, "molybdenum") + get(chemistry, "vanadium")) / 5.0
                + (get(chemistry, "nickel") + get(chemistry, "copper")) / 15.0;
        return Optional.of(ce);
    }

    private static double get(Map<String, Double> chemistry, String element) {
        return chemistry.getOrDefault(element, 0.0);
    }
}
