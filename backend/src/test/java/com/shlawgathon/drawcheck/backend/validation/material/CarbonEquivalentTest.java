package com.shlawgathon.drawcheck.backend.validation.material;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CarbonEquivalentTest {

    @Test
    void combinesAllAlloyingElements() {
        Map<String, Double> chemistry = Map.of(
                "carbon", 0.20, "manganese", 1.20, "chromium", 0.10, "nickel", 0.30);

        assertThat(CarbonEquivalent.iiw(chemistry)).hasValueSatisfying(ce -> assertThat(ce).isCloseTo(0.44,
                within(1e-9)));
    }

    @Test
    void requiresCarbonAndManganese() {
        assertThat(CarbonEquivalent.iiw(Map.of("carbon", 0.2))).isEmpty();
        assertThat(CarbonEquivalent.iiw(Map.of("manganese", 1.0))).isEmpty();
    }
}
