package com.example.elemental;

import com.example.elemental.persistence.ElementDataException;
import com.example.elemental.util.ElementalConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ElementalConfigTest {

    private static final double DELTA = 0.001;

    @Test
    @DisplayName("Bundled config matches the built-in defaults")
    void bundledConfig() {
        ElementalConfig config = ElementalConfig.load(ElementalConfig.DEFAULT_RESOURCE);
        ElementalConfig defaults = ElementalConfig.defaults();
        assertEquals(defaults.getGlobalDamageMultiplier(), config.getGlobalDamageMultiplier(), DELTA);
        assertEquals(defaults.getVarianceMin(), config.getVarianceMin(), DELTA);
        assertEquals(defaults.getVarianceMax(), config.getVarianceMax(), DELTA);
        assertEquals(500, config.getTickIntervalMs());
        assertTrue(config.isCompositionEnabled());
    }

    @Test
    @DisplayName("Every key is read")
    void customConfig() {
        ElementalConfig config = ElementalConfig.load("/elemental-test.yaml");
        assertEquals(1.5, config.getGlobalDamageMultiplier(), DELTA);
        assertFalse(config.isCompositionEnabled());
        assertTrue(config.isEnvironmentalEffectsEnabled());
        assertEquals(0.9, config.getVarianceMin(), DELTA);
        assertEquals(1.1, config.getVarianceMax(), DELTA);
        assertEquals(250, config.getTickIntervalMs());
        assertTrue(config.isDebugCalculations());
    }

    @Test
    @DisplayName("Missing config falls back to defaults")
    void missingConfig() {
        ElementalConfig config = ElementalConfig.load("/no-such-config.yaml");
        assertEquals(1.0, config.getGlobalDamageMultiplier(), DELTA);
        assertTrue(config.isEnvironmentalEffectsEnabled());
    }

    @Test
    @DisplayName("Inverted variance band is rejected")
    void invertedVariance() {
        assertThrows(ElementDataException.class, () -> ElementalConfig.load("/fixtures/bad-variance.yaml"));
    }
}
