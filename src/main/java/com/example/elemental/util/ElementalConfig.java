package com.example.elemental.util;

import com.example.elemental.persistence.ElementDataException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Engine-wide settings, read from the {@code elemental} section of a YAML resource.
 * Keys left out keep their defaults.
 */
public class ElementalConfig {

    private static final Logger logger = LoggerFactory.getLogger(ElementalConfig.class);

    public static final String DEFAULT_RESOURCE = "/elemental.yaml";

    private double globalDamageMultiplier = 1.0;
    private boolean compositionEnabled = true;
    private boolean environmentalEffectsEnabled = true;
    private double varianceMin = 0.95;
    private double varianceMax = 1.05;
    private long tickIntervalMs = 500;
    private boolean debugCalculations = false;

    public static ElementalConfig defaults() {
        return new ElementalConfig();
    }

    /**
     * Load from a classpath resource. A missing resource yields the defaults;
     * malformed YAML raises {@link ElementDataException}.
     */
    public static ElementalConfig load(String resourcePath) {
        ElementalConfig config = new ElementalConfig();
        try (InputStream is = ElementalConfig.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.info("Config resource {} not found, using defaults", resourcePath);
                return config;
            }
            Yaml yaml = new Yaml();
            Object root = yaml.load(is);
            if (!(root instanceof Map<?, ?> data)) return config;
            Object section = data.get("elemental");
            if (section instanceof Map<?, ?> settings) {
                config.apply(settings, resourcePath);
            }
        } catch (YAMLException e) {
            throw new ElementDataException(resourcePath, "malformed YAML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ElementDataException(resourcePath, "read failed: " + e.getMessage(), e);
        }
        logger.info("Loaded elemental config from {}: {}", resourcePath, config);
        return config;
    }

    private void apply(Map<?, ?> s, String resourcePath) {
        globalDamageMultiplier = number(s, "global_damage_multiplier", globalDamageMultiplier, resourcePath);
        compositionEnabled = bool(s, "composition_enabled", compositionEnabled);
        environmentalEffectsEnabled = bool(s, "environmental_effects_enabled", environmentalEffectsEnabled);
        varianceMin = number(s, "variance_min", varianceMin, resourcePath);
        varianceMax = number(s, "variance_max", varianceMax, resourcePath);
        tickIntervalMs = (long) number(s, "tick_interval_ms", tickIntervalMs, resourcePath);
        debugCalculations = bool(s, "debug_calculations", debugCalculations);
        if (varianceMax < varianceMin) {
            throw new ElementDataException(resourcePath, "variance_max below variance_min");
        }
    }

    private static double number(Map<?, ?> s, String key, double fallback, String resourcePath) {
        Object o = s.get(key);
        if (o == null) return fallback;
        if (o instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(o.toString().trim());
        } catch (NumberFormatException e) {
            throw new ElementDataException(resourcePath, "not a number for " + key + ": " + o, e);
        }
    }

    private static boolean bool(Map<?, ?> s, String key, boolean fallback) {
        Object o = s.get(key);
        if (o == null) return fallback;
        if (o instanceof Boolean b) return b;
        return Boolean.parseBoolean(o.toString().trim());
    }

    // Fluent setters for programmatic setup and tests

    public ElementalConfig globalDamageMultiplier(double v) { this.globalDamageMultiplier = v; return this; }
    public ElementalConfig compositionEnabled(boolean v) { this.compositionEnabled = v; return this; }
    public ElementalConfig environmentalEffectsEnabled(boolean v) { this.environmentalEffectsEnabled = v; return this; }
    public ElementalConfig variance(double min, double max) { this.varianceMin = min; this.varianceMax = max; return this; }
    public ElementalConfig tickIntervalMs(long v) { this.tickIntervalMs = v; return this; }
    public ElementalConfig debugCalculations(boolean v) { this.debugCalculations = v; return this; }

    public double getGlobalDamageMultiplier() { return globalDamageMultiplier; }
    public boolean isCompositionEnabled() { return compositionEnabled; }
    public boolean isEnvironmentalEffectsEnabled() { return environmentalEffectsEnabled; }
    public double getVarianceMin() { return varianceMin; }
    public double getVarianceMax() { return varianceMax; }
    public long getTickIntervalMs() { return tickIntervalMs; }
    public boolean isDebugCalculations() { return debugCalculations; }

    @Override
    public String toString() {
        return String.format("ElementalConfig[multiplier=%.2f, composition=%s, environment=%s, variance=[%.2f, %.2f), tick=%dms]",
            globalDamageMultiplier, compositionEnabled, environmentalEffectsEnabled, varianceMin, varianceMax, tickIntervalMs);
    }
}
