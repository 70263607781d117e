package com.example.elemental.combat;

/**
 * How a composite rule merges the powers of its contributing elements.
 */
public enum CombineMethod {
    /** Arithmetic mean of all contributing powers */
    AVERAGE,
    /** Largest contributing power */
    HIGHEST,
    /** Smallest contributing power */
    LOWEST,
    /** Mean weighted by per-element weights (default weight 1.0) */
    WEIGHTED,
    /** Mean power normalized over a 100-point scale, passed through the rule's curve, rescaled x100 */
    CUSTOM_CURVE;

    public static CombineMethod fromString(String s) {
        if (s == null || s.isEmpty()) return AVERAGE;
        String norm = s.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        if (norm.equals("CUSTOMCURVE")) return CUSTOM_CURVE;
        for (CombineMethod m : values()) {
            if (m.name().equals(norm)) return m;
        }
        return null;
    }
}
