package com.example.elemental.model;

/**
 * Attacker stats read by the elemental engine.
 * Each kind carries the neutral value used when an entity does not expose it.
 */
public enum StatKind {
    /** Base attack stat; scales weapon bonuses and is the bare-hit fallback power */
    OFFENSE(0.0),
    /** Scales skill bonuses */
    MAGIC_POWER(0.0),
    /** Chance (0.0-1.0) of a critical hit */
    CRITICAL_RATE(0.0),
    /** Damage multiplier applied on a critical hit */
    CRITICAL_DAMAGE(1.0);

    private final double neutralValue;

    StatKind(double neutralValue) {
        this.neutralValue = neutralValue;
    }

    public double getNeutralValue() {
        return neutralValue;
    }
}
