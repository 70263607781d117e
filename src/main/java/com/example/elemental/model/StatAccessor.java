package com.example.elemental.model;

/**
 * Narrow view of an entity's stat storage. The engine never owns character stats;
 * it reads them and reports damage back through this interface.
 */
public interface StatAccessor {

    /**
     * Read a stat value.
     * @return the value, or null if the entity does not expose this stat
     */
    Double getStat(StatKind kind);

    /**
     * Apply resolved damage to the entity.
     */
    void applyDamage(double amount);

    /**
     * Read a stat, falling back to the kind's neutral value when missing.
     */
    default double getStatOrNeutral(StatKind kind) {
        Double value = getStat(kind);
        return value != null ? value : kind.getNeutralValue();
    }
}
