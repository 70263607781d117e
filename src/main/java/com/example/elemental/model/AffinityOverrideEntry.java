package com.example.elemental.model;

import java.util.Objects;

/**
 * Replacement affinity multiplier for one (attack element, defense element) pair.
 */
public record AffinityOverrideEntry(Element attackElement, Element defenseElement, double newAffinity) {

    public AffinityOverrideEntry {
        Objects.requireNonNull(attackElement, "attackElement");
        Objects.requireNonNull(defenseElement, "defenseElement");
    }
}
