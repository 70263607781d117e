package com.example.elemental.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Elemental conditions of an area: ambient resistances, per-element damage
 * multipliers and flat power bonuses, and ambient status effects.
 * Elements without an entry are neutral.
 */
public class EnvironmentProfile {

    /** Damage multiplier and flat power bonus for one element. */
    public record DamageModifier(double damageMultiplier, double powerBonus) {}

    /** Status effect the environment may apply while an element is in play. */
    public record AmbientEffect(Element element, String statusEffectId, double applicationChance,
                                Set<Element> immuneElements) {
        public AmbientEffect {
            immuneElements = immuneElements == null ? Set.of() : Set.copyOf(immuneElements);
        }
    }

    private final String profileId;
    private final String profileName;
    private String description = "";
    private final Map<Element, Double> resistances = new EnumMap<>(Element.class);
    private final Map<Element, DamageModifier> damageModifiers = new EnumMap<>(Element.class);
    private final List<AmbientEffect> ambientEffects = new ArrayList<>();

    public EnvironmentProfile(String profileId, String profileName) {
        this.profileId = profileId;
        this.profileName = profileName == null ? profileId : profileName;
    }

    public EnvironmentProfile description(String description) {
        this.description = description == null ? "" : description;
        return this;
    }

    public EnvironmentProfile resistance(Element element, double value) {
        resistances.put(element, Math.max(-1.0, Math.min(1.0, value)));
        return this;
    }

    public EnvironmentProfile damageModifier(Element element, double damageMultiplier, double powerBonus) {
        damageModifiers.put(element, new DamageModifier(damageMultiplier, powerBonus));
        return this;
    }

    public EnvironmentProfile ambientEffect(AmbientEffect effect) {
        ambientEffects.add(effect);
        return this;
    }

    public double getDamageMultiplier(Element element) {
        DamageModifier m = damageModifiers.get(element);
        return m != null ? m.damageMultiplier() : 1.0;
    }

    public double getPowerBonus(Element element) {
        DamageModifier m = damageModifiers.get(element);
        return m != null ? m.powerBonus() : 0.0;
    }

    public double getResistance(Element element) {
        Double v = resistances.get(element);
        return v != null ? v : 0.0;
    }

    public String getProfileId() { return profileId; }
    public String getProfileName() { return profileName; }
    public String getDescription() { return description; }
    public Map<Element, Double> getResistances() { return Collections.unmodifiableMap(resistances); }
    public Map<Element, DamageModifier> getDamageModifiers() { return Collections.unmodifiableMap(damageModifiers); }
    public List<AmbientEffect> getAmbientEffects() { return Collections.unmodifiableList(ambientEffects); }

    @Override
    public String toString() {
        return "EnvironmentProfile{id=" + profileId + ", name=" + profileName + "}";
    }
}
