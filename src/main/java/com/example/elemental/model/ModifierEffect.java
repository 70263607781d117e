package com.example.elemental.model;

import java.util.List;
import java.util.Objects;

/**
 * What an elemental modifier does. One variant per modifier kind, each carrying only
 * the data that kind needs.
 */
public sealed interface ModifierEffect
        permits ModifierEffect.AttackBonus, ModifierEffect.DefenseResistance,
                ModifierEffect.AffinityOverride, ModifierEffect.ElementalConversion,
                ModifierEffect.CompositeBonus {

    ModifierKind kind();

    /** Adds element power to attacks built by the owner. */
    record AttackBonus(List<ElementalValue> values) implements ModifierEffect {
        public AttackBonus {
            values = List.copyOf(Objects.requireNonNull(values, "values"));
        }
        @Override public ModifierKind kind() { return ModifierKind.ATTACK_BONUS; }
    }

    /** Adds a temporary resistance source to the owner's defense. */
    record DefenseResistance(List<ElementalValue> values) implements ModifierEffect {
        public DefenseResistance {
            values = List.copyOf(Objects.requireNonNull(values, "values"));
        }
        @Override public ModifierKind kind() { return ModifierKind.DEFENSE_RESISTANCE; }
    }

    /** Replaces affinity multipliers for specific element pairs. */
    record AffinityOverride(List<AffinityOverrideEntry> entries) implements ModifierEffect {
        public AffinityOverride {
            entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        }
        @Override public ModifierKind kind() { return ModifierKind.AFFINITY_OVERRIDE; }
    }

    /** Converts element power when the owner builds an attack. */
    record ElementalConversion(ConversionRule rule) implements ModifierEffect {
        public ElementalConversion {
            Objects.requireNonNull(rule, "rule");
        }
        @Override public ModifierKind kind() { return ModifierKind.ELEMENTAL_CONVERSION; }
    }

    /** Multiplies the power of composites formed from the owner's attacks. */
    record CompositeBonus(double multiplier) implements ModifierEffect {
        @Override public ModifierKind kind() { return ModifierKind.COMPOSITE_BONUS; }
    }
}
