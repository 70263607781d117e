package com.example.elemental.combat;

import com.example.elemental.model.ElementalModifier;

/**
 * Lifecycle notifications from a {@link ModifierLedger}. All methods default to no-ops.
 */
public interface ModifierListener {

    default void onModifierApplied(ElementalModifier modifier) {}

    default void onModifierRemoved(ElementalModifier modifier) {}

    default void onModifierExpired(ElementalModifier modifier) {}
}
