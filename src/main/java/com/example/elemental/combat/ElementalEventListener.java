package com.example.elemental.combat;

import com.example.elemental.model.Element;
import com.example.elemental.model.EnvironmentProfile;

/**
 * One-way hook for presentation layers. Exceptions thrown here are logged and ignored.
 */
public interface ElementalEventListener {

    default void onDamageResolved(ElementalCombatant target, DamageResult result) {}

    /**
     * @param previous may be null
     * @param current  may be null when the environment was cleared
     */
    default void onEnvironmentChanged(EnvironmentProfile previous, EnvironmentProfile current) {}

    default void onImmunityTriggered(ElementalCombatant target, Element element) {}
}
