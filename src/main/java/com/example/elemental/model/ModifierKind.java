package com.example.elemental.model;

public enum ModifierKind {
    ATTACK_BONUS,
    DEFENSE_RESISTANCE,
    AFFINITY_OVERRIDE,
    ELEMENTAL_CONVERSION,
    COMPOSITE_BONUS
}
