package com.example.elemental.model;

/**
 * Classification flags for element definitions.
 */
public enum ElementFlag {
    PHYSICAL,
    MAGICAL,
    HEALING,
    DEBUFF,
    ENVIRONMENTAL,
    ETHEREAL
}
