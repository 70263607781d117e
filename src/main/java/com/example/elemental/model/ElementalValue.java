package com.example.elemental.model;

import java.util.Objects;

/**
 * Per-element flat and percentage value pair carried by attack and resistance modifiers.
 * Percentages are in percent (25 = 25%). For resistance modifiers only the flat value is used,
 * as a resistance in [-1, 1].
 */
public record ElementalValue(Element element, double flatValue, double percentageValue) {

    public ElementalValue {
        Objects.requireNonNull(element, "element");
    }

    public ElementalValue(Element element, double flatValue) {
        this(element, flatValue, 0.0);
    }

    public ElementalValue scaled(int stacks) {
        return new ElementalValue(element, flatValue * stacks, percentageValue * stacks);
    }
}
