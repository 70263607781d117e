package com.example.elemental.model;

import java.util.Objects;

/**
 * A single (element, power) contribution of an attack.
 */
public record ElementPower(Element element, double power) {

    public ElementPower {
        Objects.requireNonNull(element, "element");
    }

    public ElementPower withPower(double newPower) {
        return new ElementPower(element, newPower);
    }

    @Override
    public String toString() {
        return String.format("%s:%.2f", element.getDisplayName(), power);
    }
}
