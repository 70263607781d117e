package com.example.elemental.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts part or all of one element's power into another element.
 *
 * Replace mode rewrites every matching pair to the target element at percentage of its power.
 * Additive mode keeps the original pairs and appends the converted power as new pairs.
 */
public record ConversionRule(Element sourceElement, Element targetElement, double conversionPercentage, boolean additive) {

    public ConversionRule {
        Objects.requireNonNull(sourceElement, "sourceElement");
        Objects.requireNonNull(targetElement, "targetElement");
    }

    public ConversionRule(Element sourceElement, Element targetElement) {
        this(sourceElement, targetElement, 100.0, false);
    }

    public Attack apply(Attack attack) {
        if (attack.isComposite()) return attack;
        double fraction = conversionPercentage / 100.0;
        List<ElementPower> out = new ArrayList<>(attack.getPairs());
        List<ElementPower> appended = new ArrayList<>();
        boolean changed = false;
        for (int i = 0; i < out.size(); i++) {
            ElementPower pair = out.get(i);
            if (pair.element() != sourceElement) continue;
            double converted = pair.power() * fraction;
            if (additive) {
                appended.add(new ElementPower(targetElement, converted));
            } else {
                out.set(i, new ElementPower(targetElement, converted));
            }
            changed = true;
        }
        if (!changed) return attack;
        out.addAll(appended);
        return attack.withPairs(out);
    }
}
