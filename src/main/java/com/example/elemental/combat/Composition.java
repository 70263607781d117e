package com.example.elemental.combat;

import com.example.elemental.model.Element;

import java.util.List;

/**
 * Outcome of a composition attempt. When {@code composite} is false, element and power
 * are only the first pair of the attack, reported as a representative.
 */
public record Composition(Element element, double power, List<Element> sourceElements,
                          boolean composite, String name) {

    public Composition {
        sourceElements = sourceElements == null ? List.of() : List.copyOf(sourceElements);
        name = name == null ? "" : name;
    }

    static Composition none(Element representative, double power, List<Element> sourceElements) {
        return new Composition(representative, power, sourceElements, false, "");
    }
}
