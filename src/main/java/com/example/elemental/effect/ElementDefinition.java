package com.example.elemental.effect;

import com.example.elemental.model.Element;
import com.example.elemental.model.ElementFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Descriptive data for one element: flags, lore and the on-hit effects it carries.
 */
public class ElementDefinition {

    private final String elementId;
    private final Element element;
    private String displayName;
    private String description = "";
    private final Set<ElementFlag> flags = EnumSet.noneOf(ElementFlag.class);
    private final List<ElementalEffect> associatedEffects = new ArrayList<>();

    public ElementDefinition(String elementId, Element element) {
        this.elementId = elementId;
        this.element = element;
        this.displayName = element.getDisplayName();
    }

    public ElementDefinition displayName(String name) {
        if (name != null && !name.isEmpty()) this.displayName = name;
        return this;
    }

    public ElementDefinition description(String description) {
        this.description = description == null ? "" : description;
        return this;
    }

    public ElementDefinition flag(ElementFlag flag) {
        if (flag != null) flags.add(flag);
        return this;
    }

    public ElementDefinition effect(ElementalEffect effect) {
        if (effect != null) associatedEffects.add(effect);
        return this;
    }

    public boolean hasFlag(ElementFlag flag) {
        return flags.contains(flag);
    }

    public String getElementId() { return elementId; }
    public Element getElement() { return element; }
    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }
    public Set<ElementFlag> getFlags() { return Collections.unmodifiableSet(flags); }
    public List<ElementalEffect> getAssociatedEffects() { return Collections.unmodifiableList(associatedEffects); }

    @Override
    public String toString() {
        return "ElementDefinition{" + elementId + " " + element + " flags=" + flags + "}";
    }
}
