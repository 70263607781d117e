package com.example.elemental.effect;

import com.example.elemental.model.Element;
import com.example.elemental.model.ElementFlag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory registry of element definitions, one per element.
 * Registering a definition for an element that already has one replaces it.
 */
public class ElementRegistry {

    private final Map<Element, ElementDefinition> definitions = new EnumMap<>(Element.class);

    /**
     * Registry with a definition for every element except NONE. Elements with default
     * status effects get one on-hit effect offering them.
     */
    public static ElementRegistry defaults() {
        ElementRegistry registry = new ElementRegistry();
        for (Element e : Element.values()) {
            if (e == Element.NONE) continue;
            ElementDefinition def = new ElementDefinition(e.name().toLowerCase(), e).flag(ElementFlag.MAGICAL);
            List<String> statusEffects = ElementStatusEffects.forElement(e);
            if (!statusEffects.isEmpty()) {
                ElementalEffect onHit = new ElementalEffect(e.name().toLowerCase() + "_on_hit", e)
                    .name(e.getDisplayName() + " on-hit");
                for (String id : statusEffects) onHit.statusEffect(id);
                def.effect(onHit);
            }
            registry.register(def);
        }
        return registry;
    }

    public void register(ElementDefinition def) {
        if (def != null && def.getElement() != null) definitions.put(def.getElement(), def);
    }

    public ElementDefinition get(Element element) {
        return definitions.get(element);
    }

    public boolean contains(Element element) {
        return definitions.containsKey(element);
    }

    public Collection<ElementDefinition> getAll() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public List<ElementDefinition> getByFlag(ElementFlag flag) {
        List<ElementDefinition> out = new ArrayList<>();
        for (ElementDefinition def : definitions.values()) {
            if (def.hasFlag(flag)) out.add(def);
        }
        return out;
    }

    /**
     * On-hit effects of the element's definition that a hit of the given damage triggers.
     */
    public List<ElementalEffect> getTriggeredEffects(Element element, double damage) {
        List<ElementalEffect> out = new ArrayList<>();
        ElementDefinition def = definitions.get(element);
        if (def == null) return out;
        for (ElementalEffect effect : def.getAssociatedEffects()) {
            if (effect.shouldApply(damage, element)) out.add(effect);
        }
        return out;
    }

    public int size() {
        return definitions.size();
    }

    public void clear() {
        definitions.clear();
    }
}
