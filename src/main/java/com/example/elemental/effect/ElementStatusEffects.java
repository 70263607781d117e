package com.example.elemental.effect;

import com.example.elemental.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Default mapping between elements and the status effects they can inflict.
 */
public final class ElementStatusEffects {

    private static final Map<Element, List<String>> byElement = new EnumMap<>(Element.class);
    private static final Map<String, Element> byStatusEffect = new HashMap<>();

    static {
        add(Element.FIRE, "burn");
        add(Element.FIRE, "ignite");
        add(Element.WATER, "wet");
        add(Element.WATER, "drench");
        add(Element.ICE, "freeze");
        add(Element.ICE, "chill");
        add(Element.LIGHTNING, "shock");
        add(Element.LIGHTNING, "paralyze");
        add(Element.POISON, "poison");
        add(Element.POISON, "toxic");
        add(Element.DARK, "curse");
        add(Element.DARK, "decay");
        add(Element.LIGHT, "holy_blessing");
        add(Element.LIGHT, "purify");
    }

    private ElementStatusEffects() {}

    private static void add(Element element, String statusEffectId) {
        byElement.computeIfAbsent(element, k -> new ArrayList<>()).add(statusEffectId);
        byStatusEffect.put(statusEffectId, element);
    }

    /** Status effect ids the element can inflict; empty if none. */
    public static List<String> forElement(Element element) {
        List<String> ids = byElement.get(element);
        return ids != null ? Collections.unmodifiableList(ids) : List.of();
    }

    /** Element that inflicts the status effect, or null if unmapped. */
    public static Element elementOf(String statusEffectId) {
        return byStatusEffect.get(statusEffectId);
    }

    public static boolean isElementalStatusEffect(String statusEffectId) {
        return byStatusEffect.containsKey(statusEffectId);
    }
}
