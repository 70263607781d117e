package com.example.elemental;

import com.example.elemental.effect.ElementRegistry;
import com.example.elemental.effect.ElementStatusEffects;
import com.example.elemental.effect.ElementalEffect;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementFlag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ElementRegistryTest {

    @Test
    @DisplayName("Defaults define every element except NONE")
    void defaults() {
        ElementRegistry registry = ElementRegistry.defaults();
        assertEquals(Element.values().length - 1, registry.size());
        assertFalse(registry.contains(Element.NONE));
        assertEquals(registry.size(), registry.getByFlag(ElementFlag.MAGICAL).size());
    }

    @Test
    @DisplayName("Default fire hits offer burn and ignite")
    void defaultFireEffects() {
        List<ElementalEffect> effects = ElementRegistry.defaults().getTriggeredEffects(Element.FIRE, 1);
        assertEquals(1, effects.size());
        assertEquals(List.of("burn", "ignite"), effects.get(0).getStatusEffectIds());
        assertTrue(ElementRegistry.defaults().getTriggeredEffects(Element.EARTH, 100).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "burn, FIRE",
        "chill, ICE",
        "paralyze, LIGHTNING",
        "purify, LIGHT"
    })
    @DisplayName("Status effects map back to their element")
    void statusEffectMapping(String statusEffect, Element element) {
        assertEquals(element, ElementStatusEffects.elementOf(statusEffect));
        assertTrue(ElementStatusEffects.isElementalStatusEffect(statusEffect));
    }

    @Test
    @DisplayName("Unmapped status effects have no element")
    void unmapped() {
        assertNull(ElementStatusEffects.elementOf("sleep"));
        assertTrue(ElementStatusEffects.forElement(Element.VOID).isEmpty());
    }
}
