package com.example.elemental.effect;

import com.example.elemental.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An on-hit effect attached to an element definition. It names the status effects
 * offered to the target when an attack of the trigger element lands.
 */
public class ElementalEffect {

    private final String effectId;
    private final Element triggerElement;
    private String effectName;
    private double basePower = 10.0;
    private double duration = 5.0;
    private double minimumDamage;
    private final List<String> statusEffectIds = new ArrayList<>();

    public ElementalEffect(String effectId, Element triggerElement) {
        this.effectId = effectId;
        this.triggerElement = triggerElement;
        this.effectName = effectId;
    }

    public ElementalEffect name(String name) {
        this.effectName = name == null ? effectId : name;
        return this;
    }

    public ElementalEffect basePower(double power) {
        this.basePower = power;
        return this;
    }

    public ElementalEffect duration(double seconds) {
        this.duration = seconds;
        return this;
    }

    /** Damage the hit must reach before the effect triggers. */
    public ElementalEffect minimumDamage(double damage) {
        this.minimumDamage = damage;
        return this;
    }

    public ElementalEffect statusEffect(String statusEffectId) {
        if (statusEffectId != null && !statusEffectId.isEmpty()) {
            statusEffectIds.add(statusEffectId);
        }
        return this;
    }

    /**
     * Whether a hit of the given element and damage triggers this effect.
     */
    public boolean shouldApply(double damage, Element attackElement) {
        return attackElement == triggerElement && damage >= minimumDamage;
    }

    public String getEffectId() { return effectId; }
    public String getEffectName() { return effectName; }
    public Element getTriggerElement() { return triggerElement; }
    public double getBasePower() { return basePower; }
    public double getDuration() { return duration; }
    public double getMinimumDamage() { return minimumDamage; }
    public List<String> getStatusEffectIds() { return Collections.unmodifiableList(statusEffectIds); }
}
