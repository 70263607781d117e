package com.example.elemental.combat;

import com.example.elemental.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of resolving one attack against one defender, with the breakdown that produced it.
 * Immutable; build through {@link Builder}.
 */
public final class DamageResult {

    /** Total power (or attacker offense) before affinity, resistance and post-modifiers */
    private final double baseDamage;

    /** Damage after every step, including critical and variance */
    private final double finalDamage;

    /** Elements and powers actually resolved (the composite pair if one formed) */
    private final List<Element> attackElements;
    private final List<Double> attackPowers;

    private final boolean composite;
    private final String compositeName;
    private final boolean critical;

    private final Map<Element, Double> defenseResistances;

    /** Damage contributed per element, before critical and variance */
    private final Map<Element, Double> elementBreakdown;

    /** Elements the defender was immune to */
    private final List<Element> immuneElements;

    /** Status effects the hit was eligible to inflict */
    private final List<String> triggeredEffects;

    /** Subset of triggered effects the status-effect system accepted */
    private final List<String> appliedEffects;

    /** Environment ambient effects applied after the hit landed */
    private final List<String> ambientEffects;

    private final List<String> calculationLog;

    private DamageResult(Builder b) {
        this.baseDamage = b.baseDamage;
        this.finalDamage = b.finalDamage;
        this.attackElements = Collections.unmodifiableList(new ArrayList<>(b.attackElements));
        this.attackPowers = Collections.unmodifiableList(new ArrayList<>(b.attackPowers));
        this.composite = b.composite;
        this.compositeName = b.compositeName;
        this.critical = b.critical;
        this.defenseResistances = Collections.unmodifiableMap(copyOf(b.defenseResistances));
        this.elementBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(b.elementBreakdown));
        this.immuneElements = Collections.unmodifiableList(new ArrayList<>(b.immuneElements));
        this.triggeredEffects = Collections.unmodifiableList(new ArrayList<>(b.triggeredEffects));
        this.appliedEffects = Collections.unmodifiableList(new ArrayList<>(b.appliedEffects));
        this.ambientEffects = Collections.unmodifiableList(new ArrayList<>(b.ambientEffects));
        this.calculationLog = Collections.unmodifiableList(new ArrayList<>(b.calculationLog));
    }

    private static Map<Element, Double> copyOf(Map<Element, Double> src) {
        return src.isEmpty() ? new EnumMap<>(Element.class) : new EnumMap<>(src);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy with the final damage scaled by the given multiplier, noted in the log.
     */
    public DamageResult withMultiplier(double multiplier, String reason) {
        if (multiplier == 1.0) return this;
        Builder b = toBuilder();
        b.finalDamage = finalDamage * multiplier;
        b.log(String.format("%s: x%.2f -> %.2f", reason, multiplier, b.finalDamage));
        return b.build();
    }

    /**
     * Copy recording the environment ambient effects that took hold.
     */
    public DamageResult withAmbientEffects(List<String> applied) {
        if (applied == null || applied.isEmpty()) return this;
        Builder b = toBuilder();
        for (String id : applied) {
            b.ambientEffect(id);
            b.log("Ambient effect applied: " + id);
        }
        return b.build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.baseDamage = baseDamage;
        b.finalDamage = finalDamage;
        b.attackElements.addAll(attackElements);
        b.attackPowers.addAll(attackPowers);
        b.composite = composite;
        b.compositeName = compositeName;
        b.critical = critical;
        b.defenseResistances.putAll(defenseResistances);
        b.elementBreakdown.putAll(elementBreakdown);
        b.immuneElements.addAll(immuneElements);
        b.triggeredEffects.addAll(triggeredEffects);
        b.appliedEffects.addAll(appliedEffects);
        b.ambientEffects.addAll(ambientEffects);
        b.calculationLog.addAll(calculationLog);
        return b;
    }

    // Queries

    public double getElementDamage(Element element) {
        Double d = elementBreakdown.get(element);
        return d != null ? d : 0.0;
    }

    public boolean wasElementUsed(Element element) {
        return attackElements.contains(element);
    }

    /**
     * Element with the highest breakdown damage; NONE when nothing was dealt.
     */
    public Element getDominantElement() {
        Element dominant = Element.NONE;
        double highest = 0.0;
        for (Map.Entry<Element, Double> e : elementBreakdown.entrySet()) {
            if (e.getValue() > highest) {
                highest = e.getValue();
                dominant = e.getKey();
            }
        }
        return dominant;
    }

    public double getBaseDamage() { return baseDamage; }
    public double getFinalDamage() { return finalDamage; }
    public List<Element> getAttackElements() { return attackElements; }
    public List<Double> getAttackPowers() { return attackPowers; }
    public boolean isComposite() { return composite; }
    public String getCompositeName() { return compositeName; }
    public boolean isCritical() { return critical; }
    public Map<Element, Double> getDefenseResistances() { return defenseResistances; }
    public Map<Element, Double> getElementBreakdown() { return elementBreakdown; }
    public List<Element> getImmuneElements() { return immuneElements; }
    public List<String> getTriggeredEffects() { return triggeredEffects; }
    public List<String> getAppliedEffects() { return appliedEffects; }
    public List<String> getAmbientEffects() { return ambientEffects; }
    public List<String> getCalculationLog() { return calculationLog; }

    @Override
    public String toString() {
        return String.format("DamageResult[base=%.2f, final=%.2f, elements=%s%s%s]",
            baseDamage, finalDamage, attackElements,
            composite ? ", composite" : "", critical ? ", critical" : "");
    }

    public static final class Builder {
        private double baseDamage;
        private double finalDamage;
        private final List<Element> attackElements = new ArrayList<>();
        private final List<Double> attackPowers = new ArrayList<>();
        private boolean composite;
        private String compositeName = "";
        private boolean critical;
        private final Map<Element, Double> defenseResistances = new EnumMap<>(Element.class);
        private final Map<Element, Double> elementBreakdown = new LinkedHashMap<>();
        private final List<Element> immuneElements = new ArrayList<>();
        private final List<String> triggeredEffects = new ArrayList<>();
        private final List<String> appliedEffects = new ArrayList<>();
        private final List<String> ambientEffects = new ArrayList<>();
        private final List<String> calculationLog = new ArrayList<>();

        private Builder() {}

        public Builder baseDamage(double v) { this.baseDamage = v; return this; }
        public Builder finalDamage(double v) { this.finalDamage = v; return this; }

        public Builder attackPair(Element element, double power) {
            attackElements.add(element);
            attackPowers.add(power);
            return this;
        }

        public Builder composite(String name) {
            this.composite = true;
            this.compositeName = name == null ? "" : name;
            return this;
        }

        public Builder critical(boolean v) { this.critical = v; return this; }

        public Builder defenseResistances(Map<Element, Double> resistances) {
            defenseResistances.putAll(resistances);
            return this;
        }

        /** Accumulate damage for an element. */
        public Builder addElementDamage(Element element, double damage) {
            elementBreakdown.merge(element, damage, Double::sum);
            return this;
        }

        public Builder immune(Element element) {
            if (!immuneElements.contains(element)) immuneElements.add(element);
            return this;
        }

        public Builder triggeredEffect(String id) { triggeredEffects.add(id); return this; }
        public Builder appliedEffect(String id) { appliedEffects.add(id); return this; }
        public Builder ambientEffect(String id) { ambientEffects.add(id); return this; }
        public Builder log(String line) { calculationLog.add(line); return this; }

        public double getFinalDamage() { return finalDamage; }

        public DamageResult build() {
            return new DamageResult(this);
        }
    }
}
