package com.example.elemental.combat;

import com.example.elemental.model.Attack;
import com.example.elemental.model.ConversionRule;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementPower;
import com.example.elemental.model.StatAccessor;
import com.example.elemental.model.StatKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles outgoing attacks from registered weapon and skill element bonuses.
 *
 * Weapon bonuses scale off the attacker's OFFENSE stat, skill bonuses off MAGIC_POWER:
 * each contributes flat + stat * percentage (percentage as a fraction, only when positive).
 * Contributions of zero or less are dropped. With no contribution at all the attack
 * falls back to a bare (NONE, offense) hit.
 *
 * Bonuses registered by modifiers live in their own table keyed by modifier id and join
 * every attack the owner builds. They never share a bucket with a skill of the same id.
 */
public class AttackBuilder {

    /** One registered element bonus. A temporary bonus counts its duration down in {@link #tick}. */
    public static class ElementalBonus {
        private final Element element;
        private final double flatBonus;
        private final double percentageBonus;
        private final boolean temporary;
        private final String sourceId;
        private double duration;

        ElementalBonus(Element element, double flatBonus, double percentageBonus, double duration, String sourceId) {
            this.element = element;
            this.flatBonus = flatBonus;
            this.percentageBonus = percentageBonus;
            this.temporary = duration > 0;
            this.duration = duration;
            this.sourceId = sourceId;
        }

        double computePower(double scalingStat) {
            double power = flatBonus;
            if (percentageBonus > 0) {
                power += scalingStat * percentageBonus;
            }
            return power;
        }

        public Element getElement() { return element; }
        public double getFlatBonus() { return flatBonus; }
        public double getPercentageBonus() { return percentageBonus; }
        public boolean isTemporary() { return temporary; }
        public double getDuration() { return duration; }
        public String getSourceId() { return sourceId; }
    }

    private final Map<String, List<ElementalBonus>> weaponBonuses = new LinkedHashMap<>();
    private final Map<String, List<ElementalBonus>> skillBonuses = new LinkedHashMap<>();
    private final Map<String, List<ElementalBonus>> modifierBonuses = new LinkedHashMap<>();

    // === Registration ===

    public void registerWeaponBonus(String weaponId, Element element, double flatBonus, double percentageBonus) {
        if (weaponId == null || element == null) return;
        weaponBonuses.computeIfAbsent(weaponId, k -> new ArrayList<>())
            .add(new ElementalBonus(element, flatBonus, percentageBonus, -1, weaponId));
    }

    /**
     * Register a skill bonus. A positive duration makes it temporary; zero or negative is permanent.
     */
    public void registerSkillBonus(String skillId, Element element, double flatBonus, double percentageBonus, double duration) {
        if (skillId == null || element == null) return;
        skillBonuses.computeIfAbsent(skillId, k -> new ArrayList<>())
            .add(new ElementalBonus(element, flatBonus, percentageBonus, duration, skillId));
    }

    public void registerSkillBonus(String skillId, Element element, double flatBonus, double percentageBonus) {
        registerSkillBonus(skillId, element, flatBonus, percentageBonus, -1);
    }

    /**
     * Register a bonus owned by a modifier. It scales off MAGIC_POWER and applies to every
     * attack until removed.
     */
    public void registerModifierBonus(String modifierId, Element element, double flatBonus, double percentageBonus, double duration) {
        if (modifierId == null || element == null) return;
        modifierBonuses.computeIfAbsent(modifierId, k -> new ArrayList<>())
            .add(new ElementalBonus(element, flatBonus, percentageBonus, duration, modifierId));
    }

    public boolean removeWeaponBonuses(String weaponId) {
        return weaponBonuses.remove(weaponId) != null;
    }

    public boolean removeSkillBonuses(String skillId) {
        return skillBonuses.remove(skillId) != null;
    }

    public boolean removeModifierBonuses(String modifierId) {
        return modifierBonuses.remove(modifierId) != null;
    }

    // === Building ===

    public Attack build(StatAccessor attacker, String weaponId, String skillId) {
        return build(attacker, weaponId, skillId, List.of(), 1.0);
    }

    /**
     * Build an attack, then apply conversion rules in order and set the composite multiplier.
     */
    public Attack build(StatAccessor attacker, String weaponId, String skillId,
                        List<ConversionRule> conversions, double compositeMultiplier) {
        double offense = attacker != null ? attacker.getStatOrNeutral(StatKind.OFFENSE) : 0.0;
        double magic = attacker != null ? attacker.getStatOrNeutral(StatKind.MAGIC_POWER) : 0.0;

        List<ElementPower> pairs = new ArrayList<>();
        if (weaponId != null && !weaponId.isEmpty()) {
            addContributions(pairs, weaponBonuses.get(weaponId), offense);
        }
        if (skillId != null && !skillId.isEmpty()) {
            addContributions(pairs, skillBonuses.get(skillId), magic);
        }
        for (List<ElementalBonus> bonuses : modifierBonuses.values()) {
            addContributions(pairs, bonuses, magic);
        }

        if (pairs.isEmpty()) {
            pairs.add(new ElementPower(Element.NONE, offense));
        }

        Attack attack = new Attack(pairs, attacker);
        if (conversions != null) {
            for (ConversionRule rule : conversions) {
                attack = rule.apply(attack);
            }
        }
        if (compositeMultiplier != 1.0) {
            attack = attack.withCompositeMultiplier(compositeMultiplier);
        }
        return attack;
    }

    private static void addContributions(List<ElementPower> out, List<ElementalBonus> bonuses, double scalingStat) {
        if (bonuses == null) return;
        for (ElementalBonus bonus : bonuses) {
            double power = bonus.computePower(scalingStat);
            if (power > 0) {
                out.add(new ElementPower(bonus.element, power));
            }
        }
    }

    // === Lifecycle ===

    /**
     * Count temporary bonuses down; each weapon, skill and modifier bucket expires independently.
     */
    public void tick(double deltaSeconds) {
        tickBuckets(weaponBonuses, deltaSeconds);
        tickBuckets(skillBonuses, deltaSeconds);
        tickBuckets(modifierBonuses, deltaSeconds);
    }

    private static void tickBuckets(Map<String, List<ElementalBonus>> buckets, double deltaSeconds) {
        Iterator<Map.Entry<String, List<ElementalBonus>>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            List<ElementalBonus> bonuses = it.next().getValue();
            bonuses.removeIf(b -> {
                if (!b.temporary) return false;
                b.duration -= deltaSeconds;
                return b.duration <= 0;
            });
            if (bonuses.isEmpty()) it.remove();
        }
    }

    public void clearTemporaryBonuses() {
        clearTemporary(weaponBonuses);
        clearTemporary(skillBonuses);
        clearTemporary(modifierBonuses);
    }

    private static void clearTemporary(Map<String, List<ElementalBonus>> buckets) {
        for (List<ElementalBonus> bonuses : buckets.values()) {
            bonuses.removeIf(b -> b.temporary);
        }
        buckets.values().removeIf(List::isEmpty);
    }

    // === Queries ===

    public List<ElementalBonus> getWeaponBonuses(String weaponId) {
        List<ElementalBonus> bonuses = weaponBonuses.get(weaponId);
        return bonuses != null ? new ArrayList<>(bonuses) : new ArrayList<>();
    }

    public List<ElementalBonus> getSkillBonuses(String skillId) {
        List<ElementalBonus> bonuses = skillBonuses.get(skillId);
        return bonuses != null ? new ArrayList<>(bonuses) : new ArrayList<>();
    }

    public List<ElementalBonus> getModifierBonuses(String modifierId) {
        List<ElementalBonus> bonuses = modifierBonuses.get(modifierId);
        return bonuses != null ? new ArrayList<>(bonuses) : new ArrayList<>();
    }

    public boolean hasSkillBonuses(String skillId) {
        return skillBonuses.containsKey(skillId);
    }

    public int getWeaponBucketCount() {
        return weaponBonuses.size();
    }

    public int getSkillBucketCount() {
        return skillBonuses.size();
    }

    public int getModifierBucketCount() {
        return modifierBonuses.size();
    }
}
