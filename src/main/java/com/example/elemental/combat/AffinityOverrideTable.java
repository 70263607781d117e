package com.example.elemental.combat;

import com.example.elemental.model.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-bounded replacements for affinity pairs. Consulted before the static
 * {@link AffinityTable}; the first registered override for a pair wins.
 */
public class AffinityOverrideTable {

    /** A single active override. A negative duration at registration means permanent. */
    public static class AffinityOverride {
        private final String overrideId;
        private final Element attackElement;
        private final Element defenseElement;
        private final double newAffinity;
        private final boolean permanent;
        private final String sourceId;
        private double remainingDuration;

        AffinityOverride(String overrideId, Element attackElement, Element defenseElement,
                         double newAffinity, double duration, String sourceId) {
            this.overrideId = overrideId;
            this.attackElement = attackElement;
            this.defenseElement = defenseElement;
            this.newAffinity = newAffinity;
            this.permanent = duration < 0;
            this.remainingDuration = duration;
            this.sourceId = sourceId == null ? "" : sourceId;
        }

        public boolean matches(Element attack, Element defense) {
            return attackElement == attack && defenseElement == defense;
        }

        public String getOverrideId() { return overrideId; }
        public Element getAttackElement() { return attackElement; }
        public Element getDefenseElement() { return defenseElement; }
        public double getNewAffinity() { return newAffinity; }
        public boolean isPermanent() { return permanent; }
        public double getRemainingDuration() { return remainingDuration; }
        public String getSourceId() { return sourceId; }
    }

    private final Map<String, AffinityOverride> activeOverrides = new LinkedHashMap<>();

    public void addOverride(String overrideId, Element attackElement, Element defenseElement,
                            double newAffinity, double duration, String sourceId) {
        activeOverrides.put(overrideId,
            new AffinityOverride(overrideId, attackElement, defenseElement, newAffinity, duration, sourceId));
    }

    /** Permanent override with no source. */
    public void addOverride(String overrideId, Element attackElement, Element defenseElement, double newAffinity) {
        addOverride(overrideId, attackElement, defenseElement, newAffinity, -1, "");
    }

    public boolean removeOverride(String overrideId) {
        return activeOverrides.remove(overrideId) != null;
    }

    /**
     * Remove every override registered with the given source id.
     * @return number removed
     */
    public int removeOverridesBySource(String sourceId) {
        List<String> toRemove = new ArrayList<>();
        for (AffinityOverride o : activeOverrides.values()) {
            if (o.sourceId.equals(sourceId)) {
                toRemove.add(o.overrideId);
            }
        }
        for (String id : toRemove) {
            activeOverrides.remove(id);
        }
        return toRemove.size();
    }

    /**
     * Override value for the pair, or the given original affinity when none is active.
     */
    public double getModifiedAffinity(Element attackElement, Element defenseElement, double originalAffinity) {
        AffinityOverride o = findOverride(attackElement, defenseElement);
        return o != null ? o.newAffinity : originalAffinity;
    }

    public AffinityOverride findOverride(Element attackElement, Element defenseElement) {
        for (AffinityOverride o : activeOverrides.values()) {
            if (o.matches(attackElement, defenseElement)) return o;
        }
        return null;
    }

    /**
     * Advance durations and drop overrides that ran out.
     * @return ids of the overrides that expired this tick
     */
    public List<String> tick(double deltaSeconds) {
        List<String> expired = new ArrayList<>();
        for (AffinityOverride o : activeOverrides.values()) {
            if (o.permanent) continue;
            o.remainingDuration -= deltaSeconds;
            if (o.remainingDuration <= 0) {
                expired.add(o.overrideId);
            }
        }
        for (String id : expired) {
            activeOverrides.remove(id);
        }
        return expired;
    }

    public boolean hasOverride(String overrideId) {
        return activeOverrides.containsKey(overrideId);
    }

    public List<AffinityOverride> getActiveOverrides() {
        return new ArrayList<>(activeOverrides.values());
    }

    public int size() {
        return activeOverrides.size();
    }

    public void clear() {
        activeOverrides.clear();
    }
}
