package com.example.elemental.combat;

import com.example.elemental.model.Element;
import com.example.elemental.model.ResistanceProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines independently sourced resistance profiles into one effective profile.
 *
 * Sources live in three tables (equipment, passive, temporary) keyed by source id so each
 * can be revoked on its own. Stacked values saturate through diminishing returns:
 * positive sums become s / (s + 1), negative sums s / (1 - s).
 *
 * Immunity and weakness sets are unioned across sources. Every change to a source table
 * advances {@link #getVersion()}.
 */
public class ResistanceAggregator {

    private final Map<String, ResistanceProfile> equipmentDefenses = new LinkedHashMap<>();
    private final Map<String, ResistanceProfile> passiveDefenses = new LinkedHashMap<>();
    private final Map<String, ResistanceProfile> temporaryDefenses = new LinkedHashMap<>();
    private long version;

    // === Source tables ===

    public void registerEquipmentDefense(String equipmentId, ResistanceProfile profile) {
        if (equipmentId == null || profile == null) return;
        equipmentDefenses.put(equipmentId, profile);
        version++;
    }

    public void registerPassiveDefense(String passiveId, ResistanceProfile profile) {
        if (passiveId == null || profile == null) return;
        passiveDefenses.put(passiveId, profile);
        version++;
    }

    public void registerTemporaryDefense(String sourceId, ResistanceProfile profile) {
        if (sourceId == null || profile == null) return;
        temporaryDefenses.put(sourceId, profile);
        version++;
    }

    public boolean removeEquipmentDefense(String equipmentId) {
        return changed(equipmentDefenses.remove(equipmentId) != null);
    }

    public boolean removePassiveDefense(String passiveId) {
        return changed(passiveDefenses.remove(passiveId) != null);
    }

    public boolean removeTemporaryDefense(String sourceId) {
        return changed(temporaryDefenses.remove(sourceId) != null);
    }

    public void clearTemporaryDefenses() {
        changed(!temporaryDefenses.isEmpty());
        temporaryDefenses.clear();
    }

    private boolean changed(boolean changed) {
        if (changed) version++;
        return changed;
    }

    public long getVersion() {
        return version;
    }

    public ResistanceProfile getTemporaryDefense(String sourceId) {
        return temporaryDefenses.get(sourceId);
    }

    public Map<String, ResistanceProfile> getTemporaryDefenses() {
        return Collections.unmodifiableMap(temporaryDefenses);
    }

    public int getSourceCount() {
        return equipmentDefenses.size() + passiveDefenses.size() + temporaryDefenses.size();
    }

    /**
     * Aggregate every registered source: equipment, then passive, then temporary.
     */
    public ResistanceProfile totalDefense() {
        List<ResistanceProfile> all = new ArrayList<>(getSourceCount());
        all.addAll(equipmentDefenses.values());
        all.addAll(passiveDefenses.values());
        all.addAll(temporaryDefenses.values());
        return aggregate(all);
    }

    // === Aggregation ===

    public ResistanceProfile aggregate(List<ResistanceProfile> sources) {
        ResistanceProfile.Builder out = ResistanceProfile.builder();
        if (sources == null || sources.isEmpty()) return out.build();

        // First-seen order decides primary-element ties
        Map<Element, Double> sums = new LinkedHashMap<>();
        for (ResistanceProfile source : sources) {
            if (source == null) continue;
            for (Map.Entry<Element, Double> e : source.getResistances().entrySet()) {
                double v = e.getValue();
                if (v == 0.0) continue;
                sums.merge(e.getKey(), v, Double::sum);
            }
            out.immunities(source.getImmunities());
            out.weaknesses(source.getWeaknesses());
        }

        Element primary = Element.NONE;
        double highest = 0.0;
        for (Map.Entry<Element, Double> e : sums.entrySet()) {
            double effective = diminish(e.getValue());
            out.resistance(e.getKey(), effective);
            if (effective > highest) {
                highest = effective;
                primary = e.getKey();
            }
        }
        return out.primaryElement(primary).build();
    }

    /**
     * Diminishing-returns curve bounding any stack of resistances to (-1, 1).
     */
    public static double diminish(double total) {
        if (total > 0) return total / (total + 1.0);
        if (total < 0) return total / (1.0 - total);
        return 0.0;
    }
}
