package com.example.elemental.combat;

import com.example.elemental.model.Attack;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementalModifier;
import com.example.elemental.model.EnvironmentProfile;
import com.example.elemental.model.ResistanceProfile;
import com.example.elemental.model.StatAccessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Elemental state of one entity taking part in combat.
 *
 * Holds the entity's innate resistances, immunities and weaknesses, and a
 * {@link ModifierLedger} for everything equipment, buffs, skills and the environment add.
 * Stats stay with the entity and are reached through a {@link StatAccessor}.
 */
public class ElementalCombatant {

    private static final Logger logger = LoggerFactory.getLogger(ElementalCombatant.class);

    private final String id;
    private final String name;
    private final StatAccessor stats;
    private final ModifierLedger ledger;

    /** Declared element; NONE lets the strongest aggregated resistance decide */
    private Element primaryElement = Element.NONE;
    private Element secondaryElement = Element.NONE;

    private final Map<Element, Double> baseResistances = new EnumMap<>(Element.class);
    private final Set<Element> immunities = EnumSet.noneOf(Element.class);
    private final Set<Element> weaknesses = EnumSet.noneOf(Element.class);

    private final List<ElementalEventListener> listeners = new CopyOnWriteArrayList<>();

    // Pull-based defense cache, keyed on the ledger version (which includes the aggregator's)
    private ResistanceProfile cachedDefense;
    private long cachedVersion = -1;
    private boolean baseDirty = true;

    public ElementalCombatant(String id, String name, StatAccessor stats) {
        this(id, name, stats, new ModifierLedger());
    }

    public ElementalCombatant(String id, String name, StatAccessor stats, ModifierLedger ledger) {
        this.id = id;
        this.name = name == null ? id : name;
        this.stats = stats;
        this.ledger = ledger;
    }

    // ========== Defense ==========

    /**
     * Effective defense: innate resistances plus everything the ledger's aggregator holds,
     * each element clamped to [-1, 1]. Recomputed only when innate data changed or the
     * ledger moved on since the last read.
     */
    public ResistanceProfile getDefense() {
        if (!baseDirty && cachedDefense != null && cachedVersion == ledger.getVersion()) {
            return cachedDefense;
        }
        ResistanceProfile aggregated = ledger.getAggregator().totalDefense();

        ResistanceProfile.Builder b = ResistanceProfile.builder();
        Map<Element, Double> sums = new EnumMap<>(baseResistances);
        for (Map.Entry<Element, Double> e : aggregated.getResistances().entrySet()) {
            sums.merge(e.getKey(), e.getValue(), Double::sum);
        }
        for (Map.Entry<Element, Double> e : sums.entrySet()) {
            b.resistance(e.getKey(), e.getValue());
        }
        b.primaryElement(primaryElement != Element.NONE ? primaryElement : aggregated.getPrimaryElement());
        b.immunities(immunities).immunities(aggregated.getImmunities());
        b.weaknesses(weaknesses).weaknesses(aggregated.getWeaknesses());

        cachedDefense = b.build();
        cachedVersion = ledger.getVersion();
        baseDirty = false;
        return cachedDefense;
    }

    public void setResistance(Element element, double value) {
        baseResistances.put(element, Math.max(-1.0, Math.min(1.0, value)));
        baseDirty = true;
    }

    public void removeResistance(Element element) {
        if (baseResistances.remove(element) != null) baseDirty = true;
    }

    public double getBaseResistance(Element element) {
        Double v = baseResistances.get(element);
        return v != null ? v : 0.0;
    }

    public void addImmunity(Element element) {
        if (immunities.add(element)) baseDirty = true;
    }

    public void removeImmunity(Element element) {
        if (immunities.remove(element)) baseDirty = true;
    }

    public void addWeakness(Element element) {
        if (weaknesses.add(element)) baseDirty = true;
    }

    public void removeWeakness(Element element) {
        if (weaknesses.remove(element)) baseDirty = true;
    }

    public boolean isImmuneTo(Element element) {
        return getDefense().isImmune(element);
    }

    public boolean isWeakTo(Element element) {
        return getDefense().isWeak(element);
    }

    public void setPrimaryElement(Element element) {
        this.primaryElement = element == null ? Element.NONE : element;
        baseDirty = true;
    }

    public void setSecondaryElement(Element element) {
        this.secondaryElement = element == null ? Element.NONE : element;
    }

    public void registerEquipmentDefense(String equipmentId, ResistanceProfile profile) {
        ledger.getAggregator().registerEquipmentDefense(equipmentId, profile);
    }

    public boolean removeEquipmentDefense(String equipmentId) {
        return ledger.getAggregator().removeEquipmentDefense(equipmentId);
    }

    public void registerPassiveDefense(String passiveId, ResistanceProfile profile) {
        ledger.getAggregator().registerPassiveDefense(passiveId, profile);
    }

    public boolean removePassiveDefense(String passiveId) {
        return ledger.getAggregator().removePassiveDefense(passiveId);
    }

    // ========== Attack and damage ==========

    public Attack createAttack(String weaponId, String skillId) {
        return ledger.createAttack(stats, weaponId, skillId);
    }

    /**
     * Resolve an incoming attack against this combatant and apply the damage.
     */
    public DamageResult takeDamage(Attack attack, ResolutionPipeline pipeline,
                                   EnvironmentProfile environment) {
        return applyResult(pipeline.resolve(attack, this, environment));
    }

    /**
     * Apply an already resolved result: damage goes to the stats, then listeners hear about it.
     */
    DamageResult applyResult(DamageResult result) {
        if (stats != null && result.getFinalDamage() > 0) {
            stats.applyDamage(result.getFinalDamage());
        }
        for (Element element : result.getImmuneElements()) {
            for (ElementalEventListener l : listeners) {
                try {
                    l.onImmunityTriggered(this, element);
                } catch (RuntimeException e) {
                    logger.warn("Listener failed on immunity for {}: {}", id, e.getMessage(), e);
                }
            }
        }
        for (ElementalEventListener l : listeners) {
            try {
                l.onDamageResolved(this, result);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on damage for {}: {}", id, e.getMessage(), e);
            }
        }
        return result;
    }

    // ========== Modifiers ==========

    public boolean applyModifier(ElementalModifier modifier) {
        return ledger.apply(modifier);
    }

    public boolean removeModifier(String modifierId) {
        return ledger.remove(modifierId);
    }

    public int removeModifiersBySource(String sourceId) {
        return ledger.removeBySource(sourceId);
    }

    public void tick(double deltaSeconds) {
        ledger.tick(deltaSeconds);
    }

    public void addListener(ElementalEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(ElementalEventListener listener) {
        listeners.remove(listener);
    }

    // Getters

    public String getId() { return id; }
    public String getName() { return name; }
    public StatAccessor getStats() { return stats; }
    public ModifierLedger getLedger() { return ledger; }
    public Element getPrimaryElement() { return primaryElement; }
    public Element getSecondaryElement() { return secondaryElement; }

    @Override
    public String toString() {
        return String.format("ElementalCombatant[%s '%s' primary=%s, modifiers=%d]",
            id, name, primaryElement, ledger.getActiveCount());
    }
}
