package com.example.elemental.combat;

import com.example.elemental.model.AffinityOverrideEntry;
import com.example.elemental.model.Attack;
import com.example.elemental.model.ConversionRule;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementalModifier;
import com.example.elemental.model.ElementalValue;
import com.example.elemental.model.EnvironmentProfile;
import com.example.elemental.model.ModifierEffect;
import com.example.elemental.model.ModifierKind;
import com.example.elemental.model.ResistanceProfile;
import com.example.elemental.model.StatAccessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks the elemental modifiers active on one entity and routes each modifier's
 * effect into the tables it changes: attack bonuses into the {@link AttackBuilder},
 * resistances into the {@link ResistanceAggregator}, affinity overrides into the
 * {@link AffinityOverrideTable}. Conversions and composite bonuses stay here and are
 * read when an attack is built.
 *
 * Removing a modifier undoes exactly what applying it did. Every change advances a
 * version counter so callers can cache derived state and re-read it only when stale.
 *
 * Owned by a single combatant and driven from one thread.
 */
public class ModifierLedger {

    private static final Logger logger = LoggerFactory.getLogger(ModifierLedger.class);

    public static final String ENVIRONMENT_PREFIX = "environment_";

    private final ResistanceAggregator aggregator;
    private final AttackBuilder attackBuilder;
    private final AffinityOverrideTable overrideTable;

    private final Map<String, ElementalModifier> activeModifiers = new LinkedHashMap<>();
    // Override ids registered per modifier id, so removal touches only its own entries
    private final Map<String, List<String>> overrideIdsByModifier = new LinkedHashMap<>();
    private final List<ModifierListener> listeners = new CopyOnWriteArrayList<>();
    private long version;

    public ModifierLedger() {
        this(new ResistanceAggregator(), new AttackBuilder(), new AffinityOverrideTable());
    }

    public ModifierLedger(ResistanceAggregator aggregator, AttackBuilder attackBuilder, AffinityOverrideTable overrideTable) {
        this.aggregator = aggregator;
        this.attackBuilder = attackBuilder;
        this.overrideTable = overrideTable;
    }

    // ========== Apply / remove ==========

    /**
     * Activate a modifier. An active modifier with the same id is torn down first;
     * when both allow stacking the new one carries the old stack count plus one.
     * @return false if the modifier was rejected
     */
    public boolean apply(ElementalModifier modifier) {
        if (modifier == null) {
            logger.warn("Rejected null elemental modifier");
            return false;
        }
        if (modifier.getId() == null || modifier.getId().isEmpty()) {
            logger.warn("Rejected elemental modifier without id (source={})", modifier.getSourceId());
            return false;
        }
        if (modifier.getEffect() == null) {
            logger.warn("Rejected elemental modifier {} without effect", modifier.getId());
            return false;
        }

        ElementalModifier previous = activeModifiers.remove(modifier.getId());
        if (previous != null) {
            teardown(previous);
            if (previous.isStackingAllowed() && modifier.isStackingAllowed()) {
                modifier = modifier.withStacks(previous.getCurrentStacks() + 1);
            }
            logger.debug("Replacing modifier {} (stacks now {})", modifier.getId(), modifier.getCurrentStacks());
        }

        activeModifiers.put(modifier.getId(), modifier);
        dispatch(modifier);
        version++;
        fireApplied(modifier);
        return true;
    }

    public boolean remove(String modifierId) {
        if (modifierId == null) return false;
        ElementalModifier modifier = activeModifiers.remove(modifierId);
        if (modifier == null) return false;
        teardown(modifier);
        version++;
        fireRemoved(modifier);
        return true;
    }

    // ========== Stacks / refresh ==========

    /**
     * Add one stack to an active stackable modifier and re-dispatch its scaled values.
     * @return false if absent, not stackable or already at max stacks
     */
    public boolean addStack(String modifierId) {
        ElementalModifier current = modifierId != null ? activeModifiers.get(modifierId) : null;
        if (current == null || !current.isStackingAllowed() || current.getCurrentStacks() >= current.getMaxStacks()) {
            return false;
        }
        replace(current, current.withStacks(current.getCurrentStacks() + 1));
        return true;
    }

    /**
     * @return false if absent or already down to one stack
     */
    public boolean removeStack(String modifierId) {
        ElementalModifier current = modifierId != null ? activeModifiers.get(modifierId) : null;
        if (current == null || current.getCurrentStacks() <= 1) return false;
        replace(current, current.withStacks(current.getCurrentStacks() - 1));
        return true;
    }

    /**
     * Reset an active timed modifier to its original duration, bonuses and overrides included.
     * @return false if absent or permanent
     */
    public boolean refresh(String modifierId) {
        ElementalModifier current = modifierId != null ? activeModifiers.get(modifierId) : null;
        if (current == null || current.isPermanent()) return false;
        replace(current, current.refreshed());
        return true;
    }

    private void replace(ElementalModifier current, ElementalModifier updated) {
        teardown(current);
        activeModifiers.put(updated.getId(), updated);
        dispatch(updated);
        version++;
        logger.debug("Updated modifier {}", updated);
        fireApplied(updated);
    }

    /**
     * Remove every modifier attributed to the source.
     * @return number removed
     */
    public int removeBySource(String sourceId) {
        if (sourceId == null) return 0;
        List<String> ids = new ArrayList<>();
        for (ElementalModifier m : activeModifiers.values()) {
            if (sourceId.equals(m.getSourceId())) ids.add(m.getId());
        }
        for (String id : ids) remove(id);
        return ids.size();
    }

    public int clearByKind(ModifierKind kind) {
        List<String> ids = new ArrayList<>();
        for (ElementalModifier m : activeModifiers.values()) {
            if (m.getKind() == kind) ids.add(m.getId());
        }
        for (String id : ids) remove(id);
        return ids.size();
    }

    public void clearAll() {
        for (String id : new ArrayList<>(activeModifiers.keySet())) {
            remove(id);
        }
    }

    private void dispatch(ElementalModifier modifier) {
        String id = modifier.getId();
        int stacks = modifier.getCurrentStacks();
        double duration = modifier.isPermanent() ? -1 : modifier.getRemainingDuration();
        ModifierEffect effect = modifier.getEffect();

        if (effect instanceof ModifierEffect.AttackBonus bonus) {
            for (ElementalValue value : bonus.values()) {
                ElementalValue v = value.scaled(stacks);
                attackBuilder.registerModifierBonus(id, v.element(), v.flatValue(), v.percentageValue() / 100.0, duration);
            }
        } else if (effect instanceof ModifierEffect.DefenseResistance resistance) {
            ResistanceProfile.Builder profile = ResistanceProfile.builder();
            for (ElementalValue value : resistance.values()) {
                profile.resistance(value.element(), value.flatValue() * stacks);
            }
            aggregator.registerTemporaryDefense(id, profile.build());
        } else if (effect instanceof ModifierEffect.AffinityOverride override) {
            List<String> registered = new ArrayList<>();
            for (AffinityOverrideEntry entry : override.entries()) {
                String overrideId = id + "_" + entry.attackElement() + "_" + entry.defenseElement();
                overrideTable.addOverride(overrideId, entry.attackElement(), entry.defenseElement(),
                    entry.newAffinity(), duration, modifier.getSourceId());
                registered.add(overrideId);
            }
            overrideIdsByModifier.put(id, registered);
        }
        // Conversions and composite bonuses are read at attack-build time
    }

    // Undo only the tables dispatch wrote for this effect kind
    private void teardown(ElementalModifier modifier) {
        String id = modifier.getId();
        ModifierEffect effect = modifier.getEffect();
        if (effect instanceof ModifierEffect.AttackBonus) {
            attackBuilder.removeModifierBonuses(id);
        } else if (effect instanceof ModifierEffect.DefenseResistance) {
            aggregator.removeTemporaryDefense(id);
        } else if (effect instanceof ModifierEffect.AffinityOverride) {
            List<String> overrideIds = overrideIdsByModifier.remove(id);
            if (overrideIds != null) {
                for (String overrideId : overrideIds) {
                    overrideTable.removeOverride(overrideId);
                }
            }
        }
    }

    // ========== Tick ==========

    /**
     * Advance every timed modifier by the same delta, then remove the ones that ran out.
     * Afterwards the builder's temporary bonuses and the override table advance too.
     */
    public void tick(double deltaSeconds) {
        List<ElementalModifier> expired = new ArrayList<>();
        for (ElementalModifier m : new ArrayList<>(activeModifiers.values())) {
            if (m.tick(deltaSeconds)) expired.add(m);
        }
        for (ElementalModifier m : expired) {
            if (activeModifiers.remove(m.getId()) == null) continue;
            teardown(m);
            version++;
            logger.debug("Modifier {} expired", m.getId());
            fireExpired(m);
        }
        attackBuilder.tick(deltaSeconds);
        overrideTable.tick(deltaSeconds);
    }

    // ========== Integration helpers ==========

    /**
     * Apply equipment modifiers: permanent and attributed to the equipment id.
     */
    public void registerEquipmentModifiers(String equipmentId, List<ElementalModifier> modifiers) {
        if (equipmentId == null || modifiers == null) return;
        for (ElementalModifier m : modifiers) {
            if (m == null) continue;
            apply(m.copyWithId(m.getId()).source(equipmentId).permanent());
        }
    }

    public int unregisterEquipmentModifiers(String equipmentId) {
        return removeBySource(equipmentId);
    }

    /**
     * Apply buff modifiers attributed to the buff id for the given duration (negative = permanent).
     */
    public void registerBuffModifiers(String buffId, List<ElementalModifier> modifiers, double duration) {
        registerTimed(buffId, modifiers, duration);
    }

    public void registerSkillModifiers(String skillId, List<ElementalModifier> modifiers, double duration) {
        registerTimed(skillId, modifiers, duration);
    }

    private void registerTimed(String sourceId, List<ElementalModifier> modifiers, double duration) {
        if (sourceId == null || modifiers == null) return;
        for (ElementalModifier m : modifiers) {
            if (m == null) continue;
            apply(m.copyWithId(m.getId()).source(sourceId).duration(duration));
        }
    }

    /**
     * Apply an environment's ambient resistances as a permanent resistance modifier
     * with id {@code environment_<profileId>}.
     */
    public void applyEnvironment(EnvironmentProfile profile) {
        if (profile == null) return;
        List<ElementalValue> values = new ArrayList<>();
        for (Map.Entry<Element, Double> e : profile.getResistances().entrySet()) {
            values.add(new ElementalValue(e.getKey(), e.getValue()));
        }
        ElementalModifier modifier = new ElementalModifier(ENVIRONMENT_PREFIX + profile.getProfileId(),
                new ModifierEffect.DefenseResistance(values))
            .source(profile.getProfileId())
            .displayName(profile.getProfileName())
            .permanent();
        apply(modifier);
    }

    public boolean removeEnvironment(String profileId) {
        return remove(ENVIRONMENT_PREFIX + profileId);
    }

    // ========== Attack side ==========

    /** Conversion rules of active conversion modifiers, in application order. */
    public List<ConversionRule> getActiveConversionRules() {
        List<ConversionRule> rules = new ArrayList<>();
        for (ElementalModifier m : activeModifiers.values()) {
            if (m.getEffect() instanceof ModifierEffect.ElementalConversion conversion) {
                rules.add(conversion.rule());
            }
        }
        return rules;
    }

    /** Product of active composite bonus multipliers; 1.0 when none. */
    public double getCompositeMultiplier() {
        double multiplier = 1.0;
        for (ElementalModifier m : activeModifiers.values()) {
            if (m.getEffect() instanceof ModifierEffect.CompositeBonus bonus) {
                multiplier *= bonus.multiplier();
            }
        }
        return multiplier;
    }

    public Attack createAttack(StatAccessor attacker, String weaponId, String skillId) {
        return attackBuilder.build(attacker, weaponId, skillId, getActiveConversionRules(), getCompositeMultiplier());
    }

    /**
     * Affinity for the pair, with active overrides taking precedence over the table.
     */
    public double getAffinity(Element attackElement, Element defenseElement, AffinityTable table) {
        double base = table != null ? table.get(attackElement, defenseElement) : AffinityTable.NEUTRAL;
        return overrideTable.getModifiedAffinity(attackElement, defenseElement, base);
    }

    // ========== Listeners ==========

    public void addListener(ModifierListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(ModifierListener listener) {
        listeners.remove(listener);
    }

    private void fireApplied(ElementalModifier m) {
        for (ModifierListener l : listeners) {
            try {
                l.onModifierApplied(m);
            } catch (RuntimeException e) {
                logger.warn("Modifier listener failed on apply of {}: {}", m.getId(), e.getMessage(), e);
            }
        }
    }

    private void fireRemoved(ElementalModifier m) {
        for (ModifierListener l : listeners) {
            try {
                l.onModifierRemoved(m);
            } catch (RuntimeException e) {
                logger.warn("Modifier listener failed on removal of {}: {}", m.getId(), e.getMessage(), e);
            }
        }
    }

    private void fireExpired(ElementalModifier m) {
        for (ModifierListener l : listeners) {
            try {
                l.onModifierExpired(m);
            } catch (RuntimeException e) {
                logger.warn("Modifier listener failed on expiry of {}: {}", m.getId(), e.getMessage(), e);
            }
        }
    }

    // ========== Queries ==========

    public List<ElementalModifier> getActiveModifiers() {
        return new ArrayList<>(activeModifiers.values());
    }

    public List<ElementalModifier> getModifiersBySource(String sourceId) {
        List<ElementalModifier> out = new ArrayList<>();
        if (sourceId == null) return out;
        for (ElementalModifier m : activeModifiers.values()) {
            if (sourceId.equals(m.getSourceId())) out.add(m);
        }
        return out;
    }

    public boolean hasModifier(String modifierId) {
        return activeModifiers.containsKey(modifierId);
    }

    public ElementalModifier getModifier(String modifierId) {
        return activeModifiers.get(modifierId);
    }

    public int getActiveCount() {
        return activeModifiers.size();
    }

    /**
     * Advances on every apply, removal, restack, refresh and expiry, and on any direct
     * change to the resistance aggregator.
     */
    public long getVersion() {
        return version + aggregator.getVersion();
    }

    public ResistanceAggregator getAggregator() { return aggregator; }
    public AttackBuilder getAttackBuilder() { return attackBuilder; }
    public AffinityOverrideTable getOverrideTable() { return overrideTable; }
}
