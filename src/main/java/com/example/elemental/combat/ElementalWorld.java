package com.example.elemental.combat;

import com.example.elemental.effect.ElementDefinition;
import com.example.elemental.effect.ElementRegistry;
import com.example.elemental.effect.StatusEffectApplicator;
import com.example.elemental.model.Attack;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementalModifier;
import com.example.elemental.model.EnvironmentProfile;
import com.example.elemental.persistence.ElementData;
import com.example.elemental.util.ElementalConfig;
import com.example.elemental.util.RandomSource;
import com.example.elemental.util.TickService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Root of one combat session: the shared affinity table, composite rules and element
 * definitions, the known environments, the combatants taking part and the environment
 * currently in effect.
 *
 * Public operations are synchronized so a {@link TickService} thread and callers can share
 * a world; resolution and ticks never interleave.
 */
public class ElementalWorld {

    private static final Logger logger = LoggerFactory.getLogger(ElementalWorld.class);

    public static final String TICK_TASK = "elemental-world";

    private final ElementalConfig config;
    private final AffinityTable affinityTable;
    private final CompositionResolver compositionResolver;
    private final ElementRegistry elementRegistry;
    private final ResolutionPipeline pipeline;
    private final RandomSource random;
    private final StatusEffectApplicator applicator;

    private final Map<String, EnvironmentProfile> environments = new LinkedHashMap<>();
    private final Map<String, ElementalCombatant> combatants = new LinkedHashMap<>();
    private final List<ElementData.BonusEntry> weaponBonuses = new ArrayList<>();
    private final List<ElementData.BonusEntry> skillBonuses = new ArrayList<>();
    private final List<ElementalEventListener> listeners = new CopyOnWriteArrayList<>();

    private EnvironmentProfile currentEnvironment;
    private double globalDamageMultiplier;

    public ElementalWorld(ElementalConfig config, AffinityTable affinityTable, CompositionResolver compositionResolver,
                          ElementRegistry elementRegistry, RandomSource random, StatusEffectApplicator applicator) {
        this.config = config != null ? config : ElementalConfig.defaults();
        this.affinityTable = affinityTable != null ? affinityTable : AffinityTable.defaults();
        this.compositionResolver = compositionResolver != null ? compositionResolver : new CompositionResolver();
        this.elementRegistry = elementRegistry != null ? elementRegistry : ElementRegistry.defaults();
        this.random = random != null ? random : RandomSource.threadLocal();
        this.applicator = applicator;
        this.pipeline = new ResolutionPipeline(this.affinityTable, this.compositionResolver,
            this.elementRegistry, this.random, applicator, this.config);
        this.globalDamageMultiplier = this.config.getGlobalDamageMultiplier();
    }

    /** World with the default affinity matrix and element definitions and no composite rules. */
    public static ElementalWorld withDefaults(ElementalConfig config) {
        return new ElementalWorld(config, AffinityTable.defaults(), new CompositionResolver(),
            ElementRegistry.defaults(), RandomSource.threadLocal(), null);
    }

    /**
     * World built from loaded element data. Definitions from the data replace the defaults
     * element by element.
     */
    public static ElementalWorld fromData(ElementalConfig config, ElementData data,
                                          RandomSource random, StatusEffectApplicator applicator) {
        ElementRegistry registry = ElementRegistry.defaults();
        for (ElementDefinition def : data.getDefinitions()) {
            registry.register(def);
        }
        ElementalWorld world = new ElementalWorld(config, data.getAffinityTable(),
            new CompositionResolver(data.getCompositeRules()), registry, random, applicator);
        for (EnvironmentProfile env : data.getEnvironments()) {
            world.registerEnvironment(env);
        }
        world.weaponBonuses.addAll(data.getWeaponBonuses());
        world.skillBonuses.addAll(data.getSkillBonuses());
        logger.info("Elemental world ready: {} composite rules, {} environments, {} element definitions",
            data.getCompositeRules().size(), data.getEnvironments().size(), registry.size());
        return world;
    }

    // ========== Combatants ==========

    /**
     * Add a combatant. The current environment and the world's weapon and skill bonus
     * catalog are installed on it. Re-registering an id replaces the previous combatant.
     */
    public synchronized void registerCombatant(ElementalCombatant combatant) {
        if (combatant == null) return;
        ElementalCombatant previous = combatants.put(combatant.getId(), combatant);
        if (previous == combatant) return;
        if (previous != null) {
            logger.warn("Combatant {} re-registered, replacing previous instance", combatant.getId());
            if (currentEnvironment != null) {
                previous.getLedger().removeEnvironment(currentEnvironment.getProfileId());
            }
        }
        AttackBuilder builder = combatant.getLedger().getAttackBuilder();
        for (ElementData.BonusEntry b : weaponBonuses) {
            builder.registerWeaponBonus(b.ownerId(), b.element(), b.flatBonus(), b.percentageBonus());
        }
        for (ElementData.BonusEntry b : skillBonuses) {
            builder.registerSkillBonus(b.ownerId(), b.element(), b.flatBonus(), b.percentageBonus(), b.duration());
        }
        if (currentEnvironment != null && config.isEnvironmentalEffectsEnabled()) {
            combatant.getLedger().applyEnvironment(currentEnvironment);
        }
    }

    public synchronized ElementalCombatant unregisterCombatant(String combatantId) {
        ElementalCombatant removed = combatants.remove(combatantId);
        if (removed != null && currentEnvironment != null) {
            removed.getLedger().removeEnvironment(currentEnvironment.getProfileId());
        }
        return removed;
    }

    public synchronized ElementalCombatant getCombatant(String combatantId) {
        return combatants.get(combatantId);
    }

    public synchronized Collection<ElementalCombatant> getCombatants() {
        return Collections.unmodifiableCollection(new ArrayList<>(combatants.values()));
    }

    // ========== Environment ==========

    public synchronized void registerEnvironment(EnvironmentProfile profile) {
        if (profile != null) environments.put(profile.getProfileId(), profile);
    }

    public synchronized EnvironmentProfile getEnvironment(String profileId) {
        return environments.get(profileId);
    }

    /**
     * Switch to a registered environment by id.
     * @return false if the id is unknown; nothing changes then
     */
    public synchronized boolean setEnvironment(String profileId) {
        EnvironmentProfile profile = environments.get(profileId);
        if (profile == null) {
            logger.warn("Unknown environment profile: {}", profileId);
            return false;
        }
        setEnvironment(profile);
        return true;
    }

    /**
     * Switch environments: the previous one's modifiers leave every combatant, the new one's
     * are applied to every combatant.
     */
    public synchronized void setEnvironment(EnvironmentProfile profile) {
        EnvironmentProfile previous = currentEnvironment;
        if (previous != null) {
            for (ElementalCombatant c : combatants.values()) {
                c.getLedger().removeEnvironment(previous.getProfileId());
            }
        }
        currentEnvironment = profile;
        if (profile != null) {
            environments.putIfAbsent(profile.getProfileId(), profile);
            if (config.isEnvironmentalEffectsEnabled()) {
                for (ElementalCombatant c : combatants.values()) {
                    c.getLedger().applyEnvironment(profile);
                }
            }
        }
        logger.info("Environment changed: {} -> {}",
            previous != null ? previous.getProfileId() : "none", profile != null ? profile.getProfileId() : "none");
        for (ElementalEventListener l : listeners) {
            try {
                l.onEnvironmentChanged(previous, profile);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on environment change: {}", e.getMessage(), e);
            }
        }
    }

    public synchronized void clearEnvironment() {
        setEnvironment((EnvironmentProfile) null);
    }

    public synchronized EnvironmentProfile getCurrentEnvironment() {
        return currentEnvironment;
    }

    // ========== Resolution ==========

    /**
     * Resolve an attack against a target in the current environment, scaled by the global
     * multiplier. The target's stats are not touched.
     */
    public synchronized DamageResult resolve(Attack attack, ElementalCombatant target) {
        DamageResult result = pipeline.resolve(attack, target, currentEnvironment)
            .withMultiplier(globalDamageMultiplier, "Global multiplier");
        for (ElementalEventListener l : listeners) {
            try {
                l.onDamageResolved(target, result);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on damage resolution: {}", e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * Resolve and apply the damage to the target, then give the current environment's
     * ambient effects their chance to take hold.
     */
    public synchronized DamageResult dealDamage(Attack attack, ElementalCombatant target) {
        DamageResult result = resolve(attack, target);
        for (ElementalEventListener l : listeners) {
            for (Element element : result.getImmuneElements()) {
                try {
                    l.onImmunityTriggered(target, element);
                } catch (RuntimeException e) {
                    logger.warn("Listener failed on immunity: {}", e.getMessage(), e);
                }
            }
        }
        if (target == null) return result;
        target.applyResult(result);
        return result.withAmbientEffects(processAmbientEffects(result, target));
    }

    /**
     * Roll each ambient effect of the current environment against the landed hit. An effect
     * is skipped when any attack element is in its immune set; otherwise it is handed to the
     * status-effect applicator with the first attack element.
     * @return ids of the ambient effects the applicator accepted
     */
    private List<String> processAmbientEffects(DamageResult result, ElementalCombatant target) {
        List<String> applied = new ArrayList<>();
        EnvironmentProfile environment = currentEnvironment;
        if (environment == null || !config.isEnvironmentalEffectsEnabled()) return applied;
        List<Element> elements = result.getAttackElements();
        if (elements.isEmpty()) return applied;

        for (EnvironmentProfile.AmbientEffect effect : environment.getAmbientEffects()) {
            if (random.nextDouble() >= effect.applicationChance()) continue;
            boolean blocked = false;
            for (Element element : elements) {
                if (effect.immuneElements().contains(element)) {
                    blocked = true;
                    break;
                }
            }
            if (blocked) {
                logger.debug("Ambient effect {} blocked by attack elements {}", effect.statusEffectId(), elements);
                continue;
            }
            if (applicator != null && applicator.tryApply(effect.statusEffectId(), elements.get(0), target.getStats())) {
                applied.add(effect.statusEffectId());
                logger.debug("Ambient effect {} applied to {}", effect.statusEffectId(), target.getId());
            }
        }
        return applied;
    }

    /**
     * Resolve one attack against each target independently, in order.
     */
    public synchronized List<DamageResult> resolveArea(Attack attack, List<ElementalCombatant> targets) {
        List<DamageResult> results = new ArrayList<>();
        if (targets == null) return results;
        for (ElementalCombatant target : targets) {
            results.add(resolve(attack, target));
        }
        return results;
    }

    // ========== Modifiers ==========

    /**
     * Give every combatant its own copy of the modifier, id suffixed with the combatant id.
     */
    public synchronized void applyModifierToAll(ElementalModifier modifier) {
        if (modifier == null) return;
        for (ElementalCombatant c : combatants.values()) {
            c.applyModifier(modifier.copyWithId(modifier.getId() + "_" + c.getId()));
        }
    }

    public synchronized int removeModifiersBySourceFromAll(String sourceId) {
        int removed = 0;
        for (ElementalCombatant c : combatants.values()) {
            removed += c.removeModifiersBySource(sourceId);
        }
        return removed;
    }

    // ========== Tick ==========

    public synchronized void tick(double deltaSeconds) {
        for (ElementalCombatant c : combatants.values()) {
            c.tick(deltaSeconds);
        }
    }

    /**
     * Drive this world from the tick service at the configured interval.
     */
    public void startTicking(TickService tickService) {
        tickService.scheduleTicks(TICK_TASK, this::tick, config.getTickIntervalMs());
        logger.info("Elemental world ticking every {} ms", config.getTickIntervalMs());
    }

    public void stopTicking(TickService tickService) {
        tickService.cancel(TICK_TASK);
    }

    // ========== Listeners / settings ==========

    public void addListener(ElementalEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(ElementalEventListener listener) {
        listeners.remove(listener);
    }

    public synchronized void setGlobalDamageMultiplier(double multiplier) {
        this.globalDamageMultiplier = Math.max(0.0, multiplier);
    }

    public synchronized double getGlobalDamageMultiplier() {
        return globalDamageMultiplier;
    }

    public ElementalConfig getConfig() { return config; }
    public AffinityTable getAffinityTable() { return affinityTable; }
    public CompositionResolver getCompositionResolver() { return compositionResolver; }
    public ElementRegistry getElementRegistry() { return elementRegistry; }
    public ResolutionPipeline getPipeline() { return pipeline; }
}
