package com.example.elemental.combat;

import com.example.elemental.effect.ElementRegistry;
import com.example.elemental.effect.ElementalEffect;
import com.example.elemental.effect.StatusEffectApplicator;
import com.example.elemental.model.Attack;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementPower;
import com.example.elemental.model.EnvironmentProfile;
import com.example.elemental.model.ResistanceProfile;
import com.example.elemental.model.StatAccessor;
import com.example.elemental.model.StatKind;
import com.example.elemental.util.ElementalConfig;
import com.example.elemental.util.RandomSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns an attack and a defender into a {@link DamageResult}.
 *
 * Steps, in order: base damage, composition, defense lookup, per-element damage
 * (affinity, resistance, immunity, environment), critical and variance, on-hit effects.
 * Each step appends a line to the result's calculation log.
 *
 * Resolution only reads combat state. Applying the damage is up to the caller.
 */
public class ResolutionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionPipeline.class);

    private final AffinityTable affinityTable;
    private final CompositionResolver compositionResolver;
    private final ElementRegistry elementRegistry;
    private final RandomSource random;
    private final StatusEffectApplicator statusEffectApplicator;
    private final ElementalConfig config;

    public ResolutionPipeline(AffinityTable affinityTable, CompositionResolver compositionResolver) {
        this(affinityTable, compositionResolver, new ElementRegistry(), RandomSource.threadLocal(), null, ElementalConfig.defaults());
    }

    /**
     * @param statusEffectApplicator may be null; eligible effects are then reported but not applied
     */
    public ResolutionPipeline(AffinityTable affinityTable, CompositionResolver compositionResolver,
                              ElementRegistry elementRegistry, RandomSource random,
                              StatusEffectApplicator statusEffectApplicator, ElementalConfig config) {
        this.affinityTable = Objects.requireNonNull(affinityTable, "affinityTable");
        this.compositionResolver = Objects.requireNonNull(compositionResolver, "compositionResolver");
        this.elementRegistry = elementRegistry != null ? elementRegistry : new ElementRegistry();
        this.random = random != null ? random : RandomSource.threadLocal();
        this.statusEffectApplicator = statusEffectApplicator;
        this.config = config != null ? config : ElementalConfig.defaults();
    }

    /**
     * Resolve against a combatant: its effective defense, its affinity overrides and its stats
     * as the status-effect target.
     */
    public DamageResult resolve(Attack attack, ElementalCombatant defender, EnvironmentProfile environment) {
        if (defender == null) {
            return resolve(attack, null, null, environment, null);
        }
        return resolve(attack, defender.getDefense(), defender.getLedger().getOverrideTable(),
            environment, defender.getStats());
    }

    /**
     * @param defense   defender's effective profile; null resolves as all-zero
     * @param overrides affinity overrides consulted before the table; may be null
     * @param environment may be null
     * @param target    receives status effects; may be null
     */
    public DamageResult resolve(Attack attack, ResistanceProfile defense, AffinityOverrideTable overrides,
                                EnvironmentProfile environment, StatAccessor target) {
        Objects.requireNonNull(attack, "attack");
        DamageResult.Builder result = DamageResult.builder();

        // 1. Base damage
        StatAccessor source = attack.getSource();
        double baseDamage = source != null ? statOf(source, StatKind.OFFENSE) : attack.getTotalPower();
        result.baseDamage(baseDamage);
        result.log(String.format("Base damage: %.2f", baseDamage));

        // 2. Composition
        Attack resolved = compose(attack, result);
        for (ElementPower pair : resolved.getResolvedPairs()) {
            result.attackPair(pair.element(), pair.power());
        }

        // 3. Defense
        ResistanceProfile profile = defense != null ? defense : ResistanceProfile.empty();
        result.defenseResistances(profile.getResistances());
        Element defenderElement = profile.getPrimaryElement();
        result.log("Defense primary element: " + defenderElement.getDisplayName());

        // 4. Per-element damage
        boolean useEnvironment = environment != null && config.isEnvironmentalEffectsEnabled();
        double total = 0.0;
        for (ElementPower pair : resolved.getResolvedPairs()) {
            Element element = pair.element();
            double damage;
            if (profile.isImmune(element)) {
                damage = 0.0;
                result.immune(element);
                result.log(element.getDisplayName() + ": immune");
            } else {
                double affinity = affinityTable.get(element, defenderElement);
                if (overrides != null) {
                    affinity = overrides.getModifiedAffinity(element, defenderElement, affinity);
                }
                double resistance = profile.getResistance(element);
                damage = pair.power() * affinity * (1.0 - resistance);
                result.log(String.format("%s: %.2f x affinity %.2f x (1 - %.2f) = %.2f",
                    element.getDisplayName(), pair.power(), affinity, resistance, damage));
            }
            // Immunity zeroes the element's own damage; the environment still adds its bonus
            if (useEnvironment) {
                damage = damage * environment.getDamageMultiplier(element) + environment.getPowerBonus(element);
                damage *= 1.0 - environment.getResistance(element);
                result.log(String.format("%s: environment %s -> %.2f",
                    element.getDisplayName(), environment.getProfileId(), damage));
            }
            damage = Math.max(0.0, damage);
            result.addElementDamage(element, damage);
            total += damage;
        }

        // 5. Critical and variance
        double finalDamage = total;
        if (source != null) {
            double critRate = statOf(source, StatKind.CRITICAL_RATE);
            if (critRate > 0 && random.nextDouble() < critRate) {
                double critMultiplier = statOf(source, StatKind.CRITICAL_DAMAGE);
                finalDamage *= critMultiplier;
                result.critical(true);
                result.log(String.format("Critical hit: x%.2f", critMultiplier));
            }
        }
        double variance = random.nextDouble(config.getVarianceMin(), config.getVarianceMax());
        finalDamage *= variance;
        result.finalDamage(finalDamage);
        result.log(String.format("Variance x%.3f -> final %.2f", variance, finalDamage));

        // 6. On-hit effects
        for (Element element : resolved.getUniqueElements()) {
            for (ElementalEffect effect : elementRegistry.getTriggeredEffects(element, finalDamage)) {
                for (String statusEffectId : effect.getStatusEffectIds()) {
                    result.triggeredEffect(statusEffectId);
                    if (statusEffectApplicator != null && target != null
                            && statusEffectApplicator.tryApply(statusEffectId, element, target)) {
                        result.appliedEffect(statusEffectId);
                    }
                }
            }
        }

        DamageResult built = result.build();
        if (config.isDebugCalculations()) {
            for (String line : built.getCalculationLog()) {
                logger.debug("  {}", line);
            }
        }
        logger.debug("Resolved {} -> {}", attack, built);
        return built;
    }

    private Attack compose(Attack attack, DamageResult.Builder result) {
        if (attack.isComposite()) {
            result.composite("");
            return attack.applyCompositeMultiplier();
        }
        if (!config.isCompositionEnabled() || !attack.isCompositionAllowed() || attack.getPairs().size() <= 1) {
            return attack;
        }
        Composition composition = compositionResolver.tryCombine(attack.getPairs());
        if (!composition.composite()) {
            return attack;
        }
        Attack composed = attack
            .withComposite(composition.element(), composition.power(), attack.getCompositeMultiplier())
            .applyCompositeMultiplier();
        result.composite(composition.name());
        result.log(String.format("Composite %s%s: %.2f", composition.element().getDisplayName(),
            composition.name().isEmpty() ? "" : " (" + composition.name() + ")", composed.getCompositePower()));
        return composed;
    }

    private static double statOf(StatAccessor source, StatKind kind) {
        Double v = source.getStat(kind);
        if (v == null) {
            logger.debug("Attacker has no {} stat, using {}", kind, kind.getNeutralValue());
            return kind.getNeutralValue();
        }
        return v;
    }

    public AffinityTable getAffinityTable() { return affinityTable; }
    public CompositionResolver getCompositionResolver() { return compositionResolver; }
    public ElementRegistry getElementRegistry() { return elementRegistry; }
    public ElementalConfig getConfig() { return config; }
}
