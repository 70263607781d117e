package com.example.elemental;

import com.example.elemental.combat.AffinityOverrideTable;
import com.example.elemental.combat.AffinityTable;
import com.example.elemental.combat.CombineMethod;
import com.example.elemental.combat.CompositeRule;
import com.example.elemental.combat.CompositionResolver;
import com.example.elemental.combat.DamageResult;
import com.example.elemental.combat.ResolutionPipeline;
import com.example.elemental.effect.ElementDefinition;
import com.example.elemental.effect.ElementRegistry;
import com.example.elemental.effect.ElementalEffect;
import com.example.elemental.effect.StatusEffectApplicator;
import com.example.elemental.model.Attack;
import com.example.elemental.model.Element;
import com.example.elemental.model.EnvironmentProfile;
import com.example.elemental.model.ResistanceProfile;
import com.example.elemental.model.StatKind;
import com.example.elemental.util.ElementalConfig;
import com.example.elemental.util.RandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the damage resolution pipeline.
 * A fixed random source of 0.5 makes variance exactly 1.0 with the default 0.95-1.05 band.
 */
public class ResolutionPipelineTest {

    private static final double DELTA = 0.001;

    private CompositionResolver resolver;
    private ElementalConfig config;

    @BeforeEach
    void setUp() {
        resolver = new CompositionResolver();
        resolver.addRule(new CompositeRule(List.of(Element.FIRE, Element.WATER))
            .combineMethod(CombineMethod.AVERAGE)
            .powerMultiplier(1.2)
            .result(Element.EARTH, "Mudslide"));
        config = ElementalConfig.defaults();
    }

    private ResolutionPipeline pipeline() {
        return pipeline(null, null);
    }

    private ResolutionPipeline pipeline(ElementRegistry registry, StatusEffectApplicator applicator) {
        return new ResolutionPipeline(AffinityTable.defaults(), resolver, registry,
            RandomSource.fixed(0.5), applicator, config);
    }

    private static ResistanceProfile defense(Element element, double value) {
        return ResistanceProfile.builder().resistance(element, value).build();
    }

    // ========== Basic damage ==========

    @Test
    @DisplayName("Fire 25 against an undefended target deals 25")
    void plainFireHit() {
        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 25), null, null, null, null);
        assertEquals(25.0, result.getBaseDamage(), DELTA);
        assertEquals(25.0, result.getFinalDamage(), DELTA);
        assertEquals(25.0, result.getElementDamage(Element.FIRE), DELTA);
        assertFalse(result.isCritical());
        assertFalse(result.getCalculationLog().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "0.5, 25.0",
        "0.0, 50.0",
        "-0.5, 75.0",
        "1.0, 0.0"
    })
    @DisplayName("Resistance scales damage by (1 - resistance)")
    void resistanceScales(double resistance, double expected) {
        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 50),
            defense(Element.FIRE, resistance), null, null, null);
        assertEquals(expected, result.getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("Defender primary element selects the affinity column")
    void affinityFromPrimaryElement() {
        ResistanceProfile water = ResistanceProfile.builder().primaryElement(Element.WATER).build();
        ResistanceProfile ice = ResistanceProfile.builder().primaryElement(Element.ICE).build();
        assertEquals(20.0, pipeline().resolve(Attack.of(Element.FIRE, 40), water, null, null, null).getFinalDamage(), DELTA);
        assertEquals(60.0, pipeline().resolve(Attack.of(Element.FIRE, 40), ice, null, null, null).getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("Immune elements deal nothing and are reported")
    void immunity() {
        ResistanceProfile profile = ResistanceProfile.builder().immunity(Element.FIRE).build();
        Attack attack = Attack.of(Element.FIRE, 25).withElement(Element.WIND, 10);

        DamageResult result = pipeline().resolve(attack, profile, null, null, null);
        assertEquals(10.0, result.getFinalDamage(), DELTA);
        assertEquals(0.0, result.getElementDamage(Element.FIRE), DELTA);
        assertEquals(List.of(Element.FIRE), result.getImmuneElements());
        assertEquals(Element.WIND, result.getDominantElement());
    }

    @Test
    @DisplayName("An immune element still picks up the environment bonus")
    void immuneElementStillGetsEnvironmentBonus() {
        ResistanceProfile profile = ResistanceProfile.builder().immunity(Element.FIRE).build();
        EnvironmentProfile volcano = new EnvironmentProfile("volcano", "Volcano")
            .damageModifier(Element.FIRE, 1.2, 10);

        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 25), profile, null, volcano, null);
        assertEquals(10.0, result.getElementDamage(Element.FIRE), DELTA);
        assertEquals(10.0, result.getFinalDamage(), DELTA);
        assertEquals(List.of(Element.FIRE), result.getImmuneElements());

        config.environmentalEffectsEnabled(false);
        assertEquals(0.0, pipeline().resolve(Attack.of(Element.FIRE, 25), profile, null, volcano, null)
            .getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("Affinity override replaces the table value")
    void affinityOverride() {
        AffinityOverrideTable overrides = new AffinityOverrideTable();
        overrides.addOverride("scorch", Element.FIRE, Element.NONE, 2.0);
        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 50), null, overrides, null, null);
        assertEquals(100.0, result.getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("Per-element damage never goes below zero")
    void damageFloorIsZero() {
        AffinityOverrideTable overrides = new AffinityOverrideTable();
        overrides.addOverride("absorb", Element.FIRE, Element.NONE, -1.0);
        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 50), null, overrides, null, null);
        assertEquals(0.0, result.getFinalDamage(), DELTA);
    }

    // ========== Attacker stats ==========

    @Nested
    class AttackerStats {

        @Test
        @DisplayName("Critical hit multiplies by critical damage; base damage is offense")
        void criticalHit() {
            TestStats attacker = new TestStats()
                .with(StatKind.OFFENSE, 10)
                .with(StatKind.CRITICAL_RATE, 0.6)
                .with(StatKind.CRITICAL_DAMAGE, 2.0);
            DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 50, attacker), null, null, null, null);
            assertTrue(result.isCritical());
            assertEquals(10.0, result.getBaseDamage(), DELTA);
            assertEquals(100.0, result.getFinalDamage(), DELTA);
        }

        @Test
        @DisplayName("Roll at or above the critical rate is a normal hit")
        void noCriticalHit() {
            TestStats attacker = new TestStats()
                .with(StatKind.CRITICAL_RATE, 0.4)
                .with(StatKind.CRITICAL_DAMAGE, 2.0);
            DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 50, attacker), null, null, null, null);
            assertFalse(result.isCritical());
            assertEquals(50.0, result.getFinalDamage(), DELTA);
        }

        @Test
        @DisplayName("Missing stats mean no critical and zero base damage")
        void missingStats() {
            DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 50, new TestStats()), null, null, null, null);
            assertFalse(result.isCritical());
            assertEquals(0.0, result.getBaseDamage(), DELTA);
            assertEquals(50.0, result.getFinalDamage(), DELTA);
        }
    }

    @Test
    @DisplayName("Variance scales the final damage within the configured band")
    void varianceBand() {
        ResolutionPipeline low = new ResolutionPipeline(AffinityTable.defaults(), resolver, null,
            RandomSource.fixed(0.0), null, config);
        assertEquals(47.5, low.resolve(Attack.of(Element.FIRE, 50), null, null, null, null).getFinalDamage(), DELTA);
    }

    // ========== Composition ==========

    @Test
    @DisplayName("Fire 40 + Water 40 composes into Earth 48 and ignores Fire/Water resistance")
    void compositeHit() {
        ResistanceProfile profile = ResistanceProfile.builder()
            .resistance(Element.FIRE, 0.9).resistance(Element.WATER, 0.9).build();
        Attack attack = Attack.of(Element.FIRE, 40).withElement(Element.WATER, 40);

        DamageResult result = pipeline().resolve(attack, profile, null, null, null);
        assertTrue(result.isComposite());
        assertEquals("Mudslide", result.getCompositeName());
        assertEquals(List.of(Element.EARTH), result.getAttackElements());
        assertEquals(48.0, result.getFinalDamage(), DELTA);
        assertTrue(result.wasElementUsed(Element.EARTH));
        assertFalse(result.wasElementUsed(Element.FIRE));
    }

    @Test
    @DisplayName("Composite multiplier scales the composite power")
    void compositeMultiplier() {
        Attack attack = Attack.of(Element.FIRE, 40).withElement(Element.WATER, 40).withCompositeMultiplier(1.5);
        assertEquals(72.0, pipeline().resolve(attack, null, null, null, null).getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("Composition can be disabled by config or per attack")
    void compositionDisabled() {
        Attack attack = Attack.of(Element.FIRE, 40).withElement(Element.WATER, 40);
        assertEquals(80.0, pipeline().resolve(attack.withAllowComposition(false), null, null, null, null)
            .getFinalDamage(), DELTA);

        config.compositionEnabled(false);
        DamageResult result = pipeline().resolve(attack, null, null, null, null);
        assertFalse(result.isComposite());
        assertEquals(80.0, result.getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("A pre-composed attack resolves as its composite element")
    void preComposedAttack() {
        Attack attack = Attack.of(Element.LIGHT, 10).withComposite(Element.VOID, 30, 2.0);
        DamageResult result = pipeline().resolve(attack, null, null, null, null);
        assertTrue(result.isComposite());
        assertEquals(60.0, result.getElementDamage(Element.VOID), DELTA);
    }

    // ========== Environment ==========

    @Test
    @DisplayName("Environment multiplier, bonus and resistance apply per element")
    void environment() {
        EnvironmentProfile volcano = new EnvironmentProfile("volcano", "Volcanic Caldera")
            .resistance(Element.FIRE, 0.2)
            .damageModifier(Element.FIRE, 1.2, 5);
        // (40 * 1.2 + 5) * (1 - 0.2)
        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 40), null, null, volcano, null);
        assertEquals(42.4, result.getFinalDamage(), DELTA);

        DamageResult water = pipeline().resolve(Attack.of(Element.WATER, 40), null, null, volcano, null);
        assertEquals(40.0, water.getFinalDamage(), DELTA);
    }

    @Test
    @DisplayName("Environmental effects can be switched off")
    void environmentDisabled() {
        config.environmentalEffectsEnabled(false);
        EnvironmentProfile volcano = new EnvironmentProfile("volcano", "Volcanic Caldera")
            .damageModifier(Element.FIRE, 2.0, 0);
        assertEquals(40.0, pipeline().resolve(Attack.of(Element.FIRE, 40), null, null, volcano, null)
            .getFinalDamage(), DELTA);
    }

    // ========== On-hit effects ==========

    @Test
    @DisplayName("Triggered effects are reported; applied lists only what the applicator accepted")
    void statusEffects() {
        ElementRegistry registry = new ElementRegistry();
        registry.register(new ElementDefinition("fire", Element.FIRE)
            .effect(new ElementalEffect("fire_burn", Element.FIRE)
                .minimumDamage(10)
                .statusEffect("burn")
                .statusEffect("ignite")));
        StatusEffectApplicator applicator = (id, element, target) -> id.equals("burn");
        ResolutionPipeline pipeline = pipeline(registry, applicator);

        DamageResult hit = pipeline.resolve(Attack.of(Element.FIRE, 25), null, null, null, new TestStats());
        assertEquals(List.of("burn", "ignite"), hit.getTriggeredEffects());
        assertEquals(List.of("burn"), hit.getAppliedEffects());

        DamageResult weak = pipeline.resolve(Attack.of(Element.FIRE, 5), null, null, null, new TestStats());
        assertTrue(weak.getTriggeredEffects().isEmpty());

        DamageResult noTarget = pipeline.resolve(Attack.of(Element.FIRE, 25), null, null, null, null);
        assertEquals(2, noTarget.getTriggeredEffects().size());
        assertTrue(noTarget.getAppliedEffects().isEmpty());
    }

    @Test
    @DisplayName("withMultiplier scales final damage and logs the reason")
    void withMultiplier() {
        DamageResult result = pipeline().resolve(Attack.of(Element.FIRE, 25), null, null, null, null);
        DamageResult doubled = result.withMultiplier(2.0, "Global multiplier");
        assertEquals(50.0, doubled.getFinalDamage(), DELTA);
        assertEquals(25.0, result.getFinalDamage(), DELTA);
        assertTrue(doubled.getCalculationLog().get(doubled.getCalculationLog().size() - 1).startsWith("Global multiplier"));
        assertSame(result, result.withMultiplier(1.0, "noop"));
    }
}
