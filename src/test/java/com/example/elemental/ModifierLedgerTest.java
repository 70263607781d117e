package com.example.elemental;

import com.example.elemental.combat.AffinityTable;
import com.example.elemental.combat.AttackBuilder;
import com.example.elemental.combat.ModifierLedger;
import com.example.elemental.combat.ModifierListener;
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
import com.example.elemental.model.StatKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for modifier application, removal, expiry and stacking.
 */
public class ModifierLedgerTest {

    private static final double DELTA = 0.001;

    private ModifierLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ModifierLedger();
    }

    private static ElementalModifier resistance(String id, Element element, double value) {
        return new ElementalModifier(id, new ModifierEffect.DefenseResistance(
            List.of(new ElementalValue(element, value))));
    }

    private static ElementalModifier attackBonus(String id, Element element, double flat, double percent) {
        return new ElementalModifier(id, new ModifierEffect.AttackBonus(
            List.of(new ElementalValue(element, flat, percent))));
    }

    private static ElementalModifier override(String id, Element attack, Element defense, double value) {
        return new ElementalModifier(id, new ModifierEffect.AffinityOverride(
            List.of(new AffinityOverrideEntry(attack, defense, value))));
    }

    // ========== Validation ==========

    @Test
    @DisplayName("Null, id-less and effect-less modifiers are rejected")
    void rejectsInvalidModifiers() {
        assertFalse(ledger.apply(null));
        assertFalse(ledger.apply(resistance(null, Element.FIRE, 0.1)));
        assertFalse(ledger.apply(resistance("", Element.FIRE, 0.1)));
        assertFalse(ledger.apply(new ElementalModifier("no_effect", null)));
        assertEquals(0, ledger.getActiveCount());
        assertEquals(0, ledger.getVersion());
    }

    // ========== Apply / remove ==========

    @Test
    @DisplayName("Apply then remove leaves every table as it was")
    void applyRemoveLeavesNoResidue() {
        ledger.apply(attackBonus("bonus", Element.FIRE, 10, 0).permanent());
        ledger.apply(resistance("ward", Element.ICE, 0.3).permanent());
        ledger.apply(override("slick", Element.LIGHTNING, Element.WATER, 3.0).permanent());
        assertEquals(1, ledger.getAttackBuilder().getModifierBucketCount());
        assertEquals(0, ledger.getAttackBuilder().getSkillBucketCount());
        assertEquals(1, ledger.getAggregator().getSourceCount());
        assertEquals(1, ledger.getOverrideTable().size());

        assertTrue(ledger.remove("bonus"));
        assertTrue(ledger.remove("ward"));
        assertTrue(ledger.remove("slick"));

        assertEquals(0, ledger.getActiveCount());
        assertEquals(0, ledger.getAttackBuilder().getModifierBucketCount());
        assertEquals(0, ledger.getAggregator().getSourceCount());
        assertEquals(0, ledger.getOverrideTable().size());
        assertFalse(ledger.remove("bonus"));
    }

    @Test
    @DisplayName("Removing a modifier leaves same-named entries it did not register")
    void removeKeepsCollidingIds() {
        AttackBuilder builder = ledger.getAttackBuilder();
        builder.registerSkillBonus("fireball", Element.FIRE, 10, 0);
        ledger.getAggregator().registerTemporaryDefense("ember",
            ResistanceProfile.builder().resistance(Element.FIRE, 0.2).build());

        ledger.apply(resistance("fireball", Element.FIRE, 0.3));
        ledger.apply(attackBonus("ember", Element.FIRE, 5, 0));
        assertTrue(ledger.remove("fireball"));
        assertTrue(ledger.remove("ember"));

        assertEquals(1, builder.getSkillBucketCount());
        assertEquals(10.0, builder.getSkillBonuses("fireball").get(0).getFlatBonus(), DELTA);
        assertEquals(0, builder.getModifierBucketCount());
        assertNotNull(ledger.getAggregator().getTemporaryDefense("ember"));
        assertNull(ledger.getAggregator().getTemporaryDefense("fireball"));
    }

    @Test
    @DisplayName("Removing one modifier keeps another modifier's overrides")
    void removeTouchesOnlyOwnOverrides() {
        ledger.apply(override("a", Element.FIRE, Element.NONE, 2.0).source("shared"));
        ledger.apply(override("b", Element.WATER, Element.NONE, 0.1).source("shared"));

        ledger.remove("a");
        AffinityTable table = new AffinityTable();
        assertEquals(1.0, ledger.getAffinity(Element.FIRE, Element.NONE, table), DELTA);
        assertEquals(0.1, ledger.getAffinity(Element.WATER, Element.NONE, table), DELTA);
    }

    @Test
    @DisplayName("removeBySource drops every modifier from that source")
    void removeBySource() {
        ledger.apply(resistance("r1", Element.FIRE, 0.1).source("robe"));
        ledger.apply(resistance("r2", Element.WATER, 0.1).source("robe"));
        ledger.apply(resistance("r3", Element.EARTH, 0.1).source("boots"));

        assertEquals(2, ledger.removeBySource("robe"));
        assertEquals(List.of("r3"), ledger.getActiveModifiers().stream().map(ElementalModifier::getId).toList());
        assertEquals(0, ledger.removeBySource("robe"));
    }

    @Test
    @DisplayName("clearByKind removes only the named kind")
    void clearByKind() {
        ledger.apply(resistance("r", Element.FIRE, 0.1));
        ledger.apply(attackBonus("b", Element.FIRE, 5, 0));
        ledger.apply(new ElementalModifier("c", new ModifierEffect.CompositeBonus(1.2)));

        assertEquals(1, ledger.clearByKind(ModifierKind.DEFENSE_RESISTANCE));
        assertFalse(ledger.hasModifier("r"));
        assertTrue(ledger.hasModifier("b"));
        assertTrue(ledger.hasModifier("c"));
    }

    @Test
    @DisplayName("Version advances on apply and removal")
    void versionAdvances() {
        long v0 = ledger.getVersion();
        ledger.apply(resistance("r", Element.FIRE, 0.1));
        long v1 = ledger.getVersion();
        ledger.remove("r");
        assertTrue(v1 > v0);
        assertTrue(ledger.getVersion() > v1);
    }

    // ========== Expiry ==========

    @Test
    @DisplayName("Timed modifiers expire on tick and listeners hear about it")
    void expiryNotifiesListeners() {
        List<String> expired = new ArrayList<>();
        ledger.addListener(new ModifierListener() {
            @Override
            public void onModifierExpired(ElementalModifier modifier) {
                expired.add(modifier.getId());
            }
        });
        ledger.apply(resistance("short", Element.FIRE, 0.2).duration(1.0));
        ledger.apply(resistance("long", Element.FIRE, 0.2).duration(5.0));
        ledger.apply(resistance("forever", Element.FIRE, 0.2).permanent());

        ledger.tick(0.5);
        assertTrue(expired.isEmpty());
        ledger.tick(0.6);
        assertEquals(List.of("short"), expired);
        assertEquals(2, ledger.getActiveCount());
        assertNull(ledger.getAggregator().getTemporaryDefense("short"));

        ledger.tick(100);
        assertEquals(List.of("short", "long"), expired);
        assertTrue(ledger.hasModifier("forever"));
    }

    @Test
    @DisplayName("A failing listener does not stop the ledger")
    void failingListenerIsContained() {
        ledger.addListener(new ModifierListener() {
            @Override
            public void onModifierApplied(ElementalModifier modifier) {
                throw new IllegalStateException("boom");
            }
        });
        assertTrue(ledger.apply(resistance("r", Element.FIRE, 0.1)));
        assertTrue(ledger.hasModifier("r"));
    }

    // ========== Stacking ==========

    @Test
    @DisplayName("Re-applying a stackable modifier adds a stack and scales its values")
    void stackingScalesValues() {
        ledger.apply(resistance("frost_ward", Element.ICE, 0.1).stacking(true, 3));
        ledger.apply(resistance("frost_ward", Element.ICE, 0.1).stacking(true, 3));

        assertEquals(1, ledger.getActiveCount());
        assertEquals(2, ledger.getModifier("frost_ward").getCurrentStacks());
        assertEquals(0.2, ledger.getAggregator().getTemporaryDefense("frost_ward").getResistance(Element.ICE), DELTA);

        ledger.apply(resistance("frost_ward", Element.ICE, 0.1).stacking(true, 3));
        ledger.apply(resistance("frost_ward", Element.ICE, 0.1).stacking(true, 3));
        assertEquals(3, ledger.getModifier("frost_ward").getCurrentStacks());
    }

    @Test
    @DisplayName("Re-applying a non-stackable modifier replaces it")
    void nonStackableReplaces() {
        ledger.apply(resistance("ward", Element.FIRE, 0.1));
        ledger.apply(resistance("ward", Element.FIRE, 0.4));
        assertEquals(1, ledger.getModifier("ward").getCurrentStacks());
        assertEquals(0.4, ledger.getAggregator().getTemporaryDefense("ward").getResistance(Element.FIRE), DELTA);
    }

    @Test
    @DisplayName("addStack and removeStack re-dispatch the scaled values")
    void addStackRedispatches() {
        ledger.apply(resistance("frost_ward", Element.ICE, 0.2).stacking(true, 2));
        long before = ledger.getVersion();

        assertTrue(ledger.addStack("frost_ward"));
        assertEquals(2, ledger.getModifier("frost_ward").getCurrentStacks());
        assertEquals(0.4, ledger.getAggregator().getTemporaryDefense("frost_ward").getResistance(Element.ICE), DELTA);
        assertTrue(ledger.getVersion() > before);

        assertFalse(ledger.addStack("frost_ward"));

        assertTrue(ledger.removeStack("frost_ward"));
        assertEquals(0.2, ledger.getAggregator().getTemporaryDefense("frost_ward").getResistance(Element.ICE), DELTA);
        assertFalse(ledger.removeStack("frost_ward"));
    }

    @Test
    @DisplayName("addStack scales attack bonuses and ignores non-stackable modifiers")
    void addStackScalesAttackBonus() {
        ledger.apply(attackBonus("ember", Element.FIRE, 5, 0).stacking(true, 3));
        ledger.apply(resistance("ward", Element.FIRE, 0.1));

        assertTrue(ledger.addStack("ember"));
        assertEquals(10.0, ledger.createAttack(new TestStats(), null, null).getElementPower(Element.FIRE), DELTA);
        assertEquals(1, ledger.getAttackBuilder().getModifierBonuses("ember").size());

        assertFalse(ledger.addStack("ward"));
        assertFalse(ledger.addStack("missing"));
    }

    @Test
    @DisplayName("refresh resets the remaining duration of the modifier and its bonuses")
    void refreshResetsDuration() {
        ledger.apply(attackBonus("ember", Element.FIRE, 5, 0).duration(10.0));
        ledger.tick(6.0);
        ElementalModifier ticked = ledger.getModifier("ember");
        assertEquals(4.0, ticked.getRemainingDuration(), DELTA);
        assertEquals(0.4, ticked.getDurationPercentage(), DELTA);

        assertTrue(ledger.refresh("ember"));
        ElementalModifier refreshed = ledger.getModifier("ember");
        assertEquals(10.0, refreshed.getRemainingDuration(), DELTA);
        assertEquals(1.0, refreshed.getDurationPercentage(), DELTA);
        assertEquals(10.0, ledger.getAttackBuilder().getModifierBonuses("ember").get(0).getDuration(), DELTA);

        // Without the refresh both would have run out by now
        ledger.tick(6.0);
        assertTrue(ledger.hasModifier("ember"));
        assertEquals(5.0, ledger.createAttack(new TestStats(), null, null).getElementPower(Element.FIRE), DELTA);
    }

    @Test
    @DisplayName("refresh ignores permanent and unknown modifiers")
    void refreshIgnoresPermanent() {
        ledger.apply(resistance("ward", Element.FIRE, 0.1).permanent());
        assertFalse(ledger.refresh("ward"));
        assertFalse(ledger.refresh("missing"));
        assertEquals(1.0, ledger.getModifier("ward").getDurationPercentage(), DELTA);
        assertFalse(ledger.getModifier("ward").isExpired());
    }

    @Test
    @DisplayName("A modifier ticked past its duration reports expired")
    void modifierExpiry() {
        ElementalModifier m = resistance("flash", Element.FIRE, 0.1).duration(1.0);
        assertFalse(m.tick(0.5));
        assertFalse(m.isExpired());
        assertEquals(0.5, m.getDurationPercentage(), DELTA);
        assertTrue(m.tick(0.5));
        assertTrue(m.isExpired());
        assertEquals(0.0, m.getDurationPercentage(), DELTA);
    }

    // ========== Attack side ==========

    @Test
    @DisplayName("createAttack applies bonuses, conversions and composite multiplier")
    void createAttackCombinesModifiers() {
        TestStats stats = new TestStats().with(StatKind.MAGIC_POWER, 100);
        ledger.apply(attackBonus("ember", Element.FIRE, 10, 20));
        ledger.apply(new ElementalModifier("frostbrand",
            new ModifierEffect.ElementalConversion(new ConversionRule(Element.FIRE, Element.ICE))));
        ledger.apply(new ElementalModifier("resonance", new ModifierEffect.CompositeBonus(1.5)));

        Attack attack = ledger.createAttack(stats, null, null);
        assertEquals(List.of(Element.ICE), attack.getElements());
        assertEquals(30.0, attack.getElementPower(Element.ICE), DELTA);
        assertEquals(1.5, attack.getCompositeMultiplier(), DELTA);
        assertFalse(attack.isComposite());
    }

    @Test
    @DisplayName("Composite multipliers from several modifiers multiply")
    void compositeMultipliersMultiply() {
        assertEquals(1.0, ledger.getCompositeMultiplier(), DELTA);
        ledger.apply(new ElementalModifier("a", new ModifierEffect.CompositeBonus(1.5)));
        ledger.apply(new ElementalModifier("b", new ModifierEffect.CompositeBonus(2.0)));
        assertEquals(3.0, ledger.getCompositeMultiplier(), DELTA);
    }

    // ========== Integration helpers ==========

    @Test
    @DisplayName("Equipment modifiers are permanent and revoked by equipment id")
    void equipmentModifiers() {
        ledger.registerEquipmentModifiers("flame_shield", List.of(
            resistance("shield_fire", Element.FIRE, 0.3).duration(2.0)));
        ElementalModifier m = ledger.getModifier("shield_fire");
        assertTrue(m.isPermanent());
        assertEquals("flame_shield", m.getSourceId());

        ledger.tick(10);
        assertTrue(ledger.hasModifier("shield_fire"));
        assertEquals(1, ledger.unregisterEquipmentModifiers("flame_shield"));
    }

    @Test
    @DisplayName("Buff modifiers take the buff's duration")
    void buffModifiers() {
        ledger.registerBuffModifiers("haste", List.of(attackBonus("haste_wind", Element.WIND, 5, 0)), 3.0);
        ElementalModifier m = ledger.getModifier("haste_wind");
        assertFalse(m.isPermanent());
        assertEquals(3.0, m.getRemainingDuration(), DELTA);
        ledger.tick(3.0);
        assertFalse(ledger.hasModifier("haste_wind"));
    }

    @Test
    @DisplayName("Environment resistances come and go as one modifier")
    void environmentModifier() {
        EnvironmentProfile tundra = new EnvironmentProfile("tundra", "Frozen Tundra").resistance(Element.ICE, 0.3);
        ledger.applyEnvironment(tundra);

        ElementalModifier m = ledger.getModifier(ModifierLedger.ENVIRONMENT_PREFIX + "tundra");
        assertNotNull(m);
        assertEquals("tundra", m.getSourceId());
        assertEquals(0.3, ledger.getAggregator().getTemporaryDefense(m.getId()).getResistance(Element.ICE), DELTA);

        assertTrue(ledger.removeEnvironment("tundra"));
        assertEquals(0, ledger.getAggregator().getSourceCount());
    }
}
