package com.example.elemental.persistence;

import com.example.elemental.combat.AffinityTable;
import com.example.elemental.combat.CompositeRule;
import com.example.elemental.effect.ElementDefinition;
import com.example.elemental.model.Element;
import com.example.elemental.model.EnvironmentProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything read from one element data file.
 */
public class ElementData {

    /** A weapon or skill bonus from the catalog; ownerId is the weapon or skill id. */
    public record BonusEntry(String ownerId, Element element, double flatBonus, double percentageBonus, double duration) {}

    private final AffinityTable affinityTable;
    private final List<CompositeRule> compositeRules = new ArrayList<>();
    private final List<ElementDefinition> definitions = new ArrayList<>();
    private final List<EnvironmentProfile> environments = new ArrayList<>();
    private final List<BonusEntry> weaponBonuses = new ArrayList<>();
    private final List<BonusEntry> skillBonuses = new ArrayList<>();

    public ElementData(AffinityTable affinityTable) {
        this.affinityTable = affinityTable;
    }

    void addCompositeRule(CompositeRule rule) { compositeRules.add(rule); }
    void addDefinition(ElementDefinition def) { definitions.add(def); }
    void addEnvironment(EnvironmentProfile env) { environments.add(env); }
    void addWeaponBonus(BonusEntry b) { weaponBonuses.add(b); }
    void addSkillBonus(BonusEntry b) { skillBonuses.add(b); }

    public AffinityTable getAffinityTable() { return affinityTable; }
    public List<CompositeRule> getCompositeRules() { return Collections.unmodifiableList(compositeRules); }
    public List<ElementDefinition> getDefinitions() { return Collections.unmodifiableList(definitions); }
    public List<EnvironmentProfile> getEnvironments() { return Collections.unmodifiableList(environments); }
    public List<BonusEntry> getWeaponBonuses() { return Collections.unmodifiableList(weaponBonuses); }
    public List<BonusEntry> getSkillBonuses() { return Collections.unmodifiableList(skillBonuses); }
}
