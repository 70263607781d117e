package com.example.elemental.persistence;

import com.example.elemental.combat.AffinityTable;
import com.example.elemental.combat.CombineMethod;
import com.example.elemental.combat.CompositeRule;
import com.example.elemental.combat.PowerCurve;
import com.example.elemental.effect.ElementDefinition;
import com.example.elemental.effect.ElementalEffect;
import com.example.elemental.model.Element;
import com.example.elemental.model.ElementFlag;
import com.example.elemental.model.EnvironmentProfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads element data (affinity matrix, composite rules, element definitions, environments,
 * weapon and skill bonuses) from YAML resources, and exports affinity matrices back to YAML.
 *
 * Every section is optional. Without an {@code affinity} section the default matrix is used.
 * Unknown element names, flags or combine methods fail the load.
 */
public class ElementDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(ElementDataLoader.class);

    public static final String DEFAULT_RESOURCE = "/elements.yaml";

    /**
     * Load from a classpath resource.
     * @throws ElementDataException if the resource is missing or malformed
     */
    public ElementData load(String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new ElementDataException(resourcePath, "resource not found");
            }
            return load(is, resourcePath);
        } catch (IOException e) {
            throw new ElementDataException(resourcePath, "read failed: " + e.getMessage(), e);
        }
    }

    public ElementData load(InputStream is, String sourceName) {
        Object root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new ElementDataException(sourceName, "malformed YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            return new ElementData(AffinityTable.defaults());
        }
        if (!(root instanceof Map)) {
            throw new ElementDataException(sourceName, "top level must be a mapping");
        }
        Parser p = new Parser(sourceName);
        Map<String, Object> data = p.map(root, "top level");

        ElementData out = new ElementData(p.affinity(data.get("affinity")));
        for (Map<String, Object> m : p.maps(data.get("composite_rules"), "composite_rules")) {
            out.addCompositeRule(p.compositeRule(m));
        }
        for (Map<String, Object> m : p.maps(data.get("elements"), "elements")) {
            out.addDefinition(p.definition(m));
        }
        for (Map<String, Object> m : p.maps(data.get("environments"), "environments")) {
            out.addEnvironment(p.environment(m));
        }
        for (Map<String, Object> m : p.maps(data.get("weapon_bonuses"), "weapon_bonuses")) {
            out.addWeaponBonus(p.bonus(m, "weapon"));
        }
        for (Map<String, Object> m : p.maps(data.get("skill_bonuses"), "skill_bonuses")) {
            out.addSkillBonus(p.bonus(m, "skill"));
        }

        logger.info("Loaded element data from {}: {} composite rules, {} definitions, {} environments, {} weapon / {} skill bonuses",
            sourceName, out.getCompositeRules().size(), out.getDefinitions().size(), out.getEnvironments().size(),
            out.getWeaponBonuses().size(), out.getSkillBonuses().size());
        return out;
    }

    /**
     * Export the table's persisted matrix in the format {@link #load} reads under {@code affinity}.
     */
    public String exportAffinityMatrix(AffinityTable table) {
        List<String> supported = new ArrayList<>();
        for (Element e : table.getSupportedElements()) supported.add(e.name());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (AffinityTable.AffinityRow row : table.getMatrix()) {
            Map<String, Object> r = new LinkedHashMap<>();
            r.put("attack", row.getAttackElement().name());
            r.put("defense", new ArrayList<>(row.getDefenseAffinities()));
            rows.add(r);
        }
        Map<String, Object> affinity = new LinkedHashMap<>();
        affinity.put("supported_elements", supported);
        affinity.put("matrix", rows);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("affinity", affinity);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(root);
    }

    // Field parsing for one source; errors carry the source name
    private static final class Parser {
        private final String source;

        Parser(String source) {
            this.source = source;
        }

        AffinityTable affinity(Object section) {
            if (section == null) return AffinityTable.defaults();
            Map<String, Object> m = map(section, "affinity");
            AffinityTable table;
            if (m.containsKey("matrix")) {
                List<Element> supported = new ArrayList<>();
                for (Object o : list(m.get("supported_elements"), "affinity.supported_elements")) {
                    supported.add(element(o));
                }
                List<AffinityTable.AffinityRow> rows = new ArrayList<>();
                for (Map<String, Object> row : maps(m.get("matrix"), "affinity.matrix")) {
                    List<Double> values = new ArrayList<>();
                    for (Object v : list(row.get("defense"), "affinity.matrix.defense")) {
                        values.add(number(v, "affinity.matrix.defense"));
                    }
                    if (values.size() != supported.size()) {
                        throw new ElementDataException(source, "affinity row for " + row.get("attack")
                            + " has " + values.size() + " values, expected " + supported.size());
                    }
                    rows.add(new AffinityTable.AffinityRow(element(row.get("attack")), values));
                }
                table = new AffinityTable(supported, rows);
            } else {
                String preset = str(m.get("preset"));
                if (preset != null && !preset.equalsIgnoreCase("default")) {
                    throw new ElementDataException(source, "unknown affinity preset: " + preset);
                }
                table = AffinityTable.defaults();
            }
            for (Map<String, Object> e : maps(m.get("entries"), "affinity.entries")) {
                table.set(element(e.get("attack")), element(e.get("defense")), number(e.get("value"), "affinity.entries.value"));
            }
            return table;
        }

        CompositeRule compositeRule(Map<String, Object> m) {
            List<Element> inputs = new ArrayList<>();
            for (Object o : list(m.get("inputs"), "composite_rules.inputs")) {
                inputs.add(element(o));
            }
            String methodName = str(m.get("method"));
            CombineMethod method = CombineMethod.fromString(methodName);
            if (method == null) {
                throw new ElementDataException(source, "unknown combine method: " + methodName);
            }
            CompositeRule rule = new CompositeRule(inputs)
                .combineMethod(method)
                .result(m.containsKey("result") ? element(m.get("result")) : Element.NONE, str(m.get("name")))
                .powerMultiplier(numberOr(m.get("power_multiplier"), 1.0, "power_multiplier"))
                .minimumPowerThreshold(numberOr(m.get("minimum_power"), 0.0, "minimum_power"))
                .requiredElementCount((int) numberOr(m.get("required_count"), 2, "required_count"));
            Object weights = m.get("weights");
            if (weights != null) {
                for (Map.Entry<String, Object> w : map(weights, "composite_rules.weights").entrySet()) {
                    rule.weight(element(w.getKey()), number(w.getValue(), "weights"));
                }
            }
            Object curve = m.get("curve");
            if (curve != null) {
                List<PowerCurve.Key> keys = new ArrayList<>();
                for (Object k : list(curve, "composite_rules.curve")) {
                    List<Object> pair = list(k, "composite_rules.curve key");
                    if (pair.size() != 2) {
                        throw new ElementDataException(source, "curve keys must be [time, value] pairs");
                    }
                    keys.add(new PowerCurve.Key(number(pair.get(0), "curve"), number(pair.get(1), "curve")));
                }
                rule.customCurve(PowerCurve.of(keys));
            }
            return rule;
        }

        ElementDefinition definition(Map<String, Object> m) {
            Element element = element(m.get("element"));
            String id = str(m.get("id"));
            ElementDefinition def = new ElementDefinition(id != null ? id : element.name().toLowerCase(), element)
                .displayName(str(m.get("name")))
                .description(str(m.get("description")));
            for (Object f : list(m.get("flags"), "elements.flags")) {
                def.flag(flag(f));
            }
            for (Map<String, Object> e : maps(m.get("effects"), "elements.effects")) {
                Element trigger = e.containsKey("trigger") ? element(e.get("trigger")) : element;
                String effectId = str(e.get("id"));
                ElementalEffect effect = new ElementalEffect(effectId != null ? effectId : def.getElementId() + "_effect", trigger)
                    .name(str(e.get("name")))
                    .basePower(numberOr(e.get("base_power"), 10.0, "base_power"))
                    .duration(numberOr(e.get("duration"), 5.0, "duration"))
                    .minimumDamage(numberOr(e.get("minimum_damage"), 0.0, "minimum_damage"));
                for (Object s : list(e.get("status_effects"), "elements.effects.status_effects")) {
                    effect.statusEffect(str(s));
                }
                def.effect(effect);
            }
            return def;
        }

        EnvironmentProfile environment(Map<String, Object> m) {
            String id = str(m.get("id"));
            if (id == null || id.isEmpty()) {
                throw new ElementDataException(source, "environment without id");
            }
            EnvironmentProfile env = new EnvironmentProfile(id, str(m.get("name")))
                .description(str(m.get("description")));
            Object resistances = m.get("resistances");
            if (resistances != null) {
                for (Map.Entry<String, Object> r : map(resistances, "environments.resistances").entrySet()) {
                    env.resistance(element(r.getKey()), number(r.getValue(), "resistances"));
                }
            }
            for (Map<String, Object> d : maps(m.get("damage_modifiers"), "environments.damage_modifiers")) {
                env.damageModifier(element(d.get("element")),
                    numberOr(d.get("multiplier"), 1.0, "multiplier"),
                    numberOr(d.get("bonus"), 0.0, "bonus"));
            }
            for (Map<String, Object> a : maps(m.get("ambient_effects"), "environments.ambient_effects")) {
                Set<Element> immune = EnumSet.noneOf(Element.class);
                for (Object o : list(a.get("immune_elements"), "ambient_effects.immune_elements")) {
                    immune.add(element(o));
                }
                env.ambientEffect(new EnvironmentProfile.AmbientEffect(element(a.get("element")),
                    str(a.get("status_effect")), numberOr(a.get("chance"), 0.0, "chance"), immune));
            }
            return env;
        }

        ElementData.BonusEntry bonus(Map<String, Object> m, String ownerKey) {
            String owner = str(m.get(ownerKey));
            if (owner == null || owner.isEmpty()) {
                throw new ElementDataException(source, ownerKey + " bonus without " + ownerKey + " id");
            }
            return new ElementData.BonusEntry(owner, element(m.get("element")),
                numberOr(m.get("flat"), 0.0, "flat"),
                numberOr(m.get("percentage"), 0.0, "percentage"),
                numberOr(m.get("duration"), -1.0, "duration"));
        }

        // Primitives

        Element element(Object o) {
            Element e = Element.fromString(str(o));
            if (e == null) {
                throw new ElementDataException(source, "unknown element: " + o);
            }
            return e;
        }

        ElementFlag flag(Object o) {
            String s = str(o);
            for (ElementFlag f : ElementFlag.values()) {
                if (f.name().equalsIgnoreCase(s)) return f;
            }
            throw new ElementDataException(source, "unknown element flag: " + o);
        }

        double number(Object o, String field) {
            if (o instanceof Number n) return n.doubleValue();
            if (o == null) {
                throw new ElementDataException(source, "missing number for " + field);
            }
            try {
                return Double.parseDouble(o.toString().trim());
            } catch (NumberFormatException e) {
                throw new ElementDataException(source, "not a number for " + field + ": " + o, e);
            }
        }

        double numberOr(Object o, double fallback, String field) {
            return o == null ? fallback : number(o, field);
        }

        // Copies the mapping so a non-string key fails here instead of as a ClassCastException later
        Map<String, Object> map(Object o, String field) {
            if (!(o instanceof Map<?, ?> raw)) {
                throw new ElementDataException(source, field + " must be a mapping");
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : raw.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new ElementDataException(source, field + " has a non-string key: " + e.getKey());
                }
                out.put(key, e.getValue());
            }
            return out;
        }

        @SuppressWarnings("unchecked")
        List<Object> list(Object o, String field) {
            if (o == null) return List.of();
            if (o instanceof List) return (List<Object>) o;
            throw new ElementDataException(source, field + " must be a list");
        }

        List<Map<String, Object>> maps(Object o, String field) {
            List<Map<String, Object>> out = new ArrayList<>();
            for (Object item : list(o, field)) {
                out.add(map(item, field));
            }
            return out;
        }

        private static String str(Object o) {
            return o == null ? null : o.toString().trim();
        }
    }
}
