package com.example.elemental.combat;

import com.example.elemental.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static attack-element vs defense-element affinity multipliers.
 *
 * The persisted form is a square matrix: a list of supported elements and one row of
 * defense affinities per attacking element, in supported-element order. Lookups go
 * through a map built lazily from the matrix on first access; {@link #set} writes the
 * lookup and mirrors the change back into the matrix.
 *
 * Unset pairs are neutral (1.0). Shared read-mostly data: callers synchronize writes.
 */
public class AffinityTable {

    public static final double NEUTRAL = 1.0;

    /** One matrix row: affinities of an attacking element against each supported element. */
    public static class AffinityRow {
        private final Element attackElement;
        private final List<Double> defenseAffinities;

        public AffinityRow(Element attackElement, List<Double> defenseAffinities) {
            this.attackElement = attackElement;
            this.defenseAffinities = new ArrayList<>(defenseAffinities);
        }

        public Element getAttackElement() { return attackElement; }
        public List<Double> getDefenseAffinities() { return Collections.unmodifiableList(defenseAffinities); }
    }

    private final List<Element> supportedElements;
    private final List<AffinityRow> matrix;
    private Map<Element, Map<Element, Double>> lookup;

    /** Empty table: every pair is neutral. */
    public AffinityTable() {
        this(new ArrayList<>(), new ArrayList<>());
    }

    public AffinityTable(List<Element> supportedElements, List<AffinityRow> matrix) {
        this.supportedElements = new ArrayList<>(supportedElements);
        this.matrix = new ArrayList<>(matrix);
    }

    /**
     * Table over every element except NONE, seeded with the standard elemental relationships.
     */
    public static AffinityTable defaults() {
        List<Element> supported = new ArrayList<>();
        for (Element e : Element.values()) {
            if (e != Element.NONE) supported.add(e);
        }
        List<AffinityRow> rows = new ArrayList<>();
        for (Element attack : supported) {
            List<Double> row = new ArrayList<>();
            for (Element defense : supported) {
                row.add(defaultAffinity(attack, defense));
            }
            rows.add(new AffinityRow(attack, row));
        }
        return new AffinityTable(supported, rows);
    }

    static double defaultAffinity(Element attack, Element defense) {
        switch (attack) {
            case FIRE:
                if (defense == Element.WATER) return 0.5;
                if (defense == Element.ICE) return 1.5;
                if (defense == Element.EARTH) return 1.2;
                break;
            case WATER:
                if (defense == Element.FIRE) return 1.5;
                if (defense == Element.LIGHTNING) return 0.5;
                if (defense == Element.EARTH) return 1.2;
                break;
            case WIND:
                if (defense == Element.EARTH) return 1.5;
                if (defense == Element.FIRE) return 1.2;
                break;
            case EARTH:
                if (defense == Element.WIND) return 0.5;
                if (defense == Element.WATER) return 0.8;
                break;
            case LIGHT:
                if (defense == Element.DARK) return 1.5;
                break;
            case DARK:
                if (defense == Element.LIGHT) return 1.5;
                break;
            case LIGHTNING:
                if (defense == Element.WATER) return 1.5;
                break;
            case ICE:
                if (defense == Element.FIRE) return 0.5;
                break;
            default:
                break;
        }
        // Same-element hits are resisted
        return attack == defense ? 0.5 : NEUTRAL;
    }

    public double get(Element attackElement, Element defenseElement) {
        ensureLookup();
        Map<Element, Double> row = lookup.get(attackElement);
        if (row == null) return NEUTRAL;
        Double v = row.get(defenseElement);
        return v != null ? v : NEUTRAL;
    }

    public void set(Element attackElement, Element defenseElement, double value) {
        ensureLookup();
        lookup.computeIfAbsent(attackElement, k -> new EnumMap<>(Element.class)).put(defenseElement, value);
        syncMatrix();
    }

    /**
     * Whether the pair has an explicit entry (as opposed to the neutral default).
     */
    public boolean contains(Element attackElement, Element defenseElement) {
        ensureLookup();
        Map<Element, Double> row = lookup.get(attackElement);
        return row != null && row.containsKey(defenseElement);
    }

    public List<Element> getSupportedElements() {
        return Collections.unmodifiableList(supportedElements);
    }

    public List<AffinityRow> getMatrix() {
        return Collections.unmodifiableList(matrix);
    }

    private void ensureLookup() {
        if (lookup != null) return;
        Map<Element, Map<Element, Double>> built = new EnumMap<>(Element.class);
        for (int i = 0; i < matrix.size() && i < supportedElements.size(); i++) {
            AffinityRow row = matrix.get(i);
            for (int j = 0; j < row.defenseAffinities.size() && j < supportedElements.size(); j++) {
                built.computeIfAbsent(row.attackElement, k -> new EnumMap<>(Element.class))
                    .put(supportedElements.get(j), row.defenseAffinities.get(j));
            }
        }
        lookup = built;
    }

    // Mirror lookup values back into matrix cells the matrix can represent
    private void syncMatrix() {
        for (int i = 0; i < matrix.size() && i < supportedElements.size(); i++) {
            AffinityRow row = matrix.get(i);
            Map<Element, Double> values = lookup.get(row.attackElement);
            if (values == null) continue;
            for (int j = 0; j < row.defenseAffinities.size() && j < supportedElements.size(); j++) {
                Double v = values.get(supportedElements.get(j));
                if (v != null) row.defenseAffinities.set(j, v);
            }
        }
    }
}
