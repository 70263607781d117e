package com.example.elemental.combat;

import com.example.elemental.model.Element;
import com.example.elemental.model.ElementPower;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the first applicable composite rule for a multi-element attack.
 * Rules that require more input elements are tried first; ties keep registration order.
 */
public class CompositionResolver {

    private final List<CompositeRule> rules = new ArrayList<>();
    private List<CompositeRule> sortedRules;

    public CompositionResolver() {}

    public CompositionResolver(List<CompositeRule> rules) {
        this.rules.addAll(rules);
    }

    public void addRule(CompositeRule rule) {
        if (rule == null) return;
        rules.add(rule);
        sortedRules = null;
    }

    public boolean removeRule(CompositeRule rule) {
        boolean removed = rules.remove(rule);
        if (removed) sortedRules = null;
        return removed;
    }

    public List<CompositeRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public Composition tryCombine(List<ElementPower> pairs) {
        List<Element> sources = new ArrayList<>(pairs.size());
        for (ElementPower p : pairs) sources.add(p.element());
        Element fallbackElement = pairs.isEmpty() ? Element.NONE : pairs.get(0).element();
        double fallbackPower = pairs.isEmpty() ? 0.0 : pairs.get(0).power();

        Set<Element> unique = new LinkedHashSet<>(sources);
        if (unique.size() <= 1) {
            return Composition.none(fallbackElement, fallbackPower, sources);
        }

        for (CompositeRule rule : ordered()) {
            if (rule.canCombine(pairs)) {
                return rule.combine(pairs);
            }
        }
        return Composition.none(fallbackElement, fallbackPower, sources);
    }

    private List<CompositeRule> ordered() {
        if (sortedRules == null) {
            List<CompositeRule> copy = new ArrayList<>(rules);
            // List.sort is stable
            copy.sort(Comparator.comparingInt((CompositeRule r) -> r.getInputElements().size()).reversed());
            sortedRules = copy;
        }
        return sortedRules;
    }
}
