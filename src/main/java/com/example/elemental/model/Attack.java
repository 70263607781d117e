package com.example.elemental.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An outgoing elemental attack: ordered (element, power) pairs, an optional attributed
 * source, and an optional composite state.
 *
 * Attacks are immutable. Composition, conversion and multipliers produce new instances,
 * so one attack can be resolved against any number of targets.
 *
 * When the attack is composite the raw pairs are superseded; every query below reads
 * the composite element and power instead.
 */
public final class Attack {

    private final List<ElementPower> pairs;
    private final StatAccessor source;
    private final boolean allowComposition;
    private final boolean composite;
    private final Element compositeElement;
    private final double compositePower;
    private final double compositeMultiplier;

    private Attack(List<ElementPower> pairs, StatAccessor source, boolean allowComposition,
                   boolean composite, Element compositeElement, double compositePower,
                   double compositeMultiplier) {
        this.pairs = Collections.unmodifiableList(new ArrayList<>(pairs));
        this.source = source;
        this.allowComposition = allowComposition;
        this.composite = composite;
        this.compositeElement = compositeElement == null ? Element.NONE : compositeElement;
        this.compositePower = compositePower;
        this.compositeMultiplier = compositeMultiplier;
    }

    public Attack(List<ElementPower> pairs, StatAccessor source) {
        this(Objects.requireNonNull(pairs, "pairs"), source, true, false, Element.NONE, 0.0, 1.0);
    }

    public static Attack of(Element element, double power) {
        return of(element, power, null);
    }

    public static Attack of(Element element, double power, StatAccessor source) {
        return new Attack(List.of(new ElementPower(element, power)), source);
    }

    // Derivations

    public Attack withElement(Element element, double power) {
        List<ElementPower> next = new ArrayList<>(pairs);
        next.add(new ElementPower(element, power));
        return new Attack(next, source, allowComposition, composite, compositeElement, compositePower, compositeMultiplier);
    }

    public Attack withPairs(List<ElementPower> newPairs) {
        return new Attack(newPairs, source, allowComposition, composite, compositeElement, compositePower, compositeMultiplier);
    }

    public Attack withSource(StatAccessor newSource) {
        return new Attack(pairs, newSource, allowComposition, composite, compositeElement, compositePower, compositeMultiplier);
    }

    public Attack withAllowComposition(boolean allow) {
        return new Attack(pairs, source, allow, composite, compositeElement, compositePower, compositeMultiplier);
    }

    public Attack withComposite(Element element, double power, double multiplier) {
        return new Attack(pairs, source, allowComposition, true, element, power, multiplier);
    }

    public Attack withoutComposite() {
        return new Attack(pairs, source, allowComposition, false, Element.NONE, 0.0, 1.0);
    }

    /**
     * Set the multiplier applied to a composite once one forms, without marking the attack composite.
     */
    public Attack withCompositeMultiplier(double multiplier) {
        return new Attack(pairs, source, allowComposition, composite, compositeElement, compositePower, multiplier);
    }

    /**
     * Scale every power (or the composite power) by the given factor.
     */
    public Attack applyMultiplier(double multiplier) {
        if (composite) {
            return new Attack(pairs, source, allowComposition, true, compositeElement,
                compositePower * multiplier, compositeMultiplier);
        }
        List<ElementPower> scaled = new ArrayList<>(pairs.size());
        for (ElementPower p : pairs) {
            scaled.add(p.withPower(p.power() * multiplier));
        }
        return withPairs(scaled);
    }

    /**
     * Fold the composite multiplier into the composite power. No-op for non-composite attacks.
     */
    public Attack applyCompositeMultiplier() {
        if (!composite || compositeMultiplier == 1.0) return this;
        return new Attack(pairs, source, allowComposition, true, compositeElement,
            compositePower * compositeMultiplier, 1.0);
    }

    // Queries

    /**
     * The pairs damage is calculated from: the single composite pair when composite, the raw pairs otherwise.
     */
    public List<ElementPower> getResolvedPairs() {
        if (composite) {
            return List.of(new ElementPower(compositeElement, compositePower));
        }
        return pairs;
    }

    public double getTotalPower() {
        if (composite) return compositePower;
        double total = 0.0;
        for (ElementPower p : pairs) total += p.power();
        return total;
    }

    public double getElementPower(Element element) {
        if (composite) return compositeElement == element ? compositePower : 0.0;
        double total = 0.0;
        for (ElementPower p : pairs) {
            if (p.element() == element) total += p.power();
        }
        return total;
    }

    public boolean hasElement(Element element) {
        if (composite) return compositeElement == element;
        for (ElementPower p : pairs) {
            if (p.element() == element) return true;
        }
        return false;
    }

    /**
     * Distinct elements in first-seen order.
     */
    public List<Element> getUniqueElements() {
        if (composite) return List.of(compositeElement);
        Set<Element> unique = new LinkedHashSet<>();
        for (ElementPower p : pairs) unique.add(p.element());
        return new ArrayList<>(unique);
    }

    public int getElementCount() {
        return composite ? 1 : getUniqueElements().size();
    }

    public boolean isMultiElement() {
        return !composite && getUniqueElements().size() > 1;
    }

    public List<Element> getElements() {
        if (composite) return List.of(compositeElement);
        List<Element> out = new ArrayList<>(pairs.size());
        for (ElementPower p : pairs) out.add(p.element());
        return out;
    }

    public List<Double> getPowers() {
        if (composite) return List.of(compositePower);
        List<Double> out = new ArrayList<>(pairs.size());
        for (ElementPower p : pairs) out.add(p.power());
        return out;
    }

    /** Raw pairs as built, ignoring any composite state. */
    public List<ElementPower> getPairs() { return pairs; }
    public StatAccessor getSource() { return source; }
    public boolean hasSource() { return source != null; }
    public boolean isCompositionAllowed() { return allowComposition; }
    public boolean isComposite() { return composite; }
    public Element getCompositeElement() { return compositeElement; }
    public double getCompositePower() { return compositePower; }
    public double getCompositeMultiplier() { return compositeMultiplier; }

    @Override
    public String toString() {
        if (composite) {
            return String.format("Attack[composite %s:%.2f x%.2f]",
                compositeElement.getDisplayName(), compositePower, compositeMultiplier);
        }
        return "Attack" + pairs;
    }
}
