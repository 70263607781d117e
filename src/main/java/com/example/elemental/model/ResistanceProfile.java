package com.example.elemental.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-element resistance values of one defense source (or of an aggregate).
 * Values lie in [-1, 1]: negative amplifies damage, positive reduces it.
 *
 * Profiles are immutable; build them with {@link #builder()}.
 */
public final class ResistanceProfile {

    private static final ResistanceProfile EMPTY = builder().build();

    private final Map<Element, Double> resistances;
    private final Element primaryElement;
    private final Set<Element> immunities;
    private final Set<Element> weaknesses;

    private ResistanceProfile(Builder b) {
        this.resistances = Collections.unmodifiableMap(new EnumMap<>(b.resistances));
        this.primaryElement = b.primaryElement;
        this.immunities = Collections.unmodifiableSet(copyOf(b.immunities));
        this.weaknesses = Collections.unmodifiableSet(copyOf(b.weaknesses));
    }

    private static Set<Element> copyOf(Set<Element> src) {
        return src.isEmpty() ? EnumSet.noneOf(Element.class) : EnumSet.copyOf(src);
    }

    /** All-zero profile with no primary element. */
    public static ResistanceProfile empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.resistances.putAll(resistances);
        b.primaryElement = primaryElement;
        b.immunities.addAll(immunities);
        b.weaknesses.addAll(weaknesses);
        return b;
    }

    public double getResistance(Element element) {
        Double v = resistances.get(element);
        return v != null ? v : 0.0;
    }

    public boolean isImmune(Element element) {
        return immunities.contains(element);
    }

    public boolean isWeak(Element element) {
        return weaknesses.contains(element);
    }

    public Map<Element, Double> getResistances() { return resistances; }
    public Element getPrimaryElement() { return primaryElement; }
    public Set<Element> getImmunities() { return immunities; }
    public Set<Element> getWeaknesses() { return weaknesses; }

    @Override
    public String toString() {
        return "ResistanceProfile[primary=" + primaryElement + ", resistances=" + resistances
            + ", immune=" + immunities + ", weak=" + weaknesses + "]";
    }

    public static final class Builder {
        private final Map<Element, Double> resistances = new EnumMap<>(Element.class);
        private Element primaryElement = Element.NONE;
        private final Set<Element> immunities = EnumSet.noneOf(Element.class);
        private final Set<Element> weaknesses = EnumSet.noneOf(Element.class);

        private Builder() {}

        /** Set a resistance, clamped to [-1, 1]. */
        public Builder resistance(Element element, double value) {
            resistances.put(element, Math.max(-1.0, Math.min(1.0, value)));
            return this;
        }

        public Builder removeResistance(Element element) {
            resistances.remove(element);
            return this;
        }

        public Builder primaryElement(Element element) {
            this.primaryElement = element == null ? Element.NONE : element;
            return this;
        }

        public Builder immunity(Element element) {
            immunities.add(element);
            return this;
        }

        public Builder immunities(Set<Element> elements) {
            immunities.addAll(elements);
            return this;
        }

        public Builder weakness(Element element) {
            weaknesses.add(element);
            return this;
        }

        public Builder weaknesses(Set<Element> elements) {
            weaknesses.addAll(elements);
            return this;
        }

        public ResistanceProfile build() {
            return new ResistanceProfile(this);
        }
    }
}
