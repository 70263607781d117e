package com.example.elemental.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Piecewise-linear curve over [0, 1] used by {@link CombineMethod#CUSTOM_CURVE}.
 * Inputs outside the first/last key are clamped to the end values.
 */
public final class PowerCurve implements DoubleUnaryOperator {

    public record Key(double time, double value) {}

    private static final PowerCurve LINEAR = new PowerCurve(List.of(new Key(0, 0), new Key(1, 1)));

    private final List<Key> keys;

    private PowerCurve(List<Key> keys) {
        List<Key> sorted = new ArrayList<>(keys);
        sorted.sort(Comparator.comparingDouble(Key::time));
        this.keys = Collections.unmodifiableList(sorted);
    }

    /** Identity curve from (0,0) to (1,1). */
    public static PowerCurve linear() {
        return LINEAR;
    }

    public static PowerCurve of(List<Key> keys) {
        if (keys == null || keys.isEmpty()) return LINEAR;
        return new PowerCurve(keys);
    }

    @Override
    public double applyAsDouble(double t) {
        Key first = keys.get(0);
        if (t <= first.time()) return first.value();
        for (int i = 1; i < keys.size(); i++) {
            Key prev = keys.get(i - 1);
            Key next = keys.get(i);
            if (t <= next.time()) {
                double span = next.time() - prev.time();
                if (span <= 0) return next.value();
                double f = (t - prev.time()) / span;
                return prev.value() + (next.value() - prev.value()) * f;
            }
        }
        return keys.get(keys.size() - 1).value();
    }

    public List<Key> getKeys() {
        return keys;
    }
}
