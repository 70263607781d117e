package com.example.elemental.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of the random rolls used for critical hits and damage variance.
 */
@FunctionalInterface
public interface RandomSource {

    /** Uniform value in [0, 1). */
    double nextDouble();

    /** Uniform value in [min, max). */
    default double nextDouble(double min, double max) {
        return min + (max - min) * nextDouble();
    }

    static RandomSource threadLocal() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /** Always returns the given value. */
    static RandomSource fixed(double value) {
        return () -> value;
    }
}
