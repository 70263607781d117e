package com.example.elemental.effect;

import com.example.elemental.model.Element;
import com.example.elemental.model.StatAccessor;

/**
 * Bridge to an external status-effect system. The engine only decides which effects are
 * eligible; whether one takes hold is up to the implementation.
 */
@FunctionalInterface
public interface StatusEffectApplicator {

    /**
     * @return true if the status effect was applied to the target
     */
    boolean tryApply(String statusEffectId, Element element, StatAccessor target);
}
