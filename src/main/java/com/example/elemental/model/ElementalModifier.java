package com.example.elemental.model;

/**
 * A permanent or time-bounded elemental rule change attributed to a source
 * (equipment, buff, skill, environment). The source id is the bulk-revocation key.
 *
 * Remaining duration is counted down by the ledger the modifier is applied to. Stack
 * count and refreshed duration change only through copies, so the ledger can tear the
 * old values down and dispatch the new ones.
 */
public class ElementalModifier {

    private final String id;
    private final ModifierEffect effect;
    private String sourceId;
    private String displayName;
    private boolean permanent;
    private double remainingDuration;
    private double originalDuration;
    private boolean allowStacking;
    private int maxStacks = 1;
    private int currentStacks = 1;

    public ElementalModifier(String id, ModifierEffect effect) {
        this.id = id;
        this.effect = effect;
        this.displayName = id;
    }

    public ElementalModifier source(String sourceId) {
        this.sourceId = sourceId;
        return this;
    }

    public ElementalModifier displayName(String name) {
        this.displayName = name;
        return this;
    }

    public ElementalModifier permanent() {
        this.permanent = true;
        return this;
    }

    /**
     * Make the modifier time-bounded. A negative duration makes it permanent.
     */
    public ElementalModifier duration(double seconds) {
        if (seconds < 0) {
            this.permanent = true;
            this.remainingDuration = seconds;
            this.originalDuration = seconds;
        } else {
            this.permanent = false;
            this.remainingDuration = seconds;
            this.originalDuration = seconds;
        }
        return this;
    }

    public ElementalModifier stacking(boolean allow, int maxStacks) {
        this.allowStacking = allow;
        this.maxStacks = Math.max(1, maxStacks);
        return this;
    }

    /**
     * Copy with a new id, same effect, source and timing. Stack count starts at 1.
     */
    public ElementalModifier copyWithId(String newId) {
        ElementalModifier m = new ElementalModifier(newId, effect);
        m.sourceId = sourceId;
        m.displayName = displayName;
        m.permanent = permanent;
        m.remainingDuration = remainingDuration;
        m.originalDuration = originalDuration;
        m.allowStacking = allowStacking;
        m.maxStacks = maxStacks;
        return m;
    }

    /** Copy carrying the given stack count, clamped to [1, maxStacks]. */
    public ElementalModifier withStacks(int stacks) {
        ElementalModifier m = copyWithId(id);
        m.currentStacks = Math.max(1, Math.min(stacks, maxStacks));
        return m;
    }

    /** Copy with the remaining duration reset to the original one. */
    public ElementalModifier refreshed() {
        ElementalModifier m = copyWithId(id);
        m.currentStacks = currentStacks;
        m.remainingDuration = originalDuration;
        return m;
    }

    public boolean isExpired() {
        return !permanent && remainingDuration <= 0;
    }

    public double getDurationPercentage() {
        if (permanent) return 1.0;
        return originalDuration > 0 ? remainingDuration / originalDuration : 0.0;
    }

    /**
     * Decrement remaining duration. Permanent modifiers are unaffected.
     * @return true if the modifier has run out
     */
    public boolean tick(double deltaSeconds) {
        if (permanent) return false;
        remainingDuration -= deltaSeconds;
        return remainingDuration <= 0;
    }

    public String getId() { return id; }
    public ModifierEffect getEffect() { return effect; }
    public ModifierKind getKind() { return effect.kind(); }
    public String getSourceId() { return sourceId; }
    public String getDisplayName() { return displayName; }
    public boolean isPermanent() { return permanent; }
    public double getRemainingDuration() { return remainingDuration; }
    public double getOriginalDuration() { return originalDuration; }
    public boolean isStackingAllowed() { return allowStacking; }
    public int getMaxStacks() { return maxStacks; }
    public int getCurrentStacks() { return currentStacks; }

    @Override
    public String toString() {
        return String.format("ElementalModifier[%s %s source=%s %s stacks=%d]",
            id, getKind(), sourceId,
            permanent ? "permanent" : String.format("%.1fs", remainingDuration), currentStacks);
    }
}
