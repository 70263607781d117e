package com.example.elemental.model;

/**
 * Elemental tags carried by attacks, resistances and affinity lookups.
 * NONE stands for bare physical damage.
 */
public enum Element {
    NONE("None"),
    FIRE("Fire"),
    WATER("Water"),
    WIND("Wind"),
    EARTH("Earth"),
    LIGHT("Light"),
    DARK("Dark"),
    LIGHTNING("Lightning"),
    ICE("Ice"),
    POISON("Poison"),
    HOLY("Holy"),
    VOID("Void");

    private final String displayName;

    Element(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable name for this element.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse an element from a string (case-insensitive, enum name or display name).
     * Returns null if the string names no element.
     */
    public static Element fromString(String s) {
        if (s == null || s.isEmpty()) return null;
        String upper = s.toUpperCase().trim();
        for (Element e : values()) {
            if (e.name().equals(upper)) return e;
        }
        for (Element e : values()) {
            if (e.displayName.equalsIgnoreCase(s.trim())) return e;
        }
        return null;
    }
}
