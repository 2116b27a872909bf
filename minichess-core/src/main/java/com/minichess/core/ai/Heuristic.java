package com.minichess.core.ai;

/**
 * Selectable evaluation functions, in order of increasing sophistication.
 */
public enum Heuristic {
    /** Material balance. */
    E0("e0"),
    /** Material plus piece-square bonuses. */
    E1("e1"),
    /** Material, piece-square bonuses and threat safety. */
    E2("e2");

    private final String id;

    Heuristic(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a heuristic by its id ({@code e0}, {@code e1} or {@code e2}), ignoring case.
     *
     * @throws SearchConfigurationException if the id is unknown
     */
    public static Heuristic fromId(String id) {
        if (id != null) {
            String normalized = id.trim();
            for (Heuristic heuristic : values()) {
                if (heuristic.id.equalsIgnoreCase(normalized)) {
                    return heuristic;
                }
            }
        }
        throw new SearchConfigurationException("Unknown heuristic: " + id + " (expected e0, e1 or e2)");
    }

    @Override
    public String toString() {
        return id;
    }
}
