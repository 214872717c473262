package org.pokeai.runtime.rules;

/**
 * Timed conditions set by moves. Rooms and gravity are global; tailwind belongs to the user's side.
 */
public enum FieldCondition {
    TRICK_ROOM(true),
    GRAVITY(true),
    WONDER_ROOM(true),
    MAGIC_ROOM(true),
    TAILWIND(false);

    private final boolean global;

    FieldCondition(boolean global) {
        this.global = global;
    }

    public boolean isGlobal() {
        return global;
    }

    public static FieldCondition fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (FieldCondition condition : values()) {
            if (condition.name().replace("_", "").toLowerCase().equals(normalized)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown field condition: " + raw);
    }
}
