package org.pokeai.runtime.rules;

/**
 * Volatile conditions. All of them are cleared when the holder leaves the field.
 */
public enum VolatileKind {
    CONFUSION,
    FLINCH,
    TAUNT,
    ENCORE,
    DISABLE,
    TORMENT,
    IMPRISON,
    SUBSTITUTE,
    PARTIAL_TRAP,
    LEECH_SEED,
    PERISH_SONG,
    PROTECT;

    public String id() {
        return name().replace("_", "").toLowerCase();
    }

    public static VolatileKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (VolatileKind kind : values()) {
            if (kind.id().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown volatile condition: " + raw);
    }
}
