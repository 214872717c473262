package org.pokeai.runtime.rules;

/**
 * Moves whose damage ignores the damage formula.
 */
public enum FixedDamageKind {
    /** Damage equal to the user's level (Seismic Toss, Night Shade). */
    LEVEL,
    /** Half of the target's current HP (Super Fang). */
    HALF_CURRENT_HP,
    /** Target's HP down to the user's HP (Endeavor). */
    ENDEAVOR,
    /** Twice the physical damage taken this turn (Counter). */
    COUNTER,
    /** Twice the special damage taken this turn (Mirror Coat). */
    MIRROR_COAT;

    public static FixedDamageKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (FixedDamageKind kind : values()) {
            if (kind.name().replace("_", "").toLowerCase().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown fixed damage kind: " + raw);
    }
}
