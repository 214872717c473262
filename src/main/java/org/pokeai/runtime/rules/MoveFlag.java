package org.pokeai.runtime.rules;

public enum MoveFlag {
    CONTACT,
    SOUND,
    POWDER,
    /** Hits regardless of accuracy while it rains (Thunder, Hurricane). */
    PERFECT_IN_RAIN,
    /** Hits regardless of accuracy in hail or snow (Blizzard). */
    PERFECT_IN_HAIL,
    /** Halved by Grassy Terrain against grounded targets (Earthquake, Bulldoze, Magnitude). */
    GRASSY_HALVED,
    /** Fails unless the target is about to use a damaging move (Sucker Punch). */
    REQUIRES_TARGET_ATTACK;

    public static MoveFlag fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (MoveFlag flag : values()) {
            if (flag.name().replace("_", "").toLowerCase().equals(normalized)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unknown move flag: " + raw);
    }
}
