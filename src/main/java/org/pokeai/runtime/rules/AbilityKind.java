package org.pokeai.runtime.rules;

/**
 * Effect families of abilities. Parameters (a type, a weather, a status) live on {@link AbilityData}.
 */
public enum AbilityKind {
    NONE,
    INTIMIDATE,
    /** Clear Body, White Smoke, Full Metal Body: opponents cannot lower stats. */
    STAT_DROP_IMMUNITY,
    CONTRARY,
    UNAWARE,
    /** Mold Breaker, Teravolt, Turboblaze. */
    MOLD_BREAKER,
    MAGIC_GUARD,
    MAGIC_BOUNCE,
    REGENERATOR,
    GOOD_AS_GOLD,
    /** Volt Absorb, Water Absorb: immune to the type, heals a quarter. */
    ABSORB_HEAL,
    FLASH_FIRE,
    /** Storm Drain, Lightning Rod: immune to the type, +1 Special Attack. */
    ABSORB_BOOST,
    LEVITATE,
    TECHNICIAN,
    SHEER_FORCE,
    /** Pixilate, Aerilate, Galvanize, Refrigerate. */
    TYPE_CHANGE_BOOST,
    INFILTRATOR,
    PRANKSTER,
    GALE_WINGS,
    /** Rough Skin, Iron Barbs. */
    CONTACT_DAMAGE,
    /** Static, Flame Body, Poison Point. */
    CONTACT_STATUS,
    WEATHER_SETTER,
    TERRAIN_SETTER,
    PROTOSYNTHESIS,
    QUARK_DRIVE;

    public static AbilityKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (AbilityKind kind : values()) {
            if (kind.name().replace("_", "").toLowerCase().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ability kind: " + raw);
    }
}
