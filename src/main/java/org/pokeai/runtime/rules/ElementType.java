package org.pokeai.runtime.rules;

/**
 * Elemental types. {@link #TYPELESS} is used by Struggle and confusion self-hits and is
 * neutral against everything.
 */
public enum ElementType {
    NORMAL, FIRE, WATER, ELECTRIC, GRASS, ICE, FIGHTING, POISON, GROUND,
    FLYING, PSYCHIC, BUG, ROCK, GHOST, DRAGON, DARK, STEEL, FAIRY, TYPELESS;

    /**
     * Resolves a type from its normalized identifier.
     *
     * @param id the identifier, e.g. "fire"
     * @return the type
     * @throws IllegalArgumentException if the identifier names no type
     */
    public static ElementType fromId(String id) {
        String normalized = Ids.normalize(id);
        for (ElementType type : values()) {
            if (type.name().toLowerCase().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown type: " + id);
    }

    public String id() {
        return name().toLowerCase();
    }
}
