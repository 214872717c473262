package org.pokeai.runtime.rules;

public enum Terrain {
    NONE, ELECTRIC, GRASSY, MISTY, PSYCHIC;

    public static Terrain fromId(String raw) {
        String normalized = Ids.normalize(raw).replace("terrain", "");
        for (Terrain terrain : values()) {
            if (terrain.name().toLowerCase().equals(normalized)) {
                return terrain;
            }
        }
        throw new IllegalArgumentException("Unknown terrain: " + raw);
    }
}
