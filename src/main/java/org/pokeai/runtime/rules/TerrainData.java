package org.pokeai.runtime.rules;

/**
 * Numeric parameters of one terrain.
 *
 * @param boostedType  type whose moves are boosted for grounded users, or {@code null}
 * @param boost        multiplier for the boosted type
 * @param healFraction end-of-turn heal for grounded combatants
 * @param duration     turns the terrain lasts
 */
public record TerrainData(Terrain terrain, ElementType boostedType, double boost, double healFraction, int duration) {

    public static TerrainData inert(Terrain terrain) {
        return new TerrainData(terrain, null, 1.0, 0.0, 5);
    }
}
