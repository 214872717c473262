package org.pokeai.runtime.rules;

/**
 * Immutable ability entry.
 *
 * @param type      type parameter (absorbed type, converted-to type), or {@code null}
 * @param weather   weather set on switch-in, or {@code null}
 * @param terrain   terrain set on switch-in, or {@code null}
 * @param status    status inflicted on contact, or {@code null}
 * @param breakable whether Mold Breaker and its variants ignore this ability
 */
public record AbilityData(String id, String name, AbilityKind kind, ElementType type, Weather weather,
                          Terrain terrain, StatusCondition status, boolean breakable) {

    public static final AbilityData NONE = new AbilityData("", "No Ability", AbilityKind.NONE,
            null, null, null, null, false);

    public static AbilityData of(String id, AbilityKind kind, boolean breakable) {
        return new AbilityData(id, id, kind, null, null, null, null, breakable);
    }

    public boolean is(AbilityKind candidate) {
        return kind == candidate;
    }
}
