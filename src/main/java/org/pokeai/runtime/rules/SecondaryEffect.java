package org.pokeai.runtime.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A chance-based side effect of a damaging move, rolled once per hit.
 *
 * @param chance       trigger chance in percent (1..100)
 * @param status       major status inflicted on the target, or {@code null}
 * @param volatileKind volatile inflicted on the target (flinch, confusion), or {@code null}
 * @param targetBoosts stage changes on the target
 * @param selfBoosts   stage changes on the user
 */
public record SecondaryEffect(int chance, StatusCondition status, VolatileKind volatileKind,
                              Map<Stat, Integer> targetBoosts, Map<Stat, Integer> selfBoosts) {

    public SecondaryEffect {
        if (chance < 1 || chance > 100) {
            throw new IllegalArgumentException("Secondary chance must be within 1..100, got " + chance);
        }
        targetBoosts = unmodifiable(targetBoosts);
        selfBoosts = unmodifiable(selfBoosts);
    }

    private static Map<Stat, Integer> unmodifiable(Map<Stat, Integer> boosts) {
        if (boosts == null || boosts.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(boosts));
    }
}
