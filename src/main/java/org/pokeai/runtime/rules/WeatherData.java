package org.pokeai.runtime.rules;

import java.util.EnumSet;
import java.util.Set;

/**
 * Numeric parameters of one weather.
 *
 * @param boostedType      type whose moves deal x1.5, or {@code null}
 * @param weakenedType     type whose moves deal x0.5, or {@code null}
 * @param chipFraction     end-of-turn damage as a fraction of max HP
 * @param immuneTypes      types that take no chip damage
 * @param defenseBoostType type whose defense stat is raised x1.5, or {@code null}
 * @param defenseBoostStat the raised stat (DEFENSE or SPECIAL_DEFENSE), or {@code null}
 * @param duration         turns the weather lasts when set by a move
 */
public record WeatherData(Weather weather, ElementType boostedType, ElementType weakenedType, double chipFraction,
                          Set<ElementType> immuneTypes, ElementType defenseBoostType, Stat defenseBoostStat,
                          int duration) {

    public WeatherData {
        immuneTypes = immuneTypes == null || immuneTypes.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(immuneTypes));
    }

    /**
     * Parameters of a weather with no effects at all, used for {@link Weather#NONE}.
     */
    public static WeatherData inert(Weather weather) {
        return new WeatherData(weather, null, null, 0.0, Set.of(), null, null, 5);
    }
}
