package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.MoveData;
import org.pokeai.runtime.rules.MoveFlag;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.Weather;
import org.pokeai.runtime.spi.IRandomProvider;

/**
 * Decides whether a move connects.
 */
public class AccuracyResolver {

    static final double PARALYSIS_PENALTY = 0.8;
    static final double GRAVITY_BONUS = 5.0 / 3.0;

    /**
     * Resolves the accuracy check of {@code move}.
     * <p>
     * Always-hit moves skip the draw. Weather-perfect moves (Thunder and Hurricane in rain,
     * Blizzard in hail or snow) draw but cannot miss. Otherwise the base accuracy is scaled by
     * the attacker's accuracy stage, the inverse of the defender's evasion stage, Misty Terrain
     * (x0.5 for Dragon moves on grounded targets), paralysis (x0.8) and Gravity (x5/3), then
     * clamped to [1, 100]. The move hits when the draw is below accuracy/100.
     * </p>
     */
    public AccuracyResult resolve(MoveData move, Combatant attacker, Combatant defender, FieldState field,
                                  IRandomProvider rng) {
        if (move.alwaysHits()) {
            return AccuracyResult.alwaysHits();
        }
        Weather weather = field.weather();
        boolean forced = (move.hasFlag(MoveFlag.PERFECT_IN_RAIN) && weather == Weather.RAIN)
                || (move.hasFlag(MoveFlag.PERFECT_IN_HAIL) && weather.isHailLike());

        double accuracy;
        if (forced) {
            accuracy = 100.0;
        } else {
            accuracy = move.accuracy()
                    * StatMath.boostMultiplier(attacker.boost(Stat.ACCURACY))
                    * StatMath.boostMultiplier(-defender.boost(Stat.EVASION));
            if (field.terrain() == Terrain.MISTY && move.type() == ElementType.DRAGON
                    && FieldEffectsEngine.isGrounded(defender, field)) {
                accuracy *= 0.5;
            }
            if (attacker.hasStatus(StatusCondition.PARALYSIS)) {
                accuracy *= PARALYSIS_PENALTY;
            }
            if (field.isActive(FieldCondition.GRAVITY)) {
                accuracy *= GRAVITY_BONUS;
            }
            accuracy = Math.max(1.0, Math.min(100.0, accuracy));
        }
        double roll = rng.nextDouble();
        return new AccuracyResult(roll < accuracy / 100.0, roll, accuracy);
    }
}
