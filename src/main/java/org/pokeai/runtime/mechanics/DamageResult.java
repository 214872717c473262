package org.pokeai.runtime.mechanics;

/**
 * Output of one damage calculation.
 *
 * @param damage        HP to remove; at least 1 for a connecting damaging move unless the target is immune
 * @param criticalHit   whether the hit was critical
 * @param effectiveness type-effectiveness multiplier (0 for immune targets)
 */
public record DamageResult(int damage, boolean criticalHit, double effectiveness) {

    public static final DamageResult NO_DAMAGE = new DamageResult(0, false, 1.0);

    public static DamageResult immune() {
        return new DamageResult(0, false, 0.0);
    }

    public boolean isImmune() {
        return effectiveness == 0.0;
    }
}
