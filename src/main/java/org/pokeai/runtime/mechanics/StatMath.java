package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatBlock;
import org.pokeai.runtime.rules.StatusCondition;

/**
 * Stat arithmetic shared by every engine component.
 */
public final class StatMath {

    public static final int PERFECT_IV = 31;

    private StatMath() {
        throw new AssertionError("Utility class");
    }

    /**
     * Multiplier of a boost stage: {@code (2+s)/2} for {@code s >= 0}, {@code 2/(2+|s|)} otherwise.
     * The same table is used for accuracy and evasion stages.
     */
    public static double boostMultiplier(int stage) {
        if (stage >= 0) {
            return (2.0 + stage) / 2.0;
        }
        return 2.0 / (2.0 + Math.abs(stage));
    }

    /**
     * Derives the six battle stats from base stats with perfect IVs and the given EVs.
     */
    public static StatBlock deriveStats(StatBlock base, int level, StatBlock evs) {
        int hp = (2 * base.hp() + PERFECT_IV + evs.hp() / 4) * level / 100 + level + 10;
        return new StatBlock(hp,
                otherStat(base.attack(), evs.attack(), level),
                otherStat(base.defense(), evs.defense(), level),
                otherStat(base.specialAttack(), evs.specialAttack(), level),
                otherStat(base.specialDefense(), evs.specialDefense(), level),
                otherStat(base.speed(), evs.speed(), level));
    }

    private static int otherStat(int base, int ev, int level) {
        return (2 * base + PERFECT_IV + ev / 4) * level / 100 + 5;
    }

    /**
     * A fraction of max HP, floored, but at least 1.
     */
    public static int fractionOf(int maxHp, double fraction) {
        return Math.max(1, (int) Math.floor(maxHp * fraction));
    }

    /**
     * Speed used for turn order: stat x boost x paralysis 0.25 x tailwind 2.0 x Choice Scarf 1.5
     * x Protosynthesis/Quark Drive 1.5. Trick Room is applied by the caller.
     */
    public static double effectiveSpeed(Combatant combatant, BattleState state) {
        SideState side = state.sideOf(combatant);
        double speed = combatant.stat(Stat.SPEED) * boostMultiplier(combatant.boost(Stat.SPEED));
        if (combatant.hasStatus(StatusCondition.PARALYSIS)) {
            speed *= 0.25;
        }
        if (side.hasTailwind()) {
            speed *= 2.0;
        }
        if (ItemEffects.activeItem(combatant, state.field()) == ItemKind.CHOICE_SCARF) {
            speed *= 1.5;
        }
        if (combatant.paradoxStat() == Stat.SPEED) {
            speed *= 1.5;
        }
        return speed;
    }

    /**
     * The highest raw stat other than HP; ties resolve in Attack, Defense, Sp. Atk, Sp. Def, Speed order.
     */
    public static Stat highestStat(Combatant combatant) {
        Stat best = Stat.ATTACK;
        for (Stat stat : new Stat[]{Stat.DEFENSE, Stat.SPECIAL_ATTACK, Stat.SPECIAL_DEFENSE, Stat.SPEED}) {
            if (combatant.stat(stat) > combatant.stat(best)) {
                best = stat;
            }
        }
        return best;
    }
}
