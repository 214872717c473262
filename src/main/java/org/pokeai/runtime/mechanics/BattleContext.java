package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.BattleLog;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.rules.RuleTables;
import org.pokeai.runtime.spi.IRandomProvider;

/**
 * Handle bundling what every component of one battle needs: the read-only rule tables and
 * format, the owned battle state and the battle's random stream.
 */
public final class BattleContext {

    private final RuleTables rules;
    private final FormatRules format;
    private final BattleState state;
    private final IRandomProvider random;

    public BattleContext(RuleTables rules, FormatRules format, BattleState state, IRandomProvider random) {
        this.rules = rules;
        this.format = format;
        this.state = state;
        this.random = random;
    }

    public RuleTables rules() {
        return rules;
    }

    public FormatRules format() {
        return format;
    }

    public BattleState state() {
        return state;
    }

    public FieldState field() {
        return state.field();
    }

    public BattleLog log() {
        return state.log();
    }

    public IRandomProvider random() {
        return random;
    }

    /**
     * Applies damage that does not come from a direct attack. Blocked entirely by Magic Guard.
     *
     * @return the HP actually lost
     */
    public int indirectDamage(Combatant target, int amount, ActionKind kind, String detail) {
        if (target.isFainted() || amount <= 0) {
            return 0;
        }
        if (target.hasAbility(AbilityKind.MAGIC_GUARD)) {
            log().add(target.side(), ActionKind.ABILITY_TRIGGER, target.name(), target.name(),
                    "magicguard:" + detail, Outcome.BLOCKED);
            return 0;
        }
        int dealt = target.takeDamage(amount);
        log().addAmount(target.side(), kind, target.name(), target.name(), detail, Outcome.HIT, dealt);
        reportFaint(target);
        return dealt;
    }

    /**
     * Restores HP and logs the amount if anything was restored.
     */
    public int restore(Combatant target, int amount, ActionKind kind, String detail) {
        int restored = target.heal(amount);
        if (restored > 0) {
            log().addAmount(target.side(), kind, target.name(), target.name(), detail, Outcome.HEALED, restored);
        }
        return restored;
    }

    /**
     * Logs a faint the first time a combatant is seen at zero HP.
     *
     * @return whether the combatant is fainted
     */
    public boolean reportFaint(Combatant combatant) {
        if (combatant.isFainted() && !combatant.isFaintReported()) {
            combatant.markFaintReported();
            log().add(combatant.side(), ActionKind.STATUS_TICK, combatant.name(), combatant.name(), "faint", Outcome.FAINTED);
        }
        return combatant.isFainted();
    }
}
