package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.Stat;

import java.util.Map;

/**
 * Applies boost-stage changes, honouring Contrary and the Clear Body family.
 */
public class StatChanges {

    private final BattleContext ctx;

    public StatChanges(BattleContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Changes one stage of {@code target}.
     *
     * @param source the combatant causing the change; drops caused by an opponent can be blocked
     * @param kind   the log kind the change is reported under
     * @return the change actually applied, 0 if blocked or saturated
     */
    public int apply(Combatant target, Stat stat, int stages, Combatant source, ActionKind kind) {
        if (target.isFainted() || stages == 0) {
            return 0;
        }
        boolean fromOpponent = source != null && source.side() != target.side();
        int delta = stages;
        if (target.hasAbility(AbilityKind.CONTRARY) && !(fromOpponent && AbilityEffects.ignoresAbility(source, target))) {
            delta = -delta;
        }
        if (delta < 0 && fromOpponent && AbilityEffects.defenderHas(target, AbilityKind.STAT_DROP_IMMUNITY, source)) {
            ctx.log().add(target.side(), ActionKind.ABILITY_TRIGGER, target.name(), target.name(),
                    target.ability().id() + ":" + stat.id(), Outcome.BLOCKED);
            return 0;
        }
        int applied = target.changeBoost(stat, delta);
        ctx.log().add(target.side(), kind, source == null ? null : source.name(), target.name(),
                "boost:" + stat.id() + ":" + applied, applied == 0 ? Outcome.FAILED : Outcome.APPLIED);
        return applied;
    }

    /**
     * Applies several stage changes in stat order.
     *
     * @return whether any stage actually changed
     */
    public boolean applyAll(Combatant target, Map<Stat, Integer> changes, Combatant source, ActionKind kind) {
        boolean changed = false;
        for (Map.Entry<Stat, Integer> change : changes.entrySet()) {
            changed |= apply(target, change.getKey(), change.getValue(), source, kind) != 0;
        }
        return changed;
    }
}
