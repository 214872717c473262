package org.pokeai.runtime.spi;

import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.rules.FormatRules;

import java.util.List;

/**
 * What an action source sees when asked for a decision. The state is the live battle state
 * and must be treated as read-only.
 *
 * @param side         the deciding side
 * @param state        the battle state
 * @param legalActions every action the engine would accept, never empty
 * @param format       the active format rules
 */
public record DecisionContext(Side side, BattleState state, List<BattleAction> legalActions, FormatRules format) {

    public DecisionContext {
        legalActions = List.copyOf(legalActions);
    }

    public List<BattleAction> legalSwitches() {
        return legalActions.stream().filter(BattleAction::isSwitch).toList();
    }

    public List<BattleAction> legalAttacks() {
        return legalActions.stream().filter(BattleAction::isAttack).toList();
    }
}
