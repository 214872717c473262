package org.pokeai.runtime.spi;

import org.pokeai.runtime.model.BattleAction;

/**
 * Supplies decisions for one side. Implementations may be random policies, scripted
 * sequences or adapters to an external policy service; the engine depends on none of them.
 * <p>
 * Returning {@code null} or an action outside {@link DecisionContext#legalActions()} is not an
 * error: the engine substitutes a forced default and records it in the log.
 * </p>
 */
public interface IActionSource {

    /**
     * Chooses the action for the coming turn.
     *
     * @param context the decision context
     * @return the chosen action
     */
    BattleAction chooseAction(DecisionContext context);

    /**
     * Chooses a replacement after the active combatant fainted. The context holds switch actions only.
     * The default picks the first living bench member.
     *
     * @param context the decision context
     * @return a switch action
     */
    default BattleAction chooseReplacement(DecisionContext context) {
        return context.legalActions().get(0);
    }
}
