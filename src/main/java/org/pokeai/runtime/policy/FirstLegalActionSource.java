package org.pokeai.runtime.policy;

import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.spi.DecisionContext;
import org.pokeai.runtime.spi.IActionSource;

/**
 * Always takes the first legal action: the first usable move, or Struggle.
 */
public class FirstLegalActionSource implements IActionSource {

    @Override
    public BattleAction chooseAction(DecisionContext context) {
        return context.legalActions().get(0);
    }
}
