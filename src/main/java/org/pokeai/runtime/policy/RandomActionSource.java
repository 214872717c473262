package org.pokeai.runtime.policy;

import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.spi.DecisionContext;
import org.pokeai.runtime.spi.IActionSource;
import org.pokeai.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * Self-play baseline: attacks with probability 0.7 and switches otherwise, choosing uniformly
 * within the chosen group. Falls back to the other group when one is empty.
 */
public class RandomActionSource implements IActionSource {

    public static final double ATTACK_PROBABILITY = 0.7;

    private final IRandomProvider random;

    public RandomActionSource(IRandomProvider random) {
        this.random = random;
    }

    @Override
    public BattleAction chooseAction(DecisionContext context) {
        List<BattleAction> attacks = context.legalAttacks();
        List<BattleAction> switches = context.legalSwitches();
        if (switches.isEmpty() || (!attacks.isEmpty() && random.nextDouble() < ATTACK_PROBABILITY)) {
            return pick(attacks.isEmpty() ? switches : attacks);
        }
        return pick(switches);
    }

    @Override
    public BattleAction chooseReplacement(DecisionContext context) {
        return pick(context.legalActions());
    }

    private BattleAction pick(List<BattleAction> actions) {
        return actions.get(random.nextInt(actions.size()));
    }
}
