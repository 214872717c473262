package org.pokeai.runtime.policy;

import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.spi.DecisionContext;
import org.pokeai.runtime.spi.IActionSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Replays a fixed sequence of decisions, for tests and for replaying recorded battles. Once a
 * queue runs dry it answers {@code null} for turns (the engine then forces a default) and the
 * first legal switch for replacements.
 */
public class ScriptedActionSource implements IActionSource {

    private final Deque<BattleAction> actions;
    private final Deque<BattleAction> replacements;

    public ScriptedActionSource(List<BattleAction> actions) {
        this(actions, List.of());
    }

    public ScriptedActionSource(List<BattleAction> actions, List<BattleAction> replacements) {
        this.actions = new ArrayDeque<>(actions);
        this.replacements = new ArrayDeque<>(replacements);
    }

    public static ScriptedActionSource of(BattleAction... actions) {
        return new ScriptedActionSource(List.of(actions));
    }

    @Override
    public BattleAction chooseAction(DecisionContext context) {
        return actions.poll();
    }

    @Override
    public BattleAction chooseReplacement(DecisionContext context) {
        BattleAction next = replacements.poll();
        return next != null ? next : context.legalActions().get(0);
    }

    public int remaining() {
        return actions.size();
    }
}
