package org.pokeai.runtime.model;

import java.util.List;

/**
 * Terminal outcome of one battle.
 *
 * @param winner    winning side, or {@link Winner#TIE} when the turn cap was reached or both sides fell together
 * @param turnCount number of turns played
 * @param log       every event in order
 */
public record BattleResult(Winner winner, int turnCount, List<LogEntry> log) {

    public BattleResult {
        log = List.copyOf(log);
    }
}
