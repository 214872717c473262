package org.pokeai.runtime;

/**
 * Signals a broken engine invariant: HP outside its bounds, a boost stage outside [-6, 6],
 * a second major status, or an inconsistent roster. These indicate an engine or rule-table bug
 * and are never recovered from.
 */
public class BattleInvariantViolation extends IllegalStateException {

    public BattleInvariantViolation(String message) {
        super(message);
    }
}
