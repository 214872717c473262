package org.pokeai.runtime.model;

import org.pokeai.runtime.BattleInvariantViolation;
import org.pokeai.runtime.rules.MoveData;

/**
 * A move known by a combatant together with its remaining PP.
 */
public final class MoveSlot {

    private final MoveData move;
    private final int maxPp;
    private int remainingPp;

    public MoveSlot(MoveData move) {
        this.move = move;
        this.maxPp = Math.max(1, move.pp());
        this.remainingPp = this.maxPp;
    }

    public MoveData move() {
        return move;
    }

    public String moveId() {
        return move.id();
    }

    public int maxPp() {
        return maxPp;
    }

    public int remainingPp() {
        return remainingPp;
    }

    public boolean hasPp() {
        return remainingPp > 0;
    }

    /**
     * Spends one PP.
     *
     * @throws BattleInvariantViolation if no PP is left
     */
    public void spend() {
        if (remainingPp <= 0) {
            throw new BattleInvariantViolation("No PP left for " + move.id());
        }
        remainingPp--;
    }
}
