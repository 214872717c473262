package org.pokeai.runtime.model;

/**
 * Counters of one active volatile condition.
 * {@code turns} counts down to expiry (or up for conditions with a hard cap, such as confusion),
 * {@code counter} holds a condition-specific value (substitute HP, perish count),
 * {@code moveId} names the encored or disabled move.
 */
public final class VolatileState {

    private int turns;
    private int counter;
    private final String moveId;
    private final Side source;

    public VolatileState(int turns, int counter, String moveId, Side source) {
        this.turns = turns;
        this.counter = counter;
        this.moveId = moveId;
        this.source = source;
    }

    public static VolatileState ofTurns(int turns) {
        return new VolatileState(turns, 0, null, null);
    }

    public int turns() {
        return turns;
    }

    public void setTurns(int turns) {
        this.turns = turns;
    }

    public int counter() {
        return counter;
    }

    public void setCounter(int counter) {
        this.counter = counter;
    }

    public String moveId() {
        return moveId;
    }

    public Side source() {
        return source;
    }
}
