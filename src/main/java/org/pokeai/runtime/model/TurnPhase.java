package org.pokeai.runtime.model;

/**
 * States of one turn, in order. A turn ends in {@link #CONTINUE} or {@link #BATTLE_OVER}.
 */
public enum TurnPhase {
    AWAITING_ACTIONS,
    ORDER_DETERMINED,
    EXECUTING_FIRST,
    EXECUTING_SECOND,
    END_OF_TURN,
    CONTINUE,
    BATTLE_OVER
}
