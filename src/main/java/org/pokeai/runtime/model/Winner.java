package org.pokeai.runtime.model;

public enum Winner {
    SIDE_A, SIDE_B, TIE;

    public static Winner of(Side side) {
        return side == Side.A ? SIDE_A : SIDE_B;
    }
}
