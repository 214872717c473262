package org.pokeai.runtime.model;

public enum Side {
    A, B;

    public Side opposite() {
        return this == A ? B : A;
    }
}
