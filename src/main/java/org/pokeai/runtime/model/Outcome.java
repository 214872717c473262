package org.pokeai.runtime.model;

public enum Outcome {
    HIT,
    MISS,
    STATUS_PREVENTED,
    SWITCHED,
    HEALED,
    FAINTED,
    APPLIED,
    FAILED,
    BLOCKED,
    IMMUNE,
    EXPIRED,
    DEFAULTED
}
