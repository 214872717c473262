package org.pokeai.runtime.rules;

public enum MoveCategory {
    PHYSICAL, SPECIAL, STATUS;

    public static MoveCategory fromId(String id) {
        return valueOf(Ids.normalize(id).toUpperCase());
    }
}
