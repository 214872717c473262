package org.pokeai.runtime.rules;

/**
 * Battle stats. {@link #ACCURACY} and {@link #EVASION} exist only as boost stages.
 */
public enum Stat {
    HP("hp"),
    ATTACK("atk"),
    DEFENSE("def"),
    SPECIAL_ATTACK("spa"),
    SPECIAL_DEFENSE("spd"),
    SPEED("spe"),
    ACCURACY("accuracy"),
    EVASION("evasion");

    private final String id;

    Stat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isBoostable() {
        return this != HP;
    }

    public static Stat fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (Stat stat : values()) {
            if (stat.id.equals(normalized)) {
                return stat;
            }
        }
        throw new IllegalArgumentException("Unknown stat: " + raw);
    }
}
