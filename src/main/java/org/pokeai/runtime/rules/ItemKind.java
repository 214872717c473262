package org.pokeai.runtime.rules;

public enum ItemKind {
    NONE,
    HEAVY_DUTY_BOOTS,
    LEFTOVERS,
    BLACK_SLUDGE,
    LIFE_ORB,
    FOCUS_SASH,
    CHOICE_BAND,
    CHOICE_SPECS,
    CHOICE_SCARF,
    ASSAULT_VEST,
    ROCKY_HELMET,
    LOADED_DICE,
    BOOSTER_ENERGY,
    QUICK_CLAW;

    public boolean isChoice() {
        return this == CHOICE_BAND || this == CHOICE_SPECS || this == CHOICE_SCARF;
    }

    public static ItemKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (ItemKind kind : values()) {
            if (kind.name().replace("_", "").toLowerCase().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown item kind: " + raw);
    }
}
