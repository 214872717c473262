package org.pokeai.runtime.rules;

public enum ScreenKind {
    REFLECT, LIGHT_SCREEN, AURORA_VEIL;

    /**
     * @return whether this screen reduces damage of the given category
     */
    public boolean covers(MoveCategory category) {
        return switch (this) {
            case REFLECT -> category == MoveCategory.PHYSICAL;
            case LIGHT_SCREEN -> category == MoveCategory.SPECIAL;
            case AURORA_VEIL -> category != MoveCategory.STATUS;
        };
    }

    public static ScreenKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (ScreenKind kind : values()) {
            if (kind.name().replace("_", "").toLowerCase().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown screen: " + raw);
    }
}
