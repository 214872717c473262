package org.pokeai.runtime.rules;

/**
 * Major status conditions. A combatant holds at most one; {@link #NONE} is the empty state.
 */
public enum StatusCondition {
    NONE("none"),
    BURN("brn"),
    POISON("psn"),
    BADLY_POISONED("tox"),
    PARALYSIS("par"),
    SLEEP("slp"),
    FREEZE("frz");

    private final String id;

    StatusCondition(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isPoison() {
        return this == POISON || this == BADLY_POISONED;
    }

    public static StatusCondition fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (StatusCondition status : values()) {
            if (status.id.equals(normalized) || status.name().replace("_", "").toLowerCase().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + raw);
    }
}
