package org.pokeai.runtime.rules;

public enum HazardClearKind {
    DEFOG, RAPID_SPIN, COURT_CHANGE;

    public static HazardClearKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (HazardClearKind kind : values()) {
            if (kind.name().replace("_", "").toLowerCase().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown hazard clearing kind: " + raw);
    }
}
