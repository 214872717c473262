package org.pokeai.runtime.rules;

public enum HazardKind {
    STEALTH_ROCK(1),
    SPIKES(3),
    TOXIC_SPIKES(2),
    STICKY_WEB(1);

    private final int maxLayers;

    HazardKind(int maxLayers) {
        this.maxLayers = maxLayers;
    }

    public int maxLayers() {
        return maxLayers;
    }

    public static HazardKind fromId(String raw) {
        String normalized = Ids.normalize(raw);
        for (HazardKind kind : values()) {
            if (kind.name().replace("_", "").toLowerCase().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown hazard: " + raw);
    }
}
