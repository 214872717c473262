package org.pokeai.runtime.rules;

public enum Weather {
    NONE, SUN, RAIN, SAND, HAIL, SNOW;

    public boolean isHailLike() {
        return this == HAIL || this == SNOW;
    }

    public static Weather fromId(String raw) {
        String normalized = Ids.normalize(raw);
        return switch (normalized) {
            case "sun", "sunnyday", "harshsunlight" -> SUN;
            case "rain", "raindance" -> RAIN;
            case "sand", "sandstorm" -> SAND;
            case "hail" -> HAIL;
            case "snow", "snowscape" -> SNOW;
            case "none", "" -> NONE;
            default -> throw new IllegalArgumentException("Unknown weather: " + raw);
        };
    }
}
