package org.pokeai.runtime.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The primary effect of a move, applied after damage (or instead of it for status moves).
 * Absent parts are {@code null} or empty. {@link #NONE} is the effect of a plain attack and
 * the substitute for malformed effect data.
 *
 * @param status        major status inflicted on the target
 * @param volatileKind  volatile condition applied (to the target, or to the user for protect/substitute/imprison)
 * @param hazard        hazard placed on the opposing side
 * @param screen        screen raised on the user's side
 * @param fieldCondition room, gravity or tailwind started by the move
 * @param weather       weather set for five turns
 * @param terrain       terrain set for five turns
 * @param healFraction  fraction of max HP restored to the user
 * @param weatherScaledHeal whether the heal depends on the weather (Moonlight family)
 * @param selfBoosts    stage changes applied to the user
 * @param targetBoosts  stage changes applied to the target
 * @param fixedDamage   fixed-damage rule replacing the formula
 * @param recoilFraction fraction of dealt damage taken as recoil
 * @param drainFraction fraction of dealt damage restored to the user
 * @param hazardClear   hazard removal performed by the move
 */
public record MoveEffect(
        StatusCondition status,
        VolatileKind volatileKind,
        HazardKind hazard,
        ScreenKind screen,
        FieldCondition fieldCondition,
        Weather weather,
        Terrain terrain,
        double healFraction,
        boolean weatherScaledHeal,
        Map<Stat, Integer> selfBoosts,
        Map<Stat, Integer> targetBoosts,
        FixedDamageKind fixedDamage,
        double recoilFraction,
        double drainFraction,
        HazardClearKind hazardClear) {

    public static final MoveEffect NONE = builder().build();

    public MoveEffect {
        selfBoosts = copyOf(selfBoosts);
        targetBoosts = copyOf(targetBoosts);
    }

    private static Map<Stat, Integer> copyOf(Map<Stat, Integer> boosts) {
        if (boosts == null || boosts.isEmpty()) {
            return Map.of();
        }
        EnumMap<Stat, Integer> copy = new EnumMap<>(Stat.class);
        copy.putAll(boosts);
        return Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return this.equals(NONE);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder used by the table loader and by tests.
     */
    public static final class Builder {
        private StatusCondition status;
        private VolatileKind volatileKind;
        private HazardKind hazard;
        private ScreenKind screen;
        private FieldCondition fieldCondition;
        private Weather weather;
        private Terrain terrain;
        private double healFraction;
        private boolean weatherScaledHeal;
        private final Map<Stat, Integer> selfBoosts = new EnumMap<>(Stat.class);
        private final Map<Stat, Integer> targetBoosts = new EnumMap<>(Stat.class);
        private FixedDamageKind fixedDamage;
        private double recoilFraction;
        private double drainFraction;
        private HazardClearKind hazardClear;

        private Builder() {
        }

        public Builder status(StatusCondition value) { this.status = value; return this; }
        public Builder volatileKind(VolatileKind value) { this.volatileKind = value; return this; }
        public Builder hazard(HazardKind value) { this.hazard = value; return this; }
        public Builder screen(ScreenKind value) { this.screen = value; return this; }
        public Builder fieldCondition(FieldCondition value) { this.fieldCondition = value; return this; }
        public Builder weather(Weather value) { this.weather = value; return this; }
        public Builder terrain(Terrain value) { this.terrain = value; return this; }
        public Builder heal(double fraction) { this.healFraction = fraction; return this; }
        public Builder weatherScaledHeal(boolean value) { this.weatherScaledHeal = value; return this; }
        public Builder selfBoost(Stat stat, int stages) { this.selfBoosts.put(stat, stages); return this; }
        public Builder targetBoost(Stat stat, int stages) { this.targetBoosts.put(stat, stages); return this; }
        public Builder fixedDamage(FixedDamageKind value) { this.fixedDamage = value; return this; }
        public Builder recoil(double fraction) { this.recoilFraction = fraction; return this; }
        public Builder drain(double fraction) { this.drainFraction = fraction; return this; }
        public Builder hazardClear(HazardClearKind value) { this.hazardClear = value; return this; }

        public MoveEffect build() {
            return new MoveEffect(status, volatileKind, hazard, screen, fieldCondition, weather, terrain,
                    healFraction, weatherScaledHeal, selfBoosts, targetBoosts, fixedDamage,
                    recoilFraction, drainFraction, hazardClear);
        }
    }
}
