package org.pokeai.runtime.rules;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Type-effectiveness chart. Pairs not present in the chart are neutral.
 */
public final class TypeChart {

    private final Map<ElementType, EnumMap<ElementType, Double>> multipliers;

    private TypeChart(Map<ElementType, EnumMap<ElementType, Double>> multipliers) {
        this.multipliers = multipliers;
    }

    /**
     * Multiplier of an attacking type against a single defending type.
     */
    public double against(ElementType attacking, ElementType defending) {
        if (attacking == ElementType.TYPELESS || defending == ElementType.TYPELESS) {
            return 1.0;
        }
        EnumMap<ElementType, Double> row = multipliers.get(attacking);
        if (row == null) {
            return 1.0;
        }
        return row.getOrDefault(defending, 1.0);
    }

    /**
     * Product of the per-type multipliers against every defending type.
     */
    public double effectiveness(ElementType attacking, Collection<ElementType> defending) {
        double result = 1.0;
        for (ElementType type : defending) {
            result *= against(attacking, type);
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<ElementType, EnumMap<ElementType, Double>> multipliers = new EnumMap<>(ElementType.class);

        private Builder() {
        }

        public Builder set(ElementType attacking, ElementType defending, double multiplier) {
            multipliers.computeIfAbsent(attacking, k -> new EnumMap<>(ElementType.class)).put(defending, multiplier);
            return this;
        }

        public TypeChart build() {
            Map<ElementType, EnumMap<ElementType, Double>> copy = new EnumMap<>(ElementType.class);
            multipliers.forEach((k, v) -> copy.put(k, new EnumMap<>(v)));
            return new TypeChart(copy);
        }
    }
}
