package org.pokeai.runtime.rules;

import java.util.List;

/**
 * Immutable species entry.
 */
public record SpeciesData(String id, String name, StatBlock baseStats, List<ElementType> types, List<String> abilities) {

    /**
     * Substitute for species identifiers missing from the species table.
     */
    public static final SpeciesData BASELINE = new SpeciesData("baseline", "Baseline", StatBlock.uniform(100),
            List.of(ElementType.NORMAL), List.of());

    public SpeciesData {
        if (types == null || types.isEmpty() || types.size() > 2) {
            throw new IllegalArgumentException("Species " + id + " must have one or two types");
        }
        types = List.copyOf(types);
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
    }
}
