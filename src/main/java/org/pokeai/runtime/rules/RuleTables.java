package org.pokeai.runtime.rules;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Read-only aggregate of every content table the engine consults. Instances are immutable and
 * may be shared between concurrently running battles.
 */
public final class RuleTables {

    private final Map<String, SpeciesData> species;
    private final Map<String, MoveData> moves;
    private final Map<String, AbilityData> abilities;
    private final Map<String, ItemData> items;
    private final TypeChart typeChart;
    private final Map<Weather, WeatherData> weather;
    private final Map<Terrain, TerrainData> terrain;

    public RuleTables(Collection<SpeciesData> species, Collection<MoveData> moves, Collection<AbilityData> abilities,
                      Collection<ItemData> items, TypeChart typeChart, Collection<WeatherData> weather,
                      Collection<TerrainData> terrain) {
        this.species = index(species, SpeciesData::id);
        this.moves = index(moves, MoveData::id);
        this.abilities = index(abilities, AbilityData::id);
        this.items = index(items, ItemData::id);
        this.typeChart = typeChart;
        this.weather = new EnumMap<>(Weather.class);
        for (WeatherData data : weather) {
            this.weather.put(data.weather(), data);
        }
        this.terrain = new EnumMap<>(Terrain.class);
        for (TerrainData data : terrain) {
            this.terrain.put(data.terrain(), data);
        }
    }

    private static <T> Map<String, T> index(Collection<T> entries, Function<T, String> key) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T entry : entries) {
            map.put(Ids.normalize(key.apply(entry)), entry);
        }
        return Map.copyOf(map);
    }

    /**
     * Looks up a species, substituting {@link SpeciesData#BASELINE} for unknown identifiers.
     */
    public Lookup<SpeciesData> species(String id) {
        SpeciesData data = species.get(Ids.normalize(id));
        return data != null ? Lookup.found(data) : Lookup.defaulted(SpeciesData.BASELINE);
    }

    /**
     * Looks up a move, substituting {@link MoveData#BASELINE} for unknown identifiers.
     */
    public Lookup<MoveData> move(String id) {
        String key = Ids.normalize(id);
        if (MoveData.STRUGGLE_ID.equals(key)) {
            return Lookup.found(MoveData.STRUGGLE);
        }
        MoveData data = moves.get(key);
        return data != null ? Lookup.found(data) : Lookup.defaulted(MoveData.BASELINE);
    }

    /**
     * Looks up an ability; unknown identifiers resolve to an ability without effect.
     */
    public Lookup<AbilityData> ability(String id) {
        if (id == null || id.isBlank()) {
            return Lookup.found(AbilityData.NONE);
        }
        AbilityData data = abilities.get(Ids.normalize(id));
        return data != null ? Lookup.found(data) : Lookup.defaulted(AbilityData.NONE);
    }

    /**
     * Looks up an item; unknown identifiers resolve to no item.
     */
    public Lookup<ItemData> item(String id) {
        if (id == null || id.isBlank()) {
            return Lookup.found(ItemData.NONE);
        }
        ItemData data = items.get(Ids.normalize(id));
        return data != null ? Lookup.found(data) : Lookup.defaulted(ItemData.NONE);
    }

    public TypeChart typeChart() {
        return typeChart;
    }

    public WeatherData weather(Weather kind) {
        return weather.getOrDefault(kind, WeatherData.inert(kind));
    }

    public TerrainData terrain(Terrain kind) {
        return terrain.getOrDefault(kind, TerrainData.inert(kind));
    }

    public int speciesCount() {
        return species.size();
    }

    public int moveCount() {
        return moves.size();
    }
}
