package org.pokeai.runtime.model;

import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.Weather;

import java.util.EnumMap;

/**
 * Global field state: weather, terrain, rooms and gravity, and the turn counter.
 * A weather duration of {@link #SUSTAINED} means it lasts until replaced.
 */
public class FieldState {

    public static final int SUSTAINED = -1;

    private Weather weather = Weather.NONE;
    private int weatherTurns;
    private Terrain terrain = Terrain.NONE;
    private int terrainTurns;
    private final EnumMap<FieldCondition, Integer> conditions = new EnumMap<>(FieldCondition.class);
    private int turn;

    public Weather weather() {
        return weather;
    }

    public int weatherTurns() {
        return weatherTurns;
    }

    public void setWeather(Weather weather, int turns) {
        this.weather = weather;
        this.weatherTurns = weather == Weather.NONE ? 0 : turns;
    }

    public void setWeatherTurns(int weatherTurns) {
        this.weatherTurns = weatherTurns;
    }

    public boolean isWeatherSustained() {
        return weather != Weather.NONE && weatherTurns == SUSTAINED;
    }

    public Terrain terrain() {
        return terrain;
    }

    public int terrainTurns() {
        return terrainTurns;
    }

    public void setTerrain(Terrain terrain, int turns) {
        this.terrain = terrain;
        this.terrainTurns = terrain == Terrain.NONE ? 0 : turns;
    }

    public void setTerrainTurns(int terrainTurns) {
        this.terrainTurns = terrainTurns;
    }

    public boolean isActive(FieldCondition condition) {
        return conditions.getOrDefault(condition, 0) > 0;
    }

    public int turnsLeft(FieldCondition condition) {
        return conditions.getOrDefault(condition, 0);
    }

    public void setCondition(FieldCondition condition, int turns) {
        if (!condition.isGlobal()) {
            throw new IllegalArgumentException(condition + " is a side condition");
        }
        if (turns <= 0) {
            conditions.remove(condition);
        } else {
            conditions.put(condition, turns);
        }
    }

    public int turn() {
        return turn;
    }

    public void setTurn(int turn) {
        this.turn = turn;
    }
}
