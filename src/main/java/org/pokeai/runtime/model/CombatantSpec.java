package org.pokeai.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Roster entry as submitted by a caller.
 *
 * @param species       species identifier
 * @param level         level 1..100, 100 when omitted
 * @param moves         one to four move identifiers
 * @param ability       ability identifier, may be {@code null}
 * @param item          held item identifier, may be {@code null}
 * @param teraType      Tera type identifier, may be {@code null}
 * @param evs           effort values 0..252 keyed by stat id ("hp", "atk", ...), may be empty
 * @param statOverrides positive final stat values keyed by stat id, replacing the derived values
 */
public record CombatantSpec(String species, int level, List<String> moves, String ability, String item,
                            String teraType, Map<String, Integer> evs, Map<String, Integer> statOverrides) {

    public static final int MAX_EV = 252;

    @JsonCreator
    public CombatantSpec(@JsonProperty("species") String species,
                         @JsonProperty("level") Integer level,
                         @JsonProperty("moves") List<String> moves,
                         @JsonProperty("ability") String ability,
                         @JsonProperty("item") String item,
                         @JsonProperty("teraType") String teraType,
                         @JsonProperty("evs") Map<String, Integer> evs,
                         @JsonProperty("stats") Map<String, Integer> statOverrides) {
        this(species, level == null ? 100 : level, moves, ability, item, teraType, evs, statOverrides);
    }

    public CombatantSpec {
        if (species == null || species.isBlank()) {
            throw new IllegalArgumentException("species is required");
        }
        if (level < 1 || level > 100) {
            throw new IllegalArgumentException("level must be within 1..100, got " + level);
        }
        moves = moves == null ? List.of() : List.copyOf(moves);
        if (moves.size() > 4) {
            throw new IllegalArgumentException("At most four moves, got " + moves.size());
        }
        evs = evs == null ? Map.of() : Map.copyOf(evs);
        statOverrides = statOverrides == null ? Map.of() : Map.copyOf(statOverrides);
        for (Map.Entry<String, Integer> ev : evs.entrySet()) {
            if (ev.getValue() < 0 || ev.getValue() > MAX_EV) {
                throw new IllegalArgumentException("EV for " + ev.getKey() + " must be within 0.." + MAX_EV
                        + ", got " + ev.getValue());
            }
        }
        for (Map.Entry<String, Integer> override : statOverrides.entrySet()) {
            if (override.getValue() < 1) {
                throw new IllegalArgumentException("Stat override for " + override.getKey() + " must be positive, got "
                        + override.getValue());
            }
        }
    }

    public static CombatantSpec of(String species, String ability, String item, String... moves) {
        return new CombatantSpec(species, 100, List.of(moves), ability, item, null, Map.of(), Map.of());
    }

    public CombatantSpec withTeraType(String type) {
        return new CombatantSpec(species, level, moves, ability, item, type, evs, statOverrides);
    }

    public CombatantSpec withLevel(int newLevel) {
        return new CombatantSpec(species, newLevel, moves, ability, item, teraType, evs, statOverrides);
    }

    public CombatantSpec withStats(Map<String, Integer> overrides) {
        return new CombatantSpec(species, level, moves, ability, item, teraType, evs, overrides);
    }
}
