package org.pokeai.runtime;

import org.pokeai.runtime.mechanics.StatMath;
import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.LogEntry;
import org.pokeai.runtime.model.MoveSlot;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.rules.AbilityData;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.rules.Ids;
import org.pokeai.runtime.rules.ItemData;
import org.pokeai.runtime.rules.Lookup;
import org.pokeai.runtime.rules.MoveData;
import org.pokeai.runtime.rules.RuleTables;
import org.pokeai.runtime.rules.SpeciesData;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns roster specifications into combatants. Unknown content falls back to baselines and
 * banned content is stripped; both are logged at WARN and reported as turn-0 log entries with
 * outcome {@link Outcome#DEFAULTED} so they can be told apart from regular play.
 */
public class CombatantFactory {

    private static final Logger LOG = LoggerFactory.getLogger(CombatantFactory.class);

    public static final int MAX_ROSTER_SIZE = 6;

    private final RuleTables rules;
    private final FormatRules format;

    public CombatantFactory(RuleTables rules, FormatRules format) {
        this.rules = rules;
        this.format = format;
    }

    /**
     * Builds one side.
     *
     * @param notes receives the fallback and format-gate entries
     * @throws IllegalArgumentException if the roster is empty, too large, or empty after banned species are removed
     */
    public SideState buildSide(Side side, List<CombatantSpec> roster, List<LogEntry> notes) {
        if (roster == null || roster.isEmpty() || roster.size() > MAX_ROSTER_SIZE) {
            throw new IllegalArgumentException("Roster of side " + side + " must hold 1.." + MAX_ROSTER_SIZE
                    + " combatants, got " + (roster == null ? 0 : roster.size()));
        }
        List<Combatant> members = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (CombatantSpec spec : roster) {
            String speciesId = Ids.normalize(spec.species());
            if (format.isSpeciesBanned(speciesId)) {
                gate(notes, side, spec.species(), "species:" + speciesId);
                continue;
            }
            Combatant combatant = build(side, spec, names, notes);
            names.add(combatant.name());
            members.add(combatant);
        }
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Every combatant of side " + side + " is banned in format " + format.name());
        }
        return new SideState(side, members);
    }

    private Combatant build(Side side, CombatantSpec spec, Set<String> takenNames, List<LogEntry> notes) {
        Lookup<SpeciesData> speciesLookup = rules.species(spec.species());
        SpeciesData species = speciesLookup.value();
        String name = uniqueName(speciesLookup.fallback() ? spec.species() : species.name(), takenNames);
        if (speciesLookup.fallback()) {
            fallback(notes, side, name, "species:" + spec.species());
        }

        List<MoveSlot> moves = new ArrayList<>();
        for (String moveId : spec.moves()) {
            String normalized = Ids.normalize(moveId);
            if (format.isMoveBanned(normalized)) {
                gate(notes, side, name, "move:" + normalized);
                continue;
            }
            Lookup<MoveData> move = rules.move(moveId);
            if (move.fallback()) {
                fallback(notes, side, name, "move:" + moveId);
            }
            moves.add(new MoveSlot(move.value()));
        }
        if (moves.isEmpty()) {
            fallback(notes, side, name, "moves:none");
            moves.add(new MoveSlot(MoveData.BASELINE));
        }

        String abilityId = spec.ability() != null ? spec.ability()
                : species.abilities().isEmpty() ? null : species.abilities().get(0);
        AbilityData ability = AbilityData.NONE;
        if (abilityId != null && format.isAbilityBanned(Ids.normalize(abilityId))) {
            gate(notes, side, name, "ability:" + Ids.normalize(abilityId));
        } else {
            Lookup<AbilityData> lookup = rules.ability(abilityId);
            if (lookup.fallback()) {
                fallback(notes, side, name, "ability:" + abilityId);
            }
            ability = lookup.value();
        }

        ItemData item = ItemData.NONE;
        if (spec.item() != null && format.isItemBanned(Ids.normalize(spec.item()))) {
            gate(notes, side, name, "item:" + Ids.normalize(spec.item()));
        } else {
            Lookup<ItemData> lookup = rules.item(spec.item());
            if (lookup.fallback()) {
                fallback(notes, side, name, "item:" + spec.item());
            }
            item = lookup.value();
        }

        ElementType teraType = null;
        if (spec.teraType() != null && !spec.teraType().isBlank()) {
            try {
                teraType = ElementType.fromId(spec.teraType());
            } catch (IllegalArgumentException e) {
                fallback(notes, side, name, "tera:" + spec.teraType());
            }
        }

        StatBlock stats = StatMath.deriveStats(species.baseStats(), spec.level(), statBlock(spec.evs(), side, name, notes));
        for (Map.Entry<String, Integer> override : spec.statOverrides().entrySet()) {
            Stat stat = parseStat(override.getKey(), side, name, notes);
            if (stat != null && stat.ordinal() <= Stat.SPEED.ordinal()) {
                stats = stats.with(stat, override.getValue());
            }
        }
        return new Combatant(speciesLookup.fallback() ? Ids.normalize(spec.species()) : species.id(), name, side,
                spec.level(), stats, species.types(), ability, item, moves, teraType);
    }

    private StatBlock statBlock(Map<String, Integer> values, Side side, String name, List<LogEntry> notes) {
        StatBlock block = StatBlock.uniform(0);
        for (Map.Entry<String, Integer> entry : values.entrySet()) {
            Stat stat = parseStat(entry.getKey(), side, name, notes);
            if (stat != null && stat.ordinal() <= Stat.SPEED.ordinal()) {
                block = block.with(stat, entry.getValue());
            }
        }
        return block;
    }

    private Stat parseStat(String id, Side side, String name, List<LogEntry> notes) {
        try {
            return Stat.fromId(id);
        } catch (IllegalArgumentException e) {
            fallback(notes, side, name, "stat:" + id);
            return null;
        }
    }

    private static String uniqueName(String base, Set<String> taken) {
        String candidate = base;
        int suffix = 2;
        while (taken.contains(candidate)) {
            candidate = base + "#" + suffix++;
        }
        return candidate;
    }

    private static void fallback(List<LogEntry> notes, Side side, String actor, String detail) {
        LOG.warn("Unknown content '{}' for {} on side {}, using the default", detail, actor, side);
        notes.add(LogEntry.event(0, side, ActionKind.CONTENT_FALLBACK, actor, null, detail, Outcome.DEFAULTED));
    }

    private void gate(List<LogEntry> notes, Side side, String actor, String detail) {
        LOG.warn("Format {} bans '{}' ({} on side {}), removed", format.name(), detail, actor, side);
        notes.add(LogEntry.event(0, side, ActionKind.FORMAT_GATE, actor, null, detail, Outcome.DEFAULTED));
    }
}
