package org.pokeai.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only event log of one battle. Entries are stamped with the current turn of the
 * owning {@link FieldState}.
 */
public class BattleLog {

    private final FieldState field;
    private final List<LogEntry> entries = new ArrayList<>();

    public BattleLog(FieldState field) {
        this.field = field;
    }

    public LogEntry add(Side side, ActionKind kind, String actor, String target, String detail, Outcome outcome) {
        return append(LogEntry.event(field.turn(), side, kind, actor, target, detail, outcome));
    }

    /**
     * Records an HP change (damage, or healing for {@link Outcome#HEALED}).
     */
    public LogEntry addAmount(Side side, ActionKind kind, String actor, String target, String detail,
                              Outcome outcome, int amount) {
        return append(LogEntry.event(field.turn(), side, kind, actor, target, detail, outcome).withDamage(amount));
    }

    /**
     * Records the resolution of a move against a target.
     */
    public LogEntry addMove(Side side, String actor, String target, String detail, Outcome outcome,
                            Integer damage, Double accuracyRoll, Boolean criticalHit, Double effectiveness) {
        return append(new LogEntry(field.turn(), side, ActionKind.MOVE, actor, target, detail, outcome,
                damage, accuracyRoll, criticalHit, effectiveness));
    }

    public LogEntry append(LogEntry entry) {
        entries.add(entry);
        return entry;
    }

    public List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
