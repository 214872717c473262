package org.pokeai.runtime.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One immutable battle event. Numeric fields are {@code null} where they do not apply.
 *
 * @param turn          turn number, 0 for events before the first turn
 * @param side          acting side, or {@code null} for field-wide events
 * @param kind          event kind
 * @param actor         name of the acting combatant, or {@code null}
 * @param target        name of the affected combatant, or {@code null}
 * @param detail        free-form detail (move id, condition id, ...)
 * @param outcome       outcome tag
 * @param damage        HP lost (or restored, for {@link Outcome#HEALED})
 * @param accuracyRoll  the accuracy draw in [0, 1)
 * @param criticalHit   whether the hit was critical
 * @param effectiveness type-effectiveness multiplier
 */
@JsonPropertyOrder({"turn", "side", "kind", "actor", "target", "detail", "outcome",
        "damage", "accuracyRoll", "criticalHit", "effectiveness"})
public record LogEntry(int turn, Side side, ActionKind kind, String actor, String target, String detail,
                       Outcome outcome, Integer damage, Double accuracyRoll, Boolean criticalHit,
                       Double effectiveness) {

    public static LogEntry event(int turn, Side side, ActionKind kind, String actor, String target,
                                 String detail, Outcome outcome) {
        return new LogEntry(turn, side, kind, actor, target, detail, outcome, null, null, null, null);
    }

    public LogEntry withDamage(int amount) {
        return new LogEntry(turn, side, kind, actor, target, detail, outcome, amount, accuracyRoll, criticalHit, effectiveness);
    }
}
