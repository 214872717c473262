package org.pokeai.runtime.model;

/**
 * Kind of event recorded in a {@link LogEntry}.
 */
public enum ActionKind {
    MOVE,
    SWITCH,
    STATUS_TICK,
    WEATHER_TICK,
    TERRAIN_TICK,
    ITEM_TRIGGER,
    ABILITY_TRIGGER,
    FIELD_EFFECT,
    HAZARD,
    TERASTALLIZE,
    /** An unknown content identifier was replaced by a baseline entry. */
    CONTENT_FALLBACK,
    /** Content banned by the format was stripped from a roster. */
    FORMAT_GATE,
    /** An action source supplied no legal action and a default was used. */
    FORCED_DEFAULT
}
