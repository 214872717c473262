package org.pokeai.runtime.model;

/**
 * A decision submitted by an action source for one turn.
 *
 * @param kind         move, switch or struggle
 * @param index        move slot for {@link Kind#MOVE}, roster index for {@link Kind#SWITCH}, -1 otherwise
 * @param terastallize whether the active combatant terastallizes before moving
 */
public record BattleAction(Kind kind, int index, boolean terastallize) {

    public enum Kind {
        MOVE, SWITCH, STRUGGLE
    }

    public static BattleAction move(int moveSlot) {
        return new BattleAction(Kind.MOVE, moveSlot, false);
    }

    public static BattleAction moveWithTera(int moveSlot) {
        return new BattleAction(Kind.MOVE, moveSlot, true);
    }

    public static BattleAction switchTo(int rosterIndex) {
        return new BattleAction(Kind.SWITCH, rosterIndex, false);
    }

    public static BattleAction struggle() {
        return new BattleAction(Kind.STRUGGLE, -1, false);
    }

    public boolean isSwitch() {
        return kind == Kind.SWITCH;
    }

    public boolean isAttack() {
        return kind != Kind.SWITCH;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case MOVE -> "move[" + index + "]" + (terastallize ? "+tera" : "");
            case SWITCH -> "switch[" + index + "]";
            case STRUGGLE -> "struggle";
        };
    }
}
