package org.pokeai.runtime.model;

/**
 * Everything one battle owns: both sides, the field and the event log. Passed by exclusive
 * reference into every engine component; never shared between battles.
 */
public class BattleState {

    private final SideState sideA;
    private final SideState sideB;
    private final FieldState field;
    private final BattleLog log;

    public BattleState(SideState sideA, SideState sideB) {
        if (sideA.side() != Side.A || sideB.side() != Side.B) {
            throw new IllegalArgumentException("Sides must be given in order A, B");
        }
        this.sideA = sideA;
        this.sideB = sideB;
        this.field = new FieldState();
        this.log = new BattleLog(field);
    }

    public SideState side(Side side) {
        return side == Side.A ? sideA : sideB;
    }

    public SideState sideOf(Combatant combatant) {
        return side(combatant.side());
    }

    public SideState opponentOf(Combatant combatant) {
        return side(combatant.side().opposite());
    }

    /**
     * The active combatant facing the given one.
     */
    public Combatant foeOf(Combatant combatant) {
        return opponentOf(combatant).active();
    }

    public FieldState field() {
        return field;
    }

    public BattleLog log() {
        return log;
    }

    public int turn() {
        return field.turn();
    }
}
