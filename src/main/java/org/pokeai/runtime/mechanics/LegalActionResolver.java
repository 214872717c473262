package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.MoveSlot;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.model.VolatileState;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.MoveCategory;
import org.pokeai.runtime.rules.VolatileKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the actions the engine accepts from a side. Moves are masked by PP, encore, choice
 * lock, disable, taunt, Assault Vest, torment and the opponent's imprison; when nothing is
 * left the only attack is Struggle. Switching is blocked by partial trapping.
 */
public final class LegalActionResolver {

    private LegalActionResolver() {
        throw new AssertionError("Utility class");
    }

    /**
     * The legal actions for {@code side}: usable moves (plus Tera variants when the format allows
     * it and the side has not terastallized yet) followed by switches in roster order. If the
     * active combatant has fainted only switches are returned.
     */
    public static List<BattleAction> legalActions(Side side, BattleState state, FormatRules format) {
        SideState own = state.side(side);
        Combatant active = own.active();
        if (active.isFainted()) {
            return replacementActions(side, state);
        }
        List<BattleAction> actions = new ArrayList<>();
        List<Integer> usable = usableMoveSlots(active, state.foeOf(active), state);
        if (usable.isEmpty()) {
            actions.add(BattleAction.struggle());
        } else {
            for (int slot : usable) {
                actions.add(BattleAction.move(slot));
            }
            if (canTerastallize(own, active, format)) {
                for (int slot : usable) {
                    actions.add(BattleAction.moveWithTera(slot));
                }
            }
        }
        if (!active.hasVolatile(VolatileKind.PARTIAL_TRAP)) {
            for (int index : own.switchableIndices()) {
                actions.add(BattleAction.switchTo(index));
            }
        }
        return actions;
    }

    /**
     * Switches to every living bench member, used after the active combatant fainted.
     */
    public static List<BattleAction> replacementActions(Side side, BattleState state) {
        List<BattleAction> actions = new ArrayList<>();
        for (int index : state.side(side).switchableIndices()) {
            actions.add(BattleAction.switchTo(index));
        }
        return actions;
    }

    public static boolean canTerastallize(SideState side, Combatant active, FormatRules format) {
        return format.teraAllowed() && !side.isTeraUsed() && active.teraType() != null && !active.isTerastallized();
    }

    /**
     * Move slots {@code user} may select this turn.
     */
    public static List<Integer> usableMoveSlots(Combatant user, Combatant foe, BattleState state) {
        String forced = forcedMove(user);
        VolatileState disable = user.volatileState(VolatileKind.DISABLE);
        boolean statusBlocked = user.hasVolatile(VolatileKind.TAUNT)
                || ItemEffects.activeItem(user, state.field()) == ItemKind.ASSAULT_VEST;
        boolean imprisoned = foe != null && !foe.isFainted() && foe.hasVolatile(VolatileKind.IMPRISON);

        List<Integer> usable = new ArrayList<>();
        for (int i = 0; i < user.moves().size(); i++) {
            MoveSlot slot = user.moveSlot(i);
            String id = slot.moveId();
            if (!slot.hasPp()
                    || (forced != null && !forced.equals(id))
                    || (disable != null && id.equals(disable.moveId()))
                    || (statusBlocked && slot.move().category() == MoveCategory.STATUS)
                    || (user.hasVolatile(VolatileKind.TORMENT) && id.equals(user.lastMoveUsed()))
                    || (imprisoned && foe.knowsMove(id))) {
                continue;
            }
            usable.add(i);
        }
        return usable;
    }

    /**
     * The move an encore or a choice lock restricts the user to, or {@code null}. A lock onto a
     * move without PP no longer restricts.
     */
    private static String forcedMove(Combatant user) {
        VolatileState encore = user.volatileState(VolatileKind.ENCORE);
        if (encore != null && hasPp(user, encore.moveId())) {
            return encore.moveId();
        }
        String locked = user.choiceLockedMove();
        if (locked != null && hasPp(user, locked)) {
            return locked;
        }
        return null;
    }

    private static boolean hasPp(Combatant user, String moveId) {
        int index = user.indexOfMove(moveId);
        return index >= 0 && user.moveSlot(index).hasPp();
    }
}
