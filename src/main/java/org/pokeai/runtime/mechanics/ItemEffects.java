package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.model.MoveSlot;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.ItemKind;

/**
 * Held-item triggers. Magic Room suppresses every item while it lasts.
 */
public class ItemEffects {

    static final double LIFE_ORB_RECOIL = 0.1;
    static final double ROCKY_HELMET_FRACTION = 1.0 / 6.0;
    static final double LEFTOVERS_FRACTION = 1.0 / 16.0;
    static final double BLACK_SLUDGE_DAMAGE = 1.0 / 8.0;
    static final double QUICK_CLAW_CHANCE = 0.2;

    private final BattleContext ctx;

    public ItemEffects(BattleContext ctx) {
        this.ctx = ctx;
    }

    /**
     * The effect kind of the held item, or {@link ItemKind#NONE} while Magic Room is active.
     */
    public static ItemKind activeItem(Combatant combatant, FieldState field) {
        if (field.isActive(FieldCondition.MAGIC_ROOM)) {
            return ItemKind.NONE;
        }
        return combatant.item().kind();
    }

    private ItemKind itemOf(Combatant combatant) {
        return activeItem(combatant, ctx.field());
    }

    /**
     * Leftovers restore 1/16; Black Sludge restores 1/16 to Poison types and hurts everyone else by 1/8.
     */
    public void endOfTurn(Combatant c) {
        if (c.isFainted()) {
            return;
        }
        ItemKind item = itemOf(c);
        if (item == ItemKind.LEFTOVERS || (item == ItemKind.BLACK_SLUDGE && c.hasType(ElementType.POISON))) {
            if (!c.isAtFullHp()) {
                ctx.restore(c, StatMath.fractionOf(c.maxHp(), LEFTOVERS_FRACTION), ActionKind.ITEM_TRIGGER, c.item().id());
            }
        } else if (item == ItemKind.BLACK_SLUDGE) {
            ctx.indirectDamage(c, StatMath.fractionOf(c.maxHp(), BLACK_SLUDGE_DAMAGE), ActionKind.ITEM_TRIGGER, c.item().id());
        }
    }

    /**
     * Life Orb costs 10% of max HP whenever a damaging move is used, hit or miss.
     */
    public void lifeOrbRecoil(Combatant user) {
        if (!user.isFainted() && itemOf(user) == ItemKind.LIFE_ORB) {
            ctx.indirectDamage(user, StatMath.fractionOf(user.maxHp(), LIFE_ORB_RECOIL), ActionKind.ITEM_TRIGGER, "lifeorb");
        }
    }

    /**
     * Focus Sash leaves a full-HP holder at 1 HP instead of fainting, once.
     *
     * @return the damage to apply
     */
    public int applyFocusSash(Combatant target, int damage) {
        if (damage >= target.hp() && target.isAtFullHp() && target.maxHp() > 1 && itemOf(target) == ItemKind.FOCUS_SASH) {
            target.consumeItem();
            ctx.log().add(target.side(), ActionKind.ITEM_TRIGGER, target.name(), target.name(), "focussash", Outcome.APPLIED);
            return target.hp() - 1;
        }
        return damage;
    }

    /**
     * Rocky Helmet hurts an attacker that made contact by 1/6 of the attacker's max HP.
     */
    public void onContact(Combatant attacker, Combatant defender) {
        if (!attacker.isFainted() && itemOf(defender) == ItemKind.ROCKY_HELMET) {
            ctx.indirectDamage(attacker, StatMath.fractionOf(attacker.maxHp(), ROCKY_HELMET_FRACTION),
                    ActionKind.ITEM_TRIGGER, "rockyhelmet");
        }
    }

    /**
     * Locks a Choice item holder into the move it just used.
     */
    public void lockChoice(Combatant user, String moveId) {
        if (itemOf(user).isChoice() && user.choiceLockedMove() == null) {
            user.setChoiceLockedMove(moveId);
        }
    }

    /**
     * Releases a choice lock whose move has run out of PP.
     */
    public void releaseExhaustedLock(Combatant c) {
        String locked = c.choiceLockedMove();
        if (locked == null) {
            return;
        }
        int index = c.indexOfMove(locked);
        MoveSlot slot = index < 0 ? null : c.moveSlot(index);
        if (slot == null || !slot.hasPp()) {
            c.setChoiceLockedMove(null);
        }
    }

    /**
     * Rolls Quick Claw for a combatant about to use a move.
     */
    public boolean quickClawActivates(Combatant c) {
        if (c.isFainted() || itemOf(c) != ItemKind.QUICK_CLAW) {
            return false;
        }
        if (ctx.random().nextDouble() < QUICK_CLAW_CHANCE) {
            ctx.log().add(c.side(), ActionKind.ITEM_TRIGGER, c.name(), null, "quickclaw", Outcome.APPLIED);
            return true;
        }
        return false;
    }
}
