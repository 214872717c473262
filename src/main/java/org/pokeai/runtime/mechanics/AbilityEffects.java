package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.rules.AbilityData;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.MoveCategory;
import org.pokeai.runtime.rules.MoveData;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.Weather;

/**
 * Ability triggers: switch-in and switch-out effects, type absorption, contact punishment and
 * the Protosynthesis / Quark Drive activation. The static helpers answer ability questions
 * needed by the pure calculators.
 */
public class AbilityEffects {

    static final double ABSORB_HEAL = 0.25;
    static final double REGENERATOR_HEAL = 1.0 / 3.0;
    static final double CONTACT_DAMAGE = 1.0 / 8.0;
    static final double CONTACT_STATUS_CHANCE = 0.3;

    private final BattleContext ctx;
    private final StatChanges statChanges;
    private final FieldEffectsEngine field;
    private final StatusEngine status;

    public AbilityEffects(BattleContext ctx, StatChanges statChanges, FieldEffectsEngine field, StatusEngine status) {
        this.ctx = ctx;
        this.statChanges = statChanges;
        this.field = field;
        this.status = status;
    }

    /**
     * Whether the attacker's Mold Breaker family ability ignores the defender's ability.
     */
    public static boolean ignoresAbility(Combatant attacker, Combatant defender) {
        return attacker != null && attacker.hasAbility(AbilityKind.MOLD_BREAKER) && defender.ability().breakable();
    }

    /**
     * Whether {@code defender} has an ability of the given kind that {@code attacker} does not ignore.
     */
    public static boolean defenderHas(Combatant defender, AbilityKind kind, Combatant attacker) {
        return defender.hasAbility(kind) && !ignoresAbility(attacker, defender);
    }

    /**
     * The type a move is used as, after -ate conversions of Normal moves.
     */
    public static ElementType moveType(Combatant attacker, MoveData move) {
        AbilityData ability = attacker.ability();
        if (ability.is(AbilityKind.TYPE_CHANGE_BOOST) && ability.type() != null && move.type() == ElementType.NORMAL) {
            return ability.type();
        }
        return move.type();
    }

    /**
     * Priority added by Prankster (status moves) and Gale Wings (Flying moves at full HP).
     */
    public static int priorityBonus(Combatant user, MoveData move) {
        if (user.hasAbility(AbilityKind.PRANKSTER) && move.category() == MoveCategory.STATUS) {
            return 1;
        }
        if (user.hasAbility(AbilityKind.GALE_WINGS) && move.type() == ElementType.FLYING && user.isAtFullHp()) {
            return 1;
        }
        return 0;
    }

    /**
     * Effects of a combatant entering the field: Intimidate, weather and terrain setters.
     */
    public void onSwitchIn(Combatant c) {
        if (c.isFainted()) {
            return;
        }
        AbilityData ability = c.ability();
        switch (ability.kind()) {
            case INTIMIDATE -> {
                Combatant foe = ctx.state().foeOf(c);
                if (!foe.isFainted()) {
                    ctx.log().add(c.side(), ActionKind.ABILITY_TRIGGER, c.name(), foe.name(), ability.id(), Outcome.APPLIED);
                    statChanges.apply(foe, Stat.ATTACK, -1, c, ActionKind.ABILITY_TRIGGER);
                }
            }
            case WEATHER_SETTER -> {
                if (ability.weather() != null) {
                    field.setWeather(ability.weather(), FieldState.SUSTAINED, c, ActionKind.ABILITY_TRIGGER);
                }
            }
            case TERRAIN_SETTER -> {
                if (ability.terrain() != null) {
                    field.setTerrain(ability.terrain(), c, ActionKind.ABILITY_TRIGGER);
                }
            }
            default -> {
                // no switch-in effect
            }
        }
    }

    /**
     * Regenerator restores a third of max HP when leaving the field.
     */
    public void onSwitchOut(Combatant c) {
        if (!c.isFainted() && c.hasAbility(AbilityKind.REGENERATOR) && !c.isAtFullHp()) {
            ctx.restore(c, StatMath.fractionOf(c.maxHp(), REGENERATOR_HEAL), ActionKind.ABILITY_TRIGGER, c.ability().id());
        }
    }

    /**
     * Absorbing abilities: Volt/Water Absorb heal, Flash Fire powers up, Storm Drain and
     * Lightning Rod raise Special Attack. All grant immunity to their type.
     *
     * @return whether the move was absorbed and must not deal damage
     */
    public boolean tryAbsorb(Combatant attacker, Combatant defender, ElementType moveType) {
        AbilityData ability = defender.ability();
        if (ignoresAbility(attacker, defender)) {
            return false;
        }
        boolean absorbs = switch (ability.kind()) {
            case ABSORB_HEAL, ABSORB_BOOST -> ability.type() == moveType;
            case FLASH_FIRE -> moveType == ElementType.FIRE;
            default -> false;
        };
        if (!absorbs) {
            return false;
        }
        ctx.log().add(defender.side(), ActionKind.ABILITY_TRIGGER, defender.name(), attacker.name(), ability.id(), Outcome.IMMUNE);
        switch (ability.kind()) {
            case ABSORB_HEAL -> ctx.restore(defender, StatMath.fractionOf(defender.maxHp(), ABSORB_HEAL),
                    ActionKind.ABILITY_TRIGGER, ability.id());
            case ABSORB_BOOST -> statChanges.apply(defender, Stat.SPECIAL_ATTACK, 1, defender, ActionKind.ABILITY_TRIGGER);
            case FLASH_FIRE -> defender.setFlashFireActive(true);
            default -> {
                // unreachable, filtered above
            }
        }
        return true;
    }

    /**
     * Rough Skin and Iron Barbs damage, Static and Flame Body status, after a contact hit.
     */
    public void onContact(Combatant attacker, Combatant defender) {
        if (attacker.isFainted()) {
            return;
        }
        AbilityData ability = defender.ability();
        if (ability.is(AbilityKind.CONTACT_DAMAGE)) {
            ctx.indirectDamage(attacker, StatMath.fractionOf(attacker.maxHp(), CONTACT_DAMAGE),
                    ActionKind.ABILITY_TRIGGER, ability.id());
        } else if (ability.is(AbilityKind.CONTACT_STATUS) && ability.status() != null
                && ctx.random().nextDouble() < CONTACT_STATUS_CHANCE) {
            status.inflict(ability.status(), attacker, defender, ActionKind.ABILITY_TRIGGER, false);
        }
    }

    /**
     * Activates or ends Protosynthesis / Quark Drive. Sun (respectively Electric Terrain)
     * activates it; without the field condition a held Booster Energy is consumed once instead.
     */
    public void refreshParadox(Combatant c) {
        if (c.isFainted()) {
            return;
        }
        boolean protosynthesis = c.hasAbility(AbilityKind.PROTOSYNTHESIS);
        boolean quarkDrive = c.hasAbility(AbilityKind.QUARK_DRIVE);
        if (!protosynthesis && !quarkDrive) {
            return;
        }
        boolean fieldActive = (protosynthesis && ctx.field().weather() == Weather.SUN)
                || (quarkDrive && ctx.field().terrain() == Terrain.ELECTRIC);
        if (c.paradoxStat() != null) {
            if (!fieldActive && !c.isBoosterEnergyActive()) {
                c.setParadoxStat(null);
                ctx.log().add(c.side(), ActionKind.ABILITY_TRIGGER, c.name(), null, c.ability().id(), Outcome.EXPIRED);
            }
            return;
        }
        if (!fieldActive) {
            if (ItemEffects.activeItem(c, ctx.field()) != ItemKind.BOOSTER_ENERGY) {
                return;
            }
            c.consumeItem();
            c.setBoosterEnergyActive(true);
            ctx.log().add(c.side(), ActionKind.ITEM_TRIGGER, c.name(), null, "boosterenergy", Outcome.APPLIED);
        }
        Stat boosted = StatMath.highestStat(c);
        c.setParadoxStat(boosted);
        ctx.log().add(c.side(), ActionKind.ABILITY_TRIGGER, c.name(), null, c.ability().id() + ":" + boosted.id(), Outcome.APPLIED);
    }
}
