package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.FieldState;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.MoveCategory;
import org.pokeai.runtime.rules.MoveData;
import org.pokeai.runtime.rules.MoveFlag;
import org.pokeai.runtime.rules.RuleTables;
import org.pokeai.runtime.rules.ScreenKind;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.TerrainData;
import org.pokeai.runtime.rules.WeatherData;
import org.pokeai.runtime.spi.IRandomProvider;

/**
 * Computes the damage of one hit. Apart from the two random draws (critical hit first, then the
 * damage roll) the result depends only on its arguments; nothing is mutated.
 * <p>
 * Order of application: stat pair with boosts, level factor, type effectiveness, critical hit
 * (doubles the level factor), STAB, weather and terrain, screens, ability and item power
 * modifiers, damage roll in [0.85, 1.00], burn halving of physical damage. The result is
 * floored and at least 1.
 * </p>
 */
public class DamageCalculator {

    public static final double CRIT_CHANCE = 1.0 / 16.0;
    private static final int CONFUSION_POWER = 40;

    private final RuleTables rules;

    public DamageCalculator(RuleTables rules) {
        this.rules = rules;
    }

    /**
     * Calculates the damage {@code move} deals from {@code attacker} to {@code defender}.
     *
     * @param attacker the attacking combatant
     * @param defender the defending combatant
     * @param move     the move used
     * @param state    the battle state (field and sides are read, never written)
     * @param rng      the battle's random source
     * @return the damage, critical-hit flag and effectiveness
     */
    public DamageResult calculate(Combatant attacker, Combatant defender, MoveData move, BattleState state,
                                  IRandomProvider rng) {
        if (!move.isDamaging()) {
            return DamageResult.NO_DAMAGE;
        }
        FieldState field = state.field();
        ElementType moveType = AbilityEffects.moveType(attacker, move);
        double effectiveness = effectiveness(moveType, attacker, defender, field);

        if (move.effect().fixedDamage() != null) {
            return fixedDamage(attacker, defender, move, effectiveness);
        }
        if (effectiveness == 0.0) {
            return DamageResult.immune();
        }

        boolean physical = move.category() == MoveCategory.PHYSICAL;
        double attack = attackStat(attacker, defender, physical, field);
        double defense = defenseStat(defender, attacker, physical, field);

        double levelFactor = (2.0 * attacker.level() + 10.0) / 250.0;
        boolean critical = rng.nextDouble() < CRIT_CHANCE;
        if (critical) {
            levelFactor *= 2.0;
        }

        double base = levelFactor * attack * move.power() / defense + 2.0;
        double modifier = effectiveness
                * stab(attacker, moveType)
                * weatherModifier(moveType, field)
                * terrainModifier(attacker, defender, move, moveType, field)
                * screenModifier(attacker, state.sideOf(defender), move.category())
                * powerModifier(attacker, move, moveType, field);
        double roll = (85 + rng.nextInt(16)) / 100.0;

        int damage = (int) Math.floor(base * modifier * roll);
        if (physical && attacker.hasStatus(StatusCondition.BURN)) {
            damage = damage / 2;
        }
        return new DamageResult(Math.max(1, damage), critical, effectiveness);
    }

    /**
     * Type-effectiveness of a move type against the defender's current types, including
     * Levitate and the grounding effect of Gravity.
     */
    public double effectiveness(ElementType moveType, Combatant attacker, Combatant defender, FieldState field) {
        if (moveType == ElementType.TYPELESS) {
            return 1.0;
        }
        boolean gravity = field.isActive(FieldCondition.GRAVITY);
        double result = 1.0;
        for (ElementType type : defender.types()) {
            double multiplier = rules.typeChart().against(moveType, type);
            if (multiplier == 0.0 && gravity && moveType == ElementType.GROUND && type == ElementType.FLYING) {
                multiplier = 1.0;
            }
            result *= multiplier;
        }
        if (moveType == ElementType.GROUND && !gravity
                && AbilityEffects.defenderHas(defender, AbilityKind.LEVITATE, attacker)) {
            return 0.0;
        }
        return result;
    }

    /**
     * Self-inflicted confusion damage: a 40-power typeless physical hit without roll or critical hit.
     */
    public int confusionDamage(Combatant combatant) {
        double attack = combatant.stat(Stat.ATTACK) * StatMath.boostMultiplier(combatant.boost(Stat.ATTACK));
        double defense = combatant.stat(Stat.DEFENSE) * StatMath.boostMultiplier(combatant.boost(Stat.DEFENSE));
        double levelFactor = (2.0 * combatant.level() + 10.0) / 250.0;
        return Math.max(1, (int) Math.floor(levelFactor * attack * CONFUSION_POWER / defense + 2.0));
    }

    private DamageResult fixedDamage(Combatant attacker, Combatant defender, MoveData move, double effectiveness) {
        if (effectiveness == 0.0) {
            return DamageResult.immune();
        }
        int amount = switch (move.effect().fixedDamage()) {
            case LEVEL -> attacker.level();
            case HALF_CURRENT_HP -> Math.max(1, defender.hp() / 2);
            case ENDEAVOR -> Math.max(0, defender.hp() - attacker.hp());
            case COUNTER -> 2 * attacker.damageTakenThisTurn(MoveCategory.PHYSICAL);
            case MIRROR_COAT -> 2 * attacker.damageTakenThisTurn(MoveCategory.SPECIAL);
        };
        return new DamageResult(amount, false, 1.0);
    }

    private double attackStat(Combatant attacker, Combatant defender, boolean physical, FieldState field) {
        Stat stat = physical ? Stat.ATTACK : Stat.SPECIAL_ATTACK;
        double value = attacker.stat(stat);
        if (!AbilityEffects.defenderHas(defender, AbilityKind.UNAWARE, attacker)) {
            value *= StatMath.boostMultiplier(attacker.boost(stat));
        }
        ItemKind item = ItemEffects.activeItem(attacker, field);
        if ((physical && item == ItemKind.CHOICE_BAND) || (!physical && item == ItemKind.CHOICE_SPECS)) {
            value *= 1.5;
        }
        if (attacker.paradoxStat() == stat) {
            value *= 1.3;
        }
        return value;
    }

    private double defenseStat(Combatant defender, Combatant attacker, boolean physical, FieldState field) {
        Stat stat = physical ? Stat.DEFENSE : Stat.SPECIAL_DEFENSE;
        Stat rawStat = stat;
        if (field.isActive(FieldCondition.WONDER_ROOM)) {
            rawStat = physical ? Stat.SPECIAL_DEFENSE : Stat.DEFENSE;
        }
        double value = defender.stat(rawStat);
        if (!attacker.hasAbility(AbilityKind.UNAWARE)) {
            value *= StatMath.boostMultiplier(defender.boost(stat));
        }
        WeatherData weather = rules.weather(field.weather());
        if (weather.defenseBoostStat() == stat && weather.defenseBoostType() != null
                && defender.hasType(weather.defenseBoostType())) {
            value *= 1.5;
        }
        if (!physical && ItemEffects.activeItem(defender, field) == ItemKind.ASSAULT_VEST) {
            value *= 1.5;
        }
        if (defender.paradoxStat() == stat) {
            value *= 1.3;
        }
        return value;
    }

    /**
     * Same-type bonus. Original types and the Tera type both count; a Tera type matching an
     * original type gives 2.0.
     */
    double stab(Combatant attacker, ElementType moveType) {
        if (moveType == ElementType.TYPELESS) {
            return 1.0;
        }
        boolean original = attacker.originalTypes().contains(moveType);
        if (attacker.isTerastallized() && attacker.teraType() == moveType) {
            return original ? 2.0 : 1.5;
        }
        return original ? 1.5 : 1.0;
    }

    private double weatherModifier(ElementType moveType, FieldState field) {
        WeatherData weather = rules.weather(field.weather());
        if (moveType == weather.boostedType()) {
            return 1.5;
        }
        if (moveType == weather.weakenedType()) {
            return 0.5;
        }
        return 1.0;
    }

    private double terrainModifier(Combatant attacker, Combatant defender, MoveData move, ElementType moveType,
                                   FieldState field) {
        if (field.terrain() == Terrain.NONE) {
            return 1.0;
        }
        TerrainData terrain = rules.terrain(field.terrain());
        double modifier = 1.0;
        if (moveType == terrain.boostedType() && FieldEffectsEngine.isGrounded(attacker, field)) {
            modifier *= terrain.boost();
        }
        if (field.terrain() == Terrain.GRASSY && move.hasFlag(MoveFlag.GRASSY_HALVED)
                && FieldEffectsEngine.isGrounded(defender, field)) {
            modifier *= 0.5;
        }
        return modifier;
    }

    private double screenModifier(Combatant attacker, SideState defenderSide, MoveCategory category) {
        if (attacker.hasAbility(AbilityKind.INFILTRATOR)) {
            return 1.0;
        }
        for (ScreenKind screen : ScreenKind.values()) {
            if (defenderSide.hasScreen(screen) && screen.covers(category)) {
                return 0.5;
            }
        }
        return 1.0;
    }

    private double powerModifier(Combatant attacker, MoveData move, ElementType moveType, FieldState field) {
        double modifier = 1.0;
        if (attacker.hasAbility(AbilityKind.TECHNICIAN) && move.power() <= 60) {
            modifier *= 1.5;
        }
        if (attacker.hasAbility(AbilityKind.SHEER_FORCE) && move.secondary() != null) {
            modifier *= 1.3;
        }
        if (attacker.hasAbility(AbilityKind.TYPE_CHANGE_BOOST) && move.type() == ElementType.NORMAL
                && moveType != ElementType.NORMAL) {
            modifier *= 1.2;
        }
        if (attacker.isFlashFireActive() && moveType == ElementType.FIRE) {
            modifier *= 1.5;
        }
        if (ItemEffects.activeItem(attacker, field) == ItemKind.LIFE_ORB) {
            modifier *= 1.3;
        }
        return modifier;
    }
}
