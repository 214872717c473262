package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.MoveSlot;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.VolatileState;
import org.pokeai.runtime.rules.AbilityKind;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.ItemKind;
import org.pokeai.runtime.rules.MoveCategory;
import org.pokeai.runtime.rules.MoveData;
import org.pokeai.runtime.rules.MoveEffect;
import org.pokeai.runtime.rules.MoveFlag;
import org.pokeai.runtime.rules.SecondaryEffect;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.VolatileKind;
import org.pokeai.runtime.rules.Weather;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves one use of a move: PP and lock bookkeeping, the pre-hit gates (target present,
 * Sucker Punch, Psychic Terrain, Prankster, Protect, Good as Gold, Magic Bounce, Substitute,
 * absorbing abilities, accuracy), the per-hit damage loop and the move's primary effect.
 */
public class MoveExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(MoveExecutor.class);

    static final double SUBSTITUTE_COST = 0.25;
    static final double STRUGGLE_RECOIL = 0.25;
    static final double PROTECT_REPEAT_CHANCE = 1.0 / 3.0;

    private final BattleContext ctx;
    private final DamageCalculator damage;
    private final AccuracyResolver accuracy;
    private final StatusEngine status;
    private final StatChanges statChanges;
    private final FieldEffectsEngine field;
    private final AbilityEffects abilities;
    private final ItemEffects items;

    public MoveExecutor(BattleContext ctx, DamageCalculator damage, AccuracyResolver accuracy, StatusEngine status,
                        StatChanges statChanges, FieldEffectsEngine field, AbilityEffects abilities, ItemEffects items) {
        this.ctx = ctx;
        this.damage = damage;
        this.accuracy = accuracy;
        this.status = status;
        this.statChanges = statChanges;
        this.field = field;
        this.abilities = abilities;
        this.items = items;
    }

    /**
     * Effective priority of a move for this user.
     */
    public static int priorityOf(Combatant user, MoveData move) {
        return move.priority() + AbilityEffects.priorityBonus(user, move);
    }

    /**
     * Uses {@code move} against the opposing active combatant.
     *
     * @param slotIndex   move slot the PP is taken from, or -1 for Struggle
     * @param targetsMove the move the target chose this turn, or {@code null} if it chose none or switched
     */
    public void execute(Combatant user, MoveData move, int slotIndex, MoveData targetsMove) {
        BattleState state = ctx.state();
        Combatant target = state.foeOf(user);
        user.setMovedThisTurn(true);
        if (slotIndex >= 0) {
            MoveSlot slot = user.moveSlot(slotIndex);
            slot.spend();
            user.setLastMoveUsed(slot.moveId());
            items.lockChoice(user, slot.moveId());
        }
        if (move.effect().volatileKind() != VolatileKind.PROTECT) {
            user.setProtectStreak(0);
        }
        LOG.debug("Turn {}: {} uses {} against {}", state.turn(), user, move.id(), target);

        if (move.targetsSelf()) {
            ctx.log().addMove(user.side(), user.name(), user.name(), move.id(), Outcome.APPLIED, null, null, null, null);
            applyEffect(user, target, move);
            return;
        }
        if (target.isFainted()) {
            fail(user, null, move, Outcome.FAILED);
            return;
        }
        if (move.hasFlag(MoveFlag.REQUIRES_TARGET_ATTACK)
                && (targetsMove == null || !targetsMove.isDamaging() || target.hasMovedThisTurn())) {
            fail(user, target, move, Outcome.FAILED);
            return;
        }
        if (priorityOf(user, move) > 0 && ctx.field().terrain() == Terrain.PSYCHIC
                && FieldEffectsEngine.isGrounded(target, ctx.field())) {
            fail(user, target, move, Outcome.BLOCKED);
            return;
        }
        if (move.category() == MoveCategory.STATUS && user.hasAbility(AbilityKind.PRANKSTER)
                && target.hasType(ElementType.DARK)) {
            fail(user, target, move, Outcome.IMMUNE);
            return;
        }
        if (target.hasVolatile(VolatileKind.PROTECT)) {
            fail(user, target, move, Outcome.BLOCKED);
            return;
        }
        if (!move.isDamaging() && statusMoveBlocked(user, target, move)) {
            return;
        }
        if (abilities.tryAbsorb(user, target, AbilityEffects.moveType(user, move))) {
            return;
        }

        AccuracyResult hitCheck = accuracy.resolve(move, user, target, ctx.field(), ctx.random());
        if (!hitCheck.hit()) {
            ctx.log().addMove(user.side(), user.name(), target.name(), move.id(), Outcome.MISS, null, hitCheck.roll(), null, null);
            if (move.isDamaging()) {
                items.lifeOrbRecoil(user);
            }
            return;
        }
        if (!move.isDamaging()) {
            ctx.log().addMove(user.side(), user.name(), target.name(), move.id(), Outcome.APPLIED, null, hitCheck.roll(), null, null);
            applyEffect(user, target, move);
            return;
        }
        executeDamaging(user, target, move, hitCheck);
    }

    private void fail(Combatant user, Combatant target, MoveData move, Outcome outcome) {
        ctx.log().addMove(user.side(), user.name(), target == null ? null : target.name(), move.id(), outcome,
                null, null, null, null);
    }

    /**
     * Good as Gold, Magic Bounce and Substitute gates for status moves aimed at the opponent.
     *
     * @return whether the move is consumed by the gate
     */
    private boolean statusMoveBlocked(Combatant user, Combatant target, MoveData move) {
        if (AbilityEffects.defenderHas(target, AbilityKind.GOOD_AS_GOLD, user)) {
            ctx.log().add(target.side(), ActionKind.ABILITY_TRIGGER, target.name(), user.name(),
                    target.ability().id() + ":" + move.id(), Outcome.BLOCKED);
            return true;
        }
        MoveEffect effect = move.effect();
        boolean reflectable = effect.hazard() != null || effect.status() != null || effect.volatileKind() != null
                || !effect.targetBoosts().isEmpty();
        if (reflectable && AbilityEffects.defenderHas(target, AbilityKind.MAGIC_BOUNCE, user)) {
            ctx.log().add(target.side(), ActionKind.ABILITY_TRIGGER, target.name(), user.name(),
                    target.ability().id() + ":" + move.id(), Outcome.APPLIED);
            applyEffect(target, user, move);
            return true;
        }
        boolean hitsSubstitute = effect.status() != null || effect.volatileKind() != null || !effect.targetBoosts().isEmpty();
        if (hitsSubstitute && target.hasVolatile(VolatileKind.SUBSTITUTE) && !bypassesSubstitute(user, move)) {
            fail(user, target, move, Outcome.BLOCKED);
            return true;
        }
        return false;
    }

    private static boolean bypassesSubstitute(Combatant user, MoveData move) {
        return move.hasFlag(MoveFlag.SOUND) || user.hasAbility(AbilityKind.INFILTRATOR);
    }

    private void executeDamaging(Combatant user, Combatant target, MoveData move, AccuracyResult hitCheck) {
        int hits = hitCount(user, move);
        int totalDealt = 0;
        int landed = 0;
        boolean sheerForce = user.hasAbility(AbilityKind.SHEER_FORCE) && move.secondary() != null;
        for (int i = 0; i < hits && !target.isFainted() && !user.isFainted(); i++) {
            Double roll = i == 0 ? hitCheck.roll() : null;
            DamageResult result = damage.calculate(user, target, move, ctx.state(), ctx.random());
            if (result.isImmune()) {
                ctx.log().addMove(user.side(), user.name(), target.name(), move.id(), Outcome.IMMUNE, 0, roll, false, 0.0);
                break;
            }
            if (result.damage() == 0) {
                ctx.log().addMove(user.side(), user.name(), target.name(), move.id(), Outcome.FAILED, 0, roll,
                        false, result.effectiveness());
                break;
            }
            landed++;
            VolatileState substitute = target.volatileState(VolatileKind.SUBSTITUTE);
            if (substitute != null && !bypassesSubstitute(user, move)) {
                int absorbed = Math.min(result.damage(), substitute.counter());
                substitute.setCounter(substitute.counter() - absorbed);
                totalDealt += absorbed;
                ctx.log().addMove(user.side(), user.name(), target.name(), move.id() + ":substitute", Outcome.HIT,
                        absorbed, roll, result.criticalHit(), result.effectiveness());
                if (substitute.counter() <= 0) {
                    target.removeVolatile(VolatileKind.SUBSTITUTE);
                    ctx.log().add(target.side(), ActionKind.MOVE, user.name(), target.name(), "volatile:substitute", Outcome.EXPIRED);
                }
                continue;
            }
            int dealt = target.takeDamage(items.applyFocusSash(target, result.damage()));
            target.recordDamageTaken(move.category(), dealt);
            totalDealt += dealt;
            ctx.log().addMove(user.side(), user.name(), target.name(), move.id(), Outcome.HIT, dealt, roll,
                    result.criticalHit(), result.effectiveness());
            if (move.hasFlag(MoveFlag.CONTACT)) {
                abilities.onContact(user, target);
                items.onContact(user, target);
            }
            if (move.secondary() != null && !sheerForce && !target.isFainted()) {
                applySecondary(user, target, move.secondary());
            }
            ctx.reportFaint(target);
        }
        if (move.isMultiHit() && landed > 0) {
            ctx.log().add(user.side(), ActionKind.MOVE, user.name(), target.name(), "hits:" + landed, Outcome.APPLIED);
        }
        if (landed == 0) {
            items.lifeOrbRecoil(user);
            return;
        }

        MoveEffect effect = move.effect();
        if (totalDealt > 0 && effect.recoilFraction() > 0.0) {
            ctx.indirectDamage(user, Math.max(1, (int) Math.floor(totalDealt * effect.recoilFraction())),
                    ActionKind.MOVE, "recoil");
        }
        if (totalDealt > 0 && effect.drainFraction() > 0.0) {
            ctx.restore(user, Math.max(1, (int) Math.floor(totalDealt * effect.drainFraction())), ActionKind.MOVE, "drain");
        }
        if (MoveData.STRUGGLE_ID.equals(move.id()) && !user.isFainted()) {
            int recoil = user.takeDamage(StatMath.fractionOf(user.maxHp(), STRUGGLE_RECOIL));
            ctx.log().addAmount(user.side(), ActionKind.MOVE, user.name(), user.name(), "recoil", Outcome.HIT, recoil);
        }
        if (!user.isFainted()) {
            applyEffect(user, target, move);
        }
        if (!sheerForce) {
            items.lifeOrbRecoil(user);
        }
        ctx.reportFaint(target);
        ctx.reportFaint(user);
    }

    /**
     * Number of hits for a multi-hit move. 2-5 hit moves land 2 or 3 hits 35% each and 4 or 5
     * hits 15% each; Loaded Dice makes every count in the range equally likely.
     */
    int hitCount(Combatant user, MoveData move) {
        if (move.minHits() == move.maxHits()) {
            return move.minHits();
        }
        if (ItemEffects.activeItem(user, ctx.field()) == ItemKind.LOADED_DICE
                || move.minHits() != 2 || move.maxHits() != 5) {
            return move.minHits() + ctx.random().nextInt(move.maxHits() - move.minHits() + 1);
        }
        double draw = ctx.random().nextDouble();
        if (draw < 0.35) {
            return 2;
        }
        if (draw < 0.70) {
            return 3;
        }
        return draw < 0.85 ? 4 : 5;
    }

    private void applySecondary(Combatant user, Combatant target, SecondaryEffect secondary) {
        if (ctx.random().nextInt(100) >= secondary.chance()) {
            return;
        }
        if (secondary.status() != null) {
            status.inflict(secondary.status(), target, user, ActionKind.MOVE, false);
        }
        if (secondary.volatileKind() != null && !target.hasVolatile(secondary.volatileKind())) {
            status.applyVolatile(secondary.volatileKind(), target, user);
        }
        if (!secondary.targetBoosts().isEmpty()) {
            statChanges.applyAll(target, secondary.targetBoosts(), user, ActionKind.MOVE);
        }
        if (!secondary.selfBoosts().isEmpty()) {
            statChanges.applyAll(user, secondary.selfBoosts(), user, ActionKind.MOVE);
        }
    }

    /**
     * Applies the primary effect of a move. Hazards land on the side opposing {@code user},
     * screens and tailwind on the user's side.
     */
    void applyEffect(Combatant user, Combatant target, MoveData move) {
        MoveEffect effect = move.effect();
        BattleState state = ctx.state();
        if (effect.status() != null) {
            status.inflict(effect.status(), target, user, ActionKind.MOVE, !move.isDamaging());
        }
        if (effect.volatileKind() != null) {
            switch (effect.volatileKind()) {
                case PROTECT -> protect(user);
                case SUBSTITUTE -> substitute(user);
                case IMPRISON -> status.applyVolatile(VolatileKind.IMPRISON, user, user);
                case PERISH_SONG -> {
                    status.applyVolatile(VolatileKind.PERISH_SONG, user, user);
                    if (!target.isFainted()) {
                        status.applyVolatile(VolatileKind.PERISH_SONG, target, user);
                    }
                }
                default -> status.applyVolatile(effect.volatileKind(), target, user);
            }
        }
        if (effect.hazard() != null) {
            field.placeHazard(effect.hazard(), state.opponentOf(user), user);
        }
        if (effect.screen() != null) {
            field.raiseScreen(effect.screen(), state.sideOf(user), user);
        }
        if (effect.fieldCondition() != null) {
            field.startCondition(effect.fieldCondition(), user);
        }
        if (effect.weather() != null) {
            field.setWeather(effect.weather(), ctx.rules().weather(effect.weather()).duration(), user, ActionKind.MOVE);
        }
        if (effect.terrain() != null) {
            field.setTerrain(effect.terrain(), user, ActionKind.MOVE);
        }
        if (effect.healFraction() > 0.0) {
            heal(user, move);
        }
        if (!effect.selfBoosts().isEmpty()) {
            statChanges.applyAll(user, effect.selfBoosts(), user, ActionKind.MOVE);
        }
        if (!effect.targetBoosts().isEmpty() && !target.isFainted()) {
            statChanges.applyAll(target, effect.targetBoosts(), user, ActionKind.MOVE);
        }
        if (effect.hazardClear() != null) {
            switch (effect.hazardClear()) {
                case DEFOG -> field.defog(user, state.opponentOf(user));
                case RAPID_SPIN -> field.rapidSpin(user);
                case COURT_CHANGE -> field.courtChange(user);
            }
        }
    }

    private void heal(Combatant user, MoveData move) {
        double fraction = move.effect().healFraction();
        Weather weather = ctx.field().weather();
        if (move.effect().weatherScaledHeal() && weather != Weather.NONE && weather != Weather.SUN) {
            fraction /= 2.0;
        }
        if (user.isAtFullHp()) {
            ctx.log().add(user.side(), ActionKind.MOVE, user.name(), user.name(), "heal", Outcome.FAILED);
            return;
        }
        ctx.restore(user, StatMath.fractionOf(user.maxHp(), fraction), ActionKind.MOVE, "heal");
    }

    /**
     * Protect succeeds with chance (1/3)^n after n consecutive successes.
     */
    private void protect(Combatant user) {
        int streak = user.protectStreak();
        boolean success = streak == 0 || ctx.random().nextDouble() < Math.pow(PROTECT_REPEAT_CHANCE, streak);
        if (!success) {
            user.setProtectStreak(0);
            ctx.log().add(user.side(), ActionKind.MOVE, user.name(), user.name(), "volatile:protect", Outcome.FAILED);
            return;
        }
        user.setProtectStreak(streak + 1);
        user.addVolatile(VolatileKind.PROTECT, VolatileState.ofTurns(1));
        ctx.log().add(user.side(), ActionKind.MOVE, user.name(), user.name(), "volatile:protect", Outcome.APPLIED);
    }

    /**
     * Substitute costs a quarter of max HP and absorbs that much damage.
     */
    private void substitute(Combatant user) {
        int cost = StatMath.fractionOf(user.maxHp(), SUBSTITUTE_COST);
        if (user.hasVolatile(VolatileKind.SUBSTITUTE) || user.hp() <= cost) {
            ctx.log().add(user.side(), ActionKind.MOVE, user.name(), user.name(), "volatile:substitute", Outcome.FAILED);
            return;
        }
        int paid = user.takeDamage(cost);
        user.addVolatile(VolatileKind.SUBSTITUTE, new VolatileState(0, paid, null, user.side()));
        ctx.log().addAmount(user.side(), ActionKind.MOVE, user.name(), user.name(), "volatile:substitute", Outcome.APPLIED, paid);
    }
}
