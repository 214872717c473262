package org.pokeai.runtime.mechanics;

import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.VolatileState;
import org.pokeai.runtime.rules.ElementType;
import org.pokeai.runtime.rules.StatusCondition;
import org.pokeai.runtime.rules.Terrain;
import org.pokeai.runtime.rules.VolatileKind;
import org.pokeai.runtime.spi.IRandomProvider;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Applies, checks and expires major status and volatile conditions.
 * <p>
 * Action-time checks run in the order flinch, sleep, freeze, paralysis, confusion. End-of-turn
 * work is split into the steps the turn orchestrator sequences: status damage, leech seed,
 * partial trapping, perish song and counter expiry.
 * </p>
 */
public class StatusEngine {

    static final double SLEEP_WAKE_CHANCE = 1.0 / 3.0;
    static final int MAX_SLEEP_TURNS = 3;
    static final double THAW_CHANCE = 0.2;
    static final double FULL_PARALYSIS_CHANCE = 0.25;
    static final double CONFUSION_SELF_HIT_CHANCE = 1.0 / 3.0;
    static final int MAX_CONFUSION_TURNS = 4;
    static final int TAUNT_TURNS = 3;
    static final int ENCORE_TURNS = 3;
    static final int DISABLE_TURNS = 4;
    static final int PERISH_COUNT = 3;

    /** Types that can never hold a given status. */
    private static final Map<StatusCondition, Set<ElementType>> TYPE_IMMUNITIES = new EnumMap<>(StatusCondition.class);

    static {
        TYPE_IMMUNITIES.put(StatusCondition.BURN, EnumSet.of(ElementType.FIRE));
        TYPE_IMMUNITIES.put(StatusCondition.PARALYSIS, EnumSet.of(ElementType.ELECTRIC));
        TYPE_IMMUNITIES.put(StatusCondition.POISON, EnumSet.of(ElementType.POISON, ElementType.STEEL));
        TYPE_IMMUNITIES.put(StatusCondition.BADLY_POISONED, EnumSet.of(ElementType.POISON, ElementType.STEEL));
        TYPE_IMMUNITIES.put(StatusCondition.FREEZE, EnumSet.of(ElementType.ICE));
        TYPE_IMMUNITIES.put(StatusCondition.SLEEP, EnumSet.noneOf(ElementType.class));
    }

    private final BattleContext ctx;
    private final DamageCalculator damage;

    public StatusEngine(BattleContext ctx, DamageCalculator damage) {
        this.ctx = ctx;
        this.damage = damage;
    }

    /**
     * Whether {@code status} could be placed on {@code target} right now.
     */
    public boolean canInflict(StatusCondition status, Combatant target) {
        if (status == StatusCondition.NONE || target.isFainted() || target.status() != StatusCondition.NONE) {
            return false;
        }
        for (ElementType type : target.types()) {
            if (TYPE_IMMUNITIES.get(status).contains(type)) {
                return false;
            }
        }
        if (FieldEffectsEngine.isGrounded(target, ctx.field())) {
            Terrain terrain = ctx.field().terrain();
            if (terrain == Terrain.MISTY) {
                return false;
            }
            if (terrain == Terrain.ELECTRIC && status == StatusCondition.SLEEP) {
                return false;
            }
        }
        return true;
    }

    /**
     * Places a major status if allowed.
     *
     * @param reportFailure whether a refused status is logged (true for status moves, false for secondary effects)
     * @return whether the status was applied
     */
    public boolean inflict(StatusCondition status, Combatant target, Combatant source, ActionKind kind,
                           boolean reportFailure) {
        if (!canInflict(status, target)) {
            if (reportFailure) {
                ctx.log().add(target.side(), kind, source == null ? null : source.name(), target.name(),
                        "status:" + status.id(), Outcome.FAILED);
            }
            return false;
        }
        target.setStatus(status);
        ctx.log().add(target.side(), kind, source == null ? null : source.name(), target.name(),
                "status:" + status.id(), Outcome.APPLIED);
        return true;
    }

    /**
     * Runs the action-time checks for a combatant about to move. Confusion self-hits are
     * applied here.
     *
     * @return whether the combatant may act
     */
    public boolean checkCanAct(Combatant actor) {
        IRandomProvider rng = ctx.random();
        if (actor.hasVolatile(VolatileKind.FLINCH)) {
            prevented(actor, "flinch");
            return false;
        }
        switch (actor.status()) {
            case SLEEP -> {
                if (actor.statusCounter() >= MAX_SLEEP_TURNS || rng.nextDouble() < SLEEP_WAKE_CHANCE) {
                    actor.clearStatus();
                    ctx.log().add(actor.side(), ActionKind.STATUS_TICK, actor.name(), actor.name(), "wake", Outcome.EXPIRED);
                } else {
                    actor.setStatusCounter(actor.statusCounter() + 1);
                    prevented(actor, "slp");
                    return false;
                }
            }
            case FREEZE -> {
                if (rng.nextDouble() < THAW_CHANCE) {
                    actor.clearStatus();
                    ctx.log().add(actor.side(), ActionKind.STATUS_TICK, actor.name(), actor.name(), "thaw", Outcome.EXPIRED);
                } else {
                    prevented(actor, "frz");
                    return false;
                }
            }
            case PARALYSIS -> {
                if (rng.nextDouble() < FULL_PARALYSIS_CHANCE) {
                    prevented(actor, "par");
                    return false;
                }
            }
            default -> {
                // no action-time effect
            }
        }
        VolatileState confusion = actor.volatileState(VolatileKind.CONFUSION);
        if (confusion != null) {
            if (confusion.turns() >= MAX_CONFUSION_TURNS) {
                actor.removeVolatile(VolatileKind.CONFUSION);
                ctx.log().add(actor.side(), ActionKind.STATUS_TICK, actor.name(), actor.name(), "confusion", Outcome.EXPIRED);
            } else {
                confusion.setTurns(confusion.turns() + 1);
                if (rng.nextDouble() < CONFUSION_SELF_HIT_CHANCE) {
                    int dealt = actor.takeDamage(damage.confusionDamage(actor));
                    ctx.log().addAmount(actor.side(), ActionKind.STATUS_TICK, actor.name(), actor.name(),
                            "confusion", Outcome.STATUS_PREVENTED, dealt);
                    ctx.reportFaint(actor);
                    return false;
                }
            }
        }
        return true;
    }

    private void prevented(Combatant actor, String reason) {
        ctx.log().add(actor.side(), ActionKind.STATUS_TICK, actor.name(), actor.name(), reason, Outcome.STATUS_PREVENTED);
    }

    /**
     * Applies a volatile condition to {@code target}. Protect and Substitute are handled by the
     * move executor because they need HP bookkeeping and success chances.
     *
     * @return whether the condition was applied
     */
    public boolean applyVolatile(VolatileKind kind, Combatant target, Combatant source) {
        if (target.isFainted()) {
            return false;
        }
        if (target.hasVolatile(kind)) {
            return failed(kind, target, source);
        }
        VolatileState state;
        switch (kind) {
            case CONFUSION, TORMENT, IMPRISON -> state = VolatileState.ofTurns(0);
            case FLINCH -> state = VolatileState.ofTurns(1);
            case TAUNT -> state = VolatileState.ofTurns(TAUNT_TURNS);
            case ENCORE, DISABLE -> {
                String last = target.lastMoveUsed();
                if (last == null || !target.knowsMove(last)) {
                    return failed(kind, target, source);
                }
                state = new VolatileState(kind == VolatileKind.ENCORE ? ENCORE_TURNS : DISABLE_TURNS, 0, last,
                        source == null ? null : source.side());
            }
            case PARTIAL_TRAP -> state = new VolatileState(4 + ctx.random().nextInt(2), 0, null,
                    source == null ? null : source.side());
            case LEECH_SEED -> {
                if (target.hasType(ElementType.GRASS)) {
                    ctx.log().add(target.side(), ActionKind.MOVE, source == null ? null : source.name(), target.name(),
                            "volatile:" + kind.id(), Outcome.IMMUNE);
                    return false;
                }
                state = new VolatileState(0, 0, null, source == null ? null : source.side());
            }
            case PERISH_SONG -> state = new VolatileState(0, PERISH_COUNT, null, null);
            default -> throw new IllegalArgumentException(kind + " is not applied through the status engine");
        }
        target.addVolatile(kind, state);
        ctx.log().add(target.side(), ActionKind.MOVE, source == null ? null : source.name(), target.name(),
                "volatile:" + kind.id(), Outcome.APPLIED);
        return true;
    }

    private boolean failed(VolatileKind kind, Combatant target, Combatant source) {
        ctx.log().add(target.side(), ActionKind.MOVE, source == null ? null : source.name(), target.name(),
                "volatile:" + kind.id(), Outcome.FAILED);
        return false;
    }

    /**
     * Burn and poison deal 1/8 max HP; badly poisoned deals {@code stacks/8} and adds a stack.
     */
    public void endOfTurnStatus(Combatant c) {
        if (c.isFainted()) {
            return;
        }
        switch (c.status()) {
            case BURN, POISON -> ctx.indirectDamage(c, StatMath.fractionOf(c.maxHp(), 1.0 / 8.0),
                    ActionKind.STATUS_TICK, c.status().id());
            case BADLY_POISONED -> {
                int stacks = Math.max(1, c.statusCounter());
                ctx.indirectDamage(c, StatMath.fractionOf(c.maxHp(), stacks / 8.0), ActionKind.STATUS_TICK,
                        c.status().id() + ":" + stacks);
                c.setStatusCounter(stacks + 1);
            }
            default -> {
                // no residual damage
            }
        }
    }

    /**
     * Leech seed drains 1/8 max HP from the holder into the opposing active combatant.
     */
    public void endOfTurnLeechSeed(Combatant c) {
        if (c.isFainted() || !c.hasVolatile(VolatileKind.LEECH_SEED)) {
            return;
        }
        BattleState state = ctx.state();
        int drained = ctx.indirectDamage(c, StatMath.fractionOf(c.maxHp(), 1.0 / 8.0), ActionKind.STATUS_TICK, "leechseed");
        Combatant seeder = state.foeOf(c);
        if (drained > 0 && !seeder.isFainted()) {
            ctx.restore(seeder, drained, ActionKind.STATUS_TICK, "leechseed");
        }
    }

    /**
     * Partial trapping deals 1/8 max HP per turn until its counter runs out.
     */
    public void endOfTurnTrapping(Combatant c) {
        VolatileState trap = c.volatileState(VolatileKind.PARTIAL_TRAP);
        if (c.isFainted() || trap == null) {
            return;
        }
        ctx.indirectDamage(c, StatMath.fractionOf(c.maxHp(), 1.0 / 8.0), ActionKind.STATUS_TICK, "partialtrap");
        trap.setTurns(trap.turns() - 1);
        if (trap.turns() <= 0 && !c.isFainted()) {
            c.removeVolatile(VolatileKind.PARTIAL_TRAP);
            ctx.log().add(c.side(), ActionKind.STATUS_TICK, c.name(), c.name(), "partialtrap", Outcome.EXPIRED);
        }
    }

    /**
     * Counts perish song down; the holder faints when the count reaches zero.
     */
    public void endOfTurnPerishSong(Combatant c) {
        VolatileState perish = c.volatileState(VolatileKind.PERISH_SONG);
        if (c.isFainted() || perish == null) {
            return;
        }
        perish.setCounter(perish.counter() - 1);
        ctx.log().add(c.side(), ActionKind.STATUS_TICK, c.name(), c.name(), "perishsong:" + perish.counter(), Outcome.APPLIED);
        if (perish.counter() <= 0) {
            c.takeDamage(c.hp());
            ctx.reportFaint(c);
        }
    }

    /**
     * Decrements timed volatiles and clears the single-turn ones (flinch, protect).
     */
    public void tickCounters(Combatant c) {
        c.removeVolatile(VolatileKind.FLINCH);
        c.removeVolatile(VolatileKind.PROTECT);
        if (c.isFainted()) {
            return;
        }
        for (VolatileKind kind : new VolatileKind[]{VolatileKind.TAUNT, VolatileKind.ENCORE, VolatileKind.DISABLE}) {
            VolatileState state = c.volatileState(kind);
            if (state == null) {
                continue;
            }
            state.setTurns(state.turns() - 1);
            boolean encoreExhausted = kind == VolatileKind.ENCORE
                    && (c.indexOfMove(state.moveId()) < 0 || !c.moveSlot(c.indexOfMove(state.moveId())).hasPp());
            if (state.turns() <= 0 || encoreExhausted) {
                c.removeVolatile(kind);
                ctx.log().add(c.side(), ActionKind.STATUS_TICK, c.name(), c.name(), kind.id(), Outcome.EXPIRED);
            }
        }
    }
}
