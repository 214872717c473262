package org.pokeai.runtime;

import org.pokeai.runtime.mechanics.AbilityEffects;
import org.pokeai.runtime.mechanics.AccuracyResolver;
import org.pokeai.runtime.mechanics.BattleContext;
import org.pokeai.runtime.mechanics.DamageCalculator;
import org.pokeai.runtime.mechanics.FieldEffectsEngine;
import org.pokeai.runtime.mechanics.ItemEffects;
import org.pokeai.runtime.mechanics.LegalActionResolver;
import org.pokeai.runtime.mechanics.MoveExecutor;
import org.pokeai.runtime.mechanics.StatChanges;
import org.pokeai.runtime.mechanics.StatMath;
import org.pokeai.runtime.mechanics.StatusEngine;
import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.model.TurnPhase;
import org.pokeai.runtime.rules.FieldCondition;
import org.pokeai.runtime.rules.MoveData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs one turn at a time: Tera transformations, order determination, both action steps and
 * the fixed end-of-turn sequence. Owns the mechanics engines of one battle.
 * <p>
 * End of turn runs, for the active combatants in speed order: status damage, leech seed and
 * trapping, weather, terrain, held items, perish song, counter expiry, field condition
 * countdown, then Protosynthesis / Quark Drive refresh. Every damaging step reports faints
 * as they happen.
 * </p>
 */
public class TurnOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(TurnOrchestrator.class);

    /** Switches always act before moves. */
    public static final int SWITCH_PRIORITY = 7;

    private final BattleContext ctx;
    private final StatusEngine status;
    private final FieldEffectsEngine field;
    private final AbilityEffects abilities;
    private final ItemEffects items;
    private final MoveExecutor moves;

    private TurnPhase phase = TurnPhase.AWAITING_ACTIONS;

    public TurnOrchestrator(BattleContext ctx) {
        this.ctx = ctx;
        DamageCalculator damage = new DamageCalculator(ctx.rules());
        StatChanges statChanges = new StatChanges(ctx);
        this.status = new StatusEngine(ctx, damage);
        this.field = new FieldEffectsEngine(ctx, status, statChanges);
        this.abilities = new AbilityEffects(ctx, statChanges, field, status);
        this.items = new ItemEffects(ctx);
        this.moves = new MoveExecutor(ctx, damage, new AccuracyResolver(), status, statChanges, field, abilities, items);
    }

    public TurnPhase phase() {
        return phase;
    }

    public BattleContext context() {
        return ctx;
    }

    /**
     * Sends out both leads at turn 0, faster lead first: hazards, then switch-in abilities, then
     * Protosynthesis / Quark Drive.
     */
    public void startBattle() {
        BattleState state = ctx.state();
        List<Combatant> leads = speedOrder();
        for (Combatant lead : leads) {
            ctx.log().add(lead.side(), ActionKind.SWITCH, lead.name(), null, "lead", Outcome.SWITCHED);
        }
        for (Combatant lead : leads) {
            switchIn(lead);
        }
        LOG.debug("Battle started: {} vs {}", state.side(Side.A).active(), state.side(Side.B).active());
    }

    /**
     * Plays one turn with two legal actions.
     *
     * @return {@link TurnPhase#BATTLE_OVER} if a side has no combatant left, otherwise {@link TurnPhase#CONTINUE}
     */
    public TurnPhase playTurn(BattleAction actionA, BattleAction actionB) {
        BattleState state = ctx.state();
        phase = TurnPhase.AWAITING_ACTIONS;
        ctx.field().setTurn(ctx.field().turn() + 1);
        for (Side side : Side.values()) {
            Combatant active = state.side(side).active();
            active.beginTurn();
            items.releaseExhaustedLock(active);
        }
        terastallizeIfRequested(Side.A, actionA);
        terastallizeIfRequested(Side.B, actionB);

        Pending pendingA = pending(Side.A, actionA);
        Pending pendingB = pending(Side.B, actionB);
        boolean aFirst = goesFirst(pendingA, pendingB);
        Pending first = aFirst ? pendingA : pendingB;
        Pending second = aFirst ? pendingB : pendingA;
        phase = TurnPhase.ORDER_DETERMINED;
        LOG.debug("Turn {}: {} {} acts before {} {}", state.turn(), first.side(), first.action(), second.side(), second.action());

        phase = TurnPhase.EXECUTING_FIRST;
        execute(first, second);
        if (!bothSidesStanding()) {
            return phase = TurnPhase.BATTLE_OVER;
        }
        phase = TurnPhase.EXECUTING_SECOND;
        execute(second, first);
        if (!bothSidesStanding()) {
            return phase = TurnPhase.BATTLE_OVER;
        }

        phase = TurnPhase.END_OF_TURN;
        endOfTurn();
        phase = bothSidesStanding() ? TurnPhase.CONTINUE : TurnPhase.BATTLE_OVER;
        return phase;
    }

    private boolean bothSidesStanding() {
        return ctx.state().side(Side.A).hasLivingCombatants() && ctx.state().side(Side.B).hasLivingCombatants();
    }

    private void terastallizeIfRequested(Side side, BattleAction action) {
        SideState own = ctx.state().side(side);
        Combatant active = own.active();
        if (!action.terastallize() || !LegalActionResolver.canTerastallize(own, active, ctx.format())) {
            return;
        }
        active.terastallize();
        own.markTeraUsed();
        ctx.log().add(side, ActionKind.TERASTALLIZE, active.name(), null, "tera:" + active.teraType().id(), Outcome.APPLIED);
    }

    private record Pending(Side side, BattleAction action, Combatant actor, MoveData move, int priority) {
    }

    private Pending pending(Side side, BattleAction action) {
        Combatant actor = ctx.state().side(side).active();
        return switch (action.kind()) {
            case SWITCH -> new Pending(side, action, actor, null, SWITCH_PRIORITY);
            case STRUGGLE -> new Pending(side, action, actor, MoveData.STRUGGLE, MoveExecutor.priorityOf(actor, MoveData.STRUGGLE));
            case MOVE -> {
                MoveData move = actor.moveSlot(action.index()).move();
                yield new Pending(side, action, actor, move, MoveExecutor.priorityOf(actor, move));
            }
        };
    }

    /**
     * Higher priority first; within a bracket Quick Claw, then effective speed (inverted under
     * Trick Room), then a coin flip.
     */
    private boolean goesFirst(Pending a, Pending b) {
        if (a.priority() != b.priority()) {
            return a.priority() > b.priority();
        }
        if (!a.action().isSwitch() && !b.action().isSwitch()) {
            boolean clawA = items.quickClawActivates(a.actor());
            boolean clawB = items.quickClawActivates(b.actor());
            if (clawA != clawB) {
                return clawA;
            }
        }
        return compareSpeed(a.actor(), b.actor());
    }

    private boolean compareSpeed(Combatant a, Combatant b) {
        double speedA = StatMath.effectiveSpeed(a, ctx.state());
        double speedB = StatMath.effectiveSpeed(b, ctx.state());
        if (speedA != speedB) {
            boolean faster = speedA > speedB;
            return ctx.field().isActive(FieldCondition.TRICK_ROOM) != faster;
        }
        return ctx.random().nextInt(2) == 0;
    }

    /**
     * Both active combatants, the one that would move first in a speed contest first.
     */
    private List<Combatant> speedOrder() {
        Combatant a = ctx.state().side(Side.A).active();
        Combatant b = ctx.state().side(Side.B).active();
        return compareSpeed(a, b) ? List.of(a, b) : List.of(b, a);
    }

    private void execute(Pending pending, Pending other) {
        SideState own = ctx.state().side(pending.side());
        if (pending.action().isSwitch()) {
            if (!pending.actor().isFainted()) {
                performSwitch(own, pending.action().index());
            }
            return;
        }
        Combatant actor = own.active();
        if (actor != pending.actor() || actor.isFainted()) {
            return;
        }
        if (!status.checkCanAct(actor)) {
            actor.setMovedThisTurn(true);
            return;
        }
        MoveData targetsMove = other.action().isSwitch() ? null : other.move();
        moves.execute(actor, pending.move(), pending.action().index(), targetsMove);
    }

    /**
     * Voluntary switch: Regenerator and the switch-out reset for the outgoing combatant, then
     * switch-in effects for the incoming one.
     */
    public void performSwitch(SideState side, int rosterIndex) {
        Combatant out = side.active();
        Combatant in = side.member(rosterIndex);
        if (in.isFainted() || rosterIndex == side.activeIndex()) {
            throw new BattleInvariantViolation("Illegal switch target " + in + " on side " + side.side());
        }
        abilities.onSwitchOut(out);
        out.onSwitchOut();
        side.setActive(rosterIndex);
        in.setMovedThisTurn(true);
        ctx.log().add(side.side(), ActionKind.SWITCH, in.name(), out.name(), "switch", Outcome.SWITCHED);
        switchIn(in);
    }

    /**
     * Brings in a replacement for a fainted active combatant.
     */
    public void replaceFainted(Side side, int rosterIndex) {
        SideState own = ctx.state().side(side);
        Combatant out = own.active();
        Combatant in = own.member(rosterIndex);
        if (!out.isFainted() || in.isFainted()) {
            throw new BattleInvariantViolation("Illegal replacement " + in + " for " + out);
        }
        out.onSwitchOut();
        own.setActive(rosterIndex);
        ctx.log().add(side, ActionKind.SWITCH, in.name(), out.name(), "replace", Outcome.SWITCHED);
        switchIn(in);
    }

    private void switchIn(Combatant in) {
        field.applyEntryHazards(in);
        if (in.isFainted()) {
            return;
        }
        abilities.onSwitchIn(in);
        for (Combatant c : speedOrder()) {
            abilities.refreshParadox(c);
        }
    }

    private void endOfTurn() {
        List<Combatant> order = speedOrder();
        order.forEach(status::endOfTurnStatus);
        for (Combatant c : order) {
            status.endOfTurnLeechSeed(c);
            status.endOfTurnTrapping(c);
        }
        field.endOfTurnWeather(order);
        field.endOfTurnTerrain(order);
        order.forEach(items::endOfTurn);
        order.forEach(status::endOfTurnPerishSong);
        order.forEach(status::tickCounters);
        field.tickConditions();
        order.forEach(abilities::refreshParadox);
        LOG.debug("Turn {} ended: {} / {}", ctx.state().turn(), order.get(0), order.get(1));
    }
}
