package org.pokeai.runtime;

import org.pokeai.runtime.internal.services.SeededRandomProvider;
import org.pokeai.runtime.mechanics.BattleContext;
import org.pokeai.runtime.mechanics.LegalActionResolver;
import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.model.BattleResult;
import org.pokeai.runtime.model.BattleState;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.LogEntry;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.SideState;
import org.pokeai.runtime.model.TurnPhase;
import org.pokeai.runtime.model.Winner;
import org.pokeai.runtime.policy.RandomActionSource;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.rules.RuleTables;
import org.pokeai.runtime.spi.DecisionContext;
import org.pokeai.runtime.spi.IActionSource;
import org.pokeai.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the engine: builds both sides from rosters, loops turns until one side is
 * out of combatants or the turn cap is reached, and returns the result with the full log.
 * <p>
 * A simulation instance holds only read-only rule tables and format rules and may be shared
 * between threads; every call owns its own battle state and random stream.
 * </p>
 */
public class BattleSimulation {

    private static final Logger LOG = LoggerFactory.getLogger(BattleSimulation.class);

    private final RuleTables rules;
    private final FormatRules format;

    public BattleSimulation(RuleTables rules, FormatRules format) {
        this.rules = rules;
        this.format = format;
    }

    public RuleTables rules() {
        return rules;
    }

    public FormatRules format() {
        return format;
    }

    /**
     * Simulates a battle between two random policies. Each policy draws from its own stream
     * derived from {@code seed}, so the battle is fully determined by the seed.
     */
    public BattleResult simulate(List<CombatantSpec> rosterA, List<CombatantSpec> rosterB, int maxTurns, long seed) {
        IRandomProvider random = new SeededRandomProvider(seed);
        return simulate(rosterA, rosterB, maxTurns, random,
                new RandomActionSource(random.deriveFor("policy", Side.A.ordinal())),
                new RandomActionSource(random.deriveFor("policy", Side.B.ordinal())));
    }

    /**
     * Simulates a battle with the given random stream and action sources.
     *
     * @throws IllegalArgumentException if {@code maxTurns < 1} or a roster is invalid
     */
    public BattleResult simulate(List<CombatantSpec> rosterA, List<CombatantSpec> rosterB, int maxTurns,
                                 IRandomProvider random, IActionSource sourceA, IActionSource sourceB) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1, got " + maxTurns);
        }
        CombatantFactory factory = new CombatantFactory(rules, format);
        List<LogEntry> notes = new ArrayList<>();
        SideState sideA = factory.buildSide(Side.A, rosterA, notes);
        SideState sideB = factory.buildSide(Side.B, rosterB, notes);
        BattleState state = new BattleState(sideA, sideB);
        notes.forEach(state.log()::append);

        TurnOrchestrator orchestrator = new TurnOrchestrator(new BattleContext(rules, format, state, random));
        orchestrator.startBattle();

        int turns = 0;
        while (turns < maxTurns && sideA.hasLivingCombatants() && sideB.hasLivingCombatants()) {
            BattleAction actionA = obtainAction(Side.A, sourceA, state);
            BattleAction actionB = obtainAction(Side.B, sourceB, state);
            TurnPhase phase = orchestrator.playTurn(actionA, actionB);
            turns++;
            if (phase == TurnPhase.BATTLE_OVER) {
                break;
            }
            replaceFaintedActives(orchestrator, state, sourceA, sourceB);
        }

        Winner winner = decideWinner(sideA, sideB);
        LOG.debug("Battle finished after {} turns: {} ({} log entries)", turns, winner, state.log().size());
        return new BattleResult(winner, turns, state.log().entries());
    }

    private BattleAction obtainAction(Side side, IActionSource source, BattleState state) {
        List<BattleAction> legal = LegalActionResolver.legalActions(side, state, format);
        BattleAction chosen = source.chooseAction(new DecisionContext(side, state, legal, format));
        if (chosen != null && legal.contains(chosen)) {
            return chosen;
        }
        BattleAction forced = legal.stream()
                .filter(a -> a.isAttack() && !a.terastallize())
                .findFirst()
                .orElse(legal.get(0));
        forcedDefault(side, state, chosen, forced);
        return forced;
    }

    /**
     * Replaces fainted actives until both sides have a living active combatant or an empty
     * bench. A replacement that faints to hazards is replaced again.
     */
    private void replaceFaintedActives(TurnOrchestrator orchestrator, BattleState state,
                                       IActionSource sourceA, IActionSource sourceB) {
        boolean replaced;
        do {
            replaced = false;
            for (Side side : Side.values()) {
                SideState own = state.side(side);
                if (!own.active().isFainted() || !own.hasLivingCombatants()) {
                    continue;
                }
                List<BattleAction> legal = LegalActionResolver.replacementActions(side, state);
                IActionSource source = side == Side.A ? sourceA : sourceB;
                BattleAction chosen = source.chooseReplacement(new DecisionContext(side, state, legal, format));
                if (chosen == null || !legal.contains(chosen)) {
                    forcedDefault(side, state, chosen, legal.get(0));
                    chosen = legal.get(0);
                }
                orchestrator.replaceFainted(side, chosen.index());
                replaced = true;
            }
        } while (replaced && state.side(Side.A).hasLivingCombatants() && state.side(Side.B).hasLivingCombatants());
    }

    private void forcedDefault(Side side, BattleState state, BattleAction chosen, BattleAction forced) {
        LOG.warn("Side {} submitted {} which is not legal on turn {}, using {}", side, chosen, state.turn() + 1, forced);
        state.log().append(LogEntry.event(state.turn(), side, ActionKind.FORCED_DEFAULT,
                state.side(side).active().name(), null, String.valueOf(chosen) + "->" + forced, Outcome.DEFAULTED));
    }

    private static Winner decideWinner(SideState sideA, SideState sideB) {
        boolean aAlive = sideA.hasLivingCombatants();
        boolean bAlive = sideB.hasLivingCombatants();
        if (aAlive && !bAlive) {
            return Winner.SIDE_A;
        }
        if (bAlive && !aAlive) {
            return Winner.SIDE_B;
        }
        return Winner.TIE;
    }
}
