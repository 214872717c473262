package org.pokeai.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pokeai.junit.extensions.logging.ExpectLog;
import org.pokeai.junit.extensions.logging.LogLevel;
import org.pokeai.junit.extensions.logging.LogWatchExtension;
import org.pokeai.runtime.internal.services.SeededRandomProvider;
import org.pokeai.runtime.model.ActionKind;
import org.pokeai.runtime.model.BattleAction;
import org.pokeai.runtime.model.BattleResult;
import org.pokeai.runtime.model.Combatant;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.LogEntry;
import org.pokeai.runtime.model.Outcome;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.Winner;
import org.pokeai.runtime.policy.FirstLegalActionSource;
import org.pokeai.runtime.policy.RandomActionSource;
import org.pokeai.runtime.policy.ScriptedActionSource;
import org.pokeai.runtime.rules.FormatRules;
import org.pokeai.runtime.rules.Stat;
import org.pokeai.runtime.spi.DecisionContext;
import org.pokeai.runtime.spi.IActionSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class BattleSimulationTest {

    private static final BattleSimulation SIMULATION = new BattleSimulation(BattleFixture.RULES, FormatRules.unrestricted());

    private static List<CombatantSpec> teamA() {
        return List.of(
                CombatantSpec.of("garchomp", null, "lifeorb", "earthquake", "dragonclaw", "stealthrock", "swordsdance").withTeraType("steel"),
                CombatantSpec.of("toxapex", null, "blacksludge", "toxic", "recover", "surf", "toxicspikes"),
                CombatantSpec.of("pelipper", null, "leftovers", "hurricane", "surf", "defog", "roost"));
    }

    private static List<CombatantSpec> teamB() {
        return List.of(
                CombatantSpec.of("tyranitar", null, "leftovers", "stoneedge", "crunch", "stealthrock", "thunderwave"),
                CombatantSpec.of("gholdengo", null, "choicescarf", "makeitrain", "shadowball", "nastyplot", "recover"),
                CombatantSpec.of("rillaboom", null, "choiceband", "woodhammer", "leechseed", "knockoff", "grassyglide"));
    }

    @Test
    void maxTurnsBelowOneIsRejected() {
        assertThatThrownBy(() -> SIMULATION.simulate(teamA(), teamB(), 0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyRosterIsRejected() {
        assertThatThrownBy(() -> SIMULATION.simulate(List.of(), teamB(), 10, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reachingTheTurnCapIsATie() {
        List<CombatantSpec> a = List.of(CombatantSpec.of("blissey", null, null, "recover"));
        List<CombatantSpec> b = List.of(CombatantSpec.of("blissey", null, null, "recover"));

        BattleResult result = SIMULATION.simulate(a, b, 1, 5L);

        assertThat(result.winner()).isEqualTo(Winner.TIE);
        assertThat(result.turnCount()).isEqualTo(1);
    }

    @Test
    void sameSeedReplaysTheSameBattle() {
        BattleResult first = SIMULATION.simulate(teamA(), teamB(), 100, 1234L);
        BattleResult second = SIMULATION.simulate(teamA(), teamB(), 100, 1234L);

        assertThat(second.winner()).isEqualTo(first.winner());
        assertThat(second.turnCount()).isEqualTo(first.turnCount());
        assertThat(second.log()).isEqualTo(first.log());
    }

    @Test
    void wipingTheOpponentWins() {
        List<CombatantSpec> a = List.of(CombatantSpec.of("garchomp", null, null, "earthquake"));
        List<CombatantSpec> b = List.of(CombatantSpec.of("pikachu", null, null, "thunderbolt").withStats(Map.of("hp", 1)));

        BattleResult result = SIMULATION.simulate(a, b, 10, new SeededRandomProvider(3L),
                new FirstLegalActionSource(), new FirstLegalActionSource());

        assertThat(result.winner()).isEqualTo(Winner.SIDE_A);
        assertThat(result.turnCount()).isEqualTo(1);
        assertThat(result.log()).anyMatch(e -> e.outcome() == Outcome.FAINTED && e.side() == Side.B);
    }

    @Test
    void faintedActivesAreReplacedFromTheBench() {
        List<CombatantSpec> a = List.of(CombatantSpec.of("garchomp", null, null, "earthquake").withStats(Map.of("hp", 2000)));
        List<CombatantSpec> b = List.of(
                CombatantSpec.of("pikachu", null, null, "thunderbolt").withStats(Map.of("hp", 1)),
                CombatantSpec.of("blissey", null, null, "recover"));

        BattleResult result = SIMULATION.simulate(a, b, 2, new SeededRandomProvider(3L),
                new FirstLegalActionSource(), new FirstLegalActionSource());

        assertThat(result.log()).anyMatch(e -> e.kind() == ActionKind.SWITCH && "replace".equals(e.detail())
                && "Blissey".equals(e.actor()));
        assertThat(result.turnCount()).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*BattleSimulation", messagePattern = "Side A submitted switch\\[5\\].*")
    void illegalDecisionsAreReplacedByAForcedDefault() {
        List<CombatantSpec> a = List.of(CombatantSpec.of("blissey", null, null, "recover", "tackle"));
        List<CombatantSpec> b = List.of(CombatantSpec.of("blissey", null, null, "recover"));

        BattleResult result = SIMULATION.simulate(a, b, 1, new SeededRandomProvider(9L),
                ScriptedActionSource.of(BattleAction.switchTo(5)), new FirstLegalActionSource());

        assertThat(result.log()).filteredOn(e -> e.kind() == ActionKind.FORCED_DEFAULT)
                .extracting(LogEntry::side, LogEntry::outcome, LogEntry::detail)
                .containsExactly(tuple(Side.A, Outcome.DEFAULTED, "switch[5]->move[0]"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*BattleSimulation", messagePattern = "Side B submitted null.*", occurrences = 2)
    void exhaustedScriptsFallBackEveryTurn() {
        List<CombatantSpec> a = List.of(CombatantSpec.of("blissey", null, null, "recover"));
        List<CombatantSpec> b = List.of(CombatantSpec.of("blissey", null, null, "tackle"));

        BattleResult result = SIMULATION.simulate(a, b, 2, new SeededRandomProvider(9L),
                new FirstLegalActionSource(), ScriptedActionSource.of());

        assertThat(result.log()).filteredOn(e -> e.kind() == ActionKind.FORCED_DEFAULT).hasSize(2);
        assertThat(result.winner()).isEqualTo(Winner.TIE);
    }

    @Test
    void randomSelfPlayKeepsEveryInvariant() {
        InvariantCheckingSource checkA = new InvariantCheckingSource(new SeededRandomProvider(21L));
        InvariantCheckingSource checkB = new InvariantCheckingSource(new SeededRandomProvider(22L));

        for (long seed = 0; seed < 10; seed++) {
            BattleResult result = SIMULATION.simulate(teamA(), teamB(), 60, new SeededRandomProvider(seed), checkA, checkB);

            assertThat(result.turnCount()).isBetween(1, 60);
            assertThat(result.log()).allSatisfy(e -> {
                if (e.damage() != null) {
                    assertThat(e.damage()).isNotNegative();
                }
                if (e.accuracyRoll() != null) {
                    assertThat(e.accuracyRoll()).isBetween(0.0, 1.0);
                }
            });
            if (result.winner() != Winner.TIE) {
                assertThat(result.turnCount()).isLessThanOrEqualTo(60);
            }
        }
        assertThat(checkA.violations).isEmpty();
        assertThat(checkB.violations).isEmpty();
        assertThat(checkA.decisions).isPositive();
    }

    /**
     * Random policy that inspects the state it is shown before every decision.
     */
    private static final class InvariantCheckingSource implements IActionSource {

        private final RandomActionSource delegate;
        private final List<String> violations = new ArrayList<>();
        private int decisions;

        InvariantCheckingSource(SeededRandomProvider random) {
            this.delegate = new RandomActionSource(random);
        }

        @Override
        public BattleAction chooseAction(DecisionContext context) {
            inspect(context);
            return delegate.chooseAction(context);
        }

        @Override
        public BattleAction chooseReplacement(DecisionContext context) {
            inspect(context);
            return delegate.chooseReplacement(context);
        }

        private void inspect(DecisionContext context) {
            decisions++;
            if (context.legalActions().isEmpty()) {
                violations.add("No legal action on turn " + context.state().turn());
            }
            for (Side side : Side.values()) {
                for (Combatant c : context.state().side(side).roster()) {
                    if (c.hp() < 0 || c.hp() > c.maxHp()) {
                        violations.add(c + " has HP " + c.hp());
                    }
                    for (Stat stat : Stat.values()) {
                        if (Math.abs(c.boost(stat)) > Combatant.MAX_STAGE) {
                            violations.add(c + " has stage " + c.boost(stat) + " in " + stat);
                        }
                    }
                }
            }
        }
    }
}
