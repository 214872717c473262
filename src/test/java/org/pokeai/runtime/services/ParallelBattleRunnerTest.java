package org.pokeai.runtime.services;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pokeai.junit.extensions.logging.LogWatchExtension;
import org.pokeai.runtime.BattleFixture;
import org.pokeai.runtime.BattleSimulation;
import org.pokeai.runtime.model.BattleResult;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.Winner;
import org.pokeai.runtime.rules.FormatRules;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ParallelBattleRunnerTest {

    private static final BattleSimulation SIMULATION = new BattleSimulation(BattleFixture.RULES, FormatRules.unrestricted());

    private static List<CombatantSpec> teamA;
    private static List<CombatantSpec> teamB;

    @BeforeAll
    static void loadRosters() throws IOException {
        teamA = load("rosters/team-a.json");
        teamB = load("rosters/team-b.json");
    }

    private static List<CombatantSpec> load(String resource) throws IOException {
        try (InputStream in = ParallelBattleRunnerTest.class.getClassLoader().getResourceAsStream(resource)) {
            return new RosterLoader().load(in);
        }
    }

    @Test
    void resultsDoNotDependOnThreadCount() {
        List<BattleResult> sequential = new ParallelBattleRunner(SIMULATION, 1).run(teamA, teamB, 8, 40, 77L);
        List<BattleResult> parallel = new ParallelBattleRunner(SIMULATION, 4).run(teamA, teamB, 8, 40, 77L);

        assertThat(parallel).hasSize(8);
        assertThat(parallel).isEqualTo(sequential);
    }

    @Test
    void batchesWithDifferentSeedsDiffer() {
        List<BattleResult> first = new ParallelBattleRunner(SIMULATION, 2).run(teamA, teamB, 4, 40, 1L);
        List<BattleResult> second = new ParallelBattleRunner(SIMULATION, 2).run(teamA, teamB, 4, 40, 2L);

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void tallyCountsEveryOutcome() {
        List<BattleResult> results = new ParallelBattleRunner(SIMULATION, 3).run(teamA, teamB, 6, 40, 5L);

        Map<Winner, Integer> tally = ParallelBattleRunner.tally(results);

        assertThat(tally).containsOnlyKeys(Winner.values());
        assertThat(tally.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(6);
    }

    @Test
    void zeroBattlesGiveAnEmptyBatch() {
        assertThat(new ParallelBattleRunner(SIMULATION, 2).run(teamA, teamB, 0, 40, 5L)).isEmpty();
        assertThat(ParallelBattleRunner.tally(List.of())).containsEntry(Winner.TIE, 0);
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> new ParallelBattleRunner(SIMULATION, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParallelBattleRunner(SIMULATION, 2).run(teamA, teamB, 2, 0, 5L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
