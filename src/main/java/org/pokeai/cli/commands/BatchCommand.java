package org.pokeai.cli.commands;

import org.pokeai.cli.CommandLineInterface;
import org.pokeai.config.EngineSettings;
import org.pokeai.runtime.BattleSimulation;
import org.pokeai.runtime.model.BattleResult;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.Winner;
import org.pokeai.runtime.rules.RuleTableException;
import org.pokeai.runtime.services.ParallelBattleRunner;
import org.pokeai.runtime.services.RosterLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "batch", description = "Runs many independent battles in parallel and prints win counts.")
public class BatchCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"--team-a"}, required = true, description = "JSON roster file of side A.")
    private File teamA;

    @Option(names = {"--team-b"}, required = true, description = "JSON roster file of side B.")
    private File teamB;

    @Option(names = {"--battles"}, defaultValue = "100", description = "Number of battles (default: ${DEFAULT-VALUE}).")
    private int battles;

    @Option(names = {"--threads"}, defaultValue = "1", description = "Worker threads (default: ${DEFAULT-VALUE}).")
    private int threads;

    @Option(names = {"--seed"}, description = "Batch seed (default: pokeai.battle.seed).")
    private Long seed;

    @Option(names = {"--max-turns"}, description = "Turn cap per battle (default: pokeai.battle.max-turns).")
    private Integer maxTurns;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        EngineSettings settings = EngineSettings.fromConfig(parent.getConfig());
        PrintWriter out = spec.commandLine().getOut();
        try {
            RosterLoader loader = new RosterLoader();
            List<CombatantSpec> rosterA = loader.load(teamA.toPath());
            List<CombatantSpec> rosterB = loader.load(teamB.toPath());
            BattleSimulation simulation = new BattleSimulation(settings.loadRuleTables(), settings.format());
            ParallelBattleRunner runner = new ParallelBattleRunner(simulation, threads);
            List<BattleResult> results = runner.run(rosterA, rosterB, battles,
                    maxTurns != null ? maxTurns : settings.maxTurns(), seed != null ? seed : settings.seed());

            Map<Winner, Integer> tally = ParallelBattleRunner.tally(results);
            double averageTurns = results.stream().mapToInt(BattleResult::turnCount).average().orElse(0.0);
            out.printf(Locale.ROOT, "battles=%d sideA=%d sideB=%d ties=%d avgTurns=%.2f%n", results.size(),
                    tally.get(Winner.SIDE_A), tally.get(Winner.SIDE_B), tally.get(Winner.TIE), averageTurns);
            out.flush();
            return 0;
        } catch (IOException | IllegalArgumentException | RuleTableException e) {
            spec.commandLine().getErr().println("Batch failed: " + e.getMessage());
            return 1;
        }
    }
}
