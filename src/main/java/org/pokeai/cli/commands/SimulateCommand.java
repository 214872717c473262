package org.pokeai.cli.commands;

import org.pokeai.cli.CommandLineInterface;
import org.pokeai.config.EngineSettings;
import org.pokeai.runtime.BattleSimulation;
import org.pokeai.runtime.model.BattleResult;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.services.BattleLogWriter;
import org.pokeai.runtime.rules.RuleTableException;
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
import java.util.concurrent.Callable;

@Command(name = "simulate", description = "Simulates one battle between two rosters and prints the result and its JSONL log.")
public class SimulateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"--team-a"}, required = true, description = "JSON roster file of side A.")
    private File teamA;

    @Option(names = {"--team-b"}, required = true, description = "JSON roster file of side B.")
    private File teamB;

    @Option(names = {"--seed"}, description = "Random seed (default: pokeai.battle.seed).")
    private Long seed;

    @Option(names = {"--max-turns"}, description = "Turn cap (default: pokeai.battle.max-turns).")
    private Integer maxTurns;

    @Option(names = {"--log-out"}, description = "Write the JSONL log to this file instead of standard output.")
    private File logOut;

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
            long effectiveSeed = seed != null ? seed : settings.seed();
            BattleResult result = simulation.simulate(rosterA, rosterB,
                    maxTurns != null ? maxTurns : settings.maxTurns(), effectiveSeed);

            out.printf(Locale.ROOT, "winner=%s turns=%d entries=%d seed=%d%n",
                    result.winner(), result.turnCount(), result.log().size(), effectiveSeed);
            BattleLogWriter writer = new BattleLogWriter();
            if (logOut != null) {
                writer.write(result.log(), logOut.toPath());
            } else {
                writer.write(result.log(), out);
            }
            return 0;
        } catch (IOException | IllegalArgumentException | RuleTableException e) {
            spec.commandLine().getErr().println("Simulation failed: " + e.getMessage());
            return 1;
        }
    }
}
