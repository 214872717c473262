package org.pokeai.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.pokeai.config.LoggingConfigurator;
import org.pokeai.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private Path teamA;
    private Path teamB;
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws IOException {
        LoggingConfigurator.reset();
        teamA = copyRoster("team-a.json");
        teamB = copyRoster("team-b.json");
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path copyRoster(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/rosters/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void commandNameIsPokeai() {
        assertThat(commandLine.getCommandName()).isEqualTo("pokeai");
        assertThat(commandLine.getSubcommands()).containsKeys("simulate", "batch", "help");
    }

    @Test
    void helpListsSubcommands() {
        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("simulate", "batch");
    }

    @Test
    void simulatePrintsSummaryAndJsonlLog() {
        int exitCode = commandLine.execute("simulate", "--team-a", teamA.toString(), "--team-b", teamB.toString(),
                "--seed", "7", "--max-turns", "50");

        assertThat(exitCode).isZero();
        List<String> lines = out.toString().lines().toList();
        assertThat(lines.get(0)).startsWith("winner=").contains("seed=7");
        assertThat(lines.subList(1, lines.size())).isNotEmpty().allSatisfy(line -> assertThat(line).startsWith("{\"turn\":"));
    }

    @Test
    void simulateIsDeterministicForASeed() {
        commandLine.execute("simulate", "--team-a", teamA.toString(), "--team-b", teamB.toString(), "--seed", "11");
        String first = out.toString();
        out.getBuffer().setLength(0);

        commandLine.execute("simulate", "--team-a", teamA.toString(), "--team-b", teamB.toString(), "--seed", "11");

        assertThat(out.toString()).isEqualTo(first);
    }

    @Test
    void simulateWritesLogToFile() throws IOException {
        Path logFile = tempDir.resolve("battle.jsonl");

        int exitCode = commandLine.execute("simulate", "--team-a", teamA.toString(), "--team-b", teamB.toString(),
                "--log-out", logFile.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines().count()).isEqualTo(1);
        assertThat(Files.readAllLines(logFile)).isNotEmpty();
    }

    @Test
    void simulateReportsMissingRoster() {
        int exitCode = commandLine.execute("simulate", "--team-a", tempDir.resolve("missing.json").toString(),
                "--team-b", teamB.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Simulation failed");
    }

    @Test
    void simulateRequiresRosters() {
        int exitCode = commandLine.execute("simulate");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--team-a");
    }

    @Test
    void batchPrintsTally() {
        int exitCode = commandLine.execute("batch", "--team-a", teamA.toString(), "--team-b", teamB.toString(),
                "--battles", "4", "--threads", "2", "--max-turns", "30");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("battles=4 sideA=").contains("avgTurns=");
    }

    @Test
    void batchRejectsInvalidThreadCount() {
        int exitCode = commandLine.execute("batch", "--team-a", teamA.toString(), "--team-b", teamB.toString(),
                "--threads", "0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Batch failed");
    }

    @Test
    void explicitConfigFileOverridesTurnCap() throws IOException {
        Path conf = tempDir.resolve("short.conf");
        Files.writeString(conf, "pokeai.battle.max-turns = 1\n");

        int exitCode = commandLine.execute("-c", conf.toString(), "simulate", "--team-a", teamA.toString(),
                "--team-b", teamB.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines().findFirst().orElseThrow()).contains("turns=1");
    }
}
