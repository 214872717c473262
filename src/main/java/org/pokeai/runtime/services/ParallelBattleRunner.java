package org.pokeai.runtime.services;

import org.pokeai.runtime.BattleSimulation;
import org.pokeai.runtime.internal.services.SeededRandomProvider;
import org.pokeai.runtime.model.BattleResult;
import org.pokeai.runtime.model.CombatantSpec;
import org.pokeai.runtime.model.Side;
import org.pokeai.runtime.model.Winner;
import org.pokeai.runtime.policy.RandomActionSource;
import org.pokeai.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs independent battles on a fixed thread pool. Battle {@code i} draws from the stream
 * derived as {@code deriveFor("battle", i)} of the batch seed, so results do not depend on
 * the thread count or on scheduling. Results come back in battle order.
 */
public class ParallelBattleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelBattleRunner.class);

    private final BattleSimulation simulation;
    private final int threads;

    public ParallelBattleRunner(BattleSimulation simulation, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.simulation = simulation;
        this.threads = threads;
    }

    public List<BattleResult> run(List<CombatantSpec> rosterA, List<CombatantSpec> rosterB, int battles,
                                  int maxTurns, long seed) {
        if (battles < 0) {
            throw new IllegalArgumentException("battles must not be negative, got " + battles);
        }
        IRandomProvider root = new SeededRandomProvider(seed);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<BattleResult>> futures = new ArrayList<>(battles);
            for (int i = 0; i < battles; i++) {
                IRandomProvider battleRandom = root.deriveFor("battle", i);
                futures.add(CompletableFuture.supplyAsync(() -> simulation.simulate(rosterA, rosterB, maxTurns,
                        battleRandom,
                        new RandomActionSource(battleRandom.deriveFor("policy", Side.A.ordinal())),
                        new RandomActionSource(battleRandom.deriveFor("policy", Side.B.ordinal()))), executor));
            }
            List<BattleResult> results = new ArrayList<>(battles);
            for (CompletableFuture<BattleResult> future : futures) {
                results.add(join(future));
            }
            LOG.debug("Finished {} battles on {} threads", battles, threads);
            return results;
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static BattleResult join(CompletableFuture<BattleResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    /**
     * Counts wins per side and ties.
     */
    public static Map<Winner, Integer> tally(List<BattleResult> results) {
        Map<Winner, Integer> counts = new EnumMap<>(Winner.class);
        for (Winner winner : Winner.values()) {
            counts.put(winner, 0);
        }
        for (BattleResult result : results) {
            counts.merge(result.winner(), 1, Integer::sum);
        }
        return counts;
    }
}
