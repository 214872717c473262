package org.pokeai.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.pokeai.runtime.spi.IRandomProvider;

import java.nio.charset.StandardCharsets;

/**
 * {@link IRandomProvider} over a commons-math {@link Well19937c}. Equal seeds give equal draw
 * sequences, so a battle replays from its seed alone.
 * <p>
 * Derived providers hash the seed, scope and key, never the stream position: deriving a
 * per-battle or per-policy stream leaves the parent's draws untouched.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final long seed;
    private final Well19937c generator;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.generator = new Well19937c(seed);
    }

    @Override
    public int nextInt(int bound) {
        return generator.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return generator.nextDouble();
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        return new SeededRandomProvider(streamSeed(seed, scope, key));
    }

    static long streamSeed(long parentSeed, String scope, long key) {
        long mixed = splitMix(parentSeed);
        mixed = splitMix(mixed ^ splitMix(fnv1a(scope)));
        return splitMix(mixed ^ splitMix(key));
    }

    private static long fnv1a(String text) {
        if (text == null) {
            return 0L;
        }
        long hash = FNV_OFFSET_BASIS;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash = (hash ^ (b & 0xFF)) * FNV_PRIME;
        }
        return hash;
    }

    // SplitMix64 finalizer
    private static long splitMix(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}
