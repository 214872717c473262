package org.pokeai.runtime;

import org.pokeai.runtime.spi.IRandomProvider;

/**
 * Random provider returning the same draw every time, for tests that need a predictable branch.
 * {@code nextInt} is clamped below its bound.
 */
public final class FixedRandom implements IRandomProvider {

    private final double doubleValue;
    private final int intValue;

    public FixedRandom(double doubleValue, int intValue) {
        this.doubleValue = doubleValue;
        this.intValue = intValue;
    }

    /** Draws that never trigger a chance-based effect and roll maximum damage. */
    public static FixedRandom unlucky() {
        return new FixedRandom(0.99, Integer.MAX_VALUE);
    }

    /** Draws that trigger every chance-based effect and roll minimum damage. */
    public static FixedRandom lucky() {
        return new FixedRandom(0.0, 0);
    }

    @Override
    public int nextInt(int bound) {
        return Math.min(intValue, bound - 1);
    }

    @Override
    public double nextDouble() {
        return doubleValue;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        return this;
    }
}
