package org.pokeai.runtime.spi;

/**
 * The only source of randomness a battle may draw from.
 * <p>
 * Critical hits, damage rolls, accuracy checks, secondary-effect chances, multi-hit counts,
 * sleep and confusion durations and speed ties all go through the provider handed to the battle.
 * Implementations are pure functions of their seed.
 * </p>
 */
public interface IRandomProvider {

    /**
     * @param bound exclusive upper bound, must be positive
     * @return a value in {@code [0, bound)}
     */
    int nextInt(int bound);

    /**
     * @return a value in {@code [0.0, 1.0)}
     */
    double nextDouble();

    /**
     * An independent child stream, fixed by this provider's seed plus {@code scope} and {@code key}.
     * Used for one stream per battle of a batch and one per action source.
     *
     * @param scope stable name of the consumer, such as {@code "battle"} or {@code "policy"}
     * @param key   stable index within the scope, such as a battle index or side ordinal
     */
    IRandomProvider deriveFor(String scope, long key);
}
