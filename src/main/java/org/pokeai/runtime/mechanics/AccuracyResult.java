package org.pokeai.runtime.mechanics;

/**
 * @param hit      whether the move connects
 * @param roll     the uniform draw in [0, 1), or {@code null} when no draw was made
 * @param accuracy the effective accuracy in percent the draw was compared against
 */
public record AccuracyResult(boolean hit, Double roll, double accuracy) {

    public static AccuracyResult alwaysHits() {
        return new AccuracyResult(true, null, 100.0);
    }
}
