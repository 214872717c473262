package org.pokeai.runtime.rules;

/**
 * Result of a table lookup. {@code fallback} is set when the identifier was unknown and a
 * baseline entry was substituted.
 */
public record Lookup<T>(T value, boolean fallback) {

    public static <T> Lookup<T> found(T value) {
        return new Lookup<>(value, false);
    }

    public static <T> Lookup<T> defaulted(T value) {
        return new Lookup<>(value, true);
    }
}
