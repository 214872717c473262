package org.pokeai.junit.extensions.logging;

/**
 * Levels a test can allow or expect.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
