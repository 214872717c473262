package org.pokeai.runtime.rules;

/**
 * Thrown when a rule table cannot be read or is structurally invalid.
 */
public class RuleTableException extends RuntimeException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
