package org.dice.truthtable;

/**
 * Base type for the failures a caller may get back from parsing, evaluating or tabulating
 * a formula. The console catches this type and reports a single message to the user.
 */
@SuppressWarnings("serial")
public abstract class BadExpressionException extends RuntimeException {

    protected BadExpressionException(String message) {
        super(message);
    }
}
