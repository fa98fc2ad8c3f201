package org.dice.truthtable.table;

import org.dice.truthtable.BadExpressionException;

/**
 * Thrown when a fixed value names a proposition that does not occur in the formula.
 */
@SuppressWarnings("serial")
public class UnknownPropositionException extends BadExpressionException {

    private final String name;

    public UnknownPropositionException(String name) {
        super(String.format("Proposition '%s' does not occur in the formula", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
