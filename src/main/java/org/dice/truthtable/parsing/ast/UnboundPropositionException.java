package org.dice.truthtable.parsing.ast;

import org.dice.truthtable.BadExpressionException;

/**
 * Thrown when a formula is evaluated under an assignment that has no value for one of its
 * propositions.
 */
@SuppressWarnings("serial")
public class UnboundPropositionException extends BadExpressionException {

    private final String name;

    public UnboundPropositionException(String name) {
        super(String.format("No truth value assigned to proposition '%s'", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
