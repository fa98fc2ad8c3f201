package org.dice.truthtable.parsing;

import org.dice.truthtable.BadExpressionException;

/**
 * Thrown when formula text (or an input line) does not conform to the grammar.
 */
@SuppressWarnings("serial")
public class SyntaxException extends BadExpressionException {

    private final ParserErrors error;
    private final int position;

    public SyntaxException(ParserErrors error, int position, String message) {
        super(position < 0
                ? String.format("%s: %s", error, message)
                : String.format("%s at %d: %s", error, position, message));
        this.error = error;
        this.position = position;
    }

    public SyntaxException(ParserErrors error, String message) {
        this(error, -1, message);
    }

    public ParserErrors getError() {
        return error;
    }

    /**
     * @return character offset where the error was detected, or -1
     */
    public int getPosition() {
        return position;
    }
}
