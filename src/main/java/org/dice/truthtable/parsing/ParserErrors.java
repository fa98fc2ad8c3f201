package org.dice.truthtable.parsing;

/**
 * Error codes carried by {@link SyntaxException}.
 */
public enum ParserErrors {
    MissingLeftParen(1),
    MissingRightParen(2),
    MalFormedProposition(3),
    ReservedName(4),
    MalFormedConnective(5),
    MissingOperand(6),
    UnparenthesizedConnective(7),
    ParenthesizedNonProposition(8),
    DoubleNegation(9),
    UnresolvedPlaceholder(10),
    MalFormedExpression(11),
    MalformedFixedValue(12);

    public int value;
    ParserErrors(int value){
        this.value = value;
    }
}
