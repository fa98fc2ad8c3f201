package org.dice.truthtable.parsing.ast.operators;

import org.dice.truthtable.parsing.ast.Formula;

/**
 * The four binary connectives and their surface symbols. In formula text a symbol is always
 * surrounded by exactly one space on each side.
 */
public enum Connective {
    OR("v"),
    AND("^"),
    CONDITIONAL("->"),
    BICONDITIONAL("<->");

    private final String symbol;
    private final String spacedSymbol;

    Connective(String symbol){
        this.symbol = symbol;
        this.spacedSymbol = " " + symbol + " ";
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the symbol as it appears between two operands, e.g. {@code " -> "}
     */
    public String getSpacedSymbol() {
        return spacedSymbol;
    }

    public BinaryOperator create(Formula left, Formula right){
        switch (this){
            case OR:
                return new Or(left, right);
            case AND:
                return new And(left, right);
            case CONDITIONAL:
                return new Conditional(left, right);
            case BICONDITIONAL:
                return new Biconditional(left, right);
            default:
                throw new AssertionError(this);
        }
    }

    /**
     * Finds the connective whose spaced symbol starts at {@code offset} in {@code text}.
     *
     * @return the connective, or null if none starts there
     */
    public static Connective matchAt(String text, int offset){
        for(Connective connective : values()){
            if(text.startsWith(connective.spacedSymbol, offset)){
                return connective;
            }
        }
        return null;
    }
}
