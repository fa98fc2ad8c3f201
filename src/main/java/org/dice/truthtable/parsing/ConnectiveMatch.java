package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.operators.Connective;

/**
 * A binary connective found in a bare fragment, with the text on either side of it.
 */
public class ConnectiveMatch {

    private final Connective connective;
    private final String left;
    private final String right;
    private final int offset;

    public ConnectiveMatch(Connective connective, String left, String right, int offset) {
        this.connective = connective;
        this.left = left;
        this.right = right;
        this.offset = offset;
    }

    public Connective getConnective() {
        return connective;
    }

    public String getLeft() {
        return left;
    }

    public String getRight() {
        return right;
    }

    /**
     * @return offset of the spaced symbol within the fragment
     */
    public int getOffset() {
        return offset;
    }
}
