package org.dice.truthtable.table;

import com.google.common.collect.ImmutableMap;

/**
 * One assignment of the table and the formula's value under it.
 */
public class TableRow {

    private final ImmutableMap<String, Boolean> assignment;
    private final boolean result;

    public TableRow(ImmutableMap<String, Boolean> assignment, boolean result) {
        this.assignment = assignment;
        this.result = result;
    }

    /**
     * @return truth values keyed by proposition, iterating in column order
     */
    public ImmutableMap<String, Boolean> getAssignment() {
        return assignment;
    }

    public boolean getResult() {
        return result;
    }

    @Override
    public String toString() {
        return assignment + " -> " + result;
    }
}
