package org.dice.truthtable.parsing.ast;

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Helpers over formula trees.
 */
public final class Formulas {

    private Formulas() {
    }

    /**
     * Distinct proposition names in the order they first occur, reading left to right.
     */
    public static ImmutableList<String> propositions(Formula formula) {
        Set<String> names = new LinkedHashSet<String>();
        formula.collectPropositions(names);
        return ImmutableList.copyOf(names);
    }
}
