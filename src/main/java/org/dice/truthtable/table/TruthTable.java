package org.dice.truthtable.table;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.dice.truthtable.parsing.ast.Formula;

/**
 * Created by {@link TruthTableGenerator}.
 */
public class TruthTable {

    private final Formula formula;
    private final ImmutableList<String> freePropositions;
    private final ImmutableMap<String, Boolean> fixedValues;
    private final ImmutableList<TableRow> rows;

    TruthTable(Formula formula, ImmutableList<String> freePropositions,
               ImmutableMap<String, Boolean> fixedValues, ImmutableList<TableRow> rows) {
        this.formula = formula;
        this.freePropositions = freePropositions;
        this.fixedValues = fixedValues;
        this.rows = rows;
    }

    public Formula getFormula() {
        return formula;
    }

    public ImmutableList<String> getFreePropositions() {
        return freePropositions;
    }

    public ImmutableMap<String, Boolean> getFixedValues() {
        return fixedValues;
    }

    /**
     * @return the column names: free propositions followed by fixed ones
     */
    public ImmutableList<String> getHeader() {
        return ImmutableList.<String>builder()
                .addAll(freePropositions)
                .addAll(fixedValues.keySet())
                .build();
    }

    public ImmutableList<TableRow> getRows() {
        return rows;
    }
}
