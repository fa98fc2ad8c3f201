package org.dice.truthtable.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.dice.truthtable.parsing.ast.Formula;
import org.dice.truthtable.parsing.ast.Formulas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * Enumerates every assignment of a formula's free propositions and evaluates the formula
 * under each.
 *
 * Columns follow the order in which propositions first occur in the formula. Rows count
 * upwards in binary with false before true; the first free proposition is the most
 * significant bit, so it changes slowest.
 */
public final class TruthTableGenerator {

    private static final Logger log = LoggerFactory.getLogger(TruthTableGenerator.class);

    // rows are counted in an int
    public static final int MAX_FREE_PROPOSITIONS = 30;

    private TruthTableGenerator() {
    }

    public static TruthTable generate(Formula formula) {
        return generate(formula, Collections.<String, Boolean>emptyMap());
    }

    /**
     * @param fixed propositions pinned to a value; they are not enumerated and appear after
     *              the free propositions, in the map's iteration order
     * @throws UnknownPropositionException if a fixed proposition does not occur in the formula
     */
    public static TruthTable generate(Formula formula, Map<String, Boolean> fixed) {
        Preconditions.checkNotNull(formula, "formula");
        Preconditions.checkNotNull(fixed, "fixed");

        final ImmutableList<String> names = Formulas.propositions(formula);
        for(String name : fixed.keySet()){
            if(!names.contains(name)){
                throw new UnknownPropositionException(name);
            }
        }
        final ImmutableMap<String, Boolean> fixedValues = ImmutableMap.copyOf(fixed);

        ImmutableList.Builder<String> freeBuilder = ImmutableList.builder();
        for(String name : names){
            if(!fixedValues.containsKey(name)){
                freeBuilder.add(name);
            }
        }
        final ImmutableList<String> free = freeBuilder.build();
        final int n = free.size();
        Preconditions.checkArgument(n <= MAX_FREE_PROPOSITIONS,
                "Too many free propositions for a truth table: %s", n);

        final int rowCount = 1 << n;
        ImmutableList.Builder<TableRow> rows = ImmutableList.builder();
        for(int combination = 0; combination < rowCount; combination++){
            ImmutableMap.Builder<String, Boolean> assignment = ImmutableMap.builder();
            for(int i = 0; i < n; i++){
                assignment.put(free.get(i), ((combination >> (n - 1 - i)) & 1) == 1);
            }
            assignment.putAll(fixedValues);

            ImmutableMap<String, Boolean> values = assignment.build();
            rows.add(new TableRow(values, formula.evaluate(values)));
        }
        log.debug("Generated {} rows for {} (free: {}, fixed: {})", rowCount, formula, free, fixedValues);
        return new TruthTable(formula, free, fixedValues, rows.build());
    }
}
