package org.dice.truthtable.parsing.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.dice.truthtable.parsing.FormulaParser;
import org.dice.truthtable.parsing.ast.operands.Proposition;
import org.dice.truthtable.parsing.ast.operators.And;
import org.dice.truthtable.parsing.ast.operators.Biconditional;
import org.dice.truthtable.parsing.ast.operators.Conditional;
import org.dice.truthtable.parsing.ast.operators.Not;
import org.dice.truthtable.parsing.ast.operators.Or;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestFormulaEvaluation {

    private static final Proposition P = new Proposition("p");
    private static final Proposition Q = new Proposition("q");

    @Test
    public void evaluatesPropositionAndNegation() {
        assertTrue(P.evaluate(values(true, false)));
        assertFalse(P.evaluate(values(false, false)));
        assertFalse(new Not(P).evaluate(values(true, false)));
        assertTrue(new Not(P).evaluate(values(false, false)));
    }

    @Test
    public void evaluatesConjunctionAndDisjunction() {
        assertTrue(new And(P, Q).evaluate(values(true, true)));
        assertFalse(new And(P, Q).evaluate(values(true, false)));
        assertFalse(new And(P, Q).evaluate(values(false, true)));

        assertFalse(new Or(P, Q).evaluate(values(false, false)));
        assertTrue(new Or(P, Q).evaluate(values(false, true)));
        assertTrue(new Or(P, Q).evaluate(values(true, false)));
    }

    @Test
    public void conditionalIsFalseOnlyWhenTrueImpliesFalse() {
        Formula conditional = new Conditional(P, Q);
        assertTrue(conditional.evaluate(values(false, false)));
        assertTrue(conditional.evaluate(values(false, true)));
        assertFalse(conditional.evaluate(values(true, false)));
        assertTrue(conditional.evaluate(values(true, true)));
    }

    @Test
    public void biconditionalIsSymmetric() {
        for(boolean p : new boolean[]{false, true}){
            for(boolean q : new boolean[]{false, true}){
                Map<String, Boolean> assignment = values(p, q);
                assertEquals(p == q, new Biconditional(P, Q).evaluate(assignment));
                assertEquals(new Biconditional(P, Q).evaluate(assignment),
                        new Biconditional(Q, P).evaluate(assignment));
            }
        }
    }

    @Test
    public void evaluatesNestedFormula() {
        Formula formula = FormulaParser.parse("((p <-> ¬q) -> (p ^ q))");
        assertFalse(formula.evaluate(values(true, false)));
        assertTrue(formula.evaluate(values(true, true)));
        assertTrue(formula.evaluate(values(false, false)));
    }

    @Test
    public void reportsUnboundProposition() {
        try {
            new And(P, Q).evaluate(ImmutableMap.of("p", false));
            fail();
        }
        catch (UnboundPropositionException ex){
            assertEquals("q", ex.getName());
        }

        Map<String, Boolean> withNull = new HashMap<String, Boolean>();
        withNull.put("p", null);
        try {
            P.evaluate(withNull);
            fail();
        }
        catch (UnboundPropositionException ex){
            assertEquals("p", ex.getName());
        }
    }

    @Test
    public void rendersCanonicalText() {
        assertEquals("p", P.render());
        assertEquals("¬p", new Not(P).render());
        assertEquals("¬(p v q)", new Not(new Or(P, Q)).render());
        assertEquals("(p ^ ¬q)", new And(P, new Not(Q)).render());
        assertEquals("(p -> q)", new Conditional(P, Q).toString());
        assertEquals("(q <-> p)", new Biconditional(Q, P).toString());
    }

    @Test
    public void comparesStructurally() {
        assertEquals(new And(P, Q), new And(new Proposition("p"), new Proposition("q")));
        assertEquals(new And(P, Q).hashCode(), new And(new Proposition("p"), new Proposition("q")).hashCode());
        assertNotEquals(new And(P, Q), new Or(P, Q));
        assertNotEquals(new And(P, Q), new And(Q, P));
        assertNotEquals(new Not(P), P);
    }

    @Test
    public void listsPropositionsInOrderOfFirstOccurrence() {
        assertEquals(ImmutableList.of("q", "p", "r"),
                Formulas.propositions(FormulaParser.parse("((q v p) ^ (p -> ¬r))")));
        assertEquals(ImmutableList.of("p"), Formulas.propositions(FormulaParser.parse("(p <-> ¬p)")));
    }

    private static Map<String, Boolean> values(boolean p, boolean q) {
        return ImmutableMap.of("p", p, "q", q);
    }
}
