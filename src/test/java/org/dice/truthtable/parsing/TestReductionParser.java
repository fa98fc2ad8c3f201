package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.Formula;
import org.dice.truthtable.parsing.ast.operands.Proposition;
import org.dice.truthtable.parsing.ast.operators.And;
import org.dice.truthtable.parsing.ast.operators.Conditional;
import org.dice.truthtable.parsing.ast.operators.Not;
import org.dice.truthtable.parsing.ast.operators.Or;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestReductionParser {

    @Test
    public void reducesInnermostGroupsFirst() {
        Formula expected = new And(
                new Or(new Proposition("p"), new Proposition("q")),
                new Conditional(new Proposition("r"), new Not(new Proposition("s"))));
        assertEquals(expected, parse("((p v q) ^ (r -> ¬s))"));
        assertEquals(new And(new Not(new Or(new Proposition("p"), new Proposition("q"))), new Proposition("r")),
                parse("(¬(p v q) ^ r)"));
    }

    @Test
    public void resolvesWrappedPropositions() {
        assertEquals(new Proposition("p"), parse("(p)"));
        assertEquals(new Not(new Proposition("p")), parse("¬(p)"));
        assertEquals(new Or(new Proposition("p"), new Proposition("q")), parse("((p) v (q))"));
    }

    @Test
    public void buildsSameTreesAsRecursiveDescent() {
        for(String input : FormulaCorpus.VALID){
            assertEquals(input, FormulaParser.parse(input), parse(input));
        }
    }

    @Test
    public void rejectsEveryInvalidInput() {
        for(String input : FormulaCorpus.INVALID){
            getParserException(input);
        }
    }

    @Test
    public void rejectsReservedNameBeforeReducing() {
        assertEquals(ParserErrors.ReservedName, getParserException("(tmp ^ p)").getError());
        assertEquals(1, getParserException("(tmp ^ p)").getPosition());
        assertEquals(ParserErrors.ReservedName, getParserException("¬tmp").getError());
    }

    @Test
    public void addsErrorCodes() {
        assertEquals(ParserErrors.MissingRightParen, getParserException("(p v q").getError());
        assertEquals(ParserErrors.MissingLeftParen, getParserException("(p v q))").getError());
        assertEquals(ParserErrors.UnparenthesizedConnective, getParserException("(p v q) v r").getError());
        assertEquals(ParserErrors.ParenthesizedNonProposition, getParserException("((p v q))").getError());
        assertEquals(ParserErrors.ParenthesizedNonProposition, getParserException("(¬p)").getError());
        assertEquals(ParserErrors.DoubleNegation, getParserException("¬¬p").getError());
        assertEquals(ParserErrors.MissingOperand, getParserException("()").getError());
        assertEquals(ParserErrors.MalFormedExpression, getParserException("a(p v q)").getError());
    }

    private Formula parse(String input){
        return new ReductionParser(input).parse();
    }

    private SyntaxException getParserException(String input){
        try {
            Formula formula = parse(input);
            fail(String.format("'%s' parsed as %s", input, formula));
            return null;
        }
        catch (SyntaxException ex){
            return ex;
        }
    }
}
