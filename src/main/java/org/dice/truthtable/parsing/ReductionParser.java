package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.Formula;
import org.dice.truthtable.parsing.ast.operands.Proposition;
import org.dice.truthtable.parsing.ast.operators.Not;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Parses a formula by reducing its innermost parenthesized group first.
 *
 * Each reduced group is replaced in the working text by {@link Grammar#PLACEHOLDER} and its
 * subtree is pushed on a stack. A group's placeholders always stand for its direct children,
 * which are the most recently pushed subtrees, so they are popped right to left. Accepts the
 * same language as {@link RecursiveDescentParser} and builds the same trees.
 */
public class ReductionParser {

    private static final Logger log = LoggerFactory.getLogger(ReductionParser.class);

    private static final char cLPAREN = '(';
    private static final char cRPAREN = ')';
    private static final char cSPACE = ' ';

    private final String text;
    private final Deque<Formula> stack = new ArrayDeque<Formula>();

    public ReductionParser(String text) {
        this.text = text == null ? "" : text;
    }

    /**
     * @throws SyntaxException if the input is not a well formed formula
     */
    public Formula parse() {
        rejectReservedNames();

        String working = text;
        int close;
        while((close = working.indexOf(cRPAREN)) >= 0){
            int open = working.lastIndexOf(cLPAREN, close);
            if(open < 0){
                throw new SyntaxException(ParserErrors.MissingLeftParen, "unmatched ')'");
            }
            checkBoundaries(working, open, close);

            Formula group = reduceGroup(working.substring(open + 1, close));
            stack.push(group);
            working = working.substring(0, open) + Grammar.PLACEHOLDER + working.substring(close + 1);
            log.debug("Reduced group to {}, working text is now '{}'", group, working);
        }
        if(working.indexOf(cLPAREN) >= 0){
            throw new SyntaxException(ParserErrors.MissingRightParen, "missing ')'");
        }

        if(Grammar.findTopConnective(working).isPresent()){
            throw new SyntaxException(ParserErrors.UnparenthesizedConnective,
                    "binary connectives must be enclosed in parentheses");
        }
        Formula result = operand(working);
        if(!stack.isEmpty()){
            throw new SyntaxException(ParserErrors.UnresolvedPlaceholder,
                    String.format("%d reduced groups were never used", stack.size()));
        }
        return result;
    }

    // the placeholder shares the namespace of proposition names
    private void rejectReservedNames() {
        Matcher matcher = Grammar.NAME_CHARACTERS.matcher(text);
        while(matcher.find()){
            if(Grammar.isPlaceholder(matcher.group())){
                throw new SyntaxException(ParserErrors.ReservedName, matcher.start(),
                        String.format("'%s' is reserved", matcher.group()));
            }
        }
    }

    // a group may not be glued to a name, otherwise the placeholder would merge with it
    private void checkBoundaries(String working, int open, int close) {
        boolean openOk = open == 0
                || working.charAt(open - 1) == cLPAREN
                || working.charAt(open - 1) == cSPACE
                || working.startsWith(Grammar.NEGATION, open - Grammar.NEGATION.length());
        boolean closeOk = close == working.length() - 1
                || working.charAt(close + 1) == cRPAREN
                || working.charAt(close + 1) == cSPACE;
        if(!openOk || !closeOk){
            throw new SyntaxException(ParserErrors.MalFormedExpression,
                    String.format("unexpected text around '%s'", working.substring(open, close + 1)));
        }
    }

    private Formula reduceGroup(String bare) {
        Optional<ConnectiveMatch> match = Grammar.findTopConnective(bare);
        if(match.isPresent()){
            // the right operand's subtree was pushed last
            Formula right = operand(match.get().getRight());
            Formula left = operand(match.get().getLeft());
            return match.get().getConnective().create(left, right);
        }

        Optional<String> name = Grammar.isProposition(bare);
        if(name.isPresent()){
            return new Proposition(name.get());
        }
        if(Grammar.isPlaceholder(bare) || bare.startsWith(Grammar.NEGATION)){
            throw new SyntaxException(ParserErrors.ParenthesizedNonProposition,
                    "parentheses must enclose a binary operation or a single proposition");
        }
        if(bare.isEmpty()){
            throw new SyntaxException(ParserErrors.MissingOperand, "empty parentheses");
        }
        throw new SyntaxException(ParserErrors.MalFormedExpression,
                String.format("'(%s)' is not a binary operation or a proposition", bare));
    }

    private Formula operand(String fragment) {
        if(Grammar.isPlaceholder(fragment)){
            return pop();
        }

        Optional<String> negated = Grammar.isNegation(fragment);
        if(negated.isPresent()){
            String inner = negated.get();
            if(Grammar.isPlaceholder(inner)){
                return new Not(pop());
            }
            return new Not(new Proposition(Grammar.isProposition(inner).get()));
        }
        if(fragment.startsWith(Grammar.NEGATION)){
            String rest = fragment.substring(Grammar.NEGATION.length());
            if(rest.startsWith(Grammar.NEGATION)){
                throw new SyntaxException(ParserErrors.DoubleNegation,
                        "a negation cannot directly negate another negation");
            }
            if(rest.isEmpty()){
                throw new SyntaxException(ParserErrors.MissingOperand, "nothing to negate");
            }
            throw new SyntaxException(ParserErrors.MalFormedProposition,
                    String.format("'%s' is not a valid proposition name", rest));
        }

        Optional<String> name = Grammar.isProposition(fragment);
        if(name.isPresent()){
            return new Proposition(name.get());
        }
        if(fragment.isEmpty()){
            throw new SyntaxException(ParserErrors.MissingOperand, "expected an operand");
        }
        throw new SyntaxException(ParserErrors.MalFormedProposition,
                String.format("'%s' is not a valid proposition name", fragment));
    }

    private Formula pop() {
        if(stack.isEmpty()){
            throw new SyntaxException(ParserErrors.UnresolvedPlaceholder,
                    "placeholder without a reduced group");
        }
        return stack.pop();
    }
}
