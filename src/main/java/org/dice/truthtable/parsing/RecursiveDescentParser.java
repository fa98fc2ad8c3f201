package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.Formula;
import org.dice.truthtable.parsing.ast.operands.Proposition;
import org.dice.truthtable.parsing.ast.operators.Connective;
import org.dice.truthtable.parsing.ast.operators.Not;

import java.util.Optional;

/**
 * Parses the fully parenthesized grammar described on {@link Formula}. A parser instance
 * reads its lexer once and is not reusable.
 */
public class RecursiveDescentParser {

    private final Lexer lexer;
    private int symbol;
    private Formula root;

    public RecursiveDescentParser(Lexer lexer) {
        this.lexer  = lexer;
        this.symbol = Lexer.NONE;
    }

    /**
     * @throws SyntaxException if the input is not a well formed formula
     */
    public Formula parse() {
        symbol = lexer.nextSymbol();
        expression();
        if(symbol != Lexer.EOF){
            // unbalanced parens
            if(symbol == Lexer.RIGHT){
                throw error(ParserErrors.MissingLeftParen, "unmatched ')'");
            }
            if(Lexer.toConnective(symbol) != null){
                throw error(ParserErrors.UnparenthesizedConnective,
                        "binary connectives must be enclosed in parentheses");
            }
            throw unexpected("end of formula");
        }
        return root;
    }

    private void expression() {
        switch (symbol){
            case Lexer.TOKEN:
                proposition();
                break;

            case Lexer.NOT:
                negation();
                break;

            case Lexer.LEFT:
                parenthesized();
                break;

            case Lexer.UNKNOWN:
                throw unexpected("an operand");

            default:
                // EOF, ')' or a connective where an operand should be
                throw error(ParserErrors.MissingOperand, "expected an operand");
        }
    }

    private void proposition() {
        final String text = lexer.toString();
        if(Grammar.isPlaceholder(text)){
            throw error(ParserErrors.ReservedName, String.format("'%s' is reserved", text));
        }
        Optional<String> name = Grammar.isProposition(text);
        if(!name.isPresent()){
            throw error(ParserErrors.MalFormedProposition,
                    String.format("'%s' is not a valid proposition name", text));
        }
        root = new Proposition(name.get());
        symbol = lexer.nextSymbol();
    }

    private void negation() {
        symbol = lexer.nextSymbol();
        if(symbol == Lexer.NOT){
            throw error(ParserErrors.DoubleNegation, "a negation cannot directly negate another negation");
        }
        expression();
        root = new Not(root);
    }

    private void parenthesized() {
        symbol = lexer.nextSymbol();
        // only a bare proposition may sit alone inside a pair of parens
        final boolean bareProposition = symbol == Lexer.TOKEN;
        expression();
        final Formula left = root;

        if(symbol == Lexer.RIGHT){
            if(!bareProposition){
                throw error(ParserErrors.ParenthesizedNonProposition,
                        "parentheses must enclose a binary operation or a single proposition");
            }
            symbol = lexer.nextSymbol();
            return;
        }

        final Connective connective = Lexer.toConnective(symbol);
        if(connective == null){
            if(symbol == Lexer.EOF){
                throw error(ParserErrors.MissingRightParen, "missing ')'");
            }
            throw error(ParserErrors.MalFormedConnective,
                    "expected one of ' v ', ' ^ ', ' -> ', ' <-> '");
        }
        symbol = lexer.nextSymbol();
        expression();
        final Formula right = root;

        if(symbol != Lexer.RIGHT){
            if(symbol == Lexer.EOF){
                throw error(ParserErrors.MissingRightParen, "missing ')'");
            }
            if(Lexer.toConnective(symbol) != null){
                throw error(ParserErrors.UnparenthesizedConnective,
                        "binary connectives must be nested in parentheses");
            }
            throw unexpected("')'");
        }
        symbol = lexer.nextSymbol();
        root = connective.create(left, right);
    }

    private SyntaxException unexpected(String expected) {
        return error(ParserErrors.MalFormedExpression,
                String.format("unexpected '%s', expected %s", lexer.toString(), expected));
    }

    private SyntaxException error(ParserErrors code, String message) {
        return new SyntaxException(code, lexer.getTokenStart(), message);
    }
}
