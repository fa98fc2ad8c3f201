package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.operators.Connective;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into symbols. Names are returned as {@link #TOKEN} whether or not they
 * are legal propositions; the parser checks them against the {@link Grammar}.
 */
public class Lexer {

    private final String input;
    private int position = 0;

    private int symbol = NONE;
    private String currentToken = "";
    private int tokenStart = 0;

    public static final int EOF     = -1;
    public static final int UNKNOWN = -2;
    public static final int TOKEN   = 999;

    public static final int NONE  = 0;

    public static final int OR            = 1;
    public static final int AND           = 2;
    public static final int NOT           = 3;
    public static final int CONDITIONAL   = 4;
    public static final int BICONDITIONAL = 5;

    public static final int LEFT  = 6;
    public static final int RIGHT = 7;

    private static final char cLPAREN = '(';
    private static final char cRPAREN = ')';
    private static final char cSPACE = ' ';

    public Lexer(String s) {
        this.input = s == null ? "" : s;
    }

    public int nextSymbol() {
        tokenStart = position;
        if(position >= input.length()){
            currentToken = "";
            symbol = EOF;
            return symbol;
        }

        char c = input.charAt(position);
        if(c == cLPAREN){
            symbol = single(LEFT);
        }
        else if(c == cRPAREN){
            symbol = single(RIGHT);
        }
        else if(input.startsWith(Grammar.NEGATION, position)){
            currentToken = Grammar.NEGATION;
            position += Grammar.NEGATION.length();
            symbol = NOT;
        }
        else if(c == cSPACE){
            // a space is only legal as part of a connective symbol
            Connective connective = Connective.matchAt(input, position);
            if(connective == null){
                symbol = single(UNKNOWN);
            }
            else{
                currentToken = connective.getSpacedSymbol();
                position += currentToken.length();
                symbol = toSymbol(connective);
            }
        }
        else if(isNameCharacter(c)){
            int end = position;
            while(end < input.length() && isNameCharacter(input.charAt(end))){
                end++;
            }
            currentToken = input.substring(position, end);
            position = end;
            symbol = TOKEN;
        }
        else{
            symbol = single(UNKNOWN);
        }
        return symbol;
    }

    private int single(int code) {
        currentToken = input.substring(position, position + 1);
        position++;
        return code;
    }

    /**
     * @return offset of the current token in the input
     */
    public int getTokenStart() {
        return tokenStart;
    }

    public static int toSymbol(Connective connective) {
        switch (connective){
            case OR:
                return OR;
            case AND:
                return AND;
            case CONDITIONAL:
                return CONDITIONAL;
            case BICONDITIONAL:
                return BICONDITIONAL;
            default:
                throw new AssertionError(connective);
        }
    }

    /**
     * @return the connective for a lexer symbol, or null if the symbol is not a connective
     */
    public static Connective toConnective(int symbol) {
        switch (symbol){
            case OR:
                return Connective.OR;
            case AND:
                return Connective.AND;
            case CONDITIONAL:
                return Connective.CONDITIONAL;
            case BICONDITIONAL:
                return Connective.BICONDITIONAL;
            default:
                return null;
        }
    }

    private static boolean isNameCharacter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    public static List<Integer> tokenize(String inputString){
        // create a new lexer so as not to reset this one
        Lexer temp = new Lexer(inputString);
        List<Integer> symbols = new ArrayList<Integer>();
        int symbol;
        while ( (symbol = temp.nextSymbol()) != Lexer.EOF){
            symbols.add(symbol);
        }
        return symbols;
    }

    public String toString() {
        return this.currentToken;
    }
}
