package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.operators.Connective;
import org.dice.truthtable.parsing.ast.operators.Not;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies bare fragments of formula text, i.e. text without nested parentheses other than
 * the one optional pair around a proposition.
 */
public final class Grammar {

    /** Stands in for an already reduced subtree; never a legal proposition name. */
    public static final String PLACEHOLDER = "tmp";

    public static final String NEGATION = Not.SYMBOL;

    /** A proposition may not start with this character, it is the disjunction symbol. */
    public static final char DISJUNCTION_LEAD = 'v';

    private static final String NAME = "[a-uw-zA-Z][a-zA-Z0-9_]*";
    private static final Pattern PROPOSITION = Pattern.compile("\\((" + NAME + ")\\)|(" + NAME + ")");

    /** Runs of characters that may belong to a name, legal or not. */
    static final Pattern NAME_CHARACTERS = Pattern.compile("[a-zA-Z0-9_]+");

    private Grammar() {
    }

    /**
     * @return the proposition name if {@code text} is a name, optionally wrapped in one pair
     * of parentheses
     */
    public static Optional<String> isProposition(String text) {
        if(text == null){
            return Optional.empty();
        }
        Matcher matcher = PROPOSITION.matcher(text);
        if(!matcher.matches()){
            return Optional.empty();
        }
        String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        if(isPlaceholder(name)){
            return Optional.empty();
        }
        return Optional.of(name);
    }

    /**
     * @return the negated text if {@code text} is the negation symbol directly followed by a
     * proposition or the placeholder
     */
    public static Optional<String> isNegation(String text) {
        if(text == null || !text.startsWith(NEGATION)){
            return Optional.empty();
        }
        String inner = text.substring(NEGATION.length());
        if(isPlaceholder(inner) || isProposition(inner).isPresent()){
            return Optional.of(inner);
        }
        return Optional.empty();
    }

    /**
     * Looks for a single spaced connective symbol in {@code text}.
     *
     * @return the match, or empty if there is no connective or more than one
     */
    public static Optional<ConnectiveMatch> findTopConnective(String text) {
        if(text == null){
            return Optional.empty();
        }
        Connective found = null;
        int offset = -1;
        for(int i = 0; i < text.length(); i++){
            Connective connective = Connective.matchAt(text, i);
            if(connective == null){
                continue;
            }
            if(found != null){
                return Optional.empty();
            }
            found = connective;
            offset = i;
        }
        if(found == null){
            return Optional.empty();
        }
        return Optional.of(new ConnectiveMatch(found,
                text.substring(0, offset),
                text.substring(offset + found.getSpacedSymbol().length()),
                offset));
    }

    public static boolean isPlaceholder(String text) {
        return PLACEHOLDER.equals(text);
    }
}
