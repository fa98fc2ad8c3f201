package org.dice.truthtable.parsing;

import org.dice.truthtable.parsing.ast.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning formula text into a {@link Formula}.
 */
public final class FormulaParser {

    private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

    private FormulaParser() {
    }

    /**
     * @throws SyntaxException if {@code text} is not a well formed formula
     */
    public static Formula parse(String text) {
        Formula formula = new RecursiveDescentParser(new Lexer(text)).parse();
        log.debug("Parsed '{}' as {}", text, formula);
        return formula;
    }
}
