package org.dice.truthtable.console;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang.StringUtils;
import org.dice.truthtable.parsing.ParserErrors;
import org.dice.truthtable.parsing.SyntaxException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits {@code <formula>[, <name>=<True|False>]*} into the formula text and its fixed values.
 * Values are matched case-insensitively.
 */
public final class InputLineParser {

    private static final Splitter COMMA = Splitter.on(',').trimResults();
    private static final Splitter EQUALS = Splitter.on('=').trimResults();

    private static final String TRUE = "True";
    private static final String FALSE = "False";

    private InputLineParser() {
    }

    /**
     * @throws SyntaxException with {@link ParserErrors#MalformedFixedValue} if the line is blank
     * or a fixed value is not of the form {@code name=True} or {@code name=False}
     */
    public static InputLine parse(String line) {
        if(StringUtils.isBlank(line)){
            throw malformed("no formula given");
        }
        Iterator<String> parts = COMMA.split(line).iterator();
        String formulaText = parts.next();
        if(formulaText.isEmpty()){
            throw malformed("no formula given");
        }

        Map<String, Boolean> fixed = new LinkedHashMap<String, Boolean>();
        while(parts.hasNext()){
            String pair = parts.next();
            Iterator<String> nameAndValue = EQUALS.split(pair).iterator();
            String name = nameAndValue.next();
            if(name.isEmpty() || !nameAndValue.hasNext()){
                throw malformed(String.format("'%s' is not of the form name=value", pair));
            }
            String value = nameAndValue.next();
            if(nameAndValue.hasNext()){
                throw malformed(String.format("'%s' is not of the form name=value", pair));
            }
            if(fixed.containsKey(name)){
                throw malformed(String.format("'%s' is fixed more than once", name));
            }
            fixed.put(name, toBoolean(value));
        }
        return new InputLine(formulaText, ImmutableMap.copyOf(fixed));
    }

    private static boolean toBoolean(String value) {
        if(TRUE.equalsIgnoreCase(value)){
            return true;
        }
        if(FALSE.equalsIgnoreCase(value)){
            return false;
        }
        throw malformed(String.format("'%s' is neither %s nor %s", value, TRUE, FALSE));
    }

    private static SyntaxException malformed(String message) {
        return new SyntaxException(ParserErrors.MalformedFixedValue, message);
    }
}
