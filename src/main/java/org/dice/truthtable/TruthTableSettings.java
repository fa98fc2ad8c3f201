package org.dice.truthtable;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Display settings for the table and the console. Loaded from {@value #RESOURCE} on the
 * classpath; a system property with the same key overrides the file.
 */
public class TruthTableSettings {

    private static final Logger Log = LoggerFactory.getLogger( TruthTableSettings.class );

    public static final String RESOURCE = "truth-table.properties";

    public static final String COLUMN_WIDTH = "table.columnWidth";
    public static final String TRUE_LABEL = "table.trueLabel";
    public static final String FALSE_LABEL = "table.falseLabel";
    public static final String PROMPT = "console.prompt";
    public static final String BAD_EXPRESSION_MESSAGE = "console.badExpressionMessage";
    public static final String UNKNOWN_PROPOSITION_MESSAGE = "console.unknownPropositionMessage";

    static final int DEFAULT_COLUMN_WIDTH = 5;
    static final String DEFAULT_TRUE_LABEL = "True";
    static final String DEFAULT_FALSE_LABEL = "False";
    static final String DEFAULT_PROMPT = "Please enter an expression:";
    static final String DEFAULT_BAD_EXPRESSION_MESSAGE = "Bad expression.";
    static final String DEFAULT_UNKNOWN_PROPOSITION_MESSAGE = "Proposition not in expression.";

    private int columnWidth = DEFAULT_COLUMN_WIDTH;
    private String trueLabel = DEFAULT_TRUE_LABEL;
    private String falseLabel = DEFAULT_FALSE_LABEL;
    private String prompt = DEFAULT_PROMPT;
    private String badExpressionMessage = DEFAULT_BAD_EXPRESSION_MESSAGE;
    private String unknownPropositionMessage = DEFAULT_UNKNOWN_PROPOSITION_MESSAGE;

    public TruthTableSettings() {
    }

    public TruthTableSettings(Properties properties) {
        String width = properties.getProperty(COLUMN_WIDTH);
        if(!StringUtils.isBlank(width)){
            try {
                int parsed = Integer.parseInt(width.trim());
                if(parsed < 1){
                    Log.error(String.format("%s must be at least 1 but was %d. Defaulting to %d", COLUMN_WIDTH, parsed, DEFAULT_COLUMN_WIDTH));
                }
                else{
                    this.columnWidth = parsed;
                }
            }
            catch (NumberFormatException ex){
                Log.error(String.format("Invalid %s: %s. Defaulting to %d", COLUMN_WIDTH, width, DEFAULT_COLUMN_WIDTH));
            }
        }
        this.trueLabel = label(properties, TRUE_LABEL, DEFAULT_TRUE_LABEL);
        this.falseLabel = label(properties, FALSE_LABEL, DEFAULT_FALSE_LABEL);
        if(this.trueLabel.equals(this.falseLabel)){
            Log.error(String.format("%s and %s are both '%s'. Defaulting to %s/%s", TRUE_LABEL, FALSE_LABEL, trueLabel, DEFAULT_TRUE_LABEL, DEFAULT_FALSE_LABEL));
            this.trueLabel = DEFAULT_TRUE_LABEL;
            this.falseLabel = DEFAULT_FALSE_LABEL;
        }
        this.prompt = label(properties, PROMPT, DEFAULT_PROMPT);
        this.badExpressionMessage = label(properties, BAD_EXPRESSION_MESSAGE, DEFAULT_BAD_EXPRESSION_MESSAGE);
        this.unknownPropositionMessage = label(properties, UNKNOWN_PROPOSITION_MESSAGE, DEFAULT_UNKNOWN_PROPOSITION_MESSAGE);
    }

    private static String label(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(key);
        return StringUtils.isBlank(value) ? defaultValue : value;
    }

    /**
     * Reads {@value #RESOURCE} and applies system property overrides.
     */
    public static TruthTableSettings load() {
        Properties properties = new Properties();
        InputStream stream = TruthTableSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if(stream == null){
            Log.warn(String.format("%s not found on the classpath, using defaults", RESOURCE));
        }
        else{
            try {
                try {
                    properties.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
                }
                finally {
                    stream.close();
                }
            }
            catch (IOException ex){
                Log.error(String.format("Failed to read %s, using defaults", RESOURCE), ex);
            }
        }
        for(String key : new String[]{COLUMN_WIDTH, TRUE_LABEL, FALSE_LABEL, PROMPT,
                BAD_EXPRESSION_MESSAGE, UNKNOWN_PROPOSITION_MESSAGE}){
            String override = System.getProperty(key);
            if(override != null){
                properties.setProperty(key, override);
            }
        }
        return new TruthTableSettings(properties);
    }

    public int getColumnWidth() {
        return columnWidth;
    }

    public String getTrueLabel() {
        return trueLabel;
    }

    public String getFalseLabel() {
        return falseLabel;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getBadExpressionMessage() {
        return badExpressionMessage;
    }

    public String getUnknownPropositionMessage() {
        return unknownPropositionMessage;
    }
}
