package org.dice.truthtable;

import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.assertEquals;

public class TestTruthTableSettings {

    @Test
    public void usesDefaults() {
        TruthTableSettings settings = new TruthTableSettings();
        assertEquals(5, settings.getColumnWidth());
        assertEquals("True", settings.getTrueLabel());
        assertEquals("False", settings.getFalseLabel());
        assertEquals("Please enter an expression:", settings.getPrompt());
        assertEquals("Bad expression.", settings.getBadExpressionMessage());
        assertEquals("Proposition not in expression.", settings.getUnknownPropositionMessage());
    }

    @Test
    public void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(TruthTableSettings.COLUMN_WIDTH, " 7 ");
        properties.setProperty(TruthTableSettings.TRUE_LABEL, "1");
        properties.setProperty(TruthTableSettings.FALSE_LABEL, "0");
        properties.setProperty(TruthTableSettings.BAD_EXPRESSION_MESSAGE, "Nope.");
        TruthTableSettings settings = new TruthTableSettings(properties);
        assertEquals(7, settings.getColumnWidth());
        assertEquals("1", settings.getTrueLabel());
        assertEquals("0", settings.getFalseLabel());
        assertEquals("Nope.", settings.getBadExpressionMessage());
        assertEquals("Please enter an expression:", settings.getPrompt());
    }

    @Test
    public void fallsBackOnInvalidValues() {
        assertEquals(5, new TruthTableSettings(width("abc")).getColumnWidth());
        assertEquals(5, new TruthTableSettings(width("0")).getColumnWidth());

        Properties properties = new Properties();
        properties.setProperty(TruthTableSettings.TRUE_LABEL, "X");
        properties.setProperty(TruthTableSettings.FALSE_LABEL, "X");
        TruthTableSettings settings = new TruthTableSettings(properties);
        assertEquals("True", settings.getTrueLabel());
        assertEquals("False", settings.getFalseLabel());
    }

    @Test
    public void loadsResourceAndSystemOverrides() {
        assertEquals("Bad expression.", TruthTableSettings.load().getBadExpressionMessage());

        System.setProperty(TruthTableSettings.TRUE_LABEL, "yes");
        try {
            assertEquals("yes", TruthTableSettings.load().getTrueLabel());
        }
        finally {
            System.clearProperty(TruthTableSettings.TRUE_LABEL);
        }
    }

    private static Properties width(String value) {
        Properties properties = new Properties();
        properties.setProperty(TruthTableSettings.COLUMN_WIDTH, value);
        return properties;
    }
}
