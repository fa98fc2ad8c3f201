package org.dice.truthtable.console;

import com.google.common.collect.ImmutableMap;

/**
 * A formula and the fixed values typed after it.
 */
public class InputLine {

    private final String formulaText;
    private final ImmutableMap<String, Boolean> fixedValues;

    public InputLine(String formulaText, ImmutableMap<String, Boolean> fixedValues) {
        this.formulaText = formulaText;
        this.fixedValues = fixedValues;
    }

    public String getFormulaText() {
        return formulaText;
    }

    /**
     * @return fixed values in the order they were typed
     */
    public ImmutableMap<String, Boolean> getFixedValues() {
        return fixedValues;
    }
}
