package org.dice.truthtable.table;

import org.apache.commons.lang.StringUtils;
import org.dice.truthtable.TruthTableSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays a {@link TruthTable} out as text: one centered column per proposition, then a tab and
 * the formula (header) or its value (rows).
 */
public class TableFormatter {

    private static final String COLUMN_SEPARATOR = " ";
    private static final String RESULT_SEPARATOR = "\t";
    private static final String LINE_SEPARATOR = "\n";

    private final TruthTableSettings settings;

    public TableFormatter(TruthTableSettings settings) {
        this.settings = settings;
    }

    public String format(TruthTable table) {
        List<String> lines = new ArrayList<String>();
        lines.add(line(table.getHeader(), table.getFormula().render()));
        for(TableRow row : table.getRows()){
            List<String> values = new ArrayList<String>();
            for(Boolean value : row.getAssignment().values()){
                values.add(label(value));
            }
            lines.add(line(values, label(row.getResult())));
        }
        return StringUtils.join(lines, LINE_SEPARATOR);
    }

    private String line(List<String> cells, String last) {
        StringBuilder sb = new StringBuilder();
        for(String cell : cells){
            // odd padding goes on the right
            sb.append(StringUtils.center(cell, settings.getColumnWidth())).append(COLUMN_SEPARATOR);
        }
        return sb.append(RESULT_SEPARATOR).append(last).toString();
    }

    private String label(boolean value) {
        return value ? settings.getTrueLabel() : settings.getFalseLabel();
    }
}
