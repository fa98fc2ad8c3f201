package org.dice.truthtable.console;

import com.google.common.io.Resources;
import org.apache.commons.lang.StringUtils;
import org.dice.truthtable.BadExpressionException;
import org.dice.truthtable.TruthTableSettings;
import org.dice.truthtable.parsing.FormulaParser;
import org.dice.truthtable.parsing.ast.Formula;
import org.dice.truthtable.table.TableFormatter;
import org.dice.truthtable.table.TruthTable;
import org.dice.truthtable.table.TruthTableGenerator;
import org.dice.truthtable.table.UnknownPropositionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Prints the truth table of a formula typed by the user.
 *
 * With {@code -h} or {@code --help} prints usage, with any other arguments treats them as one
 * input line, and without arguments keeps prompting until a blank line or {@code exit}.
 */
public class TruthTableConsole {

    private static final Logger log = LoggerFactory.getLogger(TruthTableConsole.class);

    static final String HELP_RESOURCE = "truth-table-help.txt";
    private static final String EXIT = "exit";

    private final TruthTableSettings settings;
    private final TableFormatter formatter;
    private final PrintStream out;

    public TruthTableConsole(TruthTableSettings settings, PrintStream out) {
        this.settings = settings;
        this.formatter = new TableFormatter(settings);
        this.out = out;
    }

    /**
     * Prints the table for one input line, or a message if the line is not usable.
     *
     * @return true if a table was printed
     */
    public boolean process(String line) {
        try {
            InputLine input = InputLineParser.parse(line);
            Formula formula = FormulaParser.parse(input.getFormulaText());
            TruthTable table = TruthTableGenerator.generate(formula, input.getFixedValues());
            out.println(formatter.format(table));
            return true;
        }
        catch (UnknownPropositionException ex){
            log.debug("Rejected '{}': {}", line, ex.getMessage());
            out.println(settings.getUnknownPropositionMessage());
        }
        catch (BadExpressionException ex){
            log.debug("Rejected '{}': {}", line, ex.getMessage());
            out.println(settings.getBadExpressionMessage());
        }
        catch (IllegalArgumentException ex){
            log.error(String.format("Could not build a table for '%s'", line), ex);
            out.println(settings.getBadExpressionMessage());
        }
        return false;
    }

    public void run(BufferedReader in) throws IOException {
        String userInput = prompt(in);
        while (userInput != null && !userInput.trim().equals(EXIT) && !StringUtils.isBlank(userInput))
        {
            process(userInput);
            out.println();
            userInput = prompt(in);
        }
    }

    private String prompt(BufferedReader in) throws IOException {
        out.println(settings.getPrompt());
        return in.readLine();
    }

    public void printHelp() throws IOException {
        out.println(Resources.toString(Resources.getResource(HELP_RESOURCE), StandardCharsets.UTF_8));
    }

    static boolean isHelpFlag(String arg) {
        return "-h".equals(arg) || "--help".equals(arg);
    }

    public static void main(String[] args) throws IOException {
        TruthTableConsole console = new TruthTableConsole(TruthTableSettings.load(), System.out);
        if(args.length > 0 && isHelpFlag(args[0])){
            console.printHelp();
        }
        else if(args.length > 0){
            console.process(StringUtils.join(args, " "));
        }
        else{
            console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
    }
}
