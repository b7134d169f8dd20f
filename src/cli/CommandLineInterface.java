package cli;

import application.SelectionConfiguration;
import application.SelectionOrchestrator;
import domain.model.ArmorItem;
import domain.model.SelectionResult;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command-line entry point for the armor selector.
 *
 * <h3>Usage</h3>
 * <pre>
 *   java cli.CommandLineInterface &lt;armor_file&gt; &lt;budget&gt; [options]
 * </pre>
 *
 * <h3>Output</h3>
 * <ul>
 *   <li>Results are printed to stdout via {@link ResultFormatter} (or to a file if --output is used)</li>
 *   <li>Debug output goes to stderr (if --debug is enabled)</li>
 *   <li>Exit code is 0 on success, non-zero on error</li>
 * </ul>
 *
 * @see ArgumentParser
 * @see SelectionOrchestrator
 * @see ResultFormatter
 */
public final class CommandLineInterface {

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        try {
            execute(args, System.out);
        } catch (IllegalArgumentException e) {
            System.err.println("Argument Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Executes the load, filter, select, report workflow.
     *
     * @param args command-line arguments
     * @param out  stream for results when no --output file is given
     * @throws IOException if the armor file cannot be loaded or the output file written
     * @throws IllegalArgumentException if arguments are invalid, or the exhaustive selector
     *                                  receives 64 or more items
     */
    static void execute(String[] args, PrintStream out) throws IOException {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(args);

        if (parser.isHelpRequested()) {
            parser.printHelp();
            return;
        }

        SelectionConfiguration config = parser.buildConfiguration();

        if (config.isDebugMode()) {
            System.err.println("[CLI] Starting armor selection...");
            System.err.printf("[CLI] Parameters: budget=%s, defense=[%s, %s], limit=%d, strategy=%s%n",
                config.getGoldBudget(), config.getMinDefense(), config.getMaxDefense(),
                config.getItemLimit(), config.getStrategy());
            System.err.printf("[CLI] Loading armor from: %s%n", parser.getArmorFile());
        }

        List<ArmorItem> database = new DataLoader().loadArmors(parser.getArmorFile());

        if (config.isDebugMode()) {
            System.err.printf("[CLI] Database size: %d armors%n", database.size());
        }

        SelectionOrchestrator orchestrator = new SelectionOrchestrator(config);
        List<ArmorItem> candidates = orchestrator.filter(database);
        List<SelectionResult> results = orchestrator.runSelectors(candidates);

        displayResults(parser, out, config, candidates, results);
    }

    /**
     * Displays results to {@code out} or to the --output file.
     */
    private static void displayResults(ArgumentParser parser,
                                       PrintStream out,
                                       SelectionConfiguration config,
                                       List<ArmorItem> candidates,
                                       List<SelectionResult> results) throws IOException {
        if (parser.getOutputFile() != null) {
            try (PrintStream fileOut = new PrintStream(
                    new FileOutputStream(parser.getOutputFile()), true, StandardCharsets.UTF_8.name())) {
                new ResultFormatter(fileOut).printResults(candidates, config.getGoldBudget(), results);
            }
            System.err.println("[CLI] Results written to: " + parser.getOutputFile());
        } else {
            new ResultFormatter(out).printResults(candidates, config.getGoldBudget(), results);
        }
    }
}
