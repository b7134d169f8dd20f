package cli;

import application.SelectionConfiguration;
import infrastructure.util.ValidationUtils;

import static application.SelectionDefaults.*;

/**
 * Parses and validates all command-line arguments for the armor selector.
 *
 * <h3>Syntax</h3>
 * <pre>
 *   &lt;armor_file&gt; &lt;budget&gt;
 *       [--help | -h]
 *       [--debug]
 *       [--output &lt;file&gt; | -o &lt;file&gt;]
 *       [--min-defense &lt;x&gt;]
 *       [--max-defense &lt;x&gt;]
 *       [--limit &lt;n&gt;]
 *       [--strategy GREEDY|EXHAUSTIVE|BOTH]
 * </pre>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   java cli.CommandLineInterface data/armor.csv 500 --limit 10 --strategy EXHAUSTIVE
 * </pre>
 *
 * @see SelectionConfiguration
 */
public final class ArgumentParser {

    // =========================================================================
    // Error Messages
    // =========================================================================

    private static final String USAGE_MESSAGE =
        "Usage: <armor_file> <budget> [OPTIONS]\n" +
        "Options:\n" +
        "  --help, -h              Show this help message and exit\n" +
        "  --debug                 Enable debug output with per-selector timing\n" +
        "  --output, -o <file>     Write results to file instead of stdout\n" +
        "  --min-defense <x>       Inclusive lower defense bound (default: 1)\n" +
        "  --max-defense <x>       Inclusive upper defense bound (default: 2500)\n" +
        "  --limit <n>             Keep at most n qualifying armors (default: 6)\n" +
        "  --strategy <strategy>   Selector: GREEDY, EXHAUSTIVE, BOTH (default: BOTH)";

    private static final String MISSING_ARGS_ERROR =
        "Missing required arguments. " + USAGE_MESSAGE;

    private static final String INVALID_BUDGET_FORMAT =
        "Invalid budget: must be a non-negative number";

    private static final String INVALID_NUMBER_FORMAT =
        "%s requires a number, got: %s";

    private static final String MISSING_VALUE_FORMAT =
        "%s requires a value";

    private static final String UNKNOWN_STRATEGY_FORMAT =
        "Unknown strategy: %s. Valid strategies: GREEDY, EXHAUSTIVE, BOTH";

    private static final String UNKNOWN_ARG_FORMAT =
        "Unknown argument: %s. Use --help for usage information.";

    // =========================================================================
    // Parsed Fields
    // =========================================================================

    private String armorFile;
    private double goldBudget;
    private boolean helpRequested = false;
    private boolean debugMode = false;
    private String outputFile = null;
    private double minDefense = DEFAULT_MIN_DEFENSE;
    private double maxDefense = DEFAULT_MAX_DEFENSE;
    private int itemLimit = DEFAULT_ITEM_LIMIT;
    private SelectionConfiguration.Strategy strategy = SelectionConfiguration.Strategy.BOTH;

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Parses command-line arguments.
     *
     * @param args command-line arguments from {@code main()}
     * @throws IllegalArgumentException if arguments are invalid or missing
     */
    public void parse(String[] args) {
        // Allow --help even without required args
        if (args.length > 0 && (args[0].equals("--help") || args[0].equals("-h"))) {
            helpRequested = true;
            return;
        }

        if (args.length < 2) {
            throw new IllegalArgumentException(MISSING_ARGS_ERROR);
        }

        armorFile = args[0];
        goldBudget = parseBudget(args[1]);
        parseOptionalFlags(args);
    }

    /**
     * Builds a {@link SelectionConfiguration} from parsed arguments.
     *
     * <p>Must be called after {@link #parse(String[])}.
     *
     * @return immutable selection configuration
     * @throws IllegalArgumentException if the defense range is inverted
     */
    public SelectionConfiguration buildConfiguration() {
        return new SelectionConfiguration.Builder()
            .setGoldBudget(goldBudget)
            .setDefenseRange(minDefense, maxDefense)
            .setItemLimit(itemLimit)
            .setStrategy(strategy)
            .setDebugMode(debugMode)
            .build();
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public String getArmorFile() { return armorFile; }
    public double getGoldBudget() { return goldBudget; }
    public boolean isHelpRequested() { return helpRequested; }
    public boolean isDebugMode() { return debugMode; }
    public String getOutputFile() { return outputFile; }
    public double getMinDefense() { return minDefense; }
    public double getMaxDefense() { return maxDefense; }
    public int getItemLimit() { return itemLimit; }
    public SelectionConfiguration.Strategy getStrategy() { return strategy; }

    /**
     * Prints help message to stderr.
     */
    public void printHelp() {
        System.err.println("MaxDefense: armor selection within a gold budget");
        System.err.println();
        System.err.println(USAGE_MESSAGE);
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java cli.CommandLineInterface data/armor.csv 500 --strategy BOTH --debug");
    }

    // =========================================================================
    // Private Parsing Methods
    // =========================================================================

    private double parseBudget(String arg) {
        try {
            double parsed = Double.parseDouble(arg);
            ValidationUtils.validateNonNegative(parsed, "budget");
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(INVALID_BUDGET_FORMAT);
        }
    }

    /**
     * Parses optional flags starting after the two positional arguments.
     *
     * <p>Flags that take a value consume the next argument; their helper returns the index
     * of that value so the loop's own increment moves past it.
     *
     * @param args command-line arguments
     * @throws IllegalArgumentException if flags are invalid
     */
    private void parseOptionalFlags(String[] args) {
        for (int i = 2; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "--help":
                case "-h":
                    helpRequested = true;
                    break;

                case "--debug":
                    debugMode = true;
                    break;

                case "--output":
                case "-o":
                    outputFile = requireValue(args, i, arg);
                    i++;
                    break;

                case "--min-defense":
                    minDefense = parseDouble(requireValue(args, i, arg), arg);
                    i++;
                    break;

                case "--max-defense":
                    maxDefense = parseDouble(requireValue(args, i, arg), arg);
                    i++;
                    break;

                case "--limit":
                    itemLimit = parseLimit(requireValue(args, i, arg), arg);
                    i++;
                    break;

                case "--strategy":
                    strategy = parseStrategy(requireValue(args, i, arg));
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException(String.format(UNKNOWN_ARG_FORMAT, arg));
            }
        }
    }

    private static String requireValue(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(String.format(MISSING_VALUE_FORMAT, flag));
        }
        return args[i + 1];
    }

    private static double parseDouble(String value, String flag) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_NUMBER_FORMAT, flag, value));
        }
    }

    private static int parseLimit(String value, String flag) {
        try {
            int parsed = Integer.parseInt(value);
            ValidationUtils.validatePositive(parsed, "limit");
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_NUMBER_FORMAT, flag, value));
        }
    }

    private static SelectionConfiguration.Strategy parseStrategy(String value) {
        String strategyStr = value.toUpperCase();
        try {
            return SelectionConfiguration.Strategy.valueOf(strategyStr);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(UNKNOWN_STRATEGY_FORMAT, strategyStr));
        }
    }
}
