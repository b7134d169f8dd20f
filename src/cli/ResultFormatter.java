package cli;

import domain.collection.ArmorCollections;
import domain.model.ArmorItem;
import domain.model.ArmorTotals;
import domain.model.SelectionResult;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Formats armor lists and selection results for human reading.
 *
 * <p>All floating-point values use {@link Locale#ROOT} so the output is identical
 * regardless of system locale.
 */
public final class ResultFormatter {

    private final PrintStream out;

    /**
     * Constructs a formatter writing to the given stream.
     *
     * @param out destination stream
     */
    public ResultFormatter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints every armor in the list followed by grand totals.
     *
     * @param armors armor list, possibly empty
     */
    public void printArmors(List<ArmorItem> armors) {
        out.println("*** Armor Vector ***");

        if (armors.isEmpty()) {
            out.println("[empty armor list]");
            return;
        }

        for (ArmorItem armor : armors) {
            out.printf(Locale.ROOT, "Ye olde %s ==> Cost of %s gold; Defense points = %s%n",
                armor.getDescription(),
                formatNumber(armor.getCost()),
                formatNumber(armor.getDefense()));
        }

        ArmorTotals totals = ArmorCollections.sum(armors);
        out.printf(Locale.ROOT, "> Grand total cost: %s gold%n", formatNumber(totals.getTotalCost()));
        out.printf(Locale.ROOT, "> Grand total defense: %s%n", formatNumber(totals.getTotalDefense()));
    }

    /**
     * Prints the filtered candidates and then each selector result with its timing.
     *
     * @param candidates filtered armor the selectors ran on
     * @param goldBudget the budget used
     * @param results    selector results in execution order
     */
    public void printResults(List<ArmorItem> candidates, double goldBudget, List<SelectionResult> results) {
        out.println("=================================================");
        out.printf(Locale.ROOT, "CANDIDATES (%d) FOR A BUDGET OF %s GOLD%n",
            candidates.size(), formatNumber(goldBudget));
        out.println("=================================================");
        printArmors(candidates);

        for (SelectionResult result : results) {
            out.println("=================================================");
            out.printf("%s SELECTION%n", result.getSelectorName().toUpperCase(Locale.ROOT));
            out.println("-------------------------------------------------");
            printArmors(result.getSelected());
            out.printf(Locale.ROOT, "Elapsed time: %.3f ms%n", result.getElapsedMillis());
        }
        out.println("=================================================");
    }

    /**
     * Whole numbers print without a fractional part; others with up to four decimals.
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%d", (long) value);
        }
        String formatted = String.format(Locale.ROOT, "%.4f", value);
        formatted = formatted.replaceAll("0+$", "");
        return formatted.endsWith(".") ? formatted.substring(0, formatted.length() - 1) : formatted;
    }
}
