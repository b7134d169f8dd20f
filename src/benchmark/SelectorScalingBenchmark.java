package benchmark;

import application.SelectionConfiguration;
import application.SelectorFactory;
import cli.DataLoader;
import domain.collection.ArmorCollections;
import domain.engine.ArmorSelector;
import domain.engine.ExhaustiveSelector;
import domain.model.ArmorItem;
import infrastructure.util.ValidationUtils;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static application.SelectionDefaults.*;

/**
 * Measures how greedy and exhaustive selection scale with input size.
 *
 * <p>For {@code n = 1 .. maxN}, takes the first {@code n} armors with defense in the
 * default range, times both selectors ({@value #WARMUP_RUNS} warm-up runs, then
 * {@value #MEASURED_RUNS} measured runs, median reported) and emits one CSV row.
 *
 * <h3>Usage</h3>
 * <pre>
 *   java benchmark.SelectorScalingBenchmark &lt;armor_file&gt; &lt;budget&gt; &lt;max_n&gt; [output_csv]
 * </pre>
 *
 * <h3>Output</h3>
 * <pre>
 *   n,greedy_ms,exhaustive_ms,greedy_defense,exhaustive_defense
 *   1,0.004,0.006,42,42
 *   ...
 * </pre>
 *
 * <p>Stops early if the database has fewer than {@code n} qualifying armors.
 */
public final class SelectorScalingBenchmark {

    // =========================================================================
    // Configuration
    // =========================================================================

    static final int WARMUP_RUNS = 2;
    static final int MEASURED_RUNS = 5;

    static final String CSV_HEADER = "n,greedy_ms,exhaustive_ms,greedy_defense,exhaustive_defense";

    public static void main(String[] args) {
        if (args.length < 3) {
            System.err.println("Usage: <armor_file> <budget> <max_n> [output_csv]");
            System.exit(1);
        }

        try {
            double budget = Double.parseDouble(args[1]);
            ValidationUtils.validateNonNegative(budget, "budget");
            int maxN = Integer.parseInt(args[2]);
            ValidationUtils.validatePositive(maxN, "max_n");
            if (maxN >= ExhaustiveSelector.MAX_ITEMS_EXCLUSIVE) {
                throw new IllegalArgumentException(
                    "max_n must be below " + ExhaustiveSelector.MAX_ITEMS_EXCLUSIVE + ", got: " + maxN);
            }

            List<ArmorItem> database = new DataLoader().loadArmors(args[0]);

            if (args.length > 3) {
                try (PrintStream fileOut = new PrintStream(
                        new FileOutputStream(args[3]), true, StandardCharsets.UTF_8.name())) {
                    run(database, budget, maxN, fileOut);
                }
                System.err.println("[Benchmark] Results written to: " + args[3]);
            } else {
                run(database, budget, maxN, System.out);
            }
        } catch (NumberFormatException e) {
            System.err.println("Argument Error: invalid number (" + e.getMessage() + ")");
            System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println("Argument Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Runs the scaling sweep and writes CSV rows to {@code out}.
     *
     * @param database loaded armor
     * @param budget   gold budget for every run
     * @param maxN     largest input size, below 64
     * @param out      CSV destination
     * @return number of rows written (excluding the header)
     */
    static int run(List<ArmorItem> database, double budget, int maxN, PrintStream out) {
        List<ArmorSelector> selectors = SelectorFactory.createSelectors(SelectionConfiguration.Strategy.BOTH);
        ArmorSelector greedy = selectors.get(0);
        ArmorSelector exhaustive = selectors.get(1);

        out.println(CSV_HEADER);
        int rows = 0;
        for (int n = 1; n <= maxN; n++) {
            List<ArmorItem> candidates = ArmorCollections.filter(
                database, DEFAULT_MIN_DEFENSE, DEFAULT_MAX_DEFENSE, n);
            if (candidates.size() < n) {
                System.err.printf("[Benchmark] Only %d qualifying armors; stopping at n=%d%n",
                    candidates.size(), n - 1);
                break;
            }

            double greedyMs = medianMillis(greedy, candidates, budget);
            double exhaustiveMs = medianMillis(exhaustive, candidates, budget);
            double greedyDefense = ArmorCollections.sum(greedy.select(candidates, budget)).getTotalDefense();
            double exhaustiveDefense = ArmorCollections.sum(exhaustive.select(candidates, budget)).getTotalDefense();

            out.printf(Locale.ROOT, "%d,%.4f,%.4f,%.4f,%.4f%n",
                n, greedyMs, exhaustiveMs, greedyDefense, exhaustiveDefense);
            rows++;
        }
        return rows;
    }

    private static double medianMillis(ArmorSelector selector, List<ArmorItem> candidates, double budget) {
        for (int i = 0; i < WARMUP_RUNS; i++) {
            selector.select(candidates, budget);
        }

        long[] times = new long[MEASURED_RUNS];
        for (int i = 0; i < MEASURED_RUNS; i++) {
            long start = System.nanoTime();
            selector.select(candidates, budget);
            times[i] = System.nanoTime() - start;
        }
        Arrays.sort(times);
        return times[MEASURED_RUNS / 2] / NANOS_PER_MS;
    }

    private SelectorScalingBenchmark() {
        throw new AssertionError("Utility class, do not instantiate");
    }
}
