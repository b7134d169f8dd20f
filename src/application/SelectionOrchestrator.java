package application;

import domain.collection.ArmorCollections;
import domain.engine.ArmorSelector;
import domain.model.ArmorItem;
import domain.model.ArmorTotals;
import domain.model.SelectionResult;

import java.util.ArrayList;
import java.util.List;

import static application.SelectionDefaults.NANOS_PER_MS;

/**
 * Orchestrates one armor selection run.
 *
 * <h3>Step sequence</h3>
 * <ol>
 *   <li><b>FILTER</b>: Keep the first {@code itemLimit} armors with defense in
 *       {@code [minDefense, maxDefense]}.</li>
 *   <li><b>SELECT</b>: Run each configured selector on the filtered list, timing each
 *       call.</li>
 * </ol>
 *
 * <p>The orchestrator holds only its configuration and selectors, both immutable, so a
 * single instance may serve concurrent runs on independent inputs.
 *
 * @see SelectionConfiguration
 * @see SelectorFactory
 */
public final class SelectionOrchestrator {

    private final SelectionConfiguration config;
    private final List<ArmorSelector> selectors;

    /**
     * Constructs an orchestrator for the given configuration.
     *
     * @param config immutable selection parameters
     */
    public SelectionOrchestrator(SelectionConfiguration config) {
        this.config = config;
        this.selectors = SelectorFactory.createSelectors(config.getStrategy());
    }

    /**
     * Filters the database and runs every configured selector.
     *
     * @param database all loaded armor, read-only
     * @return one result per selector, greedy before exhaustive
     * @throws IllegalArgumentException if the exhaustive selector runs on 64 or more items
     */
    public List<SelectionResult> select(List<ArmorItem> database) {
        return runSelectors(filter(database));
    }

    /**
     * Runs every configured selector on an already filtered list.
     *
     * @param candidates filtered armor, read-only
     * @return one result per selector, greedy before exhaustive
     * @throws IllegalArgumentException if the exhaustive selector runs on 64 or more items
     */
    public List<SelectionResult> runSelectors(List<ArmorItem> candidates) {
        List<SelectionResult> results = new ArrayList<>(selectors.size());
        for (ArmorSelector selector : selectors) {
            results.add(runTimed(selector, candidates));
        }
        return results;
    }

    /**
     * Applies the configured filter.
     *
     * @param database all loaded armor
     * @return filtered candidates
     */
    public List<ArmorItem> filter(List<ArmorItem> database) {
        List<ArmorItem> candidates = ArmorCollections.filter(
            database, config.getMinDefense(), config.getMaxDefense(), config.getItemLimit());

        if (config.isDebugMode()) {
            System.err.printf("[Select] Filtered %d of %d armors (defense in [%s, %s], limit %d)%n",
                candidates.size(), database.size(),
                config.getMinDefense(), config.getMaxDefense(), config.getItemLimit());
        }
        return candidates;
    }

    /**
     * Runs one selector and records its wall-clock time. Timing never affects the result.
     */
    private SelectionResult runTimed(ArmorSelector selector, List<ArmorItem> candidates) {
        long start = System.nanoTime();
        List<ArmorItem> selected = selector.select(candidates, config.getGoldBudget());
        long elapsed = System.nanoTime() - start;

        ArmorTotals totals = ArmorCollections.sum(selected);

        if (config.isDebugMode()) {
            System.err.printf("[Select] %s: %d items, cost %.2f, defense %.2f, %.3f ms%n",
                selector.name(), selected.size(),
                totals.getTotalCost(), totals.getTotalDefense(), elapsed / NANOS_PER_MS);
        }
        return new SelectionResult(selector.name(), selected, totals, elapsed);
    }
}
