package application;

import domain.engine.ArmorSelector;
import domain.engine.ExhaustiveSelector;
import domain.engine.GreedySelector;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating {@link ArmorSelector} instances based on configuration.
 *
 * <p>Decouples {@link SelectionOrchestrator} and the benchmark from the concrete
 * selector classes.
 *
 * @see ArmorSelector
 * @see SelectionConfiguration.Strategy
 */
public final class SelectorFactory {

    /**
     * Creates the selectors a strategy runs, in execution order (greedy first).
     *
     * @param strategy the configured strategy
     * @return one or two selectors
     * @throws IllegalArgumentException if strategy is {@code null}
     */
    public static List<ArmorSelector> createSelectors(SelectionConfiguration.Strategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        List<ArmorSelector> selectors = new ArrayList<>(2);
        if (strategy.includesGreedy()) {
            selectors.add(new GreedySelector());
        }
        if (strategy.includesExhaustive()) {
            selectors.add(new ExhaustiveSelector());
        }
        return selectors;
    }

    /**
     * Private constructor to prevent instantiation.
     */
    private SelectorFactory() {
        throw new AssertionError("Factory class, do not instantiate");
    }
}
