package application;

import infrastructure.util.ValidationUtils;

import static application.SelectionDefaults.*;

/**
 * Immutable value object encapsulating all user-facing selection parameters.
 *
 * <p>Constructed exclusively via the nested {@link Builder}, which validates each
 * parameter before allowing {@link Builder#build()} to succeed.
 *
 * <h3>Key parameters</h3>
 * <ul>
 *   <li><b>goldBudget</b>: maximum total gold cost of a selection.</li>
 *   <li><b>minDefense / maxDefense</b>: inclusive defense bounds applied by the filter.</li>
 *   <li><b>itemLimit</b>: number of qualifying items kept by the filter.</li>
 *   <li><b>strategy</b>: which selector(s) to run.</li>
 * </ul>
 */
public final class SelectionConfiguration {

    /**
     * Selector variants that a run may execute.
     */
    public enum Strategy {
        /** Greedy defense-per-gold heuristic only. */
        GREEDY,
        /** Exhaustive subset search only. */
        EXHAUSTIVE,
        /** Greedy, then exhaustive, on the same filtered list (default). */
        BOTH;

        public boolean includesGreedy() {
            return this == GREEDY || this == BOTH;
        }

        public boolean includesExhaustive() {
            return this == EXHAUSTIVE || this == BOTH;
        }
    }

    private final double goldBudget;
    private final double minDefense;
    private final double maxDefense;
    private final int itemLimit;
    private final Strategy strategy;
    private final boolean debugMode;

    private SelectionConfiguration(Builder builder) {
        this.goldBudget = builder.goldBudget;
        this.minDefense = builder.minDefense;
        this.maxDefense = builder.maxDefense;
        this.itemLimit = builder.itemLimit;
        this.strategy = builder.strategy;
        this.debugMode = builder.debugMode;
    }

    public double getGoldBudget() { return goldBudget; }
    public double getMinDefense() { return minDefense; }
    public double getMaxDefense() { return maxDefense; }
    public int getItemLimit() { return itemLimit; }
    public Strategy getStrategy() { return strategy; }
    public boolean isDebugMode() { return debugMode; }

    /**
     * Fluent builder for {@link SelectionConfiguration}.
     *
     * <p>Defaults:
     * <ul>
     *   <li>{@code minDefense}: {@link SelectionDefaults#DEFAULT_MIN_DEFENSE}</li>
     *   <li>{@code maxDefense}: {@link SelectionDefaults#DEFAULT_MAX_DEFENSE}</li>
     *   <li>{@code itemLimit}: {@link SelectionDefaults#DEFAULT_ITEM_LIMIT}</li>
     *   <li>{@code strategy}: {@link Strategy#BOTH}</li>
     * </ul>
     * The gold budget has no default and must be set.
     */
    public static class Builder {
        private double goldBudget = Double.NaN;
        private double minDefense = DEFAULT_MIN_DEFENSE;
        private double maxDefense = DEFAULT_MAX_DEFENSE;
        private int itemLimit = DEFAULT_ITEM_LIMIT;
        private Strategy strategy = Strategy.BOTH;
        private boolean debugMode = false;

        public Builder setGoldBudget(double goldBudget) {
            ValidationUtils.validateNonNegative(goldBudget, "goldBudget");
            this.goldBudget = goldBudget;
            return this;
        }

        /**
         * Sets the inclusive defense bounds used by the filter.
         *
         * @param minDefense lower bound
         * @param maxDefense upper bound, {@code >= minDefense}
         * @return this builder
         */
        public Builder setDefenseRange(double minDefense, double maxDefense) {
            ValidationUtils.validateRange(minDefense, maxDefense, "defense range");
            this.minDefense = minDefense;
            this.maxDefense = maxDefense;
            return this;
        }

        public Builder setItemLimit(int itemLimit) {
            ValidationUtils.validatePositive(itemLimit, "itemLimit");
            this.itemLimit = itemLimit;
            return this;
        }

        public Builder setStrategy(Strategy strategy) {
            if (strategy == null) throw new IllegalArgumentException("strategy cannot be null");
            this.strategy = strategy;
            return this;
        }

        public Builder setDebugMode(boolean debug) {
            this.debugMode = debug;
            return this;
        }

        public SelectionConfiguration build() {
            if (Double.isNaN(goldBudget)) {
                throw new IllegalStateException("goldBudget must be set");
            }
            return new SelectionConfiguration(this);
        }
    }
}
