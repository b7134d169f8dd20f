package domain.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one selector run: the chosen armor, its totals, and how long the run took.
 *
 * <p>The selected list is wrapped unmodifiable; the items themselves are the shared
 * instances from the input database.
 */
public final class SelectionResult {

    private final String selectorName;
    private final List<ArmorItem> selected;
    private final ArmorTotals totals;
    private final long elapsedNanos;

    /**
     * @param selectorName name of the selector that produced the result
     * @param selected     chosen items, in selection order
     * @param totals       aggregate of {@code selected}
     * @param elapsedNanos wall-clock duration of the selector call
     */
    public SelectionResult(String selectorName, List<ArmorItem> selected,
                           ArmorTotals totals, long elapsedNanos) {
        if (selectorName == null || selected == null || totals == null) {
            throw new IllegalArgumentException("selectorName, selected and totals cannot be null");
        }
        this.selectorName = selectorName;
        this.selected = Collections.unmodifiableList(selected);
        this.totals = totals;
        this.elapsedNanos = elapsedNanos;
    }

    public String getSelectorName() { return selectorName; }
    public List<ArmorItem> getSelected() { return selected; }
    public ArmorTotals getTotals() { return totals; }
    public long getElapsedNanos() { return elapsedNanos; }

    /**
     * Returns the elapsed time in (fractional) milliseconds.
     *
     * @return elapsed wall-clock time in ms
     */
    public double getElapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("Selection{%s, items=%d, %s}", selectorName, selected.size(), totals);
    }
}
