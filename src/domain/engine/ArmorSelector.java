package domain.engine;

import domain.model.ArmorItem;

import java.util.List;

/**
 * Common interface for armor selection strategies.
 *
 * <p>A selector chooses a subset of the given armor whose total gold cost does not exceed
 * the budget, trying to maximize total defense. Implementations differ in how hard they
 * try:
 * <ul>
 *   <li>{@link GreedySelector}: best defense-per-gold first; fast, not optimal.</li>
 *   <li>{@link ExhaustiveSelector}: every subset; exact, exponential, fewer than 64 items.</li>
 * </ul>
 *
 * <p>Every implementation must:
 * <ol>
 *   <li>Leave {@code armors} and its items untouched.</li>
 *   <li>Return a freshly allocated list whose total cost is {@code <= goldBudget}.</li>
 *   <li>Return an empty list, not throw, when nothing fits.</li>
 *   <li>Keep no state between calls, so one instance may be shared across threads.</li>
 * </ol>
 *
 * @see application.SelectorFactory
 */
public interface ArmorSelector {

    /**
     * Selects a feasible subset of {@code armors}.
     *
     * @param armors     candidate items, read-only
     * @param goldBudget maximum total cost of the selection
     * @return selected items, owned by the caller
     */
    List<ArmorItem> select(List<ArmorItem> armors, double goldBudget);

    /**
     * Short display name used in reports and benchmark output.
     *
     * @return selector name
     */
    String name();
}
