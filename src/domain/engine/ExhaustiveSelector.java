package domain.engine;

import domain.collection.ArmorCollections;
import domain.model.ArmorItem;
import domain.model.ArmorTotals;

import java.util.ArrayList;
import java.util.List;

/**
 * Exact armor selection by enumerating every subset.
 *
 * <p>For {@code n} items, every mask in {@code [0, 2^n)} names one candidate subset:
 * bit {@code j} set means item {@code j} is included. Each candidate is summed with
 * {@link ArmorCollections#sum}; it is feasible iff its cost is {@code <= goldBudget}.
 * The feasible candidate with the greatest total defense is returned.
 *
 * <h3>Tie-break</h3>
 * <p>Strict {@code >} on defense: the first feasible candidate in mask order to reach the
 * best value is kept. The empty subset (mask 0) is always feasible and is the initial best,
 * so the result is never absent.
 *
 * <h3>Input bound</h3>
 * <p>The mask is a 64-bit counter, so {@code n} must be below {@link #MAX_ITEMS_EXCLUSIVE}.
 * Larger inputs are rejected before enumeration starts. In practice {@code n} should be
 * kept far smaller (see {@link ArmorCollections#filter}); cost grows as O(2^n · n).
 *
 * <p><b>Correctness guarantee:</b> EXACT over the given items.
 */
public final class ExhaustiveSelector implements ArmorSelector {

    /** Exclusive upper bound on the number of items, the bit width of the mask counter. */
    public static final int MAX_ITEMS_EXCLUSIVE = Long.SIZE;

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if {@code armors.size() >= 64}
     */
    @Override
    public List<ArmorItem> select(List<ArmorItem> armors, double goldBudget) {
        final int n = armors.size();
        if (n >= MAX_ITEMS_EXCLUSIVE) {
            throw new IllegalArgumentException(
                "Exhaustive search supports fewer than " + MAX_ITEMS_EXCLUSIVE
                    + " items, got: " + n);
        }

        // 1L << 63 is negative as a signed long; the loop compares unsigned
        final long subsetCount = 1L << n;

        List<ArmorItem> best = new ArrayList<>();
        double bestDefense = 0.0;
        boolean found = false;

        List<ArmorItem> candidate = new ArrayList<>(n);
        for (long mask = 0; Long.compareUnsigned(mask, subsetCount) < 0; mask++) {
            candidate.clear();
            for (int j = 0; j < n; j++) {
                if (((mask >>> j) & 1L) == 1L) {
                    candidate.add(armors.get(j));
                }
            }

            ArmorTotals totals = ArmorCollections.sum(candidate);
            if (!totals.fitsWithin(goldBudget)) {
                continue;
            }
            if (!found || totals.getTotalDefense() > bestDefense) {
                best = new ArrayList<>(candidate);
                bestDefense = totals.getTotalDefense();
                found = true;
            }
        }

        return best;
    }

    @Override
    public String name() {
        return "exhaustive";
    }
}
