package domain.collection;

import domain.model.ArmorItem;
import domain.model.ArmorTotals;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Aggregation and filtering over armor collections.
 *
 * <p>Both operations are pure: they never modify the source collection or its items,
 * and every returned list is freshly allocated and owned by the caller.
 */
public final class ArmorCollections {

    private ArmorCollections() {
        // Prevent instantiation, static methods only
    }

    /**
     * Sums gold cost and defense over a collection.
     *
     * @param armors any collection, possibly empty
     * @return the totals; {@link ArmorTotals#EMPTY} values for an empty collection
     */
    public static ArmorTotals sum(Collection<ArmorItem> armors) {
        double totalCost = 0.0;
        double totalDefense = 0.0;
        for (ArmorItem armor : armors) {
            totalCost += armor.getCost();
            totalDefense += armor.getDefense();
        }
        return new ArmorTotals(totalCost, totalDefense);
    }

    /**
     * Returns the first {@code limit} items of {@code source} whose defense lies in
     * {@code [minDefense, maxDefense]}.
     *
     * <p>This is a truncation, not a best-N selection: scanning stops as soon as
     * {@code limit} items have been accepted, and source order is preserved. Used to drop
     * items that cannot help (zero defense) and to cap the input of the exhaustive selector.
     *
     * @param source     items to scan, in order
     * @param minDefense inclusive lower bound on defense
     * @param maxDefense inclusive upper bound on defense
     * @param limit      maximum number of items to accept
     * @return new list of accepted items; empty if {@code limit <= 0} or nothing qualifies
     */
    public static List<ArmorItem> filter(List<ArmorItem> source,
                                         double minDefense,
                                         double maxDefense,
                                         int limit) {
        List<ArmorItem> filtered = new ArrayList<>();
        if (limit <= 0) {
            return filtered;
        }

        for (ArmorItem armor : source) {
            double defense = armor.getDefense();
            if (defense >= minDefense && defense <= maxDefense) {
                filtered.add(armor);
                if (filtered.size() >= limit) {
                    break;
                }
            }
        }
        return filtered;
    }
}
