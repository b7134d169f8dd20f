package domain.model;

/**
 * Aggregate gold cost and defense of a collection of {@link ArmorItem}s.
 *
 * <p>Produced by {@link domain.collection.ArmorCollections#sum}. Immutable.
 */
public final class ArmorTotals {

    /** Totals of the empty collection. */
    public static final ArmorTotals EMPTY = new ArmorTotals(0.0, 0.0);

    private final double totalCost;
    private final double totalDefense;

    public ArmorTotals(double totalCost, double totalDefense) {
        this.totalCost = totalCost;
        this.totalDefense = totalDefense;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public double getTotalDefense() {
        return totalDefense;
    }

    /**
     * Whether these totals fit within the given gold budget.
     *
     * @param goldBudget maximum total cost
     * @return {@code true} iff {@code totalCost <= goldBudget}
     */
    public boolean fitsWithin(double goldBudget) {
        return totalCost <= goldBudget;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArmorTotals)) return false;
        ArmorTotals other = (ArmorTotals) obj;
        return Double.compare(totalCost, other.totalCost) == 0
            && Double.compare(totalDefense, other.totalDefense) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(totalCost) + Double.hashCode(totalDefense);
    }

    @Override
    public String toString() {
        return String.format("Totals{cost=%.2f, defense=%.2f}", totalCost, totalDefense);
    }
}
