package domain.model;

/**
 * A single piece of armor that may be selected into a loadout.
 *
 * <p>Each item carries:
 * <ul>
 *   <li>{@code description}: human-readable name, e.g. "new enchanted helmet". Non-empty.</li>
 *   <li>{@code cost}: price in gold. Strictly positive and finite.</li>
 *   <li>{@code defense}: defense points granted. Non-negative and finite.</li>
 * </ul>
 *
 * <h3>Immutability and sharing</h3>
 * <p>All fields are final. One instance is typically referenced from the loaded database,
 * from one or more filtered lists, and from selector results at the same time; none of
 * those collections own or modify it.
 *
 * <h3>Equality</h3>
 * <p>Equality is reference identity. Two items with identical fields are still two distinct
 * pieces of armor, so a database may legitimately contain duplicates.
 */
public final class ArmorItem {

    /** Human-readable description. */
    private final String description;

    /** Cost in gold; {@code > 0}. */
    private final double cost;

    /** Defense points; {@code >= 0}. */
    private final double defense;

    /**
     * Constructs an armor item.
     *
     * @param description non-empty description
     * @param cost        gold cost, strictly positive and finite
     * @param defense     defense points, non-negative and finite
     * @throws IllegalArgumentException if any argument violates the constraints above
     */
    public ArmorItem(String description, double cost, double defense) {
        if (description == null || description.isEmpty()) {
            throw new IllegalArgumentException("Armor description cannot be empty");
        }
        if (!(cost > 0.0) || Double.isInfinite(cost)) {
            throw new IllegalArgumentException(
                "Armor cost must be positive and finite, got: " + cost);
        }
        if (!(defense >= 0.0) || Double.isInfinite(defense)) {
            throw new IllegalArgumentException(
                "Armor defense must be non-negative and finite, got: " + defense);
        }
        this.description = description;
        this.cost = cost;
        this.defense = defense;
    }

    public String getDescription() {
        return description;
    }

    public double getCost() {
        return cost;
    }

    public double getDefense() {
        return defense;
    }

    /**
     * Returns defense points per unit of gold, the greedy ranking key.
     *
     * @return {@code defense / cost}
     */
    public double getEfficiency() {
        return defense / cost;
    }

    @Override
    public String toString() {
        return String.format("Armor{%s, cost=%.2f, defense=%.2f}", description, cost, defense);
    }
}
