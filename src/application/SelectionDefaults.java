package application;

/**
 * Default values and constants for armor selection runs.
 *
 * <h3>Filter defaults</h3>
 * <p>The default filter keeps items with defense in {@code [1, 2500]} and caps the list at
 * six items. The lower bound drops zero-defense armor that can never help; the cap keeps
 * the exhaustive selector at {@code 2^6 = 64} subsets.
 */
public final class SelectionDefaults {

    // =========================================================================
    // Filter Defaults
    // =========================================================================

    /** Default inclusive lower bound on defense. */
    public static final double DEFAULT_MIN_DEFENSE = 1.0;

    /** Default inclusive upper bound on defense. */
    public static final double DEFAULT_MAX_DEFENSE = 2500.0;

    /** Default number of items kept by the filter. */
    public static final int DEFAULT_ITEM_LIMIT = 6;

    // =========================================================================
    // Reporting
    // =========================================================================

    /** Nanoseconds per millisecond for time reporting. */
    public static final double NANOS_PER_MS = 1_000_000.0;

    private SelectionDefaults() {
        throw new AssertionError("Utility class, do not instantiate");
    }
}
