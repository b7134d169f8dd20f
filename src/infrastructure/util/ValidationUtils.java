package infrastructure.util;

/**
 * Input validation utilities used at system boundaries (CLI argument parsing,
 * configuration building).
 *
 * <p>All methods throw {@link IllegalArgumentException} with a descriptive message
 * on invalid input so callers can propagate or display the reason to the user.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        // Prevent instantiation, static methods only
    }

    /**
     * Validates that an integer value is strictly positive (greater than zero).
     *
     * @param value     the integer value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value <= 0}
     */
    public static void validatePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(
                paramName + " must be positive, got: " + value);
        }
    }

    /**
     * Validates that a double value is finite and not negative.
     *
     * @param value     the value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value < 0}, NaN or infinite
     */
    public static void validateNonNegative(double value, String paramName) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(
                paramName + " must be a finite non-negative number, got: " + value);
        }
    }

    /**
     * Validates that {@code [min, max]} is a non-empty closed interval of finite values.
     *
     * @param min       lower bound
     * @param max       upper bound
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if either bound is NaN or infinite, or {@code min > max}
     */
    public static void validateRange(double min, double max, String paramName) {
        if (Double.isNaN(min) || Double.isNaN(max)
                || Double.isInfinite(min) || Double.isInfinite(max)) {
            throw new IllegalArgumentException(
                paramName + " bounds must be finite, got: [" + min + ", " + max + "]");
        }
        if (min > max) {
            throw new IllegalArgumentException(
                paramName + " lower bound exceeds upper bound: [" + min + ", " + max + "]");
        }
    }
}
