package io.schemarules.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts rule parameters to {@link BigDecimal} without binary floating-point drift.
 *
 * <p>{@code float} and {@code double} values go through their shortest decimal string form, so
 * {@code 5.1f} becomes exactly {@code 5.1} rather than {@code 5.099999904632568...}.
 */
public final class Decimals {

    private Decimals() {}

    /**
     * Returns the exact decimal value the caller wrote for {@code number}.
     *
     * @throws IllegalArgumentException for NaN or infinite values
     * @throws NullPointerException if {@code number} is null
     */
    public static BigDecimal of(Number number) {
        if (number == null) {
            throw new NullPointerException("number must not be null");
        }
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Float f) {
            requireFinite(f.doubleValue());
            return new BigDecimal(Float.toString(f));
        }
        if (number instanceof Double d) {
            requireFinite(d);
            return BigDecimal.valueOf(d);
        }
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(number.toString());
    }

    private static void requireFinite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Numeric rule parameter must be finite, got: " + value);
        }
    }
}
