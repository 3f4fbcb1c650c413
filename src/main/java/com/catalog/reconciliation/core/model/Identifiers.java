package com.catalog.reconciliation.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between raw record values and integer identifiers.
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    /**
     * Converts a raw value to an {@code int} identifier.
     *
     * @return the identifier, or null if the value is not an integral number within int range
     */
    public static Integer toIdentifier(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long l) {
            return fitsInt(l) ? (int) l.longValue() : null;
        }
        if (value instanceof BigInteger b) {
            return b.bitLength() < 32 ? b.intValue() : null;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            try {
                return new BigDecimal(value.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
