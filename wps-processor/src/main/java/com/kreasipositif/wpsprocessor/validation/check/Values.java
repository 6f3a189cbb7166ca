package com.kreasipositif.wpsprocessor.validation.check;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Coercions shared by the built-in checks.
 */
final class Values {

    private Values() {
    }

    /** null, blank text, or numeric zero. */
    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() == 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0d;
        }
        return false;
    }

    static String asText(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof LocalDate date) {
            return date.toString();
        }
        return String.valueOf(value);
    }

    /**
     * @throws NumberFormatException if the value is not numeric
     */
    static BigDecimal asDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Integer || value instanceof Long) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        return new BigDecimal(asText(value).trim());
    }
}
