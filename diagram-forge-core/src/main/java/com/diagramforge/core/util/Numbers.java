package com.diagramforge.core.util;

import java.math.BigDecimal;

/**
 * Number formatting for attribute and style values.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Formats a number the way the dialect writes it: integral values without a fractional
     * part ({@code 100}, not {@code 100.0}), others in plain notation without trailing zeros.
     *
     * @param value number to format
     * @return formatted text
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Parses a numeric attribute, returning {@code null} for absent or malformed values.
     *
     * @param text attribute text
     * @return parsed value or {@code null}
     */
    public static Double parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
