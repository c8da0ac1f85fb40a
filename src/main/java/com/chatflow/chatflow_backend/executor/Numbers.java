package com.chatflow.chatflow_backend.executor;

import java.util.regex.Pattern;

/**
 * Numeric reading of variable values. Only plain decimals such as "18", "-3" or "4.50" count as
 * numbers; "1f", "2d", "Infinity", "NaN", "0x1p3" and "1e5" are ordinary strings.
 */
public final class Numbers {

    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");

    private Numbers() {
    }

    /** @return the value as a finite double, or null when it is not a plain decimal. */
    public static Double parse(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (!DECIMAL.matcher(trimmed).matches()) return null;
        double d = Double.parseDouble(trimmed);
        return Double.isInfinite(d) ? null : d;
    }

    public static boolean isNumeric(String value) {
        return parse(value) != null;
    }
}
