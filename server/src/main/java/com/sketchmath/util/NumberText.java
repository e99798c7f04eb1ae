package com.sketchmath.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public class NumberText {

    public static final int DEFAULT_SIGNIFICANT_DIGITS = 12;

    /**
     * Formats a solver value for display. Integral values lose their fractional
     * part, everything is rounded to the given number of significant digits, and
     * non-finite values use the solver's spelling (oo, -oo, nan).
     */
    public static String format(double value, int significantDigits) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "oo" : "-oo";
        }
        if (value == 0.0) {
            return "0";
        }
        BigDecimal rounded = new BigDecimal(value)
                .round(new MathContext(significantDigits, RoundingMode.HALF_EVEN))
                .stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }

    public static String format(double value) {
        return format(value, DEFAULT_SIGNIFICANT_DIGITS);
    }

    /**
     * Shortest exact decimal form of a finite double, used when a measured value
     * is written back into an expression: 3.0 becomes "3", 0.1 stays "0.1".
     */
    public static String plain(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite value: " + value);
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Renders a complex root as "a + b*I". Imaginary parts below the tolerance
     * relative to the magnitude are dropped.
     */
    public static String formatComplex(double re, double im, int significantDigits) {
        if (Math.abs(im) <= 1e-9 * Math.max(1.0, Math.abs(re))) {
            return format(re, significantDigits);
        }
        String imagMagnitude = format(Math.abs(im), significantDigits);
        String imagTerm = "1".equals(imagMagnitude) ? "I" : imagMagnitude + "*I";
        if (Math.abs(re) <= 1e-12 * Math.abs(im)) {
            return im < 0 ? "-" + imagTerm : imagTerm;
        }
        return format(re, significantDigits) + (im < 0 ? " - " : " + ") + imagTerm;
    }

    /**
     * Reads a numeric value supplied as a JSON number or string.
     *
     * @throws NumberFormatException if the value is missing, not numeric or not finite
     */
    public static double parse(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            value = Double.parseDouble(((String) raw).trim());
        } else {
            throw new NumberFormatException("Not a numeric value: " + raw);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite value: " + raw);
        }
        return value;
    }
}
