package org.dxworks.cobolsim.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * PICTURE-driven storage rules shared by MOVE, arithmetic, ACCEPT and screen input.
 */
public final class PicFormatter {

    private static final Pattern NUMBER = Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)");

    private PicFormatter() {
    }

    /**
     * Left-justifies {@code text} in {@code length} characters: truncated on the right or
     * padded with spaces.
     */
    public static String fitAlphanumeric(String text, int length) {
        String value = text == null ? "" : text;
        if (value.length() >= length) {
            return value.substring(0, length);
        }
        return value + " ".repeat(length - value.length());
    }

    /**
     * Truncates toward zero, then keeps the low-order {@code digits} digits. The sign survives.
     */
    public static BigInteger fitNumeric(BigDecimal value, int digits) {
        BigInteger whole = value.setScale(0, RoundingMode.DOWN).toBigInteger();
        BigInteger kept = whole.abs().mod(BigInteger.TEN.pow(Math.max(digits, 1)));
        return whole.signum() < 0 ? kept.negate() : kept;
    }

    /**
     * Parses display text as a number. Surrounding blanks are ignored and an all-blank value
     * reads as zero.
     */
    public static Optional<BigDecimal> parseNumber(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return Optional.of(BigDecimal.ZERO);
        }
        if (!NUMBER.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed));
    }

    /**
     * Like {@link #parseNumber} but blank text does not count as a number.
     */
    static Optional<BigDecimal> parseComparable(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return parseNumber(text);
    }
}
