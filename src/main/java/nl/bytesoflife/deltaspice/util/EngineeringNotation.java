package nl.bytesoflife.deltaspice.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Conversion between numbers and SPICE engineering notation.
 * <ul>
 *   <li>f (1e-15), p (1e-12), n (1e-9), u (1e-6), m (1e-3)</li>
 *   <li>k (1e3), Meg (1e6), g (1e9), t (1e12)</li>
 * </ul>
 */
public final class EngineeringNotation {

    private static final MathContext SIX_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);
    private static final String SUB_UNIT_SUFFIXES = "fpnum";

    private EngineeringNotation() {
    }

    /**
     * Formats a value with the largest SI qualifier that keeps the mantissa at
     * or above 1, e.g. 4700 gives {@code 4.7k} and 1e-6 gives {@code 1u}.
     */
    public static String format(double value) {
        if (value == 0.0 || Double.isNaN(value) || Double.isInfinite(value)) {
            return formatShort(value);
        }
        int exponent = (int) Math.floor(Math.log10(Math.abs(value)));
        int e = Math.floorDiv(exponent, 3);
        String suffix;
        if (e >= -5 && e < 0) {
            suffix = String.valueOf(SUB_UNIT_SUFFIXES.charAt(e + 5));
        } else if (e == 0) {
            return formatShort(value);
        } else if (e == 1) {
            suffix = "k";
        } else if (e == 2) {
            suffix = "Meg";
        } else if (e == 3) {
            suffix = "g";
        } else if (e == 4) {
            suffix = "t";
        } else {
            return String.format(Locale.ROOT, "%E", value);
        }
        BigDecimal mantissa = BigDecimal.valueOf(value).movePointLeft(3 * e);
        return plain(mantissa.round(SIX_DIGITS)) + suffix;
    }

    /**
     * Parses a value written in engineering notation. Anything after the last
     * digit is taken as qualifier and unit; units such as V or F are ignored.
     *
     * @throws NumberFormatException if the numeric part is not a number
     */
    public static double parse(String text) {
        String value = text.strip();
        int x = value.length();
        while (x > 0 && !Character.isDigit(value.charAt(x - 1))) {
            x--;
        }
        String suffix = value.substring(x).toLowerCase(Locale.ROOT);
        double number = Double.parseDouble(value.substring(0, x));
        if (suffix.isEmpty()) {
            return number;
        }
        if (suffix.startsWith("meg")) {
            return number * 1e6;
        }
        return switch (suffix.charAt(0)) {
            case 'f' -> number * 1e-15;
            case 'p' -> number * 1e-12;
            case 'n' -> number * 1e-9;
            case 'u', 'µ' -> number * 1e-6;
            case 'm' -> number * 1e-3;
            case 'k' -> number * 1e3;
            case 'g' -> number * 1e9;
            case 't' -> number * 1e12;
            default -> number;
        };
    }

    /**
     * Six significant digits, trailing zeros dropped, scientific notation for
     * exponents below -4 or from 6 on (C {@code %g}).
     */
    public static String formatShort(double value) {
        return formatSignificant(value, "e");
    }

    /**
     * Like {@link #formatShort(double)} with an upper-case exponent marker
     * (C {@code %G}).
     */
    public static String formatGeneral(double value) {
        return formatSignificant(value, "E");
    }

    private static String formatSignificant(double value, String exponentMarker) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0.0) {
            return "0";
        }
        BigDecimal rounded = BigDecimal.valueOf(value).round(SIX_DIGITS);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 6) {
            String mantissa = plain(rounded.movePointLeft(exponent));
            String sign = exponent < 0 ? "-" : "+";
            return mantissa + exponentMarker + sign + String.format(Locale.ROOT, "%02d", Math.abs(exponent));
        }
        return plain(rounded);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
