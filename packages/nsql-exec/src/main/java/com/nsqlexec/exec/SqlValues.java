package com.nsqlexec.exec;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Value semantics of the relational evaluator. Cells are untyped (usually text); text that looks
 * like a number is treated as one. Numbers are {@link BigDecimal}, booleans render as 1/0 and
 * NULL propagates through comparisons and arithmetic.
 */
public final class SqlValues {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern GROUPED_NUMBER = Pattern.compile("[+-]?\\d{1,3}(,\\d{3})+(\\.\\d+)?");
    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Largest decimal exponent a value may have to be treated as a number. */
    static final int MAX_EXPONENT = 1000;

    private SqlValues() {
    }

    /**
     * Numeric value of {@code value}, or null if it is NULL or does not look like a number.
     * Thousands separators ({@code 1,234}) are accepted.
     */
    public static BigDecimal toNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return inRange((BigDecimal) value) ? (BigDecimal) value : null;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (value instanceof Number) {
            // NaN and infinities are not numbers here
            return parse(value.toString());
        }
        String text = value.toString().trim();
        if (GROUPED_NUMBER.matcher(text).matches()) {
            text = text.replace(",", "");
        }
        if (!NUMBER.matcher(text).matches()) {
            return null;
        }
        return parse(text);
    }

    /** Null if {@code text} is not a decimal number or its exponent exceeds {@link #MAX_EXPONENT}. */
    private static BigDecimal parse(String text) {
        BigDecimal number;
        try {
            number = new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
        return inRange(number) ? number : null;
    }

    static boolean inRange(BigDecimal number) {
        if (number.signum() == 0) {
            return true;
        }
        long exponent = (long) number.precision() - number.scale() - 1;
        return Math.abs(exponent) <= MAX_EXPONENT;
    }

    /**
     * Numeric operand of an arithmetic operator or aggregate. NULL stays null; non-numeric text
     * is a type mismatch.
     */
    public static BigDecimal numericOperand(Object value, String operator) throws QueryExecutionException {
        if (value == null) {
            return null;
        }
        BigDecimal number = toNumber(value);
        if (number == null) {
            throw QueryExecutionException.execution("type mismatch: " + operator + " applied to non-numeric value '"
                    + value + "'");
        }
        return number;
    }

    /**
     * Orders two non-null values: numerically when both are numbers, as text otherwise.
     */
    public static int compare(Object left, Object right) {
        BigDecimal l = toNumber(left);
        BigDecimal r = toNumber(right);
        if (l != null && r != null) {
            return l.compareTo(r);
        }
        return render(left).compareTo(render(right));
    }

    /** Three-valued equality: null when either side is NULL. */
    public static Boolean equal(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        return compare(left, right) == 0;
    }

    /** Truth value of a condition result. NULL and non-numeric text are not true. */
    public static boolean isTrue(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        BigDecimal number = toNumber(value);
        if (number == null) {
            number = numericPrefix(value.toString());
        }
        return number.signum() != 0;
    }

    /**
     * Division by zero is NULL. Two integers divide to an integer truncated toward zero.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (dividend == null || divisor == null || divisor.signum() == 0) {
            return null;
        }
        if (dividend.scale() == 0 && divisor.scale() == 0) {
            return dividend.divide(divisor, 0, RoundingMode.DOWN);
        }
        return dividend.divide(divisor, MathContext.DECIMAL64);
    }

    /**
     * {@code CAST(value AS type)}. Numeric casts take the longest numeric prefix of the text and
     * fall back to 0; integer casts truncate toward zero.
     */
    public static Object cast(Object value, String typeName) throws QueryExecutionException {
        if (value == null) {
            return null;
        }
        String type = typeName.toUpperCase(Locale.ROOT);
        switch (type) {
            case "INT":
            case "INTEGER":
            case "BIGINT":
            case "SMALLINT":
            case "TINYINT":
                return asNumber(value).setScale(0, RoundingMode.DOWN);
            case "REAL":
            case "FLOAT":
            case "DOUBLE":
            case "DECIMAL":
            case "NUMERIC":
                return asNumber(value);
            case "TEXT":
            case "VARCHAR":
            case "CHAR":
            case "STRING":
                return render(value);
            default:
                throw QueryExecutionException.execution("unsupported cast target: " + typeName);
        }
    }

    private static BigDecimal asNumber(Object value) {
        BigDecimal number = toNumber(value);
        return number != null ? number : numericPrefix(value.toString());
    }

    static BigDecimal numericPrefix(String text) {
        Matcher matcher = NUMERIC_PREFIX.matcher(text.trim());
        if (matcher.find()) {
            BigDecimal number = parse(matcher.group());
            return number != null ? number : BigDecimal.ZERO;
        }
        return BigDecimal.ZERO;
    }

    /**
     * Case-insensitive LIKE with {@code %} and {@code _} wildcards.
     */
    public static boolean like(String value, String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL)
                .matcher(value)
                .matches();
    }

    /**
     * Value as it appears in an answer: booleans become 1/0, other values are kept.
     */
    public static Object toOutput(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        return value;
    }

    /**
     * Text form of a value; numbers without trailing zeros or exponent, NULL as null.
     */
    public static String render(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "1" : "0";
        }
        if (value instanceof BigDecimal) {
            return plain((BigDecimal) value);
        }
        if (value instanceof Number) {
            BigDecimal number = toNumber(value);
            return number != null ? plain(number) : value.toString();
        }
        return value.toString();
    }

    private static String plain(BigDecimal number) {
        if (number.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = number.stripTrailingZeros();
        return inRange(stripped) ? stripped.toPlainString() : stripped.toString();
    }
}
