package su.grinev.jstream.json.token;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Finds the end of a JSON number token:
 * {@code -? (0 | [1-9][0-9]*) (. [0-9]+)? ([eE] [+-]? [0-9]+)?}.
 */
public final class NumberScanner {

    public static final int INCOMPLETE = -1;

    /**
     * Largest integer, in decimal digits, that {@link #toBigIntegerExact} will expand an exponent into.
     */
    public static final int MAX_INTEGER_DIGITS = 4096;

    private NumberScanner() {
    }

    /**
     * @param isFinalBlock whether bytes past {@code end} can never arrive
     * @return the index just past the number, or {@link #INCOMPLETE} when the number touches {@code end}
     * of a block that is not final
     * @throws MalformedNumberException if the bytes do not form a number
     */
    public static int scan(byte[] bytes, int start, int end, boolean isFinalBlock) {
        int pos = start;
        if (bytes[pos] == '-') {
            pos++;
            if (pos >= end) {
                return incompleteOrFail(isFinalBlock, "Expected digit after '-'", pos);
            }
        }

        if (bytes[pos] == '0') {
            pos++;
        } else if (isDigit(bytes[pos])) {
            while (pos < end && isDigit(bytes[pos])) {
                pos++;
            }
        } else {
            throw new MalformedNumberException("Expected digit but found '%c'".formatted((char) bytes[pos]), pos);
        }

        if (pos < end && bytes[pos] == '.') {
            pos++;
            int digits = pos;
            while (pos < end && isDigit(bytes[pos])) {
                pos++;
            }
            if (pos == digits) {
                if (pos >= end) {
                    return incompleteOrFail(isFinalBlock, "Expected digit after decimal point", pos);
                }
                throw new MalformedNumberException("Expected digit after decimal point", pos);
            }
        }

        if (pos < end && (bytes[pos] == 'e' || bytes[pos] == 'E')) {
            pos++;
            if (pos < end && (bytes[pos] == '+' || bytes[pos] == '-')) {
                pos++;
            }
            int digits = pos;
            while (pos < end && isDigit(bytes[pos])) {
                pos++;
            }
            if (pos == digits) {
                if (pos >= end) {
                    return incompleteOrFail(isFinalBlock, "Expected digit in exponent", pos);
                }
                throw new MalformedNumberException("Expected digit in exponent", pos);
            }
        }

        if (pos >= end) {
            return isFinalBlock ? pos : INCOMPLETE;
        }
        if (!isDelimiter(bytes[pos])) {
            throw new MalformedNumberException("Unexpected character '%c' in number".formatted((char) bytes[pos]), pos);
        }
        return pos;
    }

    private static int incompleteOrFail(boolean isFinalBlock, String message, int pos) {
        if (isFinalBlock) {
            throw new MalformedNumberException(message, pos);
        }
        return INCOMPLETE;
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private static boolean isDelimiter(byte b) {
        return switch (b) {
            case ' ', '\t', '\n', '\r', ',', ']', '}', '/' -> true;
            default -> false;
        };
    }

    public static class MalformedNumberException extends RuntimeException {
        private final int index;

        public MalformedNumberException(String message, int index) {
            super(message);
            this.index = index;
        }

        public int getIndex() {
            return index;
        }
    }

    /**
     * Converts a number with no fractional part to a {@link BigInteger}. Exponents are checked before they
     * are expanded.
     *
     * @throws ArithmeticException if the value has a fractional part or more than {@link #MAX_INTEGER_DIGITS} digits
     */
    public static BigInteger toBigIntegerExact(BigDecimal value) {
        if (value.signum() == 0) {
            return BigInteger.ZERO;
        }
        if ((long) value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
            throw new ArithmeticException("Integer has more than %d digits".formatted(MAX_INTEGER_DIGITS));
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > 0) {
            throw new ArithmeticException("Rounding necessary");
        }
        return stripped.toBigIntegerExact();
    }
}
