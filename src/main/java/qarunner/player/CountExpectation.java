package qarunner.player;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed element-count expectation such as {@code 3}, {@code >=2} or
 * {@code !=0}. A bare number means equality.
 */
public record CountExpectation(String operator, int expected) {

    private static final Pattern FORMAT = Pattern.compile("^\\s*(==|>=|<=|!=|>|<)?\\s*(\\d+)\\s*$");

    /**
     * @throws IllegalArgumentException if {@code raw} is not in the accepted format
     */
    public static CountExpectation parse(String raw) {
        Matcher m = FORMAT.matcher(raw == null ? "" : raw);
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "Invalid element count expectation '" + raw + "' (expected e.g. 3, >=1, <5, !=0)");
        }
        String op = m.group(1) == null ? "==" : m.group(1);
        return new CountExpectation(op, Integer.parseInt(m.group(2)));
    }

    public boolean matches(int actual) {
        return switch (operator) {
            case "==" -> actual == expected;
            case "!=" -> actual != expected;
            case ">=" -> actual >= expected;
            case "<=" -> actual <= expected;
            case ">"  -> actual > expected;
            case "<"  -> actual < expected;
            default   -> throw new IllegalStateException("Unknown operator " + operator);
        };
    }

    @Override
    public String toString() {
        return operator + expected;
    }
}
