package com.oloc.token;

import com.oloc.function.FunctionType;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical symbols of the normalized expression language and the per-type
 * grammar checks that tokens run on construction.
 */
public final class TokenGrammar {

    public static final String PI = "π";
    public static final String E = "𝑒";

    public static final char PLUS = '+';
    public static final char MINUS = '-';
    public static final char MULTIPLY = '*';
    public static final char DIVIDE = '/';
    public static final char POWER = '^';
    public static final char PERCENT = '%';
    public static final char FACTORIAL = '!';
    public static final char SQRT = '√';
    public static final char ABS_BAR = '|';
    public static final char DEGREE = '°';
    public static final char IMPLICIT_MULTIPLY = '·';

    public static final char SEPARATOR = ',';
    public static final char ALT_SEPARATOR = ';';
    public static final char DOT = '.';
    public static final char COLON = ':';
    public static final char QUESTION = '?';
    public static final char LONG_OPEN = '<';
    public static final char LONG_CLOSE = '>';
    public static final char UNDERSCORE = '_';
    public static final char EQUALS = '=';
    public static final char HASH = '#';
    public static final char AT = '@';

    public static final String RESERVED_PREFIX = "__reserved";

    public static final Set<Character> OPERATORS = Set.of(
            PLUS, MINUS, MULTIPLY, DIVIDE, POWER, PERCENT, FACTORIAL, SQRT, ABS_BAR, DEGREE, IMPLICIT_MULTIPLY);

    /**
     * Operators that take a left and a right operand.
     */
    public static final Set<Character> BINARY_OPERATORS = Set.of(
            PLUS, MINUS, MULTIPLY, DIVIDE, POWER, PERCENT, IMPLICIT_MULTIPLY);

    public static final String LEFT_BRACKETS = "([{";
    public static final String RIGHT_BRACKETS = ")]}";

    private static final Set<Character> RESERVED = Set.of(
            SEPARATOR, ALT_SEPARATOR, DOT, COLON, QUESTION, LONG_OPEN, LONG_CLOSE,
            UNDERSCORE, EQUALS, HASH, AT, '(', ')', '[', ']', '{', '}');

    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern FINITE_DECIMAL = Pattern.compile("\\d+\\.\\d+");
    private static final Pattern INFINITE_DECIMAL = Pattern.compile("\\d+\\.\\d+(\\.{3,6}|:\\d+)");
    private static final Pattern PERCENTAGE = Pattern.compile("\\d+(\\.\\d+)?%");
    private static final Pattern MIXED_FRACTION = Pattern.compile("\\d+[_|]\\d+/\\d+");
    private static final Pattern LONG_CUSTOM = Pattern.compile("<[^<>]+>");
    private static final Pattern IRRATIONAL_PARAM = Pattern.compile("[+-]?\\d+(\\.\\d+)?\\?|[+-]\\?");

    private TokenGrammar() {
    }

    /**
     * Whether {@code value} is a well-formed token of the given type.
     */
    public static boolean check(TokenType type, String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return switch (type) {
            case INTEGER -> INTEGER.matcher(value).matches();
            case FINITE_DECIMAL -> FINITE_DECIMAL.matcher(value).matches();
            case INFINITE_DECIMAL -> INFINITE_DECIMAL.matcher(value).matches();
            case PERCENTAGE -> PERCENTAGE.matcher(value).matches();
            case MIXED_FRACTION -> MIXED_FRACTION.matcher(value).matches();
            case NATIVE_IRRATIONAL -> PI.equals(value) || E.equals(value);
            case SHORT_CUSTOM_IRRATIONAL -> value.codePointCount(0, value.length()) == 1
                    && isShortCustomCandidate(value.codePointAt(0));
            case LONG_CUSTOM_IRRATIONAL -> LONG_CUSTOM.matcher(value).matches();
            case IRRATIONAL_PARAM -> IRRATIONAL_PARAM.matcher(value).matches();
            case OPERATOR -> value.length() == 1 && OPERATORS.contains(value.charAt(0));
            case LBRACKET -> value.length() == 1 && LEFT_BRACKETS.indexOf(value.charAt(0)) >= 0;
            case RBRACKET -> value.length() == 1 && RIGHT_BRACKETS.indexOf(value.charAt(0)) >= 0;
            case FUNCTION -> FunctionType.fromName(value).isPresent();
            case PARAM_SEPARATOR -> value.length() == 1
                    && (value.charAt(0) == SEPARATOR || value.charAt(0) == ALT_SEPARATOR);
            case UNKNOWN -> false;
        };
    }

    /**
     * Whether the code point may stand alone as a short custom irrational.
     */
    public static boolean isShortCustomCandidate(int codePoint) {
        if (Character.isDigit(codePoint) || Character.isWhitespace(codePoint)) {
            return false;
        }
        if (codePoint < Character.MIN_SUPPLEMENTARY_CODE_POINT) {
            char c = (char) codePoint;
            if (OPERATORS.contains(c) || RESERVED.contains(c)) {
                return false;
            }
            return !PI.equals(String.valueOf(c));
        }
        return !E.equals(new String(Character.toChars(codePoint)));
    }

    /**
     * Whether the symbol collides with a reserved word or canonical symbol.
     */
    public static boolean isReservedSymbol(String symbol) {
        if (symbol.startsWith(RESERVED_PREFIX) || symbol.startsWith("<" + RESERVED_PREFIX)) {
            return true;
        }
        if (PI.equals(symbol) || E.equals(symbol)) {
            return true;
        }
        return symbol.length() == 1
                && (OPERATORS.contains(symbol.charAt(0)) || RESERVED.contains(symbol.charAt(0)));
    }

    public static int bracketRank(char bracket) {
        return switch (bracket) {
            case '(', ')' -> 1;
            case '[', ']' -> 2;
            case '{', '}' -> 3;
            default -> 0;
        };
    }

    public static char closingOf(char open) {
        return RIGHT_BRACKETS.charAt(LEFT_BRACKETS.indexOf(open));
    }
}
