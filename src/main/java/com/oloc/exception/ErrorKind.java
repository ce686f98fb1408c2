package com.oloc.exception;

/**
 * Every diagnosable error condition, with its message template and remediation hint.
 * Templates are filled with {@link String#format(String, Object...)}.
 */
public enum ErrorKind {

    // Comments
    MISMATCHED_HASH(
            "Mismatched '#' detected",
            "Free comments must be wrapped in a leading and a trailing '#'."),

    // Brackets
    UNMATCHED_LEFT_BRACKET(
            "Unmatched left bracket '%s'",
            "Every left bracket must be closed by a right bracket of the same style."),
    UNMATCHED_RIGHT_BRACKET(
            "Unmatched right bracket '%s'",
            "Every right bracket must close a left bracket of the same style."),
    BRACKET_HIERARCHY(
            "Bracket '%s' violates the bracket hierarchy",
            "Brackets nest in the order {} > [] > (): a bracket may only open inside one of the same or a larger style."),

    // Separators
    INVALID_DIGIT_SEPARATOR(
            "Invalid numeric separator ','",
            "Digit groups are separated by ',' in threes within the integer part (1,000,000). "
                    + "Inside a function that uses digit groups, separate the arguments with ';'."),

    // Numeric literals
    INVALID_INTEGER(
            "Invalid integer '%s'",
            "An integer consists of the digits 0-9, e.g. 0, 1024."),
    INVALID_FINITE_DECIMAL(
            "Invalid finite decimal '%s'",
            "A finite decimal is an integer part, '.', and a digit sequence, e.g. 3.14."),
    INVALID_INFINITE_DECIMAL(
            "Invalid repeating decimal '%s'",
            "A repeating decimal is a finite decimal followed by 3-6 '.' or by ':' and the repeating digits, "
                    + "e.g. 1.23..., 10.1:2."),
    INVALID_PERCENTAGE(
            "Invalid percentage '%s'",
            "A percentage is an integer or finite decimal followed by '%%', e.g. 100%%, 0.125%%."),
    INVALID_MIXED_FRACTION(
            "Invalid mixed fraction '%s'",
            "A mixed fraction is written a_b/c or a|b/c with digits only, e.g. 1_1/2."),
    UNKNOWN_TOKEN(
            "Unrecognized token '%s'",
            "Check the expression against the supported syntax and the symbol mapping table."),

    // Irrationals
    INVALID_SHORT_CUSTOM_IRRATIONAL(
            "Invalid short custom irrational '%s'",
            "A short custom irrational is a single character that is neither an operator nor a digit, e.g. x, y."),
    INVALID_LONG_CUSTOM_IRRATIONAL(
            "Invalid long custom irrational '%s'",
            "A long custom irrational is a non-empty name wrapped in '<' and '>', e.g. <radius>."),
    INVALID_IRRATIONAL_PARAM(
            "Invalid irrational parameter '%s'",
            "An irrational parameter is '?' preceded by an optional sign and an optional integer or decimal, "
                    + "placed right after an irrational or a closing bracket, e.g. x+?, π3?, <r>2.5?."),
    UNMATCHED_LONG_LEFT(
            "Unmatched '<' detected",
            "A long custom irrational opened with '<' must be closed with '>'."),
    UNMATCHED_LONG_RIGHT(
            "Unmatched '>' detected",
            "A '>' must close a long custom irrational opened with '<'."),
    PLACES_OUT_OF_RANGE(
            "Irrational '%s' declares %s decimal places",
            "π and 𝑒 may declare at most 10000 decimal places, e.g. π20?."),
    CONFLICTING_IRRATIONAL_PARAM(
            "Conflicting parameters declared for irrational '%s'",
            "Declare at most one parameter per irrational, or repeat the same one."),

    // Reserved words
    RESERVED_WORD(
            "The name '%s' is a reserved word",
            "Names starting with '__reserved' and canonical operator symbols cannot be custom irrationals."),

    // Placement
    MISPLACED_EQUAL_SIGN(
            "Misplaced '=' detected",
            "'=' may only appear once, at the very end of the expression."),
    EMPTY_EXPRESSION(
            "The expression is empty",
            "Enter an expression to calculate, e.g. 1+1."),
    MISSING_OPERAND(
            "Missing operand near '%s'",
            "Every operator needs operands on the sides it applies to."),
    UNEXPECTED_TOKEN(
            "Unexpected '%s'",
            "Check the placement of operators, brackets and separators."),
    MISPLACED_SEPARATOR(
            "Parameter separator outside of a function call",
            "',' and ';' separate function arguments, e.g. pow(2,3)."),
    MISPLACED_IRRATIONAL_PARAM(
            "Irrational parameter '%s' is not attached to an irrational",
            "Place the parameter right after an irrational or a closing bracket, e.g. x2?, (π+1)3?."),

    // Functions
    ARITY_MISMATCH(
            "Function '%s' expects %s argument(s) but received %d",
            "Check the number of arguments passed to the function."),
    FUNCTION_DOMAIN(
            "'%s' is undefined for %s",
            "Check that the arguments lie in the domain of the function."),

    // Calculation
    DIVIDE_BY_ZERO(
            "Division by zero in '%s'",
            "A divisor or denominator may not be zero."),
    TIMEOUT(
            "Calculation exceeded the time limit of %d ms",
            "Simplify the expression or raise the time limit."),
    MISSING_CONVERSION_VALUE(
            "Irrational '%s' has no conversion value",
            "Declare a value for a custom irrational before converting it to a number, e.g. x2.5?."),
    NOT_RATIONAL(
            "The result '%s' is not rational",
            "Use a decimal conversion for results that keep irrational terms.");

    private final String template;
    private final String hint;

    ErrorKind(String template, String hint) {
        this.template = template;
        this.hint = hint;
    }

    public String hint() {
        return hint;
    }

    public String format(Object... args) {
        return args.length == 0 ? template.replace("%%", "%") : String.format(template, args);
    }
}
