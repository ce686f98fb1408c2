package com.oloc.number;

import com.oloc.exception.ConversionException;
import com.oloc.exception.DomainException;
import com.oloc.exception.ErrorKind;
import com.oloc.function.FunctionType;
import com.oloc.token.Span;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Converts exact values to fixed-precision decimals. π and 𝑒 are computed in
 * {@link BigDecimal} and cut to their declared places, custom irrationals use
 * their declared values and retained function calls fall back to {@code double}.
 * A retained call contributes at most 15 significant digits; further places
 * print as zeros.
 */
public final class DecimalApproximator {

    private static final int GUARD_DIGITS = 20;
    /** Significant digits a {@code double} result can be trusted for. */
    static final MathContext DOUBLE_PRECISION = new MathContext(15, RoundingMode.HALF_EVEN);

    private final String expression;
    private final Map<String, IrrationalParam> params;
    private final MathContext mathContext;

    public DecimalApproximator(String expression, Map<String, IrrationalParam> params, int places) {
        this.expression = expression;
        this.params = Map.copyOf(params);
        this.mathContext = new MathContext(Math.max(places, 0) + GUARD_DIGITS, RoundingMode.HALF_EVEN);
    }

    /**
     * Decimal string with exactly {@code places} fractional digits.
     */
    public static String toDecimalString(BigDecimal value, int places) {
        return value.setScale(places, RoundingMode.HALF_UP).toPlainString();
    }

    public BigDecimal approximate(SymbolicValue value) {
        BigDecimal sum = BigDecimal.ZERO;
        for (SymbolicTerm term : value.terms()) {
            sum = sum.add(approximate(term), mathContext);
        }
        return sum;
    }

    private BigDecimal approximate(SymbolicTerm term) {
        BigDecimal product = term.coefficient().toBigDecimal(mathContext);
        for (Map.Entry<Irrational, Fraction> factor : term.factors().entrySet()) {
            product = product.multiply(power(atom(factor.getKey()), factor.getValue(), factor.getKey()), mathContext);
        }
        return product;
    }

    private BigDecimal atom(Irrational atom) {
        return switch (atom.kind()) {
            case PI -> withPlaces(atom, pi(mathContext));
            case E -> withPlaces(atom, e(mathContext));
            case SHORT_CUSTOM, LONG_CUSTOM -> custom(atom);
            case RADICAL -> new BigDecimal(atom.radicand());
            case GROUP -> approximate(atom.group());
            case RETAINED -> retained(atom);
        };
    }

    private BigDecimal withPlaces(Irrational atom, BigDecimal exact) {
        IrrationalParam param = params.get(atom.symbol());
        if (param == null || param.places() < 0) {
            return exact;
        }
        return exact.setScale(param.places(), RoundingMode.HALF_UP);
    }

    private BigDecimal custom(Irrational atom) {
        IrrationalParam param = params.get(atom.symbol());
        if (param == null || !param.hasValue()) {
            throw new ConversionException(ErrorKind.MISSING_CONVERSION_VALUE, expression, wholeExpression(),
                    atom.symbol());
        }
        return param.value().toBigDecimal(mathContext);
    }

    private BigDecimal power(BigDecimal base, Fraction exponent, Irrational atom) {
        if (exponent.isOne()) {
            return base;
        }
        if (exponent.isInteger()) {
            int n = exponent.numerator().intValueExact();
            BigDecimal raised = base.pow(Math.abs(n), mathContext);
            return n < 0 ? BigDecimal.ONE.divide(raised, mathContext) : raised;
        }
        int p = exponent.numerator().intValueExact();
        int q = exponent.denominator().intValueExact();
        if (base.signum() < 0 && q % 2 == 0) {
            throw new DomainException(ErrorKind.FUNCTION_DOMAIN, expression, wholeExpression(),
                    FunctionType.POW.canonicalName(), atom.symbol() + " < 0");
        }
        BigDecimal root = base.signum() < 0
                ? Radicals.root(base.negate(), q, mathContext).negate()
                : Radicals.root(base, q, mathContext);
        BigDecimal raised = root.pow(Math.abs(p), mathContext);
        return p < 0 ? BigDecimal.ONE.divide(raised, mathContext) : raised;
    }

    private BigDecimal retained(Irrational atom) {
        List<SymbolicValue> args = atom.arguments();
        double a = approximate(args.get(0)).doubleValue();
        double b = args.size() > 1 ? approximate(args.get(1)).doubleValue() : Double.NaN;
        double result = switch (atom.function()) {
            case SIN -> Math.sin(a);
            case COS -> Math.cos(a);
            case TAN -> Math.tan(a);
            case ASIN -> Math.asin(a);
            case ACOS -> Math.acos(a);
            case ATAN -> Math.atan(a);
            case LN -> Math.log(a);
            case LG -> Math.log10(a);
            case LOG -> Math.log(a) / Math.log(b);
            case EXP -> Math.exp(a);
            case POW -> Math.pow(a, b);
            case SQRT -> Math.sqrt(a);
            case MOD -> a - b * Math.floor(a / b);
            case ABS -> Math.abs(a);
            case SIGN -> Math.signum(a);
            case SQ -> a * a;
            case CUB -> a * a * a;
            case REC -> 1 / a;
            case FACT, GCD, LCM -> Double.NaN;
        };
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new DomainException(ErrorKind.FUNCTION_DOMAIN, expression, wholeExpression(),
                    atom.function().canonicalName(), atom.symbol());
        }
        return new BigDecimal(result, DOUBLE_PRECISION);
    }

    private Span wholeExpression() {
        return Span.of(0, expression.length());
    }

    /**
     * π by Machin's formula: 16·atan(1/5) − 4·atan(1/239).
     */
    static BigDecimal pi(MathContext mathContext) {
        MathContext working = new MathContext(mathContext.getPrecision() + 5, RoundingMode.HALF_EVEN);
        BigDecimal pi = arctanInverse(5, working).multiply(BigDecimal.valueOf(16))
                .subtract(arctanInverse(239, working).multiply(BigDecimal.valueOf(4)));
        return pi.round(mathContext);
    }

    /**
     * 𝑒 as the sum of 1/k!.
     */
    static BigDecimal e(MathContext mathContext) {
        MathContext working = new MathContext(mathContext.getPrecision() + 5, RoundingMode.HALF_EVEN);
        BigDecimal epsilon = BigDecimal.ONE.movePointLeft(working.getPrecision());
        BigDecimal sum = BigDecimal.ONE;
        BigDecimal term = BigDecimal.ONE;
        for (int k = 1; term.compareTo(epsilon) > 0; k++) {
            term = term.divide(BigDecimal.valueOf(k), working);
            sum = sum.add(term, working);
        }
        return sum.round(mathContext);
    }

    private static BigDecimal arctanInverse(int x, MathContext working) {
        BigDecimal epsilon = BigDecimal.ONE.movePointLeft(working.getPrecision());
        BigDecimal xSquared = BigDecimal.valueOf((long) x * x);
        BigDecimal power = BigDecimal.ONE.divide(BigDecimal.valueOf(x), working);
        BigDecimal sum = power;
        for (int n = 1; power.compareTo(epsilon) > 0; n++) {
            power = power.divide(xSquared, working);
            BigDecimal term = power.divide(BigDecimal.valueOf(2L * n + 1), working);
            sum = (n % 2 == 1) ? sum.subtract(term, working) : sum.add(term, working);
        }
        return sum;
    }
}
