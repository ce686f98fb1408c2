package com.oloc.number;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;

/**
 * Integer factorization and root helpers behind exact radicals.
 */
public final class Radicals {

    private static final BigInteger TRIAL_LIMIT = BigInteger.valueOf(100_000);

    private Radicals() {
    }

    /**
     * Prime factorization by trial division. A cofactor left over past the trial
     * limit is kept as a single base (split once more if it is a perfect square).
     */
    public static Map<BigInteger, Integer> factor(BigInteger n) {
        Map<BigInteger, Integer> factors = new TreeMap<>();
        BigInteger rest = n.abs();
        BigInteger p = BigInteger.TWO;
        while (rest.compareTo(BigInteger.ONE) > 0 && p.compareTo(TRIAL_LIMIT) <= 0
                && p.multiply(p).compareTo(rest) <= 0) {
            while (rest.mod(p).signum() == 0) {
                factors.merge(p, 1, Integer::sum);
                rest = rest.divide(p);
            }
            p = p.equals(BigInteger.TWO) ? BigInteger.valueOf(3) : p.add(BigInteger.TWO);
        }
        if (rest.compareTo(BigInteger.ONE) > 0) {
            BigInteger root = rest.sqrt();
            if (root.multiply(root).equals(rest) && rest.compareTo(TRIAL_LIMIT.multiply(TRIAL_LIMIT)) > 0) {
                factors.merge(root, 2, Integer::sum);
            } else {
                factors.merge(rest, 1, Integer::sum);
            }
        }
        return factors;
    }

    /**
     * {@code base ^ exponent} as an exact term, extracting every perfect power.
     *
     * @throws ArithmeticException for zero to a non-positive power and even roots of negatives
     */
    public static SymbolicTerm power(Fraction base, Fraction exponent) {
        if (base.isZero()) {
            if (exponent.signum() <= 0) {
                throw new ArithmeticException("Zero to a non-positive power");
            }
            return SymbolicTerm.ZERO;
        }
        if (exponent.isInteger()) {
            return SymbolicTerm.of(base.pow(exponent.numerator().intValueExact()));
        }
        Fraction sign = Fraction.ONE;
        if (base.signum() < 0) {
            if (!exponent.denominator().testBit(0)) {
                throw new ArithmeticException("Even root of a negative number");
            }
            sign = exponent.numerator().testBit(0) ? Fraction.MINUS_ONE : Fraction.ONE;
        }
        Map<Irrational, Fraction> factors = new TreeMap<>();
        Fraction coefficient = sign;
        for (Map.Entry<BigInteger, Integer> entry : factor(base.numerator()).entrySet()) {
            coefficient = addPrime(factors, coefficient, entry.getKey(), exponent.multiply(Fraction.of(entry.getValue())));
        }
        for (Map.Entry<BigInteger, Integer> entry : factor(base.denominator()).entrySet()) {
            coefficient = addPrime(factors, coefficient, entry.getKey(), exponent.multiply(Fraction.of(-entry.getValue())));
        }
        return SymbolicTerm.of(coefficient, factors);
    }

    private static Fraction addPrime(Map<Irrational, Fraction> factors, Fraction coefficient,
                                     BigInteger prime, Fraction exponent) {
        if (exponent.isInteger()) {
            return coefficient.multiply(Fraction.of(prime).pow(exponent.numerator().intValueExact()));
        }
        factors.merge(Irrational.radical(prime), exponent, Fraction::add);
        return coefficient;
    }

    /**
     * k-th root of a positive decimal by Newton iteration.
     */
    public static BigDecimal root(BigDecimal value, int k, MathContext mathContext) {
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (k == 1) {
            return value;
        }
        MathContext working = new MathContext(mathContext.getPrecision() + 10, RoundingMode.HALF_EVEN);
        BigDecimal degree = BigDecimal.valueOf(k);
        BigDecimal x = BigDecimal.valueOf(Math.pow(value.doubleValue(), 1.0 / k));
        if (x.signum() <= 0 || Double.isInfinite(x.doubleValue())) {
            x = BigDecimal.ONE;
        }
        BigDecimal tolerance = BigDecimal.ONE.movePointLeft(working.getPrecision());
        for (int i = 0; i < 500; i++) {
            BigDecimal next = x.multiply(degree.subtract(BigDecimal.ONE), working)
                    .add(value.divide(x.pow(k - 1, working), working), working)
                    .divide(degree, working);
            if (next.subtract(x).abs().compareTo(tolerance) <= 0) {
                return next.round(mathContext);
            }
            x = next;
        }
        return x.round(mathContext);
    }
}
