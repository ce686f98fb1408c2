package com.oloc.function;

import com.oloc.number.Fraction;
import com.oloc.number.Irrational;
import com.oloc.number.IrrationalKind;
import com.oloc.number.Radicals;
import com.oloc.number.SymbolicTerm;
import com.oloc.number.SymbolicValue;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Pure reduction rules for operators and built-in functions. Each rule returns
 * an exact value, a retained call when no exact form exists, or throws a
 * domain or divide-by-zero error located at the call site.
 */
public final class Reductions {

    private static final int FACTORIAL_LIMIT = 10_000;
    private static final int EXPONENT_LIMIT = 100_000;
    private static final Fraction TEN = Fraction.of(10);
    private static final Fraction DEGREES_PER_HALF_TURN = Fraction.of(180);

    private Reductions() {
    }

    public static SymbolicValue add(SymbolicValue a, SymbolicValue b) {
        return a.add(b);
    }

    public static SymbolicValue subtract(SymbolicValue a, SymbolicValue b) {
        return a.subtract(b);
    }

    public static SymbolicValue multiply(SymbolicValue a, SymbolicValue b) {
        return a.multiply(b);
    }

    public static SymbolicValue divide(SymbolicValue a, SymbolicValue b, CallSite site) {
        if (b.isZero()) {
            throw site.divideByZero();
        }
        return a.divide(b);
    }

    public static SymbolicValue power(SymbolicValue base, SymbolicValue exponent, CallSite site) {
        if (!exponent.isRational()) {
            if (base.equals(SymbolicValue.ONE)) {
                return SymbolicValue.ONE;
            }
            return retained(FunctionType.POW, base, exponent);
        }
        Fraction e = exponent.asFraction();
        if (base.isZero()) {
            if (e.isZero()) {
                throw site.domainError(FunctionType.POW.canonicalName(), "0^0");
            }
            if (e.signum() < 0) {
                throw site.divideByZero();
            }
            return SymbolicValue.ZERO;
        }
        if (e.numerator().abs().compareTo(BigInteger.valueOf(EXPONENT_LIMIT)) > 0
                || e.denominator().compareTo(BigInteger.valueOf(EXPONENT_LIMIT)) > 0) {
            throw site.domainError(FunctionType.POW.canonicalName(), "exponent " + e);
        }
        if (!e.isInteger() && !e.denominator().testBit(0) && signOf(base, site.params()) < 0) {
            throw site.domainError(FunctionType.POW.canonicalName(), "an even root of " + base);
        }
        try {
            if (!e.isInteger() && base.isSingleTerm()) {
                return rootOfTerm(base.singleTerm(), e, site.params());
            }
            return base.pow(e);
        } catch (ArithmeticException ex) {
            throw site.domainError(FunctionType.POW.canonicalName(), "an even root of " + base);
        }
    }

    /**
     * Rational power of a single term. When an even power of a factor turns odd,
     * the factor's declared sign decides the result; without one the factor
     * becomes {@code abs(a)}, e.g. √(x^2) → abs(x).
     */
    private static SymbolicValue rootOfTerm(SymbolicTerm term, Fraction e, ParamResolver params) {
        Map<Irrational, Fraction> factors = new TreeMap<>();
        boolean negate = false;
        for (Map.Entry<Irrational, Fraction> factor : term.factors().entrySet()) {
            Irrational atom = factor.getKey();
            Fraction k = factor.getValue();
            Fraction scaled = k.multiply(e);
            if (k.numerator().testBit(0) || !scaled.numerator().testBit(0)) {
                factors.merge(atom, k, Fraction::add);
                continue;
            }
            int sign = signOf(atom, params);
            if (sign > 0) {
                factors.merge(atom, k, Fraction::add);
            } else if (sign < 0 && scaled.denominator().testBit(0)) {
                factors.merge(atom, k, Fraction::add);
                negate = !negate;
            } else {
                Irrational abs = Irrational.retained(FunctionType.ABS, List.of(SymbolicValue.of(atom)));
                factors.merge(abs, k, Fraction::add);
            }
        }
        SymbolicValue root = SymbolicValue.of(SymbolicTerm.of(term.coefficient(), factors)).pow(e);
        return negate ? root.negate() : root;
    }

    public static SymbolicValue modulo(SymbolicValue a, SymbolicValue b, CallSite site) {
        if (b.isZero()) {
            throw site.divideByZero();
        }
        if (a.isRational() && b.isRational()) {
            return SymbolicValue.of(a.asFraction().mod(b.asFraction()));
        }
        return retained(FunctionType.MOD, a, b);
    }

    public static SymbolicValue factorial(SymbolicValue a, CallSite site) {
        Fraction value = concreteValue(FunctionType.FACT, a, site);
        if (!value.isInteger() || value.signum() < 0) {
            throw site.domainError(FunctionType.FACT.canonicalName(), a.toString());
        }
        BigInteger n = value.numerator();
        if (n.compareTo(BigInteger.valueOf(FACTORIAL_LIMIT)) > 0) {
            throw site.domainError(FunctionType.FACT.canonicalName(), a + " (too large)");
        }
        BigInteger result = BigInteger.ONE;
        for (int i = 2; i <= n.intValue(); i++) {
            result = result.multiply(BigInteger.valueOf(i));
        }
        return SymbolicValue.of(Fraction.of(result));
    }

    public static SymbolicValue sqrt(SymbolicValue a, CallSite site) {
        return power(a, SymbolicValue.of(Fraction.HALF), site);
    }

    /**
     * Degrees to radians.
     */
    public static SymbolicValue degrees(SymbolicValue a) {
        return a.multiply(SymbolicValue.of(Irrational.PI)).divide(SymbolicValue.of(DEGREES_PER_HALF_TURN));
    }

    /**
     * Apply a built-in function to already reduced arguments.
     */
    public static SymbolicValue call(FunctionType function, List<SymbolicValue> args, CallSite site) {
        SymbolicValue a = args.get(0);
        return switch (function) {
            case POW -> power(a, args.get(1), site);
            case SQRT -> sqrt(a, site);
            case SQ -> power(a, SymbolicValue.of(2), site);
            case CUB -> power(a, SymbolicValue.of(3), site);
            case REC -> divide(SymbolicValue.ONE, a, site);
            case EXP -> exp(a);
            case MOD -> modulo(a, args.get(1), site);
            case FACT -> factorial(a, site);
            case ABS -> abs(a, site);
            case SIGN -> sign(a, site);
            case GCD -> gcdOrLcm(function, args, site);
            case LCM -> gcdOrLcm(function, args, site);
            case SIN -> sin(a);
            case COS -> cos(a);
            case TAN -> tan(a, site);
            case ASIN -> asin(a, site);
            case ACOS -> acos(a, site);
            case ATAN -> atan(a);
            case LOG -> log(function, a, args.get(1), site);
            case LN -> log(function, a, SymbolicValue.of(Irrational.E), site);
            case LG -> log(function, a, SymbolicValue.of(TEN), site);
        };
    }

    private static SymbolicValue exp(SymbolicValue a) {
        if (a.isRational()) {
            return SymbolicValue.of(SymbolicTerm.of(Fraction.ONE, Map.of(Irrational.E, a.asFraction())));
        }
        return retained(FunctionType.EXP, a);
    }

    private static SymbolicValue abs(SymbolicValue a, CallSite site) {
        int sign = signOf(a, site.params());
        if (sign == 0 && !a.isZero()) {
            return retained(FunctionType.ABS, a);
        }
        return sign < 0 ? a.negate() : a;
    }

    private static SymbolicValue sign(SymbolicValue a, CallSite site) {
        if (a.isZero()) {
            return SymbolicValue.ZERO;
        }
        int sign = signOf(a, site.params());
        return sign == 0 ? retained(FunctionType.SIGN, a) : SymbolicValue.of(sign);
    }

    private static SymbolicValue gcdOrLcm(FunctionType function, List<SymbolicValue> args, CallSite site) {
        BigInteger result = null;
        for (SymbolicValue arg : args) {
            Fraction value = concreteValue(function, arg, site);
            if (!value.isInteger()) {
                throw site.domainError(function.canonicalName(), arg.toString());
            }
            BigInteger n = value.numerator().abs();
            if (result == null) {
                result = n;
            } else if (function == FunctionType.GCD) {
                result = result.gcd(n);
            } else if (result.signum() == 0 || n.signum() == 0) {
                result = BigInteger.ZERO;
            } else {
                result = result.divide(result.gcd(n)).multiply(n);
            }
        }
        return SymbolicValue.of(Fraction.of(result));
    }

    /**
     * Rational value of an argument, substituting the declared values of custom
     * irrationals. Used by functions that are only defined on concrete numbers.
     *
     * @throws com.oloc.exception.ConversionException if a custom irrational has no declared value
     */
    private static Fraction concreteValue(FunctionType function, SymbolicValue a, CallSite site) {
        Fraction sum = Fraction.ZERO;
        for (SymbolicTerm term : a.terms()) {
            Fraction product = term.coefficient();
            for (Map.Entry<Irrational, Fraction> factor : term.factors().entrySet()) {
                Irrational atom = factor.getKey();
                Fraction exponent = factor.getValue();
                boolean custom = atom.kind() == IrrationalKind.SHORT_CUSTOM
                        || atom.kind() == IrrationalKind.LONG_CUSTOM;
                if (!custom || !exponent.isInteger()) {
                    throw site.domainError(function.canonicalName(), a.toString());
                }
                Fraction value = site.params().valueOf(atom).orElseThrow(() -> site.missingValue(atom.symbol()));
                if (value.isZero() && exponent.signum() < 0) {
                    throw site.divideByZero();
                }
                product = product.multiply(value.pow(exponent.numerator().intValueExact()));
            }
            sum = sum.add(product);
        }
        return sum;
    }

    private static SymbolicValue sin(SymbolicValue a) {
        return TrigIdentities.piMultiple(a)
                .flatMap(TrigIdentities::sinOfPiMultiple)
                .orElseGet(() -> retained(FunctionType.SIN, a));
    }

    private static SymbolicValue cos(SymbolicValue a) {
        return TrigIdentities.piMultiple(a)
                .flatMap(TrigIdentities::cosOfPiMultiple)
                .orElseGet(() -> retained(FunctionType.COS, a));
    }

    private static SymbolicValue tan(SymbolicValue a, CallSite site) {
        Optional<Fraction> k = TrigIdentities.piMultiple(a);
        if (k.isPresent()) {
            Optional<SymbolicValue> sine = TrigIdentities.sinOfPiMultiple(k.get());
            Optional<SymbolicValue> cosine = TrigIdentities.cosOfPiMultiple(k.get());
            if (sine.isPresent() && cosine.isPresent()) {
                if (cosine.get().isZero()) {
                    throw site.domainError(FunctionType.TAN.canonicalName(), a.toString());
                }
                return sine.get().divide(cosine.get());
            }
        }
        return retained(FunctionType.TAN, a);
    }

    private static SymbolicValue asin(SymbolicValue a, CallSite site) {
        checkUnitInterval(FunctionType.ASIN, a, site);
        return TrigIdentities.arcsinMultiple(a)
                .map(Reductions::piTimes)
                .orElseGet(() -> retained(FunctionType.ASIN, a));
    }

    private static SymbolicValue acos(SymbolicValue a, CallSite site) {
        checkUnitInterval(FunctionType.ACOS, a, site);
        return TrigIdentities.arcsinMultiple(a)
                .map(k -> piTimes(Fraction.HALF.subtract(k)))
                .orElseGet(() -> retained(FunctionType.ACOS, a));
    }

    private static SymbolicValue atan(SymbolicValue a) {
        return TrigIdentities.arctanMultiple(a)
                .map(Reductions::piTimes)
                .orElseGet(() -> retained(FunctionType.ATAN, a));
    }

    private static void checkUnitInterval(FunctionType function, SymbolicValue a, CallSite site) {
        if (a.isRational() && a.asFraction().abs().compareTo(Fraction.ONE) > 0) {
            throw site.domainError(function.canonicalName(), a.toString());
        }
    }

    private static SymbolicValue piTimes(Fraction k) {
        return SymbolicValue.of(SymbolicTerm.of(k, Map.of(Irrational.PI, Fraction.ONE)));
    }

    /**
     * Logarithm of {@code x} to base {@code base}; exact when x and base are
     * rational powers of a common root.
     */
    private static SymbolicValue log(FunctionType function, SymbolicValue x, SymbolicValue base, CallSite site) {
        String name = function.canonicalName();
        if (x.isZero() || signOf(x, site.params()) < 0) {
            throw site.domainError(name, x.toString());
        }
        if (base.isZero() || signOf(base, site.params()) < 0 || base.equals(SymbolicValue.ONE)) {
            throw site.domainError(name, "base " + base);
        }
        if (x.equals(SymbolicValue.ONE)) {
            return SymbolicValue.ZERO;
        }
        Optional<Map<Irrational, Fraction>> xVector = exponentVector(x);
        Optional<Map<Irrational, Fraction>> baseVector = exponentVector(base);
        if (xVector.isPresent() && baseVector.isPresent()) {
            Optional<Fraction> ratio = proportion(xVector.get(), baseVector.get());
            if (ratio.isPresent()) {
                return SymbolicValue.of(ratio.get());
            }
        }
        return switch (function) {
            case LN, LG -> retained(function, x);
            default -> retained(function, x, base);
        };
    }

    /**
     * Exponents of a positive single-term value over prime radicals and
     * irrational atoms, e.g. 12𝑒^2 → {2:2, 3:1, 𝑒:2}.
     */
    private static Optional<Map<Irrational, Fraction>> exponentVector(SymbolicValue value) {
        if (!value.isSingleTerm()) {
            return Optional.empty();
        }
        SymbolicTerm term = value.singleTerm();
        Fraction c = term.coefficient();
        if (c.signum() <= 0) {
            return Optional.empty();
        }
        Map<Irrational, Fraction> vector = new TreeMap<>(term.factors());
        Radicals.factor(c.numerator()).forEach((prime, k) ->
                vector.merge(Irrational.radical(prime), Fraction.of(k), Fraction::add));
        Radicals.factor(c.denominator()).forEach((prime, k) ->
                vector.merge(Irrational.radical(prime), Fraction.of(-k), Fraction::add));
        vector.values().removeIf(Fraction::isZero);
        return Optional.of(vector);
    }

    private static Optional<Fraction> proportion(Map<Irrational, Fraction> x, Map<Irrational, Fraction> base) {
        if (base.isEmpty() || !x.keySet().equals(base.keySet())) {
            return Optional.empty();
        }
        Fraction ratio = null;
        for (Map.Entry<Irrational, Fraction> entry : x.entrySet()) {
            Fraction r = entry.getValue().divide(base.get(entry.getKey()));
            if (ratio == null) {
                ratio = r;
            } else if (!ratio.equals(r)) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(ratio);
    }

    /**
     * Sign of a value when every term's sign is known and they agree, otherwise 0.
     */
    public static int signOf(SymbolicValue value, ParamResolver params) {
        int common = 0;
        for (SymbolicTerm term : value.terms()) {
            int sign = signOf(term, params);
            if (sign == 0 || (common != 0 && sign != common)) {
                return 0;
            }
            common = sign;
        }
        return common;
    }

    private static int signOf(SymbolicTerm term, ParamResolver params) {
        int sign = term.coefficient().signum();
        for (Map.Entry<Irrational, Fraction> factor : term.factors().entrySet()) {
            Fraction exponent = factor.getValue();
            if (exponent.isInteger() && !exponent.numerator().testBit(0)) {
                continue;
            }
            int atomSign = signOf(factor.getKey(), params);
            if (atomSign == 0) {
                return 0;
            }
            sign *= atomSign;
        }
        return sign;
    }

    private static int signOf(Irrational atom, ParamResolver params) {
        return atom.kind() == IrrationalKind.GROUP ? signOf(atom.group(), params) : params.signOf(atom);
    }

    private static SymbolicValue retained(FunctionType function, SymbolicValue... args) {
        return SymbolicValue.of(Irrational.retained(function, List.of(args)));
    }
}
