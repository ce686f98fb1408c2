package com.oloc.number;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Exact value: a sum of symbolic terms in canonical order. Like terms are merged,
 * zero terms dropped and group factors with whole positive exponents expanded.
 * A value with only a constant term is rational.
 */
public final class SymbolicValue {

    public static final SymbolicValue ZERO = new SymbolicValue(List.of());
    public static final SymbolicValue ONE = new SymbolicValue(List.of(SymbolicTerm.ONE));

    private final List<SymbolicTerm> terms;

    private SymbolicValue(List<SymbolicTerm> terms) {
        this.terms = List.copyOf(terms);
    }

    public static SymbolicValue of(Fraction value) {
        return of(SymbolicTerm.of(value));
    }

    public static SymbolicValue of(long value) {
        return of(Fraction.of(value));
    }

    public static SymbolicValue of(Irrational atom) {
        return of(SymbolicTerm.of(atom));
    }

    public static SymbolicValue of(SymbolicTerm term) {
        return ofTerms(List.of(term));
    }

    public static SymbolicValue ofTerms(Collection<SymbolicTerm> terms) {
        Map<SortedMap<Irrational, Fraction>, Fraction> merged = new LinkedHashMap<>();
        for (SymbolicTerm term : expandGroups(terms)) {
            merged.merge(term.factors(), term.coefficient(), Fraction::add);
        }
        List<SymbolicTerm> result = new ArrayList<>();
        merged.forEach((factors, coefficient) -> {
            if (!coefficient.isZero()) {
                result.add(SymbolicTerm.of(coefficient, factors));
            }
        });
        result.sort(null);
        return result.isEmpty() ? ZERO : new SymbolicValue(result);
    }

    private static List<SymbolicTerm> expandGroups(Collection<SymbolicTerm> terms) {
        List<SymbolicTerm> expanded = new ArrayList<>();
        for (SymbolicTerm term : terms) {
            Irrational whole = null;
            for (Map.Entry<Irrational, Fraction> entry : term.factors().entrySet()) {
                if (entry.getKey().kind() == IrrationalKind.GROUP
                        && entry.getValue().isInteger() && entry.getValue().signum() > 0) {
                    whole = entry.getKey();
                    break;
                }
            }
            if (whole == null) {
                expanded.add(term);
                continue;
            }
            Map<Irrational, Fraction> rest = new TreeMap<>(term.factors());
            int power = rest.remove(whole).numerator().intValueExact();
            SymbolicValue product = ofTerms(List.of(SymbolicTerm.of(term.coefficient(), rest)));
            for (int i = 0; i < power; i++) {
                product = distribute(product.terms, whole.group().terms);
            }
            expanded.addAll(product.terms);
        }
        return expanded;
    }

    public List<SymbolicTerm> terms() {
        return terms;
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isRational() {
        return terms.isEmpty() || (terms.size() == 1 && terms.get(0).isConstant());
    }

    /**
     * @throws IllegalStateException if the value keeps irrational factors
     */
    public Fraction asFraction() {
        if (!isRational()) {
            throw new IllegalStateException("Not a rational value: " + this);
        }
        return terms.isEmpty() ? Fraction.ZERO : terms.get(0).coefficient();
    }

    public boolean isSingleTerm() {
        return terms.size() <= 1;
    }

    public SymbolicTerm singleTerm() {
        return terms.isEmpty() ? SymbolicTerm.ZERO : terms.get(0);
    }

    public SymbolicValue add(SymbolicValue other) {
        List<SymbolicTerm> all = new ArrayList<>(terms);
        all.addAll(other.terms);
        return ofTerms(all);
    }

    public SymbolicValue negate() {
        return ofTerms(terms.stream().map(SymbolicTerm::negate).toList());
    }

    public SymbolicValue subtract(SymbolicValue other) {
        return add(other.negate());
    }

    public SymbolicValue multiply(SymbolicValue other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        List<SymbolicTerm> left = terms;
        List<SymbolicTerm> right = other.terms;
        if (!other.isSingleTerm() && mentions(other.factorOut(false).atom())) {
            right = List.of(other.factorOut(false).asTerm());
        } else if (!isSingleTerm() && other.mentions(factorOut(false).atom())) {
            left = List.of(factorOut(false).asTerm());
        }
        return distribute(left, right);
    }

    private static SymbolicValue distribute(List<SymbolicTerm> left, List<SymbolicTerm> right) {
        List<SymbolicTerm> products = new ArrayList<>();
        for (SymbolicTerm a : left) {
            for (SymbolicTerm b : right) {
                products.add(a.multiply(b));
            }
        }
        return ofTerms(products);
    }

    /**
     * Exact quotient. A multi-term divisor that does not divide this value
     * becomes a group factor with a negative exponent.
     *
     * @throws ArithmeticException if the divisor is zero
     */
    public SymbolicValue divide(SymbolicValue other) {
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        if (other.isSingleTerm()) {
            return multiply(of(other.singleTerm().inverse()));
        }
        if (terms.size() == other.terms.size()) {
            SymbolicTerm ratio = terms.get(0).multiply(other.terms.get(0).inverse());
            if (other.multiply(of(ratio)).equals(this)) {
                return of(ratio);
            }
        }
        return multiply(of(other.factorOut(false).asTerm().inverse()));
    }

    /**
     * Rational power.
     *
     * @throws ArithmeticException for zero to a non-positive power and even roots of negatives
     */
    public SymbolicValue pow(Fraction exponent) {
        if (isZero()) {
            if (exponent.signum() <= 0) {
                throw new ArithmeticException("Zero to a non-positive power");
            }
            return ZERO;
        }
        if (isSingleTerm()) {
            return of(singleTerm().pow(exponent));
        }
        if (exponent.isInteger()) {
            int n = exponent.numerator().intValueExact();
            SymbolicValue result = ONE;
            for (int i = 0; i < Math.abs(n); i++) {
                result = result.multiply(this);
            }
            return n < 0 ? ONE.divide(result) : result;
        }
        return of(factorOut(true).asTerm().pow(exponent));
    }

    private boolean mentions(Irrational atom) {
        for (SymbolicTerm term : terms) {
            if (term.factors().containsKey(atom)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Split a multi-term sum into a scale and a sum whose leading coefficient is 1,
     * or -1 when {@code positiveScale} is requested for a negative leading term.
     */
    private Factored factorOut(boolean positiveScale) {
        Fraction leading = terms.get(0).coefficient();
        Fraction scale = positiveScale ? leading.abs() : leading;
        List<SymbolicTerm> scaled = terms.stream()
                .map(term -> term.withCoefficient(term.coefficient().divide(scale)))
                .toList();
        return new Factored(scale, new SymbolicValue(scaled));
    }

    private record Factored(Fraction scale, SymbolicValue group) {
        Irrational atom() {
            return Irrational.group(group);
        }

        SymbolicTerm asTerm() {
            return SymbolicTerm.of(scale, Map.of(atom(), Fraction.ONE));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolicValue other)) {
            return false;
        }
        return terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }
}
