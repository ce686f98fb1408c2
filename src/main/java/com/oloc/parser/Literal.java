package com.oloc.parser;

import com.oloc.number.Irrational;
import com.oloc.number.IrrationalParam;
import com.oloc.number.SymbolicTerm;
import com.oloc.number.SymbolicValue;
import com.oloc.token.Span;

import java.util.List;
import java.util.Optional;

/**
 * Exact value leaf: an integer or an irrational from the input, or the result
 * of a reduction.
 *
 * @param value  Exact value
 * @param param  Parameter declared with '?' on an irrational, or {@code null}
 * @param span   Stream span
 * @param origin Original input span
 */
public record Literal(SymbolicValue value, IrrationalParam param, Span span, Span origin) implements AstNode {

    public static Literal of(SymbolicValue value, Span span, Span origin) {
        return new Literal(value, null, span, origin);
    }

    /**
     * The zero a prefix sign is applied to.
     */
    public static Literal implicitZero(Span at, Span origin) {
        return new Literal(SymbolicValue.ZERO, null, Span.of(at.start(), at.start()),
                Span.of(origin.start(), origin.start()));
    }

    /**
     * The irrational when this literal is exactly one irrational with coefficient 1.
     */
    public Optional<Irrational> atom() {
        if (!value.isSingleTerm() || value.isZero()) {
            return Optional.empty();
        }
        SymbolicTerm term = value.singleTerm();
        if (!term.coefficient().isOne() || term.factors().size() != 1) {
            return Optional.empty();
        }
        Irrational atom = term.factors().firstKey();
        return term.factors().get(atom).isOne() ? Optional.of(atom) : Optional.empty();
    }

    @Override
    public NodeType getType() {
        return NodeType.LITERAL;
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }
}
