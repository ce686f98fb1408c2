package com.oloc.parser;

import com.oloc.number.IrrationalParam;
import com.oloc.token.Span;

import java.util.List;

/**
 * Bracketed sub-expression, optionally followed by a parameter that applies to
 * the irrationals inside it.
 */
public record Grouping(AstNode inner, IrrationalParam param, Span span, Span origin) implements AstNode {

    @Override
    public NodeType getType() {
        return NodeType.GROUPING;
    }

    @Override
    public List<AstNode> children() {
        return List.of(inner);
    }

    public Grouping withInner(AstNode newInner) {
        return new Grouping(newInner, param, span, origin);
    }
}
