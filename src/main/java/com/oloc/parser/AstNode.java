package com.oloc.parser;

import com.oloc.token.Span;

import java.util.List;

/**
 * Node of the expression tree. Consumers switch over {@link #getType()}.
 */
public interface AstNode {

    NodeType getType();

    /**
     * Span of the node's tokens in the token stream source.
     */
    Span span();

    /**
     * Span of the node in the original input.
     */
    Span origin();

    List<AstNode> children();

    default boolean isLiteral() {
        return getType() == NodeType.LITERAL;
    }
}
