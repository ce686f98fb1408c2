package com.oloc.parser;

import com.oloc.token.Span;

import java.util.List;

/**
 * Prefix {@code √}, postfix {@code !} and {@code °}, or absolute value bars.
 */
public record UnaryOp(Operator operator, AstNode operand, Span span, Span origin) implements AstNode {

    @Override
    public NodeType getType() {
        return NodeType.UNARY_OP;
    }

    @Override
    public List<AstNode> children() {
        return List.of(operand);
    }

    public UnaryOp withOperand(AstNode newOperand) {
        return new UnaryOp(operator, newOperand, span, origin);
    }
}
