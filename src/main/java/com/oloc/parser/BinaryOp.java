package com.oloc.parser;

import com.oloc.token.Span;

import java.util.List;

/**
 * Binary operation. A prefix sign is a binary operation on an implicit zero.
 *
 * @param signed whether {@code left} is the implicit zero of a prefix sign
 */
public record BinaryOp(Operator operator, AstNode left, AstNode right, boolean signed, Span span, Span origin)
        implements AstNode {

    public static BinaryOp of(Operator operator, AstNode left, AstNode right) {
        return new BinaryOp(operator, left, right, false,
                left.span().union(right.span()), left.origin().union(right.origin()));
    }

    /**
     * {@code 0 ± operand} for a prefix sign written at {@code sign}.
     */
    public static BinaryOp signed(Operator operator, Span sign, Span signOrigin, AstNode operand) {
        return new BinaryOp(operator, Literal.implicitZero(sign, signOrigin), operand, true,
                sign.union(operand.span()), signOrigin.union(operand.origin()));
    }

    @Override
    public NodeType getType() {
        return NodeType.BINARY_OP;
    }

    @Override
    public List<AstNode> children() {
        return List.of(left, right);
    }

    public BinaryOp withOperands(AstNode newLeft, AstNode newRight) {
        return new BinaryOp(operator, newLeft, newRight, signed, span, origin);
    }
}
