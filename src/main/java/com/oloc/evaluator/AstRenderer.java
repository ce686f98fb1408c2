package com.oloc.evaluator;

import com.oloc.number.ValueFormatter;
import com.oloc.parser.AstNode;
import com.oloc.parser.BinaryOp;
import com.oloc.parser.Call;
import com.oloc.parser.Grouping;
import com.oloc.parser.Literal;
import com.oloc.parser.Operator;
import com.oloc.parser.UnaryOp;
import com.oloc.token.TokenGrammar;

import java.util.stream.Collectors;

/**
 * Prints a (partially reduced) tree in canonical expression syntax, adding
 * brackets only where precedence requires them.
 */
public final class AstRenderer {

    private AstRenderer() {
    }

    public static String render(AstNode node) {
        return switch (node.getType()) {
            case LITERAL -> ValueFormatter.format(((Literal) node).value());
            case GROUPING -> "(" + render(((Grouping) node).inner()) + ")";
            case CALL -> renderCall((Call) node);
            case UNARY_OP -> renderUnary((UnaryOp) node);
            case BINARY_OP -> renderBinary((BinaryOp) node);
        };
    }

    private static String renderCall(Call call) {
        return call.function().canonicalName() + call.arguments().stream()
                .map(AstRenderer::render)
                .collect(Collectors.joining(String.valueOf(TokenGrammar.SEPARATOR), "(", ")"));
    }

    private static String renderUnary(UnaryOp unary) {
        Operator op = unary.operator();
        AstNode operand = unary.operand();
        return switch (op) {
            case ABS -> TokenGrammar.ABS_BAR + render(operand) + TokenGrammar.ABS_BAR;
            case SQRT -> op.symbol() + wrap(operand, precedenceOf(operand) < Operator.UNARY);
            default -> {
                boolean postfixOperand = operand instanceof UnaryOp inner && inner.operator().isPostfix();
                yield wrap(operand, precedenceOf(operand) < Operator.PRIMARY && !postfixOperand) + op.symbol();
            }
        };
    }

    private static String renderBinary(BinaryOp binary) {
        Operator op = binary.operator();
        if (binary.signed()) {
            AstNode operand = binary.right();
            return op.symbol() + wrap(operand, precedenceOf(operand) <= Operator.ADDITIVE);
        }
        String left = wrap(binary.left(), precedenceOf(binary.left()) < op.precedence());
        String right = wrap(binary.right(), precedenceOf(binary.right()) <= op.precedence());
        if (op == Operator.IMPLICIT_MULTIPLY) {
            return left + ValueFormatter.juxtapose(left, right);
        }
        return left + op.symbol() + right;
    }

    private static String wrap(AstNode node, boolean brackets) {
        String text = render(node);
        return brackets ? "(" + text + ")" : text;
    }

    /**
     * Binding strength of the printed form of a node.
     */
    static int precedenceOf(AstNode node) {
        return switch (node.getType()) {
            case LITERAL -> switch (ValueFormatter.shape(((Literal) node).value())) {
                case SUM, SIGNED -> Operator.ADDITIVE;
                case QUOTIENT -> Operator.MULTIPLICATIVE;
                case PRODUCT -> Operator.IMPLICIT;
                case POWER -> Operator.EXPONENT;
                case ATOM -> Operator.PRIMARY;
            };
            case GROUPING, CALL -> Operator.PRIMARY;
            case UNARY_OP -> ((UnaryOp) node).operator().precedence();
            case BINARY_OP -> {
                BinaryOp binary = (BinaryOp) node;
                yield binary.signed() ? Operator.ADDITIVE : binary.operator().precedence();
            }
        };
    }
}
