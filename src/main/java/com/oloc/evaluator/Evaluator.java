package com.oloc.evaluator;

import com.oloc.function.CallSite;
import com.oloc.function.FunctionType;
import com.oloc.function.Reductions;
import com.oloc.number.SymbolicValue;
import com.oloc.parser.AstNode;
import com.oloc.parser.BinaryOp;
import com.oloc.parser.Call;
import com.oloc.parser.Grouping;
import com.oloc.parser.Literal;
import com.oloc.parser.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces an expression tree to a single exact value, one node at a time.
 * <p>
 * Each pass replaces the leftmost innermost node whose children are all
 * literals with the literal of its value. A bracket around a literal is dropped
 * without a step; every other reduction renders the whole tree into the step
 * trace unless the text matches the previous step.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final String expression;

    /**
     * @param expression Original input, used for error spans
     */
    public Evaluator(String expression) {
        this.expression = expression;
    }

    public Evaluation evaluate(AstNode root) {
        ParamTable params = ParamTable.collect(root, expression);
        List<String> steps = new ArrayList<>();
        appendStep(steps, AstRenderer.render(root));

        AstNode current = root;
        while (!current.isLiteral()) {
            Reduction reduction = reduce(current, params);
            current = reduction.node();
            if (reduction.visible()) {
                appendStep(steps, AstRenderer.render(current));
            }
        }
        appendStep(steps, AstRenderer.render(current));

        log.debug("Evaluated '{}' in {} steps", expression, steps.size());
        return new Evaluation(((Literal) current).value(), steps, params);
    }

    private static void appendStep(List<String> steps, String step) {
        if (steps.isEmpty() || !steps.get(steps.size() - 1).equals(step)) {
            steps.add(step);
        }
    }

    /**
     * A rewritten tree and whether the rewrite shows up in the trace.
     */
    private record Reduction(AstNode node, boolean visible) {
    }

    private Reduction reduce(AstNode node, ParamTable params) {
        return switch (node.getType()) {
            case LITERAL -> new Reduction(node, false);
            case GROUPING -> reduceGrouping((Grouping) node, params);
            case UNARY_OP -> reduceUnary((UnaryOp) node, params);
            case BINARY_OP -> reduceBinary((BinaryOp) node, params);
            case CALL -> reduceCall((Call) node, params);
        };
    }

    private Reduction reduceGrouping(Grouping grouping, ParamTable params) {
        if (grouping.inner() instanceof Literal inner) {
            return new Reduction(Literal.of(inner.value(), grouping.span(), grouping.origin()), false);
        }
        Reduction inner = reduce(grouping.inner(), params);
        if (inner.node() instanceof Literal reduced) {
            return new Reduction(Literal.of(reduced.value(), grouping.span(), grouping.origin()), inner.visible());
        }
        return new Reduction(grouping.withInner(inner.node()), inner.visible());
    }

    private Reduction reduceUnary(UnaryOp unary, ParamTable params) {
        if (!(unary.operand() instanceof Literal operand)) {
            Reduction inner = reduce(unary.operand(), params);
            return new Reduction(unary.withOperand(inner.node()), inner.visible());
        }
        CallSite site = new CallSite(expression, unary.origin(), params);
        SymbolicValue a = operand.value();
        SymbolicValue value = switch (unary.operator()) {
            case SQRT -> Reductions.sqrt(a, site);
            case FACTORIAL -> Reductions.factorial(a, site);
            case DEGREE -> Reductions.degrees(a);
            case ABS -> Reductions.call(FunctionType.ABS, List.of(a), site);
            default -> throw new IllegalStateException("Not a unary operator: " + unary.operator());
        };
        return new Reduction(Literal.of(value, unary.span(), unary.origin()), true);
    }

    private Reduction reduceBinary(BinaryOp binary, ParamTable params) {
        if (!binary.left().isLiteral()) {
            Reduction left = reduce(binary.left(), params);
            return new Reduction(binary.withOperands(left.node(), binary.right()), left.visible());
        }
        if (!binary.right().isLiteral()) {
            Reduction right = reduce(binary.right(), params);
            return new Reduction(binary.withOperands(binary.left(), right.node()), right.visible());
        }
        CallSite site = new CallSite(expression, binary.origin(), params);
        SymbolicValue a = ((Literal) binary.left()).value();
        SymbolicValue b = ((Literal) binary.right()).value();
        SymbolicValue value = switch (binary.operator()) {
            case PLUS -> Reductions.add(a, b);
            case MINUS -> Reductions.subtract(a, b);
            case MULTIPLY, IMPLICIT_MULTIPLY -> Reductions.multiply(a, b);
            case DIVIDE -> Reductions.divide(a, b, site);
            case POWER -> Reductions.power(a, b, site);
            case MODULO -> Reductions.modulo(a, b, site);
            default -> throw new IllegalStateException("Not a binary operator: " + binary.operator());
        };
        return new Reduction(Literal.of(value, binary.span(), binary.origin()), true);
    }

    private Reduction reduceCall(Call call, ParamTable params) {
        List<AstNode> arguments = call.arguments();
        for (int i = 0; i < arguments.size(); i++) {
            AstNode argument = arguments.get(i);
            if (!argument.isLiteral()) {
                Reduction inner = reduce(argument, params);
                List<AstNode> rewritten = new ArrayList<>(arguments);
                rewritten.set(i, inner.node());
                return new Reduction(call.withArguments(rewritten), inner.visible());
            }
        }
        List<SymbolicValue> values = arguments.stream().map(argument -> ((Literal) argument).value()).toList();
        SymbolicValue value = Reductions.call(call.function(), values, new CallSite(expression, call.origin(), params));
        return new Reduction(Literal.of(value, call.span(), call.origin()), true);
    }
}
