package com.oloc.evaluator;

import com.oloc.number.SymbolicValue;

import java.util.List;

/**
 * Outcome of evaluating a tree.
 *
 * @param value  Final exact value
 * @param steps  Rendered tree after each visible reduction; the last entry is the final value
 * @param params Irrational parameters declared in the expression
 */
public record Evaluation(SymbolicValue value, List<String> steps, ParamTable params) {

    public Evaluation {
        steps = List.copyOf(steps);
    }

    public String finalStep() {
        return steps.get(steps.size() - 1);
    }
}
