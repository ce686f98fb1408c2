package com.oloc.parser;

import com.oloc.function.FunctionType;
import com.oloc.token.Span;

import java.util.List;

/**
 * Function application with its arguments in order.
 */
public record Call(FunctionType function, List<AstNode> arguments, Span span, Span origin) implements AstNode {

    public Call {
        arguments = List.copyOf(arguments);
    }

    @Override
    public NodeType getType() {
        return NodeType.CALL;
    }

    @Override
    public List<AstNode> children() {
        return arguments;
    }

    public Call withArguments(List<AstNode> newArguments) {
        return new Call(function, newArguments, span, origin);
    }
}
