package com.oloc.parser;

/**
 * AST node variants.
 */
public enum NodeType {
    LITERAL,
    UNARY_OP,
    BINARY_OP,
    GROUPING,
    CALL
}
