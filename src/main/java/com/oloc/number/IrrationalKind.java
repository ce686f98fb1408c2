package com.oloc.number;

/**
 * Kinds of irrational factor. Declaration order is the order factors are
 * printed in within a term.
 */
public enum IrrationalKind {
    PI,
    E,
    SHORT_CUSTOM,
    LONG_CUSTOM,
    GROUP,
    RETAINED,
    RADICAL
}
