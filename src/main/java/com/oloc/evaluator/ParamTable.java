package com.oloc.evaluator;

import com.oloc.exception.ErrorKind;
import com.oloc.exception.IrrationalFormatException;
import com.oloc.function.ParamResolver;
import com.oloc.number.Fraction;
import com.oloc.number.Irrational;
import com.oloc.number.IrrationalKind;
import com.oloc.number.IrrationalParam;
import com.oloc.parser.AstNode;
import com.oloc.parser.Grouping;
import com.oloc.parser.Literal;
import com.oloc.token.Span;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters declared on irrationals, keyed by irrational symbol. Declarations
 * written on an irrational take precedence; a parameter on a bracket applies to
 * every irrational inside that has no declaration of its own.
 */
public final class ParamTable implements ParamResolver {

    private final Map<String, IrrationalParam> params;

    private ParamTable(Map<String, IrrationalParam> params) {
        this.params = Collections.unmodifiableMap(params);
    }

    /**
     * Collect declarations from a tree.
     *
     * @throws IrrationalFormatException when one irrational is declared with different parameters
     */
    public static ParamTable collect(AstNode root, String expression) {
        Map<String, Declaration> explicit = new LinkedHashMap<>();
        collectExplicit(root, explicit, expression);
        Map<String, Declaration> inherited = new LinkedHashMap<>();
        collectInherited(root, null, explicit, inherited, expression);

        Map<String, IrrationalParam> params = new LinkedHashMap<>();
        explicit.forEach((symbol, declaration) -> params.put(symbol, declaration.param()));
        inherited.forEach((symbol, declaration) -> params.putIfAbsent(symbol, declaration.param()));
        return new ParamTable(params);
    }

    private record Declaration(IrrationalParam param, Span origin) {
    }

    private static void collectExplicit(AstNode node, Map<String, Declaration> declared, String expression) {
        if (node instanceof Literal literal && literal.param() != null) {
            literal.atom().ifPresent(atom ->
                    declare(declared, atom, new Declaration(literal.param(), literal.origin()), expression));
        }
        for (AstNode child : node.children()) {
            collectExplicit(child, declared, expression);
        }
    }

    private static void collectInherited(AstNode node, Declaration enclosing, Map<String, Declaration> explicit,
                                         Map<String, Declaration> inherited, String expression) {
        Declaration current = enclosing;
        if (node instanceof Grouping grouping && grouping.param() != null) {
            current = new Declaration(grouping.param(), grouping.origin());
        }
        if (current != null && node instanceof Literal literal && literal.param() == null) {
            Declaration applied = current;
            literal.atom()
                    .filter(atom -> !explicit.containsKey(atom.symbol()))
                    .ifPresent(atom -> declare(inherited, atom, applied, expression));
        }
        for (AstNode child : node.children()) {
            collectInherited(child, current, explicit, inherited, expression);
        }
    }

    private static void declare(Map<String, Declaration> declared, Irrational atom, Declaration declaration,
                                String expression) {
        IrrationalParam param = declaration.param();
        if ((atom.kind() == IrrationalKind.PI || atom.kind() == IrrationalKind.E)
                && param.hasValue() && param.places() > IrrationalParam.MAX_PLACES) {
            throw new IrrationalFormatException(ErrorKind.PLACES_OUT_OF_RANGE, expression,
                    List.of(declaration.origin()), atom.symbol(), param.value());
        }
        Declaration existing = declared.putIfAbsent(atom.symbol(), declaration);
        if (existing != null && !existing.param().equals(declaration.param())) {
            throw new IrrationalFormatException(ErrorKind.CONFLICTING_IRRATIONAL_PARAM, expression,
                    List.of(existing.origin(), declaration.origin()), atom.symbol());
        }
    }

    public Map<String, IrrationalParam> asMap() {
        return params;
    }

    public IrrationalParam get(String symbol) {
        return params.get(symbol);
    }

    @Override
    public int signOf(Irrational atom) {
        return switch (atom.kind()) {
            case SHORT_CUSTOM, LONG_CUSTOM -> {
                IrrationalParam param = params.get(atom.symbol());
                yield param == null ? 0 : param.knownSign();
            }
            default -> NATIVE_ONLY.signOf(atom);
        };
    }

    @Override
    public Optional<Fraction> valueOf(Irrational atom) {
        return switch (atom.kind()) {
            case SHORT_CUSTOM, LONG_CUSTOM -> Optional.ofNullable(params.get(atom.symbol()))
                    .map(IrrationalParam::value);
            default -> Optional.empty();
        };
    }
}
