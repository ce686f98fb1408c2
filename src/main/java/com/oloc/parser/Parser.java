package com.oloc.parser;

import com.oloc.exception.ArityException;
import com.oloc.exception.ErrorKind;
import com.oloc.exception.PlacementException;
import com.oloc.function.FunctionType;
import com.oloc.number.Fraction;
import com.oloc.number.Irrational;
import com.oloc.number.IrrationalParam;
import com.oloc.number.SymbolicValue;
import com.oloc.token.Span;
import com.oloc.token.Token;
import com.oloc.token.TokenGrammar;
import com.oloc.token.TokenStream;
import com.oloc.token.TokenType;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Recursive descent parser from a token stream to an expression tree.
 * <p>
 * Grammar (loosest first):
 * <pre>
 * additive       := [sign] multiplicative (('+' | '-') multiplicative)*
 * multiplicative := implicit (('*' | '/') signed(implicit))*
 * implicit       := exponent ('·' exponent)*
 * exponent       := unary (('^' | '%') signed(unary))*
 * unary          := '√' unary | primary ('!' | '°')*
 * primary        := '(' additive ')' [param]
 *                 | function '(' [additive (',' additive)*] ')' [param]
 *                 | '|' additive '|'
 *                 | integer | irrational [param]
 * signed(x)      := ('+' | '-') x | x
 * </pre>
 * A prefix sign becomes a binary operation on an implicit zero.
 */
public final class Parser {

    private final String expression;
    private final List<Token> tokens;
    private int index;
    // true for a function argument list, false for a plain bracket or bars
    private final Deque<Boolean> contexts = new ArrayDeque<>();

    public Parser(String expression, TokenStream stream) {
        this.expression = expression;
        this.tokens = stream.tokens();
        this.index = 0;
    }

    /**
     * Parse the token stream into a tree.
     *
     * @return Root node
     */
    public AstNode parse() {
        if (tokens.isEmpty()) {
            throw new PlacementException(ErrorKind.EMPTY_EXPRESSION, expression, Span.of(0, expression.length()));
        }
        AstNode result = parseAdditive();
        if (!isAtEnd()) {
            throw unexpected(peek());
        }
        return result;
    }

    private AstNode parseAdditive() {
        AstNode left;
        if (checkOperator(TokenGrammar.PLUS) || checkOperator(TokenGrammar.MINUS)) {
            Token sign = advance();
            left = BinaryOp.signed(operatorOf(sign), sign.span(), sign.origin(), parseMultiplicative());
        } else {
            left = parseMultiplicative();
        }
        while (checkOperator(TokenGrammar.PLUS) || checkOperator(TokenGrammar.MINUS)) {
            Operator op = operatorOf(advance());
            left = BinaryOp.of(op, left, parseMultiplicative());
        }
        return left;
    }

    private AstNode parseMultiplicative() {
        AstNode left = parseImplicit();
        while (checkOperator(TokenGrammar.MULTIPLY) || checkOperator(TokenGrammar.DIVIDE)) {
            Operator op = operatorOf(advance());
            left = BinaryOp.of(op, left, parseSigned(this::parseImplicit));
        }
        return left;
    }

    private AstNode parseImplicit() {
        AstNode left = parseExponent();
        while (checkOperator(TokenGrammar.IMPLICIT_MULTIPLY)) {
            advance();
            left = BinaryOp.of(Operator.IMPLICIT_MULTIPLY, left, parseExponent());
        }
        return left;
    }

    private AstNode parseExponent() {
        AstNode left = parseUnary();
        while (checkOperator(TokenGrammar.POWER) || checkOperator(TokenGrammar.PERCENT)) {
            Operator op = operatorOf(advance());
            left = BinaryOp.of(op, left, parseSigned(this::parseUnary));
        }
        return left;
    }

    private AstNode parseSigned(Supplier<AstNode> operand) {
        if (checkOperator(TokenGrammar.PLUS) || checkOperator(TokenGrammar.MINUS)) {
            Token sign = advance();
            return BinaryOp.signed(operatorOf(sign), sign.span(), sign.origin(), operand.get());
        }
        return operand.get();
    }

    private AstNode parseUnary() {
        if (checkOperator(TokenGrammar.SQRT)) {
            Token root = advance();
            AstNode operand = parseUnary();
            return new UnaryOp(Operator.SQRT, operand, root.span().union(operand.span()),
                    root.origin().union(operand.origin()));
        }
        AstNode node = parsePrimary();
        while (checkOperator(TokenGrammar.FACTORIAL) || checkOperator(TokenGrammar.DEGREE)) {
            Token postfix = advance();
            node = new UnaryOp(operatorOf(postfix), node, node.span().union(postfix.span()),
                    node.origin().union(postfix.origin()));
        }
        return node;
    }

    private AstNode parsePrimary() {
        if (isAtEnd()) {
            throw missingOperand();
        }
        Token token = peek();
        switch (token.type()) {
            case LBRACKET -> {
                return parseGrouping();
            }
            case FUNCTION -> {
                return parseCall();
            }
            case INTEGER -> {
                advance();
                SymbolicValue value = SymbolicValue.of(Fraction.of(new BigInteger(token.value())));
                return Literal.of(value, token.span(), token.origin());
            }
            case NATIVE_IRRATIONAL, SHORT_CUSTOM_IRRATIONAL, LONG_CUSTOM_IRRATIONAL -> {
                advance();
                Irrational atom = switch (token.value()) {
                    case TokenGrammar.PI -> Irrational.PI;
                    case TokenGrammar.E -> Irrational.E;
                    default -> Irrational.custom(token.value());
                };
                Token param = matchParam();
                Span span = param == null ? token.span() : token.span().union(param.span());
                Span origin = param == null ? token.origin() : token.origin().union(param.origin());
                return new Literal(SymbolicValue.of(atom), param == null ? null : IrrationalParam.parse(param.value()),
                        span, origin);
            }
            default -> {
                if (token.isOperator(TokenGrammar.ABS_BAR)) {
                    return parseAbsolute();
                }
                throw unexpected(token);
            }
        }
    }

    private AstNode parseGrouping() {
        Token open = advance();
        contexts.push(false);
        AstNode inner = parseAdditive();
        Token close = expect(TokenType.RBRACKET);
        contexts.pop();
        return withParam(new Grouping(inner, null, open.span().union(close.span()),
                open.origin().union(close.origin())));
    }

    private AstNode parseCall() {
        Token name = advance();
        FunctionType function = FunctionType.fromName(name.value())
                .orElseThrow(() -> unexpected(name));
        expect(TokenType.LBRACKET);
        contexts.push(true);
        List<AstNode> arguments = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            arguments.add(parseAdditive());
            while (match(TokenType.PARAM_SEPARATOR)) {
                arguments.add(parseAdditive());
            }
        }
        Token close = expect(TokenType.RBRACKET);
        contexts.pop();
        Span span = name.span().union(close.span());
        Span origin = name.origin().union(close.origin());
        if (!function.acceptsArity(arguments.size())) {
            throw new ArityException(ErrorKind.ARITY_MISMATCH, expression, origin,
                    function.canonicalName(), function.arityDescription(), arguments.size());
        }
        Call call = new Call(function, arguments, span, origin);
        return check(TokenType.IRRATIONAL_PARAM) ? withParam(new Grouping(call, null, span, origin)) : call;
    }

    private AstNode parseAbsolute() {
        Token open = advance();
        contexts.push(false);
        AstNode inner = parseAdditive();
        if (!checkOperator(TokenGrammar.ABS_BAR)) {
            throw isAtEnd() ? missingOperand() : unexpected(peek());
        }
        Token close = advance();
        contexts.pop();
        return new UnaryOp(Operator.ABS, inner, open.span().union(close.span()), open.origin().union(close.origin()));
    }

    private Grouping withParam(Grouping group) {
        Token param = matchParam();
        if (param == null) {
            return group;
        }
        return new Grouping(group.inner(), IrrationalParam.parse(param.value()),
                group.span().union(param.span()), group.origin().union(param.origin()));
    }

    private Token matchParam() {
        return match(TokenType.IRRATIONAL_PARAM) ? previous() : null;
    }

    // Errors

    private PlacementException unexpected(Token token) {
        return switch (token.type()) {
            case PARAM_SEPARATOR -> Boolean.TRUE.equals(contexts.peek())
                    ? missingOperand()
                    : new PlacementException(ErrorKind.MISPLACED_SEPARATOR, expression, token.origin());
            case IRRATIONAL_PARAM -> new PlacementException(ErrorKind.MISPLACED_IRRATIONAL_PARAM, expression,
                    token.origin(), token.value());
            case OPERATOR -> token.isBinaryOperator() || token.isOperator(TokenGrammar.FACTORIAL)
                    || token.isOperator(TokenGrammar.DEGREE)
                    ? new PlacementException(ErrorKind.MISSING_OPERAND, expression, token.origin(), token.value())
                    : new PlacementException(ErrorKind.UNEXPECTED_TOKEN, expression, token.origin(), token.value());
            default -> new PlacementException(ErrorKind.UNEXPECTED_TOKEN, expression, token.origin(), token.value());
        };
    }

    /**
     * Operand expected at the current position: blame the token before it.
     */
    private PlacementException missingOperand() {
        Token blamed = index > 0 ? previous() : peek();
        if (!isAtEnd() && peek().type() == TokenType.RBRACKET && index > 0
                && previous().type() == TokenType.LBRACKET) {
            blamed = peek();
        }
        return new PlacementException(ErrorKind.MISSING_OPERAND, expression, blamed.origin(), blamed.value());
    }

    // Token helpers

    private Operator operatorOf(Token token) {
        return Operator.fromSymbol(token.value().charAt(0)).orElseThrow(() -> unexpected(token));
    }

    private boolean checkOperator(char symbol) {
        return !isAtEnd() && peek().isOperator(symbol);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        if (!check(type)) {
            throw isAtEnd() ? missingOperand() : unexpected(peek());
        }
        return advance();
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.get(index++);
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }
}
