package com.oloc.lexer;

import com.oloc.exception.BracketException;
import com.oloc.exception.ErrorKind;
import com.oloc.token.Token;
import com.oloc.token.TokenGrammar;
import com.oloc.token.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Checks bracket balance and hierarchy, then rewrites every bracket to '(' / ')'.
 * Styles rank {@code ()} < {@code []} < {@code {}}; a bracket may only open
 * inside one of the same or a larger style.
 */
final class BracketHarmonizer {

    private BracketHarmonizer() {
    }

    static List<Token> apply(List<Token> tokens, String expression) {
        Deque<Token> open = new ArrayDeque<>();
        List<Token> out = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.LBRACKET) {
                char bracket = token.value().charAt(0);
                if (!open.isEmpty()
                        && TokenGrammar.bracketRank(bracket) > TokenGrammar.bracketRank(open.peek().value().charAt(0))) {
                    throw new BracketException(ErrorKind.BRACKET_HIERARCHY, expression,
                            List.of(token.origin(), open.peek().origin()), token.value());
                }
                open.push(token);
                out.add(bracket == '(' ? token : token.withValue("("));
            } else if (token.type() == TokenType.RBRACKET) {
                char bracket = token.value().charAt(0);
                if (open.isEmpty()) {
                    throw new BracketException(ErrorKind.UNMATCHED_RIGHT_BRACKET, expression, token.origin(),
                            token.value());
                }
                Token matching = open.pop();
                if (TokenGrammar.closingOf(matching.value().charAt(0)) != bracket) {
                    throw new BracketException(ErrorKind.UNMATCHED_RIGHT_BRACKET, expression,
                            List.of(token.origin(), matching.origin()), token.value());
                }
                out.add(bracket == ')' ? token : token.withValue(")"));
            } else {
                out.add(token);
            }
        }
        if (!open.isEmpty()) {
            Token unmatched = open.peek();
            throw new BracketException(ErrorKind.UNMATCHED_LEFT_BRACKET, expression, unmatched.origin(),
                    unmatched.value());
        }
        return out;
    }
}
