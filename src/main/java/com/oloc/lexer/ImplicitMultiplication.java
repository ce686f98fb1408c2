package com.oloc.lexer;

import com.oloc.token.Span;
import com.oloc.token.Token;
import com.oloc.token.TokenGrammar;
import com.oloc.token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts the implicit multiplication operator '·' where a product is written
 * by juxtaposition, e.g. {@code 2π}, {@code 3(x+1)}, {@code x2}, {@code (1)(2)}.
 * '·' binds tighter than '*' and '/'.
 */
final class ImplicitMultiplication {

    private ImplicitMultiplication() {
    }

    static List<Token> apply(List<Token> tokens) {
        List<Token> out = new ArrayList<>(tokens.size());
        int openBars = 0;
        Token previous = null;
        boolean previousClosesBar = false;
        for (Token token : tokens) {
            boolean bar = token.isOperator(TokenGrammar.ABS_BAR);
            boolean opensBar = bar && opensBar(previous, previousClosesBar, openBars);
            if (previous != null && needsOperator(previous, previousClosesBar, token, opensBar)) {
                out.add(Token.synthetic(TokenType.OPERATOR, String.valueOf(TokenGrammar.IMPLICIT_MULTIPLY),
                        0, Span.of(token.origin().start(), token.origin().start())));
            }
            boolean closesBar = bar && !opensBar;
            if (opensBar) {
                openBars++;
            } else if (closesBar) {
                openBars--;
            }
            out.add(token);
            previous = token;
            previousClosesBar = closesBar;
        }
        return out;
    }

    /**
     * A bar opens an absolute value unless it can close one: an open bar is
     * pending and the previous token ends an operand.
     */
    private static boolean opensBar(Token previous, boolean previousClosesBar, int openBars) {
        return openBars == 0 || previous == null || !endsOperand(previous, previousClosesBar);
    }

    private static boolean endsOperand(Token token, boolean closesBar) {
        TokenType type = token.type();
        return type.isRationalLiteral() || type.isIrrationalFamily() || type == TokenType.RBRACKET
                || closesBar || token.isOperator(TokenGrammar.FACTORIAL) || token.isOperator(TokenGrammar.DEGREE);
    }

    private static boolean needsOperator(Token left, boolean leftClosesBar, Token right, boolean rightOpensBar) {
        if (!endsOperand(left, leftClosesBar)) {
            return false;
        }
        TokenType r = right.type();
        if (r.isIrrational() || r == TokenType.LBRACKET || r == TokenType.FUNCTION
                || right.isOperator(TokenGrammar.SQRT) || rightOpensBar) {
            return true;
        }
        // A number directly after a number is never elided
        return r.isRationalLiteral() && !left.type().isRationalLiteral();
    }
}
