package com.oloc.lexer;

import com.oloc.exception.ErrorKind;
import com.oloc.exception.IrrationalFormatException;
import com.oloc.exception.LiteralFormatException;
import com.oloc.exception.ReservedWordException;
import com.oloc.function.FunctionType;
import com.oloc.preprocess.NormalizedExpression;
import com.oloc.token.Span;
import com.oloc.token.Token;
import com.oloc.token.TokenGrammar;
import com.oloc.token.TokenStream;
import com.oloc.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans normalized text into a validated token stream, then inserts elided
 * multiplication, rewrites rational literals as reduced fractions and unifies
 * brackets. Every error points at the original input.
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private static final Pattern PARAM = Pattern.compile("[+-]?(\\d+(\\.\\d+)?)?\\?");
    private static final Pattern MIXED_TAIL = Pattern.compile("[_|]\\d+/\\d+");
    private static final String PERCENT_FOLLOWERS = "+-*/^%·)]}|,";

    public TokenStream tokenize(NormalizedExpression normalized) {
        List<Token> tokens = scan(normalized);
        validate(tokens, normalized);
        tokens = ImplicitMultiplication.apply(tokens);
        tokens = Fractionizer.apply(tokens, normalized.original());
        tokens = BracketHarmonizer.apply(tokens, normalized.original());
        TokenStream stream = TokenStream.of(tokens);
        log.debug("Tokenized '{}' into {}", normalized.text(), stream);
        return stream;
    }

    /**
     * Convenience for text that needs no preprocessing.
     */
    public TokenStream tokenize(String normalizedText) {
        return tokenize(NormalizedExpression.identity(normalizedText));
    }

    List<Token> scan(NormalizedExpression normalized) {
        String text = normalized.text();
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            Scanned scanned = scanOne(text, i, tokens, normalized);
            tokens.add(Token.of(scanned.type(), text.substring(i, scanned.end()), i,
                    normalized.originOf(Span.of(i, scanned.end()))));
            i = scanned.end();
        }
        return tokens;
    }

    private record Scanned(TokenType type, int end) {
    }

    private Scanned scanOne(String text, int i, List<Token> tokens, NormalizedExpression normalized) {
        char c = text.charAt(i);
        Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);

        if (c == TokenGrammar.LONG_OPEN) {
            return scanLongIrrational(text, i, normalized);
        }
        if (c == TokenGrammar.LONG_CLOSE) {
            throw new IrrationalFormatException(ErrorKind.UNMATCHED_LONG_RIGHT, normalized.original(),
                    normalized.originOf(Span.at(i)));
        }

        boolean attachable = previous != null
                && (previous.type().isIrrational() || previous.type() == TokenType.RBRACKET);
        if (attachable || c == TokenGrammar.QUESTION) {
            Matcher matcher = PARAM.matcher(text).region(i, text.length());
            if (matcher.lookingAt()) {
                return new Scanned(TokenType.IRRATIONAL_PARAM, matcher.end());
            }
        }

        int functionEnd = scanFunction(text, i);
        if (functionEnd > i) {
            return new Scanned(TokenType.FUNCTION, functionEnd);
        }

        if (Character.isDigit(c)) {
            return scanNumber(text, i);
        }
        if (TokenGrammar.LEFT_BRACKETS.indexOf(c) >= 0) {
            return new Scanned(TokenType.LBRACKET, i + 1);
        }
        if (TokenGrammar.RIGHT_BRACKETS.indexOf(c) >= 0) {
            return new Scanned(TokenType.RBRACKET, i + 1);
        }
        if (c == TokenGrammar.SEPARATOR || c == TokenGrammar.ALT_SEPARATOR) {
            return new Scanned(TokenType.PARAM_SEPARATOR, i + 1);
        }
        if (text.startsWith(TokenGrammar.PI, i) || text.startsWith(TokenGrammar.E, i)) {
            int length = text.startsWith(TokenGrammar.PI, i) ? TokenGrammar.PI.length() : TokenGrammar.E.length();
            return new Scanned(TokenType.NATIVE_IRRATIONAL, i + length);
        }
        if (TokenGrammar.OPERATORS.contains(c)) {
            return new Scanned(TokenType.OPERATOR, i + 1);
        }
        int codePoint = text.codePointAt(i);
        TokenType type = TokenGrammar.isShortCustomCandidate(codePoint)
                ? TokenType.SHORT_CUSTOM_IRRATIONAL : TokenType.UNKNOWN;
        return new Scanned(type, i + Character.charCount(codePoint));
    }

    private Scanned scanLongIrrational(String text, int i, NormalizedExpression normalized) {
        int close = text.indexOf(TokenGrammar.LONG_CLOSE, i + 1);
        if (close < 0) {
            throw new IrrationalFormatException(ErrorKind.UNMATCHED_LONG_LEFT, normalized.original(),
                    normalized.originOf(Span.at(i)));
        }
        String content = text.substring(i + 1, close);
        if (content.startsWith(TokenGrammar.RESERVED_PREFIX)) {
            throw new ReservedWordException(ErrorKind.RESERVED_WORD, normalized.original(),
                    normalized.originOf(Span.of(i, close + 1)), text.substring(i, close + 1));
        }
        return new Scanned(TokenType.LONG_CUSTOM_IRRATIONAL, close + 1);
    }

    /**
     * End of the longest function name at {@code i} that is followed by '(', or {@code i}.
     */
    private static int scanFunction(String text, int i) {
        int longest = 0;
        for (FunctionType function : FunctionType.values()) {
            String name = function.canonicalName();
            int end = i + name.length();
            if (name.length() > longest && text.startsWith(name, i)
                    && end < text.length() && text.charAt(end) == '(') {
                longest = name.length();
            }
        }
        return i + longest;
    }

    /**
     * Numeric literal: integer, optional mixed-fraction tail, optional decimal
     * part, optional repeating suffix ('.' run or ':' digits), optional '%'.
     */
    private Scanned scanNumber(String text, int i) {
        int end = digits(text, i);
        Matcher mixed = MIXED_TAIL.matcher(text).region(end, text.length());
        if (mixed.lookingAt()) {
            return new Scanned(TokenType.MIXED_FRACTION, mixed.end());
        }
        TokenType type = TokenType.INTEGER;
        if (end < text.length() && text.charAt(end) == TokenGrammar.DOT) {
            int fractionEnd = digits(text, end + 1);
            if (fractionEnd == end + 1) {
                // "12." or "12..." with no fractional digits
                return new Scanned(TokenType.FINITE_DECIMAL, dots(text, end));
            }
            end = fractionEnd;
            type = TokenType.FINITE_DECIMAL;
            if (end < text.length() && text.charAt(end) == TokenGrammar.DOT) {
                return new Scanned(TokenType.INFINITE_DECIMAL, dots(text, end));
            }
            if (end < text.length() && text.charAt(end) == TokenGrammar.COLON) {
                return new Scanned(TokenType.INFINITE_DECIMAL, digits(text, end + 1));
            }
        }
        if (end < text.length() && text.charAt(end) == TokenGrammar.PERCENT && isPercentage(text, end)) {
            return new Scanned(TokenType.PERCENTAGE, end + 1);
        }
        return new Scanned(type, end);
    }

    /**
     * '%' is a percentage sign when followed by a binary operator, a closing
     * bracket or bar, a separator, or the end of the expression.
     */
    static boolean isPercentage(String text, int percent) {
        int next = percent + 1;
        return next >= text.length() || PERCENT_FOLLOWERS.indexOf(text.charAt(next)) >= 0;
    }

    private static int digits(String text, int i) {
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int dots(String text, int i) {
        while (i < text.length() && text.charAt(i) == TokenGrammar.DOT) {
            i++;
        }
        return i;
    }

    /**
     * Turn unknown and malformed tokens into typed errors.
     */
    static void validate(List<Token> tokens, NormalizedExpression normalized) {
        for (Token token : tokens) {
            if (token.valid()) {
                continue;
            }
            TokenType type = token.type();
            if (type.isIrrationalFamily()) {
                throw new IrrationalFormatException(type.invalidKind(), normalized.original(), token.origin(),
                        token.value());
            }
            if (type.isRationalLiteral()) {
                throw new LiteralFormatException(type.invalidKind(), normalized.original(), token.origin(),
                        token.value());
            }
            throw new LiteralFormatException(ErrorKind.UNKNOWN_TOKEN, normalized.original(), token.origin(),
                    token.value());
        }
    }
}
