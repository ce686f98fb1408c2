package com.oloc.preprocess;

import com.oloc.config.OlocConfig;
import com.oloc.exception.CommentException;
import com.oloc.exception.ErrorKind;
import com.oloc.exception.PlacementException;
import com.oloc.exception.SeparatorException;
import com.oloc.function.FunctionType;
import com.oloc.token.Span;
import com.oloc.token.TokenGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Turns raw input into normalized expression text. Steps run in order and each
 * may abort with a typed error located in the original input:
 * comments, superscripts, symbol aliases, function aliases, trailing '=',
 * redundant signs and separators.
 */
public class Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private static final String SUPERSCRIPTS = "⁰¹²³⁴⁵⁶⁷⁸⁹";

    private final AliasResolver aliases;

    public Preprocessor(OlocConfig config) {
        this.aliases = new AliasResolver(config.symbols(), config.functions());
    }

    public NormalizedExpression process(String expression) {
        TrackedText text = TrackedText.of(expression);
        text = removeComments(text, expression);
        text = normalizeSuperscripts(text);
        text = aliases.resolveSymbols(text);
        text = aliases.resolveFunctions(text);
        text = removeTrailingEquals(text, expression);
        text = collapseSigns(text);
        text = resolveSeparators(text, expression);
        log.debug("Normalized '{}' to '{}'", expression, text);
        return new NormalizedExpression(expression, text);
    }

    /**
     * Drop a trailing {@code @...} comment, then every {@code #...#} pair.
     */
    TrackedText removeComments(TrackedText text, String expression) {
        String source = text.text();
        int at = source.indexOf(TokenGrammar.AT);
        int end = at >= 0 ? at : source.length();

        int hashes = 0;
        int lastHash = -1;
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == TokenGrammar.HASH) {
                hashes++;
                lastHash = i;
            }
        }
        if (hashes % 2 != 0) {
            throw new CommentException(ErrorKind.MISMATCHED_HASH, expression, text.originAt(lastHash));
        }

        TrackedText.Builder out = text.rewrite();
        boolean inComment = false;
        for (int i = 0; i < end; i++) {
            char c = source.charAt(i);
            if (c == TokenGrammar.HASH) {
                inComment = !inComment;
            } else if (!inComment) {
                out.copy(text, i, i + 1);
            }
        }
        return out.build();
    }

    /**
     * A run of superscript digits becomes '^' followed by the digits.
     */
    TrackedText normalizeSuperscripts(TrackedText text) {
        String source = text.text();
        TrackedText.Builder out = text.rewrite();
        boolean inRun = false;
        for (int i = 0; i < source.length(); i++) {
            int digit = SUPERSCRIPTS.indexOf(source.charAt(i));
            if (digit < 0) {
                inRun = false;
                out.copy(text, i, i + 1);
                continue;
            }
            if (!inRun) {
                out.append(TokenGrammar.POWER, text.originAt(i));
                inRun = true;
            }
            out.append((char) ('0' + digit), text.originAt(i));
        }
        return out.build();
    }

    /**
     * Remove one '=' at the very end; any other '=' is misplaced.
     */
    TrackedText removeTrailingEquals(TrackedText text, String expression) {
        String source = text.text();
        int end = source.length();
        if (end > 0 && source.charAt(end - 1) == TokenGrammar.EQUALS) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == TokenGrammar.EQUALS) {
                throw new PlacementException(ErrorKind.MISPLACED_EQUAL_SIGN, expression, text.originAt(i));
            }
        }
        return end == source.length() ? text : text.rewrite().copy(text, 0, end).build();
    }

    /**
     * Collapse runs of '+' and '-' by the parity of '-', then drop a '+' that
     * opens the expression, a bracket or an argument.
     */
    TrackedText collapseSigns(TrackedText text) {
        String source = text.text();
        TrackedText.Builder out = text.rewrite();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c != TokenGrammar.PLUS && c != TokenGrammar.MINUS) {
                out.copy(text, i, i + 1);
                i++;
                continue;
            }
            int start = i;
            boolean negative = false;
            while (i < source.length()
                    && (source.charAt(i) == TokenGrammar.PLUS || source.charAt(i) == TokenGrammar.MINUS)) {
                negative ^= source.charAt(i) == TokenGrammar.MINUS;
                i++;
            }
            boolean opening = out.length() == 0 || isOpening(out.lastChar());
            if (negative) {
                out.append(TokenGrammar.MINUS, text.originOf(Span.of(start, i)));
            } else if (!opening) {
                out.append(TokenGrammar.PLUS, text.originOf(Span.of(start, i)));
            }
        }
        return out.build();
    }

    private static boolean isOpening(char c) {
        return TokenGrammar.LEFT_BRACKETS.indexOf(c) >= 0
                || c == TokenGrammar.SEPARATOR || c == TokenGrammar.ALT_SEPARATOR;
    }

    private record Frame(boolean function, boolean semicolons) {
    }

    /**
     * Inside a function's own argument list ',' separates arguments unless the
     * list uses ';'. Anywhere else ',' must group integer digits in threes and is
     * removed. ';' becomes ','.
     */
    TrackedText resolveSeparators(TrackedText text, String expression) {
        String source = text.text();
        TrackedText.Builder out = text.rewrite();
        Deque<Frame> frames = new ArrayDeque<>();
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (TokenGrammar.LEFT_BRACKETS.indexOf(c) >= 0) {
                boolean function = c == '(' && functionNameEndsAt(source, i);
                frames.push(new Frame(function, function && usesSemicolons(source, i)));
                out.copy(text, i, i + 1);
            } else if (TokenGrammar.RIGHT_BRACKETS.indexOf(c) >= 0) {
                if (!frames.isEmpty()) {
                    frames.pop();
                }
                out.copy(text, i, i + 1);
            } else if (c == TokenGrammar.ALT_SEPARATOR) {
                out.append(TokenGrammar.SEPARATOR, text.originAt(i));
            } else if (c == TokenGrammar.SEPARATOR) {
                Frame frame = frames.peek();
                if (frame != null && frame.function() && !frame.semicolons()) {
                    out.copy(text, i, i + 1);
                } else if (!isDigitGroupSeparator(source, i)) {
                    throw new SeparatorException(ErrorKind.INVALID_DIGIT_SEPARATOR, expression, text.originAt(i));
                }
            } else {
                out.copy(text, i, i + 1);
            }
        }
        return out.build();
    }

    private static boolean functionNameEndsAt(String source, int open) {
        for (FunctionType function : FunctionType.values()) {
            String name = function.canonicalName();
            if (open >= name.length() && source.startsWith(name, open - name.length())) {
                return true;
            }
        }
        return false;
    }

    private static boolean usesSemicolons(String source, int open) {
        int depth = 0;
        for (int i = open + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (TokenGrammar.LEFT_BRACKETS.indexOf(c) >= 0) {
                depth++;
            } else if (TokenGrammar.RIGHT_BRACKETS.indexOf(c) >= 0) {
                if (depth == 0) {
                    return false;
                }
                depth--;
            } else if (c == TokenGrammar.ALT_SEPARATOR && depth == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the ',' at {@code index} separates digit groups of an integer part:
     * 1-3 digits (or a full group after an earlier ',') before it, exactly three after.
     */
    static boolean isDigitGroupSeparator(String source, int index) {
        if (index + 3 >= source.length()) {
            return false;
        }
        for (int k = 1; k <= 3; k++) {
            if (!Character.isDigit(source.charAt(index + k))) {
                return false;
            }
        }
        if (index + 4 < source.length() && Character.isDigit(source.charAt(index + 4))) {
            return false;
        }
        int digits = 0;
        int j = index - 1;
        while (j >= 0 && Character.isDigit(source.charAt(j))) {
            digits++;
            j--;
        }
        if (digits == 0) {
            return false;
        }
        if (j >= 0 && source.charAt(j) == TokenGrammar.SEPARATOR) {
            return digits == 3;
        }
        if (j >= 0 && source.charAt(j) == TokenGrammar.DOT) {
            return false;
        }
        return digits <= 3;
    }
}
