package com.oloc.preprocess;

import com.oloc.config.MappingTable;
import com.oloc.function.FunctionType;
import com.oloc.token.Span;
import com.oloc.token.TokenGrammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Applies the symbol and function alias tables. At each position the table is
 * tried top to bottom and each entry's aliases left to right; the first alias
 * that matches is replaced by its canonical form. Function names written before
 * '(' and the interiors of long custom irrationals are protected and copied as is.
 */
public final class AliasResolver {

    private final MappingTable symbols;
    private final MappingTable functions;
    private final List<String> canonicalFunctionNames;

    public AliasResolver(MappingTable symbols, MappingTable functions) {
        this.symbols = symbols;
        this.functions = functions;
        this.canonicalFunctionNames = Arrays.stream(FunctionType.values())
                .map(FunctionType::canonicalName)
                .toList();
    }

    public TrackedText resolveSymbols(TrackedText text) {
        List<String> protectedNames = new ArrayList<>(canonicalFunctionNames);
        functions.entries().forEach(entry -> protectedNames.addAll(entry.aliases()));
        return resolve(text, symbols, protectedSpans(text.text(), protectedNames), false);
    }

    public TrackedText resolveFunctions(TrackedText text) {
        return resolve(text, functions, protectedSpans(text.text(), canonicalFunctionNames), true);
    }

    /**
     * Replace aliases outside the protected spans.
     *
     * @param requireCall only replace aliases immediately followed by '('
     */
    static TrackedText resolve(TrackedText text, MappingTable table, List<Span> protectedSpans, boolean requireCall) {
        if (table.isEmpty()) {
            return text;
        }
        TrackedText.Builder out = text.rewrite();
        String source = text.text();
        int next = 0;
        int i = 0;
        while (i < source.length()) {
            while (next < protectedSpans.size() && protectedSpans.get(next).end() <= i) {
                next++;
            }
            Span guarded = next < protectedSpans.size() ? protectedSpans.get(next) : null;
            if (guarded != null && guarded.contains(i)) {
                out.copy(text, i, guarded.end());
                i = guarded.end();
                continue;
            }
            int limit = guarded != null ? guarded.start() : source.length();
            MatchedAlias match = match(source, i, limit, table, requireCall);
            if (match == null) {
                out.copy(text, i, i + 1);
                i++;
                continue;
            }
            Span origin = text.originOf(Span.of(i, i + match.length()));
            out.append(match.canonical(), origin);
            i += match.length();
        }
        return out.build();
    }

    private record MatchedAlias(String canonical, int length) {
    }

    private static MatchedAlias match(String source, int at, int limit, MappingTable table, boolean requireCall) {
        for (MappingTable.Entry entry : table.entries()) {
            for (String alias : entry.aliases()) {
                int end = at + alias.length();
                if (end > limit || !source.startsWith(alias, at)) {
                    continue;
                }
                if (requireCall && (end >= source.length() || source.charAt(end) != '(')) {
                    continue;
                }
                return new MatchedAlias(entry.canonical(), alias.length());
            }
        }
        return null;
    }

    /**
     * Spans of function names written before '(' (longest name wins) and of
     * complete {@code <...>} long irrationals, in order.
     */
    static List<Span> protectedSpans(String text, List<String> names) {
        List<Span> spans = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == TokenGrammar.LONG_OPEN) {
                int close = text.indexOf(TokenGrammar.LONG_CLOSE, i + 1);
                int reopen = text.indexOf(TokenGrammar.LONG_OPEN, i + 1);
                if (close > 0 && (reopen < 0 || reopen > close)) {
                    spans.add(Span.of(i, close + 1));
                    i = close + 1;
                    continue;
                }
                i++;
                continue;
            }
            int longest = 0;
            for (String name : names) {
                int end = i + name.length();
                if (name.length() > longest && text.startsWith(name, i)
                        && end < text.length() && text.charAt(end) == '(') {
                    longest = name.length();
                }
            }
            if (longest > 0) {
                spans.add(Span.of(i, i + longest));
                i += longest;
            } else {
                i++;
            }
        }
        return spans;
    }
}
