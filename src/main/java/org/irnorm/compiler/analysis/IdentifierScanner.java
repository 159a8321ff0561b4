package org.irnorm.compiler.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Finds variable-like identifiers in raw target text.
 * <p>
 * This is the only place that knows identifier boundaries. A token counts as a variable
 * reference unless it is a syntax keyword, a call ({@code name(}), a keyword key
 * ({@code name:}), a field or remote function ({@code .name}), an atom ({@code :name}), a module
 * attribute ({@code @name}) or a capture ({@code &name}). String contents are skipped except for
 * {@code #{...}} interpolations; comments are skipped.
 */
public final class IdentifierScanner {

    /**
     * One identifier occurrence.
     *
     * @param name The identifier.
     * @param start Offset of the first character.
     * @param end Offset after the last character.
     */
    public record Token(String name, int start, int end) {}

    private static final Set<String> KEYWORDS = Set.of(
            "do", "end", "fn", "when", "and", "or", "not", "in", "true", "false", "nil",
            "else", "after", "rescue", "catch", "if", "unless", "case", "cond", "with", "for",
            "try", "receive", "def", "defp", "defmodule", "defmacro", "alias", "import",
            "require", "use", "quote", "unquote");

    private IdentifierScanner() {}

    /**
     * Scans the text for variable-like identifier occurrences.
     * @param text The raw text.
     * @return The occurrences in text order.
     */
    public static List<Token> scan(String text) {
        List<Token> tokens = new ArrayList<>();
        scanCode(text, 0, text.length(), tokens);
        return tokens;
    }

    /**
     * @param text The raw text.
     * @return The distinct identifiers, in order of first occurrence.
     */
    public static Set<String> identifiers(String text) {
        Set<String> names = new LinkedHashSet<>();
        for (Token token : scan(text)) {
            names.add(token.name());
        }
        return names;
    }

    /**
     * Whole-identifier containment: {@code query} is not contained in {@code search_query}.
     * @param text The raw text.
     * @param name The identifier.
     * @return {@code true} if the identifier occurs as a variable-like token.
     */
    public static boolean contains(String text, String name) {
        for (Token token : scan(text)) {
            if (token.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces every occurrence of one identifier.
     * @param text The raw text.
     * @param from The identifier to replace.
     * @param to The replacement.
     * @return The rewritten text; the same instance if nothing matched.
     */
    public static String replace(String text, String from, String to) {
        return replace(text, name -> name.equals(from) ? to : name);
    }

    /**
     * Replaces identifiers through a renaming function.
     * @param text The raw text.
     * @param renamer Maps an identifier to its replacement, or returns it unchanged.
     * @return The rewritten text; the same instance if nothing changed.
     */
    public static String replace(String text, UnaryOperator<String> renamer) {
        StringBuilder out = null;
        int copied = 0;
        for (Token token : scan(text)) {
            String renamed = renamer.apply(token.name());
            if (renamed.equals(token.name())) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 8);
            }
            out.append(text, copied, token.start()).append(renamed);
            copied = token.end();
        }
        if (out == null) {
            return text;
        }
        out.append(text, copied, text.length());
        return out.toString();
    }

    private static void scanCode(String text, int from, int to, List<Token> tokens) {
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i, to, tokens);
            } else if (c == '#') {
                while (i < to && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '~' && i + 2 < to && Character.isLetter(text.charAt(i + 1))) {
                i = skipSigil(text, i, to);
            } else if (isIdentifierStart(c) && (i == from || !isIdentifierPart(text.charAt(i - 1)))) {
                int end = i + 1;
                while (end < to && isIdentifierPart(text.charAt(end))) {
                    end++;
                }
                if (end < to && (text.charAt(end) == '?' || text.charAt(end) == '!')) {
                    end++;
                }
                String name = text.substring(i, end);
                if (isVariableToken(text, i, end, to, name)) {
                    tokens.add(new Token(name, i, end));
                }
                i = end;
            } else if (Character.isLetterOrDigit(c)) {
                // module aliases and number literals
                while (i < to && (isIdentifierPart(text.charAt(i)) || text.charAt(i) == '.'
                        && i + 1 < to && Character.isDigit(text.charAt(i + 1)))) {
                    i++;
                }
            } else {
                i++;
            }
        }
    }

    private static boolean isVariableToken(String text, int start, int end, int limit, String name) {
        if (KEYWORDS.contains(name) || name.startsWith("__") && name.endsWith("__")) {
            return false;
        }
        if (start > 0) {
            char prev = text.charAt(start - 1);
            if (prev == ':' || prev == '@' || prev == '&') {
                return false;
            }
            if (prev == '.' && !(start > 1 && text.charAt(start - 2) == '.')) {
                return false;
            }
        }
        if (end < limit) {
            char next = text.charAt(end);
            if (next == '(') {
                return false;
            }
            if (next == ':' && (end + 1 >= limit || text.charAt(end + 1) != ':')) {
                return false;
            }
        }
        return true;
    }

    private static int skipString(String text, int start, int to, List<Token> tokens) {
        char quote = text.charAt(start);
        boolean heredoc = start + 2 < to && text.charAt(start + 1) == quote && text.charAt(start + 2) == quote;
        int i = start + (heredoc ? 3 : 1);
        while (i < to) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '#' && i + 1 < to && text.charAt(i + 1) == '{') {
                int close = findClosingBrace(text, i + 2, to);
                scanCode(text, i + 2, close, tokens);
                i = close + 1;
            } else if (c == quote) {
                if (!heredoc) {
                    return i + 1;
                }
                if (i + 2 < to && text.charAt(i + 1) == quote && text.charAt(i + 2) == quote) {
                    return i + 3;
                }
                i++;
            } else {
                i++;
            }
        }
        return to;
    }

    private static int findClosingBrace(String text, int from, int to) {
        int depth = 1;
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i, to, new ArrayList<>());
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
            i++;
        }
        return to;
    }

    private static int skipSigil(String text, int start, int to) {
        int i = start + 2;
        while (i < to && Character.isLetter(text.charAt(i - 1)) && Character.isLetter(text.charAt(i))) {
            i++;
        }
        if (i >= to) {
            return to;
        }
        char open = text.charAt(i);
        char close = switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> open;
        };
        i++;
        while (i < to && text.charAt(i) != close) {
            i += text.charAt(i) == '\\' ? 2 : 1;
        }
        i++;
        while (i < to && Character.isLetter(text.charAt(i))) {
            i++;
        }
        return Math.min(i, to);
    }

    private static boolean isIdentifierStart(char c) {
        return c >= 'a' && c <= 'z' || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
