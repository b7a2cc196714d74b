package org.carball.queryflow.parser;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Escaping and quoting helpers for query string literals.
 * <p>
 * Reserved characters: {@code + - = & | > < ! ( ) { } [ ] ^ " ~ * ? : \ /}.
 */
public final class QueryStringEscaper {

    private static final String RESERVED = "+-=&|><!(){}[]^\"~*?:\\/";

    private static final Set<String> KEYWORDS = Set.of("AND", "OR", "NOT", "TO");

    private QueryStringEscaper() {
        // Utility class - prevent instantiation
    }

    public static boolean isReserved(char c) {
        return RESERVED.indexOf(c) >= 0;
    }

    public static boolean isWildcard(char c) {
        return c == '*' || c == '?';
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    /**
     * Escapes every reserved character and every whitespace character, so the
     * result can be spliced into a query string as one bare term. A backslash
     * that already escapes such a character is kept, so escaping twice gives
     * the same text.
     */
    public static String escape(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && isEscapable(value.charAt(i + 1))) {
                sb.append(c).append(value.charAt(++i));
                continue;
            }
            if (isEscapable(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static boolean isEscapable(char c) {
        return isReserved(c) || Character.isWhitespace(c);
    }

    public static List<String> escapeAll(List<String> values) {
        return values.stream()
                .map(QueryStringEscaper::escape)
                .collect(Collectors.toList());
    }

    /**
     * Escapes reserved characters of a bare literal. Whitespace is left alone;
     * literals containing whitespace are quoted instead.
     */
    public static String escapeBare(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isReserved(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Turns plain text into a wildcard pattern that matches it literally.
     */
    public static String toWildcardPattern(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 4);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isWildcard(c) || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Writes a wildcard pattern as query text. Existing escapes and the
     * wildcards themselves are kept; other reserved characters, whitespace and
     * control characters are escaped.
     */
    public static String escapeWildcardPattern(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length() + 8);
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                sb.append(c).append(pattern.charAt(++i));
            } else if (isWildcard(c)) {
                sb.append(c);
            } else if (isReserved(c) || Character.isWhitespace(c) || Character.isISOControl(c)) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * True when the pattern holds a {@code *} or {@code ?} that is not escaped.
     */
    public static boolean hasWildcard(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                i++;
            } else if (isWildcard(c)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wraps a value in double quotes, escaping backslashes and quotes.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    /**
     * Reverses {@link #quote(String)}. Text that is not wrapped in quotes only
     * has its backslash escapes removed.
     */
    public static String unquote(String value) {
        String body = value;
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            body = value.substring(1, value.length() - 1);
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                c = body.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Escapes the regex delimiter and a trailing lone backslash. Everything
     * else in a regular expression is regex syntax and stays as written.
     */
    public static String escapeRegex(String regex) {
        StringBuilder sb = new StringBuilder(regex.length() + 4);
        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);
            if (c == '\\' && i + 1 < regex.length()) {
                sb.append(c).append(regex.charAt(++i));
            } else if (c == '/' || c == '\\') {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * A bare literal must be quoted when it is empty, contains whitespace or
     * control characters, or would read as a keyword.
     */
    public static boolean needsQuoting(String text) {
        if (text.isEmpty() || isKeyword(text)) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                return true;
            }
        }
        return false;
    }
}
