package org.carball.queryflow.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.LexException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits query string text into tokens.
 * <p>
 * Unquoted values end at whitespace, parentheses, brackets, braces, a quote or
 * a colon unless the character is escaped with a backslash. {@code AND},
 * {@code OR}, {@code NOT} and {@code TO} are keywords only when written in
 * upper case outside quotes. A value directly followed by a colon is a field.
 */
@Slf4j
public class QueryStringLexer {

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int rangeOpenOffset = -1;

    public QueryStringLexer(String input) {
        this.input = input == null ? "" : input;
    }

    public static List<Token> tokenize(String input) {
        return new QueryStringLexer(input).tokenize();
    }

    public List<Token> tokenize() {
        if (!tokens.isEmpty()) {
            return List.copyOf(tokens);
        }
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            char c = input.charAt(pos);
            switch (c) {
                case '(' -> tokens.add(Token.of(TokenType.LPAREN, "(", pos++));
                case ')' -> tokens.add(Token.of(TokenType.RPAREN, ")", pos++));
                case '[', '{' -> openRange(c);
                case ']', '}' -> closeRange(c);
                case ':' -> tokens.add(Token.of(TokenType.OPERATOR, ":", pos++));
                case '>', '<' -> readComparison(c);
                case '"' -> readQuoted();
                case '/' -> readRegex();
                default -> readWord();
            }
        }
        if (rangeOpenOffset >= 0) {
            throw new LexException(rangeOpenOffset, "unbalanced bracket '" + input.charAt(rangeOpenOffset) + "'");
        }
        tokens.add(Token.of(TokenType.EOF, "", input.length()));
        log.trace("Tokenized {} chars into {} tokens", input.length(), tokens.size());
        return List.copyOf(tokens);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void openRange(char c) {
        if (rangeOpenOffset >= 0) {
            throw new LexException(pos, "nested range bracket '" + c + "'");
        }
        rangeOpenOffset = pos;
        tokens.add(Token.of(TokenType.RANGE_OPEN, String.valueOf(c), pos++));
    }

    private void closeRange(char c) {
        if (rangeOpenOffset < 0) {
            throw new LexException(pos, "unbalanced bracket '" + c + "'");
        }
        rangeOpenOffset = -1;
        tokens.add(Token.of(TokenType.RANGE_CLOSE, String.valueOf(c), pos++));
    }

    private void readComparison(char c) {
        int start = pos++;
        if (pos < input.length() && input.charAt(pos) == '=') {
            pos++;
            tokens.add(Token.of(TokenType.OPERATOR, c + "=", start));
        } else {
            tokens.add(Token.of(TokenType.OPERATOR, String.valueOf(c), start));
        }
    }

    private void readQuoted() {
        int start = pos++;
        StringBuilder text = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '"') {
                tokens.add(new Token(TokenType.VALUE, text.toString(), start, true, false));
                return;
            }
            if (c == '\\') {
                if (pos >= input.length()) {
                    break;
                }
                c = input.charAt(pos++);
            }
            text.append(c);
        }
        throw new LexException(start, "unterminated quoted value");
    }

    private void readRegex() {
        int start = pos++;
        StringBuilder body = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '/') {
                tokens.add(Token.of(TokenType.REGEX, body.toString(), start));
                return;
            }
            body.append(c);
            if (c == '\\' && pos < input.length()) {
                body.append(input.charAt(pos++));
            }
        }
        throw new LexException(start, "unterminated regular expression");
    }

    private void readWord() {
        int start = pos;
        StringBuilder plain = new StringBuilder();
        StringBuilder pattern = new StringBuilder();
        boolean wildcard = false;
        boolean escaped = false;

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c) || isTerminator(c)) {
                break;
            }
            if (c == '\\') {
                if (pos + 1 >= input.length()) {
                    throw new LexException(pos, "dangling escape character");
                }
                char next = input.charAt(pos + 1);
                plain.append(next);
                if (QueryStringEscaper.isWildcard(next) || next == '\\') {
                    pattern.append('\\');
                }
                pattern.append(next);
                escaped = true;
                pos += 2;
                continue;
            }
            if (Character.isISOControl(c)) {
                throw new LexException(pos, String.format("control character U+%04X in unquoted value", (int) c));
            }
            if (QueryStringEscaper.isWildcard(c)) {
                wildcard = true;
            }
            plain.append(c);
            pattern.append(c);
            pos++;
        }

        String text = plain.toString();
        if (!escaped) {
            TokenType keyword = keyword(text);
            if (keyword != null) {
                tokens.add(Token.of(keyword, text, start));
                return;
            }
        }
        if (!wildcard && followedByColon()) {
            tokens.add(Token.of(TokenType.FIELD, text, start));
            return;
        }
        tokens.add(new Token(TokenType.VALUE, wildcard ? pattern.toString() : text, start, false, wildcard));
    }

    private static boolean isTerminator(char c) {
        return switch (c) {
            case '(', ')', '[', ']', '{', '}', '"', ':' -> true;
            default -> false;
        };
    }

    private static TokenType keyword(String text) {
        return switch (text) {
            case "AND" -> TokenType.AND;
            case "OR" -> TokenType.OR;
            case "NOT" -> TokenType.NOT;
            case "TO" -> TokenType.TO;
            default -> null;
        };
    }

    private boolean followedByColon() {
        int i = pos;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() && input.charAt(i) == ':';
    }
}
