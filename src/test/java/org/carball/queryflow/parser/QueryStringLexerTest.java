package org.carball.queryflow.parser;

import org.carball.queryflow.exception.LexException;
import org.carball.queryflow.exception.QueryStringParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.queryflow.parser.TokenType.AND;
import static org.carball.queryflow.parser.TokenType.EOF;
import static org.carball.queryflow.parser.TokenType.FIELD;
import static org.carball.queryflow.parser.TokenType.LPAREN;
import static org.carball.queryflow.parser.TokenType.NOT;
import static org.carball.queryflow.parser.TokenType.OPERATOR;
import static org.carball.queryflow.parser.TokenType.OR;
import static org.carball.queryflow.parser.TokenType.RANGE_CLOSE;
import static org.carball.queryflow.parser.TokenType.RANGE_OPEN;
import static org.carball.queryflow.parser.TokenType.REGEX;
import static org.carball.queryflow.parser.TokenType.RPAREN;
import static org.carball.queryflow.parser.TokenType.TO;
import static org.carball.queryflow.parser.TokenType.VALUE;

class QueryStringLexerTest {

    @Test
    void shouldTokenizeFieldAndQuotedValueWithOffsets() {
        // When
        List<Token> tokens = QueryStringLexer.tokenize("status: \"error\"");

        // Then
        assertThat(tokens).containsExactly(
                new Token(FIELD, "status", 0, false, false),
                new Token(OPERATOR, ":", 6, false, false),
                new Token(VALUE, "error", 8, true, false),
                new Token(EOF, "", 15, false, false));
    }

    @Test
    void shouldRecognizeUpperCaseKeywordsOnly() {
        assertThat(types("a AND b OR NOT c")).containsExactly(VALUE, AND, VALUE, OR, NOT, VALUE, EOF);
        assertThat(types("a and b")).containsExactly(VALUE, VALUE, VALUE, EOF);
    }

    @Test
    void shouldTreatQuotedKeywordAsValue() {
        List<Token> tokens = QueryStringLexer.tokenize("\"AND\"");

        assertThat(tokens.get(0).type()).isEqualTo(VALUE);
        assertThat(tokens.get(0).quoted()).isTrue();
        assertThat(tokens.get(0).text()).isEqualTo("AND");
    }

    @Test
    void shouldTokenizeRangeWithMixedBrackets() {
        List<Token> tokens = QueryStringLexer.tokenize("age: [18 TO 60}");

        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList()))
                .containsExactly(FIELD, OPERATOR, RANGE_OPEN, VALUE, TO, VALUE, RANGE_CLOSE, EOF);
        assertThat(tokens.get(2).text()).isEqualTo("[");
        assertThat(tokens.get(6).text()).isEqualTo("}");
    }

    @Test
    void shouldTokenizeComparisonOperators() {
        List<Token> tokens = QueryStringLexer.tokenize("level: >=3 AND count:<10");

        assertThat(tokens.stream().map(Token::text).collect(Collectors.toList()))
                .containsExactly("level", ":", ">=", "3", "AND", "count", ":", "<", "10", "");
        assertThat(tokens.get(2).type()).isEqualTo(OPERATOR);
        assertThat(tokens.get(7).type()).isEqualTo(OPERATOR);
    }

    @Test
    void shouldTokenizeParentheses() {
        assertThat(types("(a OR b)")).containsExactly(LPAREN, VALUE, OR, VALUE, RPAREN, EOF);
    }

    @Test
    void shouldResolveEscapesInBareValues() {
        // When
        Token escapedColon = QueryStringLexer.tokenize("a\\:b").get(0);
        Token escapedStar = QueryStringLexer.tokenize("foo\\*").get(0);

        // Then
        assertThat(escapedColon.text()).isEqualTo("a:b");
        assertThat(escapedColon.wildcard()).isFalse();
        assertThat(escapedStar.text()).isEqualTo("foo*");
        assertThat(escapedStar.wildcard()).isFalse();
    }

    @Test
    void shouldKeepPatternFormForWildcardValues() {
        Token token = QueryStringLexer.tokenize("fo*\\?").get(0);

        assertThat(token.wildcard()).isTrue();
        assertThat(token.text()).isEqualTo("fo*\\?");
    }

    @Test
    void shouldTokenizeRegexBody() {
        List<Token> tokens = QueryStringLexer.tokenize("email: /.*@example\\.com/");

        assertThat(tokens.get(2).type()).isEqualTo(REGEX);
        assertThat(tokens.get(2).text()).isEqualTo(".*@example\\.com");
    }

    @Test
    void shouldKeepNonAsciiValues() {
        List<Token> tokens = QueryStringLexer.tokenize("severity: 致命");

        assertThat(tokens.get(2)).isEqualTo(new Token(VALUE, "致命", 10, false, false));
    }

    @Test
    void shouldFailOnUnterminatedQuote() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("msg: \"abc"))
                .isInstanceOf(LexException.class)
                .isInstanceOf(QueryStringParseException.class)
                .hasMessageContaining("unterminated quoted value")
                .extracting(e -> ((LexException) e).getOffset())
                .isEqualTo(5);
    }

    @Test
    void shouldFailOnUnclosedRangeBracket() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("age: [1 TO 2"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("unbalanced bracket")
                .extracting(e -> ((LexException) e).getOffset())
                .isEqualTo(5);
    }

    @Test
    void shouldFailOnStrayClosingBracket() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("a]"))
                .isInstanceOf(LexException.class)
                .extracting(e -> ((LexException) e).getOffset())
                .isEqualTo(1);
    }

    @Test
    void shouldFailOnNestedRangeBracket() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("age: [1 TO [2]"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("nested range bracket");
    }

    @Test
    void shouldFailOnDanglingEscape() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("abc\\"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("dangling escape")
                .extracting(e -> ((LexException) e).getOffset())
                .isEqualTo(3);
    }

    @Test
    void shouldFailOnControlCharacterInBareValue() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("ab\u0001c"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("control character")
                .extracting(e -> ((LexException) e).getOffset())
                .isEqualTo(2);
    }

    @Test
    void shouldFailOnUnterminatedRegex() {
        assertThatThrownBy(() -> QueryStringLexer.tokenize("/abc"))
                .isInstanceOf(LexException.class)
                .hasMessageContaining("unterminated regular expression");
    }

    @Test
    void shouldReturnIndependentUnmodifiableTokenLists() {
        // Given
        QueryStringLexer lexer = new QueryStringLexer("a OR b");

        // When
        List<Token> first = lexer.tokenize();
        List<Token> second = lexer.tokenize();

        // Then
        assertThat(second).isEqualTo(first).isNotSameAs(first);
        assertThatThrownBy(() -> first.add(Token.of(EOF, "", 0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }


    private static List<TokenType> types(String input) {
        return QueryStringLexer.tokenize(input).stream().map(Token::type).collect(Collectors.toList());
    }
}
