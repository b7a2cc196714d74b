package org.carball.queryflow.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringEscaperTest {

    @Test
    void shouldEscapeEveryReservedCharacterAndWhitespace() {
        assertThat(QueryStringEscaper.escape("a+b c")).isEqualTo("a\\+b\\ c");
        assertThat(QueryStringEscaper.escape("(1+1):2")).isEqualTo("\\(1\\+1\\)\\:2");
        assertThat(QueryStringEscaper.escape("path/to\\file")).isEqualTo("path\\/to\\\\file");
        assertThat(QueryStringEscaper.escape(null)).isNull();
    }

    @Test
    void shouldEscapeAllValues() {
        assertThat(QueryStringEscaper.escapeAll(List.of("a:b", "c d", "plain")))
                .containsExactly("a\\:b", "c\\ d", "plain");
    }

    @Test
    void shouldRecognizeReservedCharacters() {
        for (char c : "+-=&|><!(){}[]^\"~*?:\\/".toCharArray()) {
            assertThat(QueryStringEscaper.isReserved(c)).as("reserved %s", c).isTrue();
        }
        assertThat(QueryStringEscaper.isReserved('a')).isFalse();
        assertThat(QueryStringEscaper.isReserved('_')).isFalse();
        assertThat(QueryStringEscaper.isReserved('.')).isFalse();
    }

    @Test
    void shouldQuoteAndUnquote() {
        String quoted = QueryStringEscaper.quote("say \"hi\" \\o/");

        assertThat(quoted).isEqualTo("\"say \\\"hi\\\" \\\\o/\"");
        assertThat(QueryStringEscaper.unquote(quoted)).isEqualTo("say \"hi\" \\o/");
    }

    @Test
    void shouldEscapeOnlyTheRegexDelimiter() {
        assertThat(QueryStringEscaper.escapeRegex("a/b")).isEqualTo("a\\/b");
        assertThat(QueryStringEscaper.escapeRegex("a\\/b")).isEqualTo("a\\/b");
        assertThat(QueryStringEscaper.escapeRegex(".*@example\\.com")).isEqualTo(".*@example\\.com");
    }

    @Test
    void shouldKeepWildcardsWhenWritingPatterns() {
        assertThat(QueryStringEscaper.escapeWildcardPattern("*time out?")).isEqualTo("*time\\ out?");
        assertThat(QueryStringEscaper.escapeWildcardPattern("a\\*b*")).isEqualTo("a\\*b*");
        assertThat(QueryStringEscaper.escapeWildcardPattern("a:b*")).isEqualTo("a\\:b*");
    }

    @Test
    void shouldTurnTextIntoLiteralPattern() {
        assertThat(QueryStringEscaper.toWildcardPattern("50*off?")).isEqualTo("50\\*off\\?");
    }

    @Test
    void shouldRequireQuotingForKeywordsWhitespaceAndEmptyText() {
        assertThat(QueryStringEscaper.needsQuoting("")).isTrue();
        assertThat(QueryStringEscaper.needsQuoting("two words")).isTrue();
        assertThat(QueryStringEscaper.needsQuoting("AND")).isTrue();
        assertThat(QueryStringEscaper.needsQuoting("TO")).isTrue();
        assertThat(QueryStringEscaper.needsQuoting("and")).isFalse();
        assertThat(QueryStringEscaper.needsQuoting("致命")).isFalse();
    }

    @Test
    void shouldKeepExistingEscapesSoEscapingIsIdempotent() {
        assertThat(QueryStringEscaper.escape("a\\+b")).isEqualTo("a\\+b");
        for (String value : List.of("a+b c", "path/to\\file", "trailing\\", "(1+1):2", "x\\ y")) {
            String once = QueryStringEscaper.escape(value);
            assertThat(QueryStringEscaper.escape(once)).as(value).isEqualTo(once);
        }
    }

    @Test
    void shouldEscapeLoneTrailingBackslashOfRegex() {
        assertThat(QueryStringEscaper.escapeRegex("a\\")).isEqualTo("a\\\\");
    }

    @Test
    void shouldDetectUnescapedWildcards() {
        assertThat(QueryStringEscaper.hasWildcard("err*")).isTrue();
        assertThat(QueryStringEscaper.hasWildcard("e?r")).isTrue();
        assertThat(QueryStringEscaper.hasWildcard("50\\*off")).isFalse();
        assertThat(QueryStringEscaper.hasWildcard("timeout")).isFalse();
    }
}
