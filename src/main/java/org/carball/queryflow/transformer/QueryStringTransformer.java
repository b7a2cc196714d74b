package org.carball.queryflow.transformer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.QueryStringParseException;
import org.carball.queryflow.model.ast.Node;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.model.mapping.ValueTranslations;
import org.carball.queryflow.parser.QueryStringLexer;
import org.carball.queryflow.parser.QueryStringParser;
import org.carball.queryflow.rewriter.QueryTreeRewriter;
import org.carball.queryflow.serializer.QueryStringSerializer;

/**
 * Parses a query string, renames fields and translates values, and writes the
 * result back as query string text.
 * <p>
 * Instances hold only read-only tables and are safe to share between threads.
 */
@Slf4j
public class QueryStringTransformer {

    private static final String MATCH_ALL = "*";

    @Getter
    private final FieldMapping fieldMapping;
    @Getter
    private final ValueTranslations valueTranslations;
    @Getter
    private final TransformerSettings settings;

    private final QueryTreeRewriter rewriter;
    private final QueryStringSerializer serializer = new QueryStringSerializer();

    public QueryStringTransformer(FieldMapping fieldMapping, ValueTranslations valueTranslations) {
        this(fieldMapping, valueTranslations, TransformerSettings.defaults());
    }

    public QueryStringTransformer(FieldMapping fieldMapping, ValueTranslations valueTranslations,
                                  TransformerSettings settings) {
        this.fieldMapping = fieldMapping != null ? fieldMapping : FieldMapping.empty();
        this.valueTranslations = valueTranslations != null ? valueTranslations : ValueTranslations.empty();
        this.settings = settings != null ? settings : TransformerSettings.defaults();
        this.settings.validate();
        this.rewriter = new QueryTreeRewriter(this.fieldMapping, this.valueTranslations,
                this.settings.isQuoteUnmatchedFreeText());
    }

    public static String transform(String queryString, FieldMapping fieldMapping,
                                   ValueTranslations valueTranslations) {
        return new QueryStringTransformer(fieldMapping, valueTranslations).transform(queryString);
    }

    /**
     * @throws QueryStringParseException when the text cannot be lexed or parsed
     */
    public String transform(String queryString) {
        if (queryString == null || queryString.isBlank()) {
            return settings.getBlankQueryResult();
        }
        if (MATCH_ALL.equals(queryString.trim())) {
            return MATCH_ALL;
        }

        Node tree = parse(queryString);
        Node rewritten = rewriter.rewrite(tree);
        String result = serializer.serialize(rewritten);
        log.debug("Transformed query string '{}' to '{}'", queryString, result);
        return result;
    }

    /**
     * Lexes and parses without rewriting.
     */
    public Node parse(String queryString) {
        try {
            return new QueryStringParser(QueryStringLexer.tokenize(queryString)).parse();
        } catch (QueryStringParseException e) {
            log.warn("Rejected query string '{}': {}", queryString, e.getMessage());
            throw e;
        }
    }
}
