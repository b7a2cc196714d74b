package org.carball.queryflow.rewriter;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.model.ast.BooleanOp;
import org.carball.queryflow.model.ast.Bound;
import org.carball.queryflow.model.ast.Group;
import org.carball.queryflow.model.ast.Identifier;
import org.carball.queryflow.model.ast.Literal;
import org.carball.queryflow.model.ast.Node;
import org.carball.queryflow.model.ast.Not;
import org.carball.queryflow.model.ast.Range;
import org.carball.queryflow.model.ast.Raw;
import org.carball.queryflow.model.ast.Term;
import org.carball.queryflow.model.mapping.FieldMapping;
import org.carball.queryflow.model.mapping.ValueTranslations;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renames fields and translates display values into stored values.
 * <p>
 * The rewrite is bottom-up and total: anything without a mapping is left as
 * it is, and subtrees that do not change are returned as the same instances.
 * A bare value that matches a translation table is widened to
 * {@code value OR (field: canonical)} so it still matches as free text.
 */
@Slf4j
public class QueryTreeRewriter {

    private final FieldMapping fieldMapping;
    private final ValueTranslations valueTranslations;
    private final boolean quoteUnmatchedFreeText;

    public QueryTreeRewriter(FieldMapping fieldMapping, ValueTranslations valueTranslations) {
        this(fieldMapping, valueTranslations, false);
    }

    public QueryTreeRewriter(FieldMapping fieldMapping, ValueTranslations valueTranslations,
                             boolean quoteUnmatchedFreeText) {
        this.fieldMapping = fieldMapping != null ? fieldMapping : FieldMapping.empty();
        this.valueTranslations = valueTranslations != null ? valueTranslations : ValueTranslations.empty();
        this.quoteUnmatchedFreeText = quoteUnmatchedFreeText;
    }

    public static Node rewrite(Node node, FieldMapping fieldMapping, ValueTranslations valueTranslations) {
        return new QueryTreeRewriter(fieldMapping, valueTranslations).rewrite(node);
    }

    public Node rewrite(Node node) {
        if (node instanceof Term term) {
            return rewriteTerm(term);
        }
        if (node instanceof Range range) {
            return rewriteRange(range);
        }
        if (node instanceof Not not) {
            Node inner = rewrite(not.inner());
            return inner == not.inner() ? not : new Not(inner);
        }
        if (node instanceof Group group) {
            return rewriteGroup(group);
        }
        if (node instanceof Raw) {
            return node;
        }
        throw new IllegalArgumentException("Unknown node type: " + (node == null ? "null" : node.getClass().getName()));
    }

    private Node rewriteGroup(Group group) {
        List<Node> children = new ArrayList<>(group.children().size());
        boolean changed = false;
        for (Node child : group.children()) {
            Node rewritten = rewrite(child);
            changed |= rewritten != child;
            children.add(rewritten);
        }
        return changed ? new Group(group.op(), children) : group;
    }

    private Node rewriteTerm(Term term) {
        if (!term.hasField()) {
            return rewriteFreeText(term);
        }
        Identifier field = mapField(term.field());
        Term result = field == term.field() ? term : term.withField(field);
        if (term.wildcard()) {
            return result;
        }
        Literal value = translate(field, term.value());
        return value == term.value() ? result : result.withValue(value);
    }

    private Node rewriteFreeText(Term term) {
        if (term.wildcard()) {
            return term;
        }
        Optional<ValueTranslations.Match> match = valueTranslations.findField(term.value().text());
        if (match.isPresent()) {
            ValueTranslations.Match found = match.get();
            log.debug("Widening free text '{}' with {}: {}", term.value().text(), found.field(), found.canonicalValue());
            Term canonical = new Term(found.field(), term.value().withText(found.canonicalValue()), false);
            return Group.of(BooleanOp.OR, term, Group.parenthesized(canonical));
        }
        if (quoteUnmatchedFreeText && !term.value().quoted()) {
            return term.withValue(Literal.quoted(term.value().text()));
        }
        return term;
    }

    private Node rewriteRange(Range range) {
        Identifier field = mapField(range.field());
        Bound lower = translate(field, range.lower());
        Bound upper = translate(field, range.upper());
        if (field == range.field() && lower == range.lower() && upper == range.upper()) {
            return range;
        }
        return new Range(field, lower, upper);
    }

    private Identifier mapField(Identifier field) {
        Optional<Identifier> mapped = fieldMapping.lookup(field.name());
        if (mapped.isEmpty() || mapped.get().equals(field)) {
            return field;
        }
        log.trace("Mapping field {} to {}", field, mapped.get());
        return mapped.get();
    }

    private Bound translate(Identifier field, Bound bound) {
        if (bound == null) {
            return null;
        }
        Literal value = translate(field, bound.value());
        return value == bound.value() ? bound : bound.withValue(value);
    }

    private Literal translate(Identifier field, Literal value) {
        return valueTranslations.translate(field, value.text())
                .filter(canonical -> !canonical.equals(value.text()))
                .map(value::withText)
                .orElse(value);
    }
}
