package org.carball.queryflow.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryflow.exception.ParseException;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser over lexer tokens.
 * <pre>
 * query      := orExpr EOF
 * orExpr     := andExpr ( OR andExpr )*
 * andExpr    := unary ( AND? unary )*
 * unary      := NOT unary | primary
 * primary    := '(' orExpr ')' | FIELD ':' fieldValue | VALUE | REGEX
 * fieldValue := '(' orExpr ')' | NOT fieldValue | VALUE | REGEX
 *             | ( '&gt;' | '&gt;=' | '&lt;' | '&lt;=' ) VALUE
 *             | ( '[' | '{' ) VALUE TO VALUE ( ']' | '}' )
 * </pre>
 * Adjacent clauses without a connective are joined with AND. Inside
 * {@code field: ( ... )} the field applies to every value of the group.
 * Parentheses and {@code NOT} may nest at most {@value #MAX_NESTING_DEPTH} levels deep.
 */
@Slf4j
public class QueryStringParser {

    public static final int MAX_NESTING_DEPTH = 512;

    private final List<Token> tokens;
    private int pos;
    private int depth;

    public QueryStringParser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    public static Node parse(String queryString) {
        return new QueryStringParser(QueryStringLexer.tokenize(queryString)).parse();
    }

    public Node parse() {
        pos = 0;
        depth = 0;
        Node root = parseOr(null);
        Token trailing = peek();
        if (trailing.is(TokenType.RPAREN)) {
            throw new ParseException(trailing.offset(), "end of input", trailing.describe(),
                    "unbalanced ')' at offset " + trailing.offset());
        }
        if (trailing.is(TokenType.TO)) {
            throw new ParseException(trailing.offset(), "end of input", trailing.describe(),
                    "'TO' outside of a range at offset " + trailing.offset());
        }
        if (!trailing.is(TokenType.EOF)) {
            throw new ParseException(trailing.offset(), "end of input", trailing.describe());
        }
        log.trace("Parsed {} tokens into {}", tokens.size(), root.getClass().getSimpleName());
        return root;
    }

    private Node parseOr(Identifier field) {
        List<Node> clauses = new ArrayList<>();
        clauses.add(parseAnd(field));
        while (peek().is(TokenType.OR)) {
            Token connective = next();
            requireClause(connective, field);
            clauses.add(parseAnd(field));
        }
        return combine(BooleanOp.OR, clauses);
    }

    private Node parseAnd(Identifier field) {
        List<Node> clauses = new ArrayList<>();
        clauses.add(parseUnary(field));
        while (true) {
            if (peek().is(TokenType.AND)) {
                Token connective = next();
                requireClause(connective, field);
                clauses.add(parseUnary(field));
            } else if (startsClause(peek(), field)) {
                clauses.add(parseUnary(field));
            } else {
                break;
            }
        }
        return combine(BooleanOp.AND, clauses);
    }

    private Node parseUnary(Identifier field) {
        if (depth >= MAX_NESTING_DEPTH) {
            Token token = peek();
            throw new ParseException(token.offset(), "expression", token.describe(),
                    "query nests deeper than " + MAX_NESTING_DEPTH + " levels at offset " + token.offset());
        }
        depth++;
        try {
            if (peek().is(TokenType.NOT)) {
                Token not = next();
                requireClause(not, field);
                return new Not(parseUnary(field));
            }
            return parsePrimary(field);
        } finally {
            depth--;
        }
    }

    private Node parsePrimary(Identifier field) {
        Token token = next();
        switch (token.type()) {
            case LPAREN:
                return parseParenthesized(token, field);
            case FIELD:
                return parseFieldClause(token, field);
            case VALUE:
                return new Term(field, literal(token), token.wildcard());
            case REGEX:
                return new Raw(field == null
                        ? "/" + token.text() + "/"
                        : field.name() + ": /" + token.text() + "/");
            case OPERATOR:
                if (!token.isComparison()) {
                    throw new ParseException(token.offset(), "expression", token.describe(),
                            "unexpected ':' at offset " + token.offset() + " without a field name");
                }
                if (field == null) {
                    throw new ParseException(token.offset(), "field before comparison", token.describe(),
                            "comparison '" + token.text() + "' at offset " + token.offset() + " requires a field");
                }
                return parseComparison(token, field);
            case RANGE_OPEN:
                if (field == null) {
                    throw new ParseException(token.offset(), "field before range", token.describe(),
                            "range at offset " + token.offset() + " requires a field");
                }
                return parseRange(token, field);
            case TO:
                throw new ParseException(token.offset(), "expression", token.describe(),
                        "'TO' outside of a range at offset " + token.offset());
            case RPAREN:
                throw new ParseException(token.offset(), "expression", token.describe(),
                        "unbalanced ')' at offset " + token.offset());
            default:
                throw new ParseException(token.offset(), "expression", token.describe());
        }
    }

    private Node parseParenthesized(Token open, Identifier field) {
        Node inner = parseOr(field);
        Token close = peek();
        if (!close.is(TokenType.RPAREN)) {
            throw new ParseException(open.offset(), "')'", close.describe(),
                    "unbalanced '(' at offset " + open.offset() + ": expected ')' but found " + close.describe());
        }
        next();
        return inner instanceof Group ? inner : Group.parenthesized(inner);
    }

    private Node parseFieldClause(Token fieldToken, Identifier enclosingField) {
        if (enclosingField != null) {
            throw new ParseException(fieldToken.offset(), "value", fieldToken.describe(),
                    "field '" + fieldToken.text() + "' at offset " + fieldToken.offset()
                            + " is nested inside a group for field '" + enclosingField + "'");
        }
        if (!Identifier.isValid(fieldToken.text())) {
            throw new ParseException(fieldToken.offset(), "field identifier", fieldToken.describe(),
                    "invalid field identifier " + fieldToken.describe() + " at offset " + fieldToken.offset());
        }
        Identifier field = Identifier.of(fieldToken.text());
        Token colon = next();
        if (!colon.is(TokenType.OPERATOR) || colon.isComparison()) {
            throw new ParseException(colon.offset(), "':'", colon.describe());
        }
        requireClause(colon, field);
        return parseUnary(field);
    }

    private Node parseComparison(Token operator, Identifier field) {
        Token value = expectValue("comparison value");
        Literal literal = literal(value);
        return switch (operator.text()) {
            case ">" -> new Range(field, new Bound(literal, false), null);
            case ">=" -> new Range(field, new Bound(literal, true), null);
            case "<" -> new Range(field, null, new Bound(literal, false));
            case "<=" -> new Range(field, null, new Bound(literal, true));
            default -> throw new ParseException(operator.offset(), "comparison operator", operator.describe());
        };
    }

    private Node parseRange(Token open, Identifier field) {
        Bound lower = rangeBound(expectRangeValue("lower range bound"), "[".equals(open.text()));
        Token to = next();
        if (!to.is(TokenType.TO)) {
            throw new ParseException(to.offset(), "'TO'", to.describe());
        }
        Token upperValue = expectRangeValue("upper range bound");
        Token close = next();
        if (!close.is(TokenType.RANGE_CLOSE)) {
            throw new ParseException(close.offset(), "']' or '}'", close.describe());
        }
        Bound upper = rangeBound(upperValue, "]".equals(close.text()));
        return new Range(field, lower, upper);
    }

    private Token expectValue(String expected) {
        Token token = next();
        if (!token.is(TokenType.VALUE) || token.wildcard()) {
            throw new ParseException(token.offset(), expected, token.describe());
        }
        return token;
    }

    private Token expectRangeValue(String expected) {
        Token token = next();
        if (!token.is(TokenType.VALUE) || (token.wildcard() && !isOpenBound(token))) {
            throw new ParseException(token.offset(), expected, token.describe());
        }
        return token;
    }

    private static boolean isOpenBound(Token token) {
        return token.wildcard() && "*".equals(token.text());
    }

    private static Bound rangeBound(Token token, boolean inclusive) {
        return isOpenBound(token) ? null : new Bound(literal(token), inclusive);
    }

    private static Literal literal(Token token) {
        return new Literal(token.text(), token.quoted());
    }

    private void requireClause(Token connective, Identifier field) {
        Token following = peek();
        if (!startsClause(following, field)) {
            throw new ParseException(following.offset(), "expression", following.describe(),
                    "expected expression after " + connective.describe() + " at offset "
                            + connective.offset() + " but found " + following.describe());
        }
    }

    private static boolean startsClause(Token token, Identifier field) {
        return switch (token.type()) {
            case FIELD, VALUE, LPAREN, NOT, REGEX -> true;
            case RANGE_OPEN -> field != null;
            case OPERATOR -> field != null && token.isComparison();
            default -> false;
        };
    }

    private static Node combine(BooleanOp op, List<Node> clauses) {
        return clauses.size() == 1 ? clauses.get(0) : new Group(op, clauses);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }
}
