package com.vidnyan.codegraph.query;

import com.vidnyan.codegraph.exception.GraphQueryException;
import com.vidnyan.codegraph.query.ast.Comparison;
import com.vidnyan.codegraph.query.ast.Expression;
import com.vidnyan.codegraph.query.ast.FunctionCall;
import com.vidnyan.codegraph.query.ast.InList;
import com.vidnyan.codegraph.query.ast.IsNull;
import com.vidnyan.codegraph.query.ast.ListExpression;
import com.vidnyan.codegraph.query.ast.Literal;
import com.vidnyan.codegraph.query.ast.Logical;
import com.vidnyan.codegraph.query.ast.MatchQuery;
import com.vidnyan.codegraph.query.ast.Negate;
import com.vidnyan.codegraph.query.ast.NodePattern;
import com.vidnyan.codegraph.query.ast.Not;
import com.vidnyan.codegraph.query.ast.OrderItem;
import com.vidnyan.codegraph.query.ast.PathPattern;
import com.vidnyan.codegraph.query.ast.PropertyAccess;
import com.vidnyan.codegraph.query.ast.RelationshipPattern;
import com.vidnyan.codegraph.query.ast.ReturnItem;
import com.vidnyan.codegraph.query.ast.StringPredicate;
import com.vidnyan.codegraph.query.ast.VariableRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the supported Cypher subset.
 * <pre>
 * MATCH pattern (, pattern)* [WHERE expr]
 * RETURN [DISTINCT] item [AS alias] (, item)*
 * [ORDER BY expr [ASC|DESC] (, ...)*] [SKIP n] [LIMIT n]
 * </pre>
 * Operator precedence, lowest first: OR, XOR, AND, NOT, comparison and string
 * predicates, unary minus, property access.
 */
public final class QueryParser {

    private static final Set<String> RESERVED = Set.of(
            "MATCH", "WHERE", "RETURN", "ORDER", "BY", "SKIP", "LIMIT", "AND", "OR", "XOR", "NOT",
            "AS", "ASC", "DESC", "ASCENDING", "DESCENDING", "DISTINCT", "IN", "IS", "NULL",
            "CONTAINS", "STARTS", "ENDS", "WITH", "TRUE", "FALSE");

    private final String text;
    private final List<QueryToken> tokens;
    private int index;

    private QueryParser(String text) {
        this.text = text;
        this.tokens = new QueryLexer(text).tokenize();
    }

    public static MatchQuery parse(String query) {
        if (query == null || query.isBlank()) {
            throw new GraphQueryException("Query is empty");
        }
        return new QueryParser(query).query();
    }

    private MatchQuery query() {
        expectKeyword("MATCH");
        List<PathPattern> patterns = new ArrayList<>();
        do {
            patterns.add(pathPattern());
        } while (acceptSymbol(","));

        Expression where = null;
        if (acceptKeyword("WHERE")) {
            where = expression();
        }

        expectKeyword("RETURN");
        boolean distinct = acceptKeyword("DISTINCT");
        List<ReturnItem> items = new ArrayList<>();
        do {
            int start = peek().start();
            Expression expression = expression();
            String alias = text.substring(start, previous().end()).trim();
            if (acceptKeyword("AS")) {
                alias = identifier("alias");
            }
            items.add(new ReturnItem(expression, alias));
        } while (acceptSymbol(","));

        List<OrderItem> orderBy = new ArrayList<>();
        if (acceptKeyword("ORDER")) {
            expectKeyword("BY");
            do {
                int start = peek().start();
                Expression expression = expression();
                String itemText = text.substring(start, previous().end()).trim();
                boolean descending = false;
                if (acceptKeyword("DESC") || acceptKeyword("DESCENDING")) {
                    descending = true;
                } else if (!acceptKeyword("ASC")) {
                    acceptKeyword("ASCENDING");
                }
                orderBy.add(new OrderItem(expression, itemText, descending));
            } while (acceptSymbol(","));
        }

        long skip = 0;
        if (acceptKeyword("SKIP")) {
            skip = nonNegativeInteger("SKIP");
        }
        Long limit = null;
        if (acceptKeyword("LIMIT")) {
            limit = nonNegativeInteger("LIMIT");
        }

        if (peek().type() != QueryToken.Type.EOF) {
            throw error("Unexpected '" + peek().text() + "'");
        }
        return new MatchQuery(patterns, where, distinct, items, orderBy, skip, limit);
    }

    private PathPattern pathPattern() {
        List<NodePattern> nodes = new ArrayList<>();
        List<RelationshipPattern> relationships = new ArrayList<>();
        nodes.add(nodePattern());
        while (peek().isSymbol("-") || peek().isSymbol("<-")) {
            relationships.add(relationshipPattern());
            nodes.add(nodePattern());
        }
        return new PathPattern(nodes, relationships);
    }

    private NodePattern nodePattern() {
        expectSymbol("(");
        String variable = null;
        if (peek().type() == QueryToken.Type.IDENTIFIER) {
            variable = identifier("variable");
        }
        String label = null;
        if (acceptSymbol(":")) {
            label = identifier("label");
        }
        Map<String, Expression> properties = null;
        if (peek().isSymbol("{")) {
            properties = propertyMap();
        }
        expectSymbol(")");
        return new NodePattern(variable, label, properties);
    }

    private RelationshipPattern relationshipPattern() {
        boolean incoming = acceptSymbol("<-");
        if (!incoming) {
            expectSymbol("-");
        }
        String variable = null;
        List<String> types = new ArrayList<>();
        if (acceptSymbol("[")) {
            if (peek().type() == QueryToken.Type.IDENTIFIER) {
                variable = identifier("variable");
            }
            if (acceptSymbol(":")) {
                types.add(identifier("relationship type"));
                while (acceptSymbol("|")) {
                    acceptSymbol(":");
                    types.add(identifier("relationship type"));
                }
            }
            if (peek().isSymbol("*")) {
                throw error("Variable-length relationships are not supported");
            }
            expectSymbol("]");
        }
        boolean outgoing;
        if (acceptSymbol("->")) {
            outgoing = true;
        } else {
            expectSymbol("-");
            outgoing = false;
        }
        if (incoming && outgoing) {
            throw error("Relationship cannot point both ways");
        }
        RelationshipPattern.Direction direction = incoming ? RelationshipPattern.Direction.INCOMING
                : outgoing ? RelationshipPattern.Direction.OUTGOING
                : RelationshipPattern.Direction.EITHER;
        return new RelationshipPattern(variable, types, direction);
    }

    private Map<String, Expression> propertyMap() {
        expectSymbol("{");
        Map<String, Expression> properties = new LinkedHashMap<>();
        if (!peek().isSymbol("}")) {
            do {
                String key = identifier("property name");
                expectSymbol(":");
                properties.put(key, expression());
            } while (acceptSymbol(","));
        }
        expectSymbol("}");
        return properties;
    }

    // Expressions

    private Expression expression() {
        return or();
    }

    private Expression or() {
        Expression left = xor();
        while (acceptKeyword("OR")) {
            left = new Logical(Logical.Operator.OR, left, xor());
        }
        return left;
    }

    private Expression xor() {
        Expression left = and();
        while (acceptKeyword("XOR")) {
            left = new Logical(Logical.Operator.XOR, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = not();
        while (acceptKeyword("AND")) {
            left = new Logical(Logical.Operator.AND, left, not());
        }
        return left;
    }

    private Expression not() {
        if (acceptKeyword("NOT")) {
            return new Not(not());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = unary();
        while (true) {
            QueryToken token = peek();
            Comparison.Operator operator = comparisonOperator(token);
            if (operator != null) {
                index++;
                left = new Comparison(left, operator, unary());
            } else if (acceptKeyword("CONTAINS")) {
                left = new StringPredicate(left, StringPredicate.Operator.CONTAINS, unary());
            } else if (token.isKeyword("STARTS")) {
                index++;
                expectKeyword("WITH");
                left = new StringPredicate(left, StringPredicate.Operator.STARTS_WITH, unary());
            } else if (token.isKeyword("ENDS")) {
                index++;
                expectKeyword("WITH");
                left = new StringPredicate(left, StringPredicate.Operator.ENDS_WITH, unary());
            } else if (acceptKeyword("IN")) {
                left = new InList(left, unary());
            } else if (acceptKeyword("IS")) {
                boolean negated = acceptKeyword("NOT");
                expectKeyword("NULL");
                left = new IsNull(left, negated);
            } else {
                return left;
            }
        }
    }

    private static Comparison.Operator comparisonOperator(QueryToken token) {
        if (token.type() != QueryToken.Type.SYMBOL) {
            return null;
        }
        return switch (token.text()) {
            case "=" -> Comparison.Operator.EQ;
            case "<>", "!=" -> Comparison.Operator.NE;
            case "<" -> Comparison.Operator.LT;
            case "<=" -> Comparison.Operator.LE;
            case ">" -> Comparison.Operator.GT;
            case ">=" -> Comparison.Operator.GE;
            default -> null;
        };
    }

    private Expression unary() {
        if (acceptSymbol("-")) {
            return new Negate(unary());
        }
        return postfix();
    }

    private Expression postfix() {
        Expression expression = primary();
        while (acceptSymbol(".")) {
            expression = new PropertyAccess(expression, identifier("property name"));
        }
        return expression;
    }

    private Expression primary() {
        QueryToken token = peek();
        switch (token.type()) {
            case STRING -> {
                index++;
                return new Literal(token.text());
            }
            case INTEGER -> {
                index++;
                try {
                    return new Literal(Long.parseLong(token.text()));
                } catch (NumberFormatException e) {
                    throw new GraphQueryException("Integer out of range: " + token.text(), token.start());
                }
            }
            case DECIMAL -> {
                index++;
                return new Literal(Double.parseDouble(token.text()));
            }
            case SYMBOL -> {
                if (acceptSymbol("(")) {
                    Expression inner = expression();
                    expectSymbol(")");
                    return inner;
                }
                if (acceptSymbol("[")) {
                    List<Expression> elements = new ArrayList<>();
                    if (!peek().isSymbol("]")) {
                        do {
                            elements.add(expression());
                        } while (acceptSymbol(","));
                    }
                    expectSymbol("]");
                    return new ListExpression(elements);
                }
                throw error("Unexpected '" + token.text() + "'");
            }
            case IDENTIFIER -> {
                if (acceptKeyword("TRUE")) {
                    return new Literal(Boolean.TRUE);
                }
                if (acceptKeyword("FALSE")) {
                    return new Literal(Boolean.FALSE);
                }
                if (acceptKeyword("NULL")) {
                    return new Literal(null);
                }
                if (tokens.get(index + 1).isSymbol("(")) {
                    return functionCall();
                }
                return new VariableRef(identifier("variable"));
            }
            default -> throw error("Unexpected end of query");
        }
    }

    private Expression functionCall() {
        QueryToken nameToken = peek();
        String name = identifier("function name");
        if (!FunctionCall.SUPPORTED.contains(name.toLowerCase(Locale.ROOT))) {
            throw new GraphQueryException("Unknown function: " + name, nameToken.start());
        }
        expectSymbol("(");
        if (acceptSymbol("*")) {
            expectSymbol(")");
            if (!name.equalsIgnoreCase("count")) {
                throw new GraphQueryException(name + "(*) is not supported", nameToken.start());
            }
            return new FunctionCall(name, List.of(), true, false);
        }
        boolean distinct = acceptKeyword("DISTINCT");
        List<Expression> arguments = new ArrayList<>();
        if (!peek().isSymbol(")")) {
            do {
                arguments.add(expression());
            } while (acceptSymbol(","));
        }
        expectSymbol(")");
        if (arguments.size() != 1) {
            throw new GraphQueryException(name + "() takes exactly one argument", nameToken.start());
        }
        return new FunctionCall(name, arguments, false, distinct);
    }

    // Token helpers

    private QueryToken peek() {
        return tokens.get(index);
    }

    private QueryToken previous() {
        return tokens.get(Math.max(0, index - 1));
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("Expected " + keyword);
        }
    }

    private boolean acceptSymbol(String symbol) {
        if (peek().isSymbol(symbol)) {
            index++;
            return true;
        }
        return false;
    }

    private void expectSymbol(String symbol) {
        if (!acceptSymbol(symbol)) {
            throw error("Expected '" + symbol + "'");
        }
    }

    private String identifier(String what) {
        QueryToken token = peek();
        if (token.type() != QueryToken.Type.IDENTIFIER || RESERVED.contains(token.upper())) {
            throw error("Expected " + what);
        }
        index++;
        return token.text();
    }

    private long nonNegativeInteger(String clause) {
        QueryToken token = peek();
        if (token.type() != QueryToken.Type.INTEGER) {
            throw error(clause + " expects a non-negative integer");
        }
        index++;
        return Long.parseLong(token.text());
    }

    private GraphQueryException error(String message) {
        QueryToken token = peek();
        String found = token.type() == QueryToken.Type.EOF ? "end of query" : "'" + token.text() + "'";
        return new GraphQueryException(message + ", found " + found, token.start());
    }
}
