package com.vidnyan.codegraph.query.ast;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.exception.GraphQueryException;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Built-in function call. {@code count} is an aggregate and is computed by the
 * executor over a group of rows, never through {@link #evaluate}.
 *
 * @param star     {@code count(*)}
 * @param distinct {@code count(DISTINCT x)}
 */
public record FunctionCall(String name, List<Expression> arguments, boolean star, boolean distinct)
        implements Expression {

    public static final Set<String> SUPPORTED = Set.of("count", "id", "labels", "type", "tolower", "toupper", "size");

    public FunctionCall {
        name = name.toLowerCase(Locale.ROOT);
        arguments = List.copyOf(arguments);
    }

    @Override
    public boolean isAggregate() {
        return name.equals("count");
    }

    @Override
    public Object evaluate(Bindings bindings) {
        if (isAggregate()) {
            throw new GraphQueryException("count() is only allowed as a RETURN item");
        }
        if (arguments.size() != 1) {
            throw new GraphQueryException(name + "() takes exactly one argument");
        }
        Object value = arguments.get(0).evaluate(bindings);
        if (value == null) {
            return null;
        }
        return switch (name) {
            case "id" -> {
                if (value instanceof GraphNode node) yield node.id();
                if (value instanceof GraphRelationship rel) yield rel.id();
                throw new GraphQueryException("id() expects a node or relationship");
            }
            case "labels" -> {
                if (value instanceof GraphNode node) yield List.of(node.label().displayName());
                throw new GraphQueryException("labels() expects a node");
            }
            case "type" -> {
                if (value instanceof GraphRelationship rel) yield rel.type().name();
                throw new GraphQueryException("type() expects a relationship");
            }
            case "tolower" -> value.toString().toLowerCase(Locale.ROOT);
            case "toupper" -> value.toString().toUpperCase(Locale.ROOT);
            case "size" -> {
                if (value instanceof List<?> list) yield (long) list.size();
                if (value instanceof String s) yield (long) s.length();
                throw new GraphQueryException("size() expects a list or string");
            }
            default -> throw new GraphQueryException("Unknown function: " + name);
        };
    }
}
