package com.vidnyan.codegraph.query.ast;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.exception.GraphQueryException;

import java.util.List;
import java.util.Locale;

/**
 * Value semantics shared by expressions and the executor.
 */
public final class Values {

    private Values() {
    }

    /**
     * Property of a node or relationship; {@code id} is always available.
     * Property access on null yields null.
     */
    public static Object property(Object target, String key) {
        if (target == null) {
            return null;
        }
        if (target instanceof GraphNode node) {
            if (key.equals("id")) {
                return node.id();
            }
            return normalize(node.property(key));
        }
        if (target instanceof GraphRelationship rel) {
            return switch (key) {
                case "id" -> rel.id();
                case "confidence" -> rel.confidence();
                case "reason" -> rel.reason();
                case "step" -> rel.step() != null ? Long.valueOf(rel.step()) : null;
                case "type" -> rel.type().name();
                default -> null;
            };
        }
        throw new GraphQueryException("Cannot read property '" + key + "' of " + describe(target));
    }

    /**
     * Integral numbers become longs, other numbers doubles.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    public static boolean equal(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            for (int i = 0; i < x.size(); i++) {
                if (!equal(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * @return null when the values are not comparable
     */
    public static Integer compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Boolean.compare(x, y);
        }
        return null;
    }

    /**
     * Sort order for ORDER BY: nulls last, then incomparable values by type name.
     */
    public static int sortCompare(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        Integer c = compare(a, b);
        if (c != null) {
            return c;
        }
        return describe(a).compareTo(describe(b));
    }

    public static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new GraphQueryException("Expected a boolean, got " + describe(value));
    }

    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof GraphNode) {
            return "node";
        }
        if (value instanceof GraphRelationship) {
            return "relationship";
        }
        if (value instanceof List) {
            return "list";
        }
        return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }
}
