package com.vidnyan.codegraph.query.ast;

/**
 * Three-valued AND / OR / XOR.
 */
public record Logical(Operator operator, Expression left, Expression right) implements Expression {

    public enum Operator {
        AND, OR, XOR
    }

    @Override
    public Object evaluate(Bindings bindings) {
        Boolean l = Values.toBoolean(left.evaluate(bindings));
        if (operator == Operator.AND && Boolean.FALSE.equals(l)) {
            return false;
        }
        if (operator == Operator.OR && Boolean.TRUE.equals(l)) {
            return true;
        }
        Boolean r = Values.toBoolean(right.evaluate(bindings));
        return switch (operator) {
            case AND -> Boolean.FALSE.equals(r) ? Boolean.FALSE : (l == null || r == null ? null : Boolean.TRUE);
            case OR -> Boolean.TRUE.equals(r) ? Boolean.TRUE : (l == null || r == null ? null : Boolean.FALSE);
            case XOR -> l == null || r == null ? null : l ^ r;
        };
    }
}
