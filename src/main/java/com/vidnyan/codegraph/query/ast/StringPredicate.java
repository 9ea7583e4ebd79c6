package com.vidnyan.codegraph.query.ast;

/**
 * CONTAINS, STARTS WITH and ENDS WITH. Non-string operands yield null.
 */
public record StringPredicate(Expression left, Operator operator, Expression right) implements Expression {

    public enum Operator {
        CONTAINS, STARTS_WITH, ENDS_WITH
    }

    @Override
    public Object evaluate(Bindings bindings) {
        Object l = left.evaluate(bindings);
        Object r = right.evaluate(bindings);
        if (!(l instanceof String s) || !(r instanceof String t)) {
            return null;
        }
        return switch (operator) {
            case CONTAINS -> s.contains(t);
            case STARTS_WITH -> s.startsWith(t);
            case ENDS_WITH -> s.endsWith(t);
        };
    }
}
