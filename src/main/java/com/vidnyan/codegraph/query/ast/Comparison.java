package com.vidnyan.codegraph.query.ast;

import java.util.function.IntPredicate;

/**
 * Binary comparison. Any null operand yields null.
 */
public record Comparison(Expression left, Operator operator, Expression right) implements Expression {

    public enum Operator {
        EQ, NE, LT, LE, GT, GE
    }

    @Override
    public Object evaluate(Bindings bindings) {
        Object l = left.evaluate(bindings);
        Object r = right.evaluate(bindings);
        if (l == null || r == null) {
            return null;
        }
        return switch (operator) {
            case EQ -> Values.equal(l, r);
            case NE -> !Values.equal(l, r);
            case LT -> compare(l, r, c -> c < 0);
            case LE -> compare(l, r, c -> c <= 0);
            case GT -> compare(l, r, c -> c > 0);
            case GE -> compare(l, r, c -> c >= 0);
        };
    }

    private static Boolean compare(Object l, Object r, IntPredicate test) {
        Integer c = Values.compare(l, r);
        return c == null ? null : test.test(c);
    }
}
