package com.vidnyan.codegraph.query.ast;

import com.vidnyan.codegraph.exception.GraphQueryException;

public record Negate(Expression operand) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        Object value = operand.evaluate(bindings);
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return -l;
        }
        if (value instanceof Number n) {
            return -n.doubleValue();
        }
        throw new GraphQueryException("Cannot negate " + Values.describe(value));
    }
}
