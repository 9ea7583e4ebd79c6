package com.vidnyan.codegraph.query.ast;

public record IsNull(Expression operand, boolean negated) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        boolean isNull = operand.evaluate(bindings) == null;
        return negated != isNull;
    }
}
