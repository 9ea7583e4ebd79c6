package com.vidnyan.codegraph.query.ast;

public record Not(Expression operand) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        Boolean value = Values.toBoolean(operand.evaluate(bindings));
        return value == null ? null : !value;
    }
}
