package com.vidnyan.codegraph.query.ast;

public record Literal(Object value) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        return value;
    }
}
