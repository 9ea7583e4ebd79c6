package com.vidnyan.codegraph.query.ast;

public record VariableRef(String name) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        return bindings.get(name);
    }
}
