package com.vidnyan.codegraph.query.ast;

public record PropertyAccess(Expression target, String key) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        return Values.property(target.evaluate(bindings), key);
    }
}
