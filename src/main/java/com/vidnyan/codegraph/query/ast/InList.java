package com.vidnyan.codegraph.query.ast;

import com.vidnyan.codegraph.exception.GraphQueryException;

import java.util.List;

public record InList(Expression element, Expression list) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        Object value = element.evaluate(bindings);
        Object candidates = list.evaluate(bindings);
        if (candidates == null || value == null) {
            return null;
        }
        if (!(candidates instanceof List<?> items)) {
            throw new GraphQueryException("IN expects a list, got " + Values.describe(candidates));
        }
        return items.stream().anyMatch(item -> item != null && Values.equal(value, item));
    }
}
