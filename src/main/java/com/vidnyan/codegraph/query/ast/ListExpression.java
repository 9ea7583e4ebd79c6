package com.vidnyan.codegraph.query.ast;

import java.util.ArrayList;
import java.util.List;

public record ListExpression(List<Expression> elements) implements Expression {

    @Override
    public Object evaluate(Bindings bindings) {
        List<Object> values = new ArrayList<>(elements.size());
        for (Expression element : elements) {
            values.add(element.evaluate(bindings));
        }
        return values;
    }
}
