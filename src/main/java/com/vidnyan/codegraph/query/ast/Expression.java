package com.vidnyan.codegraph.query.ast;

/**
 * Query expression. Values are graph nodes, relationships, strings, longs,
 * doubles, booleans, lists or null.
 */
public interface Expression {

    Object evaluate(Bindings bindings);

    default boolean isAggregate() {
        return false;
    }
}
