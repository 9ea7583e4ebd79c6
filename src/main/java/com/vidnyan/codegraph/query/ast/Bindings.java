package com.vidnyan.codegraph.query.ast;

/**
 * Variable scope an expression is evaluated in.
 */
@FunctionalInterface
public interface Bindings {

    /**
     * @throws com.vidnyan.codegraph.exception.GraphQueryException for an unknown variable
     */
    Object get(String variable);
}
