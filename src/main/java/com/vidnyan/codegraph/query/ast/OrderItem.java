package com.vidnyan.codegraph.query.ast;

/**
 * @param text source text of the expression, used to match it to a RETURN item
 */
public record OrderItem(Expression expression, String text, boolean descending) {
}
