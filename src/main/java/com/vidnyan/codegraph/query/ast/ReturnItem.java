package com.vidnyan.codegraph.query.ast;

/**
 * @param alias column name: the AS alias or the item's source text
 */
public record ReturnItem(Expression expression, String alias) {
}
