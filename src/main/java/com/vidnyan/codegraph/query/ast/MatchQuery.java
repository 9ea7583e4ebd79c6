package com.vidnyan.codegraph.query.ast;

import java.util.List;

/**
 * Parsed {@code MATCH ... [WHERE] RETURN ... [ORDER BY] [SKIP] [LIMIT]} query.
 *
 * @param where null when absent
 * @param skip  0 when absent
 * @param limit null when absent
 */
public record MatchQuery(
    List<PathPattern> patterns,
    Expression where,
    boolean distinct,
    List<ReturnItem> returnItems,
    List<OrderItem> orderBy,
    long skip,
    Long limit
) {

    public MatchQuery {
        patterns = List.copyOf(patterns);
        returnItems = List.copyOf(returnItems);
        orderBy = List.copyOf(orderBy);
    }

    public boolean isAggregating() {
        return returnItems.stream().anyMatch(item -> item.expression().isAggregate());
    }
}
