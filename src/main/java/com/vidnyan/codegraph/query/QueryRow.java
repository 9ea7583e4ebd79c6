package com.vidnyan.codegraph.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One result row, tagged by shape:
 * <ul>
 *   <li>{@code NODE}: the query returned a single node</li>
 *   <li>{@code RELATIONSHIP}: the query returned {@code a, r, b}</li>
 *   <li>{@code VALUES}: anything else, positional in RETURN order</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryRow(
    Kind kind,
    GraphNode node,
    GraphNode source,
    GraphRelationship relationship,
    GraphNode target,
    List<Object> values
) {

    public enum Kind {
        NODE,
        RELATIONSHIP,
        VALUES
    }

    static QueryRow of(List<Object> values) {
        if (values.size() == 1 && values.get(0) instanceof GraphNode node) {
            return new QueryRow(Kind.NODE, node, null, null, null, null);
        }
        if (values.size() == 3
                && values.get(0) instanceof GraphNode source
                && values.get(1) instanceof GraphRelationship relationship
                && values.get(2) instanceof GraphNode target) {
            return new QueryRow(Kind.RELATIONSHIP, null, source, relationship, target, null);
        }
        return new QueryRow(Kind.VALUES, null, null, null, null, Collections.unmodifiableList(new ArrayList<>(values)));
    }
}
