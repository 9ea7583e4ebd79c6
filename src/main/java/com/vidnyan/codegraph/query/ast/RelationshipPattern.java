package com.vidnyan.codegraph.query.ast;

import java.util.List;

/**
 * {@code -[variable:T1|T2]->}. An empty type list matches every type.
 */
public record RelationshipPattern(String variable, List<String> types, Direction direction) {

    public enum Direction {
        OUTGOING, INCOMING, EITHER
    }

    public RelationshipPattern {
        types = types == null ? List.of() : List.copyOf(types);
    }
}
