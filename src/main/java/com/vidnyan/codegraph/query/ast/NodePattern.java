package com.vidnyan.codegraph.query.ast;

import java.util.Map;

/**
 * {@code (variable:Label {key: value})}; every part is optional.
 */
public record NodePattern(String variable, String label, Map<String, Expression> properties) {

    public NodePattern {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
