package com.vidnyan.codegraph.domain.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the knowledge graph.
 * Immutable value object; identity is carried by {@code id}.
 */
public record GraphNode(
    String id,
    NodeLabel label,
    Map<String, Object> properties
) {

    public static final String NAME = "name";
    public static final String FILE_PATH = "filePath";
    public static final String START_LINE = "startLine";
    public static final String END_LINE = "endLine";
    public static final String LANGUAGE = "language";

    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String name() {
        Object value = properties.get(NAME);
        return value != null ? value.toString() : "";
    }

    /**
     * Path of the file that owns this node, empty for derived nodes.
     */
    public String filePath() {
        Object value = properties.get(FILE_PATH);
        return value != null ? value.toString() : "";
    }

    public int startLine() {
        return intProperty(START_LINE);
    }

    public int endLine() {
        return intProperty(END_LINE);
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public boolean isOwnedBy(String path) {
        return !filePath().isEmpty() && filePath().equals(path);
    }

    private int intProperty(String key) {
        Object value = properties.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }

    public static Builder builder(String id, NodeLabel label) {
        return new Builder(id, label);
    }

    public static class Builder {
        private final String id;
        private final NodeLabel label;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        private Builder(String id, NodeLabel label) {
            this.id = id;
            this.label = label;
        }

        public Builder name(String name) { return property(NAME, name); }
        public Builder filePath(String path) { return property(FILE_PATH, path); }
        public Builder lines(int start, int end) {
            property(START_LINE, start);
            return property(END_LINE, end);
        }
        public Builder language(String language) { return property(LANGUAGE, language); }

        public Builder property(String key, Object value) {
            if (value != null) {
                properties.put(key, value);
            }
            return this;
        }

        public GraphNode build() {
            return new GraphNode(id, label, properties);
        }
    }
}
