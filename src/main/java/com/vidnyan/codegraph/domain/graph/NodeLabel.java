package com.vidnyan.codegraph.domain.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of nodes stored in the knowledge graph.
 */
public enum NodeLabel {
    FOLDER("Folder"),
    FILE("File"),
    FUNCTION("Function"),
    CLASS("Class"),
    METHOD("Method"),
    INTERFACE("Interface"),
    VARIABLE("Variable"),
    IMPORT("Import"),
    TYPE("Type"),
    COMMUNITY("Community"),
    PROCESS("Process"),
    CODE_EMBEDDING("CodeEmbedding");

    private final String displayName;

    NodeLabel(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /**
     * Derived nodes are dropped and regenerated on every update, never patched.
     */
    public boolean isDerived() {
        return this == COMMUNITY || this == PROCESS;
    }

    /**
     * Code symbols that can take part in calls and inheritance.
     */
    public boolean isSymbol() {
        return switch (this) {
            case FUNCTION, CLASS, METHOD, INTERFACE, VARIABLE, TYPE -> true;
            default -> false;
        };
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }

    public static Optional<NodeLabel> find(String name) {
        return Arrays.stream(values())
                .filter(l -> l.displayName.equalsIgnoreCase(name) || l.name().equalsIgnoreCase(name))
                .findFirst();
    }

    @JsonCreator
    public static NodeLabel fromDisplayName(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown node label: " + name));
    }
}
