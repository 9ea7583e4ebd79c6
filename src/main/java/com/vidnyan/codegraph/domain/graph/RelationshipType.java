package com.vidnyan.codegraph.domain.graph;

import java.util.Arrays;
import java.util.Optional;

/**
 * Types of relationships between graph nodes.
 */
public enum RelationshipType {
    CONTAINS,           // Folder/File/Class contains a child
    IMPORTS,            // File imports another file
    CALLS,              // Callable calls another callable
    INHERITS,           // Base class without extends/implements distinction
    EXTENDS,            // Type extends another type
    IMPLEMENTS,         // Type implements an interface
    MEMBER_OF,          // Symbol belongs to a community
    STEP_IN_PROCESS;    // Symbol is an ordered step of a process trace

    public boolean isDerived() {
        return this == MEMBER_OF || this == STEP_IN_PROCESS;
    }

    public boolean isHeritage() {
        return this == INHERITS || this == EXTENDS || this == IMPLEMENTS;
    }

    public static Optional<RelationshipType> find(String name) {
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(name))
                .findFirst();
    }
}
