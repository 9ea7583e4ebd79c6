package com.vidnyan.codegraph.domain.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Phases reported in progress events, in execution order.
 */
public enum PipelinePhase {
    STRUCTURE,
    PARSING,
    IMPORTS,
    CALLS,
    HERITAGE,
    COMMUNITIES,
    PROCESSES,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
