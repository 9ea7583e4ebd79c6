package com.vidnyan.codegraph.ingestion;

/**
 * Tunables of the ingestion phases.
 */
public record PipelineSettings(
    int parseCacheSize,
    double communityResolution,
    int communityMaxIterations,
    int processMaxDepth,
    int processMaxBranching,
    int processMinSteps,
    int processMaxCount
) {

    public static PipelineSettings defaults() {
        return new PipelineSettings(ParseCache.DEFAULT_CAPACITY, 1.0, 10, 10, 4, 2, 75);
    }
}
