package com.vidnyan.codegraph.domain.pipeline;

/**
 * Progress event emitted at phase boundaries and during long phases.
 *
 * @param percent 0-100, non-decreasing within one run
 * @param stats   optional counters, null when not meaningful
 */
public record PipelineProgress(
    PipelinePhase phase,
    int percent,
    String message,
    Stats stats
) {

    public record Stats(int filesProcessed, int totalFiles, int nodesCreated) {}

    public static PipelineProgress of(PipelinePhase phase, int percent, String message) {
        return new PipelineProgress(phase, percent, message, null);
    }
}
