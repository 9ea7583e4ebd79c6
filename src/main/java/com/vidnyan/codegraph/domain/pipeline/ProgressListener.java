package com.vidnyan.codegraph.domain.pipeline;

/**
 * Receives progress events of a pipeline run.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(PipelineProgress progress);
}
