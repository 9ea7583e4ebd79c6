package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.pipeline.PipelinePhase;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.domain.pipeline.ProgressListener;
import lombok.extern.slf4j.Slf4j;

/**
 * Forwards progress to a listener, never letting the percentage go backwards.
 */
@Slf4j
public final class ProgressReporter {

    private final ProgressListener listener;
    private int lastPercent;

    public ProgressReporter(ProgressListener listener) {
        this.listener = listener != null ? listener : ProgressListener.NONE;
    }

    public void report(PipelinePhase phase, int percent, String message) {
        report(phase, percent, message, null);
    }

    public synchronized void report(PipelinePhase phase, int percent, String message, PipelineProgress.Stats stats) {
        lastPercent = Math.max(lastPercent, Math.min(100, Math.max(0, percent)));
        try {
            listener.onProgress(new PipelineProgress(phase, lastPercent, message, stats));
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: {}", e.getMessage());
        }
    }

    /**
     * Progress within one phase, mapped linearly onto {@code [from, to]}.
     */
    public Band band(PipelinePhase phase, int from, int to) {
        return new Band(phase, from, to);
    }

    public int lastPercent() {
        return lastPercent;
    }

    public final class Band {
        private final PipelinePhase phase;
        private final int from;
        private final int to;

        private Band(PipelinePhase phase, int from, int to) {
            this.phase = phase;
            this.from = from;
            this.to = to;
        }

        public void start(String message) {
            report(phase, from, message);
        }

        public void update(int done, int total, String message, PipelineProgress.Stats stats) {
            int percent = total <= 0 ? to : from + (int) Math.round((to - from) * (double) done / total);
            report(phase, percent, message, stats);
        }

        /**
         * @param fraction completion in [0, 1]
         */
        public void update(double fraction, String message) {
            report(phase, from + (int) Math.round((to - from) * Math.min(1.0, Math.max(0.0, fraction))), message);
        }
    }
}
