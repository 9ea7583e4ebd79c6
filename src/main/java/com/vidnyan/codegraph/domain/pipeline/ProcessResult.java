package com.vidnyan.codegraph.domain.pipeline;

import java.util.List;

/**
 * Output of process tracing: execution paths through the call graph.
 */
public record ProcessResult(
    List<TracedProcess> processes,
    List<Step> steps,
    Stats stats
) {

    public enum ProcessType {
        INTRA_COMMUNITY("intra_community"),
        CROSS_COMMUNITY("cross_community");

        private final String value;

        ProcessType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public record TracedProcess(
        String id,
        String label,
        String heuristicLabel,
        ProcessType processType,
        int stepCount,
        List<String> communities,
        String entryPointId,
        String terminalId,
        List<String> trace
    ) {}

    /**
     * @param step 1-based position of the node in the trace
     */
    public record Step(String nodeId, String processId, int step) {}

    public record Stats(int totalProcesses, int crossCommunityCount, double avgStepCount, int entryPointsFound) {}

    public static ProcessResult empty() {
        return new ProcessResult(List.of(), List.of(), new Stats(0, 0, 0.0, 0));
    }
}
