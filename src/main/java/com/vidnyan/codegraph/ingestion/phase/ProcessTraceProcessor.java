package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.pipeline.CommunityResult;
import com.vidnyan.codegraph.domain.pipeline.ProcessResult;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.PipelineSettings;
import com.vidnyan.codegraph.ingestion.ProgressReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Detects execution flows: bounded depth-first traces along CALLS edges that
 * start at entry points (callables nobody calls).
 * <p>
 * Runs over the whole graph. Existing Process nodes and STEP_IN_PROCESS edges
 * are expected to have been removed by the caller.
 */
@Slf4j
@Component
public class ProcessTraceProcessor {

    public static final String REASON = "trace-detection";
    public static final String HEURISTIC_LABEL = "heuristicLabel";
    public static final String PROCESS_TYPE = "processType";
    public static final String STEP_COUNT = "stepCount";
    public static final String COMMUNITIES = "communities";
    public static final String ENTRY_POINT_ID = "entryPointId";
    public static final String TERMINAL_ID = "terminalId";

    private static final Pattern ENTRY_NAME = Pattern.compile(
            "^(main|run|start|init|bootstrap|execute|serve|listen|launch|process|handle)([A-Z_].*)?$");
    private static final Pattern HANDLER_NAME = Pattern.compile("^(on|handle)[A-Z].*|.*(Handler|Controller|Command|Job)$");
    private static final Pattern TEST_PATH = Pattern.compile(
            "(^|/)(test|tests|__tests__|spec)/|\\.(test|spec)\\.[a-z]+$|(^|/)test_[^/]*\\.py$|_test\\.py$|Tests?\\.java$");

    private record Entry(String id, double score) {}

    public ProcessResult process(KnowledgeGraph graph, CommunityResult communities, IngestionContext ctx,
                                 ProgressReporter.Band band) {
        band.start("Detecting execution flows...");
        PipelineSettings settings = ctx.getSettings();

        Map<String, List<String>> callees = new HashMap<>();
        Map<String, Integer> incoming = new HashMap<>();
        for (GraphRelationship rel : graph.relationshipsOfType(RelationshipType.CALLS)) {
            if (isCallable(graph, rel.sourceId()) && isCallable(graph, rel.targetId())
                    && !rel.sourceId().equals(rel.targetId())) {
                callees.computeIfAbsent(rel.sourceId(), k -> new ArrayList<>()).add(rel.targetId());
                incoming.merge(rel.targetId(), 1, Integer::sum);
            }
        }
        callees.replaceAll((k, v) -> new ArrayList<>(new TreeSet<>(v)));

        List<Entry> entries = new ArrayList<>();
        for (String id : new TreeSet<>(callees.keySet())) {
            GraphNode node = graph.getNode(id).orElseThrow();
            if (!incoming.containsKey(id) && !TEST_PATH.matcher(node.filePath()).find()) {
                entries.add(new Entry(id, score(node, callees.get(id).size())));
            }
        }
        entries.sort(Comparator.comparingDouble(Entry::score).reversed().thenComparing(Entry::id));

        List<List<String>> traces = new ArrayList<>();
        int perEntryLimit = Math.max(1, settings.processMaxBranching() * 3);
        for (int i = 0; i < entries.size(); i++) {
            ctx.checkCancelled("process tracing");
            List<List<String>> found = new ArrayList<>();
            List<String> path = new ArrayList<>();
            path.add(entries.get(i).id());
            trace(path, callees, settings, found, perEntryLimit);
            traces.addAll(found);
            band.update((i + 1) / (double) entries.size() * 0.8, "Tracing from " + (i + 1) + "/" + entries.size());
        }

        List<List<String>> kept = removeSubsets(traces);
        if (kept.size() > settings.processMaxCount()) {
            kept = kept.subList(0, settings.processMaxCount());
        }

        ProcessResult result = toResult(graph, kept, communities.communityByNode(), entries.size());
        writeToGraph(graph, result);
        band.update(1.0, "Found " + result.processes().size() + " execution flows");
        log.info("Processes: {} flows from {} entry points ({} cross-community)",
                result.stats().totalProcesses(), entries.size(), result.stats().crossCommunityCount());
        return result;
    }

    private static boolean isCallable(KnowledgeGraph graph, String id) {
        return graph.getNode(id).map(n -> n.label().isCallable()).orElse(false);
    }

    private static double score(GraphNode node, int fanOut) {
        double score = 1.0;
        String name = node.name();
        if (Boolean.TRUE.equals(node.property(ParsingProcessor.EXPORTED))) {
            score += 0.5;
        }
        if (ENTRY_NAME.matcher(name).matches()) {
            score += 1.0;
        } else if (HANDLER_NAME.matcher(name).matches()) {
            score += 0.8;
        }
        return score + Math.min(fanOut, 5) * 0.1;
    }

    /**
     * Depth-first, breadth-bounded walk. A trace ends at a leaf, at a node whose
     * callees are all already on the path, or at the depth limit.
     */
    private static void trace(List<String> path, Map<String, List<String>> callees, PipelineSettings settings,
                              List<List<String>> found, int limit) {
        if (found.size() >= limit) {
            return;
        }
        String last = path.get(path.size() - 1);
        List<String> next = callees.getOrDefault(last, List.of()).stream()
                .filter(id -> !path.contains(id))
                .limit(settings.processMaxBranching())
                .toList();
        if (next.isEmpty() || path.size() >= settings.processMaxDepth()) {
            if (path.size() >= settings.processMinSteps()) {
                found.add(List.copyOf(path));
            }
            return;
        }
        for (String id : next) {
            path.add(id);
            trace(path, callees, settings, found, limit);
            path.remove(path.size() - 1);
        }
    }

    /**
     * Longest traces first; a trace whose nodes all appear in a kept trace is dropped.
     */
    private static List<List<String>> removeSubsets(List<List<String>> traces) {
        List<List<String>> sorted = new ArrayList<>(traces);
        sorted.sort(Comparator.<List<String>>comparingInt(List::size).reversed()
                .thenComparing(t -> String.join("|", t)));
        List<List<String>> kept = new ArrayList<>();
        List<Set<String>> keptSets = new ArrayList<>();
        for (List<String> trace : sorted) {
            Set<String> nodes = new HashSet<>(trace);
            if (keptSets.stream().noneMatch(k -> k.containsAll(nodes))) {
                kept.add(trace);
                keptSets.add(nodes);
            }
        }
        return kept;
    }

    private static ProcessResult toResult(KnowledgeGraph graph, List<List<String>> traces,
                                          Map<String, String> communityByNode, int entryPointsFound) {
        List<ProcessResult.TracedProcess> processes = new ArrayList<>();
        List<ProcessResult.Step> steps = new ArrayList<>();
        int crossCommunity = 0;
        int totalSteps = 0;

        for (int index = 0; index < traces.size(); index++) {
            List<String> trace = traces.get(index);
            String entryId = trace.get(0);
            String terminalId = trace.get(trace.size() - 1);
            String entryName = graph.getNode(entryId).map(GraphNode::name).orElse("entry");
            String terminalName = graph.getNode(terminalId).map(GraphNode::name).orElse("terminal");
            String processId = NodeIds.process(index, entryName);
            String label = capitalize(entryName) + " → " + capitalize(terminalName);

            Set<String> communities = new LinkedHashSet<>();
            trace.stream().map(communityByNode::get).filter(c -> c != null).forEach(communities::add);
            ProcessResult.ProcessType type = communities.size() > 1
                    ? ProcessResult.ProcessType.CROSS_COMMUNITY
                    : ProcessResult.ProcessType.INTRA_COMMUNITY;
            if (type == ProcessResult.ProcessType.CROSS_COMMUNITY) {
                crossCommunity++;
            }

            processes.add(new ProcessResult.TracedProcess(processId, label, label, type, trace.size(),
                    List.copyOf(communities), entryId, terminalId, trace));
            for (int step = 0; step < trace.size(); step++) {
                steps.add(new ProcessResult.Step(trace.get(step), processId, step + 1));
            }
            totalSteps += trace.size();
        }

        double average = processes.isEmpty() ? 0.0 : (double) totalSteps / processes.size();
        return new ProcessResult(processes, steps,
                new ProcessResult.Stats(processes.size(), crossCommunity, average, entryPointsFound));
    }

    private static void writeToGraph(KnowledgeGraph graph, ProcessResult result) {
        for (ProcessResult.TracedProcess process : result.processes()) {
            graph.addNode(GraphNode.builder(process.id(), NodeLabel.PROCESS)
                    .name(process.label())
                    .property(HEURISTIC_LABEL, process.heuristicLabel())
                    .property(PROCESS_TYPE, process.processType().value())
                    .property(STEP_COUNT, process.stepCount())
                    .property(COMMUNITIES, process.communities())
                    .property(ENTRY_POINT_ID, process.entryPointId())
                    .property(TERMINAL_ID, process.terminalId())
                    .build());
        }
        for (ProcessResult.Step step : result.steps()) {
            graph.addRelationship(new GraphRelationship(
                    NodeIds.processStep(step.nodeId(), step.step(), step.processId()),
                    RelationshipType.STEP_IN_PROCESS, step.nodeId(), step.processId(),
                    1.0, REASON, step.step()));
        }
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
