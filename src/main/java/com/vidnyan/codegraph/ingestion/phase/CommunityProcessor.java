package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.pipeline.CommunityResult;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.ProgressReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Clusters symbols into communities with a deterministic Leiden-style
 * modularity optimization: local moving, refinement of every community into
 * its connected components, aggregation of the refined partition, repeated
 * until the partition is stable.
 * <p>
 * Runs over the whole graph. Existing Community nodes and MEMBER_OF edges are
 * expected to have been removed by the caller.
 */
@Slf4j
@Component
public class CommunityProcessor {

    public static final String REASON = "leiden-algorithm";
    public static final String HEURISTIC_LABEL = "heuristicLabel";
    public static final String COHESION = "cohesion";
    public static final String SYMBOL_COUNT = "symbolCount";
    public static final String CLUSTER_INDEX = "clusterIndex";

    private static final Set<RelationshipType> LINK_TYPES = EnumSet.of(
            RelationshipType.CALLS, RelationshipType.EXTENDS, RelationshipType.IMPLEMENTS, RelationshipType.INHERITS);

    private static final Set<String> GENERIC_FOLDERS = Set.of(
            "src", "lib", "app", "main", "java", "com", "org", "net", "io", "source", "sources", "pkg",
            "internal", "core", "packages", "kotlin", "python", "scripts");

    private static final double EPSILON = 1e-12;

    public CommunityResult process(KnowledgeGraph graph, IngestionContext ctx, ProgressReporter.Band band) {
        band.start("Detecting communities...");

        List<String> nodeIds = new ArrayList<>(collectNodes(graph));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            index.put(nodeIds.get(i), i);
        }
        LevelGraph base = buildBaseGraph(graph, index, nodeIds.size());
        if (base.totalWeight() == 0) {
            band.update(1.0, "No communities found");
            return CommunityResult.empty();
        }

        int[] membership = cluster(base, ctx.getSettings().communityResolution(),
                ctx.getSettings().communityMaxIterations(), ctx, band);
        double modularity = modularity(base, membership, ctx.getSettings().communityResolution());

        Map<Integer, List<Integer>> groups = new TreeMap<>();
        for (int i = 0; i < membership.length; i++) {
            groups.computeIfAbsent(membership[i], k -> new ArrayList<>()).add(i);
        }
        List<List<Integer>> kept = groups.values().stream()
                .filter(members -> members.size() >= 2)
                .sorted(Comparator.<List<Integer>>comparingInt(List::size).reversed()
                        .thenComparing(members -> nodeIds.get(members.get(0))))
                .toList();

        List<CommunityResult.Community> communities = new ArrayList<>();
        List<CommunityResult.Membership> memberships = new ArrayList<>();
        for (int clusterIndex = 0; clusterIndex < kept.size(); clusterIndex++) {
            List<Integer> members = kept.get(clusterIndex);
            String communityId = NodeIds.community(clusterIndex);
            String label = heuristicLabel(graph, members, nodeIds, clusterIndex);
            double cohesion = cohesion(base, membership, members);

            communities.add(new CommunityResult.Community(communityId, clusterIndex, label, label,
                    cohesion, members.size()));
            for (int member : members) {
                memberships.add(new CommunityResult.Membership(nodeIds.get(member), communityId, clusterIndex));
            }
        }

        writeToGraph(graph, communities, memberships);
        band.update(1.0, "Found " + communities.size() + " communities");
        log.info("Communities: {} found over {} symbols, modularity {}", communities.size(), nodeIds.size(),
                String.format(Locale.ROOT, "%.3f", modularity));
        return new CommunityResult(communities, memberships,
                new CommunityResult.Stats(communities.size(), modularity, nodeIds.size()));
    }

    private static TreeSet<String> collectNodes(KnowledgeGraph graph) {
        TreeSet<String> ids = new TreeSet<>();
        for (GraphRelationship rel : graph.relationships()) {
            if (LINK_TYPES.contains(rel.type()) && !rel.sourceId().equals(rel.targetId())
                    && isSymbol(graph, rel.sourceId()) && isSymbol(graph, rel.targetId())) {
                ids.add(rel.sourceId());
                ids.add(rel.targetId());
            }
        }
        return ids;
    }

    private static boolean isSymbol(KnowledgeGraph graph, String id) {
        return graph.getNode(id).map(n -> n.label().isSymbol()).orElse(false);
    }

    private static LevelGraph buildBaseGraph(KnowledgeGraph graph, Map<String, Integer> index, int size) {
        List<Map<Integer, Double>> adjacency = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            adjacency.add(new TreeMap<>());
        }
        for (GraphRelationship rel : graph.relationships()) {
            Integer a = index.get(rel.sourceId());
            Integer b = index.get(rel.targetId());
            if (!LINK_TYPES.contains(rel.type()) || a == null || b == null || a.equals(b)) {
                continue;
            }
            adjacency.get(a).merge(b, 1.0, Double::sum);
            adjacency.get(b).merge(a, 1.0, Double::sum);
        }
        return new LevelGraph(adjacency, new double[size]);
    }

    /**
     * @return community of each base node
     */
    private int[] cluster(LevelGraph base, double resolution, int maxLevels, IngestionContext ctx,
                          ProgressReporter.Band band) {
        int[] nodeToAggregate = new int[base.size()];
        for (int i = 0; i < nodeToAggregate.length; i++) {
            nodeToAggregate[i] = i;
        }
        LevelGraph current = base;
        int[] partition = identity(current.size());

        for (int level = 0; level < Math.max(1, maxLevels); level++) {
            ctx.checkCancelled("community detection");
            boolean moved = moveNodes(current, partition, resolution);
            int[] refined = refine(current, partition);
            int refinedCount = Arrays.stream(refined).max().orElse(-1) + 1;
            band.update((level + 1) / (double) Math.max(1, maxLevels),
                    "Clustering level " + (level + 1) + ": " + refinedCount + " groups");
            if ((!moved && level > 0) || refinedCount == current.size()) {
                break;
            }

            // aggregate on the refined partition, seed the next level with the unrefined one
            LevelGraph aggregate = aggregate(current, refined, refinedCount);
            int[] seed = new int[refinedCount];
            for (int i = 0; i < refined.length; i++) {
                seed[refined[i]] = partition[i];
            }
            for (int i = 0; i < nodeToAggregate.length; i++) {
                nodeToAggregate[i] = refined[nodeToAggregate[i]];
            }
            current = aggregate;
            partition = compact(seed);
        }

        int[] result = new int[base.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = partition[nodeToAggregate[i]];
        }
        return compact(refine(base, result));
    }

    /**
     * Moves nodes between communities while modularity improves.
     *
     * @return true if any node changed community
     */
    private static boolean moveNodes(LevelGraph g, int[] partition, double resolution) {
        double m2 = g.totalDegree();
        double[] communityDegree = new double[g.size()];
        for (int i = 0; i < g.size(); i++) {
            communityDegree[partition[i]] += g.degree(i);
        }

        boolean anyMove = false;
        boolean improved = true;
        int passes = 0;
        while (improved && passes++ < 100) {
            improved = false;
            for (int node = 0; node < g.size(); node++) {
                int own = partition[node];
                double k = g.degree(node);
                communityDegree[own] -= k;

                Map<Integer, Double> linksTo = new TreeMap<>();
                for (Map.Entry<Integer, Double> e : g.adjacency().get(node).entrySet()) {
                    linksTo.merge(partition[e.getKey()], e.getValue(), Double::sum);
                }
                double bestGain = linksTo.getOrDefault(own, 0.0) - resolution * communityDegree[own] * k / m2;
                int best = own;
                for (Map.Entry<Integer, Double> e : linksTo.entrySet()) {
                    double gain = e.getValue() - resolution * communityDegree[e.getKey()] * k / m2;
                    if (gain > bestGain + EPSILON) {
                        bestGain = gain;
                        best = e.getKey();
                    }
                }

                communityDegree[best] += k;
                if (best != own) {
                    partition[node] = best;
                    improved = true;
                    anyMove = true;
                }
            }
        }
        return anyMove;
    }

    /**
     * Splits every community into its connected components, so no community is
     * internally disconnected.
     */
    private static int[] refine(LevelGraph g, int[] partition) {
        int[] refined = new int[g.size()];
        Arrays.fill(refined, -1);
        int next = 0;
        for (int start = 0; start < g.size(); start++) {
            if (refined[start] >= 0) {
                continue;
            }
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            refined[start] = next;
            while (!queue.isEmpty()) {
                int node = queue.poll();
                for (int neighbour : g.adjacency().get(node).keySet()) {
                    if (refined[neighbour] < 0 && partition[neighbour] == partition[start]) {
                        refined[neighbour] = next;
                        queue.add(neighbour);
                    }
                }
            }
            next++;
        }
        return refined;
    }

    private static LevelGraph aggregate(LevelGraph g, int[] refined, int count) {
        List<Map<Integer, Double>> adjacency = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            adjacency.add(new TreeMap<>());
        }
        double[] selfLoops = new double[count];
        for (int node = 0; node < g.size(); node++) {
            selfLoops[refined[node]] += g.selfLoops()[node];
            for (Map.Entry<Integer, Double> e : g.adjacency().get(node).entrySet()) {
                int a = refined[node];
                int b = refined[e.getKey()];
                if (a == b) {
                    // each undirected edge is visited from both ends
                    selfLoops[a] += e.getValue() / 2.0;
                } else {
                    adjacency.get(a).merge(b, e.getValue(), Double::sum);
                }
            }
        }
        return new LevelGraph(adjacency, selfLoops);
    }

    private static double modularity(LevelGraph g, int[] membership, double resolution) {
        double m = g.totalWeight();
        Map<Integer, Double> internal = new HashMap<>();
        Map<Integer, Double> degree = new HashMap<>();
        for (int node = 0; node < g.size(); node++) {
            degree.merge(membership[node], g.degree(node), Double::sum);
            for (Map.Entry<Integer, Double> e : g.adjacency().get(node).entrySet()) {
                if (membership[e.getKey()] == membership[node] && e.getKey() > node) {
                    internal.merge(membership[node], e.getValue(), Double::sum);
                }
            }
        }
        double q = 0.0;
        for (Map.Entry<Integer, Double> e : degree.entrySet()) {
            double in = internal.getOrDefault(e.getKey(), 0.0);
            double share = e.getValue() / (2.0 * m);
            q += in / m - resolution * share * share;
        }
        return q;
    }

    private static double cohesion(LevelGraph base, int[] membership, List<Integer> members) {
        double inside = 0.0;
        double total = 0.0;
        for (int node : members) {
            for (Map.Entry<Integer, Double> e : base.adjacency().get(node).entrySet()) {
                total += e.getValue();
                if (membership[e.getKey()] == membership[node]) {
                    inside += e.getValue();
                }
            }
        }
        return total == 0.0 ? 0.0 : Math.round(inside / total * 1000.0) / 1000.0;
    }

    private static String heuristicLabel(KnowledgeGraph graph, List<Integer> members, List<String> nodeIds,
                                         int clusterIndex) {
        Map<String, Integer> folderCounts = new TreeMap<>();
        for (int member : members) {
            graph.getNode(nodeIds.get(member)).map(GraphNode::filePath).ifPresent(path -> {
                String[] parts = path.split("/");
                for (int i = parts.length - 2; i >= 0; i--) {
                    if (!GENERIC_FOLDERS.contains(parts[i].toLowerCase(Locale.ROOT))) {
                        folderCounts.merge(parts[i], 1, Integer::sum);
                        break;
                    }
                }
            });
        }
        return folderCounts.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(e -> capitalize(e.getKey()))
                .orElse("Cluster " + clusterIndex);
    }

    private static void writeToGraph(KnowledgeGraph graph, List<CommunityResult.Community> communities,
                                     List<CommunityResult.Membership> memberships) {
        for (CommunityResult.Community community : communities) {
            graph.addNode(GraphNode.builder(community.id(), NodeLabel.COMMUNITY)
                    .name(community.label())
                    .property(HEURISTIC_LABEL, community.heuristicLabel())
                    .property(COHESION, community.cohesion())
                    .property(SYMBOL_COUNT, community.symbolCount())
                    .property(CLUSTER_INDEX, community.clusterIndex())
                    .build());
        }
        for (CommunityResult.Membership membership : memberships) {
            graph.addRelationship(new GraphRelationship(
                    NodeIds.membership(membership.nodeId(), membership.communityId()),
                    RelationshipType.MEMBER_OF, membership.nodeId(), membership.communityId(),
                    1.0, REASON, null));
        }
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private static int[] identity(int size) {
        int[] result = new int[size];
        for (int i = 0; i < size; i++) {
            result[i] = i;
        }
        return result;
    }

    /**
     * Renumbers labels to 0..n-1 in order of first appearance.
     */
    private static int[] compact(int[] labels) {
        Map<Integer, Integer> renumber = new HashMap<>();
        int[] result = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            result[i] = renumber.computeIfAbsent(labels[i], k -> renumber.size());
        }
        return result;
    }

    /**
     * Weighted undirected graph of one aggregation level.
     */
    private record LevelGraph(List<Map<Integer, Double>> adjacency, double[] selfLoops) {

        int size() {
            return adjacency.size();
        }

        double degree(int node) {
            double sum = 2.0 * selfLoops[node];
            for (double w : adjacency.get(node).values()) {
                sum += w;
            }
            return sum;
        }

        double totalDegree() {
            double sum = 0.0;
            for (int i = 0; i < size(); i++) {
                sum += degree(i);
            }
            return sum;
        }

        double totalWeight() {
            return totalDegree() / 2.0;
        }
    }
}
