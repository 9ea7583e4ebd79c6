package com.vidnyan.codegraph.domain.pipeline;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of community detection over the whole graph.
 */
public record CommunityResult(
    List<Community> communities,
    List<Membership> memberships,
    Stats stats
) {

    /**
     * @param cohesion share of member edges that stay inside the community, in [0, 1]
     */
    public record Community(
        String id,
        int clusterIndex,
        String label,
        String heuristicLabel,
        double cohesion,
        int symbolCount
    ) {}

    public record Membership(String nodeId, String communityId, int clusterIndex) {}

    public record Stats(int totalCommunities, double modularity, int nodesProcessed) {}

    public static CommunityResult empty() {
        return new CommunityResult(List.of(), List.of(), new Stats(0, 0.0, 0));
    }

    /**
     * Node id → community id.
     */
    public Map<String, String> communityByNode() {
        return memberships.stream()
                .collect(Collectors.toMap(Membership::nodeId, Membership::communityId, (a, b) -> a));
    }
}
