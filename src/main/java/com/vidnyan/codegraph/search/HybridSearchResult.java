package com.vidnyan.codegraph.search;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One fused search result. Node fields are only set when the semantic side matched.
 *
 * @param sources contributing rankings, "bm25" and/or "semantic"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HybridSearchResult(
    String filePath,
    double score,
    int rank,
    List<String> sources,
    String nodeId,
    String nodeName,
    String label,
    Integer startLine,
    Integer endLine
) {
}
