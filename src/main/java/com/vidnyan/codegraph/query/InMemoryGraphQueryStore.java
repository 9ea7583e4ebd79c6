package com.vidnyan.codegraph.query;

import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.exception.GraphNotLoadedException;
import com.vidnyan.codegraph.query.ast.MatchQuery;
import lombok.extern.slf4j.Slf4j;

/**
 * Queryable view of a project graph. Reloaded wholesale whenever the graph is
 * replaced; queries see either the old or the new graph, never a mix.
 */
@Slf4j
public class InMemoryGraphQueryStore {

    private volatile QueryExecutor executor;

    public void load(KnowledgeGraph graph) {
        QueryExecutor loaded = new QueryExecutor(graph);
        executor = loaded;
        log.debug("Query store loaded: {} nodes, {} relationships", graph.nodeCount(), graph.relationshipCount());
    }

    public boolean isLoaded() {
        return executor != null;
    }

    public void clear() {
        executor = null;
    }

    /**
     * @throws GraphNotLoadedException before the first {@link #load}
     * @throws com.vidnyan.codegraph.exception.GraphQueryException for a malformed query
     */
    public QueryResult query(String cypher) {
        QueryExecutor current = executor;
        if (current == null) {
            throw new GraphNotLoadedException("No graph loaded; open a project first");
        }
        MatchQuery parsed = QueryParser.parse(cypher);
        QueryResult result = current.execute(parsed);
        log.debug("Query returned {} rows in {} ms", result.size(), result.durationMs());
        return result;
    }
}
