package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.ProgressReporter;
import com.vidnyan.codegraph.ingestion.language.ParsedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * CALLS edges from the innermost enclosing callable (or the file) of each call
 * site to the resolved callee.
 */
@Slf4j
@Component
public class CallProcessor {

    public void process(KnowledgeGraph graph, List<FileEntry> files, IngestionContext ctx, ProgressReporter.Band band) {
        int resolved = 0;
        int skipped = 0;

        for (int i = 0; i < files.size(); i++) {
            ctx.checkCancelled("call resolution");
            FileEntry file = files.get(i);
            Optional<ParsedFile> parsed = ctx.parsed(file);
            if (parsed.isEmpty()) {
                continue;
            }
            List<ParsedFile.Symbol> callables = parsed.get().symbols().stream()
                    .filter(s -> s.label().isCallable())
                    .toList();

            for (ParsedFile.CallSite call : parsed.get().calls()) {
                if (BuiltinNames.isBuiltin(parsed.get().language(), call.calleeName())) {
                    skipped++;
                    continue;
                }
                String callerId = enclosingCallable(callables, call.line())
                        .map(s -> NodeIds.symbol(s.label(), file.path(), s.qualifiedName()))
                        .orElse(NodeIds.file(file.path()));

                Optional<SymbolResolver.Resolution> target = SymbolResolver.resolve(ctx, file.path(),
                        call.calleeName(), CallProcessor::isCallTarget, NodeLabel::isCallable);
                if (target.isEmpty() || target.get().nodeId().equals(callerId)) {
                    skipped++;
                    continue;
                }
                if (graph.addRelationship(GraphRelationship.of(RelationshipType.CALLS, callerId,
                        target.get().nodeId(), target.get().confidence(), target.get().reason()))) {
                    resolved++;
                }
            }
            band.update(i + 1, files.size(), "Tracing calls...", null);
        }
        log.info("Calls: {} edges, {} call sites skipped", resolved, skipped);
    }

    private static boolean isCallTarget(NodeLabel label) {
        return label.isCallable() || label == NodeLabel.CLASS;
    }

    static Optional<ParsedFile.Symbol> enclosingCallable(List<ParsedFile.Symbol> callables, int line) {
        return callables.stream()
                .filter(s -> s.contains(line))
                .min(Comparator.comparingInt(ParsedFile.Symbol::span));
    }
}
