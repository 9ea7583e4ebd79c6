package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.ProgressReporter;
import com.vidnyan.codegraph.ingestion.language.ParsedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * EXTENDS, IMPLEMENTS and INHERITS edges between types.
 */
@Slf4j
@Component
public class HeritageProcessor {

    public void process(KnowledgeGraph graph, List<FileEntry> files, IngestionContext ctx, ProgressReporter.Band band) {
        int linked = 0;
        for (int i = 0; i < files.size(); i++) {
            ctx.checkCancelled("heritage resolution");
            FileEntry file = files.get(i);
            Optional<ParsedFile> parsed = ctx.parsed(file);
            if (parsed.isEmpty() || parsed.get().heritage().isEmpty()) {
                continue;
            }
            Map<String, ParsedFile.Symbol> byQualifiedName = parsed.get().symbols().stream()
                    .collect(Collectors.toMap(ParsedFile.Symbol::qualifiedName, Function.identity(), (a, b) -> a));

            for (ParsedFile.HeritageClause clause : parsed.get().heritage()) {
                ParsedFile.Symbol child = byQualifiedName.get(clause.childQualifiedName());
                if (child == null) {
                    continue;
                }
                String childId = NodeIds.symbol(child.label(), file.path(), child.qualifiedName());
                Optional<SymbolResolver.Resolution> parent = SymbolResolver.resolve(ctx, file.path(),
                        clause.parentName(), HeritageProcessor::isType, label -> true);
                if (parent.isPresent() && !parent.get().nodeId().equals(childId)
                        && graph.addRelationship(GraphRelationship.of(clause.type(), childId,
                        parent.get().nodeId(), parent.get().confidence(), parent.get().reason()))) {
                    linked++;
                }
            }
            band.update(i + 1, files.size(), "Linking inheritance...", null);
        }
        log.info("Heritage: {} edges", linked);
    }

    private static boolean isType(NodeLabel label) {
        return label == NodeLabel.CLASS || label == NodeLabel.INTERFACE || label == NodeLabel.TYPE;
    }
}
