package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphNode;
import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.pipeline.PipelineProgress;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.ProgressReporter;
import com.vidnyan.codegraph.ingestion.SymbolTable;
import com.vidnyan.codegraph.ingestion.language.ParsedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol nodes for every parseable file, registered in the symbol table.
 */
@Slf4j
@Component
public class ParsingProcessor {

    public static final String EXPORTED = "exported";

    public void process(KnowledgeGraph graph, List<FileEntry> files, IngestionContext ctx, ProgressReporter.Band band) {
        int parsedCount = 0;
        int skipped = 0;
        for (int i = 0; i < files.size(); i++) {
            ctx.checkCancelled("parsing");
            FileEntry file = files.get(i);
            if (ctx.getParsers().supports(file.path())) {
                Optional<ParsedFile> parsed = ctx.getParsers().parse(file);
                if (parsed.isPresent()) {
                    ctx.getParseCache().put(parsed.get());
                    addSymbols(graph, parsed.get(), ctx.getSymbolTable());
                    parsedCount++;
                } else {
                    skipped++;
                }
            }
            band.update(i + 1, files.size(), "Parsing files...",
                    new PipelineProgress.Stats(i + 1, files.size(), graph.nodeCount()));
        }
        log.info("Parsing: {} files parsed, {} skipped, {} symbols known", parsedCount, skipped,
                ctx.getSymbolTable().size());
    }

    private void addSymbols(KnowledgeGraph graph, ParsedFile parsed, SymbolTable symbols) {
        String path = parsed.filePath();
        String fileId = NodeIds.file(path);
        Map<String, String> idsByQualifiedName = new HashMap<>();

        for (ParsedFile.Symbol symbol : parsed.symbols()) {
            String id = NodeIds.symbol(symbol.label(), path, symbol.qualifiedName());
            idsByQualifiedName.put(symbol.qualifiedName(), id);
            boolean added = graph.addNode(GraphNode.builder(id, symbol.label())
                    .name(symbol.name())
                    .filePath(path)
                    .lines(symbol.startLine(), symbol.endLine())
                    .language(parsed.language().id())
                    .property(EXPORTED, symbol.exported())
                    .build());
            if (added) {
                symbols.add(new SymbolTable.Definition(id, symbol.name(), symbol.label(), path));
            }
        }

        for (ParsedFile.Symbol symbol : parsed.symbols()) {
            String id = idsByQualifiedName.get(symbol.qualifiedName());
            String ownerId = symbol.ownerQualifiedName() != null
                    ? idsByQualifiedName.get(symbol.ownerQualifiedName())
                    : null;
            String containerId = ownerId != null && isContainer(graph, ownerId) ? ownerId : fileId;
            graph.addRelationship(GraphRelationship.of(RelationshipType.CONTAINS, containerId, id, 1.0, ""));
        }
    }

    private static boolean isContainer(KnowledgeGraph graph, String id) {
        return graph.getNode(id)
                .map(n -> n.label() == NodeLabel.CLASS || n.label() == NodeLabel.INTERFACE)
                .orElse(false);
    }
}
