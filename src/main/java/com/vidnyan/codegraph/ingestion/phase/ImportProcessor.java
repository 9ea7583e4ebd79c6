package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.GraphRelationship;
import com.vidnyan.codegraph.domain.graph.KnowledgeGraph;
import com.vidnyan.codegraph.domain.graph.NodeIds;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.ProgressReporter;
import com.vidnyan.codegraph.ingestion.language.ParsedFile;
import com.vidnyan.codegraph.ingestion.language.SourceLanguage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * IMPORTS edges between project files; fills the import map used by call and
 * heritage resolution.
 */
@Slf4j
@Component
public class ImportProcessor {

    public static final String REASON = "import-statement";

    public void process(KnowledgeGraph graph, List<FileEntry> files, IngestionContext ctx, ProgressReporter.Band band) {
        ModulePathResolver resolver = new ModulePathResolver(ctx.getAllPaths());
        int resolved = 0;
        int unresolved = 0;

        for (int i = 0; i < files.size(); i++) {
            ctx.checkCancelled("import resolution");
            FileEntry file = files.get(i);
            Optional<ParsedFile> parsed = ctx.parsed(file);
            if (parsed.isEmpty()) {
                continue;
            }
            SourceLanguage language = parsed.get().language();
            for (ParsedFile.ImportSpec spec : parsed.get().imports()) {
                var targets = resolver.resolve(file.path(), language, spec);
                if (targets.isEmpty()) {
                    unresolved++;
                    continue;
                }
                for (String target : targets) {
                    if (target.equals(file.path())) {
                        continue;
                    }
                    ctx.getImportMap().add(file.path(), target);
                    graph.addRelationship(GraphRelationship.of(RelationshipType.IMPORTS,
                            NodeIds.file(file.path()), NodeIds.file(target), 1.0, REASON));
                    resolved++;
                }
            }
            if (language == SourceLanguage.JAVA) {
                resolver.samePackage(file.path()).forEach(peer -> ctx.getImportMap().add(file.path(), peer));
            }
            band.update(i + 1, files.size(), "Resolving imports...", null);
        }
        log.info("Imports: {} resolved, {} external or unresolved", resolved, unresolved);
    }
}
