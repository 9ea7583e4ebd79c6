package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.ingestion.IngestionContext;
import com.vidnyan.codegraph.ingestion.SymbolTable;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Resolves a referenced name to a declared symbol: same file first, then the
 * files the referencing file imports, then a unique project-wide match.
 */
final class SymbolResolver {

    static final double SAME_FILE_CONFIDENCE = 0.95;
    static final double IMPORT_CONFIDENCE = 0.9;
    static final double GLOBAL_CONFIDENCE = 0.5;

    static final String SAME_FILE = "same-file";
    static final String IMPORT_RESOLVED = "import-resolved";
    static final String FUZZY_GLOBAL = "fuzzy-global";

    record Resolution(String nodeId, double confidence, String reason) {}

    private SymbolResolver() {
    }

    static Optional<Resolution> resolve(IngestionContext ctx, String filePath, String name,
                                        Predicate<NodeLabel> accepted, Predicate<NodeLabel> preferred) {
        SymbolTable table = ctx.getSymbolTable();

        Optional<SymbolTable.Definition> local = pick(table.lookupInFile(filePath, name), accepted, preferred);
        if (local.isPresent()) {
            return Optional.of(new Resolution(local.get().nodeId(), SAME_FILE_CONFIDENCE, SAME_FILE));
        }

        for (String imported : ctx.getImportMap().importsOf(filePath)) {
            Optional<SymbolTable.Definition> viaImport = pick(table.lookupInFile(imported, name), accepted, preferred);
            if (viaImport.isPresent()) {
                return Optional.of(new Resolution(viaImport.get().nodeId(), IMPORT_CONFIDENCE, IMPORT_RESOLVED));
            }
        }

        List<SymbolTable.Definition> global = table.lookupGlobal(name).stream()
                .filter(d -> accepted.test(d.label()))
                .toList();
        if (global.size() == 1) {
            return Optional.of(new Resolution(global.get(0).nodeId(), GLOBAL_CONFIDENCE, FUZZY_GLOBAL));
        }
        return Optional.empty();
    }

    private static Optional<SymbolTable.Definition> pick(List<SymbolTable.Definition> candidates,
                                                         Predicate<NodeLabel> accepted,
                                                         Predicate<NodeLabel> preferred) {
        Optional<SymbolTable.Definition> best = candidates.stream()
                .filter(d -> accepted.test(d.label()) && preferred.test(d.label()))
                .findFirst();
        return best.isPresent() ? best : candidates.stream().filter(d -> accepted.test(d.label())).findFirst();
    }
}
