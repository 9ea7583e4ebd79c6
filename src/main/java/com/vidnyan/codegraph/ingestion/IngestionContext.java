package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.domain.model.FileEntry;
import com.vidnyan.codegraph.domain.pipeline.CancellationToken;
import com.vidnyan.codegraph.ingestion.language.ParsedFile;
import com.vidnyan.codegraph.ingestion.language.SourceParsers;
import lombok.Getter;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Explicit state shared by the phases of one pipeline run.
 * A context is never reused across runs.
 */
@Getter
public final class IngestionContext {

    private final SymbolTable symbolTable = new SymbolTable();
    private final ImportMap importMap = new ImportMap();
    private final ParseCache parseCache;
    private final SourceParsers parsers;
    private final CancellationToken cancellationToken;
    private final ProgressReporter progress;
    private final PipelineSettings settings;
    /** Every path of the project after this run, changed or not. */
    private final Set<String> allPaths;

    public IngestionContext(SourceParsers parsers, PipelineSettings settings, CancellationToken cancellationToken,
                            ProgressReporter progress, Set<String> allPaths) {
        this.parsers = parsers;
        this.settings = settings;
        this.parseCache = new ParseCache(settings.parseCacheSize());
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.none();
        this.progress = progress;
        this.allPaths = new TreeSet<>(allPaths);
    }

    /**
     * Parsed form of a file from the cache, re-parsing on a miss.
     */
    public Optional<ParsedFile> parsed(FileEntry file) {
        Optional<ParsedFile> cached = parseCache.get(file.path());
        if (cached.isPresent()) {
            return cached;
        }
        Optional<ParsedFile> parsed = parsers.parse(file);
        parsed.ifPresent(parseCache::put);
        return parsed;
    }

    public void checkCancelled(String where) {
        cancellationToken.throwIfCancelled(where);
    }
}
