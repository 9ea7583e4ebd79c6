package com.vidnyan.codegraph.ingestion.language;

import com.vidnyan.codegraph.domain.model.FileEntry;

import java.util.Set;

/**
 * Extracts symbols, imports, call sites and heritage clauses from one file.
 */
public interface SourceParser {

    Set<SourceLanguage> languages();

    /**
     * @throws SourceParseException if the file cannot be parsed at all
     */
    ParsedFile parse(FileEntry file, SourceLanguage language);
}
