package com.vidnyan.codegraph.ingestion;

import com.vidnyan.codegraph.ingestion.language.ParsedFile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache of parsed files, shared by the phases of one run.
 */
public final class ParseCache {

    public static final int DEFAULT_CAPACITY = 50;

    private final Map<String, ParsedFile> entries;

    public ParseCache(int capacity) {
        int max = Math.max(1, capacity);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedFile> eldest) {
                return size() > max;
            }
        };
    }

    public Optional<ParsedFile> get(String path) {
        return Optional.ofNullable(entries.get(path));
    }

    public void put(ParsedFile parsed) {
        entries.put(parsed.filePath(), parsed);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
