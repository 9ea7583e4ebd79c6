package com.vidnyan.codegraph.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Freshness record persisted next to a snapshot: relative path → content hash and mtime.
 */
public record FileManifest(Map<String, Entry> files) {

    public FileManifest {
        files = files == null ? Map.of() : Map.copyOf(files);
    }

    public static FileManifest empty() {
        return new FileManifest(Map.of());
    }

    /**
     * @param hash  SHA-256 hex digest of the UTF-8 content
     * @param mtime last modification time in epoch milliseconds
     */
    public record Entry(String hash, long mtime) {}

    public Optional<Entry> get(String path) {
        return Optional.ofNullable(files.get(path));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Entry> files = new TreeMap<>();

        public Builder put(String path, String hash, long mtime) {
            files.put(path, new Entry(hash, mtime));
            return this;
        }

        public FileManifest build() {
            return new FileManifest(files);
        }
    }
}
