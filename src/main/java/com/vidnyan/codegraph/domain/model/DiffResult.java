package com.vidnyan.codegraph.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classification of changed paths since the last snapshot.
 */
public record DiffResult(
    Set<String> added,
    Set<String> modified,
    Set<String> deleted,
    @JsonProperty("isGitRepo") boolean isGitRepo
) {

    public DiffResult {
        added = Set.copyOf(added != null ? added : Set.of());
        modified = Set.copyOf(modified != null ? modified : Set.of());
        deleted = Set.copyOf(deleted != null ? deleted : Set.of());
    }

    public static DiffResult empty(boolean isGitRepo) {
        return new DiffResult(Set.of(), Set.of(), Set.of(), isGitRepo);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && deleted.isEmpty();
    }

    /**
     * Paths whose previous graph content must be discarded.
     */
    public Set<String> changedOrDeleted() {
        Set<String> paths = new LinkedHashSet<>(modified);
        paths.addAll(deleted);
        return paths;
    }

    /**
     * Paths that need to be read and re-parsed, sorted for deterministic processing.
     */
    public Set<String> addedOrModified() {
        Set<String> paths = new TreeSet<>(added);
        paths.addAll(modified);
        return paths;
    }

    public int totalChanges() {
        return added.size() + modified.size() + deleted.size();
    }

    @Override
    public String toString() {
        return String.format("DiffResult[added=%d, modified=%d, deleted=%d, git=%s]",
                added.size(), modified.size(), deleted.size(), isGitRepo);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates raw change events. A path that is both deleted and added
     * (rename back to an old name, untracked re-creation) ends up as modified.
     */
    public static class Builder {
        private final Set<String> added = new TreeSet<>();
        private final Set<String> modified = new TreeSet<>();
        private final Set<String> deleted = new TreeSet<>();
        private boolean gitRepo;

        public Builder added(String path) { added.add(path); return this; }
        public Builder modified(String path) { modified.add(path); return this; }
        public Builder deleted(String path) { deleted.add(path); return this; }
        public Builder gitRepo(boolean gitRepo) { this.gitRepo = gitRepo; return this; }

        public DiffResult build() {
            Set<String> both = new TreeSet<>(added);
            both.retainAll(deleted);
            added.removeAll(both);
            deleted.removeAll(both);
            modified.addAll(both);
            added.removeAll(modified);
            deleted.removeAll(modified);
            return new DiffResult(added, modified, deleted, gitRepo);
        }
    }
}
