package com.vidnyan.codegraph.adapter.out.change;

import com.vidnyan.codegraph.adapter.out.scanner.IgnoreRules;
import com.vidnyan.codegraph.domain.model.DiffResult;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.treewalk.filter.NotIgnoredFilter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Detects changes with JGit: the recorded commit's tree against the working
 * tree, plus untracked files. Git-ignored and rule-ignored paths are skipped.
 */
@Slf4j
@Component
public class GitChangeDetector {

    /** Index of the working tree iterator in the diff's tree walk. */
    private static final int WORKING_TREE_INDEX = 1;

    /**
     * @throws ChangeDetectionException when the root is not a repository, the
     *                                  commit is unknown or JGit fails
     */
    public DiffResult detect(Path projectRoot, String commit) {
        try (Git git = Git.open(projectRoot.toFile())) {
            Repository repo = git.getRepository();
            ObjectId oldTree = repo.resolve(commit + "^{tree}");
            if (oldTree == null) {
                throw new ChangeDetectionException("Unknown commit: " + commit);
            }

            DiffResult.Builder diff = DiffResult.builder().gitRepo(true);
            try (ObjectReader reader = repo.newObjectReader()) {
                CanonicalTreeParser oldParser = new CanonicalTreeParser();
                oldParser.reset(reader, oldTree);

                List<DiffEntry> entries = git.diff()
                        .setOldTree(oldParser)
                        .setNewTree(new FileTreeIterator(repo))
                        .setPathFilter(new NotIgnoredFilter(WORKING_TREE_INDEX))
                        .setShowNameAndStatusOnly(true)
                        .call();

                for (DiffEntry entry : entries) {
                    switch (entry.getChangeType()) {
                        case ADD, COPY -> addIfTracked(diff, entry.getNewPath());
                        case MODIFY -> {
                            if (!IgnoreRules.isIgnoredPath(entry.getNewPath())) {
                                diff.modified(entry.getNewPath());
                            }
                        }
                        case DELETE -> {
                            if (!IgnoreRules.isIgnoredPath(entry.getOldPath())) {
                                diff.deleted(entry.getOldPath());
                            }
                        }
                        case RENAME -> {
                            // rename = delete old + add new
                            if (!IgnoreRules.isIgnoredPath(entry.getOldPath())) {
                                diff.deleted(entry.getOldPath());
                            }
                            addIfTracked(diff, entry.getNewPath());
                        }
                    }
                }
            }

            for (String untracked : git.status().call().getUntracked()) {
                addIfTracked(diff, untracked);
            }

            DiffResult result = diff.build();
            log.debug("Git change detection since {}: {}", commit, result);
            return result;
        } catch (IOException | GitAPIException e) {
            throw new ChangeDetectionException("Git change detection failed: " + e.getMessage(), e);
        }
    }

    /**
     * Commit id of HEAD, empty when the root is not a repository or has no commits.
     */
    public Optional<String> headCommit(Path projectRoot) {
        if (!Files.exists(projectRoot.resolve(".git"))) {
            return Optional.empty();
        }
        try (Git git = Git.open(projectRoot.toFile())) {
            return Optional.ofNullable(git.getRepository().resolve("HEAD")).map(ObjectId::getName);
        } catch (IOException e) {
            log.debug("Cannot resolve HEAD of {}: {}", projectRoot, e.getMessage());
            return Optional.empty();
        }
    }

    private static void addIfTracked(DiffResult.Builder diff, String path) {
        if (!IgnoreRules.isIgnoredPath(path)) {
            diff.added(path);
        }
    }
}
