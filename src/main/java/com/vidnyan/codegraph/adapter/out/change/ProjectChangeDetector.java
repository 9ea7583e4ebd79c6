package com.vidnyan.codegraph.adapter.out.change;

import com.vidnyan.codegraph.application.port.out.ChangeDetector;
import com.vidnyan.codegraph.domain.model.DiffResult;
import com.vidnyan.codegraph.domain.model.FileManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Git strategy first when a commit was recorded; any failure falls back to the
 * manifest strategy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectChangeDetector implements ChangeDetector {

    private final GitChangeDetector gitDetector;
    private final ManifestChangeDetector manifestDetector;

    @Override
    public DiffResult detectChanges(Path projectRoot, String gitCommit, FileManifest manifest) {
        if (gitCommit != null && !gitCommit.isBlank()) {
            try {
                return gitDetector.detect(projectRoot, gitCommit);
            } catch (ChangeDetectionException e) {
                log.warn("Falling back to manifest change detection: {}", e.getMessage());
            }
        }
        return manifestDetector.detect(projectRoot, manifest != null ? manifest : FileManifest.empty());
    }

    @Override
    public Optional<String> currentCommit(Path projectRoot) {
        return gitDetector.headCommit(projectRoot);
    }

    @Override
    public FileManifest buildManifest(Path projectRoot, Map<String, String> fileContents) {
        return manifestDetector.buildManifest(projectRoot, fileContents);
    }
}
