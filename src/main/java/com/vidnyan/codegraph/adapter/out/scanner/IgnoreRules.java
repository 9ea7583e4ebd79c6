package com.vidnyan.codegraph.adapter.out.scanner;

import com.vidnyan.codegraph.domain.snapshot.SnapshotFormat;

import java.util.Locale;
import java.util.Set;

/**
 * Paths never ingested or tracked: tooling and dependency directories, binary
 * and data files, lock files, dotfiles and generated bundles.
 */
public final class IgnoreRules {

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
            ".git", ".svn", ".hg", "node_modules", "bower_components", "vendor",
            "venv", ".venv", "__pycache__", ".pytest_cache", ".mypy_cache",
            "dist", "build", "out", "target", ".next", ".nuxt", ".vercel",
            "coverage", ".nyc_output", "logs", "tmp", "temp", "cache", ".cache",
            ".idea", ".vscode", ".vs", ".gradle", SnapshotFormat.DIRECTORY);

    private static final Set<String> IGNORED_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".svg", ".ico", ".webp", ".bmp",
            ".zip", ".tar", ".gz", ".rar", ".7z",
            ".exe", ".dll", ".so", ".dylib", ".o", ".obj", ".class", ".jar",
            ".pyc", ".pyo", ".wasm", ".node",
            ".pdf", ".doc", ".docx", ".xls", ".xlsx",
            ".mp4", ".mp3", ".wav", ".mov", ".avi",
            ".woff", ".woff2", ".ttf", ".eot", ".otf",
            ".db", ".sqlite", ".sqlite3",
            ".map", ".lock",
            ".pem", ".key", ".crt",
            ".csv", ".parquet", ".h5", ".pkl", ".pickle",
            ".bin", ".dat", ".iso", ".img", ".dmg");

    private static final Set<String> IGNORED_FILES = Set.of(
            "package-lock.json", "yarn.lock", "pnpm-lock.yaml", "bun.lockb", "cargo.lock", "poetry.lock",
            "gemfile.lock", "composer.lock", "thumbs.db", "license", "license.md", "license.txt",
            "changelog.md");

    private static final String[] GENERATED_MARKERS = {".min.js", ".min.css", ".bundle.", ".chunk.", ".generated.", ".d.ts"};

    private IgnoreRules() {
    }

    /**
     * Directories by name; every dot-directory is ignored too.
     */
    public static boolean isIgnoredDirectory(String name) {
        return IGNORED_DIRECTORIES.contains(name) || name.startsWith(".");
    }

    public static boolean isIgnoredFile(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith(".") || IGNORED_FILES.contains(lower)) {
            return true;
        }
        for (String marker : GENERATED_MARKERS) {
            if (lower.endsWith(marker) || (marker.endsWith(".") && lower.contains(marker))) {
                return true;
            }
        }
        int dot = lower.lastIndexOf('.');
        return dot >= 0 && IGNORED_EXTENSIONS.contains(lower.substring(dot));
    }

    /**
     * @param relativePath '/'-separated path relative to the project root
     */
    public static boolean isIgnoredPath(String relativePath) {
        String[] segments = relativePath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (isIgnoredDirectory(segments[i])) {
                return true;
            }
        }
        return isIgnoredFile(segments[segments.length - 1]);
    }
}
