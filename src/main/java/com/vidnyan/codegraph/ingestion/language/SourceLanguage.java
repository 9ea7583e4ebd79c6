package com.vidnyan.codegraph.ingestion.language;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages the parsing phase understands, detected by file extension.
 */
public enum SourceLanguage {
    JAVA("java", List.of(".java")),
    TYPESCRIPT("typescript", List.of(".ts", ".tsx", ".mts", ".cts")),
    JAVASCRIPT("javascript", List.of(".js", ".jsx", ".mjs", ".cjs")),
    PYTHON("python", List.of(".py"));

    private final String id;
    private final List<String> extensions;

    SourceLanguage(String id, List<String> extensions) {
        this.id = id;
        this.extensions = extensions;
    }

    public String id() {
        return id;
    }

    public List<String> extensions() {
        return extensions;
    }

    public boolean isScript() {
        return this == TYPESCRIPT || this == JAVASCRIPT;
    }

    public static Optional<SourceLanguage> fromPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".d.ts")) {
            return Optional.empty();
        }
        for (SourceLanguage language : values()) {
            for (String ext : language.extensions) {
                if (lower.endsWith(ext)) {
                    return Optional.of(language);
                }
            }
        }
        return Optional.empty();
    }
}
