package com.vidnyan.codegraph.ingestion.language;

import com.vidnyan.codegraph.domain.model.FileEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry dispatching a file to the parser of its language.
 */
@Slf4j
@Component
public class SourceParsers {

    private final Map<SourceLanguage, SourceParser> byLanguage = new EnumMap<>(SourceLanguage.class);

    public SourceParsers(List<SourceParser> parsers) {
        for (SourceParser parser : parsers) {
            parser.languages().forEach(language -> byLanguage.put(language, parser));
        }
    }

    /**
     * Parsers for every supported language.
     */
    public static SourceParsers defaults() {
        return new SourceParsers(List.of(new JavaSourceParser(), new ScriptSourceParser(), new PythonSourceParser()));
    }

    public boolean supports(String path) {
        return SourceLanguage.fromPath(path).map(byLanguage::containsKey).orElse(false);
    }

    /**
     * Parses a file, or returns empty when its language is unsupported or parsing fails.
     */
    public Optional<ParsedFile> parse(FileEntry file) {
        Optional<SourceLanguage> language = SourceLanguage.fromPath(file.path());
        if (language.isEmpty() || !byLanguage.containsKey(language.get())) {
            return Optional.empty();
        }
        try {
            return Optional.of(byLanguage.get(language.get()).parse(file, language.get()));
        } catch (SourceParseException e) {
            log.debug("Skipping unparseable file {}: {}", file.path(), e.getMessage());
            return Optional.empty();
        }
    }
}
