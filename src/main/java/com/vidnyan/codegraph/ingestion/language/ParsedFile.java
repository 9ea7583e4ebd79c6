package com.vidnyan.codegraph.ingestion.language;

import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;

import java.util.ArrayList;
import java.util.List;

/**
 * Language-neutral extraction result of one source file.
 * Everything later phases need is captured here so that the file text does not
 * have to be parsed again while the entry stays in the parse cache.
 */
public record ParsedFile(
    String filePath,
    SourceLanguage language,
    List<Symbol> symbols,
    List<ImportSpec> imports,
    List<CallSite> calls,
    List<HeritageClause> heritage
) {

    public ParsedFile {
        symbols = List.copyOf(symbols);
        imports = List.copyOf(imports);
        calls = List.copyOf(calls);
        heritage = List.copyOf(heritage);
    }

    /**
     * A declared symbol.
     *
     * @param qualifiedName name qualified by its enclosing types, unique within the file
     * @param ownerQualifiedName qualified name of the enclosing class or interface, null at top level
     */
    public record Symbol(
        String name,
        String qualifiedName,
        NodeLabel label,
        int startLine,
        int endLine,
        boolean exported,
        String ownerQualifiedName
    ) {

        public boolean contains(int line) {
            return line >= startLine && line <= endLine;
        }

        public int span() {
            return endLine - startLine;
        }
    }

    /**
     * @param specifier module specifier as written (relative path, dotted module, Java FQN)
     * @param importedNames local names brought in, empty for side-effect or wildcard imports
     * @param wildcard true for {@code import a.b.*} and {@code from x import *}
     */
    public record ImportSpec(String specifier, List<String> importedNames, boolean wildcard, int line) {

        public ImportSpec {
            importedNames = List.copyOf(importedNames);
        }
    }

    /**
     * @param memberCall true when the callee was reached through a receiver ({@code a.b()})
     */
    public record CallSite(String calleeName, int line, boolean memberCall) {}

    public record HeritageClause(String childQualifiedName, String parentName, RelationshipType type) {}

    public static Builder builder(String filePath, SourceLanguage language) {
        return new Builder(filePath, language);
    }

    public static class Builder {
        private final String filePath;
        private final SourceLanguage language;
        private final List<Symbol> symbols = new ArrayList<>();
        private final List<ImportSpec> imports = new ArrayList<>();
        private final List<CallSite> calls = new ArrayList<>();
        private final List<HeritageClause> heritage = new ArrayList<>();

        private Builder(String filePath, SourceLanguage language) {
            this.filePath = filePath;
            this.language = language;
        }

        public Builder symbol(Symbol symbol) { symbols.add(symbol); return this; }
        public Builder importSpec(ImportSpec spec) { imports.add(spec); return this; }
        public Builder call(CallSite call) { calls.add(call); return this; }
        public Builder heritage(HeritageClause clause) { heritage.add(clause); return this; }

        public List<Symbol> symbols() {
            return symbols;
        }

        public ParsedFile build() {
            return new ParsedFile(filePath, language, symbols, imports, calls, heritage);
        }
    }
}
