package com.vidnyan.codegraph.ingestion.language;

import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indentation-aware scanner for Python modules.
 */
@Component
public class PythonSourceParser implements SourceParser {

    private static final Pattern DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CLASS = Pattern.compile("^(\\s*)class\\s+([A-Za-z_]\\w*)\\s*(?:\\((.*?)\\))?\\s*:");
    private static final Pattern ASSIGN = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?::[^=]+)?=(?!=)");
    private static final Pattern IMPORT = Pattern.compile("^\\s*import\\s+(.+)$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^\\s*from\\s+(\\.*[\\w.]*)\\s+import\\s+(.+)$");
    private static final Pattern CALL = Pattern.compile("(?<![\\w])([A-Za-z_]\\w*)\\s*\\(");

    private static final Set<String> KEYWORDS = Set.of(
            "def", "class", "if", "elif", "while", "for", "return", "and", "or", "not", "in", "is",
            "lambda", "with", "assert", "yield", "except", "await", "async", "del", "raise", "import",
            "from", "global", "nonlocal", "pass", "else", "try", "finally", "match", "case");

    private record Scope(int indent, String qualifiedName, boolean isClass) {}

    @Override
    public Set<SourceLanguage> languages() {
        return Set.of(SourceLanguage.PYTHON);
    }

    @Override
    public ParsedFile parse(FileEntry file, SourceLanguage language) {
        SourceText text = new SourceText(file.content(), SourceText.Style.PYTHON);
        ParsedFile.Builder builder = ParsedFile.builder(file.path(), language);
        String[] rawLines = file.content().split("\n", -1);

        Deque<Scope> scopes = new ArrayDeque<>();
        Set<String> qualifiedNames = new HashSet<>();
        Set<String> definitionKeys = new HashSet<>();

        for (int line = 1; line <= text.lineCount(); line++) {
            String masked = text.maskedLine(line);
            if (masked.isBlank()) {
                continue;
            }
            int indent = indentOf(masked);
            while (!scopes.isEmpty() && scopes.peek().indent() >= indent) {
                scopes.pop();
            }
            Scope parent = scopes.peek();

            Matcher def = DEF.matcher(masked);
            Matcher cls = CLASS.matcher(masked);
            if (def.find()) {
                String name = def.group(2);
                boolean method = parent != null && parent.isClass();
                String qualified = parent == null ? name : parent.qualifiedName() + "." + name;
                if (qualifiedNames.add(qualified)) {
                    builder.symbol(new ParsedFile.Symbol(name, qualified, method ? NodeLabel.METHOD : NodeLabel.FUNCTION,
                            line, blockEnd(text, line, indent), !name.startsWith("_"),
                            method ? parent.qualifiedName() : null));
                }
                definitionKeys.add(line + ":" + def.start(2));
                scopes.push(new Scope(indent, qualified, false));
            } else if (cls.find()) {
                String name = cls.group(2);
                String qualified = parent == null ? name : parent.qualifiedName() + "." + name;
                if (qualifiedNames.add(qualified)) {
                    builder.symbol(new ParsedFile.Symbol(name, qualified, NodeLabel.CLASS,
                            line, blockEnd(text, line, indent), !name.startsWith("_"),
                            parent != null && parent.isClass() ? parent.qualifiedName() : null));
                }
                if (cls.group(3) != null) {
                    baseClasses(cls.group(3)).forEach(base ->
                            builder.heritage(new ParsedFile.HeritageClause(qualified, base, RelationshipType.INHERITS)));
                }
                definitionKeys.add(line + ":" + cls.start(2));
                scopes.push(new Scope(indent, qualified, true));
            } else if (indent == 0) {
                Matcher assign = ASSIGN.matcher(masked);
                if (assign.find() && qualifiedNames.add(assign.group(1))) {
                    builder.symbol(new ParsedFile.Symbol(assign.group(1), assign.group(1), NodeLabel.VARIABLE,
                            line, line, !assign.group(1).startsWith("_"), null));
                }
            }

            collectImport(rawLines, line, masked, builder);
            collectCalls(masked, line, definitionKeys, builder);
        }
        return builder.build();
    }

    private static void collectImport(String[] rawLines, int line, String masked, ParsedFile.Builder builder) {
        Matcher from = FROM_IMPORT.matcher(masked);
        if (from.find()) {
            StringBuilder clause = new StringBuilder(from.group(2));
            int next = line;
            while (clause.indexOf("(") >= 0 && clause.indexOf(")") < 0 && next < rawLines.length) {
                clause.append(' ').append(rawLines[next++]);
            }
            String names = clause.toString().replace("(", " ").replace(")", " ").trim();
            boolean wildcard = names.equals("*");
            builder.importSpec(new ParsedFile.ImportSpec(from.group(1), wildcard ? List.of() : aliases(names),
                    wildcard, line));
            return;
        }
        Matcher imp = IMPORT.matcher(masked);
        if (imp.find()) {
            for (String part : imp.group(1).split(",")) {
                String[] alias = part.trim().split("\\s+as\\s+");
                String module = alias[0].trim();
                if (!module.isEmpty()) {
                    String local = alias.length > 1 ? alias[1].trim() : module.split("\\.")[0];
                    builder.importSpec(new ParsedFile.ImportSpec(module, List.of(local), false, line));
                }
            }
        }
    }

    private static void collectCalls(String masked, int line, Set<String> definitionKeys, ParsedFile.Builder builder) {
        Matcher call = CALL.matcher(masked);
        while (call.find()) {
            String name = call.group(1);
            if (KEYWORDS.contains(name) || definitionKeys.contains(line + ":" + call.start(1))) {
                continue;
            }
            int before = call.start(1) - 1;
            boolean member = before >= 0 && masked.charAt(before) == '.';
            builder.call(new ParsedFile.CallSite(name, line, member));
        }
    }

    /**
     * Last line of the block opened on {@code line}: the last non-blank line
     * indented deeper than the header.
     */
    private static int blockEnd(SourceText text, int line, int indent) {
        int end = line;
        for (int next = line + 1; next <= text.lineCount(); next++) {
            String masked = text.maskedLine(next);
            if (masked.isBlank()) {
                continue;
            }
            if (indentOf(masked) <= indent) {
                break;
            }
            end = next;
        }
        return end;
    }

    private static int indentOf(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }

    private static List<String> aliases(String clause) {
        List<String> names = new ArrayList<>();
        for (String part : clause.split(",")) {
            String[] alias = part.trim().split("\\s+as\\s+");
            String local = alias[alias.length - 1].trim();
            if (!local.isEmpty()) {
                names.add(local);
            }
        }
        return names;
    }

    private static List<String> baseClasses(String raw) {
        List<String> bases = new ArrayList<>();
        for (String part : raw.split(",")) {
            String base = part.trim();
            int bracket = base.indexOf('[');
            if (bracket >= 0) {
                base = base.substring(0, bracket);
            }
            if (base.isEmpty() || base.contains("=") || base.equals("object")) {
                continue;
            }
            bases.add(base.substring(base.lastIndexOf('.') + 1));
        }
        return bases;
    }
}
