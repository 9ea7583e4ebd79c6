package com.vidnyan.codegraph.ingestion.language;

import com.vidnyan.codegraph.domain.graph.NodeLabel;
import com.vidnyan.codegraph.domain.graph.RelationshipType;
import com.vidnyan.codegraph.domain.model.FileEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical scanner for TypeScript and JavaScript.
 * <p>
 * Declarations are matched on the comment- and string-free view of the file and
 * their extent is found by bracket matching. Module specifiers are read from the
 * original text at the same offsets.
 */
@Component
public class ScriptSourceParser implements SourceParser {

    private static final String ID = "[A-Za-z_$][\\w$]*";

    private static final Pattern CLASS = Pattern.compile(
            "\\b(export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?class\\s+(" + ID + ")"
                    + "(?:\\s*<[^{]*?>)?"
                    + "(?:\\s+extends\\s+(" + ID + "(?:\\." + ID + ")*)(?:\\s*<[^{]*?>)?(?:\\([^)]*\\))?)?"
                    + "(?:\\s+implements\\s+([^{]+))?\\s*\\{");
    private static final Pattern INTERFACE = Pattern.compile(
            "\\b(export\\s+)?(?:declare\\s+)?interface\\s+(" + ID + ")(?:\\s*<[^{]*?>)?"
                    + "(?:\\s+extends\\s+([^{]+))?\\s*\\{");
    private static final Pattern FUNCTION = Pattern.compile(
            "\\b(export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(" + ID + ")\\s*(?:<[^(]*?>)?\\s*\\(");
    private static final Pattern VARIABLE = Pattern.compile(
            "\\b(export\\s+)?(?:const|let|var)\\s+(" + ID + ")\\s*(?::[^=;]+?)?=(?![=>])\\s*");
    private static final Pattern TYPE_ALIAS = Pattern.compile(
            "\\b(export\\s+)?(?:declare\\s+)?type\\s+(" + ID + ")\\s*(?:<[^=]*?>)?\\s*=");
    private static final Pattern ENUM = Pattern.compile(
            "\\b(export\\s+)?(?:declare\\s+)?(?:const\\s+)?enum\\s+(" + ID + ")\\s*\\{");
    private static final Pattern MEMBER = Pattern.compile(
            "(?m)^[ \\t]*((?:(?:public|private|protected|static|async|readonly|abstract|override|declare|get|set)\\s+)*)"
                    + "\\*?\\s*(#?" + ID + ")\\s*\\??\\s*(?:<[^(]*?>)?\\s*\\(");
    private static final Pattern MEMBER_ARROW = Pattern.compile(
            "(?m)^[ \\t]*(?:(?:public|private|protected|static|readonly|override)\\s+)*(#?" + ID + ")"
                    + "\\s*(?::[^=;]+?)?=\\s*(?:async\\s+)?(?:\\([^)]*\\)|" + ID + ")\\s*(?::[^=;]+?)?=>");
    private static final Pattern EXPORT_LIST = Pattern.compile("\\bexport\\s*\\{([^}]*)}");
    private static final Pattern EXPORT_DEFAULT = Pattern.compile("\\bexport\\s+default\\s+(" + ID + ")\\s*;?");
    private static final Pattern SINGLE_PARAM_ARROW = Pattern.compile("^" + ID + "\\s*=>");
    private static final Pattern CALL = Pattern.compile("(?<![\\w$])(" + ID + ")\\s*(?:<[^<>()=;]*>)?\\s*\\(");

    private static final Pattern IMPORT_FROM = Pattern.compile(
            "(?m)^[ \\t]*(?:import|export)\\s+(?:type\\s+)?([^;'\"]*?)\\s*from\\s*['\"]([^'\"\\n]+)['\"]");
    private static final Pattern IMPORT_BARE = Pattern.compile("(?m)^[ \\t]*import\\s*['\"]([^'\"\\n]+)['\"]");
    private static final Pattern REQUIRE = Pattern.compile(
            "\\b(?:require|import)\\s*\\(\\s*['\"]([^'\"\\n]+)['\"]\\s*\\)");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "typeof", "instanceof",
            "super", "import", "require", "do", "else", "in", "of", "void", "delete", "await",
            "yield", "async", "with", "case", "throw", "let", "var", "const", "class", "extends",
            "export", "default", "new", "this", "constructor");
    private static final Set<String> MEMBER_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "with", "super", "new",
            "typeof", "await", "yield", "throw", "do", "else");

    @Override
    public Set<SourceLanguage> languages() {
        return Set.of(SourceLanguage.TYPESCRIPT, SourceLanguage.JAVASCRIPT);
    }

    @Override
    public ParsedFile parse(FileEntry file, SourceLanguage language) {
        SourceText text = new SourceText(file.content(), SourceText.Style.C_LIKE);
        Scan scan = new Scan(text, ParsedFile.builder(file.path(), language));

        scan.collectExportedNames();
        scan.collectTypes();
        scan.collectMembers();
        scan.collectFunctions();
        scan.collectVariables();
        scan.collectAliases();
        scan.collectImports();
        scan.collectCalls();
        return scan.builder.build();
    }

    private static final class Scan {
        private final SourceText text;
        private final String masked;
        private final ParsedFile.Builder builder;
        private final Set<String> exportedNames = new HashSet<>();
        private final Set<String> qualifiedNames = new HashSet<>();
        private final Set<Integer> definitionOffsets = new HashSet<>();
        private final List<TypeBody> typeBodies = new ArrayList<>();

        private Scan(SourceText text, ParsedFile.Builder builder) {
            this.text = text;
            this.masked = text.masked();
            this.builder = builder;
        }

        private record TypeBody(String qualifiedName, NodeLabel label, int open, int close) {}

        void collectExportedNames() {
            Matcher m = EXPORT_LIST.matcher(masked);
            while (m.find()) {
                for (String part : m.group(1).split(",")) {
                    String name = part.trim().replaceFirst("^type\\s+", "").split("\\s+as\\s+")[0].trim();
                    if (!name.isEmpty()) {
                        exportedNames.add(name);
                    }
                }
            }
            Matcher d = EXPORT_DEFAULT.matcher(masked);
            while (d.find()) {
                exportedNames.add(d.group(1));
            }
        }

        void collectTypes() {
            Matcher m = CLASS.matcher(masked);
            while (m.find()) {
                String name = m.group(2);
                int open = m.end() - 1;
                int close = text.matchingClose(open);
                if (close < 0 || !addSymbol(name, name, NodeLabel.CLASS, m.start(), close, exported(m, name), null)) {
                    continue;
                }
                definitionOffsets.add(m.start(2));
                typeBodies.add(new TypeBody(name, NodeLabel.CLASS, open, close));
                if (m.group(3) != null) {
                    builder.heritage(new ParsedFile.HeritageClause(name, lastSegment(m.group(3)), RelationshipType.EXTENDS));
                }
                if (m.group(4) != null) {
                    typeList(m.group(4)).forEach(parent ->
                            builder.heritage(new ParsedFile.HeritageClause(name, parent, RelationshipType.IMPLEMENTS)));
                }
            }

            Matcher i = INTERFACE.matcher(masked);
            while (i.find()) {
                String name = i.group(2);
                int open = i.end() - 1;
                int close = text.matchingClose(open);
                if (close < 0 || !addSymbol(name, name, NodeLabel.INTERFACE, i.start(), close, exported(i, name), null)) {
                    continue;
                }
                typeBodies.add(new TypeBody(name, NodeLabel.INTERFACE, open, close));
                if (i.group(3) != null) {
                    typeList(i.group(3)).forEach(parent ->
                            builder.heritage(new ParsedFile.HeritageClause(name, parent, RelationshipType.EXTENDS)));
                }
            }
        }

        void collectMembers() {
            for (TypeBody body : typeBodies) {
                Matcher m = MEMBER.matcher(masked).region(body.open() + 1, body.close());
                while (m.find()) {
                    String name = m.group(2);
                    if (MEMBER_KEYWORDS.contains(name) || text.braceDepth(body.open(), m.start(2)) != 1) {
                        continue;
                    }
                    int paren = m.end() - 1;
                    int parenClose = text.matchingClose(paren);
                    if (parenClose < 0) {
                        continue;
                    }
                    int end = bodyEnd(parenClose, body.label() == NodeLabel.INTERFACE);
                    if (end < 0) {
                        continue;
                    }
                    boolean isPrivate = m.group(1).contains("private") || name.startsWith("#");
                    if (addSymbol(name, body.qualifiedName() + "." + name, NodeLabel.METHOD,
                            m.start(2), end, !isPrivate, body.qualifiedName())) {
                        definitionOffsets.add(m.start(2));
                    }
                }

                Matcher a = MEMBER_ARROW.matcher(masked).region(body.open() + 1, body.close());
                while (a.find()) {
                    String name = a.group(1);
                    if (text.braceDepth(body.open(), a.start(1)) != 1) {
                        continue;
                    }
                    int end = arrowEnd(a.end());
                    if (addSymbol(name, body.qualifiedName() + "." + name, NodeLabel.METHOD,
                            a.start(1), end, !name.startsWith("#"), body.qualifiedName())) {
                        definitionOffsets.add(a.start(1));
                    }
                }
            }
        }

        void collectFunctions() {
            Matcher m = FUNCTION.matcher(masked);
            while (m.find()) {
                String name = m.group(2);
                int paren = m.end() - 1;
                int parenClose = text.matchingClose(paren);
                if (parenClose < 0) {
                    continue;
                }
                int end = bodyEnd(parenClose, false);
                if (end < 0) {
                    // overload signature or ambient declaration
                    continue;
                }
                if (addSymbol(name, name, NodeLabel.FUNCTION, m.start(), end, exported(m, name), null)) {
                    definitionOffsets.add(m.start(2));
                }
            }
        }

        void collectVariables() {
            Matcher m = VARIABLE.matcher(masked);
            while (m.find()) {
                String name = m.group(2);
                int rhs = m.end();
                int end = functionValueEnd(rhs);
                if (end >= 0) {
                    if (addSymbol(name, name, NodeLabel.FUNCTION, m.start(), end, exported(m, name), null)) {
                        definitionOffsets.add(m.start(2));
                    }
                } else if (text.braceDepth(0, m.start()) == 0) {
                    addSymbol(name, name, NodeLabel.VARIABLE, m.start(), statementEnd(rhs), exported(m, name), null);
                }
            }
        }

        void collectAliases() {
            Matcher t = TYPE_ALIAS.matcher(masked);
            while (t.find()) {
                if (text.braceDepth(0, t.start()) == 0) {
                    addSymbol(t.group(2), t.group(2), NodeLabel.TYPE, t.start(), statementEnd(t.end()),
                            exported(t, t.group(2)), null);
                }
            }
            Matcher e = ENUM.matcher(masked);
            while (e.find()) {
                int close = text.matchingClose(e.end() - 1);
                if (close >= 0) {
                    addSymbol(e.group(2), e.group(2), NodeLabel.TYPE, e.start(), close, exported(e, e.group(2)), null);
                }
            }
        }

        void collectImports() {
            String content = text.content();
            Matcher m = IMPORT_FROM.matcher(content);
            while (m.find()) {
                int keyword = m.start() + (m.group().length() - m.group().stripLeading().length());
                if (text.isCode(keyword)) {
                    String clause = m.group(1).trim();
                    builder.importSpec(new ParsedFile.ImportSpec(m.group(2), importedNames(clause),
                            clause.startsWith("*"), text.lineOf(keyword)));
                }
            }
            Matcher bare = IMPORT_BARE.matcher(content);
            while (bare.find()) {
                int keyword = bare.start() + (bare.group().length() - bare.group().stripLeading().length());
                if (text.isCode(keyword)) {
                    builder.importSpec(new ParsedFile.ImportSpec(bare.group(1), List.of(), false, text.lineOf(keyword)));
                }
            }
            Matcher r = REQUIRE.matcher(content);
            while (r.find()) {
                if (text.isCode(r.start())) {
                    builder.importSpec(new ParsedFile.ImportSpec(r.group(1), List.of(), false, text.lineOf(r.start())));
                }
            }
        }

        void collectCalls() {
            Matcher m = CALL.matcher(masked);
            while (m.find()) {
                String name = m.group(1);
                if (KEYWORDS.contains(name) || definitionOffsets.contains(m.start(1))) {
                    continue;
                }
                builder.call(new ParsedFile.CallSite(name, text.lineOf(m.start(1)), precededByDot(m.start(1))));
            }
        }

        private boolean addSymbol(String name, String qualifiedName, NodeLabel label, int start, int end,
                                  boolean exported, String owner) {
            if (!qualifiedNames.add(qualifiedName)) {
                return false;
            }
            builder.symbol(new ParsedFile.Symbol(name, qualifiedName, label,
                    text.lineOf(start), text.lineOf(end), exported, owner));
            return true;
        }

        private boolean exported(Matcher m, String name) {
            return m.group(1) != null || exportedNames.contains(name);
        }

        /**
         * End offset of a body following a parameter list, -1 when there is no body.
         */
        private int bodyEnd(int parenClose, boolean signatureAllowed) {
            for (int i = parenClose + 1; i < masked.length(); i++) {
                char c = masked.charAt(i);
                if (c == '{') {
                    int close = text.matchingClose(i);
                    return close;
                }
                if (c == ';' || c == '}' || (c == '\n' && signatureAllowed && lineEndsSignature(i))) {
                    return signatureAllowed ? i : -1;
                }
                if (c == '=' && i + 1 < masked.length() && masked.charAt(i + 1) == '>') {
                    return -1;
                }
            }
            return -1;
        }

        private boolean lineEndsSignature(int newline) {
            int i = newline - 1;
            while (i >= 0 && Character.isWhitespace(masked.charAt(i))) {
                i--;
            }
            return i >= 0 && masked.charAt(i) != ':' && masked.charAt(i) != ',' && masked.charAt(i) != '|';
        }

        /**
         * End offset when the value at {@code rhs} is a function, -1 otherwise.
         */
        private int functionValueEnd(int rhs) {
            String rest = masked.substring(rhs);
            String stripped = rest.startsWith("async") ? rest.substring(5).stripLeading() : rest;
            int start = rhs + (rest.length() - stripped.length());
            if (stripped.startsWith("function")) {
                int paren = masked.indexOf('(', start);
                int close = paren < 0 ? -1 : text.matchingClose(paren);
                return close < 0 ? -1 : bodyEnd(close, false);
            }
            if (stripped.startsWith("(")) {
                int close = text.matchingClose(start);
                if (close < 0) {
                    return -1;
                }
                int arrow = masked.indexOf("=>", close);
                if (arrow < 0 || !isTypeAnnotation(masked.substring(close + 1, arrow))) {
                    return -1;
                }
                return arrowEnd(arrow + 2);
            }
            Matcher single = SINGLE_PARAM_ARROW.matcher(stripped);
            if (single.find()) {
                return arrowEnd(start + single.end());
            }
            return -1;
        }

        private static boolean isTypeAnnotation(String between) {
            String trimmed = between.trim();
            return trimmed.isEmpty() || (trimmed.startsWith(":") && !trimmed.contains(";") && !trimmed.contains("="));
        }

        private int arrowEnd(int afterArrow) {
            int next = text.skipWhitespace(afterArrow);
            if (next >= 0 && masked.charAt(next) == '{') {
                int close = text.matchingClose(next);
                return close >= 0 ? close : next;
            }
            return statementEnd(afterArrow);
        }

        /**
         * Offset of the first ';' or line break outside brackets, or the end of text.
         */
        private int statementEnd(int from) {
            int depth = 0;
            for (int i = from; i < masked.length(); i++) {
                char c = masked.charAt(i);
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    if (depth == 0) {
                        return i;
                    }
                    depth--;
                } else if (depth == 0 && (c == ';' || c == '\n') && i > from && !continuesOnNextLine(i)) {
                    return i;
                }
            }
            return masked.length() - 1;
        }

        private boolean continuesOnNextLine(int index) {
            if (masked.charAt(index) != '\n') {
                return false;
            }
            int prev = index - 1;
            while (prev >= 0 && (masked.charAt(prev) == ' ' || masked.charAt(prev) == '\t')) {
                prev--;
            }
            return prev >= 0 && "=+-*/&|?:,.(".indexOf(masked.charAt(prev)) >= 0;
        }

        private boolean precededByDot(int offset) {
            int i = offset - 1;
            while (i >= 0 && Character.isWhitespace(masked.charAt(i))) {
                i--;
            }
            return i >= 0 && masked.charAt(i) == '.';
        }
    }

    private static List<String> importedNames(String clause) {
        List<String> names = new ArrayList<>();
        for (String part : clause.replace("{", ",").replace("}", ",").split(",")) {
            String name = part.trim().replaceFirst("^type\\s+", "");
            if (name.isEmpty()) {
                continue;
            }
            String[] alias = name.split("\\s+as\\s+");
            String local = alias[alias.length - 1].trim();
            if (!local.isEmpty() && !local.equals("*")) {
                names.add(local);
            }
        }
        return names;
    }

    private static List<String> typeList(String raw) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (char c : raw.toCharArray()) {
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addTypeName(result, current.toString());
                current.setLength(0);
            } else if (depth == 0) {
                current.append(c);
            }
        }
        addTypeName(result, current.toString());
        return result;
    }

    private static void addTypeName(List<String> result, String raw) {
        String name = raw.trim();
        if (!name.isEmpty()) {
            result.add(lastSegment(name));
        }
    }

    private static String lastSegment(String dotted) {
        return dotted.substring(dotted.lastIndexOf('.') + 1).trim();
    }
}
