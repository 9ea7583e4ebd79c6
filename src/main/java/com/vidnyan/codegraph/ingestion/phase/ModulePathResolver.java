package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.ingestion.language.ParsedFile;
import com.vidnyan.codegraph.ingestion.language.SourceLanguage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps an import specifier to the project files it refers to.
 */
final class ModulePathResolver {

    private static final List<String> SCRIPT_EXTENSIONS =
            List.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".mts", ".cts");

    private final Set<String> allPaths;

    ModulePathResolver(Set<String> allPaths) {
        this.allPaths = allPaths;
    }

    Set<String> resolve(String fromPath, SourceLanguage language, ParsedFile.ImportSpec spec) {
        return switch (language) {
            case TYPESCRIPT, JAVASCRIPT -> resolveScript(fromPath, spec.specifier());
            case PYTHON -> resolvePython(fromPath, spec);
            case JAVA -> resolveJava(spec);
        };
    }

    /**
     * Java files of the same package, visible without an import.
     */
    Set<String> samePackage(String fromPath) {
        String dir = directoryOf(fromPath);
        Set<String> result = new LinkedHashSet<>();
        for (String path : allPaths) {
            if (!path.equals(fromPath) && path.endsWith(".java") && directoryOf(path).equals(dir)) {
                result.add(path);
            }
        }
        return result;
    }

    private Set<String> resolveScript(String fromPath, String specifier) {
        String base;
        if (specifier.startsWith(".")) {
            base = normalize(join(directoryOf(fromPath), specifier));
        } else if (specifier.startsWith("@/") || specifier.startsWith("~/")) {
            base = "src/" + specifier.substring(2);
        } else {
            return Set.of();
        }
        if (base == null) {
            return Set.of();
        }

        List<String> candidates = new ArrayList<>();
        candidates.add(base);
        String stem = stripScriptExtension(base);
        for (String ext : SCRIPT_EXTENSIONS) {
            candidates.add(stem + ext);
        }
        for (String ext : SCRIPT_EXTENSIONS) {
            candidates.add(base + "/index" + ext);
        }
        return firstExisting(candidates);
    }

    private Set<String> resolvePython(String fromPath, ParsedFile.ImportSpec spec) {
        String specifier = spec.specifier();
        int dots = 0;
        while (dots < specifier.length() && specifier.charAt(dots) == '.') {
            dots++;
        }
        String module = specifier.substring(dots).replace('.', '/');

        Set<String> result = new LinkedHashSet<>();
        if (dots > 0) {
            String dir = directoryOf(fromPath);
            for (int i = 1; i < dots && dir != null; i++) {
                dir = parentOf(dir);
            }
            if (dir == null) {
                return Set.of();
            }
            String base = module.isEmpty() ? dir : join(dir, module);
            if (!module.isEmpty()) {
                result.addAll(firstExisting(List.of(base + ".py", join(base, "__init__.py"))));
            }
            // from . import sub / from .pkg import sub
            for (String name : spec.importedNames()) {
                result.addAll(firstExisting(List.of(join(base, name + ".py"), join(join(base, name), "__init__.py"))));
            }
            if (result.isEmpty() && module.isEmpty()) {
                result.addAll(firstExisting(List.of(join(base, "__init__.py"))));
            }
            return result;
        }

        result.addAll(bySuffix(module + ".py"));
        if (result.isEmpty()) {
            result.addAll(bySuffix(module + "/__init__.py"));
        }
        for (String name : spec.importedNames()) {
            result.addAll(bySuffix(module + "/" + name + ".py"));
        }
        return result;
    }

    private Set<String> resolveJava(ParsedFile.ImportSpec spec) {
        String path = spec.specifier().replace('.', '/');
        if (spec.wildcard()) {
            Set<String> result = new LinkedHashSet<>();
            for (String candidate : allPaths) {
                if (candidate.endsWith(".java") && ("/" + directoryOf(candidate)).endsWith("/" + path)) {
                    result.add(candidate);
                }
            }
            return result;
        }
        // a.b.Outer.Inner lives in a/b/Outer.java
        String current = path;
        while (!current.isEmpty()) {
            Set<String> found = bySuffix(current + ".java");
            if (!found.isEmpty()) {
                return found;
            }
            int slash = current.lastIndexOf('/');
            if (slash < 0) {
                break;
            }
            current = current.substring(0, slash);
        }
        return Set.of();
    }

    private Set<String> firstExisting(List<String> candidates) {
        for (String candidate : candidates) {
            if (allPaths.contains(candidate)) {
                return Set.of(candidate);
            }
        }
        return Set.of();
    }

    /**
     * The shortest project path equal to or ending in {@code /suffix}.
     */
    private Set<String> bySuffix(String suffix) {
        return allPaths.stream()
                .filter(p -> p.equals(suffix) || p.endsWith("/" + suffix))
                .min(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()))
                .map(Set::of)
                .orElse(Set.of());
    }

    private static String stripScriptExtension(String path) {
        for (String ext : SCRIPT_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return path.substring(0, path.length() - ext.length());
            }
        }
        return path;
    }

    static String directoryOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String parentOf(String dir) {
        if (dir.isEmpty()) {
            return null;
        }
        return directoryOf(dir);
    }

    private static String join(String dir, String child) {
        return dir.isEmpty() ? child : dir + "/" + child;
    }

    /**
     * Collapses {@code .} and {@code ..} segments; null when the path escapes the root.
     */
    static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
}
