package com.vidnyan.codegraph.ingestion.phase;

import com.vidnyan.codegraph.ingestion.language.SourceLanguage;

import java.util.Set;

/**
 * Names of runtime and standard-library functions that never resolve to project symbols.
 */
final class BuiltinNames {

    private static final Set<String> SCRIPT = Set.of(
            "console", "log", "warn", "error", "info", "debug", "setTimeout", "setInterval", "clearTimeout",
            "clearInterval", "parseInt", "parseFloat", "isNaN", "JSON", "parse", "stringify", "Object", "keys",
            "values", "entries", "assign", "freeze", "Array", "isArray", "from", "push", "pop", "shift", "unshift",
            "slice", "splice", "map", "filter", "reduce", "forEach", "find", "findIndex", "some", "every",
            "includes", "indexOf", "join", "split", "concat", "sort", "reverse", "then", "catch", "finally",
            "resolve", "reject", "Promise", "all", "allSettled", "race", "fetch", "String", "Number", "Boolean",
            "Symbol", "Math", "floor", "ceil", "round", "max", "min", "abs", "random", "Date", "now", "toString",
            "toFixed", "trim", "replace", "match", "test", "exec", "substring", "substr", "toLowerCase",
            "toUpperCase", "startsWith", "endsWith", "charAt", "padStart", "padEnd", "Map", "Set", "WeakMap",
            "Error", "TypeError", "addEventListener", "removeEventListener", "querySelector",
            "querySelectorAll", "getElementById", "useState", "useEffect", "useCallback", "useMemo", "useRef",
            "useContext", "encodeURIComponent", "decodeURIComponent", "structuredClone", "alert");

    private static final Set<String> PYTHON = Set.of(
            "print", "len", "range", "str", "int", "float", "list", "dict", "set", "tuple", "bool", "open",
            "isinstance", "issubclass", "hasattr", "getattr", "setattr", "super", "enumerate", "zip", "map",
            "filter", "sorted", "reversed", "min", "max", "sum", "abs", "any", "all", "type", "repr", "iter",
            "next", "format", "append", "extend", "pop", "items", "keys", "values", "get", "update", "join",
            "split", "strip", "replace", "startswith", "endswith", "lower", "upper", "round", "id", "hash",
            "vars", "dir", "callable", "staticmethod", "classmethod", "property", "Exception", "ValueError",
            "TypeError", "KeyError", "RuntimeError");

    private static final Set<String> JAVA = Set.of(
            "println", "print", "printf", "format", "toString", "equals", "hashCode", "getClass", "valueOf",
            "asList", "stream", "collect", "forEach", "put", "get", "remove", "contains", "containsKey",
            "size", "isEmpty", "length", "charAt", "substring", "append", "trim", "orElse", "orElseThrow",
            "ifPresent", "isPresent", "toList", "String", "Object", "Integer", "Long", "ArrayList", "HashMap",
            "HashSet", "LinkedHashMap", "StringBuilder", "requireNonNull", "info", "debug", "warn", "error",
            "trace", "Exception", "RuntimeException", "IllegalArgumentException", "IllegalStateException");

    private BuiltinNames() {
    }

    static boolean isBuiltin(SourceLanguage language, String name) {
        return switch (language) {
            case TYPESCRIPT, JAVASCRIPT -> SCRIPT.contains(name);
            case PYTHON -> PYTHON.contains(name);
            case JAVA -> JAVA.contains(name);
        };
    }
}
