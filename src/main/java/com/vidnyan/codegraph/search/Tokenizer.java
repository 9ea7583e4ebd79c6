package com.vidnyan.codegraph.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits source text and queries into lowercase terms. Identifiers are
 * split on camelCase and snake_case boundaries and also kept whole.
 */
public final class Tokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9_]+");
    private static final Pattern CAMEL = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])|_+");
    private static final int MIN_LENGTH = 2;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "of", "to", "in", "is", "it", "an", "as", "at", "be", "by", "for", "on",
            "if", "else", "return", "var", "let", "const", "new", "this", "self", "def", "import", "from",
            "public", "private", "protected", "static", "final", "void");

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return terms;
        }
        for (String word : NON_WORD.split(text)) {
            if (word.isEmpty()) {
                continue;
            }
            String[] parts = CAMEL.split(word);
            if (parts.length > 1) {
                addTerm(terms, word);
            }
            for (String part : parts) {
                addTerm(terms, part);
            }
        }
        return terms;
    }

    private static void addTerm(List<String> terms, String raw) {
        String term = raw.toLowerCase(Locale.ROOT);
        if (term.length() >= MIN_LENGTH && !STOP_WORDS.contains(term)) {
            terms.add(term);
        }
    }
}
