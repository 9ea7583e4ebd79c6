package com.vidnyan.codegraph.query;

import java.util.Locale;

/**
 * Lexical token of a graph query.
 *
 * @param start offset of the first character in the query text
 * @param end   offset after the last character
 */
record QueryToken(Type type, String text, int start, int end) {

    enum Type {
        IDENTIFIER,
        STRING,
        INTEGER,
        DECIMAL,
        SYMBOL,
        EOF
    }

    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    boolean isSymbol(String symbol) {
        return type == Type.SYMBOL && text.equals(symbol);
    }

    String upper() {
        return text.toUpperCase(Locale.ROOT);
    }
}
