package com.vidnyan.codegraph.query;

import com.vidnyan.codegraph.exception.GraphQueryException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits query text into tokens. Keywords are returned as identifiers and
 * recognized case-insensitively by the parser.
 */
final class QueryLexer {

    private static final String[] SYMBOLS = {
            "<>", "<=", ">=", "->", "<-", "!=",
            "(", ")", "[", "]", "{", "}", ":", ",", ".", "|", "-", "<", ">", "=", "*"
    };

    private final String text;
    private int pos;

    QueryLexer(String text) {
        this.text = text;
    }

    List<QueryToken> tokenize() {
        List<QueryToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new QueryToken(QueryToken.Type.EOF, "", pos, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private QueryToken next() {
        char c = text.charAt(pos);
        int start = pos;
        if (Character.isLetter(c) || c == '_') {
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            return new QueryToken(QueryToken.Type.IDENTIFIER, text.substring(start, pos), start, pos);
        }
        if (c == '`') {
            int close = text.indexOf('`', pos + 1);
            if (close < 0) {
                throw new GraphQueryException("Unterminated quoted identifier", start);
            }
            pos = close + 1;
            return new QueryToken(QueryToken.Type.IDENTIFIER, text.substring(start + 1, close), start, pos);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(c, start);
        }
        for (String symbol : SYMBOLS) {
            if (text.startsWith(symbol, pos)) {
                pos += symbol.length();
                return new QueryToken(QueryToken.Type.SYMBOL, symbol, start, pos);
            }
        }
        throw new GraphQueryException("Unexpected character '" + c + "'", start);
    }

    private QueryToken number(int start) {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        boolean decimal = false;
        if (pos + 1 < text.length() && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
            decimal = true;
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        return new QueryToken(decimal ? QueryToken.Type.DECIMAL : QueryToken.Type.INTEGER,
                text.substring(start, pos), start, pos);
    }

    private QueryToken string(char quote, int start) {
        StringBuilder value = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == quote) {
                return new QueryToken(QueryToken.Type.STRING, value.toString(), start, pos);
            }
            if (c == '\\' && pos < text.length()) {
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        throw new GraphQueryException("Unterminated string literal", start);
    }

    private void skipWhitespaceAndComments() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (text.startsWith("//", pos)) {
                int newline = text.indexOf('\n', pos);
                pos = newline < 0 ? text.length() : newline + 1;
            } else {
                return;
            }
        }
    }
}
