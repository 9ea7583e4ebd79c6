package com.vidnyan.codegraph.ingestion.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lexical view of a source file used by the script and Python scanners.
 * <p>
 * {@link #masked()} is the content with comments and string literals blanked
 * out. Blanking keeps every offset and line break in place, so positions found
 * in the masked text are valid in the original content.
 */
final class SourceText {

    enum Style { C_LIKE, PYTHON }

    private final String content;
    private final String masked;
    private final int[] lineStarts;

    SourceText(String content, Style style) {
        this.content = content;
        this.masked = style == Style.PYTHON ? maskPython(content) : maskCLike(content);
        this.lineStarts = computeLineStarts(content);
    }

    String content() {
        return content;
    }

    String masked() {
        return masked;
    }

    /**
     * True when the character at {@code offset} is code rather than comment or string.
     */
    boolean isCode(int offset) {
        return offset < content.length() && masked.charAt(offset) == content.charAt(offset)
                && !Character.isWhitespace(content.charAt(offset));
    }

    /**
     * 1-based line of an offset.
     */
    int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    int lineCount() {
        return lineStarts.length;
    }

    /**
     * Masked text of a 1-based line, without the line terminator.
     */
    String maskedLine(int line) {
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : masked.length();
        return masked.substring(start, Math.max(start, end));
    }

    /**
     * Offset of the bracket closing the one at {@code openIndex}, or -1.
     */
    int matchingClose(int openIndex) {
        char open = masked.charAt(openIndex);
        char close = switch (open) {
            case '{' -> '}';
            case '(' -> ')';
            case '[' -> ']';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + open);
        };
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Brace depth at {@code offset} relative to {@code from}.
     */
    int braceDepth(int from, int offset) {
        int depth = 0;
        for (int i = from; i < offset; i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth;
    }

    /**
     * Index of the first non-whitespace character at or after {@code from}, or -1.
     */
    int skipWhitespace(int from) {
        for (int i = from; i < masked.length(); i++) {
            if (!Character.isWhitespace(masked.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static String maskCLike(String s) {
        StringBuilder out = new StringBuilder(s);
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (c == '/' && i + 1 < n && s.charAt(i + 1) == '/') {
                while (i < n && s.charAt(i) != '\n') {
                    blank(out, i++);
                }
            } else if (c == '/' && i + 1 < n && s.charAt(i + 1) == '*') {
                int end = s.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                while (i < stop) {
                    blank(out, i++);
                }
            } else if (c == '"' || c == '\'' || c == '`') {
                i = maskQuoted(s, out, i, c, c != '`');
            } else {
                i++;
            }
        }
        return out.toString();
    }

    private static String maskPython(String s) {
        StringBuilder out = new StringBuilder(s);
        int i = 0;
        int n = s.length();
        while (i < n) {
            char c = s.charAt(i);
            if (c == '#') {
                while (i < n && s.charAt(i) != '\n') {
                    blank(out, i++);
                }
            } else if ((c == '"' || c == '\'') && s.startsWith(String.valueOf(c).repeat(3), i)) {
                String delimiter = String.valueOf(c).repeat(3);
                int end = s.indexOf(delimiter, i + 3);
                int stop = end < 0 ? n : end + 3;
                while (i < stop) {
                    blank(out, i++);
                }
            } else if (c == '"' || c == '\'') {
                i = maskQuoted(s, out, i, c, true);
            } else {
                i++;
            }
        }
        return out.toString();
    }

    private static int maskQuoted(String s, StringBuilder out, int start, char quote, boolean stopAtNewline) {
        int n = s.length();
        blank(out, start);
        int i = start + 1;
        while (i < n) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < n) {
                blank(out, i++);
                blank(out, i++);
                continue;
            }
            if (c == quote) {
                blank(out, i);
                return i + 1;
            }
            if (c == '\n' && stopAtNewline) {
                return i;
            }
            blank(out, i++);
        }
        return i;
    }

    private static void blank(StringBuilder out, int index) {
        if (out.charAt(index) != '\n') {
            out.setCharAt(index, ' ');
        }
    }
}
