package com.e2eq.skos.core;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a concept block into logical statements. A statement ends at a {@code ;}
 * or at a terminating {@code .} (followed by whitespace or the end of the block)
 * found outside quotes and angle brackets; line breaks inside a statement are
 * joined with a space. Quoted literals never span lines.
 */
public final class StatementTokenizer {
    private StatementTokenizer() {}

    /**
     * Statements of one subject's description, plus whatever text followed its
     * terminating {@code .}.
     */
    public record Terminated(List<String> statements, String remainder) {}

    public static List<String> split(String block) {
        List<String> statements = new ArrayList<>();
        if (block == null || block.isEmpty()) return statements;
        scan(block, statements, false);
        return statements;
    }

    /**
     * Like {@link #split(String)} but stops at the first terminating {@code .}; the
     * text after it is returned untouched as the remainder.
     */
    public static Terminated splitFirst(String block) {
        List<String> statements = new ArrayList<>();
        if (block == null || block.isEmpty()) return new Terminated(statements, "");
        int end = scan(block, statements, true);
        return new Terminated(statements, block.substring(end));
    }

    // returns the index just past the terminator when stopping, else the block length
    private static int scan(String block, List<String> statements, boolean stopAtTerminator) {
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        boolean inIri = false;
        int n = block.length();
        for (int i = 0; i < n; i++) {
            char c = block.charAt(i);
            if (c == '\n' || c == '\r') {
                // line-oriented: an unterminated literal or IRI ends with its line
                inQuote = false;
                inIri = false;
                current.append(' ');
                continue;
            }
            if (inQuote) {
                current.append(c);
                if (c == '\\' && i + 1 < n && block.charAt(i + 1) != '\n') {
                    current.append(block.charAt(++i));
                } else if (c == '"') {
                    inQuote = false;
                }
                continue;
            }
            if (inIri) {
                current.append(c);
                if (c == '>') inIri = false;
                continue;
            }
            switch (c) {
                case '"':
                    inQuote = true;
                    current.append(c);
                    break;
                case '<':
                    inIri = true;
                    current.append(c);
                    break;
                case '#':
                    if (current.length() == 0 || Character.isWhitespace(current.charAt(current.length() - 1))) {
                        while (i + 1 < n && block.charAt(i + 1) != '\n') i++;
                    } else {
                        current.append(c);
                    }
                    break;
                case ';':
                    flush(current, statements);
                    break;
                case '.':
                    if (i + 1 == n || Character.isWhitespace(block.charAt(i + 1))) {
                        flush(current, statements);
                        if (stopAtTerminator) return i + 1;
                    } else {
                        current.append(c);
                    }
                    break;
                default:
                    current.append(c);
            }
        }
        flush(current, statements);
        return n;
    }

    /**
     * Trims a statement and strips trailing separators so it can be re-emitted
     * with a fresh terminator. Whitespace runs are collapsed outside quoted literals only.
     */
    public static String tidy(String statement) {
        String t = StringUtils.stripEnd(statement.trim(), " ;.,");
        return collapseOutsideQuotes(t).trim();
    }

    private static String collapseOutsideQuotes(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuote) {
                out.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(text.charAt(++i));
                } else if (c == '"') {
                    inQuote = false;
                }
            } else if (Character.isWhitespace(c)) {
                if (out.length() == 0 || out.charAt(out.length() - 1) != ' ') out.append(' ');
            } else {
                if (c == '"') inQuote = true;
                out.append(c);
            }
        }
        return out.toString();
    }

    private static void flush(StringBuilder current, List<String> statements) {
        String t = tidy(current.toString());
        if (!t.isEmpty()) statements.add(t);
        current.setLength(0);
    }
}
