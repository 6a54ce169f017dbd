package com.e2eq.skos.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A single predicate-object statement of a concept block, e.g.
 * {@code skos:broader <31>} or {@code skos:prefLabel "Foo"@en , "Bar"@de}.
 */
public record Statement(String predicate, String objects) {

    private static final Pattern PREFIXED_NAME = Pattern.compile("[A-Za-z][\\w.-]*:[^\\s,;<>\"]*");

    /**
     * A quoted literal and its language tag (null when untagged).
     */
    public record Literal(String text, String language) {}

    public static Statement parse(String text) {
        String t = text == null ? "" : text.trim();
        int ws = indexOfWhitespace(t);
        if (ws < 0) return new Statement(t, "");
        return new Statement(t.substring(0, ws), t.substring(ws).trim());
    }

    public String text() {
        return objects.isEmpty() ? predicate : predicate + " " + objects;
    }

    public boolean hasPredicate(String name) {
        return predicate.equals(name);
    }

    /**
     * Identifier tokens among the objects, as written: bracketed IRIs (with their
     * brackets) and prefixed names. Literals and datatype tags are skipped.
     */
    public List<String> identifiers() {
        List<String> ids = new ArrayList<>();
        scan(objects, null, ids);
        return ids;
    }

    public List<Literal> literals() {
        List<Literal> literals = new ArrayList<>();
        scan(objects, literals, null);
        return literals;
    }

    private static void scan(String s, List<Literal> literals, List<String> ids) {
        int n = s.length();
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);
            if (c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < n && s.charAt(i) != '"') {
                    char ch = s.charAt(i);
                    if (ch == '\\' && i + 1 < n) {
                        sb.append(unescape(s.charAt(i + 1)));
                        i += 2;
                        continue;
                    }
                    sb.append(ch);
                    i++;
                }
                i++; // closing quote
                String language = null;
                if (i < n && s.charAt(i) == '@') {
                    int start = ++i;
                    while (i < n && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '-')) i++;
                    language = s.substring(start, i);
                } else if (s.startsWith("^^", i)) {
                    i += 2;
                    if (i < n && s.charAt(i) == '<') {
                        int end = s.indexOf('>', i);
                        i = end < 0 ? n : end + 1;
                    } else {
                        while (i < n && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != ',') i++;
                    }
                }
                if (literals != null) literals.add(new Literal(sb.toString(), language));
            } else if (c == '<') {
                int end = s.indexOf('>', i);
                int stop = end < 0 ? n : end + 1;
                if (ids != null && end >= 0) ids.add(s.substring(i, stop));
                i = stop;
            } else if (Character.isWhitespace(c) || c == ',') {
                i++;
            } else {
                int start = i;
                while (i < n && !Character.isWhitespace(s.charAt(i)) && s.charAt(i) != ',') i++;
                String token = s.substring(start, i);
                if (ids != null && PREFIXED_NAME.matcher(token).matches()) ids.add(token);
            }
        }
    }

    private static char unescape(char c) {
        switch (c) {
            case 't': return '\t';
            case 'n': return '\n';
            case 'r': return '\r';
            default: return c;
        }
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }
}
