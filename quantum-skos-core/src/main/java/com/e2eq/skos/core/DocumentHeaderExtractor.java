package com.e2eq.skos.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the document-level declarations: {@code @base}, {@code @prefix} lines and the
 * ConceptScheme block.
 */
public final class DocumentHeaderExtractor {
    private DocumentHeaderExtractor() {}

    private static final Pattern BASE = Pattern.compile("(@base\\s+<([^>]+)>\\s*\\.)");
    private static final String SCHEME_MARKER = "a skos:ConceptScheme";

    public static DocumentHeader extract(String content) {
        Optional<String> baseDeclaration = Optional.empty();
        Optional<String> baseUri = Optional.empty();
        Matcher m = BASE.matcher(content);
        if (m.find()) {
            baseDeclaration = Optional.of(m.group(1));
            baseUri = Optional.of(m.group(2));
        }

        List<String> prefixes = new ArrayList<>();
        String scheme = null;
        List<String> schemeLines = new ArrayList<>();
        boolean inScheme = false;
        for (String raw : content.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("@prefix")) {
                prefixes.add(line);
                continue;
            }
            if (line.contains(SCHEME_MARKER)) {
                inScheme = true;
                schemeLines.clear();
                schemeLines.add(line);
                if (line.endsWith(" .")) {
                    scheme = String.join("\n    ", schemeLines);
                    inScheme = false;
                }
            } else if (inScheme) {
                schemeLines.add(line);
                if (line.endsWith(" .") || line.equals(".")) {
                    scheme = String.join("\n    ", schemeLines);
                    inScheme = false;
                }
            }
        }
        return new DocumentHeader(baseDeclaration, baseUri, List.copyOf(prefixes), Optional.ofNullable(scheme));
    }
}
