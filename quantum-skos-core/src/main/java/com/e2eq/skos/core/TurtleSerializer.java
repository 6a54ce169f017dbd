package com.e2eq.skos.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the cleaned document: base declaration, prefixes, the concept scheme block
 * and one block per concept. Literal text gets a final punctuation-spacing pass.
 */
public final class TurtleSerializer {

    static final List<String> DEFAULT_PREFIXES = List.of(
            "@prefix skos: <http://www.w3.org/2004/02/skos/core#> .",
            "@prefix esco: <http://data.europa.eu/esco/> .");
    static final String INDENT = "    ";

    private final UriCanonicalizer canonicalizer;
    private final TextNormalizer normalizer;
    private final CleaningRun run;

    public TurtleSerializer(UriCanonicalizer canonicalizer, TextNormalizer normalizer, CleaningRun run) {
        this.canonicalizer = canonicalizer;
        this.normalizer = normalizer;
        this.run = run;
    }

    public String serialize(List<Concept> concepts, DocumentHeader header) {
        List<String> lines = new ArrayList<>();
        header.baseDeclaration().ifPresent(lines::add);
        lines.addAll(header.prefixDeclarations().isEmpty() ? DEFAULT_PREFIXES : header.prefixDeclarations());
        lines.add("");
        header.conceptScheme().ifPresent(scheme -> {
            lines.add(scheme);
            lines.add("");
        });
        for (Concept concept : concepts) {
            lines.add(format(concept));
            lines.add("");
        }
        return String.join("\n", lines);
    }

    String format(Concept concept) {
        List<String> properties = new ArrayList<>();
        for (TextProperty property : TextProperty.values()) {
            for (LangString value : concept.values(property)) {
                properties.add(property.predicate() + " " + literal(value));
                count(property);
            }
        }
        for (String prop : concept.otherProperties()) {
            String tidy = StatementTokenizer.tidy(prop);
            if (!tidy.isEmpty()) properties.add(tidy);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(canonicalizer.toToken(concept.uri())).append(" a skos:Concept ;");
        for (int i = 0; i < properties.size(); i++) {
            sb.append('\n').append(INDENT).append(properties.get(i)).append(i < properties.size() - 1 ? " ;" : " .");
        }
        return sb.toString();
    }

    private String literal(LangString value) {
        String text = escape(normalizer.fixPunctuationSpacing(value.text()));
        String language = value.language();
        return "\"" + text + "\"" + (language == null || language.isEmpty() ? "" : "@" + language);
    }

    private void count(TextProperty property) {
        switch (property) {
            case PREF_LABEL:
            case ALT_LABEL:
                run.increment(Statistic.LABELS_PROCESSED);
                break;
            case DEFINITION:
                run.increment(Statistic.DEFINITIONS_PROCESSED);
                break;
            case EXAMPLE:
                break;
            default:
                run.increment(Statistic.NOTES_PROCESSED);
        }
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
