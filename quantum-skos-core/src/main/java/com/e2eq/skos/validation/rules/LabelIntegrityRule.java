package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.LangString;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Label integrity: at most one prefLabel per language (S14), disjoint pref and alt
 * labels (S13), plus label quality warnings.
 */
public final class LabelIntegrityRule implements ValidationRule {

    static final int MAX_LABEL_LENGTH = 500;
    static final int PREVIEW_LENGTH = 50;
    private static final List<String> ENCODING_RESIDUE = List.of("Ã¤", "Ã¶", "Ã¼", "ÃŸ");

    @Override
    public String name() {
        return "label-integrity";
    }

    @Override
    public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
        List<Finding> findings = new ArrayList<>();
        for (Concept concept : concepts) {
            checkPrefLabelPerLanguage(concept, findings);
            checkPrefAltOverlap(concept, findings);
            List<LangString> labels = new ArrayList<>(concept.prefLabels());
            labels.addAll(concept.altLabels());
            for (LangString label : labels) {
                checkQuality(concept.uri(), label.text(), findings);
            }
        }
        return RuleOutcome.of(findings);
    }

    private static void checkPrefLabelPerLanguage(Concept concept, List<Finding> findings) {
        Map<String, List<String>> byLanguage = new LinkedHashMap<>();
        for (LangString label : concept.prefLabels()) {
            byLanguage.computeIfAbsent(label.language(), k -> new ArrayList<>()).add(label.text());
        }
        for (Map.Entry<String, List<String>> e : byLanguage.entrySet()) {
            List<String> texts = e.getValue();
            if (texts.size() > 1) {
                String listed = texts.stream().map(t -> "\"" + t + "\"").collect(Collectors.joining(", "));
                findings.add(Finding.violation(FindingCategory.S14_PREF_LABEL_DUPLICATES,
                        "S14 Violation: <" + concept.uri() + "> has " + texts.size() + " prefLabels for language '"
                                + e.getKey() + "': " + listed + ". "
                                + "Suggestion: Keep only one prefLabel per language, move others to altLabel."));
            }
        }
    }

    private static void checkPrefAltOverlap(Concept concept, List<Finding> findings) {
        Set<LangString> alt = new HashSet<>(concept.altLabels());
        List<String> overlap = new ArrayList<>();
        for (LangString pref : concept.prefLabels()) {
            if (alt.contains(pref)) {
                overlap.add("\"" + pref.text() + "\"@" + pref.language());
            }
        }
        if (!overlap.isEmpty()) {
            findings.add(Finding.violation(FindingCategory.S13_PREF_ALT_OVERLAP,
                    "S13 Violation: <" + concept.uri() + "> has overlapping prefLabel/altLabel: "
                            + String.join(", ", overlap) + ". "
                            + "Suggestion: Remove duplicate from altLabel or use different preferred term."));
        }
    }

    private static void checkQuality(String uri, String text, List<Finding> findings) {
        int length = text.codePointCount(0, text.length());
        if (length > MAX_LABEL_LENGTH) {
            String preview = text.substring(0, text.offsetByCodePoints(0, PREVIEW_LENGTH));
            findings.add(Finding.warning(FindingCategory.LABEL_TOO_LONG,
                    "Very long label (" + length + " chars) in <" + uri + ">: '" + preview + "...'. "
                            + "Suggestion: Consider shortening or using skos:definition for detailed descriptions."));
        }
        if (text.isEmpty()) {
            findings.add(Finding.warning(FindingCategory.LABEL_EMPTY,
                    "Empty label in <" + uri + ">. Suggestion: Remove empty label or provide meaningful text."));
        }
        if (ENCODING_RESIDUE.stream().anyMatch(text::contains)) {
            findings.add(Finding.warning(FindingCategory.LABEL_ENCODING_ISSUE,
                    "Potential encoding issue in <" + uri + ">: '" + text + "'. "
                            + "Suggestion: Check UTF-8 encoding of source data."));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            findings.add(Finding.warning(FindingCategory.LABEL_LOOKS_LIKE_URI,
                    "Label looks like URI in <" + uri + ">: '" + text + "'. "
                            + "Suggestion: Use skos:exactMatch for URI mappings instead."));
        }
    }
}
