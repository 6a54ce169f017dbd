package com.e2eq.skos.validation;

/**
 * Category attached to every finding when it is created. The summary reports the
 * sixteen summarized categories in declaration order, zeros included.
 */
public enum FindingCategory {
    S14_PREF_LABEL_DUPLICATES("S14 prefLabel duplicates"),
    S13_PREF_ALT_OVERLAP("S13 pref/alt overlap"),
    URI_FORMAT_INVALID("URI format invalid"),
    LANGUAGE_TAG_INVALID("Language tag possibly invalid"),
    S27_BROADER_RELATED_CONFLICT("S27 broader+related conflict"),
    SIMPLE_HIERARCHY_CYCLE("Simple hierarchy cycles"),
    HIERARCHY_GAP("Hierarchy gap (missing intermediate level)"),
    HIERARCHY_MISSING_BROADER("Hierarchy: missing broader to prefix"),
    HIERARCHY_PARENT_MISSING_NARROWER("Hierarchy: parent missing narrower"),
    SCHEME_TOP_CONCEPT_WITHOUT_IN_SCHEME("Scheme: topConceptOf without inScheme"),
    SCHEME_TOP_CONCEPT_NOT_A_CONCEPT("Scheme: hasTopConcept -> non-Concept"),
    SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME("Scheme: hasTopConcept target missing inScheme"),
    LABEL_TOO_LONG("Label warning: very long"),
    LABEL_EMPTY("Label warning: empty"),
    LABEL_ENCODING_ISSUE("Label warning: encoding issue"),
    LABEL_LOOKS_LIKE_URI("Label warning: looks like URI"),
    // reported in the finding lists only
    SKOS_XL_URI_CONFLICT("SKOS-XL label URI conflict", false),
    SKOS_XL_ORPHANED_LABEL("SKOS-XL orphaned label", false);

    private final String label;
    private final boolean summarized;

    FindingCategory(String label) {
        this(label, true);
    }

    FindingCategory(String label, boolean summarized) {
        this.label = label;
        this.summarized = summarized;
    }

    public String label() {
        return label;
    }

    public boolean summarized() {
        return summarized;
    }
}
