package com.e2eq.skos.core;

/**
 * Counters maintained for a single cleaning run.
 */
public enum Statistic {
    TOTAL_CONCEPTS("Total concepts processed"),
    BLOCKS_WITHOUT_SUBJECT("Blocks without concept declaration"),
    CONCEPTS_WITHOUT_PREFLABEL("Concepts without prefLabel"),
    STRAY_STATEMENTS_DROPPED("Statements after a concept terminator dropped"),
    DUPLICATES_REMOVED("Duplicates removed"),
    MALFORMED_URIS_FIXED("Malformed URIs fixed"),
    URI_NORMALIZATIONS("URI normalizations"),
    ENCODING_ISSUES_FIXED("Encoding issues fixed"),
    TEXT_FIELDS_CLEANED("Text fields cleaned"),
    EMPTY_VALUES_REMOVED("Empty labels removed"),
    COMMA_FIXES("Comma spacing fixes"),
    LABELS_SEEN("Labels parsed"),
    TEXT_VALUES_SEEN("Text values parsed"),
    LABELS_PROCESSED("Labels checked"),
    DEFINITIONS_PROCESSED("Definitions processed"),
    NOTES_PROCESSED("Notes processed"),
    BROADER_LINKS_ADDED("Broader links added"),
    CHUNKS_PROCESSED("Chunks processed"),
    FINAL_CONCEPTS("Final concepts in output");

    private final String label;

    Statistic(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
