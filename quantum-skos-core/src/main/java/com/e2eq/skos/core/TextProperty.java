package com.e2eq.skos.core;

import java.util.Optional;

/**
 * The literal-valued SKOS predicates modeled on {@link Concept}. Declaration order is
 * the order in which values are serialized.
 */
public enum TextProperty {
    PREF_LABEL("skos:prefLabel", true),
    ALT_LABEL("skos:altLabel", true),
    DEFINITION("skos:definition", false),
    NOTE("skos:note", false),
    SCOPE_NOTE("skos:scopeNote", false),
    EDITORIAL_NOTE("skos:editorialNote", false),
    HISTORY_NOTE("skos:historyNote", false),
    CHANGE_NOTE("skos:changeNote", false),
    EXAMPLE("skos:example", false);

    private final String predicate;
    private final boolean label;

    TextProperty(String predicate, boolean label) {
        this.predicate = predicate;
        this.label = label;
    }

    public String predicate() {
        return predicate;
    }

    /**
     * Labels are short controlled terms and get the narrower label cleaning.
     */
    public boolean isLabel() {
        return label;
    }

    public static Optional<TextProperty> forPredicate(String predicate) {
        for (TextProperty p : values()) {
            if (p.predicate.equals(predicate)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
