package com.e2eq.skos.core;

import java.util.*;

/**
 * One vocabulary entry reconstructed from a concept block.
 * <p>
 * Literal values are kept per {@link TextProperty}; every other statement of the
 * block is kept verbatim in {@link #otherProperties()} so that relations survive
 * a round trip without being interpreted.
 * </p>
 */
public final class Concept {

    private final String uri;
    private final Map<TextProperty, List<LangString>> values = new EnumMap<>(TextProperty.class);
    private final List<String> otherProperties = new ArrayList<>();
    private final List<String> issues = new ArrayList<>();
    private boolean frozen;

    public Concept(String uri) {
        this.uri = Objects.requireNonNull(uri, "uri");
        for (TextProperty p : TextProperty.values()) {
            values.put(p, new ArrayList<>());
        }
    }

    public String uri() {
        return uri;
    }

    public List<LangString> values(TextProperty property) {
        return Collections.unmodifiableList(values.get(property));
    }

    /**
     * Appends a value unless the same text and language is already present.
     */
    public boolean addValue(TextProperty property, LangString value) {
        checkMutable();
        List<LangString> list = values.get(property);
        if (list.contains(value)) return false;
        return list.add(value);
    }

    public List<LangString> prefLabels() {
        return values(TextProperty.PREF_LABEL);
    }

    public List<LangString> altLabels() {
        return values(TextProperty.ALT_LABEL);
    }

    public List<LangString> definitions() {
        return values(TextProperty.DEFINITION);
    }

    public List<LangString> notes() {
        return values(TextProperty.NOTE);
    }

    public List<LangString> scopeNotes() {
        return values(TextProperty.SCOPE_NOTE);
    }

    public List<LangString> editorialNotes() {
        return values(TextProperty.EDITORIAL_NOTE);
    }

    public List<LangString> historyNotes() {
        return values(TextProperty.HISTORY_NOTE);
    }

    public List<LangString> changeNotes() {
        return values(TextProperty.CHANGE_NOTE);
    }

    public List<LangString> examples() {
        return values(TextProperty.EXAMPLE);
    }

    public boolean hasPrefLabel() {
        return !values.get(TextProperty.PREF_LABEL).isEmpty();
    }

    public List<String> otherProperties() {
        return Collections.unmodifiableList(otherProperties);
    }

    public void addOtherProperty(String statement) {
        checkMutable();
        otherProperties.add(statement);
    }

    public List<String> issues() {
        return Collections.unmodifiableList(issues);
    }

    public void addIssue(String issue) {
        checkMutable();
        issues.add(issue);
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Marks the concept as final; every later mutation throws {@link IllegalStateException}.
     */
    void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Concept " + uri + " is part of a completed run and can no longer be modified");
        }
    }

    @Override
    public String toString() {
        return "Concept{" + uri + ", prefLabels=" + prefLabels() + '}';
    }
}
