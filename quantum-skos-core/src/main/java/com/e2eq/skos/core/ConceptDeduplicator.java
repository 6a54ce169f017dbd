package com.e2eq.skos.core;

import org.jboss.logging.Logger;

import java.util.*;

/**
 * Collapses concepts sharing a URI. The first record in parse order wins; later
 * records are dropped without merging their labels.
 */
public final class ConceptDeduplicator {

    private static final Logger LOG = Logger.getLogger(ConceptDeduplicator.class);

    public List<Concept> deduplicate(List<Concept> concepts, CleaningRun run) {
        List<Concept> unique = new ArrayList<>(concepts.size());
        for (Concept concept : concepts) {
            if (run.markSeen(concept.uri())) {
                unique.add(concept);
            } else {
                run.increment(Statistic.DUPLICATES_REMOVED);
                run.logChange("Duplicate removed: " + concept.uri());
                LOG.debugf("Dropped duplicate concept %s", concept.uri());
            }
        }
        return unique;
    }

    /**
     * Alternate strategy: fold all records of one URI into a single concept holding
     * the union of their values, opaque statements and issues in first-seen order.
     */
    public static Concept merge(List<Concept> duplicates) {
        if (duplicates == null || duplicates.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        Concept merged = new Concept(duplicates.get(0).uri());
        Set<String> statements = new LinkedHashSet<>();
        Set<String> issues = new LinkedHashSet<>();
        for (Concept c : duplicates) {
            if (!c.uri().equals(merged.uri())) {
                throw new IllegalArgumentException("Cannot merge <" + c.uri() + "> into <" + merged.uri() + ">");
            }
            for (TextProperty p : TextProperty.values()) {
                c.values(p).forEach(v -> merged.addValue(p, v));
            }
            statements.addAll(c.otherProperties());
            issues.addAll(c.issues());
        }
        statements.forEach(merged::addOtherProperty);
        issues.forEach(merged::addIssue);
        return merged;
    }
}
