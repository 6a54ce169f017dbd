package com.e2eq.skos.spi;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.util.List;

/**
 * A family of structural checks over the cleaned concept list. Rules are read-only
 * and deterministic: they report findings in the order they discover them and never
 * modify the concepts they inspect.
 */
public interface ValidationRule {

    enum Scope {
        /** Findings depend on one concept (or pairs inside the list); safe to run per chunk. */
        PER_CHUNK,
        /** Needs every concept at once; always run over the full list. */
        GLOBAL
    }

    String name();

    /**
     * Evaluate this rule.
     *
     * @param concepts concepts to inspect; a chunk when {@link #scope()} is PER_CHUNK
     * @return findings, possibly empty, never null
     */
    RuleOutcome validate(List<Concept> concepts, ValidationContext context);

    default Scope scope() {
        return Scope.PER_CHUNK;
    }

    default boolean isEnabled(CleanerOptions options) {
        return true;
    }
}
