package com.e2eq.skos.validation;

import com.e2eq.skos.core.DocumentHeader;
import com.e2eq.skos.core.UriCanonicalizer;
import com.e2eq.skos.runtime.CleanerOptions;

/**
 * Read-only inputs shared by the rules of one validation pass.
 */
public record ValidationContext(DocumentHeader header, UriCanonicalizer canonicalizer, CleanerOptions options) {

    public static ValidationContext of(DocumentHeader header, CleanerOptions options) {
        return new ValidationContext(header, UriCanonicalizer.forRun(header, options), options);
    }
}
