package com.e2eq.skos.core;

import java.util.List;
import java.util.Optional;

/**
 * Document-level declarations captured once per run: the base declaration, the
 * prefix lines and the ConceptScheme block (kept as opaque text).
 */
public record DocumentHeader(Optional<String> baseDeclaration,
                             Optional<String> baseUri,
                             List<String> prefixDeclarations,
                             Optional<String> conceptScheme) {

    public static DocumentHeader empty() {
        return new DocumentHeader(Optional.empty(), Optional.empty(), List.of(), Optional.empty());
    }
}
