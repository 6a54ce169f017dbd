package com.e2eq.skos.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options consumed by a cleaning run. Mirrors the YAML document read by
 * {@link CleanerOptionsLoader}; every field has a usable default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CleanerOptions {

    /**
     * Number of concepts per chunk when memory-efficient mode is on.
     * Default: 1000
     */
    @Builder.Default
    private int chunkSize = 1000;

    /**
     * Run the validation rules after cleaning.
     * Default: true
     */
    @Builder.Default
    private boolean validationEnabled = true;

    /**
     * Clean and validate per-concept rules chunk by chunk to bound the working set.
     * Default: false
     */
    @Builder.Default
    private boolean memoryEfficient = false;

    /**
     * Check skosxl label statements.
     * Default: false
     */
    @Builder.Default
    private boolean skosXlEnabled = false;

    /**
     * Append missing skos:broader links to the nearest existing code-prefix parent.
     * Default: false
     */
    @Builder.Default
    private boolean autofixBroader = false;

    /**
     * Report parents lacking an explicit skos:narrower back-link as info findings.
     * Default: false
     */
    @Builder.Default
    private boolean warnMissingNarrower = false;

    /**
     * Language assigned to literals that carry no language tag.
     * Default: en
     */
    @Builder.Default
    private String defaultLanguage = "en";

    /**
     * Additional prefix to namespace expansions used when canonicalizing prefixed names.
     * The esco prefix is always known.
     */
    @Builder.Default
    private Map<String, String> prefixNamespaces = new LinkedHashMap<>();

    public static CleanerOptions defaults() {
        return CleanerOptions.builder().build();
    }

    /**
     * True when a list of the given size should be processed in chunks.
     */
    public boolean chunkedFor(int conceptCount) {
        return memoryEfficient && conceptCount > chunkSize;
    }

    public void validate() {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be a positive integer, was " + chunkSize);
        }
        if (defaultLanguage == null || defaultLanguage.isBlank()) {
            throw new IllegalArgumentException("defaultLanguage must be non-empty");
        }
        if (prefixNamespaces != null) {
            prefixNamespaces.forEach((prefix, ns) -> {
                if (prefix == null || prefix.isBlank() || ns == null || ns.isBlank()) {
                    throw new IllegalArgumentException("Invalid prefix namespace entry '" + prefix + "' -> '" + ns + "'");
                }
            });
        }
    }
}
