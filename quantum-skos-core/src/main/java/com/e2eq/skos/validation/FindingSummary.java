package com.e2eq.skos.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-category finding counts. Every summarized category is listed, in declaration
 * order, whether or not it has findings.
 */
public final class FindingSummary {
    private FindingSummary() {}

    @SafeVarargs
    public static Map<FindingCategory, Integer> summarize(Collection<Finding>... findingLists) {
        Map<FindingCategory, Integer> summary = new LinkedHashMap<>();
        for (FindingCategory category : FindingCategory.values()) {
            if (category.summarized()) summary.put(category, 0);
        }
        for (Collection<Finding> findings : findingLists) {
            for (Finding f : findings) {
                summary.computeIfPresent(f.category(), (k, v) -> v + 1);
            }
        }
        return Collections.unmodifiableMap(summary);
    }

    /**
     * Same counts keyed by the category labels.
     */
    public static Map<String, Integer> byLabel(Map<FindingCategory, Integer> summary) {
        Map<String, Integer> labelled = new LinkedHashMap<>();
        summary.forEach((category, count) -> labelled.put(category.label(), count));
        return Collections.unmodifiableMap(labelled);
    }
}
