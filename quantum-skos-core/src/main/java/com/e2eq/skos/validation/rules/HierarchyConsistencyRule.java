package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.HierarchyCodes;
import com.e2eq.skos.core.HierarchyIndex;
import com.e2eq.skos.core.Concept;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Checks the code-derived hierarchy: every code prefix should exist as a concept,
 * a concept should be broader-linked to at least one existing prefix, and, when
 * {@code warnMissingNarrower} is set, linked parents should list the child as narrower.
 * Needs every concept at once.
 */
public final class HierarchyConsistencyRule implements ValidationRule {

    static final String NO_TARGETS = "none";

    @Override
    public String name() {
        return "hierarchy";
    }

    @Override
    public Scope scope() {
        return Scope.GLOBAL;
    }

    @Override
    public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
        HierarchyIndex index = HierarchyIndex.of(concepts);
        if (index.isEmpty()) return RuleOutcome.empty();

        boolean warnMissingNarrower = context.options().isWarnMissingNarrower();
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, String> entry : index.codeToUri().entrySet()) {
            String code = entry.getKey();
            String uri = entry.getValue();
            List<String> candidates = HierarchyCodes.parentCandidates(code);
            if (candidates.isEmpty()) continue;

            for (String parent : candidates) {
                if (!index.hasCode(parent)) {
                    findings.add(Finding.warning(FindingCategory.HIERARCHY_GAP,
                            "Hierarchy gap: <" + uri + "> (code " + code + ") is missing intermediate level concept '"
                                    + parent + "'. Suggestion: Add concept '" + parent
                                    + "' or adjust codes to reflect intended hierarchy."));
                }
            }

            Set<String> broader = index.broaderCodes(code);
            SortedSet<String> existing = new TreeSet<>(index.existingCandidates(code));
            if (!existing.isEmpty() && Collections.disjoint(broader, existing)) {
                List<String> candidateUris = existing.stream().map(c -> token(index, c)).collect(Collectors.toList());
                String found = broader.isEmpty()
                        ? NO_TARGETS
                        : new TreeSet<>(broader).stream().map(c -> token(index, c)).collect(Collectors.joining(", "));
                findings.add(Finding.violation(FindingCategory.HIERARCHY_MISSING_BROADER,
                        "Inconsistent hierarchy: <" + uri + "> (code " + code + ") has no skos:broader to any prefix among "
                                + candidateUris + ". Found broader targets: " + found + ". "
                                + "Suggestion: Add a skos:broader to one of its prefix concepts (e.g., "
                                + candidateUris.get(0) + ")."));
            }

            if (!warnMissingNarrower) continue;
            for (String parent : existing) {
                if (broader.contains(parent) && !index.narrowerCodes(parent).contains(code)) {
                    findings.add(Finding.info(FindingCategory.HIERARCHY_PARENT_MISSING_NARROWER,
                            "Parent missing skos:narrower: " + token(index, parent) + " should include <" + uri
                                    + "> (code " + code + ") as narrower. "
                                    + "Suggestion: Add 'skos:narrower <" + uri + ">' to parent."));
                }
            }
        }
        return RuleOutcome.of(findings);
    }

    private static String token(HierarchyIndex index, String code) {
        return "<" + index.uriOf(code).orElse(code) + ">";
    }
}
