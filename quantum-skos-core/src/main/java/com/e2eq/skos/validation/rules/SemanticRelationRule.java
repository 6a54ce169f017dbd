package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.HierarchyIndex;
import com.e2eq.skos.core.Statement;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Broader/related disjointness (S27) and mutually broader concept pairs.
 * Only two-node cycles are reported.
 */
public final class SemanticRelationRule implements ValidationRule {

    static final String RELATED = "skos:related";

    private record Link(String source, String target) {
        Link reversed() {
            return new Link(target, source);
        }
    }

    @Override
    public String name() {
        return "semantic-relations";
    }

    @Override
    public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
        Set<Link> broader = new LinkedHashSet<>();
        Set<Link> related = new LinkedHashSet<>();
        for (Concept concept : concepts) {
            for (String prop : concept.otherProperties()) {
                Statement st = Statement.parse(prop);
                Set<Link> into;
                if (st.hasPredicate(HierarchyIndex.BROADER)) {
                    into = broader;
                } else if (st.hasPredicate(RELATED)) {
                    into = related;
                } else {
                    continue;
                }
                for (String id : st.identifiers()) {
                    into.add(new Link(concept.uri(), context.canonicalizer().canonicalize(id)));
                }
            }
        }

        List<Finding> findings = new ArrayList<>();
        for (Link link : broader) {
            if (related.contains(link)) {
                findings.add(Finding.violation(FindingCategory.S27_BROADER_RELATED_CONFLICT,
                        "S27 Violation: <" + link.source() + "> has both skos:broader and skos:related to <"
                                + link.target() + ">. "
                                + "Suggestion: Use either broader or related, but not both for the same concept pair."));
            }
        }
        for (Link link : broader) {
            if (!link.source().equals(link.target()) && broader.contains(link.reversed())) {
                findings.add(Finding.warning(FindingCategory.SIMPLE_HIERARCHY_CYCLE,
                        "Simple cycle detected: <" + link.source() + "> and <" + link.target() + "> are mutually broader. "
                                + "Suggestion: Remove one of the broader relations to create a proper hierarchy."));
            }
        }
        return RuleOutcome.of(findings);
    }
}
