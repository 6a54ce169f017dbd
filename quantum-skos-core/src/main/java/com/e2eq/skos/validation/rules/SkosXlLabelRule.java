package com.e2eq.skos.validation.rules;

import com.e2eq.skos.core.Concept;
import com.e2eq.skos.core.Statement;
import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.Finding;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;

import java.util.*;

/**
 * SKOS-XL label checks, enabled by {@link CleanerOptions#isSkosXlEnabled()}.
 * <p>
 * Label references are collected over the whole list before orphans are looked
 * for, so the order of concepts does not matter.
 * </p>
 */
public final class SkosXlLabelRule implements ValidationRule {

    static final Set<String> LABEL_PREDICATES = Set.of("skosxl:prefLabel", "skosxl:altLabel", "skosxl:hiddenLabel");
    static final String LITERAL_FORM = "skosxl:literalForm";

    @Override
    public String name() {
        return "skos-xl-labels";
    }

    @Override
    public Scope scope() {
        return Scope.GLOBAL;
    }

    @Override
    public boolean isEnabled(CleanerOptions options) {
        return options.isSkosXlEnabled();
    }

    @Override
    public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
        Set<String> conceptUris = new HashSet<>();
        for (Concept c : concepts) {
            conceptUris.add(c.uri());
        }

        List<Finding> findings = new ArrayList<>();
        Set<String> referencedLabels = new HashSet<>();
        for (Concept concept : concepts) {
            for (String prop : concept.otherProperties()) {
                Statement st = Statement.parse(prop);
                if (!LABEL_PREDICATES.contains(st.predicate())) continue;
                for (String id : st.identifiers()) {
                    String label = context.canonicalizer().canonicalize(id);
                    referencedLabels.add(label);
                    if (conceptUris.contains(label)) {
                        findings.add(Finding.warning(FindingCategory.SKOS_XL_URI_CONFLICT,
                                "SKOS-XL label URI <" + label + "> conflicts with concept URI in <" + concept.uri() + ">. "
                                        + "Suggestion: Use different namespace for XL labels."));
                    }
                }
            }
        }

        for (Concept concept : concepts) {
            boolean hasLiteralForm = concept.otherProperties().stream()
                    .anyMatch(p -> Statement.parse(p).hasPredicate(LITERAL_FORM));
            if (hasLiteralForm && !referencedLabels.contains(concept.uri())) {
                findings.add(Finding.warning(FindingCategory.SKOS_XL_ORPHANED_LABEL,
                        "Orphaned SKOS-XL label <" + concept.uri() + "> not referenced by any concept. "
                                + "Suggestion: Link to concept via skosxl:prefLabel/altLabel/hiddenLabel."));
            }
        }
        return RuleOutcome.of(findings);
    }
}
