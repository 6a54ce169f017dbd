package com.e2eq.skos.validation.rules;

import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.e2eq.skos.validation.rules.RuleFixtures.concept;
import static org.junit.jupiter.api.Assertions.*;

class SchemeConsistencyRuleTest {

    private static final String SCHEME = "<scheme> a skos:ConceptScheme ;\n    skos:hasTopConcept <1>, <2>, <99> .";

    private final SchemeConsistencyRule rule = new SchemeConsistencyRule();

    @Test
    void testTopConceptMembership() {
        RuleOutcome outcome = rule.validate(List.of(
                concept("http://ex.org/1", "skos:inScheme <scheme>", "skos:topConceptOf <scheme>"),
                concept("http://ex.org/2", "skos:topConceptOf <http://ex.org/scheme>"),
                concept("http://ex.org/3", "skos:inScheme <http://ex.org/scheme>", "skos:topConceptOf <scheme>")),
                RuleFixtures.context(CleanerOptions.defaults(), SCHEME));

        assertEquals(3, outcome.violations().size());
        assertEquals(FindingCategory.SCHEME_TOP_CONCEPT_WITHOUT_IN_SCHEME, outcome.violations().get(0).category());
        assertEquals("Concept <http://ex.org/2> has topConceptOf <http://ex.org/scheme> but is missing inScheme <http://ex.org/scheme>",
                outcome.violations().get(0).message());
        assertEquals(FindingCategory.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME, outcome.violations().get(1).category());
        assertEquals("Concept <http://ex.org/2> is hasTopConcept of <scheme> but missing inScheme <scheme>",
                outcome.violations().get(1).message());
        assertEquals(FindingCategory.SCHEME_TOP_CONCEPT_NOT_A_CONCEPT, outcome.violations().get(2).category());
        assertEquals("hasTopConcept points to non-Concept: <http://ex.org/99>", outcome.violations().get(2).message());
    }

    @Test
    void testWithoutSchemeBlockOnlyTopConceptOfIsChecked() {
        RuleOutcome outcome = rule.validate(List.of(
                concept("http://ex.org/1", "skos:topConceptOf <scheme>")), RuleFixtures.context());
        assertEquals(1, outcome.violations().size());
        assertEquals(FindingCategory.SCHEME_TOP_CONCEPT_WITHOUT_IN_SCHEME, outcome.violations().get(0).category());
    }
}
