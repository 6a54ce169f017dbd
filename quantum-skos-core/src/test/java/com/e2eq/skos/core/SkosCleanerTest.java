package com.e2eq.skos.core;

import com.e2eq.skos.exceptions.CleaningException;
import com.e2eq.skos.runtime.CleanerOptions;
import com.e2eq.skos.spi.ValidationRule;
import com.e2eq.skos.validation.FindingCategory;
import com.e2eq.skos.validation.RuleOutcome;
import com.e2eq.skos.validation.ValidationContext;
import com.e2eq.skos.validation.ValidationEngine;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SkosCleanerTest {

    private static final String HIERARCHY = String.join("\n",
            "@base <http://ex.org/> .",
            "<31> a skos:Concept ;",
            "    skos:prefLabel \"Parent\"@en .",
            "<311> a skos:Concept ;",
            "    skos:prefLabel \"Child\"@en .");

    private static String resource(String path) throws IOException {
        try (InputStream in = SkosCleanerTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "missing fixture " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static CleaningResult clean(String content) {
        return new SkosCleaner(CleanerOptions.defaults()).cleanOrThrow(content);
    }

    @Test
    void testCleansSampleThesaurus() throws IOException {
        CleaningResult result = clean(resource("/thesaurus/occupations.ttl"));

        assertEquals(resource("/thesaurus/occupations-cleaned.ttl"), result.cleanedDocument());
        assertEquals(6, result.count(Statistic.TOTAL_CONCEPTS));
        assertEquals(4, result.count(Statistic.FINAL_CONCEPTS));
        assertEquals(1, result.count(Statistic.DUPLICATES_REMOVED));
        assertEquals(1, result.count(Statistic.CONCEPTS_WITHOUT_PREFLABEL));
        assertEquals(1, result.count(Statistic.MALFORMED_URIS_FIXED));
        assertEquals(1, result.count(Statistic.ENCODING_ISSUES_FIXED));
        assertEquals(1, result.count(Statistic.COMMA_FIXES));
        assertEquals(3, result.count(Statistic.TEXT_FIELDS_CLEANED));
        assertEquals(1, result.count(Statistic.DEFINITIONS_PROCESSED));
        assertEquals(1, result.count(Statistic.NOTES_PROCESSED));

        // 311 declares no broader although 31 and 3 exist
        assertEquals(1, result.violations().size());
        assertEquals(FindingCategory.HIERARCHY_MISSING_BROADER, result.violations().get(0).category());
        assertTrue(result.warnings().isEmpty());
        assertEquals(16, result.summary().size());
        assertEquals(1, result.summary().get(FindingCategory.HIERARCHY_MISSING_BROADER));
    }

    @Test
    void testCleaningIsIdempotent() throws IOException {
        String once = clean(resource("/thesaurus/occupations.ttl")).cleanedDocument();
        CleaningResult twice = clean(once);

        assertEquals(once, twice.cleanedDocument());
        assertEquals(0, twice.count(Statistic.DUPLICATES_REMOVED));
        assertEquals(0, twice.count(Statistic.COMMA_FIXES));
        assertEquals(0, twice.count(Statistic.MALFORMED_URIS_FIXED));
        assertEquals(0, twice.count(Statistic.ENCODING_ISSUES_FIXED));
        assertEquals(0, twice.count(Statistic.TEXT_FIELDS_CLEANED));
    }

    @Test
    void testStatementAfterConceptTerminatorIsNotSerialized() {
        CleaningResult result = clean(String.join("\n",
                "<http://x/31> a skos:Concept ;",
                "    skos:prefLabel \"Parent\"@en .",
                "<http://x/31> skos:narrower <http://x/311> ."));

        assertTrue(result.cleanedDocument().endsWith("<http://x/31> a skos:Concept ;\n    skos:prefLabel \"Parent\"@en .\n"));
        assertFalse(result.cleanedDocument().contains("skos:narrower"));
        assertEquals(1, result.count(Statistic.STRAY_STATEMENTS_DROPPED));
    }

    @Test
    void testOpaqueLiteralWhitespaceIsPreserved() {
        CleaningResult result = clean("<http://x/1> a skos:Concept ;\n    skos:prefLabel \"One\"@en ;\n    skos:notation \"a  b\" .");
        assertEquals(List.of("skos:notation \"a  b\""), result.concepts().get(0).otherProperties());
        assertTrue(result.cleanedDocument().contains("    skos:notation \"a  b\" ."));
    }

    @Test
    void testReturnedConceptsAreFrozen() {
        CleaningResult result = clean(HIERARCHY);
        Concept concept = result.concepts().get(0);

        assertTrue(concept.isFrozen());
        assertThrows(IllegalStateException.class,
                () -> concept.addValue(TextProperty.ALT_LABEL, new LangString("Late", "en")));
        assertThrows(IllegalStateException.class, () -> concept.addOtherProperty("skos:broader <http://x/1>"));
        assertThrows(UnsupportedOperationException.class, () -> result.concepts().remove(0));
        assertThrows(UnsupportedOperationException.class, () -> result.statistics().put(Statistic.FINAL_CONCEPTS, 0));
    }

    @Test
    void testCommaSpacingScenario() {
        CleaningResult result = clean("<http://x/1> a skos:Concept ;\n    skos:prefLabel \"Foo,Bar\"@en .");

        assertTrue(result.cleanedDocument().contains("<http://x/1> a skos:Concept ;\n    skos:prefLabel \"Foo, Bar\"@en ."));
        assertTrue(result.cleanedDocument().startsWith(String.join("\n", TurtleSerializer.DEFAULT_PREFIXES)));
        assertEquals(1, result.count(Statistic.COMMA_FIXES));
        assertTrue(result.changeLog().contains("Comma spacing fixed: 'Foo,Bar' -> 'Foo, Bar'"));
    }

    @Test
    void testDuplicateScenario() {
        CleaningResult result = clean(String.join("\n",
                "<http://x/1> a skos:Concept ;",
                "    skos:prefLabel \"A\"@en .",
                "<http://x/1> a skos:Concept ;",
                "    skos:prefLabel \"B\"@en ."));

        assertEquals(1, result.concepts().size());
        assertEquals("A", result.concepts().get(0).prefLabels().get(0).text());
        assertEquals(1, result.count(Statistic.DUPLICATES_REMOVED));
        assertFalse(result.cleanedDocument().contains("\"B\""));
    }

    @Test
    void testHierarchyScenarioWithoutAutofix() {
        CleaningResult result = clean(HIERARCHY);

        assertEquals(1, result.summary().get(FindingCategory.HIERARCHY_MISSING_BROADER));
        assertEquals(2, result.summary().get(FindingCategory.HIERARCHY_GAP));
        assertTrue(result.violations().get(0).message().startsWith("Inconsistent hierarchy: <http://ex.org/311> (code 311)"));
        assertEquals(0, result.count(Statistic.BROADER_LINKS_ADDED));
    }

    @Test
    void testHierarchyScenarioWithAutofix() {
        CleanerOptions options = CleanerOptions.builder().autofixBroader(true).warnMissingNarrower(true).build();
        CleaningResult result = new SkosCleaner(options).cleanOrThrow(HIERARCHY);

        assertEquals(1, result.count(Statistic.BROADER_LINKS_ADDED));
        assertEquals(0, result.summary().get(FindingCategory.HIERARCHY_MISSING_BROADER));
        assertEquals(1, result.summary().get(FindingCategory.HIERARCHY_PARENT_MISSING_NARROWER));
        assertTrue(result.cleanedDocument().contains(
                "<311> a skos:Concept ;\n    skos:prefLabel \"Child\"@en ;\n    skos:broader <http://ex.org/31> ."));
        assertTrue(result.changeLog().contains(
                "Autofix: added skos:broader <http://ex.org/31> to <http://ex.org/311> based on code 311"));
    }

    private static String schemeDocument(String... topConceptStatements) {
        StringBuilder doc = new StringBuilder(String.join("\n",
                "@base <http://ex.org/> .",
                "<scheme> a skos:ConceptScheme ;",
                "    skos:hasTopConcept <a1>, <a99> .",
                "<a1> a skos:Concept ;",
                "    skos:prefLabel \"Top\"@en"));
        for (String statement : topConceptStatements) {
            doc.append(" ;\n    ").append(statement);
        }
        return doc.append(" .\n").toString();
    }

    @Test
    void testHasTopConceptScenario() {
        CleaningResult result = clean(schemeDocument());

        assertEquals(1, result.summary().get(FindingCategory.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME));
        assertEquals(1, result.summary().get(FindingCategory.SCHEME_TOP_CONCEPT_NOT_A_CONCEPT));
        assertEquals("Concept <http://ex.org/a1> is hasTopConcept of <scheme> but missing inScheme <scheme>",
                result.violations().get(0).message());

        CleaningResult fixed = clean(schemeDocument("skos:inScheme <scheme>"));
        assertEquals(0, fixed.summary().get(FindingCategory.SCHEME_TOP_CONCEPT_MISSING_IN_SCHEME));
        assertEquals(1, fixed.summary().get(FindingCategory.SCHEME_TOP_CONCEPT_NOT_A_CONCEPT));
    }

    @Test
    void testPrefixedSubjectIsFixed() {
        CleaningResult result = clean("esco:123 a skos:Concept ;\n    skos:prefLabel \"Skill\"@en .");

        assertEquals(1, result.count(Statistic.MALFORMED_URIS_FIXED));
        assertTrue(result.cleanedDocument().contains("<http://data.europa.eu/esco/skill/123> a skos:Concept ;"));
        assertTrue(result.changeLog().contains(
                "URI fixed: expanded prefix 'esco:123' -> <http://data.europa.eu/esco/skill/123>"));
    }

    @Test
    void testRejectedConceptsAreNotEmitted() {
        CleaningResult result = clean(String.join("\n",
                "<http://x/1> a skos:Concept ;",
                "    skos:altLabel \"Only alt\"@en .",
                "<http://x/2> a skos:Concept ;",
                "    skos:prefLabel \"Kept\"@en ."));

        assertEquals(1, result.concepts().size());
        assertFalse(result.cleanedDocument().contains("<http://x/1>"));
        assertEquals(1, result.count(Statistic.CONCEPTS_WITHOUT_PREFLABEL));
    }

    @Test
    void testOutputUrisAreUnique() throws IOException {
        CleaningResult result = clean(resource("/thesaurus/occupations.ttl"));
        Set<String> uris = new HashSet<>();
        for (Concept c : result.concepts()) {
            assertTrue(uris.add(c.uri()), "duplicate " + c.uri());
        }
    }

    @Test
    void testOpaqueStatementsSurvive() {
        CleaningResult result = clean(String.join("\n",
                "<http://x/1> a skos:Concept ;",
                "    skos:prefLabel \"One\"@en ;",
                "    skos:exactMatch <http://other.org/one> ;",
                "    skos:notation \"1\"^^<http://ex.org/code> ."));

        assertEquals(List.of("skos:exactMatch <http://other.org/one>", "skos:notation \"1\"^^<http://ex.org/code>"),
                result.concepts().get(0).otherProperties());
        assertTrue(result.cleanedDocument().contains("    skos:notation \"1\"^^<http://ex.org/code> ."));
    }

    @Test
    void testValidationCanBeDisabled() {
        CleaningResult result = new SkosCleaner(CleanerOptions.builder().validationEnabled(false).build())
                .cleanOrThrow(HIERARCHY);
        assertTrue(result.violations().isEmpty());
        assertTrue(result.summary().values().stream().allMatch(v -> v == 0));
    }

    @Test
    void testChunkedRunKeepsUniqueness() {
        StringBuilder doc = new StringBuilder();
        for (String id : List.of("a", "b", "c", "a", "d")) {
            doc.append("<http://x/").append(id).append("> a skos:Concept ;\n    skos:prefLabel \"")
                    .append(id).append("\"@en .\n");
        }
        CleanerOptions options = CleanerOptions.builder().memoryEfficient(true).chunkSize(2).build();

        CleaningResult result = new SkosCleaner(options).cleanOrThrow(doc.toString());

        assertEquals(3, result.count(Statistic.CHUNKS_PROCESSED));
        assertEquals(1, result.count(Statistic.DUPLICATES_REMOVED));
        assertEquals(4, result.count(Statistic.FINAL_CONCEPTS));
    }

    @Test
    void testFailingRuleAbortsRun() {
        ValidationRule exploding = new ValidationRule() {
            @Override
            public String name() {
                return "exploding";
            }

            @Override
            public RuleOutcome validate(List<Concept> concepts, ValidationContext context) {
                throw new IllegalStateException("broken rule");
            }
        };
        SkosCleaner cleaner = new SkosCleaner(CleanerOptions.defaults(), new ValidationEngine(List.of(exploding)));
        String doc = "<http://x/1> a skos:Concept ;\n    skos:prefLabel \"One\"@en .";

        PhaseResult<CleaningResult> result = cleaner.clean(doc);
        assertTrue(result.isFailure());

        CleaningException ex = assertThrows(CleaningException.class, () -> cleaner.cleanOrThrow(doc));
        assertEquals("validation:exploding", ex.getPhase());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testInvalidOptionsRejectedUpFront() {
        assertThrows(IllegalArgumentException.class,
                () -> new SkosCleaner(CleanerOptions.builder().chunkSize(-1).build()));
    }
}
