package com.e2eq.skos.core;

import com.e2eq.skos.runtime.CleanerOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConceptDeduplicatorTest {

    private static Concept concept(String uri, String label) {
        Concept c = new Concept(uri);
        c.addValue(TextProperty.PREF_LABEL, new LangString(label, "en"));
        return c;
    }

    @Test
    void testFirstOccurrenceWins() {
        CleaningRun run = new CleaningRun(CleanerOptions.defaults());
        List<Concept> unique = new ConceptDeduplicator().deduplicate(
                List.of(concept("http://x/1", "A"), concept("http://x/2", "C"), concept("http://x/1", "B")), run);

        assertEquals(2, unique.size());
        assertEquals("A", unique.get(0).prefLabels().get(0).text());
        assertEquals("http://x/2", unique.get(1).uri());
        assertEquals(1, run.count(Statistic.DUPLICATES_REMOVED));
        assertEquals(List.of("Duplicate removed: http://x/1"), run.changeLog());
    }

    @Test
    void testUniquenessHoldsAcrossCalls() {
        CleaningRun run = new CleaningRun(CleanerOptions.defaults());
        ConceptDeduplicator deduplicator = new ConceptDeduplicator();
        deduplicator.deduplicate(List.of(concept("http://x/1", "A")), run);
        List<Concept> second = deduplicator.deduplicate(List.of(concept("http://x/1", "B"), concept("http://x/3", "C")), run);

        assertEquals(1, second.size());
        assertEquals("http://x/3", second.get(0).uri());
        assertEquals(1, run.count(Statistic.DUPLICATES_REMOVED));
    }

    @Test
    void testMergeUnionsValues() {
        Concept a = concept("http://x/1", "A");
        a.addOtherProperty("skos:broader <2>");
        Concept b = concept("http://x/1", "B");
        b.addValue(TextProperty.PREF_LABEL, new LangString("A", "en"));
        b.addOtherProperty("skos:broader <2>");
        b.addOtherProperty("skos:related <3>");

        Concept merged = ConceptDeduplicator.merge(List.of(a, b));

        assertEquals(List.of(new LangString("A", "en"), new LangString("B", "en")), merged.prefLabels());
        assertEquals(List.of("skos:broader <2>", "skos:related <3>"), merged.otherProperties());
    }

    @Test
    void testMergeRejectsDifferentUris() {
        assertThrows(IllegalArgumentException.class,
                () -> ConceptDeduplicator.merge(List.of(concept("http://x/1", "A"), concept("http://x/2", "B"))));
        assertThrows(IllegalArgumentException.class, () -> ConceptDeduplicator.merge(List.of()));
    }
}
