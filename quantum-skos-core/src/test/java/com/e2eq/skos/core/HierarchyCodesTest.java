package com.e2eq.skos.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyCodesTest {

    @Test
    void testExtractCode() {
        assertEquals(Optional.of("42-10"), HierarchyCodes.extractCode("<42-10>"));
        assertEquals(Optional.of("311"), HierarchyCodes.extractCode("http://ex.org/isco/311"));
        assertEquals(Optional.of("311"), HierarchyCodes.extractCode("<http://ex.org/isco/311/>"));
        assertEquals(Optional.of("7"), HierarchyCodes.extractCode("http://ex.org/C7"));
        assertEquals(Optional.empty(), HierarchyCodes.extractCode("http://ex.org/abc"));
        assertEquals(Optional.empty(), HierarchyCodes.extractCode(""));
    }

    @Test
    void testParentCandidates() {
        assertEquals(List.of("42", "4"), HierarchyCodes.parentCandidates("42-10"));
        assertEquals(List.of("31", "3"), HierarchyCodes.parentCandidates("311"));
        assertEquals(List.of("44-1", "44", "4"), HierarchyCodes.parentCandidates("44-1-2"));
        assertEquals(List.of("4"), HierarchyCodes.parentCandidates("4-1"));
        assertEquals(List.of(), HierarchyCodes.parentCandidates("4"));
        assertEquals(List.of(), HierarchyCodes.parentCandidates(null));
    }
}
