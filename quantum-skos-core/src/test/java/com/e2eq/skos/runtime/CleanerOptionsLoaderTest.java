package com.e2eq.skos.runtime;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CleanerOptionsLoaderTest {

    private final CleanerOptionsLoader loader = new CleanerOptionsLoader();

    @Test
    void testLoadDefaultResource() throws IOException {
        CleanerOptions options = loader.loadDefault();
        assertEquals(CleanerOptions.defaults(), options);
    }

    @Test
    void testLoadFromClasspath() throws IOException {
        CleanerOptions options = loader.loadFromClasspath("/options/chunked.yaml");
        assertEquals(500, options.getChunkSize());
        assertTrue(options.isMemoryEfficient());
        assertTrue(options.isAutofixBroader());
        assertTrue(options.isWarnMissingNarrower());
        assertTrue(options.isValidationEnabled());
        assertEquals("de", options.getDefaultLanguage());
        assertEquals(Map.of("isco", "http://data.europa.eu/esco/isco/"), options.getPrefixNamespaces());
    }

    @Test
    void testMissingResource() {
        IOException ex = assertThrows(IOException.class, () -> loader.loadFromClasspath("/options/nope.yaml"));
        assertTrue(ex.getMessage().contains("/options/nope.yaml"));
    }

    @Test
    void testInvalidOptionsRejected() {
        assertThrows(IllegalArgumentException.class, () -> loader.loadFromClasspath("/options/invalid-chunk-size.yaml"));
    }

    @Test
    void testLoadFromPath() throws IOException {
        Path file = Files.createTempFile("skos-cleaner", ".yaml");
        try {
            Files.writeString(file, "skosXlEnabled: true\nprefixNamespaces:\n");
            CleanerOptions options = loader.loadFromPath(file);
            assertTrue(options.isSkosXlEnabled());
            assertNotNull(options.getPrefixNamespaces());
            assertEquals(1000, options.getChunkSize());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void testLoadFromStream() throws IOException {
        CleanerOptions options = loader.load(new ByteArrayInputStream(
                "validationEnabled: false\n".getBytes(StandardCharsets.UTF_8)));
        assertFalse(options.isValidationEnabled());
    }
}
