package com.traverse.poc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigTest {

    @Test
    @DisplayName("Bundled configuration loads")
    void testLoadDefaultResource() {
        Config config = Config.loadFromResources(Config.DEFAULT_RESOURCE);

        assertEquals("select a, b from t where a = 1", config.getDefaultQuery());
        assertEquals("  ", config.getOutput().getIndent());
        assertEquals(80, config.getOutput().getMaxSummaryWidth());
        assertTrue(config.getOutput().isPrintStatement());
    }

    @Test
    @DisplayName("All output settings are read from YAML")
    void testLoadCustomResource() {
        Config config = Config.loadFromResources("traversal-test.yaml");

        assertEquals("select a from t1, t2", config.getDefaultQuery());
        assertEquals("    ", config.getOutput().getIndent());
        assertEquals(20, config.getOutput().getMaxSummaryWidth());
        assertFalse(config.getOutput().isPrintStatement());
    }

    @Test
    @DisplayName("Missing output section falls back to defaults")
    void testMissingOutputSection() {
        Config config = Config.loadFromResources("traversal-minimal.yaml");

        assertEquals("select 1", config.getDefaultQuery());
        assertEquals("  ", config.getOutput().getIndent());
        assertEquals(80, config.getOutput().getMaxSummaryWidth());
        assertTrue(config.getOutput().isPrintStatement());
    }

    @Test
    @DisplayName("An explicit null indent gets the same default as a missing one")
    void testNullIndent() {
        Config config = Config.loadFromResources("traversal-null-indent.yaml");

        assertEquals("  ", config.getOutput().getIndent());
        assertEquals(40, config.getOutput().getMaxSummaryWidth());
    }

    @Test
    @DisplayName("Defaults without a resource")
    void testDefaults() {
        Config config = Config.defaults();

        assertNull(config.getDefaultQuery());
        assertEquals("  ", config.getOutput().getIndent());
    }

    @Test
    @DisplayName("Unknown resource fails with its path in the message")
    void testMissingResource() {
        RuntimeException e = assertThrows(RuntimeException.class, () -> Config.loadFromResources("no-such.yaml"));
        assertTrue(e.getMessage().contains("no-such.yaml"));
    }
}
