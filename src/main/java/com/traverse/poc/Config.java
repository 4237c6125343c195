package com.traverse.poc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.InputStream;
import java.util.Objects;

/**
 * Loads and holds the traversal tool settings from a YAML resource
 * (traversal.yaml by default).
 */
public class Config {

    public static final String DEFAULT_RESOURCE = "traversal.yaml";

    // These field names must match the top-level keys in traversal.yaml
    private String defaultQuery;
    private OutputOptions output;

    // Getters are needed for Jackson deserialization
    public String getDefaultQuery() {
        return defaultQuery;
    }

    public void setDefaultQuery(String defaultQuery) {
        this.defaultQuery = defaultQuery;
    }

    public OutputOptions getOutput() {
        return output;
    }

    public void setOutput(OutputOptions output) {
        this.output = output;
    }

    // --- Inner classes representing the structure in YAML ---

    public static class OutputOptions {
        static final String DEFAULT_INDENT = "  ";

        private String indent = DEFAULT_INDENT;
        private int maxSummaryWidth = 80;
        private boolean printStatement = true;

        /**
         * @return The string repeated once per depth level in front of each printed node.
         */
        public String getIndent() {
            return indent;
        }

        public void setIndent(String indent) {
            this.indent = indent;
        }

        /**
         * @return Maximum length of a node summary; longer summaries are cut and end in "...".
         */
        public int getMaxSummaryWidth() {
            return maxSummaryWidth;
        }

        public void setMaxSummaryWidth(int maxSummaryWidth) {
            this.maxSummaryWidth = maxSummaryWidth;
        }

        public boolean isPrintStatement() {
            return printStatement;
        }

        public void setPrintStatement(boolean printStatement) {
            this.printStatement = printStatement;
        }
    }

    // --- Loading Logic ---

    /**
     * Loads configuration from the specified classpath resource path.
     * @param resourcePath Path relative to the classpath root (e.g., "traversal.yaml")
     * @return Loaded Config object.
     * @throws RuntimeException if loading fails.
     */
    public static Config loadFromResources(String resourcePath) {
        Objects.requireNonNull(resourcePath, "resourcePath cannot be null");
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = Config.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RuntimeException("Cannot find configuration file in classpath: " + resourcePath);
            }
            Config config = mapper.readValue(is, Config.class);
            config.applyDefaults();
            return config;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load configuration from " + resourcePath, e);
        }
    }

    /**
     * @return A configuration with every setting at its default and no default query.
     */
    public static Config defaults() {
        Config config = new Config();
        config.applyDefaults();
        return config;
    }

    private void applyDefaults() {
        if (output == null) {
            output = new OutputOptions(); // Missing section means all defaults
        }
        if (output.getIndent() == null) {
            output.setIndent(OutputOptions.DEFAULT_INDENT); // Explicit null behaves like a missing key
        }
        if (output.getMaxSummaryWidth() < 4) {
            throw new IllegalArgumentException("output.maxSummaryWidth must be at least 4, got " + output.getMaxSummaryWidth());
        }
    }
}
