package com.seqdraft.core.generator;

/**
 * Configuration for diagram generation.
 *
 * @param indentWidth spaces per nesting level; negative values fall back to {@value #DEFAULT_INDENT_WIDTH}
 * @param includeComments whether stored {@code %%} comments are emitted
 * @param title document title for generators that produce one, may be null
 */
public record GeneratorConfig(
    int indentWidth,
    boolean includeComments,
    String title
) {
    public static final int DEFAULT_INDENT_WIDTH = 4;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (indentWidth < 0) {
            indentWidth = DEFAULT_INDENT_WIDTH;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_INDENT_WIDTH, true, null);
    }

    /**
     * Returns the indentation for a nesting level.
     *
     * @param level nesting level, 0 for the header line
     * @return spaces
     */
    public String indent(int level) {
        return " ".repeat(indentWidth * level);
    }
}
