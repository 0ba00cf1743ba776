package com.seqdraft.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.seqdraft.core.generator.GeneratorConfig;

/**
 * Root configuration for seqdraft.
 *
 * <p>Loaded from {@code seqdraft.yaml}. Missing sections and keys take their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   strict: false
 *
 * generator:
 *   format: mermaid
 *   indent: 4
 *   includeComments: true
 *   title: "Checkout flow"
 * }</pre>
 *
 * @param parser parser settings
 * @param generator generator settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeqDraftConfig(
    @JsonProperty("parser") ParserSettings parser,
    @JsonProperty("generator") GeneratorSettings generator
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public SeqDraftConfig {
        if (parser == null) {
            parser = ParserSettings.defaults();
        }
        if (generator == null) {
            generator = GeneratorSettings.defaults();
        }
    }

    /**
     * Creates the default configuration: lenient parsing, Mermaid output indented by four spaces.
     *
     * @return default configuration
     */
    public static SeqDraftConfig defaults() {
        return new SeqDraftConfig(ParserSettings.defaults(), GeneratorSettings.defaults());
    }

    /**
     * Parser settings.
     *
     * @param strict when true, warnings fail validation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("strict") Boolean strict
    ) {
        public static ParserSettings defaults() {
            return new ParserSettings(false);
        }

        public boolean isStrict() {
            return Boolean.TRUE.equals(strict);
        }
    }

    /**
     * Generator settings.
     *
     * @param format generator id ({@code mermaid} or {@code markdown})
     * @param indent spaces per nesting level
     * @param includeComments whether comments are written
     * @param title document title for the Markdown generator
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("format") String format,
        @JsonProperty("indent") Integer indent,
        @JsonProperty("includeComments") Boolean includeComments,
        @JsonProperty("title") String title
    ) {
        public static final String DEFAULT_FORMAT = "mermaid";

        public static GeneratorSettings defaults() {
            return new GeneratorSettings(DEFAULT_FORMAT, GeneratorConfig.DEFAULT_INDENT_WIDTH, true, null);
        }

        public String formatOrDefault() {
            return format != null && !format.isBlank() ? format : DEFAULT_FORMAT;
        }

        /**
         * Converts these settings into a per-call generator configuration.
         *
         * @return generator configuration
         */
        public GeneratorConfig toGeneratorConfig() {
            return new GeneratorConfig(
                indent != null ? indent : GeneratorConfig.DEFAULT_INDENT_WIDTH,
                includeComments == null || includeComments,
                title
            );
        }
    }
}
