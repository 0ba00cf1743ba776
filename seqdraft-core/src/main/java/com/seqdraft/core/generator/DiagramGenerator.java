package com.seqdraft.core.generator;

import com.seqdraft.core.model.Diagram;

/**
 * Interface for generators that turn a {@link Diagram} into a text document.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI), see {@link Generators}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class MermaidGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "mermaid";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Mermaid Sequence Diagram Generator";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "mmd";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(Diagram diagram, GeneratorConfig config) {
 *         return new GeneratedDiagram("sequence-diagram", render(diagram, config), getFileExtension());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.seqdraft.core.generator.DiagramGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration and on the command line.
     * Should be lowercase (e.g., "mermaid", "markdown").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated documents.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates a document from the diagram.
     *
     * <p>Must not fail for empty diagrams, diagrams without participants or without statements.
     * Generation never mutates the diagram.
     *
     * @param diagram the diagram to write
     * @param config configuration settings for generation
     * @return generated document
     */
    GeneratedDiagram generate(Diagram diagram, GeneratorConfig config);
}
