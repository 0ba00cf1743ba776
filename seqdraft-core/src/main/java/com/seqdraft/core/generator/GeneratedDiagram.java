package com.seqdraft.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram document.
 *
 * @param name document name, used as the default output file name
 * @param content generated text
 * @param fileExtension file extension for this content, without leading dot
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the default file name: {@code name.fileExtension}.
     *
     * @return file name
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
