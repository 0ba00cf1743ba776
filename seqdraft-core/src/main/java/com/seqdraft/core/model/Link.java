package com.seqdraft.core.model;

import java.util.Objects;

/**
 * A labeled hyperlink attached to a participant's menu.
 *
 * @param label link label shown in the participant menu
 * @param url target URL
 */
public record Link(
    String label,
    String url
) {
    /**
     * Compact constructor with validation.
     */
    public Link {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(url, "url must not be null");
    }
}
