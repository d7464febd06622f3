package org.cmmn.parser.validation;

import lombok.Builder;

import java.util.List;

/**
 * Metadata read from a bundled JSON schema.
 */
@Builder
public record SchemaInfo(
        String title,
        String description,
        String version,
        List<String> supportedElements
) {
    public SchemaInfo {
        supportedElements = supportedElements == null ? List.of() : List.copyOf(supportedElements);
    }
}
