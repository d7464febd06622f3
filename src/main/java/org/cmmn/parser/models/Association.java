package org.cmmn.parser.models;

/**
 * Flat edge between two elements, e.g. a text annotation and the element it describes.
 */
public record Association(
        String id,
        String name,
        String documentation,
        String sourceRef,
        String targetRef,
        String associationDirection
) implements CmmnElement {

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.ASSOCIATION;
    }
}
