package org.cmmn.parser.models;

/**
 * An {@code import} of an external definition document. Nothing is resolved.
 */
public record Import(
        String id,
        String name,
        String documentation,
        String namespace,
        String location,
        String importType
) implements CmmnElement {

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.IMPORT;
    }
}
