package org.cmmn.parser.models;

public record Role(
        String id,
        String name,
        String documentation
) implements CmmnElement {

    public Role(String id, String name) {
        this(id, name, null);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.ROLE;
    }
}
