package org.cmmn.parser.models;

public record Milestone(
        String id,
        String name,
        String documentation
) implements CmmnElement {

    public Milestone(String id, String name) {
        this(id, name, null);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.MILESTONE;
    }
}
