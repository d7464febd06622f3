package org.cmmn.parser.models;

public record IfPart(
        String id,
        String condition
) {

    public CmmnElementType elementType() {
        return CmmnElementType.IF_PART;
    }
}
