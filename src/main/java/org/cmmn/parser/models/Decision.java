package org.cmmn.parser.models;

public record Decision(
        String id,
        String name,
        String documentation,
        String decisionLogic
) implements CmmnElement {

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.DECISION;
    }
}
