package org.cmmn.parser.models;

import java.util.List;

public record CaseFileItemDefinition(
        String id,
        String name,
        String documentation,
        String structureRef,
        String definitionType,
        List<String> definitiveProperties
) implements CmmnElement {

    public CaseFileItemDefinition {
        definitiveProperties = ModelDefaults.list(definitiveProperties);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.CASE_FILE_ITEM_DEFINITION;
    }
}
