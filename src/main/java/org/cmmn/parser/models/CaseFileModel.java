package org.cmmn.parser.models;

import java.util.List;

public record CaseFileModel(
        String id,
        String name,
        String documentation,
        List<CaseFileItem> caseFileItems
) implements CmmnElement {

    public CaseFileModel {
        caseFileItems = ModelDefaults.list(caseFileItems);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.CASE_FILE_MODEL;
    }
}
