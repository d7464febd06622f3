package org.cmmn.parser.models;

import lombok.Builder;

import java.util.List;

/**
 * @param casePlanModel null when the document declares none
 * @param caseFileModel null when the document declares none
 */
@Builder
public record Case(
        String id,
        String name,
        String documentation,
        Stage casePlanModel,
        CaseFileModel caseFileModel,
        List<Role> caseRoles
) implements CmmnElement {

    public Case {
        caseRoles = ModelDefaults.list(caseRoles);
        if (casePlanModel != null && !casePlanModel.isCasePlanModel()) {
            throw new IllegalArgumentException("Case plan model must be tagged " + CmmnElementType.CASE_PLAN_MODEL
                    + " but was " + casePlanModel.elementType());
        }
    }

    public Case(String id, String name) {
        this(id, name, null, null, null, null);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.CASE;
    }
}
