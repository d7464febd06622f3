package org.cmmn.parser.models;

import lombok.Builder;

import java.util.List;

/**
 * A positioned reference, within a stage, to a task, stage, milestone or event listener
 * definition. All references are opaque ids.
 */
@Builder
public record PlanItem(
        String id,
        String name,
        String documentation,
        String definitionRef,
        List<String> entryCriteria,
        List<String> exitCriteria,
        List<String> reactivationCriteria,
        ItemControl itemControl
) implements CmmnElement {

    public PlanItem {
        entryCriteria = ModelDefaults.list(entryCriteria);
        exitCriteria = ModelDefaults.list(exitCriteria);
        reactivationCriteria = ModelDefaults.list(reactivationCriteria);
    }

    public PlanItem(String id, String name, String definitionRef) {
        this(id, name, null, definitionRef, null, null, null, null);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.PLAN_ITEM;
    }
}
