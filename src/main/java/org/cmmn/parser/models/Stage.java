package org.cmmn.parser.models;

import lombok.Builder;

import java.util.List;

/**
 * A stage, or the case plan model when tagged {@link CmmnElementType#CASE_PLAN_MODEL}.
 * <p>
 * Plan items and sentries are the references; the {@code ...Definitions} lists hold the
 * definitions those plan items point at. Documents written in the flat dialect keep
 * tasks, milestones and nested stages as direct children; {@link #tasks()},
 * {@link #milestones()} and {@link #stages()} expose them from the same buckets.
 */
@Builder
public record Stage(
        CmmnElementType elementType,
        String id,
        String name,
        String documentation,
        boolean autoComplete,
        List<PlanItem> planItems,
        List<Sentry> sentries,
        List<CaseFileItem> caseFileItems,
        List<Task> taskDefinitions,
        List<EventListener> eventDefinitions,
        List<Milestone> milestoneDefinitions,
        List<Stage> stageDefinitions,
        List<Criterion> criteriaDefinitions
) implements CmmnElement {

    public Stage {
        if (elementType == null) {
            elementType = CmmnElementType.STAGE;
        }
        ModelDefaults.requireOneOf(elementType, "Stage", CmmnElementType.STAGE, CmmnElementType.CASE_PLAN_MODEL);
        planItems = ModelDefaults.list(planItems);
        sentries = ModelDefaults.list(sentries);
        caseFileItems = ModelDefaults.list(caseFileItems);
        taskDefinitions = ModelDefaults.list(taskDefinitions);
        eventDefinitions = ModelDefaults.list(eventDefinitions);
        milestoneDefinitions = ModelDefaults.list(milestoneDefinitions);
        stageDefinitions = ModelDefaults.list(stageDefinitions);
        criteriaDefinitions = ModelDefaults.list(criteriaDefinitions);
    }

    public static Stage casePlanModel(String id, String name) {
        return Stage.builder().elementType(CmmnElementType.CASE_PLAN_MODEL).id(id).name(name).build();
    }

    public boolean isCasePlanModel() {
        return elementType == CmmnElementType.CASE_PLAN_MODEL;
    }

    public List<Task> tasks() {
        return taskDefinitions;
    }

    public List<Milestone> milestones() {
        return milestoneDefinitions;
    }

    public List<Stage> stages() {
        return stageDefinitions;
    }
}
