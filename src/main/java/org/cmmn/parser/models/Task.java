package org.cmmn.parser.models;

import lombok.Builder;

/**
 * A task definition. The variant is carried by {@link #elementType()}; only the
 * reference fields belonging to that variant are expected to be filled.
 */
@Builder
public record Task(
        CmmnElementType elementType,  // TASK, HUMAN_TASK, PROCESS_TASK, CASE_TASK or DECISION_TASK
        String id,
        String name,
        String documentation,
        boolean isBlocking,

        //for human tasks
        String performer,
        String formKey,

        //for process tasks
        String processRef,

        //for case tasks
        String caseRef,

        //for decision tasks
        String decisionRef
) implements CmmnElement {

    public Task {
        if (elementType == null) {
            elementType = CmmnElementType.TASK;
        }
        ModelDefaults.requireOneOf(elementType, "Task",
                CmmnElementType.TASK,
                CmmnElementType.HUMAN_TASK,
                CmmnElementType.PROCESS_TASK,
                CmmnElementType.CASE_TASK,
                CmmnElementType.DECISION_TASK);
    }

    public static Task task(String id, String name) {
        return new Task(CmmnElementType.TASK, id, name, null, true, null, null, null, null, null);
    }

    public static Task humanTask(String id, String name, String performer, String formKey) {
        return new Task(CmmnElementType.HUMAN_TASK, id, name, null, true, performer, formKey, null, null, null);
    }

    public static Task processTask(String id, String name, String processRef) {
        return new Task(CmmnElementType.PROCESS_TASK, id, name, null, true, null, null, processRef, null, null);
    }

    public static Task caseTask(String id, String name, String caseRef) {
        return new Task(CmmnElementType.CASE_TASK, id, name, null, true, null, null, null, caseRef, null);
    }

    public static Task decisionTask(String id, String name, String decisionRef) {
        return new Task(CmmnElementType.DECISION_TASK, id, name, null, true, null, null, null, null, decisionRef);
    }

    // Lombok fills in the builder; this only sets the documented default
    public static class TaskBuilder {
        private boolean isBlocking = true;
    }
}
