package org.cmmn.parser.models;

/**
 * Discriminator carried by every node of the model.
 * <p>
 * {@link #tagName()} is the XML local name of the element and, for the variant types,
 * also the value written to the JSON {@code type} key.
 */
public enum CmmnElementType {
    DEFINITIONS("definitions"),
    IMPORT("import"),
    CASE_FILE_ITEM_DEFINITION("caseFileItemDefinition"),
    CASE("case"),
    CASE_PLAN_MODEL("casePlanModel"),
    STAGE("stage"),
    PLAN_ITEM("planItem"),
    ITEM_CONTROL("itemControl"),
    TASK("task"),
    HUMAN_TASK("humanTask"),
    PROCESS_TASK("processTask"),
    CASE_TASK("caseTask"),
    DECISION_TASK("decisionTask"),
    MILESTONE("milestone"),
    EVENT_LISTENER("eventListener"),
    TIMER_EVENT_LISTENER("timerEventListener"),
    USER_EVENT_LISTENER("userEventListener"),
    SENTRY("sentry"),
    ON_PART("onPart"),
    IF_PART("ifPart"),
    ENTRY_CRITERION("entryCriterion"),
    EXIT_CRITERION("exitCriterion"),
    REACTIVATION_CRITERION("reactivationCriterion"),
    CASE_FILE_MODEL("caseFileModel"),
    CASE_FILE_ITEM("caseFileItem"),
    ASSOCIATION("association"),
    ROLE("role"),
    PROCESS("process"),
    DECISION("decision");

    private final String tagName;

    CmmnElementType(String tagName) {
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    /**
     * Looks up a type by its XML local name.
     *
     * @param tagName local element name, e.g. "humanTask"
     * @return the matching type, or null when the name is not a CMMN element handled by the model
     */
    public static CmmnElementType fromTagName(String tagName) {
        if (tagName == null) {
            return null;
        }
        for (CmmnElementType type : values()) {
            if (type.tagName.equals(tagName)) {
                return type;
            }
        }
        return null;
    }
}
