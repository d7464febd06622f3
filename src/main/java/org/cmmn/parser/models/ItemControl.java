package org.cmmn.parser.models;

/**
 * Rules attached to a plan item. Each rule is the raw condition text, never evaluated.
 */
public record ItemControl(
        String id,
        String requiredRule,
        String repetitionRule,
        String manualActivationRule
) {

    public CmmnElementType elementType() {
        return CmmnElementType.ITEM_CONTROL;
    }
}
