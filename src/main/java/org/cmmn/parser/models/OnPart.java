package org.cmmn.parser.models;

/**
 * Event trigger of a sentry.
 *
 * @param sourceRef     id of the plan item or case file item the event comes from
 * @param standardEvent transition name, e.g. "complete" or "occur"
 */
public record OnPart(
        String id,
        String name,
        String sourceRef,
        String standardEvent
) {

    public OnPart(String sourceRef, String standardEvent) {
        this(null, null, sourceRef, standardEvent);
    }

    public CmmnElementType elementType() {
        return CmmnElementType.ON_PART;
    }
}
