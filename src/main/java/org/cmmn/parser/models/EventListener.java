package org.cmmn.parser.models;

import java.util.List;

/**
 * Event listener definition: generic, timer or user driven.
 *
 * @param timerExpression    timer variants only, typically an ISO-8601 duration such as "PT2H"
 * @param authorizedRoleRefs user variants only; never null
 */
public record EventListener(
        CmmnElementType elementType,
        String id,
        String name,
        String documentation,
        String timerExpression,
        List<String> authorizedRoleRefs
) implements CmmnElement {

    public EventListener {
        if (elementType == null) {
            elementType = CmmnElementType.EVENT_LISTENER;
        }
        ModelDefaults.requireOneOf(elementType, "EventListener",
                CmmnElementType.EVENT_LISTENER,
                CmmnElementType.TIMER_EVENT_LISTENER,
                CmmnElementType.USER_EVENT_LISTENER);
        authorizedRoleRefs = ModelDefaults.list(authorizedRoleRefs);
    }

    public static EventListener timer(String id, String name, String timerExpression) {
        return new EventListener(CmmnElementType.TIMER_EVENT_LISTENER, id, name, null, timerExpression, List.of());
    }

    public static EventListener user(String id, String name, List<String> authorizedRoleRefs) {
        return new EventListener(CmmnElementType.USER_EVENT_LISTENER, id, name, null, null, authorizedRoleRefs);
    }
}
