package org.cmmn.parser.models;

/**
 * Entry, exit or reactivation criterion. The three variants share one shape and differ
 * only by {@link #elementType()}.
 */
public record Criterion(
        CmmnElementType elementType,
        String id,
        String name,
        String documentation,
        String sentryRef
) implements CmmnElement {

    public Criterion {
        if (elementType == null) {
            elementType = CmmnElementType.ENTRY_CRITERION;
        }
        ModelDefaults.requireOneOf(elementType, "Criterion",
                CmmnElementType.ENTRY_CRITERION,
                CmmnElementType.EXIT_CRITERION,
                CmmnElementType.REACTIVATION_CRITERION);
    }

    public static Criterion entry(String id, String name, String sentryRef) {
        return new Criterion(CmmnElementType.ENTRY_CRITERION, id, name, null, sentryRef);
    }

    public static Criterion exit(String id, String name, String sentryRef) {
        return new Criterion(CmmnElementType.EXIT_CRITERION, id, name, null, sentryRef);
    }

    public static Criterion reactivation(String id, String name, String sentryRef) {
        return new Criterion(CmmnElementType.REACTIVATION_CRITERION, id, name, null, sentryRef);
    }
}
