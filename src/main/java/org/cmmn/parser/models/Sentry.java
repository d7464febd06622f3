package org.cmmn.parser.models;

import java.util.List;

/**
 * Guard composed of event triggers and an optional condition.
 *
 * @param ifPart may be null
 */
public record Sentry(
        String id,
        String name,
        String documentation,
        List<OnPart> onParts,
        IfPart ifPart
) implements CmmnElement {

    public Sentry {
        onParts = ModelDefaults.list(onParts);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.SENTRY;
    }
}
