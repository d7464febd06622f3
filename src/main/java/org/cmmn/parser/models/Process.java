package org.cmmn.parser.models;

/**
 * Process referenced by process tasks.
 *
 * @param isExecutable defaults to true when the document does not say otherwise
 */
public record Process(
        String id,
        String name,
        String documentation,
        boolean isExecutable,
        String implementationType
) implements CmmnElement {

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.PROCESS;
    }
}
