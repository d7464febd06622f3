package org.cmmn.parser.models;

import lombok.Builder;

import java.util.List;

/**
 * Node of the case file tree. Children form a tree; cycles are neither expected nor checked.
 *
 * @param multiplicity e.g. "ZeroOrOne", "OneOrMore"; kept as written in the document
 */
@Builder
public record CaseFileItem(
        String id,
        String name,
        String documentation,
        String definitionRef,
        String definitionType,
        String multiplicity,
        String sourceRef,
        List<String> targetRefs,
        List<CaseFileItem> children
) implements CmmnElement {

    public CaseFileItem {
        targetRefs = ModelDefaults.list(targetRefs);
        children = ModelDefaults.list(children);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.CASE_FILE_ITEM;
    }
}
