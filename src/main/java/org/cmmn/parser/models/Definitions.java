package org.cmmn.parser.models;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Root of a parsed CMMN document.
 *
 * @param extensionElements vendor extensions keyed by tag name, in document order; empty when absent
 */
@Builder
public record Definitions(
        String id,
        String name,
        String documentation,
        String targetNamespace,
        String expressionLanguage,
        String exporter,
        String exporterVersion,
        String author,
        String creationDate,
        List<Import> imports,
        List<CaseFileItemDefinition> caseFileItemDefinitions,
        List<Case> cases,
        List<Process> processes,
        List<Decision> decisions,
        List<Association> associations,
        Map<String, ExtensionValue> extensionElements
) implements CmmnElement {

    public Definitions {
        imports = ModelDefaults.list(imports);
        caseFileItemDefinitions = ModelDefaults.list(caseFileItemDefinitions);
        cases = ModelDefaults.list(cases);
        processes = ModelDefaults.list(processes);
        decisions = ModelDefaults.list(decisions);
        associations = ModelDefaults.list(associations);
        extensionElements = ModelDefaults.orderedMap(extensionElements);
    }

    @Override
    public CmmnElementType elementType() {
        return CmmnElementType.DEFINITIONS;
    }

    public Case findCaseById(String caseId) {
        return cases.stream()
                .filter(c -> caseId != null && caseId.equals(c.id()))
                .findFirst()
                .orElse(null);
    }
}
