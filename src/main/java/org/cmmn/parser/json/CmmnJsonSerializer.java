package org.cmmn.parser.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.cmmn.parser.exceptions.CmmnException;
import org.cmmn.parser.models.Association;
import org.cmmn.parser.models.Case;
import org.cmmn.parser.models.CaseFileItem;
import org.cmmn.parser.models.CaseFileItemDefinition;
import org.cmmn.parser.models.CaseFileModel;
import org.cmmn.parser.models.CmmnElement;
import org.cmmn.parser.models.CmmnElementType;
import org.cmmn.parser.models.Criterion;
import org.cmmn.parser.models.Decision;
import org.cmmn.parser.models.Definitions;
import org.cmmn.parser.models.EventListener;
import org.cmmn.parser.models.ExtensionValue;
import org.cmmn.parser.models.Import;
import org.cmmn.parser.models.ItemControl;
import org.cmmn.parser.models.Milestone;
import org.cmmn.parser.models.OnPart;
import org.cmmn.parser.models.PlanItem;
import org.cmmn.parser.models.Process;
import org.cmmn.parser.models.Role;
import org.cmmn.parser.models.Sentry;
import org.cmmn.parser.models.Stage;
import org.cmmn.parser.models.Task;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes a {@link Definitions} tree in the JSON dialect read by {@link CmmnJsonParser}.
 * <p>
 * Null scalars are left out; booleans and lists are always written. Task, event listener
 * and criterion entries carry an explicit {@code type}.
 */
public class CmmnJsonSerializer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static ObjectNode toJson(Definitions definitions) {
        ObjectNode node = base(definitions);
        putText(node, "targetNamespace", definitions.targetNamespace());
        putText(node, "expressionLanguage", definitions.expressionLanguage());
        putText(node, "exporter", definitions.exporter());
        putText(node, "exporterVersion", definitions.exporterVersion());
        putText(node, "author", definitions.author());
        putText(node, "creationDate", definitions.creationDate());
        node.set("imports", array(definitions.imports(), CmmnJsonSerializer::importToJson));
        node.set("caseFileItemDefinitions", array(definitions.caseFileItemDefinitions(), CmmnJsonSerializer::caseFileItemDefinitionToJson));
        node.set("cases", array(definitions.cases(), CmmnJsonSerializer::caseToJson));
        node.set("processes", array(definitions.processes(), CmmnJsonSerializer::processToJson));
        node.set("decisions", array(definitions.decisions(), CmmnJsonSerializer::decisionToJson));
        node.set("associations", array(definitions.associations(), CmmnJsonSerializer::associationToJson));

        ObjectNode extensions = node.putObject("extensionElements");
        definitions.extensionElements().forEach((tag, value) -> extensions.set(tag, extensionToJson(value)));
        return node;
    }

    public static Map<String, Object> toMap(Definitions definitions) {
        return CmmnJsonParser.MAPPER.convertValue(toJson(definitions), new TypeReference<Map<String, Object>>() {
        });
    }

    public static String toJsonString(Definitions definitions) {
        try {
            return CmmnJsonParser.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(definitions));
        } catch (JsonProcessingException e) {
            throw new CmmnException("Failed to write CMMN JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ObjectNode importToJson(Import anImport) {
        ObjectNode node = base(anImport);
        putText(node, "namespace", anImport.namespace());
        putText(node, "location", anImport.location());
        putText(node, "importType", anImport.importType());
        return node;
    }

    private static ObjectNode caseFileItemDefinitionToJson(CaseFileItemDefinition definition) {
        ObjectNode node = base(definition);
        putText(node, "structureRef", definition.structureRef());
        putText(node, "definitionType", definition.definitionType());
        node.set("definitiveProperty", strings(definition.definitiveProperties()));
        return node;
    }

    private static ObjectNode caseToJson(Case aCase) {
        ObjectNode node = base(aCase);
        if (aCase.casePlanModel() != null) {
            node.set("casePlanModel", stageToJson(aCase.casePlanModel()));
        }
        if (aCase.caseFileModel() != null) {
            node.set("caseFileModel", caseFileModelToJson(aCase.caseFileModel()));
        }
        node.set("caseRoles", array(aCase.caseRoles(), CmmnJsonSerializer::roleToJson));
        return node;
    }

    private static ObjectNode roleToJson(Role role) {
        return base(role);
    }

    private static ObjectNode stageToJson(Stage stage) {
        ObjectNode node = base(stage);
        node.put("autoComplete", stage.autoComplete());
        node.set("planItems", array(stage.planItems(), CmmnJsonSerializer::planItemToJson));
        node.set("sentries", array(stage.sentries(), CmmnJsonSerializer::sentryToJson));
        node.set("caseFileItems", array(stage.caseFileItems(), CmmnJsonSerializer::caseFileItemToJson));
        node.set("taskDefinitions", array(stage.taskDefinitions(), CmmnJsonSerializer::taskToJson));
        node.set("eventDefinitions", array(stage.eventDefinitions(), CmmnJsonSerializer::eventListenerToJson));
        node.set("milestoneDefinitions", array(stage.milestoneDefinitions(), CmmnJsonSerializer::milestoneToJson));
        node.set("stageDefinitions", array(stage.stageDefinitions(), CmmnJsonSerializer::stageToJson));
        node.set("criteriaDefinitions", array(stage.criteriaDefinitions(), CmmnJsonSerializer::criterionToJson));
        return node;
    }

    private static ObjectNode planItemToJson(PlanItem planItem) {
        ObjectNode node = base(planItem);
        putText(node, "definitionRef", planItem.definitionRef());
        node.set("entryCriteria", strings(planItem.entryCriteria()));
        node.set("exitCriteria", strings(planItem.exitCriteria()));
        node.set("reactivationCriteria", strings(planItem.reactivationCriteria()));
        if (planItem.itemControl() != null) {
            node.set("itemControl", itemControlToJson(planItem.itemControl()));
        }
        return node;
    }

    private static ObjectNode itemControlToJson(ItemControl itemControl) {
        ObjectNode node = NODES.objectNode();
        putText(node, "id", itemControl.id());
        putText(node, "requiredRule", itemControl.requiredRule());
        putText(node, "repetitionRule", itemControl.repetitionRule());
        putText(node, "manualActivationRule", itemControl.manualActivationRule());
        return node;
    }

    private static ObjectNode sentryToJson(Sentry sentry) {
        ObjectNode node = base(sentry);
        node.set("onParts", array(sentry.onParts(), CmmnJsonSerializer::onPartToJson));
        if (sentry.ifPart() != null) {
            ObjectNode ifPart = node.putObject("ifPart");
            putText(ifPart, "id", sentry.ifPart().id());
            putText(ifPart, "condition", sentry.ifPart().condition());
        }
        return node;
    }

    private static ObjectNode onPartToJson(OnPart onPart) {
        ObjectNode node = NODES.objectNode();
        putText(node, "id", onPart.id());
        putText(node, "name", onPart.name());
        putText(node, "sourceRef", onPart.sourceRef());
        putText(node, "standardEvent", onPart.standardEvent());
        return node;
    }

    private static ObjectNode taskToJson(Task task) {
        ObjectNode node = base(task);
        node.put("type", typeName(task.elementType()));
        node.put("isBlocking", task.isBlocking());
        putText(node, "performer", task.performer());
        putText(node, "formKey", task.formKey());
        putText(node, "processRef", task.processRef());
        putText(node, "caseRef", task.caseRef());
        putText(node, "decisionRef", task.decisionRef());
        return node;
    }

    private static ObjectNode eventListenerToJson(EventListener listener) {
        ObjectNode node = base(listener);
        node.put("type", typeName(listener.elementType()));
        putText(node, "timerExpression", listener.timerExpression());
        node.set("authorizedRoleRefs", strings(listener.authorizedRoleRefs()));
        return node;
    }

    private static ObjectNode milestoneToJson(Milestone milestone) {
        return base(milestone);
    }

    private static ObjectNode criterionToJson(Criterion criterion) {
        ObjectNode node = base(criterion);
        node.put("type", typeName(criterion.elementType()));
        putText(node, "sentryRef", criterion.sentryRef());
        return node;
    }

    private static ObjectNode caseFileModelToJson(CaseFileModel caseFileModel) {
        ObjectNode node = base(caseFileModel);
        node.set("caseFileItems", array(caseFileModel.caseFileItems(), CmmnJsonSerializer::caseFileItemToJson));
        return node;
    }

    private static ObjectNode caseFileItemToJson(CaseFileItem item) {
        ObjectNode node = base(item);
        putText(node, "definitionRef", item.definitionRef());
        putText(node, "definitionType", item.definitionType());
        putText(node, "multiplicity", item.multiplicity());
        putText(node, "sourceRef", item.sourceRef());
        node.set("targetRefs", strings(item.targetRefs()));
        node.set("children", array(item.children(), CmmnJsonSerializer::caseFileItemToJson));
        return node;
    }

    private static ObjectNode processToJson(Process process) {
        ObjectNode node = base(process);
        node.put("isExecutable", process.isExecutable());
        putText(node, "implementationType", process.implementationType());
        return node;
    }

    private static ObjectNode decisionToJson(Decision decision) {
        ObjectNode node = base(decision);
        putText(node, "decisionLogic", decision.decisionLogic());
        return node;
    }

    private static ObjectNode associationToJson(Association association) {
        ObjectNode node = base(association);
        putText(node, "sourceRef", association.sourceRef());
        putText(node, "targetRef", association.targetRef());
        putText(node, "associationDirection", association.associationDirection());
        return node;
    }

    static JsonNode extensionToJson(ExtensionValue value) {
        if (value instanceof ExtensionValue.Mapping mapping) {
            ObjectNode node = NODES.objectNode();
            mapping.entries().forEach((key, entry) -> node.set(key, extensionToJson(entry)));
            return node;
        }
        if (value instanceof ExtensionValue.Sequence sequence) {
            ArrayNode node = NODES.arrayNode();
            sequence.values().forEach(entry -> node.add(extensionToJson(entry)));
            return node;
        }
        Object scalar = ((ExtensionValue.Scalar) value).value();
        if (scalar == null) {
            return NODES.nullNode();
        }
        if (scalar instanceof Boolean bool) {
            return NODES.booleanNode(bool);
        }
        if (scalar instanceof Integer number) {
            return NODES.numberNode(number);
        }
        if (scalar instanceof Long number) {
            return NODES.numberNode(number);
        }
        if (scalar instanceof Double number) {
            return NODES.numberNode(number);
        }
        if (scalar instanceof BigInteger number) {
            return NODES.numberNode(number);
        }
        if (scalar instanceof BigDecimal number) {
            return NODES.numberNode(number);
        }
        if (scalar instanceof Number number) {
            return NODES.numberNode(number.doubleValue());
        }
        return NODES.textNode(scalar.toString());
    }

    /**
     * Discriminator written for the variant types.
     */
    static String typeName(CmmnElementType elementType) {
        return switch (elementType) {
            case TASK -> "task";
            case HUMAN_TASK -> "humanTask";
            case PROCESS_TASK -> "processTask";
            case CASE_TASK -> "caseTask";
            case DECISION_TASK -> "decisionTask";
            case EVENT_LISTENER -> "eventListener";
            case TIMER_EVENT_LISTENER -> "timerEventListener";
            case USER_EVENT_LISTENER -> "userEventListener";
            case ENTRY_CRITERION -> "entry";
            case EXIT_CRITERION -> "exit";
            case REACTIVATION_CRITERION -> "reactivation";
            case DEFINITIONS, IMPORT, CASE_FILE_ITEM_DEFINITION, CASE, CASE_PLAN_MODEL, STAGE, PLAN_ITEM,
                 ITEM_CONTROL, MILESTONE, SENTRY, ON_PART, IF_PART, CASE_FILE_MODEL, CASE_FILE_ITEM,
                 ASSOCIATION, ROLE, PROCESS, DECISION ->
                    throw new IllegalArgumentException("No type discriminator for " + elementType);
        };
    }

    private static ObjectNode base(CmmnElement element) {
        ObjectNode node = NODES.objectNode();
        putText(node, "id", element.id());
        putText(node, "name", element.name());
        putText(node, "documentation", element.documentation());
        return node;
    }

    private static void putText(ObjectNode node, String key, String value) {
        if (value != null) {
            node.put(key, value);
        }
    }

    private static ArrayNode strings(List<String> values) {
        ArrayNode node = NODES.arrayNode();
        values.forEach(node::add);
        return node;
    }

    private static <T> ArrayNode array(List<T> values, Function<T, ObjectNode> writer) {
        ArrayNode node = NODES.arrayNode();
        values.forEach(value -> node.add(writer.apply(value)));
        return node;
    }
}
