package org.cmmn.parser.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cmmn.parser.exceptions.CmmnStructureException;
import org.cmmn.parser.exceptions.CmmnSyntaxException;
import org.cmmn.parser.models.Association;
import org.cmmn.parser.models.Case;
import org.cmmn.parser.models.CaseFileItem;
import org.cmmn.parser.models.CaseFileItemDefinition;
import org.cmmn.parser.models.CaseFileModel;
import org.cmmn.parser.models.CmmnElementType;
import org.cmmn.parser.models.Criterion;
import org.cmmn.parser.models.Decision;
import org.cmmn.parser.models.Definitions;
import org.cmmn.parser.models.EventListener;
import org.cmmn.parser.models.ExtensionValue;
import org.cmmn.parser.models.IfPart;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds a {@link Definitions} tree from the JSON dialect.
 * <p>
 * Every key is optional. Both the bucketed stage layout written by
 * {@link CmmnJsonSerializer} and the older flat layout ({@code tasks}, {@code milestones},
 * {@code stages}) are read.
 */
public class CmmnJsonParser {
    private static final Logger logger = LoggerFactory.getLogger(CmmnJsonParser.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final Set<CmmnElementType> TASK_TYPES = Set.of(
            CmmnElementType.TASK, CmmnElementType.HUMAN_TASK, CmmnElementType.PROCESS_TASK,
            CmmnElementType.CASE_TASK, CmmnElementType.DECISION_TASK);
    private static final Set<CmmnElementType> EVENT_LISTENER_TYPES = Set.of(
            CmmnElementType.EVENT_LISTENER, CmmnElementType.TIMER_EVENT_LISTENER,
            CmmnElementType.USER_EVENT_LISTENER);

    /**
     * Parses JSON text.
     *
     * @throws CmmnSyntaxException    if the text is not valid JSON
     * @throws CmmnStructureException if the document is not an object or a key has the wrong shape
     */
    public static Definitions parse(String jsonContent) {
        return parse(readTree(jsonContent));
    }

    /**
     * Parses an already decoded JSON document.
     */
    public static Definitions parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new CmmnStructureException("JSON data must be an object");
        }

        JsonNode definitionsNode = root;
        JsonNode wrapped = root.get("definitions");
        if (wrapped != null && wrapped.isObject()) {
            definitionsNode = wrapped;
        }

        Definitions definitions = parseDefinitions(definitionsNode);
        logger.debug("Parsed CMMN JSON definitions '{}' with {} case(s)", definitions.id(), definitions.cases().size());
        return definitions;
    }

    /**
     * Parses a document decoded into plain maps and lists.
     */
    public static Definitions parse(Map<String, ?> data) {
        if (data == null) {
            throw new CmmnStructureException("JSON data must be an object");
        }
        JsonNode root;
        try {
            root = MAPPER.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new CmmnStructureException("Unable to convert JSON data: " + e.getMessage(), e);
        }
        return parse(root);
    }

    /**
     * Decodes JSON text into a tree.
     *
     * @throws CmmnSyntaxException if the text is not valid JSON
     */
    public static JsonNode readTree(String jsonContent) {
        if (jsonContent == null) {
            throw new CmmnSyntaxException("Invalid JSON format: content is null");
        }
        try {
            JsonNode node = MAPPER.readTree(jsonContent);
            if (node == null || node.isMissingNode()) {
                throw new CmmnSyntaxException("Invalid JSON format: no content");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CmmnSyntaxException("Invalid JSON format: " + e.getOriginalMessage(), e);
        }
    }

    private static Definitions parseDefinitions(JsonNode node) {
        return Definitions.builder()
                .id(text(node, "id"))
                .name(text(node, "name"))
                .documentation(documentation(node))
                .targetNamespace(text(node, "targetNamespace"))
                .expressionLanguage(text(node, "expressionLanguage"))
                .exporter(text(node, "exporter"))
                .exporterVersion(text(node, "exporterVersion"))
                .author(text(node, "author"))
                .creationDate(text(node, "creationDate"))
                .imports(objects(node, "imports", CmmnJsonParser::parseImport))
                .caseFileItemDefinitions(objects(node, "caseFileItemDefinitions", CmmnJsonParser::parseCaseFileItemDefinition))
                .cases(objects(node, "cases", CmmnJsonParser::parseCase))
                .processes(objects(node, "processes", CmmnJsonParser::parseProcess))
                .decisions(objects(node, "decisions", CmmnJsonParser::parseDecision))
                .associations(objects(node, "associations", CmmnJsonParser::parseAssociation))
                .extensionElements(parseExtensionElements(node))
                .build();
    }

    private static Import parseImport(JsonNode node) {
        return new Import(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                text(node, "namespace"),
                text(node, "location"),
                text(node, "importType"));
    }

    private static CaseFileItemDefinition parseCaseFileItemDefinition(JsonNode node) {
        return new CaseFileItemDefinition(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                text(node, "structureRef"),
                text(node, "definitionType"),
                strings(node, "definitiveProperty"));
    }

    private static Case parseCase(JsonNode node) {
        JsonNode casePlanModelNode = object(node, "casePlanModel");
        JsonNode caseFileModelNode = object(node, "caseFileModel");

        List<Role> caseRoles = objects(node, "caseRoles", CmmnJsonParser::parseRole);
        if (caseRoles.isEmpty()) {
            caseRoles = objects(node, "roles", CmmnJsonParser::parseRole);
        }

        return Case.builder()
                .id(text(node, "id"))
                .name(text(node, "name"))
                .documentation(documentation(node))
                .casePlanModel(casePlanModelNode == null ? null : parseStage(casePlanModelNode, CmmnElementType.CASE_PLAN_MODEL))
                .caseFileModel(caseFileModelNode == null ? null : parseCaseFileModel(caseFileModelNode))
                .caseRoles(caseRoles)
                .build();
    }

    private static Role parseRole(JsonNode node) {
        return new Role(text(node, "id"), text(node, "name"), documentation(node));
    }

    private static Stage parseStage(JsonNode node, CmmnElementType stageType) {
        List<Task> tasks = objects(node, "tasks", CmmnJsonParser::parseTask);
        tasks.addAll(objects(node, "taskDefinitions", CmmnJsonParser::parseTask));

        List<Milestone> milestones = objects(node, "milestones", CmmnJsonParser::parseMilestone);
        milestones.addAll(objects(node, "milestoneDefinitions", CmmnJsonParser::parseMilestone));

        List<Stage> stages = objects(node, "stages", CmmnJsonParser::parseNestedStage);
        stages.addAll(objects(node, "stageDefinitions", CmmnJsonParser::parseNestedStage));

        return Stage.builder()
                .elementType(stageType)
                .id(text(node, "id"))
                .name(text(node, "name"))
                .documentation(documentation(node))
                .autoComplete(bool(node, "autoComplete", false))
                .planItems(objects(node, "planItems", CmmnJsonParser::parsePlanItem))
                .sentries(objects(node, "sentries", CmmnJsonParser::parseSentry))
                .caseFileItems(caseFileItems(node))
                .taskDefinitions(tasks)
                .eventDefinitions(objects(node, "eventDefinitions", CmmnJsonParser::parseEventListener))
                .milestoneDefinitions(milestones)
                .stageDefinitions(stages)
                .criteriaDefinitions(objects(node, "criteriaDefinitions", CmmnJsonParser::parseCriterion))
                .build();
    }

    private static Stage parseNestedStage(JsonNode node) {
        return parseStage(node, CmmnElementType.STAGE);
    }

    private static PlanItem parsePlanItem(JsonNode node) {
        JsonNode itemControlNode = object(node, "itemControl");
        return PlanItem.builder()
                .id(text(node, "id"))
                .name(text(node, "name"))
                .documentation(documentation(node))
                .definitionRef(text(node, "definitionRef"))
                .entryCriteria(strings(node, "entryCriteria"))
                .exitCriteria(strings(node, "exitCriteria"))
                .reactivationCriteria(strings(node, "reactivationCriteria"))
                .itemControl(itemControlNode == null ? null : parseItemControl(itemControlNode))
                .build();
    }

    private static ItemControl parseItemControl(JsonNode node) {
        return new ItemControl(
                text(node, "id"),
                rule(node, "requiredRule"),
                rule(node, "repetitionRule"),
                rule(node, "manualActivationRule"));
    }

    /**
     * A rule is either the condition string itself or an object holding it under {@code condition}.
     */
    private static String rule(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value != null && value.isObject()) {
            return text(value, "condition");
        }
        return text(node, key);
    }

    private static Sentry parseSentry(JsonNode node) {
        List<OnPart> onParts = objects(node, "onParts", CmmnJsonParser::parseOnPart);
        // older documents list source refs under "onPart"
        for (JsonNode entry : array(node, "onPart")) {
            if (entry.isObject()) {
                onParts.add(parseOnPart(entry));
            } else if (entry.isValueNode() && !entry.isNull()) {
                onParts.add(new OnPart(entry.asText(), null));
            } else {
                throw new CmmnStructureException("Entries of 'onPart' must be objects or strings, got " + entry.getNodeType());
            }
        }

        IfPart ifPart = null;
        JsonNode ifPartNode = node.get("ifPart");
        if (ifPartNode != null && ifPartNode.isObject()) {
            ifPart = new IfPart(text(ifPartNode, "id"), text(ifPartNode, "condition"));
        } else {
            String condition = text(node, "ifPart");
            if (condition != null) {
                ifPart = new IfPart(null, condition);
            }
        }

        return new Sentry(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                onParts,
                ifPart);
    }

    private static OnPart parseOnPart(JsonNode node) {
        return new OnPart(
                text(node, "id"),
                text(node, "name"),
                text(node, "sourceRef"),
                text(node, "standardEvent"));
    }

    /**
     * An explicit {@code type} (or {@code taskType}) naming a task variant wins; otherwise the
     * variant follows from the keys present, defaulting to a human task.
     */
    private static Task parseTask(JsonNode node) {
        CmmnElementType taskType = explicitType(node, TASK_TYPES);
        if (taskType == null) {
            if (node.hasNonNull("processRef")) {
                taskType = CmmnElementType.PROCESS_TASK;
            } else if (node.hasNonNull("caseRef")) {
                taskType = CmmnElementType.CASE_TASK;
            } else if (node.hasNonNull("decisionRef")) {
                taskType = CmmnElementType.DECISION_TASK;
            } else {
                taskType = CmmnElementType.HUMAN_TASK;
            }
        }

        return Task.builder()
                .elementType(taskType)
                .id(text(node, "id"))
                .name(text(node, "name"))
                .documentation(documentation(node))
                .isBlocking(bool(node, "isBlocking", true))
                .performer(taskType == CmmnElementType.HUMAN_TASK ? text(node, "performer") : null)
                .formKey(taskType == CmmnElementType.HUMAN_TASK ? text(node, "formKey") : null)
                .processRef(taskType == CmmnElementType.PROCESS_TASK ? text(node, "processRef") : null)
                .caseRef(taskType == CmmnElementType.CASE_TASK ? text(node, "caseRef") : null)
                .decisionRef(taskType == CmmnElementType.DECISION_TASK ? text(node, "decisionRef") : null)
                .build();
    }

    private static EventListener parseEventListener(JsonNode node) {
        CmmnElementType listenerType = explicitType(node, EVENT_LISTENER_TYPES);
        if (listenerType == null) {
            if (node.hasNonNull("timerExpression")) {
                listenerType = CmmnElementType.TIMER_EVENT_LISTENER;
            } else if (node.hasNonNull("authorizedRoleRefs")) {
                listenerType = CmmnElementType.USER_EVENT_LISTENER;
            } else {
                listenerType = CmmnElementType.EVENT_LISTENER;
            }
        }

        return new EventListener(
                listenerType,
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                listenerType == CmmnElementType.TIMER_EVENT_LISTENER ? text(node, "timerExpression") : null,
                listenerType == CmmnElementType.USER_EVENT_LISTENER ? strings(node, "authorizedRoleRefs") : List.of());
    }

    private static Milestone parseMilestone(JsonNode node) {
        return new Milestone(text(node, "id"), text(node, "name"), documentation(node));
    }

    /**
     * Only "exit" selects an exit criterion. Everything else, "reactivation" included, is
     * read as an entry criterion.
     */
    private static Criterion parseCriterion(JsonNode node) {
        String type = text(node, "type");
        CmmnElementType criterionType = CmmnElementType.ENTRY_CRITERION;
        if ("exit".equals(type)) {
            criterionType = CmmnElementType.EXIT_CRITERION;
        } else if (type != null && !"entry".equals(type)) {
            logger.warn("Criterion '{}' has type '{}', reading it as an entry criterion", text(node, "id"), type);
        }

        return new Criterion(
                criterionType,
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                text(node, "sentryRef"));
    }

    private static CaseFileModel parseCaseFileModel(JsonNode node) {
        return new CaseFileModel(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                caseFileItems(node));
    }

    /**
     * Entries are objects, or plain strings naming the definition they refer to.
     */
    private static List<CaseFileItem> caseFileItems(JsonNode node) {
        List<CaseFileItem> items = new ArrayList<>();
        for (JsonNode entry : array(node, "caseFileItems")) {
            if (entry.isTextual()) {
                items.add(CaseFileItem.builder().definitionRef(entry.asText()).build());
            } else if (entry.isObject()) {
                items.add(parseCaseFileItem(entry));
            } else {
                throw new CmmnStructureException("Entries of 'caseFileItems' must be objects or strings, got " + entry.getNodeType());
            }
        }
        return items;
    }

    private static CaseFileItem parseCaseFileItem(JsonNode node) {
        return CaseFileItem.builder()
                .id(text(node, "id"))
                .name(text(node, "name"))
                .documentation(documentation(node))
                .definitionRef(text(node, "definitionRef"))
                .definitionType(text(node, "definitionType"))
                .multiplicity(text(node, "multiplicity"))
                .sourceRef(text(node, "sourceRef"))
                .targetRefs(strings(node, "targetRefs"))
                .children(objects(node, "children", CmmnJsonParser::parseCaseFileItem))
                .build();
    }

    private static Process parseProcess(JsonNode node) {
        return new Process(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                bool(node, "isExecutable", true),
                text(node, "implementationType"));
    }

    private static Decision parseDecision(JsonNode node) {
        return new Decision(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                text(node, "decisionLogic"));
    }

    private static Association parseAssociation(JsonNode node) {
        return new Association(
                text(node, "id"),
                text(node, "name"),
                documentation(node),
                text(node, "sourceRef"),
                text(node, "targetRef"),
                text(node, "associationDirection"));
    }

    private static Map<String, ExtensionValue> parseExtensionElements(JsonNode node) {
        Map<String, ExtensionValue> elements = new LinkedHashMap<>();
        JsonNode extensionNode = object(node, "extensionElements");
        if (extensionNode == null) {
            return elements;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = extensionNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            elements.put(field.getKey(), toExtensionValue(field.getValue()));
        }
        return elements;
    }

    static ExtensionValue toExtensionValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return new ExtensionValue.Scalar(null);
        }
        if (node.isObject()) {
            Map<String, ExtensionValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toExtensionValue(field.getValue()));
            }
            return new ExtensionValue.Mapping(entries);
        }
        if (node.isArray()) {
            List<ExtensionValue> values = new ArrayList<>();
            for (JsonNode element : node) {
                values.add(toExtensionValue(element));
            }
            return new ExtensionValue.Sequence(values);
        }
        if (node.isBoolean()) {
            return new ExtensionValue.Scalar(node.booleanValue());
        }
        if (node.isNumber()) {
            return new ExtensionValue.Scalar(node.numberValue());
        }
        return new ExtensionValue.Scalar(node.asText());
    }

    // ---------------------------------------------------------------- key access

    private static CmmnElementType explicitType(JsonNode node, Set<CmmnElementType> allowed) {
        String type = text(node, "type");
        if (type == null) {
            type = text(node, "taskType");
        }
        CmmnElementType elementType = CmmnElementType.fromTagName(type);
        return allowed.contains(elementType) ? elementType : null;
    }

    private static String documentation(JsonNode node) {
        String documentation = text(node, "documentation");
        return documentation != null ? documentation : text(node, "description");
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isContainerNode()) {
            throw wrongShape(key, "a string", value);
        }
        return value.asText();
    }

    private static boolean bool(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return "true".equalsIgnoreCase(value.asText().trim());
        }
        throw wrongShape(key, "a boolean", value);
    }

    private static JsonNode object(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw wrongShape(key, "an object", value);
        }
        return value;
    }

    private static Iterable<JsonNode> array(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw wrongShape(key, "an array", value);
        }
        return value;
    }

    private static <T> List<T> objects(JsonNode node, String key, Function<JsonNode, T> mapper) {
        List<T> result = new ArrayList<>();
        for (JsonNode entry : array(node, key)) {
            if (!entry.isObject()) {
                throw new CmmnStructureException("Entries of '" + key + "' must be objects, got " + entry.getNodeType());
            }
            result.add(mapper.apply(entry));
        }
        return result;
    }

    private static List<String> strings(JsonNode node, String key) {
        List<String> result = new ArrayList<>();
        for (JsonNode entry : array(node, key)) {
            if (entry.isContainerNode() || entry.isNull()) {
                throw new CmmnStructureException("Entries of '" + key + "' must be strings, got " + entry.getNodeType());
            }
            result.add(entry.asText());
        }
        return result;
    }

    private static CmmnStructureException wrongShape(String key, String expected, JsonNode actual) {
        return new CmmnStructureException("Key '" + key + "' must be " + expected + ", got " + actual.getNodeType());
    }
}
