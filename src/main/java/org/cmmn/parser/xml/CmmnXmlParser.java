package org.cmmn.parser.xml;

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
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link Definitions} tree from CMMN XML.
 * <p>
 * Elements are dispatched on their local name, so CMMN 1.1 and CMMN 1.0 documents (and
 * documents without a namespace) are read the same way. Both stage shapes found in the
 * wild are accepted: definitions nested directly in the case plan model and plan items
 * that only reference them.
 */
public class CmmnXmlParser {
    private static final Logger logger = LoggerFactory.getLogger(CmmnXmlParser.class);

    public static final String CMMN_11_NS = "http://www.omg.org/spec/CMMN/20151109/MODEL";
    public static final String CMMN_10_NS = "http://www.omg.org/spec/CMMN/20131201/MODEL";

    private static final Set<String> TASK_TAGS = Set.of(
            "task", "humanTask", "processTask", "caseTask", "decisionTask");
    private static final Set<String> EVENT_LISTENER_TAGS = Set.of(
            "eventListener", "timerEventListener", "userEventListener");
    private static final Set<String> ON_PART_TAGS = Set.of(
            "onPart", "planItemOnPart", "caseFileItemOnPart");

    private static final ErrorHandler RAISING_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            logger.debug("XML parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    /**
     * Parses CMMN XML text.
     *
     * @param xmlContent the XML document
     * @return the parsed definitions
     * @throws CmmnSyntaxException    if the text is not well-formed XML
     * @throws CmmnStructureException if the root element is not {@code definitions}
     */
    public static Definitions parse(String xmlContent) {
        if (xmlContent == null) {
            throw new CmmnSyntaxException("XML content must not be null");
        }
        return parse(new InputSource(new StringReader(xmlContent)));
    }

    /**
     * Parses CMMN XML from a byte stream, honouring the encoding declared in the prolog.
     */
    public static Definitions parse(InputStream xmlStream) {
        return parse(new InputSource(xmlStream));
    }

    private static Definitions parse(InputSource source) {
        Document doc = readDocument(source);

        Element definitionsEl = doc.getDocumentElement();
        String rootName = localName(definitionsEl);
        if (!"definitions".equals(rootName)) {
            throw new CmmnStructureException("Root element must be 'definitions', got '" + rootName + "'");
        }

        Definitions definitions = parseDefinitions(definitionsEl);
        logger.debug("Parsed CMMN XML definitions '{}' with {} case(s)", definitions.id(), definitions.cases().size());
        return definitions;
    }

    /**
     * Reads a DOM document with a namespace-aware, non-validating parser that raises on
     * every error instead of printing it.
     *
     * @throws CmmnSyntaxException if the content is not well-formed or cannot be decoded
     */
    public static Document readDocument(InputSource source) {
        try {
            return newDocumentBuilder().parse(source);
        } catch (SAXException e) {
            throw new CmmnSyntaxException("Invalid XML syntax: " + e.getMessage(), e);
        } catch (IOException e) {
            // malformed byte sequences in the declared encoding end up here
            throw new CmmnSyntaxException("Unable to read XML content: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RAISING_ERROR_HANDLER);
            return builder;
        } catch (ParserConfigurationException | IllegalArgumentException e) {
            throw new IllegalStateException("Unable to configure XML parser", e);
        }
    }

    private static Definitions parseDefinitions(Element definitionsEl) {
        List<Import> imports = new ArrayList<>();
        List<CaseFileItemDefinition> caseFileItemDefinitions = new ArrayList<>();
        List<Case> cases = new ArrayList<>();
        List<Process> processes = new ArrayList<>();
        List<Decision> decisions = new ArrayList<>();
        List<Association> associations = new ArrayList<>();
        Map<String, ExtensionValue> extensionElements = new LinkedHashMap<>();

        for (Element child : childElements(definitionsEl)) {
            switch (localName(child)) {
                case "import" -> imports.add(parseImport(child));
                case "caseFileItemDefinition" -> caseFileItemDefinitions.add(parseCaseFileItemDefinition(child));
                case "case" -> cases.add(parseCase(child));
                case "process" -> processes.add(parseProcess(child));
                case "decision" -> decisions.add(parseDecision(child));
                case "association" -> associations.add(parseAssociation(child));
                case "extensionElements" -> extensionElements.putAll(parseExtensionElements(child));
                default -> {
                    // diagram interchange, artifacts and unknown vendor content are not modelled
                }
            }
        }

        return Definitions.builder()
                .id(attr(definitionsEl, "id"))
                .name(attr(definitionsEl, "name"))
                .documentation(documentation(definitionsEl))
                .targetNamespace(attr(definitionsEl, "targetNamespace"))
                .expressionLanguage(attr(definitionsEl, "expressionLanguage"))
                .exporter(attr(definitionsEl, "exporter"))
                .exporterVersion(attr(definitionsEl, "exporterVersion"))
                .author(attr(definitionsEl, "author"))
                .creationDate(attr(definitionsEl, "creationDate"))
                .imports(imports)
                .caseFileItemDefinitions(caseFileItemDefinitions)
                .cases(cases)
                .processes(processes)
                .decisions(decisions)
                .associations(associations)
                .extensionElements(extensionElements)
                .build();
    }

    private static Import parseImport(Element importEl) {
        return new Import(
                attr(importEl, "id"),
                attr(importEl, "name"),
                documentation(importEl),
                attr(importEl, "namespace"),
                attr(importEl, "location"),
                attr(importEl, "importType"));
    }

    private static CaseFileItemDefinition parseCaseFileItemDefinition(Element definitionEl) {
        List<String> definitiveProperties = new ArrayList<>();
        for (Element child : childElements(definitionEl, "definitiveProperty")) {
            String propertyName = attr(child, "name");
            if (propertyName != null) {
                definitiveProperties.add(propertyName);
            }
        }

        return new CaseFileItemDefinition(
                attr(definitionEl, "id"),
                attr(definitionEl, "name"),
                documentation(definitionEl),
                attr(definitionEl, "structureRef"),
                attr(definitionEl, "definitionType"),
                definitiveProperties);
    }

    private static Case parseCase(Element caseEl) {
        Stage casePlanModel = null;
        CaseFileModel caseFileModel = null;
        List<Role> caseRoles = new ArrayList<>();

        for (Element child : childElements(caseEl)) {
            switch (localName(child)) {
                case "casePlanModel" -> casePlanModel = parseStage(child, CmmnElementType.CASE_PLAN_MODEL);
                case "caseFileModel" -> caseFileModel = parseCaseFileModel(child);
                case "caseRoles" -> caseRoles.addAll(parseCaseRoles(child));
                default -> {
                }
            }
        }

        return Case.builder()
                .id(attr(caseEl, "id"))
                .name(attr(caseEl, "name"))
                .documentation(documentation(caseEl))
                .casePlanModel(casePlanModel)
                .caseFileModel(caseFileModel)
                .caseRoles(caseRoles)
                .build();
    }

    /**
     * CMMN 1.1 wraps roles in a single {@code caseRoles} element; CMMN 1.0 repeats
     * {@code caseRoles} once per role.
     */
    private static List<Role> parseCaseRoles(Element caseRolesEl) {
        List<Element> roleEls = childElements(caseRolesEl, "role");
        List<Role> roles = new ArrayList<>();
        if (roleEls.isEmpty()) {
            if (attr(caseRolesEl, "id") != null || attr(caseRolesEl, "name") != null) {
                roles.add(parseRole(caseRolesEl));
            }
            return roles;
        }
        for (Element roleEl : roleEls) {
            roles.add(parseRole(roleEl));
        }
        return roles;
    }

    private static Role parseRole(Element roleEl) {
        return new Role(attr(roleEl, "id"), attr(roleEl, "name"), documentation(roleEl));
    }

    private static Stage parseStage(Element stageEl, CmmnElementType stageType) {
        List<PlanItem> planItems = new ArrayList<>();
        List<Sentry> sentries = new ArrayList<>();
        List<CaseFileItem> caseFileItems = new ArrayList<>();
        List<Task> tasks = new ArrayList<>();
        List<EventListener> eventListeners = new ArrayList<>();
        List<Milestone> milestones = new ArrayList<>();
        List<Stage> stages = new ArrayList<>();
        List<Criterion> criteria = new ArrayList<>();

        for (Element child : childElements(stageEl)) {
            String tag = localName(child);
            if (TASK_TAGS.contains(tag)) {
                tasks.add(parseTask(child));
            } else if (EVENT_LISTENER_TAGS.contains(tag)) {
                eventListeners.add(parseEventListener(child));
            } else {
                switch (tag) {
                    case "planItem" -> planItems.add(parsePlanItem(child));
                    case "sentry" -> sentries.add(parseSentry(child));
                    case "caseFileItem" -> caseFileItems.add(parseCaseFileItem(child));
                    case "milestone" -> milestones.add(parseMilestone(child));
                    case "stage" -> stages.add(parseStage(child, CmmnElementType.STAGE));
                    case "entryCriterion", "exitCriterion" -> criteria.add(parseCriterion(child));
                    default -> {
                    }
                }
            }
        }

        return Stage.builder()
                .elementType(stageType)
                .id(attr(stageEl, "id"))
                .name(attr(stageEl, "name"))
                .documentation(documentation(stageEl))
                .autoComplete(booleanAttr(stageEl, "autoComplete", false))
                .planItems(planItems)
                .sentries(sentries)
                .caseFileItems(caseFileItems)
                .taskDefinitions(tasks)
                .eventDefinitions(eventListeners)
                .milestoneDefinitions(milestones)
                .stageDefinitions(stages)
                .criteriaDefinitions(criteria)
                .build();
    }

    private static PlanItem parsePlanItem(Element planItemEl) {
        List<String> entryCriteria = refs(planItemEl, "entryCriteriaRefs");
        List<String> exitCriteria = refs(planItemEl, "exitCriteriaRefs");
        List<String> reactivationCriteria = refs(planItemEl, "reactivationCriteriaRefs");
        ItemControl itemControl = null;

        for (Element child : childElements(planItemEl)) {
            switch (localName(child)) {
                case "entryCriterion" -> addIfPresent(entryCriteria, attr(child, "sentryRef"));
                case "exitCriterion" -> addIfPresent(exitCriteria, attr(child, "sentryRef"));
                case "itemControl" -> itemControl = parseItemControl(child);
                default -> {
                }
            }
        }

        return PlanItem.builder()
                .id(attr(planItemEl, "id"))
                .name(attr(planItemEl, "name"))
                .documentation(documentation(planItemEl))
                .definitionRef(attr(planItemEl, "definitionRef"))
                .entryCriteria(entryCriteria)
                .exitCriteria(exitCriteria)
                .reactivationCriteria(reactivationCriteria)
                .itemControl(itemControl)
                .build();
    }

    private static ItemControl parseItemControl(Element itemControlEl) {
        return new ItemControl(
                attr(itemControlEl, "id"),
                ruleCondition(itemControlEl, "requiredRule"),
                ruleCondition(itemControlEl, "repetitionRule"),
                ruleCondition(itemControlEl, "manualActivationRule"));
    }

    private static String ruleCondition(Element itemControlEl, String ruleTag) {
        Element ruleEl = firstChildElement(itemControlEl, ruleTag);
        if (ruleEl == null) {
            return null;
        }
        return childText(ruleEl, "condition");
    }

    private static Sentry parseSentry(Element sentryEl) {
        List<OnPart> onParts = new ArrayList<>();
        IfPart ifPart = null;

        for (Element child : childElements(sentryEl)) {
            String tag = localName(child);
            if (ON_PART_TAGS.contains(tag)) {
                onParts.add(new OnPart(
                        attr(child, "id"),
                        attr(child, "name"),
                        attr(child, "sourceRef"),
                        childText(child, "standardEvent")));
            } else if ("ifPart".equals(tag)) {
                String condition = childText(child, "condition");
                if (condition == null) {
                    condition = ownText(child);
                }
                ifPart = new IfPart(attr(child, "id"), condition);
            }
        }

        return new Sentry(
                attr(sentryEl, "id"),
                attr(sentryEl, "name"),
                documentation(sentryEl),
                onParts,
                ifPart);
    }

    private static Task parseTask(Element taskEl) {
        CmmnElementType taskType = CmmnElementType.fromTagName(localName(taskEl));

        String performer = attr(taskEl, "performer");
        if (performer == null) {
            performer = attr(taskEl, "performerRef");
        }

        return Task.builder()
                .elementType(taskType)
                .id(attr(taskEl, "id"))
                .name(attr(taskEl, "name"))
                .documentation(documentation(taskEl))
                .isBlocking(booleanAttr(taskEl, "isBlocking", true))
                .performer(taskType == CmmnElementType.HUMAN_TASK ? performer : null)
                .formKey(taskType == CmmnElementType.HUMAN_TASK ? attr(taskEl, "formKey") : null)
                .processRef(taskType == CmmnElementType.PROCESS_TASK ? attr(taskEl, "processRef") : null)
                .caseRef(taskType == CmmnElementType.CASE_TASK ? attr(taskEl, "caseRef") : null)
                .decisionRef(taskType == CmmnElementType.DECISION_TASK ? attr(taskEl, "decisionRef") : null)
                .build();
    }

    private static EventListener parseEventListener(Element listenerEl) {
        CmmnElementType listenerType = CmmnElementType.fromTagName(localName(listenerEl));

        String timerExpression = null;
        List<String> authorizedRoleRefs = new ArrayList<>();
        if (listenerType == CmmnElementType.TIMER_EVENT_LISTENER) {
            timerExpression = childText(listenerEl, "timerExpression");
        } else if (listenerType == CmmnElementType.USER_EVENT_LISTENER) {
            authorizedRoleRefs = refs(listenerEl, "authorizedRoleRefs");
        }

        return new EventListener(
                listenerType,
                attr(listenerEl, "id"),
                attr(listenerEl, "name"),
                documentation(listenerEl),
                timerExpression,
                authorizedRoleRefs);
    }

    private static Milestone parseMilestone(Element milestoneEl) {
        return new Milestone(attr(milestoneEl, "id"), attr(milestoneEl, "name"), documentation(milestoneEl));
    }

    private static Criterion parseCriterion(Element criterionEl) {
        return new Criterion(
                CmmnElementType.fromTagName(localName(criterionEl)),
                attr(criterionEl, "id"),
                attr(criterionEl, "name"),
                documentation(criterionEl),
                attr(criterionEl, "sentryRef"));
    }

    private static CaseFileModel parseCaseFileModel(Element caseFileModelEl) {
        List<CaseFileItem> items = new ArrayList<>();
        for (Element itemEl : childElements(caseFileModelEl, "caseFileItem")) {
            items.add(parseCaseFileItem(itemEl));
        }
        return new CaseFileModel(
                attr(caseFileModelEl, "id"),
                attr(caseFileModelEl, "name"),
                documentation(caseFileModelEl),
                items);
    }

    private static CaseFileItem parseCaseFileItem(Element itemEl) {
        List<CaseFileItem> children = new ArrayList<>();
        for (Element child : childElements(itemEl)) {
            String tag = localName(child);
            if ("caseFileItem".equals(tag)) {
                children.add(parseCaseFileItem(child));
            } else if ("children".equals(tag)) {
                for (Element nested : childElements(child, "caseFileItem")) {
                    children.add(parseCaseFileItem(nested));
                }
            }
        }

        return CaseFileItem.builder()
                .id(attr(itemEl, "id"))
                .name(attr(itemEl, "name"))
                .documentation(documentation(itemEl))
                .definitionRef(attr(itemEl, "definitionRef"))
                .definitionType(attr(itemEl, "definitionType"))
                .multiplicity(attr(itemEl, "multiplicity"))
                .sourceRef(attr(itemEl, "sourceRef"))
                .targetRefs(refs(itemEl, "targetRefs"))
                .children(children)
                .build();
    }

    private static Process parseProcess(Element processEl) {
        return new Process(
                attr(processEl, "id"),
                attr(processEl, "name"),
                documentation(processEl),
                booleanAttr(processEl, "isExecutable", true),
                attr(processEl, "implementationType"));
    }

    private static Decision parseDecision(Element decisionEl) {
        return new Decision(
                attr(decisionEl, "id"),
                attr(decisionEl, "name"),
                documentation(decisionEl),
                childText(decisionEl, "decisionLogic"));
    }

    private static Association parseAssociation(Element associationEl) {
        return new Association(
                attr(associationEl, "id"),
                attr(associationEl, "name"),
                documentation(associationEl),
                attr(associationEl, "sourceRef"),
                attr(associationEl, "targetRef"),
                attr(associationEl, "associationDirection"));
    }

    /**
     * Vendor extensions keyed by tag. A repeated tag keeps its last occurrence.
     */
    private static Map<String, ExtensionValue> parseExtensionElements(Element extensionEl) {
        Map<String, ExtensionValue> elements = new LinkedHashMap<>();
        for (Element child : childElements(extensionEl)) {
            elements.put(localName(child), elementToValue(child));
        }
        return elements;
    }

    /**
     * Generic conversion used for vendor content: attributes become entries, non-blank
     * text goes under "text", child elements are grouped by tag under "children".
     */
    static ExtensionValue.Mapping elementToValue(Element element) {
        Map<String, ExtensionValue> entries = new LinkedHashMap<>();

        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
                continue;
            }
            entries.put(attribute.getName(), new ExtensionValue.Scalar(attribute.getValue()));
        }

        String text = ownText(element);
        if (text != null) {
            entries.put("text", new ExtensionValue.Scalar(text));
        }

        Map<String, List<ExtensionValue>> childrenByTag = new LinkedHashMap<>();
        for (Element child : childElements(element)) {
            childrenByTag.computeIfAbsent(localName(child), tag -> new ArrayList<>()).add(elementToValue(child));
        }
        if (!childrenByTag.isEmpty()) {
            Map<String, ExtensionValue> children = new LinkedHashMap<>();
            childrenByTag.forEach((tag, values) -> children.put(tag, new ExtensionValue.Sequence(values)));
            entries.put("children", new ExtensionValue.Mapping(children));
        }

        return new ExtensionValue.Mapping(entries);
    }

    // ---------------------------------------------------------------- DOM helpers

    static String localName(Node node) {
        String localName = node.getLocalName();
        if (localName != null) {
            return localName;
        }
        String nodeName = node.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static List<Element> childElements(Element parent, String tag) {
        List<Element> elements = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (tag.equals(localName(child))) {
                elements.add(child);
            }
        }
        return elements;
    }

    private static Element firstChildElement(Element parent, String tag) {
        for (Element child : childElements(parent)) {
            if (tag.equals(localName(child))) {
                return child;
            }
        }
        return null;
    }

    /**
     * DOM returns "" for missing attributes; the model wants null.
     */
    private static String attr(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static boolean booleanAttr(Element element, String name, boolean defaultValue) {
        String value = attr(element, name);
        if (value == null) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim());
    }

    /**
     * Space separated id list; never null.
     */
    private static List<String> refs(Element element, String name) {
        List<String> refs = new ArrayList<>();
        String value = attr(element, name);
        if (value == null || value.isBlank()) {
            return refs;
        }
        for (String ref : value.strip().split("\\s+")) {
            refs.add(ref);
        }
        return refs;
    }

    private static void addIfPresent(List<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value);
        }
    }

    private static String childText(Element parent, String tag) {
        Element child = firstChildElement(parent, tag);
        if (child == null) {
            return null;
        }
        String text = child.getTextContent();
        return text == null ? null : text.trim();
    }

    /**
     * Text and CDATA directly under the element, trimmed; null when blank.
     */
    private static String ownText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        String trimmed = text.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String documentation(Element element) {
        String documentation = childText(element, "documentation");
        if (documentation != null) {
            return documentation;
        }
        return attr(element, "description");
    }
}
