package org.cmmn.parser.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.cmmn.parser.exceptions.CmmnStructureException;
import org.cmmn.parser.exceptions.CmmnSyntaxException;
import org.cmmn.parser.models.Case;
import org.cmmn.parser.models.CaseFileItem;
import org.cmmn.parser.models.CmmnElementType;
import org.cmmn.parser.models.Definitions;
import org.cmmn.parser.models.ExtensionValue;
import org.cmmn.parser.models.PlanItem;
import org.cmmn.parser.models.Sentry;
import org.cmmn.parser.models.Stage;
import org.cmmn.parser.models.Task;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CmmnJsonParserTest {
    private static final String MINIMAL_JSON = "src/test/resources/models/json/minimal.json";
    private static final String SAMPLE_JSON = "src/test/resources/models/json/sample.json";
    private static final String WRAPPED_JSON = "src/test/resources/models/json/wrapped.json";

    private static String read(String path) throws IOException {
        return Files.readString(Path.of(path));
    }

    private static Task singleTask(String taskJson) {
        String json = "{\"cases\":[{\"id\":\"C1\",\"casePlanModel\":{\"id\":\"P1\",\"tasks\":[" + taskJson + "]}}]}";
        return CmmnJsonParser.parse(json).cases().get(0).casePlanModel().tasks().get(0);
    }

    @Test
    void shouldParseMinimalDocument() throws IOException {
        Definitions definitions = CmmnJsonParser.parse(read(MINIMAL_JSON));

        assertEquals("Definitions_1", definitions.id());
        Stage plan = definitions.cases().get(0).casePlanModel();
        assertEquals("P1", plan.id());
        assertEquals(CmmnElementType.CASE_PLAN_MODEL, plan.elementType());
        assertFalse(plan.autoComplete());
        assertTrue(definitions.imports().isEmpty());
        assertTrue(definitions.extensionElements().isEmpty());
    }

    @Test
    void shouldParseCaseWithoutPlanModel() {
        Definitions definitions = CmmnJsonParser.parse("{\"cases\":[{\"id\":\"C1\"}]}");

        Case aCase = definitions.cases().get(0);
        assertEquals("C1", aCase.id());
        assertNull(aCase.casePlanModel());
        assertNull(aCase.caseFileModel());
    }

    @Test
    void shouldUnwrapDefinitionsObject() throws IOException {
        Definitions definitions = CmmnJsonParser.parse(read(WRAPPED_JSON));

        assertEquals("Definitions_Wrapped", definitions.id());
        Task task = definitions.cases().get(0).casePlanModel().tasks().get(0);
        assertEquals(CmmnElementType.HUMAN_TASK, task.elementType());
        assertEquals("forms/start", task.formKey());
    }

    @Test
    void shouldMergeFlatListsAndBuckets() throws IOException {
        Stage plan = CmmnJsonParser.parse(read(SAMPLE_JSON)).cases().get(0).casePlanModel();

        assertTrue(plan.autoComplete());
        List<Task> tasks = plan.tasks();
        assertEquals(4, tasks.size());
        assertEquals(List.of("Task_Check", "Task_Ship", "Task_Plain", "Task_Rate"),
                tasks.stream().map(Task::id).toList());

        assertEquals(1, plan.milestones().size());
        assertEquals(1, plan.stages().size());
        Stage billing = plan.stages().get(0);
        assertEquals(CmmnElementType.STAGE, billing.elementType());
        assertEquals(CmmnElementType.CASE_TASK, billing.tasks().get(0).elementType());
        assertEquals("Case_Invoice", billing.tasks().get(0).caseRef());
    }

    @Test
    void shouldDiscriminateTasks() throws IOException {
        List<Task> tasks = CmmnJsonParser.parse(read(SAMPLE_JSON)).cases().get(0).casePlanModel().tasks();

        assertEquals(CmmnElementType.HUMAN_TASK, tasks.get(0).elementType());
        assertEquals("Role_Clerk", tasks.get(0).performer());
        assertEquals(CmmnElementType.PROCESS_TASK, tasks.get(1).elementType());
        assertEquals("Process_Ship", tasks.get(1).processRef());
        assertEquals(CmmnElementType.TASK, tasks.get(2).elementType());
        assertFalse(tasks.get(2).isBlocking());
        assertEquals(CmmnElementType.DECISION_TASK, tasks.get(3).elementType());
        assertEquals("Decision_Rate", tasks.get(3).decisionRef());
    }

    @Test
    void shouldDefaultToHumanTaskWhenNothingDiscriminates() {
        Task task = singleTask("{\"id\":\"T1\"}");
        assertEquals(CmmnElementType.HUMAN_TASK, task.elementType());
        assertTrue(task.isBlocking());
    }

    @Test
    void shouldPreferExplicitTypeOverStructure() {
        Task task = singleTask("{\"id\":\"T1\",\"type\":\"processTask\",\"processRef\":\"p1\",\"performer\":\"bob\"}");
        assertEquals(CmmnElementType.PROCESS_TASK, task.elementType());
        assertEquals("p1", task.processRef());
        assertNull(task.performer());

        Task human = singleTask("{\"id\":\"T2\",\"performer\":\"bob\"}");
        assertEquals(CmmnElementType.HUMAN_TASK, human.elementType());
        assertEquals("bob", human.performer());
    }

    @Test
    void shouldFallBackToStructureForUnknownType() {
        Task task = singleTask("{\"id\":\"T1\",\"type\":\"robotTask\",\"caseRef\":\"c2\"}");
        assertEquals(CmmnElementType.CASE_TASK, task.elementType());
    }

    @Test
    void shouldDiscriminateEventListeners() throws IOException {
        Stage plan = CmmnJsonParser.parse(read(SAMPLE_JSON)).cases().get(0).casePlanModel();

        assertEquals(CmmnElementType.TIMER_EVENT_LISTENER, plan.eventDefinitions().get(0).elementType());
        assertEquals("PT1H", plan.eventDefinitions().get(0).timerExpression());
        assertEquals(CmmnElementType.USER_EVENT_LISTENER, plan.eventDefinitions().get(1).elementType());
        assertEquals(List.of("Role_Clerk"), plan.eventDefinitions().get(1).authorizedRoleRefs());
    }

    @Test
    void shouldReadUnknownCriterionTypeAsEntry() {
        String json = """
                {"cases":[{"id":"C1","casePlanModel":{"id":"P1","criteriaDefinitions":[
                  {"id":"A","type":"exit"},
                  {"id":"B","type":"reactivation"},
                  {"id":"C"}
                ]}}]}
                """;

        Stage plan = CmmnJsonParser.parse(json).cases().get(0).casePlanModel();

        assertEquals(CmmnElementType.EXIT_CRITERION, plan.criteriaDefinitions().get(0).elementType());
        assertEquals(CmmnElementType.ENTRY_CRITERION, plan.criteriaDefinitions().get(1).elementType());
        assertEquals(CmmnElementType.ENTRY_CRITERION, plan.criteriaDefinitions().get(2).elementType());
    }

    @Test
    void shouldAcceptLegacySentryShapes() throws IOException {
        List<Sentry> sentries = CmmnJsonParser.parse(read(SAMPLE_JSON)).cases().get(0).casePlanModel().sentries();

        Sentry received = sentries.get(0);
        assertEquals(1, received.onParts().size());
        assertEquals("PI_Receive", received.onParts().get(0).sourceRef());
        assertNull(received.onParts().get(0).standardEvent());
        assertEquals("${paid}", received.ifPart().condition());
        assertNull(received.ifPart().id());

        Sentry checked = sentries.get(1);
        assertEquals("OnPart_Checked", checked.onParts().get(0).id());
        assertEquals("complete", checked.onParts().get(0).standardEvent());
        assertEquals("IfPart_Checked", checked.ifPart().id());
        assertEquals("${ok}", checked.ifPart().condition());
    }

    @Test
    void shouldAcceptItemControlRulesAsStringsOrObjects() throws IOException {
        PlanItem check = CmmnJsonParser.parse(read(SAMPLE_JSON)).cases().get(0).casePlanModel().planItems().get(0);

        assertEquals(List.of("Sentry_Received"), check.entryCriteria());
        assertTrue(check.exitCriteria().isEmpty());
        assertEquals("${mandatory}", check.itemControl().requiredRule());
        assertEquals("${again}", check.itemControl().repetitionRule());
        assertNull(check.itemControl().manualActivationRule());
    }

    @Test
    void shouldAcceptAliasesAndStringCaseFileItems() throws IOException {
        Definitions definitions = CmmnJsonParser.parse(read(SAMPLE_JSON));
        Case order = definitions.cases().get(0);

        assertEquals("Order fulfilment", order.documentation());
        assertEquals(1, order.caseRoles().size());
        assertEquals("Clerk", order.caseRoles().get(0).name());

        List<CaseFileItem> items = order.caseFileModel().caseFileItems();
        assertEquals(2, items.size());
        assertEquals("CFID_Order", items.get(0).definitionRef());
        assertNull(items.get(0).id());
        assertEquals("ZeroOrOne", items.get(1).multiplicity());
        assertEquals("CFI_Line", items.get(1).children().get(0).id());

        assertEquals(List.of("orderId"), definitions.caseFileItemDefinitions().get(0).definitiveProperties());
        assertFalse(definitions.processes().get(0).isExecutable());
    }

    @Test
    void shouldConvertExtensionValues() throws IOException {
        Definitions definitions = CmmnJsonParser.parse(read(SAMPLE_JSON));

        ExtensionValue.Mapping vendor = (ExtensionValue.Mapping) definitions.extensionElements().get("vendor");
        assertEquals(new ExtensionValue.Scalar(3), vendor.get("version"));
        assertEquals(new ExtensionValue.Scalar(true), vendor.get("enabled"));
        assertEquals(new ExtensionValue.Scalar(0.5), vendor.get("ratio"));
        assertEquals(new ExtensionValue.Scalar(null), vendor.get("missing"));
        assertEquals(new ExtensionValue.Sequence(List.of(new ExtensionValue.Scalar("a"), new ExtensionValue.Scalar("b"))),
                vendor.get("tags"));
    }

    @Test
    void shouldParseDecodedMapsLikeText() throws IOException {
        String json = read(SAMPLE_JSON);
        @SuppressWarnings("unchecked")
        Map<String, Object> decoded = new ObjectMapper().readValue(json, Map.class);

        assertEquals(CmmnJsonParser.parse(json), CmmnJsonParser.parse(decoded));
    }

    @Test
    void shouldThrowSyntaxErrorWhenMalformed() {
        assertThrows(CmmnSyntaxException.class, () -> CmmnJsonParser.parse("{\"cases\": ["));
    }

    @Test
    void shouldThrowSyntaxErrorWhenContentFollowsDocument() {
        CmmnSyntaxException e = assertThrows(CmmnSyntaxException.class,
                () -> CmmnJsonParser.parse("{\"cases\":[{\"id\":\"C1\"}]} }garbage"));
        assertTrue(e.getMessage().startsWith("Invalid JSON format"));
        assertThrows(CmmnSyntaxException.class, () -> CmmnJsonParser.readTree("{} {}"));
    }

    @Test
    void shouldThrowStructureErrorWhenNotAnObject() {
        assertThrows(CmmnStructureException.class, () -> CmmnJsonParser.parse("[1, 2]"));
    }

    @Test
    void shouldThrowStructureErrorWhenKeyHasWrongShape() {
        assertThrows(CmmnStructureException.class, () -> CmmnJsonParser.parse("{\"cases\": {\"id\": \"C1\"}}"));
        assertThrows(CmmnStructureException.class,
                () -> CmmnJsonParser.parse("{\"cases\": [{\"id\": \"C1\", \"casePlanModel\": []}]}"));
        assertThrows(CmmnStructureException.class, () -> CmmnJsonParser.parse("{\"id\": {\"nested\": true}}"));
    }
}
