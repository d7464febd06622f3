package org.cmmn.parser.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.cmmn.parser.models.Case;
import org.cmmn.parser.models.CmmnElementType;
import org.cmmn.parser.models.Criterion;
import org.cmmn.parser.models.Definitions;
import org.cmmn.parser.models.Stage;
import org.cmmn.parser.models.Task;
import org.cmmn.parser.xml.CmmnXmlParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CmmnJsonSerializerTest {
    private static final String SAMPLE_CMMN = "src/test/resources/models/xml/sample.cmmn";
    private static final String LEGACY_CMMN = "src/test/resources/models/xml/legacy_cmmn10.xml";
    private static final String SAMPLE_JSON = "src/test/resources/models/json/sample.json";

    private static String read(String path) throws IOException {
        return Files.readString(Path.of(path));
    }

    @Test
    void shouldRoundTripXmlThroughJson() throws IOException {
        for (String path : List.of(SAMPLE_CMMN, LEGACY_CMMN)) {
            Definitions fromXml = CmmnXmlParser.parse(read(path));

            Definitions fromJson = CmmnJsonParser.parse(CmmnJsonSerializer.toJson(fromXml));

            assertEquals(fromXml, fromJson, "round trip of " + path);
        }
    }

    @Test
    void shouldRoundTripJsonThroughJson() throws IOException {
        Definitions original = CmmnJsonParser.parse(read(SAMPLE_JSON));

        Definitions reparsed = CmmnJsonParser.parse(CmmnJsonSerializer.toJsonString(original));

        assertEquals(original, reparsed);
    }

    @Test
    void shouldBeIdempotent() throws IOException {
        Definitions definitions = CmmnXmlParser.parse(read(SAMPLE_CMMN));

        ObjectNode first = CmmnJsonSerializer.toJson(definitions);
        ObjectNode second = CmmnJsonSerializer.toJson(CmmnJsonParser.parse(first));

        assertEquals(first, second);
        assertEquals(CmmnJsonSerializer.toJson(definitions), first);
    }

    @Test
    void shouldOmitNullScalarsButAlwaysWriteBooleansAndLists() {
        Definitions definitions = Definitions.builder()
                .cases(List.of(Case.builder()
                        .id("C1")
                        .casePlanModel(Stage.casePlanModel("P1", null))
                        .build()))
                .build();

        ObjectNode json = CmmnJsonSerializer.toJson(definitions);

        assertFalse(json.has("id"));
        assertFalse(json.has("targetNamespace"));
        assertTrue(json.get("imports").isArray());
        assertTrue(json.get("extensionElements").isObject());

        JsonNode aCase = json.get("cases").get(0);
        assertEquals("C1", aCase.get("id").asText());
        assertFalse(aCase.has("name"));
        assertFalse(aCase.has("caseFileModel"));

        JsonNode plan = aCase.get("casePlanModel");
        assertFalse(plan.has("name"));
        assertTrue(plan.get("autoComplete").isBoolean());
        assertFalse(plan.get("autoComplete").booleanValue());
        assertEquals(0, plan.get("planItems").size());
        assertEquals(0, plan.get("taskDefinitions").size());
        assertFalse(plan.has("tasks"));
    }

    @Test
    void shouldWriteTypeDiscriminators() throws IOException {
        ObjectNode json = CmmnJsonSerializer.toJson(CmmnXmlParser.parse(read(SAMPLE_CMMN)));
        JsonNode plan = json.get("cases").get(0).get("casePlanModel");

        List<String> taskTypes = List.of("humanTask", "processTask", "caseTask", "decisionTask", "task");
        for (int i = 0; i < taskTypes.size(); i++) {
            assertEquals(taskTypes.get(i), plan.get("taskDefinitions").get(i).get("type").asText());
        }
        assertEquals("timerEventListener", plan.get("eventDefinitions").get(0).get("type").asText());
        assertEquals("userEventListener", plan.get("eventDefinitions").get(1).get("type").asText());
        assertEquals("eventListener", plan.get("eventDefinitions").get(2).get("type").asText());
        assertEquals("entry", plan.get("criteriaDefinitions").get(0).get("type").asText());
        assertEquals("exit", plan.get("criteriaDefinitions").get(1).get("type").asText());
        assertTrue(plan.get("taskDefinitions").get(0).get("isBlocking").booleanValue());
        assertFalse(plan.get("taskDefinitions").get(1).get("isBlocking").booleanValue());
    }

    @Test
    void shouldWriteReactivationCriterion() {
        Stage plan = Stage.builder()
                .elementType(CmmnElementType.CASE_PLAN_MODEL)
                .id("P1")
                .criteriaDefinitions(List.of(Criterion.reactivation("R1", null, "S1")))
                .build();
        Definitions definitions = Definitions.builder()
                .cases(List.of(Case.builder().id("C1").casePlanModel(plan).build()))
                .build();

        JsonNode criterion = CmmnJsonSerializer.toJson(definitions)
                .get("cases").get(0).get("casePlanModel").get("criteriaDefinitions").get(0);

        assertEquals("reactivation", criterion.get("type").asText());
        assertEquals("S1", criterion.get("sentryRef").asText());
    }

    @Test
    void shouldNotModifyTheModel() throws IOException {
        Definitions definitions = CmmnXmlParser.parse(read(SAMPLE_CMMN));
        Definitions copy = CmmnXmlParser.parse(read(SAMPLE_CMMN));

        CmmnJsonSerializer.toJson(definitions);
        CmmnJsonSerializer.toJsonString(definitions);

        assertEquals(copy, definitions);
    }

    @Test
    void shouldProduceMapAndPrettyText() throws IOException {
        Definitions definitions = CmmnXmlParser.parse(read(SAMPLE_CMMN));

        Map<String, Object> map = CmmnJsonSerializer.toMap(definitions);
        assertEquals("Definitions_Claims", map.get("id"));
        assertTrue(map.get("cases") instanceof List<?>);

        String text = CmmnJsonSerializer.toJsonString(definitions);
        assertTrue(text.contains("\n"));
        JsonNode reread = new ObjectMapper().readTree(text);
        assertEquals(CmmnJsonSerializer.toJson(definitions), reread);
    }

    @Test
    void shouldRejectDiscriminatorForSingleVariantTypes() {
        assertEquals("humanTask", CmmnJsonSerializer.typeName(Task.humanTask("T", null, null, null).elementType()));
        assertThrows(IllegalArgumentException.class, () -> CmmnJsonSerializer.typeName(CmmnElementType.MILESTONE));
    }
}
