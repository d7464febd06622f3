package org.cmmn.parser.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import org.cmmn.parser.exceptions.CmmnSyntaxException;
import org.cmmn.parser.exceptions.CmmnValidationException;
import org.cmmn.parser.json.CmmnJsonSerializer;
import org.cmmn.parser.xml.CmmnXmlParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CmmnJsonValidatorTest {
    private static final String MINIMAL_JSON = "src/test/resources/models/json/minimal.json";
    private static final String SAMPLE_JSON = "src/test/resources/models/json/sample.json";
    private static final String WRAPPED_JSON = "src/test/resources/models/json/wrapped.json";
    private static final String INVALID_JSON = "src/test/resources/models/json/invalid.json";
    private static final String SAMPLE_CMMN = "src/test/resources/models/xml/sample.cmmn";

    private final CmmnJsonValidator validator = new CmmnJsonValidator();

    private static String read(String path) throws IOException {
        return Files.readString(Path.of(path));
    }

    @Test
    void shouldValidateWhenValid() throws IOException {
        assertDoesNotThrow(() -> validator.validate(read(MINIMAL_JSON)));
        assertDoesNotThrow(() -> validator.validate(read(SAMPLE_JSON)));
        assertDoesNotThrow(() -> validator.validate(read(WRAPPED_JSON)));
    }

    @Test
    void shouldAcceptSerializerOutput() throws IOException {
        String json = CmmnJsonSerializer.toJsonString(CmmnXmlParser.parse(read(SAMPLE_CMMN)));
        assertEquals(List.of(), validator.getValidationErrors(json));
    }

    @Test
    void shouldRequireCaseId() {
        CmmnValidationException e = assertThrows(CmmnValidationException.class,
                () -> validator.validate("{\"cases\":[{\"name\":\"no id\"}]}"));
        assertTrue(e.getMessage().contains("id"));
    }

    @Test
    void shouldRejectUnknownMultiplicity() {
        String json = """
                {"cases":[{"id":"C1","caseFileModel":{"caseFileItems":[{"id":"I1","multiplicity":"Many"}]}}]}
                """;
        assertThrows(CmmnValidationException.class, () -> validator.validate(json));
    }

    @Test
    void shouldRejectUnknownStandardEvent() {
        String json = """
                {"cases":[{"id":"C1","casePlanModel":{"id":"P1","sentries":[
                  {"id":"S1","onParts":[{"sourceRef":"PI1","standardEvent":"explode"}]}
                ]}}]}
                """;
        assertThrows(CmmnValidationException.class, () -> validator.validate(json));
    }

    @Test
    void shouldRejectUnknownTopLevelKey() {
        assertThrows(CmmnValidationException.class, () -> validator.validate("{\"id\":\"D1\",\"surprise\":1}"));
    }

    @Test
    void shouldRejectWrongTypes() {
        assertThrows(CmmnValidationException.class,
                () -> validator.validate("{\"cases\":[{\"id\":\"C1\",\"casePlanModel\":{\"id\":\"P1\",\"autoComplete\":\"yes\"}}]}"));
    }

    @Test
    void shouldCollectEveryError() throws IOException {
        List<String> errors = validator.getValidationErrors(read(INVALID_JSON));

        assertTrue(errors.size() >= 2);
        assertTrue(errors.stream().anyMatch(message -> message.contains("id")));
    }

    @Test
    void shouldReportMalformedJsonAsSingleError() {
        List<String> errors = validator.getValidationErrors("{not json");

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Invalid JSON format"));
        assertThrows(CmmnSyntaxException.class, () -> validator.validate("{not json"));
        assertFalse(validator.isValid("{not json"));
    }

    @Test
    void shouldRejectTrailingContent() {
        String json = "{\"cases\":[{\"id\":\"C1\"}]} }garbage";

        assertThrows(CmmnSyntaxException.class, () -> validator.validate(json));
        assertFalse(validator.isValid(json));
        assertTrue(validator.isValid("{\"cases\":[{\"id\":\"C1\"}]}\n"));
    }

    @Test
    void shouldValidateDecodedMaps() {
        assertDoesNotThrow(() -> validator.validate(Map.of("id", "D1", "cases", List.of(Map.of("id", "C1")))));
        assertThrows(CmmnValidationException.class, () -> validator.validate(Map.of("cases", List.of(Map.of()))));
    }

    @Test
    void shouldUseInjectedSchema() throws IOException {
        String schemaJson = "{\"$schema\":\"http://json-schema.org/draft-07/schema#\",\"type\":\"object\",\"required\":[\"author\"]}";
        JsonSchema schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7)
                .getSchema(new ObjectMapper().readTree(schemaJson));
        CmmnJsonValidator custom = new CmmnJsonValidator(schema);

        assertFalse(custom.isValid(read(MINIMAL_JSON)));
        assertTrue(custom.isValid("{\"author\":\"me\"}"));
    }
}
