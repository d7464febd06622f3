package org.cmmn.parser.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.ValidationMessage;
import org.cmmn.parser.exceptions.CmmnStructureException;
import org.cmmn.parser.exceptions.CmmnSyntaxException;
import org.cmmn.parser.exceptions.CmmnValidationException;
import org.cmmn.parser.json.CmmnJsonParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks JSON documents against the bundled CMMN definitions schema.
 * <p>
 * The default instance loads the schema on first use and keeps it for its lifetime.
 */
public class CmmnJsonValidator {

    private static final ObjectMapper mapper = new ObjectMapper();

    private volatile JsonSchema schema;

    public CmmnJsonValidator() {
    }

    public CmmnJsonValidator(JsonSchema schema) {
        this.schema = schema;
    }

    /**
     * @throws CmmnSyntaxException     if the text is not valid JSON
     * @throws CmmnValidationException with the first schema violation
     */
    public void validate(String jsonContent) {
        validate(CmmnJsonParser.readTree(jsonContent));
    }

    public void validate(Map<String, ?> data) {
        validate(toTree(data));
    }

    public void validate(JsonNode document) {
        List<String> errors = validationMessages(document);
        if (!errors.isEmpty()) {
            throw new CmmnValidationException("JSON validation failed: " + errors.get(0));
        }
    }

    public boolean isValid(String jsonContent) {
        return getValidationErrors(jsonContent).isEmpty();
    }

    /**
     * Collects every schema violation. Never throws; malformed text yields a single message.
     */
    public List<String> getValidationErrors(String jsonContent) {
        JsonNode document;
        try {
            document = CmmnJsonParser.readTree(jsonContent);
        } catch (CmmnSyntaxException e) {
            return List.of(e.getMessage());
        }
        return validationMessages(document);
    }

    public List<String> getValidationErrors(JsonNode document) {
        return validationMessages(document);
    }

    private List<String> validationMessages(JsonNode document) {
        Set<ValidationMessage> messages = schema().validate(document);
        List<String> errors = new ArrayList<>();
        for (ValidationMessage message : messages) {
            errors.add(message.getMessage());
        }
        return errors;
    }

    private JsonSchema schema() {
        JsonSchema loaded = schema;
        if (loaded == null) {
            synchronized (this) {
                loaded = schema;
                if (loaded == null) {
                    loaded = CmmnSchemaLoader.loadDefinitionsSchema();
                    schema = loaded;
                }
            }
        }
        return loaded;
    }

    private static JsonNode toTree(Map<String, ?> data) {
        try {
            return mapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            throw new CmmnStructureException("Unable to convert JSON data: " + e.getMessage(), e);
        }
    }
}
