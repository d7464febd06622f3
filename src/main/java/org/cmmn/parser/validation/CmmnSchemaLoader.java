package org.cmmn.parser.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import org.cmmn.parser.exceptions.CmmnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the JSON schemas bundled on the classpath.
 */
public class CmmnSchemaLoader {
    private static final Logger logger = LoggerFactory.getLogger(CmmnSchemaLoader.class);

    public static final String DEFINITIONS_SCHEMA = "schema/cmmn-definitions.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    public static JsonSchema loadDefinitionsSchema() {
        return loadSchema(DEFINITIONS_SCHEMA);
    }

    /**
     * @param schemaResourcePath classpath location of a draft-07 schema
     * @throws CmmnException if the resource is missing or is not valid JSON
     */
    public static JsonSchema loadSchema(String schemaResourcePath) {
        JsonSchema schema = factory.getSchema(loadSchemaNode(schemaResourcePath));
        logger.debug("Loaded JSON schema {}", schemaResourcePath);
        return schema;
    }

    /**
     * Reads the title, description, id and named sub-schemas of the bundled schema.
     */
    public static SchemaInfo describeDefinitionsSchema() {
        return describeSchema(DEFINITIONS_SCHEMA);
    }

    public static SchemaInfo describeSchema(String schemaResourcePath) {
        JsonNode schemaNode = loadSchemaNode(schemaResourcePath);

        List<String> elements = new ArrayList<>();
        JsonNode definitions = schemaNode.path("definitions");
        definitions.fieldNames().forEachRemaining(elements::add);

        return SchemaInfo.builder()
                .title(schemaNode.path("title").asText("Unknown"))
                .description(schemaNode.path("description").asText("No description available"))
                .version(schemaNode.path("$id").asText("Unknown"))
                .supportedElements(elements)
                .build();
    }

    static JsonNode loadSchemaNode(String schemaResourcePath) {
        ClassLoader cl = CmmnSchemaLoader.class.getClassLoader();

        try (InputStream schemaStream = cl.getResourceAsStream(schemaResourcePath)) {
            if (schemaStream == null) {
                throw new CmmnException("Schema not found on classpath: " + schemaResourcePath);
            }
            return mapper.readTree(schemaStream);
        } catch (IOException e) {
            throw new CmmnException("Failed to load schema " + schemaResourcePath + ": " + e.getMessage(), e);
        }
    }
}
