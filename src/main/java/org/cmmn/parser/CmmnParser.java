package org.cmmn.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.cmmn.parser.exceptions.CmmnException;
import org.cmmn.parser.exceptions.CmmnFileException;
import org.cmmn.parser.exceptions.CmmnStructureException;
import org.cmmn.parser.exceptions.CmmnSyntaxException;
import org.cmmn.parser.exceptions.EmptyContentException;
import org.cmmn.parser.format.CmmnFormat;
import org.cmmn.parser.format.FormatDetector;
import org.cmmn.parser.json.CmmnJsonParser;
import org.cmmn.parser.json.CmmnJsonSerializer;
import org.cmmn.parser.models.Definitions;
import org.cmmn.parser.validation.CmmnJsonValidator;
import org.cmmn.parser.validation.CmmnXmlValidator;
import org.cmmn.parser.xml.CmmnXmlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Entry point for reading CMMN models from XML or JSON and writing them back as JSON.
 * <p>
 * Every failure surfaces as a {@link CmmnException}; a partially built model is never returned.
 */
public class CmmnParser {
    private static final Logger logger = LoggerFactory.getLogger(CmmnParser.class);

    private final CmmnXmlValidator xmlValidator;
    private final CmmnJsonValidator jsonValidator;

    public CmmnParser() {
        this(new CmmnXmlValidator(), new CmmnJsonValidator());
    }

    public CmmnParser(CmmnXmlValidator xmlValidator, CmmnJsonValidator jsonValidator) {
        this.xmlValidator = xmlValidator;
        this.jsonValidator = jsonValidator;
    }

    // ---------------------------------------------------------------- parsing

    public Definitions parseString(String content) {
        return parseString(content, CmmnFormat.AUTO);
    }

    /**
     * @param hint "xml", "json", "auto" or null
     */
    public Definitions parseString(String content, String hint) {
        return parseString(content, CmmnFormat.fromHint(hint));
    }

    public Definitions parseString(String content, CmmnFormat format) {
        requireContent(content);
        CmmnFormat detected = FormatDetector.detect(content, format);
        return detected == CmmnFormat.XML ? parseXmlString(content) : parseJsonString(content);
    }

    public Definitions parseBytes(byte[] content) {
        return parseBytes(content, CmmnFormat.AUTO);
    }

    public Definitions parseBytes(byte[] content, String hint) {
        return parseBytes(content, CmmnFormat.fromHint(hint));
    }

    /**
     * Decodes the bytes as UTF-8, rejecting malformed sequences, then parses them.
     */
    public Definitions parseBytes(byte[] content, CmmnFormat format) {
        return parseString(decodeUtf8(content), format);
    }

    public Definitions parseFile(Path path) {
        return parseFile(path, CmmnFormat.AUTO);
    }

    public Definitions parseFile(Path path, String hint) {
        return parseFile(path, CmmnFormat.fromHint(hint));
    }

    /**
     * An AUTO format is first resolved from the file extension, then from the content.
     *
     * @throws CmmnFileException if the file is missing or unreadable
     */
    public Definitions parseFile(Path path, CmmnFormat format) {
        String content = readFile(path);
        Definitions definitions = parseString(content, resolveFormat(path, format));
        logger.debug("Parsed CMMN file {}", path);
        return definitions;
    }

    public Definitions parseXmlString(String xmlContent) {
        requireContent(xmlContent);
        try {
            return CmmnXmlParser.parse(xmlContent);
        } catch (CmmnException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CmmnStructureException("Failed to parse CMMN XML: " + e.getMessage(), e);
        }
    }

    public Definitions parseJsonString(String jsonContent) {
        requireContent(jsonContent);
        try {
            return CmmnJsonParser.parse(jsonContent);
        } catch (CmmnException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CmmnStructureException("Failed to parse CMMN JSON: " + e.getMessage(), e);
        }
    }

    public Definitions parseJson(JsonNode document) {
        try {
            return CmmnJsonParser.parse(document);
        } catch (CmmnException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CmmnStructureException("Failed to parse CMMN JSON: " + e.getMessage(), e);
        }
    }

    public Definitions parseJson(Map<String, ?> document) {
        try {
            return CmmnJsonParser.parse(document);
        } catch (CmmnException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CmmnStructureException("Failed to parse CMMN JSON: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- validation

    public void validateXmlString(String xmlContent) {
        requireContent(xmlContent);
        xmlValidator.validate(xmlContent);
    }

    public void validateJsonString(String jsonContent) {
        requireContent(jsonContent);
        jsonValidator.validate(jsonContent);
    }

    public void validateJson(JsonNode document) {
        jsonValidator.validate(document);
    }

    public void validateJson(Map<String, ?> document) {
        jsonValidator.validate(document);
    }

    public void validateString(String content, String hint) {
        requireContent(content);
        if (FormatDetector.detect(content, hint) == CmmnFormat.XML) {
            xmlValidator.validate(content);
        } else {
            jsonValidator.validate(content);
        }
    }

    public void validateFile(Path path) {
        validateFile(path, CmmnFormat.AUTO);
    }

    public void validateFile(Path path, String hint) {
        validateFile(path, CmmnFormat.fromHint(hint));
    }

    /**
     * Resolves the format the same way {@link #parseFile(Path, CmmnFormat)} does.
     */
    public void validateFile(Path path, CmmnFormat format) {
        String content = readFile(path);
        requireContent(content);
        if (FormatDetector.detect(content, resolveFormat(path, format)) == CmmnFormat.XML) {
            xmlValidator.validate(content);
        } else {
            jsonValidator.validate(content);
        }
    }

    /**
     * Validates without throwing.
     *
     * @return every problem found, empty when the content is valid
     */
    public List<String> getValidationErrors(String content, String hint) {
        try {
            requireContent(content);
            CmmnFormat format = FormatDetector.detect(content, hint);
            return format == CmmnFormat.XML
                    ? xmlValidator.getValidationErrors(content)
                    : jsonValidator.getValidationErrors(content);
        } catch (CmmnException e) {
            return List.of(e.getMessage());
        }
    }

    // ---------------------------------------------------------------- output

    public ObjectNode toJson(Definitions definitions) {
        return CmmnJsonSerializer.toJson(definitions);
    }

    public Map<String, Object> toMap(Definitions definitions) {
        return CmmnJsonSerializer.toMap(definitions);
    }

    public String toJsonString(Definitions definitions) {
        return CmmnJsonSerializer.toJsonString(definitions);
    }

    // ---------------------------------------------------------------- helpers

    private static void requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new EmptyContentException("Content is empty");
        }
    }

    private static CmmnFormat resolveFormat(Path path, CmmnFormat format) {
        if (format != CmmnFormat.AUTO) {
            return format;
        }
        return FormatDetector.detectFromPath(path);
    }

    private static String readFile(Path path) {
        if (path == null) {
            throw new CmmnFileException("File path must not be null");
        }
        try {
            return decodeUtf8(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            throw new CmmnFileException("File not found: " + path, e);
        } catch (IOException e) {
            throw new CmmnFileException("Unable to read file " + path + ": " + e.getMessage(), e);
        }
    }

    private static String decodeUtf8(byte[] content) {
        if (content == null) {
            throw new EmptyContentException("Content is empty");
        }
        try {
            String decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            return decoded.startsWith("\uFEFF") ? decoded.substring(1) : decoded;
        } catch (CharacterCodingException e) {
            throw new CmmnSyntaxException("Content is not valid UTF-8: " + e.getMessage(), e);
        }
    }
}
