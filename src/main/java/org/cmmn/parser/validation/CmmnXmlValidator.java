package org.cmmn.parser.validation;

import org.camunda.bpm.model.cmmn.Cmmn;
import org.camunda.bpm.model.cmmn.CmmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;
import org.cmmn.parser.exceptions.CmmnException;
import org.cmmn.parser.exceptions.CmmnSyntaxException;
import org.cmmn.parser.exceptions.CmmnValidationException;
import org.cmmn.parser.xml.CmmnXmlParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.transform.dom.DOMSource;
import javax.xml.validation.Schema;
import javax.xml.validation.Validator;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates CMMN XML documents.
 * <p>
 * By default documents are read through the Camunda CMMN model API, which checks them
 * against the CMMN 1.1 (and 1.0) XSDs it ships with. A custom {@link Schema} can be
 * supplied instead.
 */
public class CmmnXmlValidator {
    private static final Logger logger = LoggerFactory.getLogger(CmmnXmlValidator.class);

    private final Schema schema;

    public CmmnXmlValidator() {
        this(null);
    }

    /**
     * @param schema grammar to validate against, or null to use the CMMN XSDs
     */
    public CmmnXmlValidator(Schema schema) {
        this.schema = schema;
    }

    /**
     * @throws CmmnSyntaxException     if the text is not well-formed XML
     * @throws CmmnValidationException if the document does not conform to the schema
     */
    public void validate(String xmlContent) {
        if (xmlContent == null) {
            throw new CmmnSyntaxException("XML content must not be null");
        }
        Document document = CmmnXmlParser.readDocument(new InputSource(new StringReader(xmlContent)));

        if (schema != null) {
            List<String> errors = validateAgainstSchema(document, true);
            if (!errors.isEmpty()) {
                throw new CmmnValidationException("XML validation failed: " + errors.get(0));
            }
            return;
        }

        String namespace = document.getDocumentElement().getNamespaceURI();
        if (!CmmnXmlParser.CMMN_11_NS.equals(namespace) && !CmmnXmlParser.CMMN_10_NS.equals(namespace)) {
            throw new CmmnValidationException("XML validation failed: unsupported namespace '" + namespace + "'");
        }

        try {
            CmmnModelInstance modelInstance = Cmmn.readModelFromStream(
                    new ByteArrayInputStream(xmlContent.getBytes(declaredCharset(document))));
            Cmmn.validateModel(modelInstance);
        } catch (ModelException e) {
            throw new CmmnValidationException("XML validation failed: " + describe(e), e);
        }
        logger.debug("CMMN XML document is valid");
    }

    public boolean isValid(String xmlContent) {
        return getValidationErrors(xmlContent).isEmpty();
    }

    /**
     * Collects validation problems without throwing.
     */
    public List<String> getValidationErrors(String xmlContent) {
        if (xmlContent == null) {
            return List.of("XML content must not be null");
        }
        if (schema != null) {
            try {
                Document document = CmmnXmlParser.readDocument(new InputSource(new StringReader(xmlContent)));
                return validateAgainstSchema(document, false);
            } catch (CmmnException e) {
                return List.of(e.getMessage());
            }
        }

        try {
            validate(xmlContent);
            return List.of();
        } catch (CmmnException e) {
            return List.of(e.getMessage());
        }
    }

    private List<String> validateAgainstSchema(Document document, boolean stopAtFirst) {
        List<String> errors = new ArrayList<>();
        Validator validator = schema.newValidator();
        validator.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                logger.debug("XML schema warning at line {}: {}", e.getLineNumber(), e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                errors.add(e.getMessage());
                if (stopAtFirst) {
                    throw e;
                }
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                errors.add(e.getMessage());
                throw e;
            }
        });

        try {
            validator.validate(new DOMSource(document));
        } catch (SAXException e) {
            if (errors.isEmpty()) {
                errors.add(e.getMessage());
            }
        } catch (IOException e) {
            throw new CmmnException("Failed to validate CMMN XML: " + e.getMessage(), e);
        }
        return errors;
    }

    /**
     * The model API decodes the bytes it is given by the prolog's encoding declaration,
     * so the text must be re-encoded with that charset.
     */
    private static Charset declaredCharset(Document document) {
        String encoding = document.getXmlEncoding();
        if (encoding == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding);
        } catch (IllegalArgumentException e) {
            logger.debug("Unsupported XML encoding '{}', falling back to UTF-8", encoding);
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * The model API wraps the XSD failure; its cause carries the useful message.
     */
    private static String describe(ModelException e) {
        Throwable cause = e.getCause();
        if (cause != null && cause.getMessage() != null) {
            return e.getMessage() + ": " + cause.getMessage();
        }
        return e.getMessage();
    }
}
