package org.cmmn.parser.exceptions;

/**
 * Content does not conform to the XML or JSON schema. The message describes the first violation.
 */
public class CmmnValidationException extends CmmnException {

    public CmmnValidationException(String message) {
        super(message);
    }

    public CmmnValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
