package org.cmmn.parser.exceptions;

/**
 * Content is not well-formed XML or JSON, or cannot be decoded.
 */
public class CmmnSyntaxException extends CmmnException {

    public CmmnSyntaxException(String message) {
        super(message);
    }

    public CmmnSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
