package org.cmmn.parser.exceptions;

/**
 * Base of every failure raised by the parser, the serializer and the validators.
 * Low-level causes (SAX, Jackson, I/O) are always wrapped, never thrown as-is.
 */
public class CmmnException extends RuntimeException {

    public CmmnException(String message) {
        super(message);
    }

    public CmmnException(String message, Throwable cause) {
        super(message, cause);
    }
}
