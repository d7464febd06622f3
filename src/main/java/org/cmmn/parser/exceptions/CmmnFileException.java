package org.cmmn.parser.exceptions;

public class CmmnFileException extends CmmnException {

    public CmmnFileException(String message) {
        super(message);
    }

    public CmmnFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
