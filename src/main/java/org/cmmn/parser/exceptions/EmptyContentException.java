package org.cmmn.parser.exceptions;

public class EmptyContentException extends CmmnException {

    public EmptyContentException(String message) {
        super(message);
    }
}
