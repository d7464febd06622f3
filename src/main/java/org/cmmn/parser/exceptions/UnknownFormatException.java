package org.cmmn.parser.exceptions;

/**
 * The format hint is not one of xml, json or auto, or auto-detection could not decide.
 */
public class UnknownFormatException extends CmmnException {

    public UnknownFormatException(String message) {
        super(message);
    }
}
