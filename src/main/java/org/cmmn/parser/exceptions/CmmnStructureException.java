package org.cmmn.parser.exceptions;

/**
 * Content is well-formed but has the wrong shape, e.g. a root element other than
 * {@code definitions} or a JSON top level that is not an object.
 */
public class CmmnStructureException extends CmmnException {

    public CmmnStructureException(String message) {
        super(message);
    }

    public CmmnStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
