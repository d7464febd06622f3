package org.cmmn.parser.models;

/**
 * Common shape of every CMMN node: identifier, optional name and documentation,
 * and the element-type tag fixed when the node is created.
 */
public interface CmmnElement {

    String id();

    String name();

    String documentation();

    CmmnElementType elementType();
}
