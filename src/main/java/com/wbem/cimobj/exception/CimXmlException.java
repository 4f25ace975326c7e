package com.wbem.cimobj.exception;

/**
 * Wraps a failure of the underlying XML machinery while building or rendering CIM-XML.
 */
public class CimXmlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CimXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
