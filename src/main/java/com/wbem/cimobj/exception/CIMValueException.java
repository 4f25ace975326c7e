package com.wbem.cimobj.exception;

/**
 * Raised when an input is structurally wrong for the declared or inferred CIM type:
 * invalid type names, malformed datetime strings or WBEM URIs, inconsistent names,
 * or a null where a value is required.
 */
public class CIMValueException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public CIMValueException(String message) {
        super(message);
    }

    public CIMValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
