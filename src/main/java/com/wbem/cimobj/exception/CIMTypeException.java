package com.wbem.cimobj.exception;

/**
 * Raised when an input is of the wrong category, for example an unsupported keybinding
 * value type or a list where a scalar is required.
 */
public class CIMTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public CIMTypeException(String message) {
        super(message);
    }

    public CIMTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
