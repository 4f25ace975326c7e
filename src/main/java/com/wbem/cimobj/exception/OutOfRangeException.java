package com.wbem.cimobj.exception;

/**
 * Raised when an integer value does not fit the bit width and signedness of its CIM type.
 */
public class OutOfRangeException extends CIMValueException {

    private static final long serialVersionUID = 1L;

    public OutOfRangeException(String message) {
        super(message);
    }
}
