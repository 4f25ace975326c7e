package com.wbem.cimobj.exception;

import java.util.NoSuchElementException;

/**
 * Raised by the dictionary-style accessors for a name that is not present.
 */
public class CIMKeyException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public CIMKeyException(String key) {
        super("No such key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
