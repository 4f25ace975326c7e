package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM sint64 (64-bit signed integer).
 */
public final class Sint64 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Sint64(long value) {
        super(CIMType.SINT64, BigInteger.valueOf(value));
    }

    public Sint64(BigInteger value) {
        super(CIMType.SINT64, value);
    }

    public Sint64(String value) {
        super(CIMType.SINT64, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.SINT64;
    }
}
