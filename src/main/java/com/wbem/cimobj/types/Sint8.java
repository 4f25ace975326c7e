package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM sint8 (8-bit signed integer).
 */
public final class Sint8 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Sint8(long value) {
        super(CIMType.SINT8, BigInteger.valueOf(value));
    }

    public Sint8(BigInteger value) {
        super(CIMType.SINT8, value);
    }

    public Sint8(String value) {
        super(CIMType.SINT8, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.SINT8;
    }
}
