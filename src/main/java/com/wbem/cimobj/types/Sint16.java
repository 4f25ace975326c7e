package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM sint16 (16-bit signed integer).
 */
public final class Sint16 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Sint16(long value) {
        super(CIMType.SINT16, BigInteger.valueOf(value));
    }

    public Sint16(BigInteger value) {
        super(CIMType.SINT16, value);
    }

    public Sint16(String value) {
        super(CIMType.SINT16, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.SINT16;
    }
}
