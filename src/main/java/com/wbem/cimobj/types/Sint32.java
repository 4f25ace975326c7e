package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM sint32 (32-bit signed integer).
 */
public final class Sint32 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Sint32(long value) {
        super(CIMType.SINT32, BigInteger.valueOf(value));
    }

    public Sint32(BigInteger value) {
        super(CIMType.SINT32, value);
    }

    public Sint32(String value) {
        super(CIMType.SINT32, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.SINT32;
    }
}
