package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM uint16 (16-bit unsigned integer).
 */
public final class Uint16 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Uint16(long value) {
        super(CIMType.UINT16, BigInteger.valueOf(value));
    }

    public Uint16(BigInteger value) {
        super(CIMType.UINT16, value);
    }

    public Uint16(String value) {
        super(CIMType.UINT16, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.UINT16;
    }
}
