package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM uint8 (8-bit unsigned integer).
 */
public final class Uint8 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Uint8(long value) {
        super(CIMType.UINT8, BigInteger.valueOf(value));
    }

    public Uint8(BigInteger value) {
        super(CIMType.UINT8, value);
    }

    public Uint8(String value) {
        super(CIMType.UINT8, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.UINT8;
    }
}
