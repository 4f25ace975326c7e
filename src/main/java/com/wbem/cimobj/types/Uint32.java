package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM uint32 (32-bit unsigned integer).
 */
public final class Uint32 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Uint32(long value) {
        super(CIMType.UINT32, BigInteger.valueOf(value));
    }

    public Uint32(BigInteger value) {
        super(CIMType.UINT32, value);
    }

    public Uint32(String value) {
        super(CIMType.UINT32, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.UINT32;
    }
}
