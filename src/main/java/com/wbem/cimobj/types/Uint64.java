package com.wbem.cimobj.types;

import java.math.BigInteger;

/**
 * CIM uint64 (64-bit unsigned integer).
 */
public final class Uint64 extends CIMInt {

    private static final long serialVersionUID = 1L;

    public Uint64(long value) {
        super(CIMType.UINT64, BigInteger.valueOf(value));
    }

    public Uint64(BigInteger value) {
        super(CIMType.UINT64, value);
    }

    public Uint64(String value) {
        super(CIMType.UINT64, value);
    }

    @Override
    public CIMType getCimType() {
        return CIMType.UINT64;
    }
}
