package com.wbem.cimobj.types;

/**
 * CIM real64 (IEEE 754 double precision).
 */
public final class Real64 extends CIMFloat {

    private static final long serialVersionUID = 1L;

    public Real64(double value) {
        super(value);
    }

    public Real64(String value) {
        super(CimTypes.parseReal(CIMType.REAL64, value));
    }

    @Override
    public CIMType getCimType() {
        return CIMType.REAL64;
    }

    @Override
    protected String formatFinite() {
        return Double.toString(doubleValue());
    }
}
