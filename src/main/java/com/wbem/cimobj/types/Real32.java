package com.wbem.cimobj.types;

/**
 * CIM real32 (IEEE 754 single precision).
 */
public final class Real32 extends CIMFloat {

    private static final long serialVersionUID = 1L;

    public Real32(float value) {
        super(value);
    }

    public Real32(double value) {
        super((float) value);
    }

    public Real32(String value) {
        super((float) CimTypes.parseReal(CIMType.REAL32, value));
    }

    @Override
    public CIMType getCimType() {
        return CIMType.REAL32;
    }

    @Override
    protected String formatFinite() {
        return Float.toString(floatValue());
    }
}
