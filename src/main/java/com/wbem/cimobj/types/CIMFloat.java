package com.wbem.cimobj.types;

import com.wbem.cimobj.util.CimEquality;

/**
 * Base class of the CIM real types.
 *
 * <p>NaN is never equal to anything, itself included, as in IEEE 754.
 */
public abstract class CIMFloat extends Number {

    private static final long serialVersionUID = 1L;

    private final double value;

    protected CIMFloat(double value) {
        this.value = value;
    }

    public abstract CIMType getCimType();

    @Override
    public int intValue() {
        return (int) value;
    }

    @Override
    public long longValue() {
        return (long) value;
    }

    @Override
    public float floatValue() {
        return (float) value;
    }

    @Override
    public double doubleValue() {
        return value;
    }

    public boolean isNaN() {
        return Double.isNaN(value);
    }

    public boolean isInfinite() {
        return Double.isInfinite(value);
    }

    /**
     * Text form used by CIM-XML, MOF and WBEM URIs: {@code INF}, {@code -INF}, {@code NaN},
     * or the shortest decimal that reads back to the same value.
     */
    public String toCimString() {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "INF" : "-INF";
        }
        return formatFinite();
    }

    protected abstract String formatFinite();

    @Override
    public boolean equals(Object o) {
        return o instanceof Number && CimEquality.numbersEqual(this, (Number) o);
    }

    @Override
    public int hashCode() {
        return CimEquality.valueHash(this);
    }

    @Override
    public String toString() {
        return toCimString();
    }
}
