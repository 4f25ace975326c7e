package com.wbem.cimobj.types;

import com.wbem.cimobj.config.CimConfig;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.exception.OutOfRangeException;
import com.wbem.cimobj.util.CimEquality;

import java.math.BigInteger;

/**
 * Base class of the fixed-width CIM integer types.
 *
 * <p>The value is held as a {@link BigInteger} so that {@code uint64} values above
 * {@code Long.MAX_VALUE} are represented exactly. Instances compare equal to any other
 * integral {@link Number} of the same numeric value, regardless of width or signedness.
 */
public abstract class CIMInt extends Number implements Comparable<CIMInt> {

    private static final long serialVersionUID = 1L;

    private final BigInteger value;

    protected CIMInt(CIMType type, BigInteger value) {
        if (value == null) {
            throw new CIMValueException("Value of " + type + " must not be null");
        }
        checkRange(type, value, CimConfig.global());
        this.value = value;
    }

    protected CIMInt(CIMType type, String value) {
        this(type, parse(type, value));
    }

    private static BigInteger parse(CIMType type, String value) {
        if (value == null) {
            throw new CIMValueException("Value of " + type + " must not be null");
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new CIMValueException("Invalid " + type + " value: '" + value + "'", e);
        }
    }

    /**
     * Check that the value fits the type, if range checking is enabled in the configuration.
     *
     * @throws OutOfRangeException if the value does not fit
     */
    public static void checkRange(CIMType type, BigInteger value, CimConfig config) {
        if (!config.isEnforceIntegerRange()) {
            return;
        }
        if (value.compareTo(type.getMinValue()) < 0 || value.compareTo(type.getMaxValue()) > 0) {
            throw new OutOfRangeException("Integer value " + value + " is out of range for CIM datatype "
                + type + " (" + type.getMinValue() + ".." + type.getMaxValue() + ")");
        }
    }

    public abstract CIMType getCimType();

    public BigInteger getMinValue() {
        return getCimType().getMinValue();
    }

    public BigInteger getMaxValue() {
        return getCimType().getMaxValue();
    }

    public BigInteger bigIntegerValue() {
        return value;
    }

    @Override
    public int intValue() {
        return value.intValue();
    }

    @Override
    public long longValue() {
        return value.longValue();
    }

    @Override
    public float floatValue() {
        return value.floatValue();
    }

    @Override
    public double doubleValue() {
        return value.doubleValue();
    }

    @Override
    public int compareTo(CIMInt other) {
        return value.compareTo(other.value);
    }

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
        return value.toString();
    }
}
