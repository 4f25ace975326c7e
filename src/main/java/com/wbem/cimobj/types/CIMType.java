package com.wbem.cimobj.types;

import com.wbem.cimobj.exception.CIMValueException;

import java.math.BigInteger;
import java.util.Locale;

/**
 * The CIM data types (DSP0004).
 */
public enum CIMType {
    BOOLEAN("boolean"),
    STRING("string"),
    CHAR16("char16"),
    DATETIME("datetime"),
    REFERENCE("reference"),
    UINT8("uint8", false, 8),
    UINT16("uint16", false, 16),
    UINT32("uint32", false, 32),
    UINT64("uint64", false, 64),
    SINT8("sint8", true, 8),
    SINT16("sint16", true, 16),
    SINT32("sint32", true, 32),
    SINT64("sint64", true, 64),
    REAL32("real32"),
    REAL64("real64");

    private final String cimName;
    private final boolean integer;
    private final boolean signed;
    private final int bits;

    CIMType(String cimName) {
        this.cimName = cimName;
        this.integer = false;
        this.signed = false;
        this.bits = 0;
    }

    CIMType(String cimName, boolean signed, int bits) {
        this.cimName = cimName;
        this.integer = true;
        this.signed = signed;
        this.bits = bits;
    }

    /**
     * The lower-case type name used in CIM-XML and MOF.
     */
    public String getCimName() {
        return cimName;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isReal() {
        return this == REAL32 || this == REAL64;
    }

    public boolean isNumeric() {
        return integer || isReal();
    }

    public boolean isSigned() {
        return signed;
    }

    public int getBits() {
        return bits;
    }

    /**
     * Smallest value of an integer type.
     */
    public BigInteger getMinValue() {
        if (!integer) {
            throw new IllegalStateException(cimName + " is not an integer type");
        }
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    /**
     * Largest value of an integer type.
     */
    public BigInteger getMaxValue() {
        if (!integer) {
            throw new IllegalStateException(cimName + " is not an integer type");
        }
        int magnitudeBits = signed ? bits - 1 : bits;
        return BigInteger.ONE.shiftLeft(magnitudeBits).subtract(BigInteger.ONE);
    }

    /**
     * Resolve a CIM type name, ignoring case.
     *
     * @throws CIMValueException for null or unknown names
     */
    public static CIMType fromName(String name) {
        if (name == null) {
            throw new CIMValueException("CIM type name must not be null");
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (CIMType type : values()) {
            if (type.cimName.equals(lower)) {
                return type;
            }
        }
        throw new CIMValueException("Invalid CIM type name: " + name);
    }

    @Override
    public String toString() {
        return cimName;
    }
}
