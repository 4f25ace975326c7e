package com.wbem.cimobj.types;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.model.CIMClass;
import com.wbem.cimobj.model.CIMClassName;
import com.wbem.cimobj.model.CIMInstance;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.util.CimEquality;

import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Type inference, conversion and formatting of CIM values.
 */
public final class CimTypes {

    private static final Pattern REAL_PATTERN = Pattern.compile(
        "^[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?$");

    private static final Pattern DECIMAL_PATTERN = Pattern.compile("^[+-]?[0-9]+$");

    private CimTypes() {
        // Utility class
    }

    /**
     * Determine the CIM type of a value that carries no declared type.
     *
     * <p>For a list, the type of its first non-null element is returned. Plain Java numbers
     * do not identify a CIM type and are rejected; use the CIM integer and real classes.
     *
     * @throws CIMTypeException if the value is of a class without a CIM type
     * @throws CIMValueException if the value is null or a list without non-null elements
     */
    public static CIMType inferType(Object value) {
        if (value == null) {
            throw new CIMValueException("Cannot infer the CIM type of a null value");
        }
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null) {
                    return inferType(element);
                }
            }
            throw new CIMValueException("Cannot infer the CIM type of an array without non-null elements");
        }
        if (value instanceof CIMInt cimInt) {
            return cimInt.getCimType();
        }
        if (value instanceof CIMFloat cimFloat) {
            return cimFloat.getCimType();
        }
        if (value instanceof Boolean) {
            return CIMType.BOOLEAN;
        }
        if (value instanceof String) {
            return CIMType.STRING;
        }
        if (value instanceof Character) {
            return CIMType.CHAR16;
        }
        if (value instanceof CIMDateTime || value instanceof OffsetDateTime || value instanceof ZonedDateTime
            || value instanceof LocalDateTime || value instanceof Duration) {
            return CIMType.DATETIME;
        }
        if (value instanceof CIMInstanceName || value instanceof CIMClassName) {
            return CIMType.REFERENCE;
        }
        if (value instanceof CIMInstance || value instanceof CIMClass) {
            return CIMType.STRING;
        }
        if (value instanceof Number) {
            throw new CIMTypeException("Cannot infer the CIM type of a plain number of type "
                + value.getClass().getName() + "; use a CIM integer or real type");
        }
        throw new CIMTypeException("Type " + value.getClass().getName() + " does not have a CIM type");
    }

    /**
     * Convert a value to the representation of a CIM type. Lists are converted element by
     * element; null stays null.
     *
     * @throws CIMTypeException if the value is of a category the type does not accept
     * @throws CIMValueException if the value is malformed or out of range
     */
    public static Object cimValue(Object value, CIMType type) {
        if (value == null) {
            return null;
        }
        if (type == null) {
            throw new CIMValueException("Cannot convert value " + value + " without a CIM type");
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object element : list) {
                converted.add(cimValue(element, type));
            }
            return converted;
        }
        return switch (type) {
            case STRING -> toStringValue(value);
            case CHAR16 -> toChar16Value(value);
            case BOOLEAN -> toBooleanValue(value);
            case DATETIME -> CIMDateTime.of(value);
            case REFERENCE -> toReferenceValue(value);
            case REAL32, REAL64 -> toRealValue(value, type);
            default -> toIntValue(value, type);
        };
    }

    private static Object toStringValue(Object value) {
        if (value instanceof String || value instanceof CIMInstance || value instanceof CIMClass) {
            return value;
        }
        if (value instanceof Character) {
            return String.valueOf(value);
        }
        throw wrongCategory(value, CIMType.STRING);
    }

    private static Object toChar16Value(Object value) {
        if (value instanceof String) {
            return value;
        }
        if (value instanceof Character) {
            return String.valueOf(value);
        }
        throw wrongCategory(value, CIMType.CHAR16);
    }

    private static Object toBooleanValue(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        throw wrongCategory(value, CIMType.BOOLEAN);
    }

    private static Object toReferenceValue(Object value) {
        if (value instanceof CIMInstanceName || value instanceof CIMClassName) {
            return value;
        }
        if (value instanceof String uri) {
            try {
                return CIMClassName.fromWbemUri(uri);
            } catch (CIMValueException e) {
                return CIMInstanceName.fromWbemUri(uri);
            }
        }
        throw wrongCategory(value, CIMType.REFERENCE);
    }

    private static Object toRealValue(Object value, CIMType type) {
        if (value instanceof CIMFloat cimFloat && cimFloat.getCimType() == type) {
            return value;
        }
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            d = parseReal(type, s);
        } else {
            throw wrongCategory(value, type);
        }
        return type == CIMType.REAL32 ? new Real32(d) : new Real64(d);
    }

    private static Object toIntValue(Object value, CIMType type) {
        if (value instanceof CIMInt cimInt && cimInt.getCimType() == type) {
            return value;
        }
        if (value instanceof Number n && !CimEquality.isFloating(n)) {
            return newInt(type, CimEquality.toBigInteger(n));
        }
        if (value instanceof String s && DECIMAL_PATTERN.matcher(s.trim()).matches()) {
            return newInt(type, new BigInteger(s.trim()));
        }
        if (value instanceof String) {
            throw new CIMValueException("Invalid " + type + " value: '" + value + "'");
        }
        throw wrongCategory(value, type);
    }

    private static CIMTypeException wrongCategory(Object value, CIMType type) {
        return new CIMTypeException("A value of type " + value.getClass().getName()
            + " cannot be used for CIM type " + type + ": " + value);
    }

    /**
     * Create the CIM integer wrapper for a type.
     */
    public static CIMInt newInt(CIMType type, BigInteger value) {
        return switch (type) {
            case UINT8 -> new Uint8(value);
            case UINT16 -> new Uint16(value);
            case UINT32 -> new Uint32(value);
            case UINT64 -> new Uint64(value);
            case SINT8 -> new Sint8(value);
            case SINT16 -> new Sint16(value);
            case SINT32 -> new Sint32(value);
            case SINT64 -> new Sint64(value);
            default -> throw new CIMValueException(type + " is not a CIM integer type");
        };
    }

    /**
     * Parse the text form of a real value, including {@code INF}, {@code -INF} and
     * {@code NaN} in any case.
     */
    public static double parseReal(CIMType type, String text) {
        if (text == null) {
            throw new CIMValueException("Value of " + type + " must not be null");
        }
        String s = text.trim();
        switch (s.toUpperCase(Locale.ROOT)) {
            case "INF", "+INF":
                return Double.POSITIVE_INFINITY;
            case "-INF":
                return Double.NEGATIVE_INFINITY;
            case "NAN":
                return Double.NaN;
            default:
                break;
        }
        if (!REAL_PATTERN.matcher(s).matches()) {
            throw new CIMValueException("Invalid " + type + " value: '" + text + "'");
        }
        return Double.parseDouble(s);
    }

    /**
     * Text form of a scalar value as used in CIM-XML {@code VALUE} elements: booleans as
     * {@code TRUE}/{@code FALSE}, reals with {@code INF}/{@code -INF}/{@code NaN}, datetimes in
     * their 25-character form.
     *
     * @throws CIMTypeException for values without a text form
     */
    public static String toCimString(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof CIMFloat cimFloat) {
            return cimFloat.toCimString();
        }
        if (value instanceof Float f) {
            return new Real32(f).toCimString();
        }
        if (value instanceof Double d) {
            return new Real64(d).toCimString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof CIMDateTime || value instanceof OffsetDateTime || value instanceof ZonedDateTime
            || value instanceof LocalDateTime || value instanceof Duration) {
            return CIMDateTime.of(value).toString();
        }
        throw new CIMTypeException("Value of type " + (value == null ? "null" : value.getClass().getName())
            + " has no CIM-XML text form");
    }
}
