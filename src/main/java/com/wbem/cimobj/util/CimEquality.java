package com.wbem.cimobj.util;

import com.wbem.cimobj.types.CIMFloat;
import com.wbem.cimobj.types.CIMInt;
import com.wbem.cimobj.types.Real32;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Equality and hashing rules shared by all CIM objects.
 *
 * <p>Names compare case-insensitively. Values compare by CIM semantics: integers of any
 * width or class are equal when numerically equal, a {@code Real32} compares at single
 * precision, a {@code Character} equals the one-character {@code String}, and lists
 * compare element by element. Hashes agree with these rules.
 */
@UtilityClass
public class CimEquality {

    public static String lower(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    public static boolean namesEqual(String a, String b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.equalsIgnoreCase(b);
    }

    public static int nameHash(String name) {
        return name == null ? 0 : lower(name).hashCode();
    }

    public static boolean valuesEqual(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number && b instanceof Number) {
            return numbersEqual((Number) a, (Number) b);
        }
        if (a instanceof List && b instanceof List) {
            return listsEqual((List<?>) a, (List<?>) b);
        }
        if (a instanceof Character && b instanceof String) {
            return charEqualsString((Character) a, (String) b);
        }
        if (b instanceof Character && a instanceof String) {
            return charEqualsString((Character) b, (String) a);
        }
        return a.equals(b);
    }

    public static int valueHash(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            // -0.0 and 0.0 are equal, so they must hash alike
            return Float.hashCode(((Number) value).floatValue() + 0.0f);
        }
        if (value instanceof List) {
            int hash = 1;
            for (Object element : (List<?>) value) {
                hash = 31 * hash + valueHash(element);
            }
            return hash;
        }
        if (value instanceof Character) {
            return String.valueOf(value).hashCode();
        }
        return value.hashCode();
    }

    public static boolean numbersEqual(Number a, Number b) {
        boolean floatA = isFloating(a);
        boolean floatB = isFloating(b);
        if (!floatA && !floatB) {
            return toBigInteger(a).equals(toBigInteger(b));
        }
        if (floatA && floatB) {
            if (isSinglePrecision(a) || isSinglePrecision(b)) {
                return a.floatValue() == b.floatValue();
            }
            return a.doubleValue() == b.doubleValue();
        }
        double real = floatA ? a.doubleValue() : b.doubleValue();
        Number integral = floatA ? b : a;
        if (Double.isNaN(real) || Double.isInfinite(real) || real != Math.rint(real)) {
            return false;
        }
        return new BigDecimal(real).toBigIntegerExact().equals(toBigInteger(integral));
    }

    public static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float || n instanceof CIMFloat
            || n instanceof BigDecimal;
    }

    private static boolean isSinglePrecision(Number n) {
        return n instanceof Float || n instanceof Real32;
    }

    public static BigInteger toBigInteger(Number n) {
        if (n instanceof CIMInt) {
            return ((CIMInt) n).bigIntegerValue();
        }
        if (n instanceof BigInteger) {
            return (BigInteger) n;
        }
        return BigInteger.valueOf(n.longValue());
    }

    private static boolean listsEqual(List<?> a, List<?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Iterator<?> ia = a.iterator();
        Iterator<?> ib = b.iterator();
        while (ia.hasNext()) {
            if (!valuesEqual(ia.next(), ib.next())) {
                return false;
            }
        }
        return true;
    }

    private static boolean charEqualsString(Character c, String s) {
        return s.length() == 1 && s.charAt(0) == c;
    }
}
