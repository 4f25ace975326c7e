package com.wbem.cimobj.model;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.types.CIMType;
import com.wbem.cimobj.types.CimTypes;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation and inference shared by the typed elements (properties, parameters,
 * qualifiers and qualifier declarations).
 */
final class ValueChecks {

    private ValueChecks() {
        // Utility class
    }

    static String checkName(String name, String kind) {
        if (name == null) {
            throw new CIMValueException("Name of " + kind + " must not be null");
        }
        return name;
    }

    /**
     * The declared type, or the type inferred from the value when none is declared.
     */
    static CIMType resolveType(String typeName, Object value, String kind, String name) {
        if (typeName != null) {
            return CIMType.fromName(typeName);
        }
        if (value == null) {
            throw new CIMValueException("Cannot infer the CIM type of " + kind + " '" + name
                + "' from its value when the value is null; specify the type");
        }
        try {
            return CimTypes.inferType(value);
        } catch (CIMTypeException | CIMValueException e) {
            throw new CIMValueException("Cannot infer the CIM type of " + kind + " '" + name
                + "' from its value " + value + ": " + e.getMessage(), e);
        }
    }

    static boolean inferIsArray(Boolean isArray, Object value) {
        return isArray != null ? isArray : value instanceof List;
    }

    static void checkArrayParms(Boolean isArray, Integer arraySize, Object value, String kind, String name) {
        if (arraySize != null && Boolean.FALSE.equals(isArray)) {
            throw new CIMValueException("The array_size of " + kind + " '" + name + "' is " + arraySize
                + " but is_array is False");
        }
        if (value != null && isArray != null) {
            boolean valueIsArray = value instanceof List;
            if (!isArray && valueIsArray) {
                throw new CIMValueException("The is_array parameter of " + kind + " '" + name
                    + "' is False but value " + value + " is an array");
            }
            if (isArray && !valueIsArray) {
                throw new CIMValueException("The is_array parameter of " + kind + " '" + name
                    + "' is True but value " + value + " is not an array");
            }
        }
    }

    static void checkNoReferenceArray(CIMType type, boolean isArray, String kind, String name) {
        if (type == CIMType.REFERENCE && isArray) {
            throw new CIMValueException("The " + kind + " '" + name + "' is an array of CIM type reference,"
                + " which is not allowed");
        }
    }

    static EmbeddedObject inferEmbeddedObject(Object value) {
        Object first = value;
        if (value instanceof List<?> list) {
            first = null;
            for (Object element : list) {
                if (element != null) {
                    first = element;
                    break;
                }
            }
        }
        if (first instanceof CIMInstance) {
            return EmbeddedObject.INSTANCE;
        }
        if (first instanceof CIMClass) {
            return EmbeddedObject.OBJECT;
        }
        return null;
    }

    static void checkEmbeddedObject(EmbeddedObject embeddedObject, CIMType type, Object value,
                                    String kind, String name) {
        if (embeddedObject == null) {
            return;
        }
        if (type != CIMType.STRING) {
            throw new CIMValueException("The " + kind + " '" + name + "' specifies embedded_object "
                + embeddedObject + " but its CIM type is invalid: " + type + " (must be string)");
        }
        List<Object> values = new ArrayList<>();
        if (value instanceof List<?> list) {
            values.addAll(list);
        } else {
            values.add(value);
        }
        for (Object element : values) {
            if (element != null && !(element instanceof CIMInstance) && !(element instanceof CIMClass)) {
                throw new CIMValueException("The " + kind + " '" + name + "' specifies embedded_object "
                    + embeddedObject + " but its value is of type " + element.getClass().getName()
                    + " (must be CIMInstance or CIMClass)");
            }
        }
    }

    static void checkReferenceClass(String referenceClass, CIMType type, String kind, String name) {
        if (referenceClass != null && type != CIMType.REFERENCE) {
            throw new CIMValueException("The " + kind + " '" + name + "' has reference_class '" + referenceClass
                + "' but its CIM type is " + type + " (must be reference)");
        }
    }

    /**
     * Convert the value to the type, reporting the wrong category of value as a value error.
     */
    static Object convertValue(Object value, CIMType type, String kind, String name) {
        try {
            return CimTypes.cimValue(value, type);
        } catch (CIMTypeException e) {
            throw new CIMValueException("Invalid value for " + kind + " '" + name + "' of CIM type " + type
                + ": " + e.getMessage(), e);
        }
    }

    /**
     * Copy of a value: lists and CIM objects are copied, immutable scalars are shared.
     */
    static Object copyValue(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        if (value instanceof CIMInstance instance) {
            return instance.copy();
        }
        if (value instanceof CIMClass cimClass) {
            return cimClass.copy();
        }
        if (value instanceof CIMInstanceName path) {
            return path.copy();
        }
        if (value instanceof CIMClassName path) {
            return path.copy();
        }
        return value;
    }
}
