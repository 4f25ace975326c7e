package com.wbem.cimobj.model;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.util.NocaseDict;

import java.util.AbstractMap.SimpleEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the case-insensitive maps of CIM objects from loosely typed input.
 *
 * <p>Every builder accepts a {@link Map} (including a {@link NocaseDict}), an
 * {@link Iterable} of named CIM objects, or an {@link Iterable} of {@link Map.Entry}
 * name/value pairs, and keeps the iteration order of the input. A named object stored
 * under a key must carry that name, ignoring case.
 */
public final class ElementMaps {

    /** Scope names of qualifier declarations, in MOF rendering order. */
    public static final List<String> SCOPES = List.of(
        "CLASS", "ASSOCIATION", "INDICATION", "PROPERTY", "REFERENCE", "METHOD", "PARAMETER", "ANY");

    private static final Set<String> SCOPE_SET = Set.copyOf(SCOPES);

    private ElementMaps() {
        // Utility class
    }

    public static NocaseDict<CIMQualifier> qualifiers(Object input) {
        NocaseDict<CIMQualifier> result = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : entries(input, "qualifiers")) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value instanceof CIMQualifier qualifier) {
                checkKey(key, qualifier.getName(), "Qualifier");
                result.put(key, qualifier);
            } else {
                result.put(key, new CIMQualifier(key, value));
            }
        }
        return result;
    }

    public static NocaseDict<CIMProperty> properties(Object input) {
        NocaseDict<CIMProperty> result = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : entries(input, "properties")) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value instanceof CIMProperty property) {
                checkKey(key, property.getName(), "Property");
                result.put(key, property);
            } else {
                result.put(key, new CIMProperty(key, value));
            }
        }
        return result;
    }

    public static NocaseDict<CIMMethod> methods(Object input) {
        NocaseDict<CIMMethod> result = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : entries(input, "methods")) {
            if (!(entry.getValue() instanceof CIMMethod method)) {
                throw new CIMTypeException("Method '" + entry.getKey() + "' must be a CIMMethod, but is "
                    + typeName(entry.getValue()));
            }
            checkKey(entry.getKey(), method.getName(), "Method");
            result.put(entry.getKey(), method);
        }
        return result;
    }

    public static NocaseDict<CIMParameter> parameters(Object input) {
        NocaseDict<CIMParameter> result = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : entries(input, "parameters")) {
            if (!(entry.getValue() instanceof CIMParameter parameter)) {
                throw new CIMTypeException("Parameter '" + entry.getKey() + "' must be a CIMParameter, but is "
                    + typeName(entry.getValue()));
            }
            checkKey(entry.getKey(), parameter.getName(), "Parameter");
            result.put(entry.getKey(), parameter);
        }
        return result;
    }

    public static NocaseDict<Boolean> scopes(Object input) {
        NocaseDict<Boolean> result = new NocaseDict<>();
        for (Map.Entry<String, Object> entry : entries(input, "scopes")) {
            String key = entry.getKey();
            if (key == null || !SCOPE_SET.contains(key.toUpperCase(Locale.ROOT))) {
                throw new CIMValueException("Invalid qualifier scope: '" + key + "' (must be one of " + SCOPES + ")");
            }
            if (!(entry.getValue() instanceof Boolean flag)) {
                throw new CIMTypeException("Value of qualifier scope '" + key + "' must be a Boolean, but is "
                    + typeName(entry.getValue()));
            }
            result.put(key, flag);
        }
        return result;
    }

    /**
     * Flatten the input into name/value pairs. Named CIM objects supply their own name.
     */
    static List<Map.Entry<String, Object>> entries(Object input, String kind) {
        List<Map.Entry<String, Object>> result = new ArrayList<>();
        if (input == null) {
            return result;
        }
        if (input instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.add(new SimpleEntry<>(keyOf(entry.getKey(), kind), entry.getValue()));
            }
            return result;
        }
        if (input instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                result.add(entryOf(item, kind));
            }
            return result;
        }
        throw new CIMTypeException("Invalid type for " + kind + ": " + typeName(input)
            + " (must be a Map or an Iterable)");
    }

    private static Map.Entry<String, Object> entryOf(Object item, String kind) {
        if (item instanceof Map.Entry<?, ?> entry) {
            return new SimpleEntry<>(keyOf(entry.getKey(), kind), entry.getValue());
        }
        if (item instanceof CIMQualifier q) {
            return new SimpleEntry<>(q.getName(), q);
        }
        if (item instanceof CIMProperty p) {
            return new SimpleEntry<>(p.getName(), p);
        }
        if (item instanceof CIMMethod m) {
            return new SimpleEntry<>(m.getName(), m);
        }
        if (item instanceof CIMParameter p) {
            return new SimpleEntry<>(p.getName(), p);
        }
        throw new CIMTypeException("Invalid item in " + kind + ": " + typeName(item)
            + " (must be a named CIM object or a Map.Entry)");
    }

    private static String keyOf(Object key, String kind) {
        if (key == null || key instanceof String) {
            return (String) key;
        }
        throw new CIMTypeException("Key in " + kind + " must be a String, but is " + typeName(key));
    }

    private static void checkKey(String key, String name, String kind) {
        if (!CimEquality.namesEqual(key, name)) {
            throw new CIMValueException(kind + " name '" + name + "' does not match its key '" + key + "'");
        }
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
