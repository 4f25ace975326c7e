package com.wbem.cimobj.uri;

import com.wbem.cimobj.exception.CIMTypeException;
import com.wbem.cimobj.model.CIMClassName;
import com.wbem.cimobj.model.CIMInstanceName;
import com.wbem.cimobj.types.CIMDateTime;
import com.wbem.cimobj.types.CimTypes;
import com.wbem.cimobj.util.CimEquality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders class and instance paths as WBEM URIs.
 */
public class WbemUriWriter {

    private WbemUriWriter() {
        // Utility class
    }

    public static String toWbemUri(CIMClassName path, WbemUriFormat format) {
        return prefix(path.getHost(), path.getNamespace(), format) + name(path.getClassname(), format);
    }

    /**
     * @throws CIMTypeException if a keybinding value has a type that cannot be rendered
     */
    public static String toWbemUri(CIMInstanceName path, WbemUriFormat format) {
        StringBuilder sb = new StringBuilder();
        sb.append(prefix(path.getHost(), path.getNamespace(), format));
        sb.append(name(path.getClassname(), format));
        List<Map.Entry<String, Object>> keybindings = new ArrayList<>(path.getKeybindings().entrySet());
        if (format == WbemUriFormat.CANONICAL) {
            keybindings.sort(Comparator.comparing(WbemUriWriter::sortKey));
        }
        String separator = ".";
        for (Map.Entry<String, Object> keybinding : keybindings) {
            sb.append(separator);
            separator = ",";
            if (keybinding.getKey() != null) {
                sb.append(name(keybinding.getKey(), format)).append('=');
            }
            sb.append(keyValue(keybinding.getKey(), keybinding.getValue(), format));
        }
        return sb.toString();
    }

    private static String sortKey(Map.Entry<String, Object> keybinding) {
        return keybinding.getKey() == null ? "" : CimEquality.lower(keybinding.getKey());
    }

    private static String prefix(String host, String namespace, WbemUriFormat format) {
        String ns = namespace == null ? "" : name(namespace, format);
        String authority = host == null ? null : name(host, format);
        return switch (format) {
            case STANDARD, CANONICAL -> (authority == null ? "" : "//" + authority) + "/" + ns + ":";
            case CIMOBJECT -> "/" + ns + ":";
            case HISTORICAL -> {
                if (authority != null) {
                    yield "//" + authority + "/" + ns + ":";
                }
                yield namespace == null ? "" : ns + ":";
            }
        };
    }

    private static String name(String name, WbemUriFormat format) {
        return format == WbemUriFormat.CANONICAL ? CimEquality.lower(name) : name;
    }

    private static String keyValue(String key, Object value, WbemUriFormat format) {
        if (value == null) {
            return "\"\"";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof CIMDateTime dateTime) {
            return quote(dateTime.toString());
        }
        if (value instanceof CIMInstanceName reference) {
            return quote(toWbemUri(reference, format));
        }
        if (value instanceof Character c) {
            return "'" + escape(String.valueOf(c), '\'') + "'";
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return CimTypes.toCimString(value);
        }
        throw new CIMTypeException("Keybinding '" + key + "' has a value of a type that cannot be rendered in a"
            + " WBEM URI: " + value.getClass().getName());
    }

    private static String quote(String value) {
        return "\"" + escape(value, '"') + "\"";
    }

    private static String escape(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == quote) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
