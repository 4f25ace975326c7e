package com.wbem.cimobj.model;

import com.wbem.cimobj.exception.CIMValueException;

import java.util.Locale;

/**
 * Marker of a {@code string} typed element whose value is an embedded CIM object.
 */
public enum EmbeddedObject {
    /** The value is a {@link CIMInstance}. */
    INSTANCE("instance"),
    /** The value is a {@link CIMClass} or a {@link CIMInstance}. */
    OBJECT("object");

    private final String xmlValue;

    EmbeddedObject(String xmlValue) {
        this.xmlValue = xmlValue;
    }

    /**
     * Value of the {@code EmbeddedObject} attribute in CIM-XML.
     */
    public String getXmlValue() {
        return xmlValue;
    }

    public static EmbeddedObject fromName(String name) {
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (EmbeddedObject e : values()) {
                if (e.xmlValue.equals(lower)) {
                    return e;
                }
            }
        }
        throw new CIMValueException("Invalid value for embedded_object: '" + name
            + "' (must be 'instance' or 'object')");
    }

    @Override
    public String toString() {
        return xmlValue;
    }
}
