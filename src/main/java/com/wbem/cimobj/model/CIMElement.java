package com.wbem.cimobj.model;

import com.wbem.cimobj.xml.CimXmlDocuments;
import org.w3c.dom.Element;

/**
 * Base class of all CIM objects that have a CIM-XML representation.
 */
public abstract class CIMElement {

    /**
     * The CIM-XML element of this object, owned by a new DOM document.
     */
    public abstract Element toCimXml();

    /**
     * The CIM-XML of this object as a single line without whitespace between elements.
     */
    public String toCimXmlStr() {
        return CimXmlDocuments.toXmlString(toCimXml(), null);
    }

    /**
     * The CIM-XML of this object, pretty printed with the given number of spaces.
     */
    public String toCimXmlStr(int indent) {
        return CimXmlDocuments.toXmlString(toCimXml(), " ".repeat(indent));
    }

    /**
     * The CIM-XML of this object, pretty printed with the given indentation string.
     * A null indentation renders a single line.
     */
    public String toCimXmlStr(String indent) {
        return CimXmlDocuments.toXmlString(toCimXml(), indent);
    }
}
