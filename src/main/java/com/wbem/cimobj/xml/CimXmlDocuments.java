package com.wbem.cimobj.xml;

import com.wbem.cimobj.exception.CimXmlException;
import org.w3c.dom.Document;
import org.w3c.dom.Node;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;

/**
 * DOM document creation and serialization for CIM-XML fragments.
 */
public final class CimXmlDocuments {

    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY = DocumentBuilderFactory.newInstance();
    private static final TransformerFactory TRANSFORMER_FACTORY = TransformerFactory.newInstance();

    private CimXmlDocuments() {
        // Utility class
    }

    public static Document newDocument() {
        try {
            return DOCUMENT_BUILDER_FACTORY.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new CimXmlException("Cannot create a DOM document builder", e);
        }
    }

    /**
     * Serialize a node without XML declaration.
     *
     * @param indent null for a single line without whitespace between elements; otherwise
     *               child elements are put on separate lines, indented by as many spaces as
     *               the string is long
     */
    public static String toXmlString(Node node, String indent) {
        try {
            Transformer transformer = TRANSFORMER_FACTORY.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            if (indent != null) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount",
                    String.valueOf(indent.length()));
            } else {
                transformer.setOutputProperty(OutputKeys.INDENT, "no");
            }
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            String xml = writer.toString();
            return indent != null ? xml.stripTrailing() : xml;
        } catch (TransformerException e) {
            throw new CimXmlException("Cannot serialize CIM-XML element " + node.getNodeName(), e);
        }
    }
}
