package com.wbem.cimobj.model;

import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.uri.WbemUri;
import com.wbem.cimobj.uri.WbemUriFormat;
import com.wbem.cimobj.uri.WbemUriParser;
import com.wbem.cimobj.uri.WbemUriWriter;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.xml.CimXmlWriter;
import lombok.Builder;
import lombok.Getter;
import org.w3c.dom.Element;

import java.util.Objects;

/**
 * The path of a CIM class: class name, optionally with namespace and host.
 *
 * <p>{@link #toString()} returns the WBEM URI in historical format, e.g.
 * {@code //acme.com/root/cimv2:CIM_Foo}.
 */
@Getter
public class CIMClassName extends CIMElement {

    private String classname;
    private String host;
    private String namespace;

    public CIMClassName(String classname) {
        this(classname, null, null);
    }

    @Builder
    public CIMClassName(String classname, String host, String namespace) {
        this.classname = checkClassname(classname);
        this.host = host;
        this.namespace = normalizeNamespace(namespace);
    }

    static String checkClassname(String classname) {
        if (classname == null || classname.isEmpty()) {
            throw new CIMValueException("Class name must not be null or empty");
        }
        return classname;
    }

    /**
     * Strip all leading and trailing slashes; an empty namespace becomes {@code null}.
     */
    static String normalizeNamespace(String namespace) {
        if (namespace == null) {
            return null;
        }
        int start = 0;
        int end = namespace.length();
        while (start < end && namespace.charAt(start) == '/') {
            start++;
        }
        while (end > start && namespace.charAt(end - 1) == '/') {
            end--;
        }
        return start == end ? null : namespace.substring(start, end);
    }

    /**
     * Parse a WBEM URI denoting a class path.
     *
     * @throws CIMValueException if the URI is malformed or denotes an instance path
     */
    public static CIMClassName fromWbemUri(String wbemUri) {
        WbemUri uri = WbemUriParser.parse(wbemUri);
        if (uri.getKeybindings() != null) {
            throw new CIMValueException("WBEM URI is an instance path but should be a class path: '"
                + wbemUri + "'");
        }
        return new CIMClassName(uri.getClassname(), uri.getHost(), uri.getNamespace());
    }

    public void setClassname(String classname) {
        this.classname = checkClassname(classname);
    }

    public void setHost(String host) {
        this.host = host;
    }

    public void setNamespace(String namespace) {
        this.namespace = normalizeNamespace(namespace);
    }

    public CIMClassName copy() {
        return new CIMClassName(classname, host, namespace);
    }

    public String toWbemUri(WbemUriFormat format) {
        return WbemUriWriter.toWbemUri(this, format);
    }

    public String toWbemUri() {
        return toWbemUri(WbemUriFormat.STANDARD);
    }

    @Override
    public Element toCimXml() {
        return toCimXml(false, false);
    }

    /**
     * {@code CLASSNAME}, {@code LOCALCLASSPATH} or {@code CLASSPATH}, depending on which of
     * namespace and host are present and not ignored.
     */
    public Element toCimXml(boolean ignoreHost, boolean ignoreNamespace) {
        return new CimXmlWriter().className(this, ignoreHost, ignoreNamespace);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMClassName other)) {
            return false;
        }
        return CimEquality.namesEqual(classname, other.classname)
            && CimEquality.namesEqual(host, other.host)
            && CimEquality.namesEqual(namespace, other.namespace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(classname), CimEquality.nameHash(host),
            CimEquality.nameHash(namespace));
    }

    @Override
    public String toString() {
        return toWbemUri(WbemUriFormat.HISTORICAL);
    }
}
