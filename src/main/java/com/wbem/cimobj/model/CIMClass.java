package com.wbem.cimobj.model;

import com.wbem.cimobj.mof.MofWriter;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.util.NocaseDict;
import com.wbem.cimobj.xml.CimXmlWriter;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

import java.util.Map;
import java.util.Objects;

/**
 * A CIM class declaration with its properties, methods and qualifiers.
 *
 * <p>The values of the class properties are their default values.
 */
@Getter
@ToString
public class CIMClass extends CIMElement {

    private String classname;
    private NocaseDict<CIMProperty> properties;
    private NocaseDict<CIMMethod> methods;
    private String superclass;
    private NocaseDict<CIMQualifier> qualifiers;
    private CIMClassName path;

    public CIMClass(String classname) {
        this(classname, null, null, null, null, null);
    }

    /**
     * @param properties a Map, or an Iterable of {@link CIMProperty} or of name/value entries
     * @param methods    a Map, or an Iterable of {@link CIMMethod} or of name/method entries
     * @param qualifiers a Map, or an Iterable of {@link CIMQualifier} or of name/value entries
     * @param path       the class path, or null
     */
    @Builder
    public CIMClass(String classname, Object properties, Object methods, String superclass, Object qualifiers,
                    CIMClassName path) {
        this.classname = CIMClassName.checkClassname(classname);
        this.properties = ElementMaps.properties(properties);
        this.methods = ElementMaps.methods(methods);
        this.superclass = superclass;
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
        this.path = path;
    }

    private CIMClass(CIMClass other) {
        this.classname = other.classname;
        this.properties = new NocaseDict<>();
        for (Map.Entry<String, CIMProperty> entry : other.properties.entrySet()) {
            this.properties.put(entry.getKey(), entry.getValue().copy());
        }
        this.methods = new NocaseDict<>();
        for (Map.Entry<String, CIMMethod> entry : other.methods.entrySet()) {
            this.methods.put(entry.getKey(), entry.getValue().copy());
        }
        this.superclass = other.superclass;
        this.qualifiers = CIMProperty.copyQualifiers(other.qualifiers);
        this.path = other.path == null ? null : other.path.copy();
    }

    public void setClassname(String classname) {
        this.classname = CIMClassName.checkClassname(classname);
    }

    public void setProperties(Object properties) {
        this.properties = ElementMaps.properties(properties);
    }

    public void setMethods(Object methods) {
        this.methods = ElementMaps.methods(methods);
    }

    public void setSuperclass(String superclass) {
        this.superclass = superclass;
    }

    public void setQualifiers(Object qualifiers) {
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    public void setPath(CIMClassName path) {
        this.path = path;
    }

    public CIMClass copy() {
        return new CIMClass(this);
    }

    @Override
    public Element toCimXml() {
        return new CimXmlWriter().cimClass(this);
    }

    public String toMof() {
        return MofWriter.cimClass(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMClass other)) {
            return false;
        }
        return CimEquality.namesEqual(classname, other.classname)
            && CimEquality.namesEqual(superclass, other.superclass)
            && properties.equals(other.properties)
            && methods.equals(other.methods)
            && qualifiers.equals(other.qualifiers)
            && Objects.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(classname), CimEquality.nameHash(superclass), properties,
            methods, qualifiers, path);
    }
}
