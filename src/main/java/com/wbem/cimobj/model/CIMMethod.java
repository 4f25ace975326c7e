package com.wbem.cimobj.model;

import com.wbem.cimobj.exception.CIMValueException;
import com.wbem.cimobj.mof.MofWriter;
import com.wbem.cimobj.types.CIMType;
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
 * A method declaration of a CIM class.
 */
@Getter
@ToString
public class CIMMethod extends CIMElement {

    private String name;
    private CIMType returnType;
    private NocaseDict<CIMParameter> parameters;
    private String classOrigin;
    private Boolean propagated;
    private NocaseDict<CIMQualifier> qualifiers;

    public CIMMethod(String name, String returnType) {
        this(name, returnType, null, null, null, null);
    }

    /**
     * @param parameters a Map, or an Iterable of {@link CIMParameter} or of name/parameter entries
     * @param qualifiers a Map, or an Iterable of {@link CIMQualifier} or of name/value entries
     */
    @Builder
    public CIMMethod(String name, String returnType, Object parameters, String classOrigin, Boolean propagated,
                     Object qualifiers) {
        this.name = ValueChecks.checkName(name, "method");
        this.returnType = checkReturnType(returnType, name);
        this.parameters = ElementMaps.parameters(parameters);
        this.classOrigin = classOrigin;
        this.propagated = propagated;
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    private CIMMethod(CIMMethod other) {
        this.name = other.name;
        this.returnType = other.returnType;
        this.parameters = new NocaseDict<>();
        for (Map.Entry<String, CIMParameter> entry : other.parameters.entrySet()) {
            this.parameters.put(entry.getKey(), entry.getValue().copy());
        }
        this.classOrigin = other.classOrigin;
        this.propagated = other.propagated;
        this.qualifiers = CIMProperty.copyQualifiers(other.qualifiers);
    }

    private static CIMType checkReturnType(String returnType, String name) {
        if (returnType == null) {
            throw new CIMValueException("Return type of method '" + name + "' must not be null");
        }
        CIMType type = CIMType.fromName(returnType);
        if (type == CIMType.REFERENCE) {
            throw new CIMValueException("Return type of method '" + name + "' must not be reference");
        }
        return type;
    }

    public void setName(String name) {
        this.name = ValueChecks.checkName(name, "method");
    }

    public void setReturnType(String returnType) {
        this.returnType = checkReturnType(returnType, name);
    }

    public void setParameters(Object parameters) {
        this.parameters = ElementMaps.parameters(parameters);
    }

    public void setClassOrigin(String classOrigin) {
        this.classOrigin = classOrigin;
    }

    public void setPropagated(Boolean propagated) {
        this.propagated = propagated;
    }

    public void setQualifiers(Object qualifiers) {
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    public CIMMethod copy() {
        return new CIMMethod(this);
    }

    @Override
    public Element toCimXml() {
        return new CimXmlWriter().method(this);
    }

    public String toMof() {
        return MofWriter.method(this, MofWriter.MOF_INDENT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMMethod other)) {
            return false;
        }
        return CimEquality.namesEqual(name, other.name)
            && returnType == other.returnType
            && parameters.equals(other.parameters)
            && CimEquality.namesEqual(classOrigin, other.classOrigin)
            && Objects.equals(propagated, other.propagated)
            && qualifiers.equals(other.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(name), returnType, parameters, CimEquality.nameHash(classOrigin),
            propagated, qualifiers);
    }
}
