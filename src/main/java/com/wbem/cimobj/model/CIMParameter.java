package com.wbem.cimobj.model;

import com.wbem.cimobj.mof.MofWriter;
import com.wbem.cimobj.types.CIMType;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.util.NocaseDict;
import com.wbem.cimobj.xml.CimXmlWriter;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

import java.util.Objects;

/**
 * A parameter of a CIM method.
 *
 * <p>In a method declaration only the name, type and qualifiers matter. The value is used
 * when the parameter is passed to a method invocation, see {@link #toCimXml(boolean)}.
 * Unlike properties, parameters may be arrays of references.
 */
@Getter
@ToString
public class CIMParameter extends CIMElement {

    private String name;
    private CIMType type;
    private String referenceClass;
    private boolean isArray;
    private Integer arraySize;
    private NocaseDict<CIMQualifier> qualifiers;
    private Object value;
    private EmbeddedObject embeddedObject;

    public CIMParameter(String name, String type) {
        this(name, type, null, null, null, null, null, null);
    }

    /**
     * @param qualifiers a Map, or an Iterable of {@link CIMQualifier} or of name/value entries
     */
    @Builder
    public CIMParameter(String name, String type, String referenceClass, Boolean isArray, Integer arraySize,
                        Object qualifiers, Object value, EmbeddedObject embeddedObject) {
        String kind = "parameter";
        this.name = ValueChecks.checkName(name, kind);
        this.type = ValueChecks.resolveType(type, value, kind, name);
        ValueChecks.checkArrayParms(isArray, arraySize, value, kind, name);
        this.isArray = ValueChecks.inferIsArray(isArray, value);
        this.embeddedObject = embeddedObject != null ? embeddedObject : ValueChecks.inferEmbeddedObject(value);
        ValueChecks.checkEmbeddedObject(this.embeddedObject, this.type, value, kind, name);
        ValueChecks.checkReferenceClass(referenceClass, this.type, kind, name);
        this.value = ValueChecks.convertValue(value, this.type, kind, name);
        this.referenceClass = referenceClass;
        this.arraySize = arraySize;
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    private CIMParameter(CIMParameter other) {
        this.name = other.name;
        this.type = other.type;
        this.referenceClass = other.referenceClass;
        this.isArray = other.isArray;
        this.arraySize = other.arraySize;
        this.qualifiers = CIMProperty.copyQualifiers(other.qualifiers);
        this.value = ValueChecks.copyValue(other.value);
        this.embeddedObject = other.embeddedObject;
    }

    public void setName(String name) {
        this.name = ValueChecks.checkName(name, "parameter");
    }

    /**
     * Set the value passed to a method invocation, converted to the parameter type.
     */
    public void setValue(Object value) {
        ValueChecks.checkArrayParms(isArray, null, value, "parameter", name);
        ValueChecks.checkEmbeddedObject(embeddedObject, type, value, "parameter", name);
        this.value = ValueChecks.convertValue(value, type, "parameter", name);
    }

    public void setQualifiers(Object qualifiers) {
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    public CIMParameter copy() {
        return new CIMParameter(this);
    }

    /**
     * The parameter declaration element ({@code PARAMETER}, {@code PARAMETER.ARRAY},
     * {@code PARAMETER.REFERENCE} or {@code PARAMETER.REFARRAY}).
     */
    @Override
    public Element toCimXml() {
        return toCimXml(false);
    }

    /**
     * @param asValue render the parameter value as a {@code PARAMVALUE} element instead of
     *                the declaration
     */
    public Element toCimXml(boolean asValue) {
        CimXmlWriter writer = new CimXmlWriter();
        return asValue ? writer.paramValue(this) : writer.parameter(this);
    }

    public String toMof() {
        return MofWriter.parameter(this, MofWriter.MOF_INDENT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMParameter other)) {
            return false;
        }
        return CimEquality.namesEqual(name, other.name)
            && type == other.type
            && CimEquality.namesEqual(referenceClass, other.referenceClass)
            && isArray == other.isArray
            && Objects.equals(arraySize, other.arraySize)
            && qualifiers.equals(other.qualifiers)
            && CimEquality.valuesEqual(value, other.value)
            && embeddedObject == other.embeddedObject;
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(name), type, CimEquality.nameHash(referenceClass), isArray,
            arraySize, qualifiers, CimEquality.valueHash(value), embeddedObject);
    }
}
