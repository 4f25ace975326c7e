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
 * A CIM property: a named, typed value of a class or instance, with its qualifiers.
 *
 * <p>In a class the value is the default value of the property. The type is inferred
 * from the value when it is not specified; plain Java numbers carry no CIM type, so for
 * them the type must be given and the value is converted to it.
 */
@Getter
@ToString
public class CIMProperty extends CIMElement {

    private String name;
    private Object value;
    private CIMType type;
    private String referenceClass;
    private EmbeddedObject embeddedObject;
    private boolean isArray;
    private Integer arraySize;
    private String classOrigin;
    private Boolean propagated;
    private NocaseDict<CIMQualifier> qualifiers;

    public CIMProperty(String name, Object value) {
        this(name, value, null, null, null, null, null, null, null, null);
    }

    public CIMProperty(String name, Object value, String type) {
        this(name, value, type, null, null, null, null, null, null, null);
    }

    /**
     * @param qualifiers a Map, or an Iterable of {@link CIMQualifier} or of name/value entries
     */
    @Builder
    public CIMProperty(String name, Object value, String type, String classOrigin, Integer arraySize,
                       Boolean propagated, Boolean isArray, String referenceClass, Object qualifiers,
                       EmbeddedObject embeddedObject) {
        String kind = "property";
        this.name = ValueChecks.checkName(name, kind);
        this.type = ValueChecks.resolveType(type, value, kind, name);
        ValueChecks.checkArrayParms(isArray, arraySize, value, kind, name);
        this.isArray = ValueChecks.inferIsArray(isArray, value);
        ValueChecks.checkNoReferenceArray(this.type, this.isArray, kind, name);
        this.embeddedObject = embeddedObject != null ? embeddedObject : ValueChecks.inferEmbeddedObject(value);
        ValueChecks.checkEmbeddedObject(this.embeddedObject, this.type, value, kind, name);
        ValueChecks.checkReferenceClass(referenceClass, this.type, kind, name);
        this.value = ValueChecks.convertValue(value, this.type, kind, name);
        this.referenceClass = referenceClass;
        this.arraySize = arraySize;
        this.classOrigin = classOrigin;
        this.propagated = propagated;
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    private CIMProperty(CIMProperty other) {
        this.name = other.name;
        this.value = ValueChecks.copyValue(other.value);
        this.type = other.type;
        this.referenceClass = other.referenceClass;
        this.embeddedObject = other.embeddedObject;
        this.isArray = other.isArray;
        this.arraySize = other.arraySize;
        this.classOrigin = other.classOrigin;
        this.propagated = other.propagated;
        this.qualifiers = copyQualifiers(other.qualifiers);
    }

    static NocaseDict<CIMQualifier> copyQualifiers(NocaseDict<CIMQualifier> qualifiers) {
        NocaseDict<CIMQualifier> copy = new NocaseDict<>();
        for (Map.Entry<String, CIMQualifier> entry : qualifiers.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }

    public void setName(String name) {
        this.name = ValueChecks.checkName(name, "property");
    }

    /**
     * Set the value, converted to the type of the property. The array-ness of the value
     * must match the property.
     */
    public void setValue(Object value) {
        ValueChecks.checkArrayParms(isArray, null, value, "property", name);
        ValueChecks.checkEmbeddedObject(embeddedObject, type, value, "property", name);
        this.value = ValueChecks.convertValue(value, type, "property", name);
    }

    public void setReferenceClass(String referenceClass) {
        ValueChecks.checkReferenceClass(referenceClass, type, "property", name);
        this.referenceClass = referenceClass;
    }

    public void setArraySize(Integer arraySize) {
        if (arraySize != null && !isArray) {
            throw new CIMValueException("The array_size of property '" + name + "' is " + arraySize
                + " but the property is not an array");
        }
        this.arraySize = arraySize;
    }

    public void setClassOrigin(String classOrigin) {
        this.classOrigin = classOrigin;
    }

    public void setPropagated(Boolean propagated) {
        this.propagated = propagated;
    }

    /**
     * @param qualifiers a Map, or an Iterable of {@link CIMQualifier} or of name/value entries
     */
    public void setQualifiers(Object qualifiers) {
        this.qualifiers = ElementMaps.qualifiers(qualifiers);
    }

    public CIMProperty copy() {
        return new CIMProperty(this);
    }

    @Override
    public Element toCimXml() {
        return new CimXmlWriter().property(this);
    }

    /**
     * The MOF form of this property as it appears in an instance, {@code name = value;}.
     */
    public String toMof() {
        return toMof(true);
    }

    /**
     * The MOF form of this property in an instance ({@code name = value;}) or as a property
     * declaration of a class.
     */
    public String toMof(boolean isInstance) {
        return MofWriter.property(this, isInstance, MofWriter.MOF_INDENT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMProperty other)) {
            return false;
        }
        return CimEquality.namesEqual(name, other.name)
            && CimEquality.valuesEqual(value, other.value)
            && type == other.type
            && CimEquality.namesEqual(referenceClass, other.referenceClass)
            && embeddedObject == other.embeddedObject
            && isArray == other.isArray
            && Objects.equals(arraySize, other.arraySize)
            && CimEquality.namesEqual(classOrigin, other.classOrigin)
            && Objects.equals(propagated, other.propagated)
            && qualifiers.equals(other.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(name), CimEquality.valueHash(value), type,
            CimEquality.nameHash(referenceClass), embeddedObject, isArray, arraySize,
            CimEquality.nameHash(classOrigin), propagated, qualifiers);
    }
}
