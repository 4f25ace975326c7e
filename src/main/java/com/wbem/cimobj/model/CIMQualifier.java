package com.wbem.cimobj.model;

import com.wbem.cimobj.mof.MofWriter;
import com.wbem.cimobj.types.CIMType;
import com.wbem.cimobj.util.CimEquality;
import com.wbem.cimobj.xml.CimXmlWriter;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Objects;

/**
 * A qualifier value attached to a class, instance, property, method or parameter,
 * together with its flavors.
 *
 * <p>The flavor flags are tri-state: {@code null} means the flavor is not specified.
 */
@Getter
@ToString
public class CIMQualifier extends CIMElement {

    private String name;
    private CIMType type;
    private Object value;
    private Boolean propagated;
    private Boolean overridable;
    private Boolean tosubclass;
    private Boolean toinstance;
    private Boolean translatable;

    public CIMQualifier(String name, Object value) {
        this(name, value, null, null, null, null, null, null);
    }

    public CIMQualifier(String name, Object value, String type) {
        this(name, value, type, null, null, null, null, null);
    }

    @Builder
    public CIMQualifier(String name, Object value, String type, Boolean propagated, Boolean overridable,
                        Boolean tosubclass, Boolean toinstance, Boolean translatable) {
        this.name = ValueChecks.checkName(name, "qualifier");
        this.type = ValueChecks.resolveType(type, value, "qualifier", name);
        ValueChecks.checkNoReferenceArray(this.type, value instanceof List, "qualifier", name);
        this.value = ValueChecks.convertValue(value, this.type, "qualifier", name);
        this.propagated = propagated;
        this.overridable = overridable;
        this.tosubclass = tosubclass;
        this.toinstance = toinstance;
        this.translatable = translatable;
    }

    public boolean isArray() {
        return value instanceof List;
    }

    public void setName(String name) {
        this.name = ValueChecks.checkName(name, "qualifier");
    }

    /**
     * Set the value, converted to the type of the qualifier.
     */
    public void setValue(Object value) {
        this.value = ValueChecks.convertValue(value, type, "qualifier", name);
    }

    public void setPropagated(Boolean propagated) {
        this.propagated = propagated;
    }

    public void setOverridable(Boolean overridable) {
        this.overridable = overridable;
    }

    public void setTosubclass(Boolean tosubclass) {
        this.tosubclass = tosubclass;
    }

    public void setToinstance(Boolean toinstance) {
        this.toinstance = toinstance;
    }

    public void setTranslatable(Boolean translatable) {
        this.translatable = translatable;
    }

    public CIMQualifier copy() {
        return new CIMQualifier(name, ValueChecks.copyValue(value), type.getCimName(), propagated, overridable,
            tosubclass, toinstance, translatable);
    }

    @Override
    public Element toCimXml() {
        return new CimXmlWriter().qualifier(this);
    }

    /**
     * The MOF form of this qualifier, e.g. {@code Description ( "text" )}.
     */
    public String toMof() {
        return MofWriter.qualifier(this, MofWriter.MOF_INDENT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMQualifier other)) {
            return false;
        }
        return CimEquality.namesEqual(name, other.name)
            && type == other.type
            && CimEquality.valuesEqual(value, other.value)
            && Objects.equals(propagated, other.propagated)
            && Objects.equals(overridable, other.overridable)
            && Objects.equals(tosubclass, other.tosubclass)
            && Objects.equals(toinstance, other.toinstance)
            && Objects.equals(translatable, other.translatable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(name), type, CimEquality.valueHash(value), propagated,
            overridable, tosubclass, toinstance, translatable);
    }
}
