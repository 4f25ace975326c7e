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

import java.util.Objects;

/**
 * The declaration of a qualifier type: its CIM type, default value, the scopes
 * (element kinds) it may be applied to, and its default flavors.
 */
@Getter
@ToString
public class CIMQualifierDeclaration extends CIMElement {

    private String name;
    private CIMType type;
    private Object value;
    private boolean isArray;
    private Integer arraySize;
    private NocaseDict<Boolean> scopes;
    private Boolean overridable;
    private Boolean tosubclass;
    private Boolean toinstance;
    private Boolean translatable;

    public CIMQualifierDeclaration(String name, String type) {
        this(name, type, null, null, null, null, null, null, null, null);
    }

    /**
     * @param scopes a Map from scope name to Boolean, or an Iterable of such entries
     */
    @Builder
    public CIMQualifierDeclaration(String name, String type, Object value, Boolean isArray, Integer arraySize,
                                   Object scopes, Boolean overridable, Boolean tosubclass, Boolean toinstance,
                                   Boolean translatable) {
        String kind = "qualifier declaration";
        this.name = ValueChecks.checkName(name, kind);
        if (type == null) {
            throw new CIMValueException("Type of qualifier declaration '" + name + "' must not be null");
        }
        this.type = CIMType.fromName(type);
        ValueChecks.checkArrayParms(isArray, arraySize, value, kind, name);
        this.isArray = ValueChecks.inferIsArray(isArray, value);
        ValueChecks.checkNoReferenceArray(this.type, this.isArray, kind, name);
        this.value = ValueChecks.convertValue(value, this.type, kind, name);
        this.arraySize = arraySize;
        this.scopes = ElementMaps.scopes(scopes);
        this.overridable = overridable;
        this.tosubclass = tosubclass;
        this.toinstance = toinstance;
        this.translatable = translatable;
    }

    public void setName(String name) {
        this.name = ValueChecks.checkName(name, "qualifier declaration");
    }

    public void setValue(Object value) {
        ValueChecks.checkArrayParms(isArray, null, value, "qualifier declaration", name);
        this.value = ValueChecks.convertValue(value, type, "qualifier declaration", name);
    }

    public void setScopes(Object scopes) {
        this.scopes = ElementMaps.scopes(scopes);
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

    /**
     * Whether the qualifier may be applied to an element kind. {@code ANY} grants all scopes.
     */
    public boolean hasScope(String scope) {
        return Boolean.TRUE.equals(scopes.get(scope)) || Boolean.TRUE.equals(scopes.get("ANY"));
    }

    public CIMQualifierDeclaration copy() {
        return new CIMQualifierDeclaration(name, type.getCimName(), ValueChecks.copyValue(value), isArray,
            arraySize, scopes.copy(), overridable, tosubclass, toinstance, translatable);
    }

    @Override
    public Element toCimXml() {
        return new CimXmlWriter().qualifierDeclaration(this);
    }

    public String toMof() {
        return MofWriter.qualifierDeclaration(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CIMQualifierDeclaration other)) {
            return false;
        }
        return CimEquality.namesEqual(name, other.name)
            && type == other.type
            && CimEquality.valuesEqual(value, other.value)
            && isArray == other.isArray
            && Objects.equals(arraySize, other.arraySize)
            && scopes.equals(other.scopes)
            && Objects.equals(overridable, other.overridable)
            && Objects.equals(tosubclass, other.tosubclass)
            && Objects.equals(toinstance, other.toinstance)
            && Objects.equals(translatable, other.translatable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CimEquality.nameHash(name), type, CimEquality.valueHash(value), isArray, arraySize,
            scopes, overridable, tosubclass, toinstance, translatable);
    }
}
